package com.studytrack.validation;

import com.studytrack.domain.DomainModels.Exam;
import com.studytrack.domain.DomainModels.GradeScale;
import com.studytrack.domain.DomainModels.Module;
import com.studytrack.domain.DomainModels.Program;
import com.studytrack.domain.DomainModels.Semester;
import com.studytrack.domain.DomainModels.Student;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Component
public class RecordValidator {

    public List<ValidationIssue> validate(Student student) {
        List<ValidationIssue> issues = new ArrayList<>();
        String path = "student";

        blank(student.firstName(), path, "firstName", issues);
        blank(student.lastName(), path, "lastName", issues);
        blank(student.matriculationNumber(), path, "matriculationNumber", issues);

        if (student.program() == null) {
            issues.add(new ValidationIssue("MISSING_FIELD", "program is required", path, "program"));
        } else {
            validateProgram(student.program(), path + ".program", issues);
        }
        return issues;
    }

    public void requireValid(Student student) {
        List<ValidationIssue> issues = validate(student);
        if (!issues.isEmpty()) {
            throw new ValidationException(issues);
        }
    }

    /** Checks a single grade against a scale; used where input is accepted outside the tree. */
    public void requireGrade(GradeScale scale, double grade, String path, String field) {
        if (!Double.isFinite(grade) || !scale.contains(grade)) {
            throw new ValidationException(new ValidationIssue("GRADE_OUT_OF_SCALE",
                    "Grade " + grade + " is outside the scale " + scale.best() + ".." + scale.worst(), path, field));
        }
    }

    private void validateProgram(Program program, String path, List<ValidationIssue> issues) {
        blank(program.name(), path, "name", issues);
        if (!Double.isFinite(program.totalCreditsRequired()) || program.totalCreditsRequired() <= 0) {
            issues.add(new ValidationIssue("INVALID_CREDITS", "Total credits required must be positive", path, "totalCreditsRequired"));
        }

        GradeScale scale = program.gradeScale();
        boolean scaleValid = scale != null && Double.isFinite(scale.best()) && Double.isFinite(scale.worst()) && scale.best() != scale.worst();
        if (scale == null) {
            issues.add(new ValidationIssue("INVALID_SCALE", "Grade scale is required", path, "gradeScale"));
        } else if (!scaleValid) {
            issues.add(new ValidationIssue("INVALID_SCALE", "Grade scale needs two distinct finite bounds", path, "gradeScale"));
        } else {
            if (!Double.isFinite(scale.passMark()) || !scale.contains(scale.passMark())) {
                issues.add(new ValidationIssue("INVALID_SCALE", "Pass mark " + scale.passMark() + " is outside the grade scale", path + ".gradeScale", "passMark"));
            }
            if (!Double.isFinite(program.targetAverage()) || !scale.contains(program.targetAverage())) {
                issues.add(new ValidationIssue("TARGET_OUT_OF_SCALE", "Target average " + program.targetAverage() + " is outside the grade scale", path, "targetAverage"));
            }
        }

        List<Row> semesters = new ArrayList<>();
        List<Row> modules = new ArrayList<>();
        List<Row> exams = new ArrayList<>();
        for (int i = 0; i < program.semesters().size(); i++) {
            Semester semester = program.semesters().get(i);
            String semesterPath = path + ".semesters[" + i + "]";
            semesters.add(new Row(String.valueOf(semester.number()), semesterPath));
            for (int j = 0; j < semester.modules().size(); j++) {
                Module module = semester.modules().get(j);
                String modulePath = semesterPath + ".modules[" + j + "]";
                modules.add(new Row(module.name(), modulePath));
                for (int k = 0; k < module.exams().size(); k++) {
                    exams.add(new Row(module.exams().get(k).id(), modulePath + ".exams[" + k + "]"));
                }
            }
        }
        duplicate(semesters, "DUPLICATE_SEMESTER", "number", issues);
        duplicate(modules, "DUPLICATE_MODULE", "name", issues);
        duplicate(exams, "DUPLICATE_EXAM", "id", issues);

        for (int i = 0; i < program.semesters().size(); i++) {
            validateSemester(program.semesters().get(i), scaleValid ? scale : null, path + ".semesters[" + i + "]", issues);
        }
    }

    private void validateSemester(Semester semester, GradeScale scale, String path, List<ValidationIssue> issues) {
        if (semester.number() < 1) {
            issues.add(new ValidationIssue("INVALID_SEMESTER_NUMBER", "Semester number must be at least 1", path, "number"));
        }
        if (!Double.isFinite(semester.recommendedCredits()) || semester.recommendedCredits() < 0) {
            issues.add(new ValidationIssue("INVALID_CREDITS", "Recommended credits must not be negative", path, "recommendedCredits"));
        }
        if (semester.startDate() != null && semester.endDate() != null && semester.endDate().isBefore(semester.startDate())) {
            issues.add(new ValidationIssue("INVALID_PERIOD", "Semester ends before it starts", path, "endDate"));
        }
        for (int i = 0; i < semester.modules().size(); i++) {
            validateModule(semester.modules().get(i), scale, path + ".modules[" + i + "]", issues);
        }
    }

    private void validateModule(Module module, GradeScale scale, String path, List<ValidationIssue> issues) {
        blank(module.name(), path, "name", issues);
        if (!Double.isFinite(module.credits()) || module.credits() <= 0) {
            issues.add(new ValidationIssue("INVALID_CREDITS", "Module credits must be positive", path, "credits"));
        }
        for (int i = 0; i < module.exams().size(); i++) {
            validateExam(module.exams().get(i), scale, path + ".exams[" + i + "]", issues);
        }
    }

    private void validateExam(Exam exam, GradeScale scale, String path, List<ValidationIssue> issues) {
        blank(exam.id(), path, "id", issues);
        blank(exam.kind(), path, "kind", issues);
        if (!Double.isFinite(exam.weight()) || exam.weight() < 0) {
            issues.add(new ValidationIssue("INVALID_WEIGHT", "Weight must be zero or positive", path, "weight"));
        }
        if (exam.attempts() < 1) {
            issues.add(new ValidationIssue("INVALID_ATTEMPTS", "Attempts must be at least 1", path, "attempts"));
        }
        if (exam.grade() != null && scale != null && (!Double.isFinite(exam.grade()) || !scale.contains(exam.grade()))) {
            issues.add(new ValidationIssue("GRADE_OUT_OF_SCALE",
                    "Grade " + exam.grade() + " is outside the scale " + scale.best() + ".." + scale.worst(), path, "grade"));
        }
    }

    private void blank(String value, String path, String field, List<ValidationIssue> issues) {
        if (value == null || value.isBlank()) {
            issues.add(new ValidationIssue("MISSING_FIELD", field + " is required", path, field));
        }
    }

    // Every repeat is reported at its own position; the first occurrence stays valid.
    private void duplicate(List<Row> rows, String code, String field, List<ValidationIssue> issues) {
        Set<String> seen = new HashSet<>();
        for (Row row : rows) {
            if (row.id() != null && !seen.add(row.id())) {
                issues.add(new ValidationIssue(code, "Duplicate " + field + ": " + row.id(), row.path(), field));
            }
        }
    }

    private record Row(String id, String path) {}
}
