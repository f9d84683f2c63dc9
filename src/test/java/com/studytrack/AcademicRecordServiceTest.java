package com.studytrack;

import com.studytrack.domain.DomainModels.ExamRef;
import com.studytrack.domain.DomainModels.ExamStatus;
import com.studytrack.domain.DomainModels.GradeScale;
import com.studytrack.domain.DomainModels.Student;
import com.studytrack.service.AcademicRecordService;
import com.studytrack.service.RecordCommands.ExamDraft;
import com.studytrack.service.RecordCommands.ModuleDraft;
import com.studytrack.service.RecordCommands.ProgramSettings;
import com.studytrack.service.RecordCommands.SemesterDraft;
import com.studytrack.service.RecordCommands.StudentProfile;
import com.studytrack.service.UnknownEntityException;
import com.studytrack.validation.ValidationException;
import com.studytrack.validation.ValidationIssue;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class AcademicRecordServiceTest {
    @Autowired
    private AcademicRecordService records;

    @Test
    void rejectsOutOfScaleGradeAndKeepsTree() {
        Student student = records.addModule(student(), 1, ModuleDraft.of("Analysis", 5));

        ValidationException e = assertThrows(ValidationException.class,
                () -> records.addExam(student, "Analysis", ExamDraft.graded(9.0, 1)));

        ValidationIssue issue = e.getIssues().get(0);
        assertEquals("GRADE_OUT_OF_SCALE", issue.code());
        assertEquals("grade", issue.field());
        assertEquals("student.program.semesters[0].modules[0].exams[0]", issue.path());
        assertTrue(student.program().module("Analysis").orElseThrow().exams().isEmpty());
    }

    @Test
    void rejectsNonPositiveCreditsAndDuplicateNames() {
        Student student = records.addModule(student(), 1, ModuleDraft.of("Analysis", 5));

        ValidationException credits = assertThrows(ValidationException.class,
                () -> records.addModule(student, 1, ModuleDraft.of("Lineare Algebra", -5)));
        assertEquals("credits", credits.getIssues().get(0).field());

        ValidationException duplicate = assertThrows(ValidationException.class,
                () -> records.addModule(student, 2, ModuleDraft.of("Analysis", 5)));
        assertEquals("DUPLICATE_MODULE", duplicate.getIssues().get(0).code());
        assertEquals("student.program.semesters[1].modules[0]", duplicate.getIssues().get(0).path());
        assertEquals("name", duplicate.getIssues().get(0).field());
        assertTrue(student.program().semester(2).isEmpty());
    }

    @Test
    void rejectsInvalidProgramSettings() {
        StudentProfile profile = new StudentProfile("Max", "Mustermann", "123456", null, null, null);

        assertThrows(ValidationException.class,
                () -> records.createStudent(profile, new ProgramSettings("Informatik", 0, 2.0, GradeScale.DEFAULT)));
        assertThrows(ValidationException.class,
                () -> records.createStudent(profile, new ProgramSettings("Informatik", 180, 7.0, GradeScale.DEFAULT)));
        assertThrows(ValidationException.class,
                () -> records.changeTargetAverage(student(), 0.5));
    }

    @Test
    void missingGradeScaleIsReportedAsInvalidScale() {
        StudentProfile profile = new StudentProfile("Max", "Mustermann", "123456", null, null, null);

        ValidationException e = assertThrows(ValidationException.class,
                () -> records.createStudent(profile, new ProgramSettings("Informatik", 180, 2.0, null)));

        ValidationIssue issue = e.getIssues().get(0);
        assertEquals("INVALID_SCALE", issue.code());
        assertEquals("student.program", issue.path());
        assertEquals("gradeScale", issue.field());
    }

    @Test
    void passMarkMustLieOnTheScale() {
        StudentProfile profile = new StudentProfile("Max", "Mustermann", "123456", null, null, null);

        ValidationException e = assertThrows(ValidationException.class,
                () -> records.createStudent(profile, new ProgramSettings("Informatik", 180, 2.0, new GradeScale(1.0, 6.0, 7.0))));

        ValidationIssue issue = e.getIssues().get(0);
        assertEquals("INVALID_SCALE", issue.code());
        assertEquals("student.program.gradeScale", issue.path());
        assertEquals("passMark", issue.field());
    }

    @Test
    void duplicateExamIdIsReportedAtTheRepeatedExam() {
        Student student = records.addModule(student(), 1, ModuleDraft.of("Analysis", 5));
        student = records.addModule(student, 2, ModuleDraft.of("Numerik", 5));
        Student withExam = records.addExam(student, "Analysis", new ExamDraft("E1", null, null, 2.0, 1.0, null, null));

        ValidationException e = assertThrows(ValidationException.class,
                () -> records.addExam(withExam, "Numerik", new ExamDraft("E1", null, null, 1.0, 1.0, null, null)));

        assertEquals("DUPLICATE_EXAM", e.getIssues().get(0).code());
        assertEquals("student.program.semesters[1].modules[0].exams[0]", e.getIssues().get(0).path());
    }

    @Test
    void semestersStayOrderedAndUnique() {
        Student student = records.addSemester(student(), SemesterDraft.of(3));
        student = records.addSemester(student, SemesterDraft.of(1));
        Student withTwo = student;

        assertEquals(1, student.program().semesters().get(0).number());
        assertEquals(30.0, student.program().semesters().get(0).recommendedCredits());
        assertThrows(ValidationException.class, () -> records.addSemester(withTwo, SemesterDraft.of(3)));
        assertThrows(ValidationException.class, () -> records.addSemester(withTwo,
                new SemesterDraft(4, LocalDate.of(2024, 10, 1), LocalDate.of(2024, 3, 31), null)));
    }

    @Test
    void removeSemesterCascadesToModulesAndExams() {
        Student student = records.addModule(student(), 1, ModuleDraft.of("Analysis", 5));
        student = records.addExam(student, "Analysis", ExamDraft.graded(2.0, 1));
        student = records.addModule(student, 2, ModuleDraft.of("Numerik", 5));

        Student after = records.removeSemester(student, 1);

        assertTrue(after.program().module("Analysis").isEmpty());
        assertTrue(after.program().exams().isEmpty());
        assertTrue(after.program().module("Numerik").isPresent());
        assertThrows(UnknownEntityException.class, () -> records.removeSemester(after, 1));
    }

    @Test
    void gradeRetakeAndRemoveExam() {
        Student student = records.addModule(student(), 1, ModuleDraft.of("Analysis", 5));
        student = records.addExam(student, "Analysis", ExamDraft.scheduled(LocalDate.of(2024, 7, 1)));
        String id = student.program().exams().get(0).exam().id();

        student = records.recordGrade(student, id, 4.3, null);
        ExamRef graded = student.program().exam(id).orElseThrow();
        assertEquals(ExamStatus.COMPLETED, graded.exam().status());
        assertEquals(LocalDate.of(2024, 7, 1), graded.exam().date());
        assertEquals("Analysis", graded.moduleName());

        student = records.scheduleRetake(student, id, LocalDate.of(2024, 9, 20));
        ExamRef retake = student.program().exam(id).orElseThrow();
        assertNull(retake.exam().grade());
        assertEquals(ExamStatus.SCHEDULED, retake.exam().status());
        assertEquals(2, retake.exam().attempts());

        student = records.changeExamWeight(student, id, 2.5);
        assertEquals(2.5, student.program().exam(id).orElseThrow().exam().weight());

        Student removed = records.removeExam(student, id);
        assertTrue(removed.program().exam(id).isEmpty());
        assertThrows(UnknownEntityException.class, () -> records.recordGrade(removed, id, 1.0, null));
    }

    @Test
    void draftDefaultsAreApplied() {
        Student student = records.addModule(student(), 1, ModuleDraft.of("Analysis", 5));
        student = records.addExam(student, "Analysis", new ExamDraft(null, null, null, 1.7, null, null, null));

        var exam = student.program().exams().get(0).exam();
        assertNotNull(exam.id());
        assertEquals("Exam", exam.kind());
        assertEquals(1.0, exam.weight());
        assertEquals(ExamStatus.COMPLETED, exam.status());
        assertEquals(1, exam.attempts());
    }

    @Test
    void unknownModuleIsReported() {
        UnknownEntityException e = assertThrows(UnknownEntityException.class,
                () -> records.addExam(student(), "Gibt es nicht", ExamDraft.graded(1.0, 1)));
        assertEquals("module", e.getEntity());
        assertEquals("Gibt es nicht", e.getKey());
    }

    private Student student() {
        return records.createStudent(new StudentProfile("Max", "Mustermann", "123456", null, null, null),
                new ProgramSettings("Mathematik Bachelor", 180, 2.0, GradeScale.DEFAULT));
    }
}
