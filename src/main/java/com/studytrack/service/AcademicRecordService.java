package com.studytrack.service;

import com.studytrack.domain.DomainModels.Exam;
import com.studytrack.domain.DomainModels.ExamRef;
import com.studytrack.domain.DomainModels.ExamStatus;
import com.studytrack.domain.DomainModels.Module;
import com.studytrack.domain.DomainModels.Program;
import com.studytrack.domain.DomainModels.Semester;
import com.studytrack.domain.DomainModels.Student;
import com.studytrack.service.RecordCommands.ExamDraft;
import com.studytrack.service.RecordCommands.ModuleDraft;
import com.studytrack.service.RecordCommands.ProgramSettings;
import com.studytrack.service.RecordCommands.SemesterDraft;
import com.studytrack.service.RecordCommands.StudentProfile;
import com.studytrack.validation.RecordValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
public class AcademicRecordService {
    private static final String DEFAULT_EXAM_KIND = "Exam";

    private final RecordValidator validator;

    public AcademicRecordService(RecordValidator validator) {
        this.validator = validator;
    }

    public Student createStudent(StudentProfile profile, ProgramSettings settings) {
        Program program = new Program(settings.name(), settings.totalCreditsRequired(), settings.targetAverage(),
                settings.gradeScale(), List.of());
        Student student = new Student(profile.firstName(), profile.lastName(), profile.matriculationNumber(),
                profile.email(), profile.birthDate(), profile.enrolledOn(), program);
        return publish(student);
    }

    public Student addSemester(Student student, SemesterDraft draft) {
        double recommended = draft.recommendedCredits() == null ? Semester.DEFAULT_RECOMMENDED_CREDITS : draft.recommendedCredits();
        Semester semester = new Semester(draft.number(), draft.startDate(), draft.endDate(), recommended, List.of());
        log.debug("Adding semester {}", draft.number());
        return publish(student.withProgram(student.program().withSemester(semester)));
    }

    /** Removes the semester together with its modules and their exams. */
    public Student removeSemester(Student student, int number) {
        Program program = student.program();
        requireSemester(program, number);
        log.debug("Removing semester {}", number);
        return publish(student.withProgram(program.withSemesters(program.semesters().stream()
                .filter(s -> s.number() != number)
                .toList())));
    }

    /** Adds a module; the semester is created first when the program does not have it yet. */
    public Student addModule(Student student, int semesterNumber, ModuleDraft draft) {
        Program program = student.program();
        if (program.semester(semesterNumber).isEmpty()) {
            log.debug("Semester {} not found, creating it for module {}", semesterNumber, draft.name());
            program = program.withSemester(Semester.empty(semesterNumber));
        }
        Module module = new Module(draft.name(), draft.code(), draft.description(), draft.credits(), List.of());
        Program next = program.mapSemesters(s -> s.number() == semesterNumber ? s.withModule(module) : s);
        return publish(student.withProgram(next));
    }

    public Student removeModule(Student student, String moduleName) {
        Program program = student.program();
        requireModule(program, moduleName);
        log.debug("Removing module {}", moduleName);
        return publish(student.withProgram(program.mapSemesters(s -> s.withModules(s.modules().stream()
                .filter(m -> !m.name().equals(moduleName))
                .toList()))));
    }

    public Student addExam(Student student, String moduleName, ExamDraft draft) {
        Program program = student.program();
        requireModule(program, moduleName);
        Exam exam = toExam(draft);
        log.debug("Adding exam {} to module {}", exam.id(), moduleName);
        return publish(student.withProgram(program.mapModules(m -> m.name().equals(moduleName) ? m.withExam(exam) : m)));
    }

    /** Marks the exam completed with the given grade; a null date keeps the exam's current date. */
    public Student recordGrade(Student student, String examId, double grade, LocalDate date) {
        requireExam(student.program(), examId);
        return publish(student.withProgram(student.program().mapExams(e -> {
            if (!e.id().equals(examId)) return e;
            Exam graded = e.withGrade(grade, ExamStatus.COMPLETED);
            return date == null ? graded : graded.withDate(date);
        })));
    }

    public Student changeExamWeight(Student student, String examId, double weight) {
        requireExam(student.program(), examId);
        return publish(student.withProgram(student.program().mapExams(e -> e.id().equals(examId) ? e.withWeight(weight) : e)));
    }

    /** Drops the recorded grade and schedules another attempt on the given date. */
    public Student scheduleRetake(Student student, String examId, LocalDate date) {
        requireExam(student.program(), examId);
        return publish(student.withProgram(student.program().mapExams(e -> e.id().equals(examId)
                ? e.withGrade(null, ExamStatus.SCHEDULED).withDate(date).withAttempts(e.attempts() + 1)
                : e)));
    }

    public Student removeExam(Student student, String examId) {
        requireExam(student.program(), examId);
        log.debug("Removing exam {}", examId);
        return publish(student.withProgram(student.program().mapModules(m -> m.withExams(m.exams().stream()
                .filter(e -> !e.id().equals(examId))
                .toList()))));
    }

    public Student changeTargetAverage(Student student, double target) {
        return publish(student.withProgram(student.program().withTargetAverage(target)));
    }

    public Student changeTotalCreditsRequired(Student student, double total) {
        return publish(student.withProgram(student.program().withTotalCreditsRequired(total)));
    }

    Exam toExam(ExamDraft draft) {
        String id = draft.id() == null || draft.id().isBlank() ? UUID.randomUUID().toString() : draft.id();
        String kind = draft.kind() == null || draft.kind().isBlank() ? DEFAULT_EXAM_KIND : draft.kind();
        double weight = draft.weight() == null ? Exam.DEFAULT_WEIGHT : draft.weight();
        ExamStatus status = draft.status() != null
                ? draft.status()
                : (draft.grade() == null ? ExamStatus.SCHEDULED : ExamStatus.COMPLETED);
        return new Exam(id, kind, draft.description(), draft.grade(), weight, draft.date(), status, 1);
    }

    private Student publish(Student candidate) {
        validator.requireValid(candidate);
        return candidate;
    }

    private void requireSemester(Program program, int number) {
        if (program.semester(number).isEmpty()) {
            throw new UnknownEntityException("semester", String.valueOf(number));
        }
    }

    private void requireModule(Program program, String moduleName) {
        if (program.module(moduleName).isEmpty()) {
            throw new UnknownEntityException("module", moduleName);
        }
    }

    private ExamRef requireExam(Program program, String examId) {
        return program.exam(examId).orElseThrow(() -> new UnknownEntityException("exam", examId));
    }
}
