package com.studytrack.aggregation;

import com.studytrack.aggregation.AggregationModels.*;
import com.studytrack.domain.DomainModels.Exam;
import com.studytrack.domain.DomainModels.ExamRef;
import com.studytrack.domain.DomainModels.ExamStatus;
import com.studytrack.domain.DomainModels.GradeScale;
import com.studytrack.domain.DomainModels.Module;
import com.studytrack.domain.DomainModels.Program;
import com.studytrack.domain.DomainModels.Semester;
import com.studytrack.domain.DomainModels.Student;
import com.studytrack.service.UnknownEntityException;
import com.studytrack.validation.RecordValidator;
import com.studytrack.validation.ValidationException;
import com.studytrack.validation.ValidationIssue;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Service
public class AggregationService {
    private final RecordValidator validator;

    public AggregationService(RecordValidator validator) {
        this.validator = validator;
    }

    /** Weighted mean over completed, graded exams with a positive weight; empty when there are none. */
    public OptionalDouble overallAverage(Program program) {
        return weightedAverage(program.modules().flatMap(m -> m.exams().stream()));
    }

    public OptionalDouble semesterAverage(Program program, int semesterNumber) {
        Semester semester = program.semester(semesterNumber)
                .orElseThrow(() -> new UnknownEntityException("semester", String.valueOf(semesterNumber)));
        return semesterAverage(semester);
    }

    public OptionalDouble semesterAverage(Semester semester) {
        return weightedAverage(semester.modules().stream().flatMap(m -> m.exams().stream()));
    }

    public OptionalDouble moduleAverage(Module module) {
        return weightedAverage(module.exams().stream());
    }

    public double creditsCompleted(Program program) {
        return program.modules().filter(Module::isCompleted).mapToDouble(Module::credits).sum();
    }

    public double progressRatio(Program program) {
        double ratio = creditsCompleted(program) / program.totalCreditsRequired();
        return Math.max(0.0, Math.min(1.0, ratio));
    }

    public CreditProgress creditProgress(Program program) {
        double completed = creditsCompleted(program);
        double required = program.totalCreditsRequired();
        return new CreditProgress(completed, Math.min(completed, required), required, progressRatio(program));
    }

    public TargetStatus onTarget(Program program) {
        OptionalDouble average = overallAverage(program);
        if (average.isEmpty()) return TargetStatus.UNDETERMINED;
        return program.gradeScale().isBetterOrEqual(average.getAsDouble(), program.targetAverage())
                ? TargetStatus.ON_TARGET
                : TargetStatus.OFF_TARGET;
    }

    /**
     * Overall average as if the given pending exams had been completed with the given grades.
     * The program is not modified.
     */
    public OptionalDouble projectedAverage(Program program, Map<String, Double> hypotheticalGrades) {
        Map<String, Double> grades = hypotheticalGrades == null ? Map.of() : hypotheticalGrades;
        grades.forEach((examId, grade) -> {
            ExamRef ref = requirePending(program, examId);
            if (grade == null) {
                throw new ValidationException(new ValidationIssue("MISSING_FIELD", "Hypothetical grade is required", "exams[" + examId + "]", "grade"));
            }
            validator.requireGrade(program.gradeScale(), grade, "exams[" + ref.exam().id() + "]", "grade");
        });

        Stream<Exam> exams = program.modules()
                .flatMap(m -> m.exams().stream())
                .map(e -> grades.containsKey(e.id())
                        ? e.withGrade(grades.get(e.id()), ExamStatus.COMPLETED)
                        : e);
        return weightedAverage(exams);
    }

    /**
     * The single grade that, achieved on every listed pending exam, lands the overall average
     * exactly on the target.
     */
    public RequiredGrade requiredGrade(Program program, Collection<String> pendingExamIds) {
        Set<String> ids = new LinkedHashSet<>(pendingExamIds == null ? List.of() : pendingExamIds);
        double pendingWeight = ids.stream()
                .map(id -> requirePending(program, id))
                .mapToDouble(r -> r.exam().weight())
                .sum();
        if (pendingWeight <= 0) return RequiredGrade.of(RequiredGradeStatus.UNDETERMINED);

        List<Exam> graded = program.modules()
                .flatMap(m -> m.exams().stream())
                .filter(e -> e.isGraded() && e.weight() > 0)
                .toList();
        double weightedSum = graded.stream().mapToDouble(e -> e.grade() * e.weight()).sum();
        double weight = graded.stream().mapToDouble(Exam::weight).sum();

        double needed = (program.targetAverage() * (weight + pendingWeight) - weightedSum) / pendingWeight;
        GradeScale scale = program.gradeScale();
        if (scale.isBetterOrEqual(scale.worst(), needed)) return RequiredGrade.of(RequiredGradeStatus.SECURED);
        if (!scale.isBetterOrEqual(scale.best(), needed)) return RequiredGrade.of(RequiredGradeStatus.UNREACHABLE);
        return new RequiredGrade(RequiredGradeStatus.REACHABLE, OptionalDouble.of(needed));
    }

    public List<SemesterAverage> semesterAverages(Program program) {
        return program.semesters().stream()
                .map(s -> new SemesterAverage(s.number(), semesterAverage(s)))
                .toList();
    }

    public List<GradeCount> gradeDistribution(Program program) {
        Map<Double, Long> counts = program.modules()
                .flatMap(m -> m.exams().stream())
                .filter(Exam::isGraded)
                .collect(Collectors.groupingBy(Exam::grade, Collectors.counting()));
        return counts.entrySet().stream()
                .sorted(Map.Entry.comparingByKey(program.gradeScale().bestFirst()))
                .map(e -> new GradeCount(e.getKey(), e.getValue()))
                .toList();
    }

    public List<ModuleStanding> moduleStandings(Program program) {
        List<ModuleStanding> out = new ArrayList<>();
        for (Semester semester : program.semesters()) {
            for (Module module : semester.modules()) {
                out.add(new ModuleStanding(semester.number(), module.name(), module.credits(), standing(module, program.gradeScale()), moduleAverage(module)));
            }
        }
        return out;
    }

    /** Exams not yet graded whose date falls within {@code [today, today + days]}, soonest first. */
    public List<UpcomingExam> upcomingExams(Program program, LocalDate today, int days) {
        LocalDate end = today.plusDays(days);
        return program.exams().stream()
                .filter(r -> !r.exam().isGraded())
                .filter(r -> r.exam().date() != null)
                .filter(r -> !r.exam().date().isBefore(today) && !r.exam().date().isAfter(end))
                .sorted(Comparator.comparing((ExamRef r) -> r.exam().date()))
                .map(r -> new UpcomingExam(r, ChronoUnit.DAYS.between(today, r.exam().date())))
                .toList();
    }

    public double remainingCredits(Semester semester) {
        double completed = semester.modules().stream().filter(Module::isCompleted).mapToDouble(Module::credits).sum();
        return Math.max(0.0, semester.recommendedCredits() - completed);
    }

    public ProgressSummary summary(Student student) {
        Program program = student.program();
        return new ProgressSummary(
                student.fullName(),
                program.name(),
                overallAverage(program),
                program.targetAverage(),
                onTarget(program),
                creditProgress(program),
                semesterAverages(program),
                gradeDistribution(program),
                moduleStandings(program),
                failedExams(program)
        );
    }

    public List<ExamRef> failedExams(Program program) {
        return program.exams().stream()
                .filter(r -> r.exam().isFailed(program.gradeScale()))
                .toList();
    }

    private Standing standing(Module module, GradeScale scale) {
        if (module.exams().stream().anyMatch(e -> e.isFailed(scale))) return Standing.FAILED;
        if (module.isCompleted()) return Standing.COMPLETED;
        return module.exams().stream().anyMatch(Exam::isGraded) ? Standing.IN_PROGRESS : Standing.OPEN;
    }

    private ExamRef requirePending(Program program, String examId) {
        ExamRef ref = program.exam(examId).orElseThrow(() -> new UnknownEntityException("exam", examId));
        if (ref.exam().isGraded()) {
            throw new ValidationException(new ValidationIssue("EXAM_ALREADY_GRADED",
                    "Exam already has a recorded grade", "exams[" + examId + "]", "grade"));
        }
        return ref;
    }

    private OptionalDouble weightedAverage(Stream<Exam> exams) {
        List<Exam> counted = exams.filter(e -> e.isGraded() && e.weight() > 0).toList();
        if (counted.isEmpty()) return OptionalDouble.empty();
        double weightedSum = counted.stream().mapToDouble(e -> e.grade() * e.weight()).sum();
        double weight = counted.stream().mapToDouble(Exam::weight).sum();
        return OptionalDouble.of(weightedSum / weight);
    }
}
