package com.studytrack.domain;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

public class DomainModels {

    public record Student(String firstName,
                          String lastName,
                          String matriculationNumber,
                          String email,
                          LocalDate birthDate,
                          LocalDate enrolledOn,
                          Program program) {
        public String fullName() {
            return firstName + " " + lastName;
        }

        public Student withProgram(Program next) {
            return new Student(firstName, lastName, matriculationNumber, email, birthDate, enrolledOn, next);
        }
    }

    public record Program(String name,
                          double totalCreditsRequired,
                          double targetAverage,
                          GradeScale gradeScale,
                          List<Semester> semesters) {
        public Program {
            semesters = List.copyOf(semesters);
        }

        public Optional<Semester> semester(int number) {
            return semesters.stream().filter(s -> s.number() == number).findFirst();
        }

        public Stream<Module> modules() {
            return semesters.stream().flatMap(s -> s.modules().stream());
        }

        public Optional<Module> module(String moduleName) {
            return modules().filter(m -> m.name().equals(moduleName)).findFirst();
        }

        public Optional<Integer> semesterOf(String moduleName) {
            return semesters.stream()
                    .filter(s -> s.modules().stream().anyMatch(m -> m.name().equals(moduleName)))
                    .map(Semester::number)
                    .findFirst();
        }

        public List<ExamRef> exams() {
            List<ExamRef> refs = new ArrayList<>();
            for (Semester semester : semesters) {
                for (Module module : semester.modules()) {
                    for (Exam exam : module.exams()) {
                        refs.add(new ExamRef(semester.number(), module.name(), exam));
                    }
                }
            }
            return refs;
        }

        public Optional<ExamRef> exam(String examId) {
            return exams().stream().filter(r -> r.exam().id().equals(examId)).findFirst();
        }

        public Program withTargetAverage(double target) {
            return new Program(name, totalCreditsRequired, target, gradeScale, semesters);
        }

        public Program withTotalCreditsRequired(double total) {
            return new Program(name, total, targetAverage, gradeScale, semesters);
        }

        public Program withSemesters(List<Semester> next) {
            return new Program(name, totalCreditsRequired, targetAverage, gradeScale, next);
        }

        /** Semesters are kept ordered by number regardless of insertion order. */
        public Program withSemester(Semester semester) {
            List<Semester> next = new ArrayList<>(semesters);
            next.add(semester);
            next.sort(Comparator.comparingInt(Semester::number));
            return withSemesters(next);
        }

        public Program mapSemesters(UnaryOperator<Semester> fn) {
            return withSemesters(semesters.stream().map(fn).toList());
        }

        public Program mapModules(UnaryOperator<Module> fn) {
            return mapSemesters(s -> s.withModules(s.modules().stream().map(fn).toList()));
        }

        public Program mapExams(UnaryOperator<Exam> fn) {
            return mapModules(m -> m.withExams(m.exams().stream().map(fn).toList()));
        }
    }

    /**
     * Numeric grade range with direction. {@code best < worst} means lower is better
     * (1.0 best, 6.0 worst); {@code best > worst} means higher is better. A grade passes
     * when it is at least as good as {@code passMark}. Comparisons tolerate
     * {@link #TOLERANCE} so that a weighted mean equal to a bound is not pushed off it by
     * rounding.
     */
    public record GradeScale(double best, double worst, double passMark) {
        public static final double TOLERANCE = 1e-9;
        public static final GradeScale DEFAULT = new GradeScale(1.0, 6.0, 4.0);

        public boolean lowerIsBetter() {
            return best < worst;
        }

        public boolean contains(double grade) {
            return grade >= Math.min(best, worst) && grade <= Math.max(best, worst);
        }

        public boolean isBetterOrEqual(double grade, double reference) {
            return lowerIsBetter() ? grade <= reference + TOLERANCE : grade >= reference - TOLERANCE;
        }

        public boolean passes(double grade) {
            return isBetterOrEqual(grade, passMark);
        }

        public Comparator<Double> bestFirst() {
            Comparator<Double> natural = Comparator.naturalOrder();
            return lowerIsBetter() ? natural : natural.reversed();
        }
    }

    public record Semester(int number,
                           LocalDate startDate,
                           LocalDate endDate,
                           double recommendedCredits,
                           List<Module> modules) {
        public static final double DEFAULT_RECOMMENDED_CREDITS = 30;

        public Semester {
            modules = List.copyOf(modules);
        }

        public static Semester empty(int number) {
            return new Semester(number, null, null, DEFAULT_RECOMMENDED_CREDITS, List.of());
        }

        public Semester withModules(List<Module> next) {
            return new Semester(number, startDate, endDate, recommendedCredits, next);
        }

        public Semester withModule(Module module) {
            List<Module> next = new ArrayList<>(modules);
            next.add(module);
            return withModules(next);
        }
    }

    public record Module(String name,
                         String code,
                         String description,
                         double credits,
                         List<Exam> exams) {
        public Module {
            exams = List.copyOf(exams);
        }

        /** Completed iff it has exams and every one of them is completed with a grade. */
        public boolean isCompleted() {
            return !exams.isEmpty() && exams.stream().allMatch(Exam::isGraded);
        }

        public Module withExams(List<Exam> next) {
            return new Module(name, code, description, credits, next);
        }

        public Module withExam(Exam exam) {
            List<Exam> next = new ArrayList<>(exams);
            next.add(exam);
            return withExams(next);
        }
    }

    public record Exam(String id,
                       String kind,
                       String description,
                       Double grade,
                       double weight,
                       LocalDate date,
                       ExamStatus status,
                       int attempts) {
        public static final double DEFAULT_WEIGHT = 1.0;

        public Exam {
            Objects.requireNonNull(status, "status");
        }

        public boolean isGraded() {
            return status == ExamStatus.COMPLETED && grade != null;
        }

        public boolean isPassed(GradeScale scale) {
            return isGraded() && scale.passes(grade);
        }

        public boolean isFailed(GradeScale scale) {
            return isGraded() && !scale.passes(grade);
        }

        public Exam withGrade(Double nextGrade, ExamStatus nextStatus) {
            return new Exam(id, kind, description, nextGrade, weight, date, nextStatus, attempts);
        }

        public Exam withWeight(double nextWeight) {
            return new Exam(id, kind, description, grade, nextWeight, date, status, attempts);
        }

        public Exam withDate(LocalDate nextDate) {
            return new Exam(id, kind, description, grade, weight, nextDate, status, attempts);
        }

        public Exam withAttempts(int nextAttempts) {
            return new Exam(id, kind, description, grade, weight, date, status, nextAttempts);
        }
    }

    public enum ExamStatus {
        SCHEDULED, COMPLETED;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Optional<ExamStatus> fromWire(String value) {
            if (value == null) return Optional.empty();
            for (ExamStatus status : values()) {
                if (status.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) return Optional.of(status);
            }
            return Optional.empty();
        }
    }

    /** An exam located in the tree; the module context is derived, never stored on the exam. */
    public record ExamRef(int semesterNumber, String moduleName, Exam exam) {}
}
