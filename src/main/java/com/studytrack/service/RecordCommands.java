package com.studytrack.service;

import com.studytrack.domain.DomainModels.ExamStatus;
import com.studytrack.domain.DomainModels.GradeScale;

import java.time.LocalDate;

public class RecordCommands {
    public record StudentProfile(String firstName,
                                 String lastName,
                                 String matriculationNumber,
                                 String email,
                                 LocalDate birthDate,
                                 LocalDate enrolledOn) {}

    public record ProgramSettings(String name, double totalCreditsRequired, double targetAverage, GradeScale gradeScale) {}

    public record SemesterDraft(int number, LocalDate startDate, LocalDate endDate, Double recommendedCredits) {
        public static SemesterDraft of(int number) {
            return new SemesterDraft(number, null, null, null);
        }
    }

    public record ModuleDraft(String name, String code, String description, double credits) {
        public static ModuleDraft of(String name, double credits) {
            return new ModuleDraft(name, null, null, credits);
        }
    }

    /**
     * {@code id}, {@code weight} and {@code status} may be null: a fresh id is generated,
     * the weight defaults to 1 and the status follows from whether a grade is present.
     */
    public record ExamDraft(String id,
                            String kind,
                            String description,
                            Double grade,
                            Double weight,
                            LocalDate date,
                            ExamStatus status) {
        public static ExamDraft graded(double grade, double weight) {
            return new ExamDraft(null, null, null, grade, weight, null, ExamStatus.COMPLETED);
        }

        public static ExamDraft scheduled(LocalDate date) {
            return new ExamDraft(null, null, null, null, null, date, ExamStatus.SCHEDULED);
        }
    }
}
