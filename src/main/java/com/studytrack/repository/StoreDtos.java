package com.studytrack.repository;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.LocalDate;
import java.util.List;

public class StoreDtos {
    @JsonPropertyOrder({"student"})
    public record StoreDoc(StudentDoc student) {}

    @JsonPropertyOrder({"firstName", "lastName", "matriculationNumber", "email", "birthDate", "enrolledOn", "program"})
    public record StudentDoc(String firstName, String lastName, String matriculationNumber, String email,
                             LocalDate birthDate, LocalDate enrolledOn, ProgramDoc program) {}

    @JsonPropertyOrder({"name", "totalCreditsRequired", "targetAverage", "gradeScale", "semesters"})
    public record ProgramDoc(String name, Double totalCreditsRequired, Double targetAverage,
                             GradeScaleDoc gradeScale, List<SemesterDoc> semesters) {}

    @JsonPropertyOrder({"best", "worst", "passMark"})
    public record GradeScaleDoc(Double best, Double worst, Double passMark) {}

    @JsonPropertyOrder({"number", "startDate", "endDate", "recommendedCredits", "modules"})
    public record SemesterDoc(Integer number, LocalDate startDate, LocalDate endDate,
                              Double recommendedCredits, List<ModuleDoc> modules) {}

    @JsonPropertyOrder({"name", "code", "description", "credits", "exams"})
    public record ModuleDoc(String name, String code, String description, Double credits, List<ExamDoc> exams) {}

    @JsonPropertyOrder({"id", "kind", "description", "grade", "weight", "date", "status", "attempts"})
    public record ExamDoc(String id, String kind, String description, Double grade, Double weight,
                          LocalDate date, String status, Integer attempts) {}
}
