package com.studytrack.bootstrap;

import com.studytrack.domain.DomainModels.ExamStatus;
import com.studytrack.domain.DomainModels.GradeScale;
import com.studytrack.domain.DomainModels.Student;
import com.studytrack.service.AcademicRecordService;
import com.studytrack.service.RecordCommands.ExamDraft;
import com.studytrack.service.RecordCommands.ModuleDraft;
import com.studytrack.service.RecordCommands.ProgramSettings;
import com.studytrack.service.RecordCommands.SemesterDraft;
import com.studytrack.service.RecordCommands.StudentProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

@Slf4j
@Component
public class SampleDataFactory {
    static final int SEMESTERS = 6;
    static final int MODULES_PER_SEMESTER = 3;
    static final int CURRENT_SEMESTER = 3;

    private final AcademicRecordService recordService;

    public SampleDataFactory(AcademicRecordService recordService) {
        this.recordService = recordService;
    }

    public Student create(LocalDate today) {
        Student student = recordService.createStudent(
                new StudentProfile("Max", "Mustermann", "123456", "max.mustermann@iu-example.de",
                        LocalDate.of(1985, 6, 16), LocalDate.of(2022, 4, 1)),
                new ProgramSettings("Informatik Bachelor", 180, 2.0, GradeScale.DEFAULT));

        for (int i = 1; i <= SEMESTERS; i++) {
            student = recordService.addSemester(student, semester(i));
            for (int j = 1; j <= MODULES_PER_SEMESTER; j++) {
                String name = "Modul " + i + "." + j;
                student = recordService.addModule(student, i, new ModuleDraft(name, "M" + i + j,
                        "Beschreibung für Modul " + i + "." + j, j == 1 ? 10 : j == 2 ? 5 : 15));

                if (i < CURRENT_SEMESTER || (i == CURRENT_SEMESTER && j == 1)) {
                    int year = 2022 + (i - 1) / 2;
                    student = recordService.addExam(student, name, new ExamDraft("E" + i + j,
                            j % 2 == 1 ? "Klausur" : "Hausarbeit", "Prüfung für Modul " + i + "." + j,
                            grade(i, j), 1.0, LocalDate.of(year, i % 2 == 1 ? 7 : 2, 15), ExamStatus.COMPLETED));
                } else if (i == CURRENT_SEMESTER) {
                    student = recordService.addExam(student, name, new ExamDraft("E" + i + j,
                            j % 2 == 0 ? "Klausur" : "Hausarbeit", "Anstehende Prüfung für Modul " + i + "." + j,
                            null, 1.0, today.plusDays(14), ExamStatus.SCHEDULED));
                }
            }
        }
        log.info("Created sample record for {} with {} exams", student.fullName(), student.program().exams().size());
        return student;
    }

    // Odd semesters run April to September, even ones October to March of the following year.
    private SemesterDraft semester(int number) {
        int year = 2022 + (number - 1) / 2;
        if (number % 2 == 1) {
            return new SemesterDraft(number, LocalDate.of(year, 4, 1), LocalDate.of(year, 9, 30), 30.0);
        }
        return new SemesterDraft(number, LocalDate.of(year, 10, 1), LocalDate.of(year + 1, 3, 31), 30.0);
    }

    private static double grade(int semester, int module) {
        if (semester == 1) return module == 1 ? 1.3 : module == 2 ? 2.0 : 1.7;
        if (semester == 2) return module == 1 ? 2.3 : module == 2 ? 3.0 : 1.0;
        return 2.7;
    }
}
