package com.studytrack;

import com.studytrack.aggregation.AggregationModels.TargetStatus;
import com.studytrack.aggregation.AggregationService;
import com.studytrack.bootstrap.SampleDataFactory;
import com.studytrack.config.StudyTrackProperties;
import com.studytrack.config.StudyTrackProperties.BootstrapMode;
import com.studytrack.domain.DomainModels.Student;
import com.studytrack.repository.JsonRecordRepository;
import com.studytrack.service.CsvImportService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.test.context.SpringBootTest;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class StudyTrackRunnerTest {
    @Autowired
    private JsonRecordRepository repository;

    @Autowired
    private SampleDataFactory sampleData;

    @Autowired
    private CsvImportService csvService;

    @Autowired
    private AggregationService aggregation;

    @Autowired
    private StudyTrackProperties properties;

    @Test
    void testProfileDoesNotBootstrap() {
        assertEquals(BootstrapMode.NONE, properties.bootstrap());
        assertFalse(Files.exists(properties.storePath()));
    }

    @Test
    void bootstrapsSampleExportsAndSaves(@TempDir Path dir) throws Exception {
        Path store = dir.resolve("store.json");
        Path export = dir.resolve("exams.csv");

        runner(store, BootstrapMode.SAMPLE).run(new DefaultApplicationArguments("--export=" + export));

        Student saved = repository.read(store).orElseThrow();
        assertEquals("Max Mustermann", saved.fullName());
        assertEquals(6, saved.program().semesters().size());
        assertEquals(18, saved.program().modules().count());
        assertEquals(2.0, aggregation.overallAverage(saved.program()).getAsDouble(), 1e-9);
        assertEquals(TargetStatus.ON_TARGET, aggregation.onTarget(saved.program()));
        assertEquals(70.0, aggregation.creditsCompleted(saved.program()));
        assertEquals(saved.program().exams().size() + 1, Files.readAllLines(export).size());
    }

    @Test
    void importsIntoExistingStore(@TempDir Path dir) throws Exception {
        Path store = dir.resolve("store.json");
        Path csv = dir.resolve("new.csv");
        Files.writeString(csv, "module,semester,grade,weight,date,status\nModul 4.1,4,1.0,1,2025-02-15,completed\n");
        runner(store, BootstrapMode.SAMPLE).run(new DefaultApplicationArguments());
        int before = repository.read(store).orElseThrow().program().exams().size();

        runner(store, BootstrapMode.NONE).run(new DefaultApplicationArguments("--import=" + csv));

        Student saved = repository.read(store).orElseThrow();
        assertEquals(before + 1, saved.program().exams().size());
        assertEquals(List.of(1.0), saved.program().module("Modul 4.1").orElseThrow().exams().stream()
                .map(e -> e.grade()).toList());
    }

    @Test
    void noStoreAndNoBootstrapWritesNothing(@TempDir Path dir) throws Exception {
        Path store = dir.resolve("store.json");

        runner(store, BootstrapMode.NONE).run(new DefaultApplicationArguments());

        assertFalse(Files.exists(store));
    }

    private StudyTrackRunner runner(Path store, BootstrapMode mode) {
        return new StudyTrackRunner(repository, sampleData, csvService, aggregation,
                new StudyTrackProperties(store, mode, 5, 30));
    }
}
