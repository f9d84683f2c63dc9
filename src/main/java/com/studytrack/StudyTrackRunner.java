package com.studytrack;

import com.studytrack.aggregation.AggregationModels.ModuleStanding;
import com.studytrack.aggregation.AggregationModels.ProgressSummary;
import com.studytrack.aggregation.AggregationModels.SemesterAverage;
import com.studytrack.aggregation.AggregationModels.UpcomingExam;
import com.studytrack.aggregation.AggregationService;
import com.studytrack.bootstrap.SampleDataFactory;
import com.studytrack.config.StudyTrackProperties;
import com.studytrack.config.StudyTrackProperties.BootstrapMode;
import com.studytrack.csv.CsvFormatException;
import com.studytrack.csv.CsvModels.CsvImportResult;
import com.studytrack.domain.DomainModels.ExamRef;
import com.studytrack.domain.DomainModels.Student;
import com.studytrack.repository.JsonRecordRepository;
import com.studytrack.repository.MalformedStoreException;
import com.studytrack.service.CsvImportService;
import com.studytrack.service.RecordSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

@Slf4j
@Component
public class StudyTrackRunner implements ApplicationRunner {
    static final String IMPORT_OPTION = "import";
    static final String EXPORT_OPTION = "export";

    private final JsonRecordRepository repository;
    private final SampleDataFactory sampleData;
    private final CsvImportService csvService;
    private final AggregationService aggregation;
    private final StudyTrackProperties properties;

    public StudyTrackRunner(JsonRecordRepository repository,
                            SampleDataFactory sampleData,
                            CsvImportService csvService,
                            AggregationService aggregation,
                            StudyTrackProperties properties) {
        this.repository = repository;
        this.sampleData = sampleData;
        this.csvService = csvService;
        this.aggregation = aggregation;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) throws MalformedStoreException, CsvFormatException {
        RecordSession session = new RecordSession(repository, properties.storePath());
        if (!session.load()) {
            if (properties.bootstrap() == BootstrapMode.NONE) {
                log.info("No record at {} and bootstrap is disabled, nothing to do", properties.storePath());
                return;
            }
            session.replace(sampleData.create(LocalDate.now()));
        }

        try {
            List<String> imports = args.getOptionValues(IMPORT_OPTION);
            if (imports != null) {
                for (String file : imports) {
                    CsvImportResult result = csvService.importFrom(session.require(), Path.of(file));
                    session.replace(result.student());
                }
            }
            List<String> exports = args.getOptionValues(EXPORT_OPTION);
            if (exports != null) {
                for (String file : exports) {
                    csvService.exportTo(Path.of(file), session.require().program());
                }
            }
            report(session.require());
        } finally {
            session.checkpoint();
        }
    }

    void report(Student student) {
        ProgressSummary summary = aggregation.summary(student);
        log.info("{} / {}", summary.studentName(), summary.programName());
        log.info("Average {} (target {}, {})", format(summary.overallAverage()), summary.targetAverage(), summary.targetStatus());
        log.info("Credits {} of {} ({}%)", summary.credits().reportedCompleted(), summary.credits().required(), summary.credits().percent());
        for (SemesterAverage semester : summary.semesterAverages()) {
            log.info("  Semester {}: {}", semester.semesterNumber(), format(semester.average()));
        }
        for (ModuleStanding module : summary.modules()) {
            log.debug("  {} [{}] {} credits, {}", module.moduleName(), module.standing(), module.credits(), format(module.average()));
        }
        for (ExamRef failed : summary.failedExams()) {
            log.info("Failed: {} ({}) with {}, attempt {}", failed.moduleName(), failed.exam().kind(), failed.exam().grade(), failed.exam().attempts());
        }
        for (UpcomingExam upcoming : aggregation.upcomingExams(student.program(), LocalDate.now(), properties.upcomingDays())) {
            log.info("Upcoming: {} ({}) in {} days", upcoming.exam().moduleName(), upcoming.exam().exam().kind(), upcoming.daysLeft());
        }
    }

    private static String format(OptionalDouble value) {
        return value.isPresent() ? String.format(Locale.ROOT, "%.2f", value.getAsDouble()) : "no data";
    }
}
