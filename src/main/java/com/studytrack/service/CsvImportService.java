package com.studytrack.service;

import com.studytrack.config.StudyTrackProperties;
import com.studytrack.csv.CsvFormatException;
import com.studytrack.csv.CsvModels;
import com.studytrack.csv.CsvModels.CsvImportResult;
import com.studytrack.csv.CsvModels.ExamLine;
import com.studytrack.csv.CsvModels.ParsedRow;
import com.studytrack.csv.CsvModels.RowImportError;
import com.studytrack.csv.ExamCsvCodec;
import com.studytrack.domain.DomainModels.Program;
import com.studytrack.domain.DomainModels.Student;
import com.studytrack.repository.StoreFiles;
import com.studytrack.service.RecordCommands.ExamDraft;
import com.studytrack.service.RecordCommands.ModuleDraft;
import com.studytrack.validation.ValidationException;
import com.studytrack.validation.ValidationIssue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
public class CsvImportService {
    static final String IMPORTED_EXAM_KIND = "Import";

    private final ExamCsvCodec codec;
    private final AcademicRecordService recordService;
    private final StudyTrackProperties properties;

    public CsvImportService(ExamCsvCodec codec, AcademicRecordService recordService, StudyTrackProperties properties) {
        this.codec = codec;
        this.recordService = recordService;
        this.properties = properties;
    }

    public CsvImportResult importFrom(Student student, Path path) throws CsvFormatException {
        if (!Files.isRegularFile(path)) {
            throw new CsvFormatException("CSV file not found: " + path.toAbsolutePath());
        }
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            CsvImportResult result = importRows(student, reader);
            log.info("Imported {} exam rows from {} ({} rejected)", result.importedRows(), path.toAbsolutePath(), result.errors().size());
            return result;
        } catch (IOException e) {
            throw new CsvFormatException("Cannot read CSV file " + path.toAbsolutePath() + ": " + e.getMessage(), e);
        }
    }

    public CsvImportResult importRows(Student student, Reader reader) throws CsvFormatException {
        List<ParsedRow> rows = codec.parse(reader);
        List<RowImportError> errors = new ArrayList<>();
        List<String> createdModules = new ArrayList<>();
        Student current = student;
        int imported = 0;

        for (ParsedRow row : rows) {
            if (!row.valid()) {
                row.errors().forEach(this::reject);
                errors.addAll(row.errors());
                continue;
            }
            ExamLine line = row.line();
            Optional<Integer> owner = current.program().semesterOf(line.module());
            if (owner.isPresent() && owner.get() != line.semester()) {
                RowImportError error = new RowImportError(row.row(), "semester",
                        "module " + line.module() + " belongs to semester " + owner.get() + ", not " + line.semester());
                reject(error);
                errors.add(error);
                continue;
            }
            try {
                Student candidate = current;
                if (owner.isEmpty()) {
                    candidate = recordService.addModule(candidate, line.semester(),
                            ModuleDraft.of(line.module(), properties.importModuleCredits()));
                }
                candidate = recordService.addExam(candidate, line.module(),
                        new ExamDraft(null, IMPORTED_EXAM_KIND, null, line.grade(), line.weight(), line.date(), line.status()));
                if (owner.isEmpty()) {
                    createdModules.add(line.module());
                }
                current = candidate;
                imported++;
            } catch (ValidationException e) {
                for (ValidationIssue issue : e.getIssues()) {
                    RowImportError error = new RowImportError(row.row(), column(issue), issue.message());
                    reject(error);
                    errors.add(error);
                }
            }
        }

        log.info("CSV import: {} of {} rows applied, {} modules created", imported, rows.size(), createdModules.size());
        return new CsvImportResult(current, imported, List.copyOf(errors), List.copyOf(createdModules));
    }

    public String export(Program program) {
        return codec.write(program);
    }

    public void exportTo(Path path, Program program) {
        String csv = export(program);
        StoreFiles.writeAtomically(path, csv.getBytes(StandardCharsets.UTF_8));
        log.info("Exported {} exams to {}", program.exams().size(), path.toAbsolutePath());
    }

    private void reject(RowImportError error) {
        log.warn("Rejected CSV row {} ({}): {}", error.row(), error.column(), error.message());
    }

    // Issues on fields that are not CSV columns (module credits, exam kind) are charged to the module column.
    private static String column(ValidationIssue issue) {
        return issue.field() != null && CsvModels.COLUMNS.contains(issue.field()) ? issue.field() : "module";
    }
}
