package com.studytrack.csv;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.studytrack.csv.CsvModels.*;
import com.studytrack.domain.DomainModels.Exam;
import com.studytrack.domain.DomainModels.ExamStatus;
import com.studytrack.domain.DomainModels.Module;
import com.studytrack.domain.DomainModels.Program;
import com.studytrack.domain.DomainModels.Semester;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.*;

@Component
public class ExamCsvCodec {
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final CsvMapper mapper = CsvMapper.builder().build();

    public String write(Program program) {
        List<ExamCsvRow> rows = new ArrayList<>();
        for (Semester semester : program.semesters()) {
            for (Module module : semester.modules()) {
                for (Exam exam : module.exams()) {
                    rows.add(new ExamCsvRow(
                            module.name(),
                            String.valueOf(semester.number()),
                            exam.grade() == null ? "" : String.valueOf(exam.grade()),
                            String.valueOf(exam.weight()),
                            exam.date() == null ? "" : exam.date().toString(),
                            exam.status().wireName()));
                }
            }
        }
        if (rows.isEmpty()) {
            return String.join(",", CsvModels.COLUMNS) + "\n";
        }
        CsvSchema schema = mapper.schemaFor(ExamCsvRow.class).withHeader().withLineSeparator("\n");
        try {
            return mapper.writer(schema).writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to write exam CSV", e);
        }
    }

    public List<ParsedRow> parse(Reader reader) throws CsvFormatException {
        List<ParsedRow> out = new ArrayList<>();
        try (MappingIterator<String[]> it = mapper.readerFor(String[].class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                .readValues(reader)) {
            if (!it.hasNextValue()) {
                throw new CsvFormatException("CSV input is empty, expected header " + String.join(",", CsvModels.COLUMNS));
            }
            Map<String, Integer> columns = header(it.nextValue());
            int row = 0;
            while (it.hasNextValue()) {
                row++;
                out.add(parseRow(row, it.nextValue(), columns));
            }
        } catch (IOException e) {
            throw new CsvFormatException("Cannot read CSV input after " + out.size() + " data rows: " + e.getMessage(), e);
        }
        return out;
    }

    private Map<String, Integer> header(String[] cells) throws CsvFormatException {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < cells.length; i++) {
            String name = cells[i];
            if (i == 0 && !name.isEmpty() && name.charAt(0) == BYTE_ORDER_MARK) {
                name = name.substring(1);
            }
            columns.putIfAbsent(name.trim().toLowerCase(Locale.ROOT), i);
        }
        List<String> missing = CsvModels.COLUMNS.stream().filter(c -> !columns.containsKey(c)).toList();
        if (!missing.isEmpty()) {
            throw new CsvFormatException("CSV header is missing columns: " + String.join(",", missing));
        }
        return columns;
    }

    private ParsedRow parseRow(int row, String[] cells, Map<String, Integer> columns) {
        List<RowImportError> errors = new ArrayList<>();

        String module = cell(cells, columns, "module");
        if (module.isEmpty()) {
            errors.add(new RowImportError(row, "module", "module is required"));
        }

        Integer semester = null;
        String semesterValue = cell(cells, columns, "semester");
        try {
            semester = Integer.parseInt(semesterValue);
            if (semester < 1) {
                errors.add(new RowImportError(row, "semester", "semester must be at least 1"));
            }
        } catch (NumberFormatException e) {
            errors.add(new RowImportError(row, "semester", "semester is not a whole number: '" + semesterValue + "'"));
        }

        Double grade = number(row, "grade", cell(cells, columns, "grade"), errors);

        String weightValue = cell(cells, columns, "weight");
        Double weight = weightValue.isEmpty() ? Double.valueOf(Exam.DEFAULT_WEIGHT) : number(row, "weight", weightValue, errors);
        if (weight != null && weight < 0) {
            errors.add(new RowImportError(row, "weight", "weight must not be negative"));
        }

        LocalDate date = null;
        String dateValue = cell(cells, columns, "date");
        if (!dateValue.isEmpty()) {
            try {
                date = LocalDate.parse(dateValue);
            } catch (DateTimeParseException e) {
                errors.add(new RowImportError(row, "date", "date is not an ISO date (yyyy-MM-dd): '" + dateValue + "'"));
            }
        }

        ExamStatus status = null;
        String statusValue = cell(cells, columns, "status");
        if (statusValue.isEmpty()) {
            status = grade == null ? ExamStatus.SCHEDULED : ExamStatus.COMPLETED;
        } else {
            Optional<ExamStatus> parsed = ExamStatus.fromWire(statusValue);
            if (parsed.isEmpty()) {
                errors.add(new RowImportError(row, "status", "status must be scheduled or completed: '" + statusValue + "'"));
            } else {
                status = parsed.get();
            }
        }

        if (!errors.isEmpty()) {
            return new ParsedRow(row, null, errors);
        }
        return new ParsedRow(row, new ExamLine(module, semester, grade, weight, date, status), List.of());
    }

    private Double number(int row, String column, String value, List<RowImportError> errors) {
        if (value.isEmpty()) return null;
        try {
            double parsed = Double.parseDouble(value);
            if (!Double.isFinite(parsed)) {
                errors.add(new RowImportError(row, column, column + " must be a finite number"));
                return null;
            }
            return parsed;
        } catch (NumberFormatException e) {
            errors.add(new RowImportError(row, column, column + " is not a number: '" + value + "'"));
            return null;
        }
    }

    private String cell(String[] cells, Map<String, Integer> columns, String column) {
        int index = columns.get(column);
        return index < cells.length && cells[index] != null ? cells[index].trim() : "";
    }
}
