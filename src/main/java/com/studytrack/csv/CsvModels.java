package com.studytrack.csv;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.studytrack.domain.DomainModels.ExamStatus;
import com.studytrack.domain.DomainModels.Student;

import java.time.LocalDate;
import java.util.List;

public class CsvModels {
    public static final List<String> COLUMNS = List.of("module", "semester", "grade", "weight", "date", "status");

    /** One exported line, already formatted. */
    @JsonPropertyOrder({"module", "semester", "grade", "weight", "date", "status"})
    public record ExamCsvRow(String module, String semester, String grade, String weight, String date, String status) {}

    /** A typed data row; {@code grade}, {@code date} and {@code status} may be absent. */
    public record ExamLine(String module, int semester, Double grade, double weight, LocalDate date, ExamStatus status) {}

    /** {@code row} is the 1-based index of the data row, header excluded. */
    public record RowImportError(int row, String column, String message) {}

    /** Outcome of parsing one data row: either {@code line} or {@code errors} is set. */
    public record ParsedRow(int row, ExamLine line, List<RowImportError> errors) {
        public boolean valid() {
            return line != null;
        }
    }

    /**
     * {@code student} is the tree with every accepted row applied; it equals the input tree
     * when no row was accepted.
     */
    public record CsvImportResult(Student student, int importedRows, List<RowImportError> errors, List<String> createdModules) {
        public boolean complete() {
            return errors.isEmpty();
        }
    }
}
