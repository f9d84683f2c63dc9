package com.studytrack.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.studytrack.domain.DomainModels.Exam;
import com.studytrack.domain.DomainModels.ExamStatus;
import com.studytrack.domain.DomainModels.GradeScale;
import com.studytrack.domain.DomainModels.Module;
import com.studytrack.domain.DomainModels.Program;
import com.studytrack.domain.DomainModels.Semester;
import com.studytrack.domain.DomainModels.Student;
import com.studytrack.repository.StoreDtos.*;
import com.studytrack.validation.RecordValidator;
import com.studytrack.validation.ValidationIssue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Repository
public class JsonRecordRepository {
    private static final Pattern MISSING_PROPERTY = Pattern.compile("Missing (?:required )?creator property '([^']+)'");

    private final JsonMapper mapper;
    private final RecordValidator validator;

    public JsonRecordRepository(JsonMapper storeMapper, RecordValidator validator) {
        this.mapper = storeMapper;
        this.validator = validator;
    }

    /** Empty when the file does not exist: there is no dataset yet. */
    public Optional<Student> read(Path path) throws MalformedStoreException {
        if (!Files.exists(path)) {
            log.info("No record store at {}", path.toAbsolutePath());
            return Optional.empty();
        }
        Student student = deserialize(StoreFiles.read(path));
        log.info("Loaded record of {} from {}", student.fullName(), path.toAbsolutePath());
        return Optional.of(student);
    }

    public void write(Path path, Student student) {
        StoreFiles.writeAtomically(path, serialize(student));
        log.info("Saved record of {} to {}", student.fullName(), path.toAbsolutePath());
    }

    public byte[] serialize(Student student) {
        try {
            String json = mapper.writeValueAsString(new StoreDoc(toDoc(student)));
            return (json + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize record of " + student.fullName(), e);
        }
    }

    public Student deserialize(byte[] content) throws MalformedStoreException {
        StoreDoc doc;
        try {
            doc = mapper.readValue(content, StoreDoc.class);
        } catch (JsonMappingException e) {
            throw new MalformedStoreException(describe(e), e);
        } catch (JsonProcessingException e) {
            throw new MalformedStoreException(new ValidationIssue("UNREADABLE_STORE", e.getOriginalMessage(), "$", null), e);
        } catch (IOException e) {
            throw new MalformedStoreException(new ValidationIssue("UNREADABLE_STORE", e.getMessage(), "$", null), e);
        }

        List<ValidationIssue> issues = new ArrayList<>();
        Student student = toDomain(doc, issues);
        if (issues.isEmpty()) {
            issues.addAll(validator.validate(student));
        }
        if (!issues.isEmpty()) {
            throw new MalformedStoreException(issues);
        }
        return student;
    }

    private StudentDoc toDoc(Student s) {
        Program p = s.program();
        return new StudentDoc(s.firstName(), s.lastName(), s.matriculationNumber(), s.email(), s.birthDate(), s.enrolledOn(),
                new ProgramDoc(p.name(), p.totalCreditsRequired(), p.targetAverage(),
                        new GradeScaleDoc(p.gradeScale().best(), p.gradeScale().worst(), p.gradeScale().passMark()),
                        p.semesters().stream().map(this::toDoc).toList()));
    }

    private SemesterDoc toDoc(Semester s) {
        return new SemesterDoc(s.number(), s.startDate(), s.endDate(), s.recommendedCredits(),
                s.modules().stream().map(this::toDoc).toList());
    }

    private ModuleDoc toDoc(Module m) {
        return new ModuleDoc(m.name(), m.code(), m.description(), m.credits(),
                m.exams().stream().map(this::toDoc).toList());
    }

    private ExamDoc toDoc(Exam e) {
        return new ExamDoc(e.id(), e.kind(), e.description(), e.grade(), e.weight(), e.date(), e.status().wireName(), e.attempts());
    }

    // Returns null when a required value is absent; the reason is recorded in issues.
    private Student toDomain(StoreDoc doc, List<ValidationIssue> issues) {
        if (required(doc, "$", null, issues) == null) return null;
        StudentDoc s = required(doc.student(), "$", "student", issues);
        if (s == null) return null;
        ProgramDoc p = required(s.program(), "student", "program", issues);
        if (p == null) return null;

        String path = "student.program";
        Double total = required(p.totalCreditsRequired(), path, "totalCreditsRequired", issues);
        Double target = required(p.targetAverage(), path, "targetAverage", issues);
        GradeScaleDoc scale = required(p.gradeScale(), path, "gradeScale", issues);
        Double best = scale == null ? null : required(scale.best(), path + ".gradeScale", "best", issues);
        Double worst = scale == null ? null : required(scale.worst(), path + ".gradeScale", "worst", issues);
        Double passMark = scale == null ? null : required(scale.passMark(), path + ".gradeScale", "passMark", issues);
        List<Semester> semesters = list(p.semesters(), path, "semesters", issues, this::semesterFromDoc);
        if (total == null || target == null || best == null || worst == null || passMark == null || semesters == null) return null;

        Program program = new Program(p.name(), total, target, new GradeScale(best, worst, passMark), semesters);
        return new Student(s.firstName(), s.lastName(), s.matriculationNumber(), s.email(), s.birthDate(), s.enrolledOn(), program);
    }

    private Semester semesterFromDoc(Indexed<SemesterDoc> in, List<ValidationIssue> issues) {
        SemesterDoc s = in.value();
        Integer number = required(s.number(), in.path(), "number", issues);
        Double recommended = required(s.recommendedCredits(), in.path(), "recommendedCredits", issues);
        List<Module> modules = list(s.modules(), in.path(), "modules", issues, this::moduleFromDoc);
        if (number == null || recommended == null || modules == null) return null;
        return new Semester(number, s.startDate(), s.endDate(), recommended, modules);
    }

    private Module moduleFromDoc(Indexed<ModuleDoc> in, List<ValidationIssue> issues) {
        ModuleDoc m = in.value();
        Double credits = required(m.credits(), in.path(), "credits", issues);
        List<Exam> exams = list(m.exams(), in.path(), "exams", issues, this::examFromDoc);
        if (credits == null || exams == null) return null;
        return new Module(m.name(), m.code(), m.description(), credits, exams);
    }

    private Exam examFromDoc(Indexed<ExamDoc> in, List<ValidationIssue> issues) {
        ExamDoc e = in.value();
        Double weight = required(e.weight(), in.path(), "weight", issues);
        Integer attempts = required(e.attempts(), in.path(), "attempts", issues);
        String statusValue = required(e.status(), in.path(), "status", issues);
        Optional<ExamStatus> status = ExamStatus.fromWire(statusValue);
        if (statusValue != null && status.isEmpty()) {
            issues.add(new ValidationIssue("INVALID_STATUS", "Unknown exam status: " + statusValue, in.path(), "status"));
        }
        if (weight == null || attempts == null || status.isEmpty()) return null;
        return new Exam(e.id(), e.kind(), e.description(), e.grade(), weight, e.date(), status.get(), attempts);
    }

    private <T> T required(T value, String path, String field, List<ValidationIssue> issues) {
        if (value == null) {
            issues.add(new ValidationIssue("MISSING_FIELD", (field == null ? "Document" : field) + " must not be null", path, field));
        }
        return value;
    }

    private <D, T> List<T> list(List<D> docs, String path, String field, List<ValidationIssue> issues,
                                Converter<D, T> converter) {
        if (required(docs, path, field, issues) == null) return null;
        List<T> out = new ArrayList<>();
        boolean complete = true;
        for (int i = 0; i < docs.size(); i++) {
            String itemPath = path + "." + field + "[" + i + "]";
            D doc = docs.get(i);
            if (doc == null) {
                issues.add(new ValidationIssue("MISSING_FIELD", "Entry must not be null", itemPath, null));
                complete = false;
                continue;
            }
            T converted = converter.convert(new Indexed<>(doc, itemPath), issues);
            if (converted == null) complete = false;
            else out.add(converted);
        }
        return complete ? out : null;
    }

    // Jackson reports a missing creator property as an input mismatch whose last path
    // reference is the absent key.
    private ValidationIssue describe(JsonMappingException e) {
        List<JsonMappingException.Reference> refs = e.getPath();
        String code;
        if (e instanceof UnrecognizedPropertyException) {
            code = "UNKNOWN_FIELD";
        } else if (e instanceof MismatchedInputException && MISSING_PROPERTY.matcher(String.valueOf(e.getOriginalMessage())).find()) {
            code = "MISSING_FIELD";
        } else {
            code = "INVALID_VALUE";
        }

        if (!refs.isEmpty() && refs.get(refs.size() - 1).getFieldName() != null) {
            String field = refs.get(refs.size() - 1).getFieldName();
            return new ValidationIssue(code, e.getOriginalMessage(), formatPath(refs.subList(0, refs.size() - 1)), field);
        }
        Matcher missing = MISSING_PROPERTY.matcher(String.valueOf(e.getOriginalMessage()));
        return new ValidationIssue(code, e.getOriginalMessage(), formatPath(refs), missing.find() ? missing.group(1) : null);
    }

    private String formatPath(List<JsonMappingException.Reference> refs) {
        StringBuilder sb = new StringBuilder();
        for (JsonMappingException.Reference ref : refs) {
            if (ref.getFieldName() != null) {
                if (sb.length() > 0) sb.append('.');
                sb.append(ref.getFieldName());
            } else if (ref.getIndex() >= 0) {
                sb.append('[').append(ref.getIndex()).append(']');
            }
        }
        return sb.length() == 0 ? "$" : sb.toString();
    }

    private record Indexed<T>(T value, String path) {}

    @FunctionalInterface
    private interface Converter<D, T> {
        T convert(Indexed<D> doc, List<ValidationIssue> issues);
    }
}
