package com.studytrack;

import com.studytrack.bootstrap.SampleDataFactory;
import com.studytrack.domain.DomainModels.Student;
import com.studytrack.repository.JsonRecordRepository;
import com.studytrack.repository.MalformedStoreException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class JsonRecordRepositoryTest {
    private static final String VALID = """
            {
              "student": {
                "firstName": "Max",
                "lastName": "Mustermann",
                "matriculationNumber": "123456",
                "email": null,
                "birthDate": "1985-06-16",
                "enrolledOn": null,
                "program": {
                  "name": "Informatik Bachelor",
                  "totalCreditsRequired": 180.0,
                  "targetAverage": 2.0,
                  "gradeScale": { "best": 1.0, "worst": 6.0, "passMark": 4.0 },
                  "semesters": [ {
                    "number": 1,
                    "startDate": null,
                    "endDate": null,
                    "recommendedCredits": 30.0,
                    "modules": [ {
                      "name": "Analysis",
                      "code": "M11",
                      "description": null,
                      "credits": 5.0,
                      "exams": [ {
                        "id": "e1",
                        "kind": "Klausur",
                        "description": null,
                        "grade": 2.0,
                        "weight": 1.0,
                        "date": "2024-07-01",
                        "status": "completed",
                        "attempts": 1
                      } ]
                    } ]
                  } ]
                }
              }
            }
            """;

    @Autowired
    private JsonRecordRepository repository;

    @Autowired
    private SampleDataFactory sampleData;

    @Test
    void roundTripIsLosslessAndByteStable() throws MalformedStoreException {
        Student student = sampleData.create(LocalDate.of(2024, 5, 1));

        byte[] first = repository.serialize(student);
        Student loaded = repository.deserialize(first);

        assertEquals(student, loaded);
        assertArrayEquals(first, repository.serialize(student));
        assertArrayEquals(first, repository.serialize(loaded));
        String text = new String(first, StandardCharsets.UTF_8);
        assertTrue(text.endsWith("}\n"));
        assertFalse(text.contains("\r"));
        assertTrue(text.contains("\"email\" : \"max.mustermann@iu-example.de\""));
    }

    @Test
    void readsHandWrittenStore() throws MalformedStoreException {
        Student student = repository.deserialize(bytes(VALID));

        assertEquals("Max Mustermann", student.fullName());
        assertNull(student.email());
        assertEquals(2.0, student.program().exam("e1").orElseThrow().exam().grade());
    }

    @Test
    void missingFileMeansNoDataset(@TempDir Path dir) throws MalformedStoreException {
        assertTrue(repository.read(dir.resolve("absent.json")).isEmpty());
    }

    @Test
    void writeThenReadFromDisk(@TempDir Path dir) throws Exception {
        Student student = sampleData.create(LocalDate.of(2024, 5, 1));
        Path store = dir.resolve("nested").resolve("store.json");

        repository.write(store, student);
        repository.write(store, student);

        assertEquals(student, repository.read(store).orElseThrow());
        try (var files = Files.list(store.getParent())) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void rejectsUnknownKey() {
        MalformedStoreException e = assertThrows(MalformedStoreException.class,
                () -> repository.deserialize(bytes(VALID.replace("\"firstName\": \"Max\",", "\"firstName\": \"Max\", \"nickname\": \"M\","))));

        assertEquals("UNKNOWN_FIELD", e.getIssues().get(0).code());
        assertEquals("student", e.getPath());
        assertEquals("nickname", e.getField());
    }

    @Test
    void rejectsMissingKey() {
        MalformedStoreException e = assertThrows(MalformedStoreException.class,
                () -> repository.deserialize(bytes(VALID.replace(",\n            \"attempts\": 1", ""))));

        assertEquals("MISSING_FIELD", e.getIssues().get(0).code());
        assertEquals("student.program.semesters[0].modules[0].exams[0]", e.getPath());
        assertEquals("attempts", e.getField());

        MalformedStoreException target = assertThrows(MalformedStoreException.class,
                () -> repository.deserialize(bytes(VALID.replace("\"targetAverage\": 2.0,", ""))));
        assertEquals("MISSING_FIELD", target.getIssues().get(0).code());
        assertEquals("student.program", target.getPath());
        assertEquals("targetAverage", target.getField());
    }

    @Test
    void rejectsStoreWithoutPassMark() {
        MalformedStoreException e = assertThrows(MalformedStoreException.class,
                () -> repository.deserialize(bytes(VALID.replace(", \"passMark\": 4.0", ""))));

        assertEquals("MISSING_FIELD", e.getIssues().get(0).code());
        assertEquals("student.program.gradeScale", e.getPath());
        assertEquals("passMark", e.getField());
    }

    @Test
    void rejectsNegativeCredits() {
        MalformedStoreException e = assertThrows(MalformedStoreException.class,
                () -> repository.deserialize(bytes(VALID.replace("\"credits\": 5.0", "\"credits\": -5.0"))));

        assertEquals("INVALID_CREDITS", e.getIssues().get(0).code());
        assertEquals("student.program.semesters[0].modules[0]", e.getPath());
        assertEquals("credits", e.getField());
    }

    @Test
    void rejectsGradeOutsideScale() {
        MalformedStoreException e = assertThrows(MalformedStoreException.class,
                () -> repository.deserialize(bytes(VALID.replace("\"grade\": 2.0", "\"grade\": 9.0"))));

        assertEquals("GRADE_OUT_OF_SCALE", e.getIssues().get(0).code());
        assertEquals("student.program.semesters[0].modules[0].exams[0]", e.getPath());
        assertEquals("grade", e.getField());
    }

    @Test
    void rejectsWrongTypesAndUnknownStatus() {
        MalformedStoreException type = assertThrows(MalformedStoreException.class,
                () -> repository.deserialize(bytes(VALID.replace("\"number\": 1", "\"number\": \"eins\""))));
        assertEquals("INVALID_VALUE", type.getIssues().get(0).code());
        assertEquals("number", type.getField());

        MalformedStoreException status = assertThrows(MalformedStoreException.class,
                () -> repository.deserialize(bytes(VALID.replace("\"completed\"", "\"passed\""))));
        assertEquals("INVALID_STATUS", status.getIssues().get(0).code());
        assertEquals("status", status.getField());
    }

    @Test
    void rejectsGarbage() {
        MalformedStoreException e = assertThrows(MalformedStoreException.class,
                () -> repository.deserialize(bytes("not json")));
        assertEquals("$", e.getPath());
    }

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }
}
