package org.transparentclassroom.client.tests;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.transparentclassroom.client.model.CallShape;
import org.transparentclassroom.client.model.Child;
import org.transparentclassroom.client.model.ConferenceReport;
import org.transparentclassroom.client.model.EntityKind;
import org.transparentclassroom.client.model.Form;
import org.transparentclassroom.client.model.MappedRecord;
import org.transparentclassroom.client.model.OnlineApplication;
import org.transparentclassroom.client.model.User;
import org.transparentclassroom.client.model.widget.AnswerWidget;
import org.transparentclassroom.client.model.widget.HeaderWidget;
import org.transparentclassroom.client.model.widget.TextAreaWidget;
import org.transparentclassroom.client.model.widget.TextWidget;
import org.transparentclassroom.client.model.widget.UnknownWidget;
import org.transparentclassroom.client.model.widget.Widget;
import org.transparentclassroom.client.rest.EntityMapper;
import org.transparentclassroom.client.rest.EntitySchemas;
import org.transparentclassroom.client.rest.MappingContext;
import org.transparentclassroom.client.rest.MappingDiagnostics;
import org.transparentclassroom.client.rest.exception.MalformedFieldException;
import org.transparentclassroom.client.rest.exception.MissingRequiredFieldException;
import org.transparentclassroom.client.tests.base.JsonFixtures;

import java.io.IOException;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Mapping single payloads to typed records.
 */
public class EntityMapperTest {

    private final RecordingDiagnostics diagnostics = new RecordingDiagnostics();
    private final EntityMapper mapper = new EntityMapper(MappingContext.builder().diagnostics(diagnostics).build());

    private Object load(String file) throws IOException {
        return JsonFixtures.load("EntityMapperTest", file);
    }

    @Test
    @DisplayName("Child detail: birth date parsed, absent exit notes stay absent")
    public void testChildDetail() throws Exception {
        MappedRecord record = mapper.map(EntityKind.CHILD, load("child-detail.json"));
        Child child = assertInstanceOf(Child.class, record);
        System.out.println(child);

        assertEquals(EntityKind.CHILD, child.getKind());
        assertEquals(1501, child.getId());
        assertEquals("Ada", child.getFirstName());
        assertEquals(LocalDate.of(2019, 4, 1), child.getBirthDate());
        assertEquals(Arrays.asList("White", "Asian"), child.getEthnicity());
        assertEquals(Arrays.asList(201, 202), child.getParentIds());
        assertEquals(Collections.singletonList(12), child.getClassroomIds());
        assertEquals(LocalDate.of(2022, 9, 6), child.getFirstDay());

        assertFalse(child.has("exit_notes"));
        assertNull(child.getExitNotes());
        assertFalse(child.getPresentFields().contains("exit_notes"));

        assertTrue(child.has("middle_name"), "Explicit null is present");
        assertNull(child.getMiddleName());

        assertTrue(diagnostics.missingDetail.isEmpty(), "Every detail-only field was sent");
        assertTrue(diagnostics.unknown.isEmpty());
    }

    @Test
    @DisplayName("Child list projection: detail-only fields absent, lists default to empty")
    public void testChildListProjection() throws Exception {
        Child child = mapper.map(EntitySchemas.CHILD, load("child-list.json"), CallShape.LIST);

        assertEquals("Lovelace", child.getLastName());
        assertNull(child.getBirthDate());
        assertFalse(child.has("birth_date"));

        // The one exception to "absent means absent": list fields read as empty lists
        assertEquals(Collections.emptyList(), child.getEthnicity());
        assertEquals(Collections.emptyList(), child.getParentIds());
        assertFalse(child.has("ethnicity"), "Defaulted list is not reported as present");
        assertFalse(child.has("parent_ids"));

        assertEquals(Arrays.asList("id", "first_name", "last_name", "profile_photo"),
                new ArrayList<>(child.getPresentFields()));
        assertTrue(diagnostics.missingDetail.isEmpty(), "List payloads may omit detail-only fields");
    }

    @Test
    @DisplayName("Diagnostics: detail payload lacking detail-only fields is reported, not rejected")
    public void testMissingDetailFieldsReported() throws Exception {
        Child child = mapper.map(EntitySchemas.CHILD, load("child-list.json"), CallShape.DETAIL);

        assertEquals(1501, child.getId());
        System.out.println("Reported: " + diagnostics.missingDetail);
        assertEquals(11, diagnostics.missingDetail.size());
        assertTrue(diagnostics.missingDetail.contains("birth_date"));
        assertTrue(diagnostics.missingDetail.contains("classroom_ids"));
        assertFalse(diagnostics.missingDetail.contains("exit_notes"), "Optional fields are not reported");
    }

    @Test
    @DisplayName("Diagnostics: undeclared keys are ignored and reported")
    public void testUnknownFieldsReported() {
        Object raw = JsonFixtures.parse("""
            {"id": 1, "name": "Lower Elementary", "room_number": "B12", "lesson_set_id": 4}
            """);

        MappedRecord classroom = mapper.map(EntityKind.CLASSROOM, raw, CallShape.LIST);

        assertFalse(classroom.has("room_number"));
        assertNull(classroom.get("room_number"));
        assertEquals(Collections.singletonMap("room_number", "B12"), diagnostics.unknown);
    }

    @Test
    @DisplayName("Non-numeric id is a malformed field, never a silent null")
    public void testNonNumericId() {
        MalformedFieldException e = assertThrows(MalformedFieldException.class, () -> mapper.map(EntityKind.CHILD,
                JsonFixtures.parse("{\"id\": \"abc\", \"first_name\": \"Ada\", \"last_name\": \"L\"}")));
        System.out.println(e.getMessage());
        assertEquals(EntityKind.CHILD, e.getEntityKind());
        assertEquals("id", e.getField());
        assertEquals("abc", e.getRawValue());

        MalformedFieldException numeric = assertThrows(MalformedFieldException.class, () -> mapper.map(
                EntityKind.LEVEL, JsonFixtures.parse("""
                    {"id": 1, "child_id": "1501", "lesson_id": 3, "proficiency": 2, "date": "2022-01-01"}
                    """)));
        assertEquals("child_id", numeric.getField(), "Numeric strings are not coerced either");
    }

    @Test
    @DisplayName("Required fields: absent or null raises MissingRequiredFieldException")
    public void testMissingRequired() {
        MissingRequiredFieldException absent = assertThrows(MissingRequiredFieldException.class,
                () -> mapper.map(EntityKind.CHILD, JsonFixtures.parse("{\"id\": 1, \"first_name\": \"Ada\"}")));
        assertEquals("last_name", absent.getField());
        assertEquals(EntityKind.CHILD, absent.getEntityKind());
        assertTrue(absent.getMessage().contains("last_name"));
        assertNull(absent.getIndex());

        MissingRequiredFieldException isNull = assertThrows(MissingRequiredFieldException.class,
                () -> mapper.map(EntityKind.SCHOOL, JsonFixtures.parse("""
                    {"id": 1, "name": "Montessori", "type": null}
                    """)));
        assertEquals("type", isNull.getField());
    }

    @Test
    @DisplayName("Non-object payload is malformed without a field")
    public void testNonObjectPayload() {
        MalformedFieldException e = assertThrows(MalformedFieldException.class,
                () -> mapper.map(EntityKind.SESSION, JsonFixtures.parse("[1, 2]")));
        assertNull(e.getField());
        assertEquals(EntityKind.SESSION, e.getEntityKind());
    }

    @Test
    @DisplayName("Form fields: text widget plus unknown signature pad")
    public void testFormWidgets() throws Exception {
        Form form = mapper.map(EntitySchemas.FORM, load("form-detail.json"), CallShape.DETAIL);

        assertEquals(ZonedDateTime.of(2021, 8, 15, 9, 30, 0, 0, ZoneOffset.ofHours(-7)), form.getCreatedAt());
        List<Widget> fields = form.getFields();
        assertEquals(2, fields.size());

        TextWidget text = assertInstanceOf(TextWidget.class, fields.get(0));
        assertEquals("Ada", text.getValue());

        UnknownWidget signature = assertInstanceOf(UnknownWidget.class, fields.get(1));
        assertEquals("signature_pad_v2", signature.getType());
        assertEquals("guardian_signature", signature.getAttributes().get("name"));
        assertEquals("2021-08-15", signature.getAttributes().get("signed_at"), "Raw values are not coerced");
        assertEquals(4, signature.getAttributes().size());

        assertEquals("Ada", form.getStudentFirstName());
        assertEquals("Lovelace", form.getStudentLastName());
        assertEquals("Anne Byron", form.getParentName());
        assertEquals("Primary 1", form.getClassroom());
        assertTrue(form.getRelease().startsWith("I agree"));
        assertEquals("Anne Byron", form.getSignature());
        assertTrue(diagnostics.unknown.isEmpty(), "Every form key is declared");
    }

    @Test
    @DisplayName("Online application detail: applicant fields are kept")
    public void testOnlineApplicationDetail() throws Exception {
        OnlineApplication application = mapper.map(EntitySchemas.ONLINE_APPLICATION,
                load("online-application-detail.json"), CallShape.DETAIL);

        assertEquals("Primary (3-6)", application.getProgram());
        assertEquals("Alan", application.getChildFirstName());
        assertEquals("Turing", application.getChildLastName());
        assertEquals(LocalDate.of(2019, 6, 23), application.getChildBirthDate());
        assertEquals("M", application.getChildGender());
        assertEquals("ethel@example.org", application.getMotherEmail());
        assertEquals(21, application.getSessionId());
        assertEquals(1, application.getFields().size());
        assertTrue(diagnostics.unknown.isEmpty(), "Every application key is declared");
    }

    @Test
    @DisplayName("User detail: single-line address is kept")
    public void testUserDetail() throws Exception {
        User user = mapper.map(EntitySchemas.USER, load("user-detail.json"), CallShape.DETAIL);

        assertEquals("12 St James's Square, London", user.getAddress());
        assertFalse(user.has("street"));
        assertEquals("555-0100", user.getMobileNumber());
        assertTrue(diagnostics.unknown.isEmpty());
    }

    @Test
    @DisplayName("Explicit null on an optional field never masks a missing required field")
    public void testNullOptionalWithMissingRequired() {
        MissingRequiredFieldException e = assertThrows(MissingRequiredFieldException.class,
                () -> mapper.map(EntitySchemas.CHILD, JsonFixtures.parse("""
                    {"id": 1501, "first_name": "Ada", "exit_notes": null}
                    """), CallShape.DETAIL));
        assertEquals("last_name", e.getField());

        Child child = mapper.map(EntitySchemas.CHILD, JsonFixtures.parse("""
                {"id": 1501, "first_name": "Ada", "last_name": "Lovelace", "exit_notes": null}
                """), CallShape.DETAIL);
        assertTrue(child.has("exit_notes"), "Explicit null is present");
        assertNull(child.getExitNotes());
        assertTrue(child.getPresentFields().contains("exit_notes"));
        assertFalse(child.has("exit_reason"));
    }

    @Test
    @DisplayName("Ids beyond the int range are malformed, not truncated")
    public void testIdOutOfIntRange() {
        MalformedFieldException e = assertThrows(MalformedFieldException.class, () -> mapper.map(EntityKind.CHILD,
                JsonFixtures.parse("{\"id\": 3000000000, \"first_name\": \"Ada\", \"last_name\": \"L\"}")));
        assertEquals("id", e.getField());
        assertEquals(3000000000L, e.getRawValue());
        assertTrue(e.getMessage().contains("out of range"), e.getMessage());
    }

    @Test
    @DisplayName("Form fields: name -> answer object becomes answer widgets")
    public void testFormAnswers() throws Exception {
        Form form = mapper.map(EntitySchemas.FORM, load("form-answers.json"), CallShape.DETAIL);

        Map<String, Object> answers = new HashMap<>();
        for (Widget widget : form.getFields()) {
            AnswerWidget answer = assertInstanceOf(AnswerWidget.class, widget);
            assertEquals(AnswerWidget.TYPE, answer.getType());
            answers.put(answer.getName(), answer.getValue());
        }

        assertEquals(3, answers.size());
        assertEquals("Ada", answers.get("nickname"));
        assertEquals(2, answers.get("siblings"));
        assertEquals(Boolean.TRUE, answers.get("photo_release"));
        assertFalse(form.has("child_id"));
    }

    @Test
    @DisplayName("Conference report: widgets are read from the data key")
    public void testConferenceReportData() throws Exception {
        ConferenceReport report = mapper.map(EntitySchemas.CONFERENCE_REPORT, load("conference-report.json"),
                CallShape.DETAIL);

        assertTrue(report.has("widgets"));
        assertEquals(2, report.getWidgets().size());
        assertInstanceOf(HeaderWidget.class, report.getWidgets().get(0));
        assertEquals("Pours water independently.",
                assertInstanceOf(TextAreaWidget.class, report.getWidgets().get(1)).getValue());
        assertFalse(diagnostics.unknown.containsKey("data"));
    }

    @Test
    @DisplayName("Records: value equality over kind and fields")
    public void testRecordEquality() throws Exception {
        Child first = mapper.map(EntitySchemas.CHILD, load("child-detail.json"), CallShape.DETAIL);
        Child second = mapper.map(EntitySchemas.CHILD, load("child-detail.json"), CallShape.DETAIL);
        Child listed = mapper.map(EntitySchemas.CHILD, load("child-list.json"), CallShape.LIST);

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, listed);
    }

    private static class RecordingDiagnostics implements MappingDiagnostics {
        private final Map<String, Object> unknown = new HashMap<>();
        private final List<String> missingDetail = new ArrayList<>();

        @Override
        public void unknownField(EntityKind kind, String path, Object value) {
            unknown.put(path, value);
        }

        @Override
        public void missingDetailField(EntityKind kind, String path) {
            missingDetail.add(path);
        }
    }
}
