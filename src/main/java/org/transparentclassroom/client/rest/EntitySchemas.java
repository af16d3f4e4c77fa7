package org.transparentclassroom.client.rest;

import org.transparentclassroom.client.model.Activity;
import org.transparentclassroom.client.model.Child;
import org.transparentclassroom.client.model.Classroom;
import org.transparentclassroom.client.model.ConferenceReport;
import org.transparentclassroom.client.model.EntityKind;
import org.transparentclassroom.client.model.Event;
import org.transparentclassroom.client.model.Form;
import org.transparentclassroom.client.model.FormTemplate;
import org.transparentclassroom.client.model.LessonSet;
import org.transparentclassroom.client.model.Level;
import org.transparentclassroom.client.model.MappedRecord;
import org.transparentclassroom.client.model.OnlineApplication;
import org.transparentclassroom.client.model.Presence;
import org.transparentclassroom.client.model.School;
import org.transparentclassroom.client.model.Session;
import org.transparentclassroom.client.model.User;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

import static org.transparentclassroom.client.rest.FieldSpec.always;
import static org.transparentclassroom.client.rest.FieldSpec.detailOnly;
import static org.transparentclassroom.client.rest.FieldSpec.optional;
import static org.transparentclassroom.client.rest.FieldType.BOOLEAN;
import static org.transparentclassroom.client.rest.FieldType.DATE;
import static org.transparentclassroom.client.rest.FieldType.DATETIME;
import static org.transparentclassroom.client.rest.FieldType.INTEGER;
import static org.transparentclassroom.client.rest.FieldType.INTEGER_LIST;
import static org.transparentclassroom.client.rest.FieldType.OBJECT;
import static org.transparentclassroom.client.rest.FieldType.OBJECT_LIST;
import static org.transparentclassroom.client.rest.FieldType.STRING;
import static org.transparentclassroom.client.rest.FieldType.STRING_LIST;
import static org.transparentclassroom.client.rest.FieldType.WIDGET_LIST;

/**
 * Schemas of every entity kind exposed by the Transparent Classroom API.
 * <p>
 * Identifiers ({@code id}, {@code *_id}, {@code *_ids}) are {@link FieldType#INTEGER}: the
 * API's ids are 32-bit, so an integral id outside the {@code int} range is reported as
 * malformed rather than truncated. {@code student_id} is a school-assigned code and reads
 * as a string.
 * </p>
 */
public class EntitySchemas {

    public static final EntitySchema<Activity> ACTIVITY = new EntitySchema<>(EntityKind.ACTIVITY, Arrays.asList(
            always("id", INTEGER),
            always("author_id", INTEGER),
            optional("classroom_id", INTEGER),
            optional("text", STRING),
            optional("html", STRING),
            always("date", DATE),
            always("created_at", DATETIME),
            optional("staff_unprocessed", BOOLEAN),
            optional("photo_url", STRING),
            optional("medium_photo_url", STRING),
            optional("large_photo_url", STRING),
            optional("original_photo_url", STRING)
    ), Activity::new);

    public static final EntitySchema<Child> CHILD = new EntitySchema<>(EntityKind.CHILD, Arrays.asList(
            always("id", INTEGER),
            always("first_name", STRING),
            optional("middle_name", STRING),
            always("last_name", STRING),
            detailOnly("birth_date", DATE),
            detailOnly("gender", STRING),
            optional("profile_photo", STRING),
            detailOnly("program", STRING),
            detailOnly("ethnicity", STRING_LIST),
            detailOnly("household_income", STRING),
            detailOnly("dominant_language", STRING),
            detailOnly("grade", STRING),
            optional("student_id", STRING),
            detailOnly("hours_string", STRING),
            optional("allergies", STRING),
            optional("notes", STRING),
            detailOnly("first_day", DATE),
            optional("last_day", DATE),
            optional("exit_notes", STRING),
            optional("exit_reason", STRING),
            optional("exit_survey_id", INTEGER),
            optional("approved_adults_string", STRING),
            optional("emergency_contacts_string", STRING),
            detailOnly("parent_ids", INTEGER_LIST),
            detailOnly("classroom_ids", INTEGER_LIST)
    ), Child::new);

    public static final EntitySchema<Classroom> CLASSROOM = new EntitySchema<>(EntityKind.CLASSROOM, Arrays.asList(
            always("id", INTEGER),
            always("name", STRING),
            optional("lesson_set_id", INTEGER),
            optional("level", STRING),
            optional("active", BOOLEAN)
    ), Classroom::new);

    public static final EntitySchema<ConferenceReport> CONFERENCE_REPORT = new EntitySchema<>(
            EntityKind.CONFERENCE_REPORT, Arrays.asList(
            always("id", INTEGER),
            always("name", STRING),
            always("child_id", INTEGER),
            new FieldSpec("widgets", "data", WIDGET_LIST, Presence.DETAIL_ONLY)
    ), ConferenceReport::new);

    public static final EntitySchema<Event> EVENT = new EntitySchema<>(EntityKind.EVENT, Arrays.asList(
            always("id", INTEGER),
            optional("classroom_id", INTEGER),
            always("child_id", INTEGER),
            always("event_type", STRING),
            optional("value", STRING),
            optional("value2", STRING),
            optional("created_by_id", INTEGER),
            optional("created_by_name", STRING),
            always("time", DATETIME)
    ), Event::new);

    public static final EntitySchema<Form> FORM = new EntitySchema<>(EntityKind.FORM, Arrays.asList(
            always("id", INTEGER),
            always("form_template_id", INTEGER),
            always("state", STRING),
            optional("child_id", INTEGER),
            optional("student_first_name", STRING),
            optional("student_last_name", STRING),
            optional("parent_name", STRING),
            optional("classroom", STRING),
            optional("release", STRING),
            optional("signature", STRING),
            always("created_at", DATETIME),
            detailOnly("fields", WIDGET_LIST)
    ), Form::new);

    public static final EntitySchema<FormTemplate> FORM_TEMPLATE = new EntitySchema<>(EntityKind.FORM_TEMPLATE, Arrays.asList(
            always("id", INTEGER),
            always("name", STRING),
            detailOnly("widgets", WIDGET_LIST)
    ), FormTemplate::new);

    public static final EntitySchema<LessonSet> LESSON_SET = new EntitySchema<>(EntityKind.LESSON_SET, Arrays.asList(
            always("id", INTEGER),
            always("name", STRING),
            detailOnly("children", OBJECT_LIST),
            optional("scales", OBJECT)
    ), LessonSet::new);

    public static final EntitySchema<Level> LEVEL = new EntitySchema<>(EntityKind.LEVEL, Arrays.asList(
            always("id", INTEGER),
            always("child_id", INTEGER),
            always("lesson_id", INTEGER),
            always("proficiency", INTEGER),
            always("date", DATE),
            optional("planned", BOOLEAN)
    ), Level::new);

    public static final EntitySchema<OnlineApplication> ONLINE_APPLICATION = new EntitySchema<>(
            EntityKind.ONLINE_APPLICATION, Arrays.asList(
            always("id", INTEGER),
            always("school_id", INTEGER),
            always("state", STRING),
            optional("program", STRING),
            optional("child_first_name", STRING),
            optional("child_last_name", STRING),
            optional("child_birth_date", DATE),
            optional("child_gender", STRING),
            optional("mother_email", STRING),
            optional("session_id", INTEGER),
            optional("created_at", DATETIME),
            detailOnly("fields", WIDGET_LIST)
    ), OnlineApplication::new);

    public static final EntitySchema<School> SCHOOL = new EntitySchema<>(EntityKind.SCHOOL, Arrays.asList(
            always("id", INTEGER),
            always("name", STRING),
            optional("phone", STRING),
            optional("address", STRING),
            always("type", STRING),
            optional("timezone", STRING)
    ), School::new);

    public static final EntitySchema<Session> SESSION = new EntitySchema<>(EntityKind.SESSION, Arrays.asList(
            always("id", INTEGER),
            always("name", STRING),
            always("start_date", DATE),
            always("stop_date", DATE),
            optional("children", INTEGER),
            optional("current", BOOLEAN),
            optional("inactive", BOOLEAN)
    ), Session::new);

    public static final EntitySchema<User> USER = new EntitySchema<>(EntityKind.USER, Arrays.asList(
            always("id", INTEGER),
            always("type", STRING),
            optional("inactive", BOOLEAN),
            always("email", STRING),
            always("first_name", STRING),
            always("last_name", STRING),
            detailOnly("roles", STRING_LIST),
            detailOnly("accessible_classroom_ids", INTEGER_LIST),
            optional("default_classroom_id", INTEGER),
            optional("address", STRING),
            optional("street", STRING),
            optional("city", STRING),
            optional("state_province", STRING),
            optional("postal_code", STRING),
            optional("home_number", STRING),
            optional("mobile_number", STRING),
            optional("work_number", STRING)
    ), User::new);

    private static final Map<EntityKind, EntitySchema<?>> BY_KIND = new EnumMap<>(EntityKind.class);

    static {
        for (EntitySchema<?> schema : Arrays.asList(ACTIVITY, CHILD, CLASSROOM, CONFERENCE_REPORT, EVENT, FORM,
                FORM_TEMPLATE, LESSON_SET, LEVEL, ONLINE_APPLICATION, SCHOOL, SESSION, USER)) {
            BY_KIND.put(schema.getKind(), schema);
        }
    }

    private EntitySchemas() {
    }

    /**
     * @param kind entity kind
     * @return the schema of the kind (every kind has one)
     */
    public static EntitySchema<? extends MappedRecord> forKind(EntityKind kind) {
        EntitySchema<?> schema = BY_KIND.get(kind);
        if (schema == null) {
            throw new IllegalArgumentException("No schema registered for " + kind);
        }
        return schema;
    }
}
