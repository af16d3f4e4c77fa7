package org.transparentclassroom.client.model;

import java.time.LocalDate;
import java.util.List;

/**
 * A child enrolled at (or applying to, or withdrawn from) a school.
 * <p>
 * The children list endpoint returns names and ids only; demographic and enrollment
 * fields are populated by the detail endpoint. Exit fields are only sent for
 * withdrawn children.
 * </p>
 */
public class Child extends MappedRecord {

    public Child(FieldValues values) {
        super(EntityKind.CHILD, values);
    }

    public Integer getId() {
        return value("id");
    }

    public String getFirstName() {
        return value("first_name");
    }

    public String getMiddleName() {
        return value("middle_name");
    }

    public String getLastName() {
        return value("last_name");
    }

    public LocalDate getBirthDate() {
        return value("birth_date");
    }

    public String getGender() {
        return value("gender");
    }

    public String getProfilePhoto() {
        return value("profile_photo");
    }

    public String getProgram() {
        return value("program");
    }

    /** Ethnicity identities; empty when the payload does not carry them. */
    public List<String> getEthnicity() {
        return value("ethnicity");
    }

    public String getHouseholdIncome() {
        return value("household_income");
    }

    public String getDominantLanguage() {
        return value("dominant_language");
    }

    public String getGrade() {
        return value("grade");
    }

    public String getStudentId() {
        return value("student_id");
    }

    public String getHoursString() {
        return value("hours_string");
    }

    public String getAllergies() {
        return value("allergies");
    }

    public String getNotes() {
        return value("notes");
    }

    public LocalDate getFirstDay() {
        return value("first_day");
    }

    public LocalDate getLastDay() {
        return value("last_day");
    }

    public String getExitNotes() {
        return value("exit_notes");
    }

    public String getExitReason() {
        return value("exit_reason");
    }

    public Integer getExitSurveyId() {
        return value("exit_survey_id");
    }

    public String getApprovedAdultsString() {
        return value("approved_adults_string");
    }

    public String getEmergencyContactsString() {
        return value("emergency_contacts_string");
    }

    public List<Integer> getParentIds() {
        return value("parent_ids");
    }

    public List<Integer> getClassroomIds() {
        return value("classroom_ids");
    }
}
