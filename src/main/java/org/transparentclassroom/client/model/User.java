package org.transparentclassroom.client.model;

import java.util.List;

/**
 * A staff member, parent or administrator account.
 */
public class User extends MappedRecord {

    public User(FieldValues values) {
        super(EntityKind.USER, values);
    }

    public Integer getId() {
        return value("id");
    }

    public String getType() {
        return value("type");
    }

    public Boolean getInactive() {
        return value("inactive");
    }

    public String getEmail() {
        return value("email");
    }

    public String getFirstName() {
        return value("first_name");
    }

    public String getLastName() {
        return value("last_name");
    }

    public List<String> getRoles() {
        return value("roles");
    }

    public List<Integer> getAccessibleClassroomIds() {
        return value("accessible_classroom_ids");
    }

    public Integer getDefaultClassroomId() {
        return value("default_classroom_id");
    }

    /** Street address as one line */
    public String getAddress() {
        return value("address");
    }

    public String getStreet() {
        return value("street");
    }

    public String getCity() {
        return value("city");
    }

    public String getStateProvince() {
        return value("state_province");
    }

    public String getPostalCode() {
        return value("postal_code");
    }

    public String getHomeNumber() {
        return value("home_number");
    }

    public String getMobileNumber() {
        return value("mobile_number");
    }

    public String getWorkNumber() {
        return value("work_number");
    }
}
