package org.transparentclassroom.client.model;

/**
 * A school, or a network of schools.
 */
public class School extends MappedRecord {

    public School(FieldValues values) {
        super(EntityKind.SCHOOL, values);
    }

    public Integer getId() {
        return value("id");
    }

    public String getName() {
        return value("name");
    }

    public String getPhone() {
        return value("phone");
    }

    public String getAddress() {
        return value("address");
    }

    /** "school" or "network". */
    public String getType() {
        return value("type");
    }

    /** Rails-style time zone name, e.g. "Pacific Time (US &amp; Canada)". */
    public String getTimezone() {
        return value("timezone");
    }
}
