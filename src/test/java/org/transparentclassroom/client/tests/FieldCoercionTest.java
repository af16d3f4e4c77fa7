package org.transparentclassroom.client.tests;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.transparentclassroom.client.model.EntityKind;
import org.transparentclassroom.client.rest.FieldType;
import org.transparentclassroom.client.rest.MappingContext;
import org.transparentclassroom.client.rest.ValueConverter;
import org.transparentclassroom.client.rest.exception.MalformedFieldException;

import java.math.BigInteger;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Coercion rules applied to individual raw JSON values.
 */
public class FieldCoercionTest {

    private static final ZoneId LOS_ANGELES = ZoneId.of("America/Los_Angeles");

    private final MappingContext naive = MappingContext.defaults();
    private final MappingContext school = MappingContext.builder().zone(LOS_ANGELES).build();

    private Object convert(Object value, FieldType type) {
        return ValueConverter.convert(value, type, EntityKind.CHILD, "field", naive);
    }

    private MalformedFieldException assertMalformed(Object value, FieldType type) {
        MalformedFieldException e = assertThrows(MalformedFieldException.class, () -> convert(value, type));
        System.out.println("Rejected " + value + " as " + type.getSimpleName() + ": " + e.getMessage());
        assertEquals(EntityKind.CHILD, e.getEntityKind());
        assertEquals("field", e.getField());
        assertEquals(value, e.getRawValue());
        return e;
    }

    @Test
    @DisplayName("Date: yyyy-MM-dd parses to a calendar date")
    public void testDate() {
        assertEquals(LocalDate.of(2019, 4, 1), convert("2019-04-01", FieldType.DATE));
        assertNull(convert("", FieldType.DATE), "Empty date string reads as null");
        assertNull(convert(null, FieldType.DATE));
    }

    @Test
    @DisplayName("Date: other shapes are malformed")
    public void testMalformedDate() {
        assertMalformed("04/01/2019", FieldType.DATE);
        assertMalformed("2019-04-01T10:00:00Z", FieldType.DATE);
        assertMalformed(20190401, FieldType.DATE);
    }

    @Test
    @DisplayName("Datetime: payload offset is kept when no school zone is configured")
    public void testDateTimeWithOffset() {
        assertEquals(ZonedDateTime.of(2020, 3, 4, 10, 15, 30, 0, ZoneOffset.UTC),
                convert("2020-03-04T10:15:30Z", FieldType.DATETIME));
        assertEquals(ZonedDateTime.of(2020, 3, 4, 10, 15, 30, 123_000_000, ZoneOffset.ofHours(-5)),
                convert("2020-03-04T10:15:30.123-05:00", FieldType.DATETIME));
        assertEquals(ZonedDateTime.of(2020, 3, 4, 10, 15, 30, 0, ZoneOffset.ofHours(2)),
                convert("2020-03-04 10:15:30+02:00", FieldType.DATETIME), "Space separator is accepted");
    }

    @Test
    @DisplayName("Datetime: values are converted to the school zone")
    public void testDateTimeInSchoolZone() {
        Object converted = ValueConverter.convert("2020-03-04T10:15:30Z", FieldType.DATETIME,
                EntityKind.EVENT, "time", school);
        assertEquals(ZonedDateTime.of(2020, 3, 4, 2, 15, 30, 0, LOS_ANGELES), converted);

        Object naiveValue = ValueConverter.convert("2020-03-04T10:15:30", FieldType.DATETIME,
                EntityKind.EVENT, "time", school);
        assertEquals(ZonedDateTime.of(2020, 3, 4, 10, 15, 30, 0, LOS_ANGELES), naiveValue,
                "Offset-less values are local to the school");
    }

    @Test
    @DisplayName("Datetime: offset-less values without a school zone are naive local time")
    public void testNaiveDateTime() {
        assertEquals(ZonedDateTime.of(2020, 3, 4, 10, 15, 30, 0, ZoneId.systemDefault()),
                convert("2020-03-04 10:15:30", FieldType.DATETIME));
    }

    @Test
    @DisplayName("Datetime: a bare date falls back to the date rule")
    public void testDateTimeFallsBackToDate() {
        Object converted = ValueConverter.convert("2020-03-04", FieldType.DATETIME,
                EntityKind.FORM, "created_at", school);
        assertEquals(ZonedDateTime.of(2020, 3, 4, 0, 0, 0, 0, LOS_ANGELES), converted);

        assertMalformed("yesterday", FieldType.DATETIME);
        assertMalformed(1583316930, FieldType.DATETIME);
        assertNull(convert("", FieldType.DATETIME));
    }

    @Test
    @DisplayName("Integer: integral JSON numbers in the int range only")
    public void testInteger() {
        assertEquals(42, convert(42, FieldType.INTEGER));
        assertEquals(42, convert(42L, FieldType.INTEGER));
        assertEquals(42, convert(BigInteger.valueOf(42), FieldType.INTEGER));
        assertEquals(7, convert((short) 7, FieldType.INTEGER));

        assertMalformed("42", FieldType.INTEGER);
        assertMalformed("abc", FieldType.INTEGER);
        assertMalformed(1.5, FieldType.INTEGER);
        assertMalformed(true, FieldType.INTEGER);
        MalformedFieldException e = assertMalformed(3_000_000_000L, FieldType.INTEGER);
        assertTrue(e.getMessage().contains("out of range"));
    }

    @Test
    @DisplayName("String and boolean: passthrough with type check")
    public void testStringAndBoolean() {
        assertEquals("Ada", convert("Ada", FieldType.STRING));
        assertEquals(Boolean.TRUE, convert(true, FieldType.BOOLEAN));
        assertNull(convert(null, FieldType.STRING));

        assertMalformed(12, FieldType.STRING);
        assertMalformed("true", FieldType.BOOLEAN);
        assertMalformed(1, FieldType.BOOLEAN);
    }

    @Test
    @DisplayName("Object: copied to an unmodifiable map")
    public void testObject() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("beginner", 1);
        @SuppressWarnings("unchecked")
        Map<String, Object> converted = (Map<String, Object>) convert(raw, FieldType.OBJECT);

        assertEquals(raw, converted);
        assertThrows(UnsupportedOperationException.class, () -> converted.put("expert", 3));
        assertMalformed(Arrays.asList(1, 2), FieldType.OBJECT);
    }

    @Test
    @DisplayName("Lists: element-wise coercion, failures name the element index")
    public void testLists() {
        assertEquals(Arrays.asList(3, 5), convert(Arrays.asList(3, 5), FieldType.INTEGER_LIST));
        assertEquals(Collections.emptyList(), convert(null, FieldType.STRING_LIST),
                "A null list reads as an empty list");

        MalformedFieldException e = assertThrows(MalformedFieldException.class, () ->
                ValueConverter.convert(Arrays.asList(3, "x"), FieldType.INTEGER_LIST,
                        EntityKind.CHILD, "parent_ids", naive));
        assertEquals("parent_ids[1]", e.getField());
        assertEquals("x", e.getRawValue());

        assertMalformed("Asian", FieldType.STRING_LIST);
    }

    @Test
    @DisplayName("Serialization: every rule has an inverse")
    public void testToJson() {
        assertEquals("2019-04-01", ValueConverter.toJson(LocalDate.of(2019, 4, 1), FieldType.DATE));
        assertEquals("2020-03-04T10:15:30Z", ValueConverter.toJson(
                ZonedDateTime.of(2020, 3, 4, 10, 15, 30, 0, ZoneOffset.UTC), FieldType.DATETIME));

        ZonedDateTime local = ZonedDateTime.of(2020, 3, 4, 2, 15, 30, 0, LOS_ANGELES);
        Object json = ValueConverter.toJson(local, FieldType.DATETIME);
        assertEquals("2020-03-04T02:15:30-08:00[America/Los_Angeles]", json);
        assertEquals(local, ValueConverter.convert(json, FieldType.DATETIME, EntityKind.EVENT, "time", school));

        assertEquals(Arrays.asList(3, 5), ValueConverter.toJson(Arrays.asList(3, 5), FieldType.INTEGER_LIST));
        assertNull(ValueConverter.toJson(null, FieldType.DATE));
    }
}
