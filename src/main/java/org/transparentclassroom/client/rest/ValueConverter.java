package org.transparentclassroom.client.rest;

import org.transparentclassroom.client.model.EntityKind;
import org.transparentclassroom.client.model.widget.AnswerWidget;
import org.transparentclassroom.client.model.widget.Widget;
import org.transparentclassroom.client.rest.widget.WidgetMapperChain;

import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.transparentclassroom.client.rest.exception.MalformedFieldException.buildMalformedFieldException;

/**
 * Converts raw JSON values to typed values based on {@link FieldType}, and back.
 *
 * <p>Coercion rules:</p>
 * <ul>
 *   <li>STRING, BOOLEAN: passthrough with a type check</li>
 *   <li>INTEGER: integral JSON numbers within the int range; strings are never parsed</li>
 *   <li>DATE: {@code yyyy-MM-dd}</li>
 *   <li>DATETIME: ISO-8601 date-time, falling back to the DATE rule for payloads that
 *       under-specify the time</li>
 *   <li>list types: JSON array, each element coerced by the element type</li>
 * </ul>
 *
 * <p>{@code null} converts to {@code null}, except for list types which convert to an
 * empty list. Any type mismatch raises a
 * {@link org.transparentclassroom.client.rest.exception.MalformedFieldException}.</p>
 */
public class ValueConverter {

    /** ISO date-time with either 'T' or ' ' separator, optional offset and optional [region] */
    private static final DateTimeFormatter DATE_TIME_FORMAT = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
            .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
            .optionalStart()
            .appendLiteral('[')
            .parseCaseSensitive()
            .appendZoneRegionId()
            .appendLiteral(']')
            .optionalEnd()
            .toFormatter();

    private ValueConverter() {
    }

    /**
     * Converts a raw JSON value to the Java value of the field type.
     *
     * @param value     Raw value as materialized from JSON (String, Number, Boolean, Map, List or null)
     * @param fieldType Target field type
     * @param kind      Entity kind being mapped, for error reporting
     * @param field     Field path being mapped, for error reporting
     * @param context   Mapping context (time zone, widget mappers, diagnostics)
     * @return Converted typed value
     */
    public static Object convert(Object value, FieldType fieldType, EntityKind kind, String field,
                                 MappingContext context) {
        if (fieldType.isList()) {
            return convertList(value, fieldType, kind, field, context);
        }
        if (value == null) {
            return null;
        }

        switch (fieldType) {
            case STRING:
                if (value instanceof String) {
                    return value;
                }
                throw buildMalformedFieldException(kind, field, value, "expected a string");

            case INTEGER:
                return toInteger(value, kind, field);

            case BOOLEAN:
                if (value instanceof Boolean) {
                    return value;
                }
                throw buildMalformedFieldException(kind, field, value, "expected a boolean");

            case DATE:
                return toDate(value, kind, field);

            case DATETIME:
                return toDateTime(value, kind, field, context);

            case OBJECT:
                if (value instanceof Map) {
                    return copyObject((Map<?, ?>) value);
                }
                throw buildMalformedFieldException(kind, field, value, "expected an object");

            case WIDGET:
                return context.getWidgetMappers().map(value, kind, field, context);

            case ANY:
            default:
                return value;
        }
    }

    /**
     * Converts a typed value back to its raw JSON representation, writing widgets through
     * the default widget chain.
     *
     * @param value     Typed value, as produced by {@link #convert}
     * @param fieldType Field type of the value
     * @return Raw value (String, Number, Boolean, Map, List or null)
     */
    public static Object toJson(Object value, FieldType fieldType) {
        return toJson(value, fieldType, WidgetMapperChain.DEFAULT);
    }

    /**
     * Converts a typed value back to its raw JSON representation.
     *
     * @param value         Typed value, as produced by {@link #convert}
     * @param fieldType     Field type of the value
     * @param widgetMappers Chain the widgets were mapped with
     * @return Raw value (String, Number, Boolean, Map, List or null)
     */
    public static Object toJson(Object value, FieldType fieldType, WidgetMapperChain widgetMappers) {
        if (value == null) {
            return null;
        }
        if (fieldType.isList()) {
            List<Object> result = new ArrayList<>();
            for (Object element : (List<?>) value) {
                result.add(toJson(element, fieldType.getElementType(), widgetMappers));
            }
            return result;
        }

        switch (fieldType) {
            case DATE:
                return ((LocalDate) value).format(DateTimeFormatter.ISO_LOCAL_DATE);

            case DATETIME:
                ZonedDateTime dateTime = (ZonedDateTime) value;
                if (dateTime.getZone() instanceof ZoneOffset) {
                    return dateTime.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
                }
                return dateTime.format(DateTimeFormatter.ISO_ZONED_DATE_TIME);

            case WIDGET:
                return RecordWriter.write((Widget) value, widgetMappers);

            default:
                return value;
        }
    }

    private static List<Object> convertList(Object value, FieldType fieldType, EntityKind kind, String field,
                                            MappingContext context) {
        if (value == null) {
            return Collections.emptyList();
        }
        if (fieldType == FieldType.WIDGET_LIST && value instanceof Map) {
            return Collections.unmodifiableList(answersToWidgets((Map<?, ?>) value, kind, field, context));
        }
        if (!(value instanceof List)) {
            throw buildMalformedFieldException(kind, field, value, "expected an array");
        }

        List<?> elements = (List<?>) value;
        List<Object> result = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            result.add(convert(elements.get(i), fieldType.getElementType(), kind, field + "[" + i + "]", context));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Form and online application detail payloads may carry answers as a
     * {@code name -> value} object; each entry becomes an answer widget.
     */
    private static List<Object> answersToWidgets(Map<?, ?> answers, EntityKind kind, String field,
                                                 MappingContext context) {
        List<Object> result = new ArrayList<>(answers.size());
        int i = 0;
        for (Map.Entry<?, ?> entry : answers.entrySet()) {
            Map<String, Object> widget = new LinkedHashMap<>();
            widget.put("type", AnswerWidget.TYPE);
            widget.put("name", String.valueOf(entry.getKey()));
            widget.put("value", entry.getValue());
            result.add(convert(widget, FieldType.WIDGET, kind, field + "[" + i++ + "]", context));
        }
        return result;
    }

    private static Integer toInteger(Object value, EntityKind kind, String field) {
        if (value instanceof Integer) {
            return (Integer) value;
        }
        if (value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue();
        }
        if (value instanceof Long || value instanceof BigInteger) {
            try {
                return value instanceof Long
                        ? Math.toIntExact((Long) value)
                        : ((BigInteger) value).intValueExact();
            } catch (ArithmeticException e) {
                throw buildMalformedFieldException(kind, field, value, "integer out of range", e);
            }
        }
        throw buildMalformedFieldException(kind, field, value, "expected an integer");
    }

    private static LocalDate toDate(Object value, EntityKind kind, String field) {
        if (!(value instanceof String)) {
            throw buildMalformedFieldException(kind, field, value, "expected a yyyy-MM-dd date string");
        }
        String text = (String) value;
        if (text.isEmpty()) {
            return null;
        }
        try {
            return LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE);
        } catch (DateTimeParseException e) {
            throw buildMalformedFieldException(kind, field, value, "expected a yyyy-MM-dd date", e);
        }
    }

    private static ZonedDateTime toDateTime(Object value, EntityKind kind, String field, MappingContext context) {
        if (!(value instanceof String)) {
            throw buildMalformedFieldException(kind, field, value, "expected an ISO-8601 date-time string");
        }
        String text = (String) value;
        if (text.isEmpty()) {
            return null;
        }

        ZoneId schoolZone = context.getZone();
        try {
            TemporalAccessor parsed = DATE_TIME_FORMAT.parseBest(text, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime) {
                ZonedDateTime dateTime = (ZonedDateTime) parsed;
                return schoolZone == null ? dateTime : dateTime.withZoneSameInstant(schoolZone);
            }
            return ((LocalDateTime) parsed).atZone(context.getEffectiveZone());
        } catch (DateTimeParseException e) {
            // Older payloads send a bare date where a timestamp is documented
            try {
                return LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay(context.getEffectiveZone());
            } catch (DateTimeParseException ignored) {
                throw buildMalformedFieldException(kind, field, value, "expected an ISO-8601 date-time", e);
            }
        }
    }

    private static Map<String, Object> copyObject(Map<?, ?> value) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : value.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return Collections.unmodifiableMap(copy);
    }
}
