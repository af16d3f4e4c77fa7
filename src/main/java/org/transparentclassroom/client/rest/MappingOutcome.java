package org.transparentclassroom.client.rest;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.transparentclassroom.client.model.MappedRecord;
import org.transparentclassroom.client.rest.exception.MappingException;

/**
 * Result of mapping one element of a collection payload: either a record or the
 * exception raised for it, correlated to the element's source index.
 *
 * @param <R> record type
 */
@Getter
@EqualsAndHashCode
@ToString
public class MappingOutcome<R extends MappedRecord> {

    private final int index;
    private final R record;
    private final MappingException error;

    private MappingOutcome(int index, R record, MappingException error) {
        this.index = index;
        this.record = record;
        this.error = error;
    }

    public static <R extends MappedRecord> MappingOutcome<R> success(int index, R record) {
        return new MappingOutcome<>(index, record, null);
    }

    public static <R extends MappedRecord> MappingOutcome<R> failure(int index, MappingException error) {
        return new MappingOutcome<>(index, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
