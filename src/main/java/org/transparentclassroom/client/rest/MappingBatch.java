package org.transparentclassroom.client.rest;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.transparentclassroom.client.model.MappedRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered outcomes of mapping a collection payload, in source order.
 *
 * @param <R> record type
 */
@EqualsAndHashCode
@ToString
public class MappingBatch<R extends MappedRecord> {

    private final List<MappingOutcome<R>> outcomes;

    public MappingBatch(List<MappingOutcome<R>> outcomes) {
        this.outcomes = Collections.unmodifiableList(new ArrayList<>(outcomes));
    }

    public List<MappingOutcome<R>> getOutcomes() {
        return outcomes;
    }

    /**
     * @return successfully mapped records, in source order
     */
    public List<R> getRecords() {
        List<R> records = new ArrayList<>();
        for (MappingOutcome<R> outcome : outcomes) {
            if (outcome.isSuccess()) {
                records.add(outcome.getRecord());
            }
        }
        return records;
    }

    /**
     * @return failed elements, in source order
     */
    public List<MappingOutcome<R>> getFailures() {
        List<MappingOutcome<R>> failures = new ArrayList<>();
        for (MappingOutcome<R> outcome : outcomes) {
            if (!outcome.isSuccess()) {
                failures.add(outcome);
            }
        }
        return failures;
    }

    public boolean hasFailures() {
        return outcomes.stream().anyMatch(outcome -> !outcome.isSuccess());
    }

    public int size() {
        return outcomes.size();
    }
}
