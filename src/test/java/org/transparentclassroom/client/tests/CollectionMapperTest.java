package org.transparentclassroom.client.tests;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.transparentclassroom.client.model.CallShape;
import org.transparentclassroom.client.model.Child;
import org.transparentclassroom.client.model.EntityKind;
import org.transparentclassroom.client.model.Event;
import org.transparentclassroom.client.model.MappedRecord;
import org.transparentclassroom.client.rest.CollectionMapper;
import org.transparentclassroom.client.rest.EntityMapper;
import org.transparentclassroom.client.rest.EntitySchemas;
import org.transparentclassroom.client.rest.MappingBatch;
import org.transparentclassroom.client.rest.MappingContext;
import org.transparentclassroom.client.rest.MappingOutcome;
import org.transparentclassroom.client.rest.MappingPolicy;
import org.transparentclassroom.client.rest.exception.MalformedFieldException;
import org.transparentclassroom.client.rest.exception.MappingException;
import org.transparentclassroom.client.rest.exception.MissingRequiredFieldException;
import org.transparentclassroom.client.tests.base.JsonFixtures;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Mapping list payloads under the best-effort and fail-fast policies.
 */
public class CollectionMapperTest {

    private final CollectionMapper mapper = new CollectionMapper();

    private Object load(String file) throws IOException {
        return JsonFixtures.load("CollectionMapperTest", file);
    }

    @Test
    @DisplayName("Best effort: missing id at index 1 yields 2 records and 1 failure")
    public void testBestEffort() throws Exception {
        MappingBatch<Child> batch = mapper.mapMany(EntitySchemas.CHILD, load("children-missing-id.json"));

        assertEquals(3, batch.size());
        assertTrue(batch.hasFailures());

        List<Child> children = batch.getRecords();
        assertEquals(2, children.size());
        assertEquals(1501, children.get(0).getId());
        assertEquals(1503, children.get(1).getId());

        List<MappingOutcome<Child>> failures = batch.getFailures();
        assertEquals(1, failures.size());
        MappingOutcome<Child> failure = failures.get(0);
        System.out.println("Failure: " + failure.getError().getMessage());
        assertEquals(1, failure.getIndex());
        assertFalse(failure.isSuccess());
        assertNull(failure.getRecord());
        assertInstanceOf(MissingRequiredFieldException.class, failure.getError());
        assertEquals(1, failure.getError().getIndex());
        assertEquals("id", failure.getError().getField());
        assertTrue(failure.getError().getMessage().startsWith("[1] "));
    }

    @Test
    @DisplayName("Best effort: outcomes keep source order")
    public void testSourceOrder() throws Exception {
        MappingBatch<Event> batch = mapper.mapMany(EntitySchemas.EVENT, load("events-mixed.json"));

        List<Integer> indexes = batch.getOutcomes().stream()
                .map(MappingOutcome::getIndex)
                .collect(Collectors.toList());
        assertEquals(List.of(0, 1, 2, 3), indexes);

        List<Boolean> successes = batch.getOutcomes().stream()
                .map(MappingOutcome::isSuccess)
                .collect(Collectors.toList());
        assertEquals(List.of(true, false, false, true), successes);

        MappingException badTime = batch.getOutcomes().get(1).getError();
        assertInstanceOf(MalformedFieldException.class, badTime);
        assertEquals("time", badTime.getField());
        assertEquals("not a time", badTime.getRawValue());

        MappingException badChild = batch.getOutcomes().get(2).getError();
        assertEquals("child_id", badChild.getField());

        assertEquals("Milk", batch.getRecords().get(1).getValue2());
    }

    @Test
    @DisplayName("Fail fast: first failure is thrown tagged with its index")
    public void testFailFast() {
        MissingRequiredFieldException e = assertThrows(MissingRequiredFieldException.class,
                () -> mapper.mapMany(EntitySchemas.CHILD, load("children-missing-id.json"), CallShape.LIST,
                        MappingPolicy.FAIL_FAST));
        System.out.println(e.getMessage());
        assertEquals(1, e.getIndex());
        assertEquals(EntityKind.CHILD, e.getEntityKind());
    }

    @Test
    @DisplayName("Policy defaults to the mapping context")
    public void testContextPolicy() {
        CollectionMapper failFast = new CollectionMapper(new EntityMapper(
                MappingContext.builder().policy(MappingPolicy.FAIL_FAST).build()));

        MalformedFieldException e = assertThrows(MalformedFieldException.class,
                () -> failFast.mapMany(EntityKind.EVENT, load("events-mixed.json")));
        assertEquals(1, e.getIndex());

        assertDoesNotThrow(() -> failFast.mapMany(EntityKind.EVENT, load("events-mixed.json"),
                MappingPolicy.BEST_EFFORT));
    }

    @Test
    @DisplayName("Input shapes: single object is one element, scalars are malformed")
    public void testInputShapes() {
        MappingBatch<? extends MappedRecord> single = mapper.mapMany(EntityKind.CLASSROOM,
                JsonFixtures.parse("{\"id\": 12, \"name\": \"Primary\"}"));
        assertEquals(1, single.getRecords().size());
        assertEquals(12, single.getRecords().get(0).get("id"));

        MappingBatch<? extends MappedRecord> empty = mapper.mapMany(EntityKind.CLASSROOM, JsonFixtures.parse("[]"));
        assertEquals(0, empty.size());
        assertFalse(empty.hasFailures());

        MalformedFieldException e = assertThrows(MalformedFieldException.class,
                () -> mapper.mapMany(EntityKind.CLASSROOM, "classrooms"));
        assertNull(e.getField());
        assertNull(e.getIndex());
    }

    @Test
    @DisplayName("Non-object elements fail only their own slot")
    public void testNonObjectElement() {
        MappingBatch<? extends MappedRecord> batch = mapper.mapMany(EntityKind.SCHOOL, JsonFixtures.parse("""
            [{"id": 1, "name": "North", "type": "Montessori"}, 42]
            """));

        assertEquals(1, batch.getRecords().size());
        assertEquals(1, batch.getFailures().get(0).getIndex());
        assertInstanceOf(MalformedFieldException.class, batch.getFailures().get(0).getError());
    }
}
