package org.transparentclassroom.client.rest;

/**
 * How the collection mapper reacts to a failing element.
 */
public enum MappingPolicy {

    /** Collect successes and failures side by side, in source order. */
    BEST_EFFORT,
    /** Abort on the first failing element. */
    FAIL_FAST

}
