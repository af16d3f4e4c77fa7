package org.transparentclassroom.client.rest;

import lombok.Builder;
import lombok.Getter;
import org.transparentclassroom.client.rest.widget.WidgetMapperChain;

import java.time.ZoneId;

/**
 * Per-call settings of the mapping layer. Immutable and safe to share between threads.
 */
@Getter
@Builder
public class MappingContext {

    /** School time zone for date-time values; null means naive local time */
    private final ZoneId zone;

    @Builder.Default
    private final MappingPolicy policy = MappingPolicy.BEST_EFFORT;

    @Builder.Default
    private final MappingDiagnostics diagnostics = new LoggingMappingDiagnostics();

    @Builder.Default
    private final WidgetMapperChain widgetMappers = WidgetMapperChain.DEFAULT;

    public static MappingContext defaults() {
        return MappingContext.builder().build();
    }

    /**
     * @return the school zone, or the JVM default zone when none is configured
     */
    public ZoneId getEffectiveZone() {
        return zone != null ? zone : ZoneId.systemDefault();
    }
}
