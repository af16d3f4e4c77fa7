package org.transparentclassroom.client.rest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.transparentclassroom.client.model.EntityKind;

/**
 * Reports schema drift to the log at debug level.
 */
public class LoggingMappingDiagnostics implements MappingDiagnostics {

    private static final Logger logger = LoggerFactory.getLogger(LoggingMappingDiagnostics.class);

    @Override
    public void unknownField(EntityKind kind, String path, Object value) {
        logger.debug("Undeclared field '{}' on {}: {}", path, kind, value);
    }

    @Override
    public void missingDetailField(EntityKind kind, String path) {
        logger.debug("Detail payload of {} has no '{}'", kind, path);
    }
}
