package org.transparentclassroom.client.rest;

import org.transparentclassroom.client.model.EntityKind;

/**
 * Optional sink for schema drift observed while mapping. Never affects the mapping
 * result.
 */
public interface MappingDiagnostics {

    /** Discards everything. */
    MappingDiagnostics NONE = new MappingDiagnostics() {
        @Override
        public void unknownField(EntityKind kind, String path, Object value) {
        }

        @Override
        public void missingDetailField(EntityKind kind, String path) {
        }
    };

    /**
     * The payload carried a key the schema does not declare.
     *
     * @param kind  entity kind being mapped
     * @param path  path of the undeclared key (e.g. {@code nickname})
     * @param value its raw value
     */
    void unknownField(EntityKind kind, String path, Object value);

    /**
     * A detail payload lacked a field the schema only allows list payloads to omit.
     *
     * @param kind entity kind being mapped
     * @param path path of the absent field
     */
    void missingDetailField(EntityKind kind, String path);
}
