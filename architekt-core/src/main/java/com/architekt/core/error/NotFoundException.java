package com.architekt.core.error;

/**
 * Raised when a referenced project, system, flow, data model, component, entry point or
 * attribute parent does not exist.
 */
public class NotFoundException extends ArchitektException {

    private final String entityType;
    private final String entityId;

    public NotFoundException(String entityType, String entityId) {
        super(entityType + " not found: " + entityId);
        this.entityType = entityType;
        this.entityId = entityId;
    }

    public String entityType() {
        return entityType;
    }

    public String entityId() {
        return entityId;
    }

    @Override
    public int httpStatus() {
        return 404;
    }
}
