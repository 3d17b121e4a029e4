package com.platform.replication.error;

/**
 * Create of a record that already exists.
 */
public class ResourceConflictException extends ControlPlaneException {

    public ResourceConflictException(String resourceType, String resourceId) {
        super(ErrorCode.RESOURCE_CONFLICT, String.format("%s already exists: %s", resourceType, resourceId));
    }
}
