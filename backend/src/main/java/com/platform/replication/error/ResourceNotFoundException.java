package com.platform.replication.error;

/**
 * Exception for resource not found errors.
 */
public class ResourceNotFoundException extends ControlPlaneException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(ErrorCode errorCode, String resourceType, String resourceId) {
        super(errorCode, String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public static ResourceNotFoundException intent(String key) {
        return new ResourceNotFoundException(ErrorCode.INTENT_NOT_FOUND, "ReplicationIntent", key);
    }

    public static ResourceNotFoundException backendRecord(String kind, String key) {
        return new ResourceNotFoundException(ErrorCode.RESOURCE_NOT_FOUND, kind, key);
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
