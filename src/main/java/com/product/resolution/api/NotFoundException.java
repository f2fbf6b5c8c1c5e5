package com.product.resolution.api;

/**
 * Thrown when a record or golden record id does not exist.
 */
public class NotFoundException extends RuntimeException {

    public enum ResourceType {
        RECORD, GOLDEN_RECORD
    }

    private final ResourceType resourceType;
    private final String id;

    public NotFoundException(ResourceType resourceType, String id) {
        super(resourceType + " not found: " + id);
        this.resourceType = resourceType;
        this.id = id;
    }

    public ResourceType getResourceType() {
        return resourceType;
    }

    public String getId() {
        return id;
    }
}
