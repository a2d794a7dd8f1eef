package com.serpintel.common.exception;

/**
 * Raised for a missing record and for a record owned by another project.
 * Both cases use the same message so callers cannot probe other tenants.
 */
public class ResourceNotFoundException extends VolatilityException {

    public ResourceNotFoundException(String resource) {
        super(ErrorCode.NOT_FOUND, resource + " not found");
    }
}
