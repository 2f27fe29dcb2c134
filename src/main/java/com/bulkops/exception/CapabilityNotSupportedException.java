package com.bulkops.exception;

import com.bulkops.model.ErrorCode;

/**
 * The backend integration does not offer an optional capability.
 */
public class CapabilityNotSupportedException extends BulkOperationException {

    private final String capability;

    public CapabilityNotSupportedException(String capability) {
        super(ErrorCode.UNEXPECTED, "Capability not supported by backend: " + capability);
        this.capability = capability;
    }

    public String getCapability() {
        return capability;
    }
}
