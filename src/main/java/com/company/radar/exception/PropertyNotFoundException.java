package com.company.radar.exception;

import java.util.UUID;

public class PropertyNotFoundException extends RuntimeException {
    public PropertyNotFoundException(UUID accountId, UUID propertyId) {
        super("Property " + propertyId + " not found for account " + accountId);
    }
}
