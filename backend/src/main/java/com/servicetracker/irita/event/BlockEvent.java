package com.servicetracker.irita.event;

import java.util.Map;

/**
 * One end-block event: a type plus its decoded attributes. Attribute keys are unique per event.
 */
public record BlockEvent(String type, Map<String, String> attributes) {

    public BlockEvent {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    /** Attribute value or null when absent. */
    public String attribute(String key) {
        return attributes.get(key);
    }

    public boolean isType(String eventType) {
        return type != null && type.equals(eventType);
    }
}
