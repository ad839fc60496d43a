package com.servicetracker.irita.event;

import java.util.List;

/**
 * Decoded block results delivered to subscribers. Read-only; scoped to one callback invocation.
 */
public record Block(long height, List<BlockEvent> endBlockEvents) {

    public Block {
        endBlockEvents = endBlockEvents == null ? List.of() : List.copyOf(endBlockEvents);
    }
}
