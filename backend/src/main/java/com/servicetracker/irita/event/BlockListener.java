package com.servicetracker.irita.event;

/**
 * Invoked once per new block that matches a subscription's query, on the event source's delivery thread.
 */
@FunctionalInterface
public interface BlockListener {

    void onBlock(Block block);
}
