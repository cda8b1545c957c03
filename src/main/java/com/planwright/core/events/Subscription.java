package com.planwright.core.events;

/**
 * Handle for an event subscription.
 */
public interface Subscription {

    String id();

    /** Stops delivery; events already handed to the consumer are not recalled. */
    void unsubscribe();
}
