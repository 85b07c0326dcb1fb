package com.taskweaver.core.events;

/**
 * Receives delegation events. Beans implementing this interface are registered on the
 * {@link EventBus} when it is created.
 */
@FunctionalInterface
public interface DelegationEventListener {

    void onEvent(DelegationEvent event);
}
