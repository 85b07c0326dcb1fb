package com.taskweaver.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Dispatches delegation events synchronously on the publishing thread.
 * <p>
 * Listeners are either registered for every delegation (all {@link DelegationEventListener}
 * beans, e.g. the metrics recorder) or watch a single delegation. A watch ends by
 * itself once that delegation publishes {@link DelegationEventType#DELEGATION_COMPLETED}.
 * A failing listener is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final List<DelegationEventListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, List<DelegationEventListener>> watchers = new ConcurrentHashMap<>();

    public EventBus() {
    }

    @Autowired
    public EventBus(ObjectProvider<DelegationEventListener> beans) {
        beans.orderedStream().forEach(listeners::add);
        log.debug("Event bus started with {} listener(s)", listeners.size());
    }

    public void publish(DelegationEvent event) {
        log.trace("{} delegation={} item={}", event.type().key(), event.delegationId(), event.workItem());
        for (DelegationEventListener listener : listeners) {
            dispatch(listener, event);
        }
        List<DelegationEventListener> watching = event.type() == DelegationEventType.DELEGATION_COMPLETED
                ? watchers.remove(event.delegationId())
                : watchers.get(event.delegationId());
        if (watching != null) {
            for (DelegationEventListener listener : watching) {
                dispatch(listener, event);
            }
        }
    }

    /** Registers a listener for the events of every delegation. */
    public Subscription register(DelegationEventListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /** Registers a listener for one delegation, up to and including its completion event. */
    public Subscription watch(String delegationId, DelegationEventListener listener) {
        watchers.computeIfAbsent(delegationId, id -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> watchers.computeIfPresent(delegationId, (id, watching) -> {
            watching.remove(listener);
            return watching.isEmpty() ? null : watching;
        });
    }

    int watchedDelegations() {
        return watchers.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private static void dispatch(DelegationEventListener listener, DelegationEvent event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            log.warn("Listener {} failed on {}: {}", listener.getClass().getSimpleName(), event.type().key(),
                    e.getMessage(), e);
        }
    }
}
