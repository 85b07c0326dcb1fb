package com.taskweaver.core.parallel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Keeps track of in-flight notifications sent to a parent session so a run can wait
 * for them before returning.
 */
public final class NotificationTracker {

    private static final Logger log = LoggerFactory.getLogger(NotificationTracker.class);

    private final Set<CompletableFuture<?>> pending = ConcurrentHashMap.newKeySet();

    public void track(CompletableFuture<?> notification) {
        pending.add(notification);
        notification.whenComplete((ignored, error) -> pending.remove(notification));
    }

    public int pendingCount() {
        return pending.size();
    }

    /**
     * Waits until every tracked notification has finished, successfully or not.
     *
     * @return false when some notification was still running after {@code timeout}
     */
    public boolean awaitAll(Duration timeout) {
        CompletableFuture<?>[] snapshot = pending.toArray(new CompletableFuture<?>[0]);
        if (snapshot.length == 0) {
            return true;
        }
        try {
            CompletableFuture.allOf(snapshot)
                    .handle((ignored, error) -> null)
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            log.warn("{} notification(s) still pending after {} ms", pending.size(), timeout.toMillis());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            // handle() above maps failures to null
            throw new IllegalStateException(e.getCause());
        }
    }
}
