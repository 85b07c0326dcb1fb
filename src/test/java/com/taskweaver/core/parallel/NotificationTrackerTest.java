package com.taskweaver.core.parallel;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class NotificationTrackerTest {

    @Test
    void finishedNotificationsAreForgotten() {
        var tracker = new NotificationTracker();
        var sent = new CompletableFuture<Void>();

        tracker.track(sent);
        assertEquals(1, tracker.pendingCount());

        sent.complete(null);
        assertEquals(0, tracker.pendingCount());
        assertTrue(tracker.awaitAll(Duration.ofMillis(10)));
    }

    @Test
    void failedNotificationsCountAsFinished() {
        var tracker = new NotificationTracker();
        var sent = new CompletableFuture<Void>();
        tracker.track(sent);

        CompletableFuture.runAsync(() -> sent.completeExceptionally(new IllegalStateException("closed")));

        assertTrue(tracker.awaitAll(Duration.ofSeconds(5)));
    }

    @Test
    void awaitGivesUpAfterTheTimeout() {
        var tracker = new NotificationTracker();
        tracker.track(new CompletableFuture<Void>());

        assertFalse(tracker.awaitAll(Duration.ofMillis(50)));
        assertEquals(1, tracker.pendingCount());
    }
}
