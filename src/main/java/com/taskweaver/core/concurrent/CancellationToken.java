package com.taskweaver.core.concurrent;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation signal shared between a delegation and the work it spawns.
 * <p>
 * A token can be linked to parent tokens (cancelled when any parent is) and can carry
 * a timeout. Cancellation is one-way and idempotent; the first reason wins. A linked
 * token stays registered with its parents until it is cancelled or {@link #release()}d,
 * so tokens derived from a long-lived parent must end in one of the two.
 */
public final class CancellationToken {

    private final CompletableFuture<Void> signal = new CompletableFuture<>();
    private final AtomicReference<String> reason = new AtomicReference<>();
    private final Set<CancellationToken> children = ConcurrentHashMap.newKeySet();
    private final List<CancellationToken> parents = new CopyOnWriteArrayList<>();

    private CancellationToken() {}

    /** A fresh token that is only cancelled explicitly. */
    public static CancellationToken create() {
        return new CancellationToken();
    }

    /** A fresh token cancelled as soon as any of {@code parents} is. */
    public static CancellationToken linkedTo(CancellationToken... parents) {
        CancellationToken child = new CancellationToken();
        for (CancellationToken parent : parents) {
            if (parent != null) {
                child.parents.add(parent);
                parent.children.add(child);
                // a parent cancelled before the add above never sees this child
                if (parent.isCancelled()) {
                    child.cancel(parent.reason());
                }
            }
        }
        return child;
    }

    /**
     * Returns a token linked to this one that is also cancelled after {@code timeoutMs}.
     */
    public CancellationToken withTimeout(long timeoutMs) {
        CancellationToken child = linkedTo(this);
        CompletableFuture<Void> timer = new CompletableFuture<>();
        timer.orTimeout(timeoutMs, TimeUnit.MILLISECONDS).whenComplete((ignored, error) -> {
            if (error instanceof TimeoutException) {
                child.cancel("Timed out after " + timeoutMs + " ms");
            }
        });
        child.signal.whenComplete((ignored, error) -> timer.complete(null));
        return child;
    }

    public void cancel() {
        cancel("Cancelled");
    }

    public void cancel(String why) {
        if (!reason.compareAndSet(null, why != null ? why : "Cancelled")) {
            return;
        }
        signal.complete(null);
        detach();
        for (CancellationToken child : children) {
            child.cancel(reason.get());
        }
    }

    /**
     * Unlinks this token from its parents without cancelling it. Use once the work the
     * token guarded has finished.
     */
    public void release() {
        detach();
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    /** A future that completes normally when the token is cancelled. */
    public CompletableFuture<Void> whenCancelled() {
        return signal.copy();
    }

    public String reason() {
        return reason.get();
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException(reason());
        }
    }

    int linkedChildCount() {
        return children.size();
    }

    private void detach() {
        for (CancellationToken parent : parents) {
            parent.children.remove(this);
        }
        parents.clear();
    }
}
