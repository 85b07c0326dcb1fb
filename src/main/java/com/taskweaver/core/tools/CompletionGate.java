package com.taskweaver.core.tools;

import com.taskweaver.core.model.ChildResult;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * One-shot, thread-safe slot for the result of a child session.
 * <p>
 * The first {@link #trySet} or {@link #trySetFault} wins; every later attempt
 * returns false and leaves the stored value untouched.
 */
public final class CompletionGate {

    private final CompletableFuture<ChildResult> future = new CompletableFuture<>();

    public boolean trySet(ChildResult result) {
        return future.complete(result);
    }

    public boolean trySetFault(Throwable fault) {
        return future.completeExceptionally(fault);
    }

    public boolean isDone() {
        return future.isDone();
    }

    public boolean isFaulted() {
        return future.isCompletedExceptionally();
    }

    /** Completes when the gate settles; completing the returned future has no effect on the gate. */
    public CompletableFuture<ChildResult> future() {
        return future.copy();
    }

    /**
     * Returns the settled result, rethrowing a stored fault as is.
     *
     * @throws IllegalStateException if the gate has not settled yet
     */
    public ChildResult resultNow() {
        if (!future.isDone()) {
            throw new IllegalStateException("Completion gate has not settled");
        }
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }
}
