package com.questrail.plcbridge.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for a task armed on a {@link MonotonicScheduler}.
 *
 * <p>The rebirth debounce relies on this handle: every new schema-change
 * trigger cancels the outstanding expiry before arming the next one, so there
 * is never more than one live debounce task.</p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if the task will not run because of this call;
     *         {@code false} if it already ran or was cancelled earlier
     */
    boolean cancel();
}
