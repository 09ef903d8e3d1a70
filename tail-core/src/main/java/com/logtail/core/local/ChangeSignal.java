package com.logtail.core.local;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Wake-up flag handed from a watch thread to the session that owns it. Setting, waiting and clearing all happen under
 * this object's monitor, so a notification arriving between a check and a wait is never lost.
 */
public final class ChangeSignal implements FileChangeListener {

    private boolean changed;

    @Override
    public synchronized void onChanged() {
        changed = true;
        notifyAll();
    }

    /**
     * Waits until signalled or until {@code timeout} elapses, clearing the flag on return.
     *
     * @return true if a change was signalled, false on timeout
     */
    public synchronized boolean await(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!changed) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            TimeUnit.NANOSECONDS.timedWait(this, remaining);
        }
        changed = false;
        return true;
    }
}
