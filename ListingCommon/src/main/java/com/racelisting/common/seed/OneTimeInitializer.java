package com.racelisting.common.seed;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs an action at most once for the lifetime of the instance.
 *
 * Callers racing on the first call wait until the winner finishes. A failing
 * action still counts as run: its exception reaches the first caller only.
 */
public class OneTimeInitializer {

    private final AtomicBoolean done = new AtomicBoolean();

    /**
     * @return true when this call executed the action
     */
    public boolean runOnce(Runnable action) {
        if (done.get()) {
            return false;
        }
        synchronized (this) {
            if (done.get()) {
                return false;
            }
            try {
                action.run();
            } finally {
                done.set(true);
            }
            return true;
        }
    }

    public boolean hasRun() {
        return done.get();
    }
}
