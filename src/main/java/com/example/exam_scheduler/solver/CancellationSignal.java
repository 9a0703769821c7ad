package com.example.exam_scheduler.solver;

import java.util.ArrayList;
import java.util.List;

/**
 * Lets the owner of a scheduling run stop it from another thread. Backends
 * register a stop action; cancelling runs every registered action once.
 */
public class CancellationSignal {
    private final List<Runnable> stopActions = new ArrayList<>();
    private volatile boolean cancelled = false;

    public boolean isCancelled() {
        return cancelled;
    }

    public void cancel() {
        List<Runnable> toRun;
        synchronized (this) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = new ArrayList<>(stopActions);
            stopActions.clear();
        }
        toRun.forEach(Runnable::run);
    }

    /**
     * Registers an action to run on cancellation. If the signal was already
     * cancelled the action runs immediately.
     */
    public void onCancel(Runnable stopAction) {
        synchronized (this) {
            if (!cancelled) {
                stopActions.add(stopAction);
                return;
            }
        }
        stopAction.run();
    }

    public synchronized void clear() {
        stopActions.clear();
    }
}
