package com.example.exam_scheduler.services;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import com.example.exam_scheduler.model.ScheduleItem;
import com.example.exam_scheduler.solver.CancellationSignal;

/**
 * Handle on a scheduling run executing in the background.
 */
public class SchedulingJob {
    private final CompletableFuture<List<ScheduleItem>> result;
    private final CancellationSignal cancellation;

    SchedulingJob(CompletableFuture<List<ScheduleItem>> result, CancellationSignal cancellation) {
        this.result = result;
        this.cancellation = cancellation;
    }

    /** Stops the solver; the job then completes with a CANCELLED failure. */
    public void cancel() {
        cancellation.cancel();
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    public boolean isDone() {
        return result.isDone();
    }

    public CompletableFuture<List<ScheduleItem>> getResult() {
        return result;
    }

    /**
     * Waits for the run and returns its schedule, rethrowing the failure that
     * ended it.
     */
    public List<ScheduleItem> join() {
        try {
            return result.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }
}
