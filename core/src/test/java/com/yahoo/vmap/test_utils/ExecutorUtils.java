/*
 * Copyright 2020, Verizon Media.
 * Licensed under the terms of the Apache 2.0 license.
 * Please see LICENSE file in the project root for terms.
 */

package com.yahoo.vmap.test_utils;


import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Runs a batch of tasks on a fixed pool and collects their results, failing if any task throws or
 * misses the time limit.
 */
public class ExecutorUtils<T> {

    public static class ExecutionError extends Exception { }

    final ExecutorService executor;
    final List<Future<T>> tasks = new ArrayList<>();

    public ExecutorUtils(int numThreads) {
        this.executor = Executors.newFixedThreadPool(numThreads);
    }

    public void submitTasks(int numTasks, Function<Integer, Callable<T>> taskGenerator) {
        for (int i = 0; i < numTasks; i++) {
            tasks.add(executor.submit(taskGenerator.apply(i)));
        }
    }

    /**
     * Waits for all the submitted tasks and returns their results in submission order.
     * All failures are attached to the thrown error as suppressed exceptions.
     */
    public List<T> shutdown(long timeLimitInSeconds) throws ExecutionError {
        long timeLimitInMs = TimeUnit.MILLISECONDS.convert(timeLimitInSeconds, TimeUnit.SECONDS);
        List<T> results = new ArrayList<>(tasks.size());
        ExecutionError error = null;
        try {
            executor.shutdown();
            Instant startingTime = Instant.now();
            for (Future<T> task : tasks) {
                long timeToWait = Math.max(1, timeLimitInMs - Duration.between(startingTime, Instant.now()).toMillis());
                try {
                    results.add(task.get(timeToWait, TimeUnit.MILLISECONDS));
                } catch (InterruptedException | ExecutionException | TimeoutException e) {
                    if (error == null) {
                        error = new ExecutionError();
                    }
                    error.addSuppressed(e);
                }
            }
            tasks.clear();
            if (error != null) {
                throw error;
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    public void shutdownNow() {
        executor.shutdownNow();
    }
}
