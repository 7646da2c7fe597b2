/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Strata.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.strata.sieve.exec;

import com.hellblazer.strata.sieve.SieveConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Runs one task per partition on a fork/join pool and waits for all of them.
 *
 * <p>Task bodies must be idempotent and free of externally visible side effects: a failed task is simply run again,
 * up to {@link SieveConfig#getMaxTaskAttempts()} times, and the query fails with a {@link QueryExecutionException}
 * once a task exhausts its attempts. Small task sets run on the calling thread.
 *
 * <p>Thread Safety: instances may be shared by concurrent queries. Call {@link #close()} to release the pool.
 *
 * @author hal.hildebrand
 */
public class PartitionTaskExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PartitionTaskExecutor.class);

    private final ExecutorService taskExecutor;
    private final SieveConfig     config;

    public PartitionTaskExecutor() {
        this(SieveConfig.defaultConfig());
    }

    public PartitionTaskExecutor(SieveConfig config) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.taskExecutor = new ForkJoinPool(config.getParallelism(), ForkJoinPool.defaultForkJoinWorkerThreadFactory,
                                             null, true);
        log.info("Created PartitionTaskExecutor with parallelism: {}", config.getParallelism());
    }

    public SieveConfig getConfig() {
        return config;
    }

    /**
     * Apply {@code body} to every task input and return the results in input order. Returns only once every task
     * has finished.
     *
     * @throws QueryExecutionException if a task fails on every attempt or the caller is interrupted
     */
    public <I, T> List<T> execute(List<I> tasks, Function<? super I, ? extends T> body) {
        Objects.requireNonNull(tasks, "Tasks cannot be null");
        Objects.requireNonNull(body, "Task body cannot be null");
        if (tasks.isEmpty()) {
            return List.of();
        }

        if (tasks.size() < config.getMinPartitionsForParallel()) {
            var results = new ArrayList<T>(tasks.size());
            for (int i = 0; i < tasks.size(); i++) {
                results.add(attempt(i, tasks.get(i), body));
            }
            return results;
        }

        var futures = new ArrayList<CompletableFuture<T>>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            var index = i;
            var task = tasks.get(i);
            futures.add(CompletableFuture.supplyAsync(() -> attempt(index, task, body), taskExecutor));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get();
        } catch (InterruptedException e) {
            // tasks not yet started never run; running tasks finish but their results are dropped
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new QueryExecutionException("Interrupted waiting for partition tasks", -1, e);
        } catch (ExecutionException e) {
            throw failure(e.getCause());
        }

        var results = new ArrayList<T>(futures.size());
        for (var future : futures) {
            results.add(future.join());
        }
        return results;
    }

    private <I, T> T attempt(int index, I task, Function<? super I, ? extends T> body) {
        var maxAttempts = config.getMaxTaskAttempts();
        RuntimeException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return body.apply(task);
            } catch (RuntimeException e) {
                last = e;
                if (attempt < maxAttempts) {
                    log.warn("Partition task {} failed on attempt {} of {}, retrying", index, attempt, maxAttempts, e);
                }
            }
        }
        log.error("Partition task {} failed after {} attempt(s)", index, maxAttempts, last);
        throw new QueryExecutionException("Partition task " + index + " failed after " + maxAttempts + " attempt(s)",
                                          index, last);
    }

    private static QueryExecutionException failure(Throwable cause) {
        var root = cause instanceof CompletionException && cause.getCause() != null ? cause.getCause() : cause;
        if (root instanceof QueryExecutionException qee) {
            return qee;
        }
        return new QueryExecutionException("Partition task failed", -1, root);
    }

    /**
     * Shutdown the task executor.
     */
    @Override
    public void close() {
        taskExecutor.shutdown();
        try {
            if (!taskExecutor.awaitTermination(60, TimeUnit.SECONDS)) {
                taskExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            taskExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("PartitionTaskExecutor shutdown complete");
    }
}
