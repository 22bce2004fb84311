/*
 * Original work: Copyright (c) 2021, Xilinx, Inc.
 *                Author: Eddie Hung, Xilinx Research Labs.
 *                This file is derived from RapidWright.
 * Modified work: Copyright (c) 2026, NetWright contributors.
 * All rights reserved.
 *
 * This file is part of NetWright.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package com.netwright.util;

import java.util.ArrayList;
import java.util.List;
import java.util.ListIterator;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Utilities to aid in parallel processing
 *
 * A class that abstracts away single-threaded and multi-threaded execution.
 * Single-threaded mode means that all tasks submitted will be executed
 * immediately (on the submitting thread).
 */
public class ParallelismTools {
    /**
     * Name of the environment variable to disable parallel processing, set NW_PARALLEL=0 to disable
     */
    public static final String NW_PARALLEL = "NW_PARALLEL";

    private static final int POOL_SIZE = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);

    /** A fixed-size thread pool with as many threads as there are processors
     * minus one, fed by a single task queue */
    private static final ThreadPoolExecutor pool = new ThreadPoolExecutor(
            POOL_SIZE,
            POOL_SIZE,
            0, TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(),
            (r) -> {
                Thread t = Executors.defaultThreadFactory().newThread(r);
                t.setDaemon(true);
                return t;
            });

    private static boolean parallel = true;

    static {
        String value = Params.getParamValue(NW_PARALLEL);
        setParallel(value == null || Params.isSet(value));
    }

    /**
     * Global setter to control parallel processing.
     * @param parallel Enable parallel processing.
     */
    public static void setParallel(boolean parallel) {
        ParallelismTools.parallel = parallel;
        if (parallel) {
            pool.prestartAllCoreThreads();
        }
    }

    /**
     * Global getter for current parallel processing state.
     * @return Current parallel processing state.
     */
    public static boolean getParallel() {
        return parallel;
    }

    /**
     * Submit a task-with-return-value to the thread pool.
     * @param task Task to be performed.
     * @param <T> Type returned by task.
     * @return A Future object holding the value returned by task.
     */
    public static <T> Future<T> submit(Callable<T> task) {
        if (!getParallel()) {
            try {
                return CompletableFuture.completedFuture(task.call());
            } catch (Exception e) {
                CompletableFuture<T> f = new CompletableFuture<>();
                f.completeExceptionally(e);
                return f;
            }
        }
        return pool.submit(task);
    }

    /**
     * Block until the task behind the given Future is complete.
     * If necessary, steal the task from the job queue for immediate execution
     * on the current thread. Unchecked exceptions thrown by the task are
     * rethrown as they are; anything else is wrapped.
     * @param future Future representing previously submitted task.
     * @return Value returned by task.
     */
    public static <T> T get(Future<T> future) {
        trySteal(future);

        try {
            return future.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new RuntimeException(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(e);
        }
    }

    /**
     * For a given List of Futures, block until all are complete.
     * The list is walked in reverse order and tasks are stolen from the
     * queue so that they may be completed using the current thread.
     * @param futures A List of Future objects corresponding to previously
     *                submitted tasks.
     * @param <T> Type returned by all tasks.
     * @return The values returned by the tasks, in order.
     */
    public static <T> List<T> join(List<Future<T>> futures) {
        if (getParallel()) {
            // Walk backwards and try and steal those not done
            ListIterator<Future<T>> it = futures.listIterator(futures.size());
            while (it.hasPrevious()) {
                trySteal(it.previous());
            }
        }

        // Now block to wait for other threads to finish their tasks
        List<T> results = new ArrayList<>(futures.size());
        for (Future<T> f : futures) {
            results.add(get(f));
        }
        return results;
    }

    private static <T> boolean trySteal(Future<T> future) {
        boolean doneOrStolen = future.isDone();
        if (!doneOrStolen && (future instanceof Runnable)) {
            doneOrStolen = pool.remove((Runnable) future);
            if (doneOrStolen) {
                ((Runnable) future).run();
            }
        }
        return doneOrStolen;
    }

    /**
     * Given a list of tasks-with-return-value, submit all of them and return
     * their futures without waiting. Callers join on the result.
     * @param tasks List of tasks-with-return-value.
     * @param <T> Type returned by all tasks.
     * @return A list of Future objects used to hold returned data.
     */
    public static <T> List<Future<T>> submitAll(List<? extends Callable<T>> tasks) {
        List<Future<T>> futures = new ArrayList<>(tasks.size());
        for (Callable<T> task : tasks) {
            futures.add(submit(task));
        }
        return futures;
    }
}
