/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.job;

import java.util.concurrent.RejectedExecutionException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.action.support.PlainActionFuture;
import org.opensearch.common.CheckedSupplier;
import org.opensearch.core.action.ActionListener;
import org.opensearch.threadpool.ThreadPool;

/**
 * Runs CPU-bound closures (fits, grid searches, forecasts, scoring) on the
 * bounded ML executor and reports through an {@link ActionListener}.
 */
public class MlTaskRunner {
    private static final Logger logger = LogManager.getLogger(MlTaskRunner.class);

    private final ThreadPool threadPool;
    private final String executorName;

    public MlTaskRunner(ThreadPool threadPool, String executorName) {
        this.threadPool = threadPool;
        this.executorName = executorName;
    }

    /**
     * @param task closure to run on the ML executor
     * @param listener completed with the closure's result or exception; a
     *        rejected submission is reported as a failure
     * @param <T> result type
     */
    public <T> void submit(CheckedSupplier<T, Exception> task, ActionListener<T> listener) {
        try {
            threadPool.executor(executorName).execute(() -> {
                T result;
                try {
                    result = task.get();
                } catch (Exception e) {
                    listener.onFailure(e);
                    return;
                }
                listener.onResponse(result);
            });
        } catch (RejectedExecutionException e) {
            logger.warn("ML executor [{}] rejected a task", executorName);
            listener.onFailure(e);
        }
    }

    /**
     * Submits the closure and blocks the calling thread until it completes.
     * Runtime exceptions thrown by the closure are rethrown as is.
     *
     * @param task closure to run on the ML executor
     * @param <T> result type
     * @return the closure's result
     */
    public <T> T submitAndWait(CheckedSupplier<T, Exception> task) {
        PlainActionFuture<T> future = PlainActionFuture.newFuture();
        submit(task, future);
        return future.actionGet();
    }
}
