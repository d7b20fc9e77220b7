/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.job;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

import org.energymonitor.prediction.timeseries.AbstractPredictionTest;
import org.energymonitor.prediction.timeseries.common.exception.ModelNotTrainedException;
import org.opensearch.core.action.ActionListener;
import org.opensearch.threadpool.ThreadPool;

public class MlTaskRunnerTests extends AbstractPredictionTest {
    private ThreadPool threadPool;
    private ExecutorService executorService;
    private MlTaskRunner runner;

    @Override
    public void setUp() throws Exception {
        super.setUp();
        threadPool = mock(ThreadPool.class);
        executorService = mock(ExecutorService.class);
        when(threadPool.executor(anyString())).thenReturn(executorService);
        doAnswer(invocation -> {
            Runnable runnable = invocation.getArgument(0);
            runnable.run();
            return null;
        }).when(executorService).execute(any(Runnable.class));
        runner = new MlTaskRunner(threadPool, "prediction_ml");
    }

    public void testResponse() {
        AtomicReference<Integer> response = new AtomicReference<>();
        runner.submit(() -> 42, ActionListener.wrap(response::set, e -> fail("unexpected failure " + e)));
        assertEquals(Integer.valueOf(42), response.get());
    }

    public void testFailure() {
        AtomicReference<Exception> failure = new AtomicReference<>();
        runner.submit(() -> {
            throw new ModelNotTrainedException("forecaster");
        }, ActionListener.wrap(r -> fail("unexpected response"), failure::set));
        assertTrue(failure.get() instanceof ModelNotTrainedException);
    }

    public void testRejection() {
        doThrow(new RejectedExecutionException("queue full")).when(executorService).execute(any(Runnable.class));
        AtomicReference<Exception> failure = new AtomicReference<>();
        runner.submit(() -> 1, ActionListener.wrap(r -> fail("unexpected response"), failure::set));
        assertTrue(failure.get() instanceof RejectedExecutionException);
    }

    public void testSubmitAndWait() {
        assertEquals("done", runner.submitAndWait(() -> "done"));
    }

    public void testSubmitAndWaitRethrows() {
        ModelNotTrainedException e = expectThrows(ModelNotTrainedException.class, () -> runner.submitAndWait(() -> {
            throw new ModelNotTrainedException("anomaly_detector");
        }));
        assertEquals("anomaly_detector", e.getModelId());
    }
}
