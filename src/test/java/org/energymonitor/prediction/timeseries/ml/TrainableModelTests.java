/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.energymonitor.prediction.timeseries.ml;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.energymonitor.prediction.timeseries.AbstractPredictionTest;
import org.energymonitor.prediction.timeseries.common.exception.ModelTrainingException;
import org.energymonitor.prediction.timeseries.model.HyperparameterSet;
import org.energymonitor.prediction.timeseries.model.Sample;

public class TrainableModelTests extends AbstractPredictionTest {

    /**
     * Counts overlapping fits; the first fit blocks until released.
     */
    private static class SlowModel extends TrainableModel<Integer> {
        private final AtomicInteger inFlight = new AtomicInteger();
        private final AtomicInteger maxInFlight = new AtomicInteger();
        private final AtomicInteger fits = new AtomicInteger();
        private final CountDownLatch firstFitStarted = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);

        SlowModel(Clock clock) {
            super("slow_model", clock, 2);
        }

        @Override
        protected Integer fit(List<Sample> samples, HyperparameterSet params) {
            int current = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(current, Math::max);
            try {
                if (fits.incrementAndGet() == 1) {
                    firstFitStarted.countDown();
                    assertTrue(release.await(10, TimeUnit.SECONDS));
                }
                return samples.size();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            } finally {
                inFlight.decrementAndGet();
            }
        }
    }

    public void testConcurrentTrainingIsSerialized() throws Exception {
        SlowModel model = new SlowModel(new MutableClock(START));
        List<Sample> samples = hourlySine(24);
        AtomicReference<Throwable> failure = new AtomicReference<>();

        Thread first = new Thread(() -> train(model, samples, failure), "train-1");
        first.start();
        assertTrue(model.firstFitStarted.await(10, TimeUnit.SECONDS));

        Thread second = new Thread(() -> train(model, samples, failure), "train-2");
        second.start();
        // the second caller blocks on the lock, not inside fit
        assertBusy(() -> assertTrue(second.getState() == Thread.State.WAITING || second.getState() == Thread.State.TIMED_WAITING));
        assertEquals(1, model.fits.get());

        model.release.countDown();
        first.join(10_000);
        second.join(10_000);

        assertNull(failure.get());
        assertEquals(2, model.fits.get());
        assertEquals(1, model.maxInFlight.get());
        assertEquals(2, model.getState().getGeneration());
        assertEquals(Integer.valueOf(24), model.getState().getModel().get());
    }

    public void testFailedFitKeepsPreviousState() {
        TrainableModel<Integer> model = new TrainableModel<Integer>("failing_model", new MutableClock(START), 2) {
            @Override
            protected Integer fit(List<Sample> samples, HyperparameterSet params) {
                throw new IllegalStateException("singular");
            }
        };

        ModelState<Integer> before = model.getState();
        ModelTrainingException e = expectThrows(ModelTrainingException.class, () -> model.train(hourlySine(10), HyperparameterSet.EMPTY));

        assertEquals("failing_model", e.getModelId());
        assertSame(before, model.getState());
        assertFalse(model.isTrained());
    }

    private static void train(TrainableModel<Integer> model, List<Sample> samples, AtomicReference<Throwable> failure) {
        try {
            model.train(samples, HyperparameterSet.EMPTY);
        } catch (Throwable t) {
            failure.compareAndSet(null, t);
        }
    }
}
