package fp.promise;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.AfterClass;
import org.junit.Assert;
import org.junit.Test;

import fp.io.DefaultPlatform;
import fp.io.ManualScheduler;
import fp.util.Either;
import fp.util.ExceptionFailure;
import fp.util.Failure;
import fp.util.GeneralFailure;
import fp.util.Left;
import fp.util.Right;

public class CoreTest {
    final static DefaultPlatform platform = new DefaultPlatform(4);

    @AfterClass
    public static void tearDown() {
        platform.shutdown();
    }

    private static <T> List<Either<Failure, T>> received() {
        return Collections.synchronizedList(new ArrayList<>());
    }

    @Test(expected = DoubleSetException.class)
    public void testSetResultTwice() {
        final Core<Integer> core = new Core<>();
        core.setResult(Right.of(1));
        core.setResult(Right.of(2));
    }

    @Test(expected = DoubleSetException.class)
    public void testSetCallbackTwice() {
        final Core<Integer> core = new Core<>();
        core.setCallback(r -> {});
        core.setCallback(r -> {});
    }

    @Test(expected = NotReadyException.class)
    public void testReadResultBeforeSet() {
        final Core<Integer> core = new Core<>();
        core.readResult();
    }

    @Test
    public void testReadResultIsIdempotent() {
        final Core<Integer> core = new Core<>();
        Assert.assertFalse(core.isReady());
        core.setResult(Right.of(5));
        Assert.assertTrue(core.isReady());
        Assert.assertEquals(Right.of(5), core.readResult());
        Assert.assertSame(core.readResult(), core.readResult());
    }

    @Test
    public void testResultThenCallback() {
        final Core<Integer> core = new Core<>();
        final List<Either<Failure, Integer>> received = received();
        core.setResult(Right.of(5));
        Assert.assertTrue(received.isEmpty());
        core.setCallback(received::add);
        Assert.assertEquals(Arrays.asList(Right.of(5)), received);
    }

    @Test
    public void testCallbackThenResult() {
        final Core<Integer> core = new Core<>();
        final List<Either<Failure, Integer>> received = received();
        core.setCallback(received::add);
        Assert.assertTrue(received.isEmpty());
        core.setResult(Right.of(5));
        Assert.assertEquals(Arrays.asList(Right.of(5)), received);
    }

    @Test
    public void testFailureIsDeliveredAsResult() {
        final Core<Integer> core = new Core<>();
        final List<Either<Failure, Integer>> received = received();
        core.setCallback(received::add);
        core.setResult(Left.of(GeneralFailure.of("ERROR_001")));
        Assert.assertEquals(Arrays.asList(Left.of(GeneralFailure.of("ERROR_001"))), received);
    }

    @Test
    public void testCallbackFiresOnlyOnce() {
        final Core<Integer> core = new Core<>();
        final List<Either<Failure, Integer>> received = received();
        core.setCallback(received::add);
        core.setResult(Right.of(5));
        core.deactivate();
        core.activate();
        core.detachPromise();
        core.detachFuture();
        Assert.assertEquals(1, received.size());
    }

    @Test
    public void testDetachPromiseWithoutResultBreaksIt() {
        final Core<Integer> core = new Core<>();
        final List<Either<Failure, Integer>> received = received();
        core.setCallback(received::add);
        core.detachPromise();

        Assert.assertEquals(1, received.size());
        final Either<Failure, Integer> result = received.get(0);
        Assert.assertTrue(result.toString(), result.isLeft());
        Assert.assertTrue(
            ((ExceptionFailure) result.left()).is(BrokenPromiseException.class)
        );
        Assert.assertEquals(result, core.readResult());
    }

    @Test
    public void testDetachPromiseBeforeCallback() {
        final Core<Integer> core = new Core<>();
        final List<Either<Failure, Integer>> received = received();
        core.detachPromise();
        core.setCallback(received::add);

        Assert.assertEquals(1, received.size());
        Assert.assertTrue(
            ((ExceptionFailure) received.get(0).left()).throwable
                instanceof BrokenPromiseException
        );
    }

    @Test
    public void testDetachFutureWithoutCallback() {
        final Core<Integer> core = new Core<>();
        core.detachFuture();
        Assert.assertFalse(core.isDisposed());

        core.setResult(Right.of(1));
        Assert.assertFalse(core.isDisposed());

        core.detachPromise();
        Assert.assertTrue(core.isDisposed());
    }

    @Test
    public void testDetachFutureAfterResult() {
        final Core<Integer> core = new Core<>();
        core.setResult(Right.of(1));
        core.detachPromise();
        Assert.assertFalse(core.isDisposed());

        core.detachFuture();
        Assert.assertTrue(core.isDisposed());
    }

    @Test
    public void testDisposedOnlyAfterBothSidesDetach() {
        final Core<Integer> core = new Core<>();
        final List<Either<Failure, Integer>> received = received();
        core.setCallback(received::add);
        core.setResult(Right.of(3));
        Assert.assertEquals(1, received.size());
        Assert.assertFalse(core.isDisposed());

        core.detachPromise();
        Assert.assertFalse(core.isDisposed());

        core.detachFuture();
        Assert.assertTrue(core.isDisposed());
        Assert.assertEquals(1, received.size());
    }

    @Test(expected = IllegalStateException.class)
    public void testThirdDetachFails() {
        final Core<Integer> core = new Core<>();
        core.detachFuture();
        core.detachPromise();
        core.detachPromise();
    }

    @Test
    public void testDeactivateHoldsDelivery() {
        final Core<Integer> core = new Core<>();
        final List<Either<Failure, Integer>> received = received();
        core.deactivate();
        Assert.assertFalse(core.isActive());

        core.setResult(Right.of(7));
        core.setCallback(received::add);
        Assert.assertTrue(received.isEmpty());
        Assert.assertEquals(Right.of(7), core.readResult());

        core.activate();
        Assert.assertTrue(core.isActive());
        Assert.assertEquals(Arrays.asList(Right.of(7)), received);
    }

    @Test
    public void testActivateWithoutResultDoesNotFire() {
        final Core<Integer> core = new Core<>();
        final List<Either<Failure, Integer>> received = received();
        core.deactivate();
        core.setCallback(received::add);
        core.activate();
        Assert.assertTrue(received.isEmpty());

        core.setResult(Right.of(1));
        Assert.assertEquals(1, received.size());
    }

    @Test
    public void testDeactivatedForeverKeepsResult() {
        final Core<Integer> core = new Core<>();
        final List<Either<Failure, Integer>> received = received();
        core.deactivate();
        core.setCallback(received::add);
        core.setResult(Right.of(9));
        core.detachPromise();

        Assert.assertTrue(received.isEmpty());
        Assert.assertTrue(core.isReady());
        Assert.assertFalse(core.isDisposed());
    }

    @Test
    public void testDetachFutureReactivates() {
        final Core<Integer> core = new Core<>();
        final List<Either<Failure, Integer>> received = received();
        core.deactivate();
        core.setCallback(received::add);
        core.setResult(Right.of(2));
        Assert.assertTrue(received.isEmpty());

        core.detachFuture();
        Assert.assertTrue(core.isActive());
        Assert.assertEquals(Arrays.asList(Right.of(2)), received);
    }

    @Test
    public void testCallbackCanCallBackIntoCore() {
        final Core<Integer> core = new Core<>();
        final List<Either<Failure, Integer>> received = received();
        core.setCallback(result -> {
            received.add(core.readResult());
            core.activate();
        });
        core.setResult(Right.of(4));
        Assert.assertEquals(Arrays.asList(Right.of(4)), received);
    }

    @Test
    public void testCallbackRunsOutsideLock() throws Exception {
        final Core<Integer> core = new Core<>();
        final AtomicReference<Boolean> otherThreadDone = new AtomicReference<>();
        core.setCallback(result -> {
            final CompletableFuture<Void> other = CompletableFuture.runAsync(
                () -> core.setScheduler(null),
                platform.getExecutor()
            );
            try {
                other.get(5, TimeUnit.SECONDS);
                otherThreadDone.set(true);
            } catch (Exception e) {
                otherThreadDone.set(false);
            }
        });
        core.setResult(Right.of(1));
        Assert.assertEquals(Boolean.TRUE, otherThreadDone.get());
    }

    @Test
    public void testSchedulerDefersCallback() {
        final Core<Integer> core = new Core<>();
        final ManualScheduler scheduler = new ManualScheduler();
        final List<Either<Failure, Integer>> received = received();
        core.setScheduler(scheduler);
        core.setResult(Right.of(5));
        core.setCallback(received::add);

        Assert.assertTrue(received.isEmpty());
        Assert.assertEquals(1, scheduler.size());

        core.activate();
        Assert.assertEquals(1, scheduler.size());

        Assert.assertEquals(1, scheduler.run());
        Assert.assertEquals(Arrays.asList(Right.of(5)), received);
    }

    @Test
    public void testSchedulerRunningWorkImmediatelyFiresOnce() {
        final Core<Integer> core = new Core<>();
        final AtomicInteger calls = new AtomicInteger();
        core.setScheduler(Runnable::run);
        core.setResult(Right.of(1));
        core.setCallback(result -> {
            calls.incrementAndGet();
            core.activate();
        });
        Assert.assertEquals(1, calls.get());

        core.detachPromise();
        core.detachFuture();
        Assert.assertEquals(1, calls.get());
        Assert.assertTrue(core.isDisposed());
    }

    @Test
    public void testRejectedHandOffLeavesCallbackUnfired() {
        final Core<Integer> core = new Core<>();
        final List<Either<Failure, Integer>> received = received();
        core.setScheduler(work -> {
            throw new IllegalStateException("rejected");
        });
        core.setResult(Right.of(1));
        try {
            core.setCallback(received::add);
            Assert.fail("Hand-off should have been rejected");
        } catch (IllegalStateException e) {
            Assert.assertEquals("rejected", e.getMessage());
        }

        core.setScheduler(null);
        core.activate();
        Assert.assertEquals(Arrays.asList(Right.of(1)), received);
    }

    @Test
    public void testDetachStillCountsWhenCallbackThrows() {
        final Core<Integer> core = new Core<>();
        core.setCallback(result -> {
            throw new IllegalArgumentException("boom");
        });
        core.detachFuture();
        try {
            core.detachPromise();
            Assert.fail("Callback exception should propagate");
        } catch (IllegalArgumentException e) {
            Assert.assertEquals("boom", e.getMessage());
        }
        Assert.assertTrue(core.isDisposed());
    }

    @Test
    public void testSchedulerRunsOnPlatformThread() throws Exception {
        final Core<Integer> core = new Core<>();
        final CompletableFuture<String> threadName = new CompletableFuture<>();
        core.setScheduler(platform.getScheduler());
        core.setResult(Right.of(5));
        core.setCallback(result ->
            threadName.complete(Thread.currentThread().getName())
        );
        Assert.assertTrue(
            "It is not an executor thread's name",
            threadName.get(5, TimeUnit.SECONDS)
                .matches("io-executor-\\d+-thread-\\d+")
        );
    }

    @Test
    public void testConcurrentSetWithSchedulerNeverRunsInline() throws Exception {
        for (int i = 0; i < 200; i++) {
            final Core<Integer> core = new Core<>();
            final ManualScheduler scheduler = new ManualScheduler();
            final AtomicInteger calls = new AtomicInteger();
            final CyclicBarrier barrier = new CyclicBarrier(2);
            core.setScheduler(scheduler);

            final CompletableFuture<Void> producer = CompletableFuture.runAsync(() -> {
                await(barrier);
                core.setResult(Right.of(5));
            }, platform.getExecutor());
            final CompletableFuture<Void> consumer = CompletableFuture.runAsync(() -> {
                await(barrier);
                core.setCallback(result -> calls.incrementAndGet());
            }, platform.getExecutor());
            CompletableFuture.allOf(producer, consumer).get(5, TimeUnit.SECONDS);

            Assert.assertEquals(0, calls.get());
            Assert.assertEquals(1, scheduler.size());
            scheduler.run();
            Assert.assertEquals(1, calls.get());
        }
    }

    @Test
    public void testConcurrentSetFiresExactlyOnce() throws Exception {
        for (int i = 0; i < 500; i++) {
            final Core<Integer> core = new Core<>();
            final List<Either<Failure, Integer>> received = received();
            final CyclicBarrier barrier = new CyclicBarrier(2);
            final int value = i;

            final CompletableFuture<Void> producer = CompletableFuture.runAsync(() -> {
                await(barrier);
                core.setResult(Right.of(value));
                core.detachPromise();
            }, platform.getExecutor());
            final CompletableFuture<Void> consumer = CompletableFuture.runAsync(() -> {
                await(barrier);
                core.setCallback(received::add);
                core.detachFuture();
            }, platform.getExecutor());
            CompletableFuture.allOf(producer, consumer).get(5, TimeUnit.SECONDS);

            Assert.assertEquals(Arrays.asList(Right.of(value)), received);
            Assert.assertTrue(core.isDisposed());
        }
    }

    private static void await(CyclicBarrier barrier) {
        try {
            barrier.await(5, TimeUnit.SECONDS);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
