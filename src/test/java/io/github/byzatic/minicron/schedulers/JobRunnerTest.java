package io.github.byzatic.minicron.schedulers;

import io.github.byzatic.minicron.cron.CronSpec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.*;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class JobRunnerTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-04T23:01:20.500Z"), ZoneOffset.UTC);
    private static final Sleeper FAST = d -> Thread.sleep(5);

    private final List<JobEventListener> listeners = new CopyOnWriteArrayList<>();
    private Thread thread;

    @AfterEach
    void tearDown() throws Exception {
        if (thread != null) {
            thread.interrupt();
            thread.join(2_000);
        }
    }

    private JobRunner runner(String cron, CronTask task, Sleeper sleeper) throws Exception {
        return new JobRunner(UUID.randomUUID(), CronSpec.parse(cron), task, CLOCK, sleeper, listeners);
    }

    private void start(JobRunner runner) {
        thread = new Thread(runner, "job-runner-test");
        thread.start();
    }

    @Test
    void runsRepeatedlyAndRecordsLastRun() throws Exception {
        CountDownLatch threeRuns = new CountDownLatch(3);
        JobRunner runner = runner("* * * * *", token -> threeRuns.countDown(), FAST);
        start(runner);

        assertTrue(threeRuns.await(3, TimeUnit.SECONDS));
        // the clock stands still, so each run takes the tick after the previous one
        assertNotNull(runner.getLastRunTime());
        assertFalse(runner.getLastRunTime().isBefore(LocalDateTime.of(2024, 3, 4, 23, 2)));
        assertNull(runner.getLastError());
        assertFalse(runner.getStatus().isTerminal());

        runner.requestStop("test done");
        thread.interrupt();
        assertTrue(runner.awaitTermination(Duration.ofSeconds(2)));
        assertEquals(JobStatus.STOPPED, runner.getStatus());
    }

    @Test
    void advancingClockGivesIncreasingTicks() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2024-03-04T23:01:20Z"));
        List<LocalDateTime> ticks = new CopyOnWriteArrayList<>();
        List<LocalDateTime> lastRuns = new CopyOnWriteArrayList<>();
        AtomicReference<JobRunner> self = new AtomicReference<>();
        JobRunner runner = new JobRunner(UUID.randomUUID(), CronSpec.parse("30 * * * *"),
                token -> {
                    JobRunner r = self.get();
                    if (r.getLastRunTime() != null) lastRuns.add(r.getLastRunTime());
                    ticks.add(r.getNextTick());
                    if (ticks.size() == 3) throw new InterruptedException("enough");
                }, clock, clock::advance, listeners);
        self.set(runner);
        runner.run();
        assertTrue(Thread.interrupted());

        assertEquals(List.of(
                LocalDateTime.of(2024, 3, 4, 23, 30),
                LocalDateTime.of(2024, 3, 5, 0, 30),
                LocalDateTime.of(2024, 3, 5, 1, 30)), ticks);
        assertEquals(ticks.subList(0, 2), lastRuns);
        assertEquals(JobStatus.STOPPED, runner.getStatus());
    }

    @Test
    void earlyWakeDoesNotRepeatTick() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2024-03-04T23:01:20Z"));
        List<LocalDateTime> ticks = new CopyOnWriteArrayList<>();
        AtomicReference<JobRunner> self = new AtomicReference<>();
        // wakes one millisecond before every tick
        Sleeper early = d -> {
            if (d.compareTo(Duration.ofMillis(1)) > 0) clock.advance(d.minusMillis(1));
        };
        JobRunner runner = new JobRunner(UUID.randomUUID(), CronSpec.parse("* * * * *"),
                token -> {
                    ticks.add(self.get().getNextTick());
                    if (ticks.size() == 4) throw new InterruptedException("enough");
                }, clock, early, listeners);
        self.set(runner);
        runner.run();
        assertTrue(Thread.interrupted());

        assertEquals(List.of(
                LocalDateTime.of(2024, 3, 4, 23, 2),
                LocalDateTime.of(2024, 3, 4, 23, 3),
                LocalDateTime.of(2024, 3, 4, 23, 4),
                LocalDateTime.of(2024, 3, 4, 23, 5)), ticks);
    }

    @Test
    void lastRunTimeIsNeverBeforeFiredTick() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2024-03-04T23:01:20Z"));
        AtomicReference<JobRunner> self = new AtomicReference<>();
        AtomicReference<LocalDateTime> recorded = new AtomicReference<>();
        Sleeper early = d -> clock.advance(d.minusMillis(1));
        JobRunner runner = new JobRunner(UUID.randomUUID(), CronSpec.parse("* * * * *"),
                token -> {
                    if (self.get().getLastRunTime() != null) {
                        recorded.set(self.get().getLastRunTime());
                        throw new InterruptedException("enough");
                    }
                }, clock, early, listeners);
        self.set(runner);
        runner.run();
        assertTrue(Thread.interrupted());

        // first run returned at 23:01:59.999, the tick it fired for was 23:02
        assertEquals(LocalDateTime.of(2024, 3, 4, 23, 2), recorded.get());
    }

    @Test
    void sleepsForTheLiveIntervalUntilNextTick() throws Exception {
        AtomicReference<Duration> slept = new AtomicReference<>();
        AtomicInteger runs = new AtomicInteger();
        JobRunner runner = runner("* * * * *", token -> runs.incrementAndGet(), d -> {
            slept.set(d);
            throw new InterruptedException("stop here");
        });
        runner.run();

        assertEquals(Duration.ofMillis(39_500), slept.get());
        assertEquals(0, runs.get());
        assertEquals(JobStatus.STOPPED, runner.getStatus());
        // run() restores the interrupt flag of the calling thread
        assertTrue(Thread.interrupted());
    }

    @Test
    void failingTaskEndsInFailedWithoutRetry() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch errorEvent = new CountDownLatch(1);
        listeners.add(new JobEventListener() {
            @Override
            public void onError(UUID jobId, Throwable error) {
                errorEvent.countDown();
            }
        });
        JobRunner runner = runner("@minutely", token -> {
            calls.incrementAndGet();
            throw new IllegalStateException("boom");
        }, FAST);
        start(runner);

        assertTrue(errorEvent.await(3, TimeUnit.SECONDS));
        assertTrue(runner.awaitTermination(Duration.ofSeconds(2)));
        Thread.sleep(50);
        assertEquals(1, calls.get());
        assertEquals(JobStatus.FAILED, runner.getStatus());
        assertTrue(runner.getLastError().contains("boom"));
        assertNull(runner.getLastRunTime());
    }

    @Test
    void statusFollowsSleepThenRun() throws Exception {
        List<JobStatus> seen = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(1);
        AtomicReference<JobRunner> self = new AtomicReference<>();
        listeners.add(new JobEventListener() {
            @Override
            public void onSleep(UUID jobId, LocalDateTime nextTick) {
                seen.add(self.get().getStatus());
            }

            @Override
            public void onStart(UUID jobId) {
                seen.add(self.get().getStatus());
            }
        });
        JobRunner runner = runner("* * * * *", token -> {
            done.countDown();
            throw new InterruptedException("leave");
        }, FAST);
        self.set(runner);
        assertEquals(JobStatus.SCHEDULED, runner.getStatus());
        start(runner);

        assertTrue(done.await(3, TimeUnit.SECONDS));
        assertTrue(runner.awaitTermination(Duration.ofSeconds(2)));
        assertEquals(List.of(JobStatus.SLEEPING, JobStatus.RUNNING), seen);
        assertEquals(JobStatus.STOPPED, runner.getStatus());
    }

    @Test
    void stopBeforeStartNeverRunsTask() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch stopped = new CountDownLatch(1);
        listeners.add(new JobEventListener() {
            @Override
            public void onStopped(UUID jobId) {
                stopped.countDown();
            }
        });
        JobRunner runner = runner("* * * * *", token -> calls.incrementAndGet(), FAST);
        runner.requestStop("never mind");

        assertEquals(JobStatus.STOPPED, runner.getStatus());
        assertTrue(stopped.await(1, TimeUnit.SECONDS));
        assertTrue(runner.awaitTermination(Duration.ZERO));

        runner.run();
        assertEquals(0, calls.get());
        assertEquals(JobStatus.STOPPED, runner.getStatus());
    }

    @Test
    void stopHookAndTokenReachTheTask() throws Exception {
        CountDownLatch running = new CountDownLatch(1);
        CountDownLatch hook = new CountDownLatch(1);
        AtomicReference<String> reason = new AtomicReference<>();
        JobRunner runner = runner("* * * * *", new CronTask() {
            @Override
            public void run(CancellationToken token) throws Exception {
                running.countDown();
                while (!token.isStopRequested()) {
                    Thread.onSpinWait();
                }
                reason.set(token.reason());
            }

            @Override
            public void onStopRequested() {
                hook.countDown();
            }
        }, FAST);
        start(runner);

        assertTrue(running.await(3, TimeUnit.SECONDS));
        runner.requestStop("shutdown");
        assertTrue(hook.await(1, TimeUnit.SECONDS));
        assertTrue(runner.awaitTermination(Duration.ofSeconds(2)));
        assertEquals("shutdown", reason.get());
        assertEquals(JobStatus.STOPPED, runner.getStatus());
    }

    @Test
    void throwingListenerDoesNotDisturbJob() throws Exception {
        CountDownLatch twoRuns = new CountDownLatch(2);
        listeners.add(new JobEventListener() {
            @Override
            public void onStart(UUID jobId) {
                throw new RuntimeException("listener bug");
            }
        });
        JobRunner runner = runner("* * * * *", token -> twoRuns.countDown(), FAST);
        start(runner);

        assertTrue(twoRuns.await(3, TimeUnit.SECONDS));
        assertNotEquals(JobStatus.FAILED, runner.getStatus());
    }

    /**
     * Clock that only moves when told to.
     */
    private static final class MutableClock extends Clock {
        private final AtomicReference<Instant> now;

        MutableClock(Instant start) {
            this.now = new AtomicReference<>(start);
        }

        void advance(Duration d) {
            now.updateAndGet(i -> i.plus(d));
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            throw new UnsupportedOperationException();
        }

        @Override
        public Instant instant() {
            return now.get();
        }
    }

    @Test
    void snapshotCarriesExpression() throws Exception {
        JobRunner runner = runner("@hourly", token -> {
        }, FAST);
        JobInfo info = runner.snapshot();
        assertEquals(runner.getId(), info.id);
        assertEquals("@hourly", info.cron);
        assertEquals(JobStatus.SCHEDULED, info.status);
        assertNull(info.nextTick);
        assertTrue(info.toString().contains("@hourly"));
    }
}
