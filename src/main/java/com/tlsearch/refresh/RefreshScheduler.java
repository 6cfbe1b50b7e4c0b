package com.tlsearch.refresh;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tlsearch.build.BuildException;

/**
 * Rebuilds the index every night at local midnight. One long-lived task computes the next fire time,
 * waits for it, refreshes and loops until {@link #stop()}.
 */
public class RefreshScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RefreshScheduler.class);

    private final IndexRefresher refresher;
    private final Clock clock;
    private final ZoneId zone;
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicLong completedRuns = new AtomicLong();
    private ExecutorService executor;

    public RefreshScheduler(IndexRefresher refresher, Clock clock, ZoneId zone) {
        this.refresher = refresher;
        this.clock = clock;
        this.zone = zone;
    }

    public static Duration delayUntilNextMidnight(ZonedDateTime now) {
        ZonedDateTime nextMidnight = now.toLocalDate().plusDays(1).atStartOfDay(now.getZone());
        return Duration.between(now, nextMidnight);
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("scheduler already started");
        }
        executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "index-refresh-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        executor.submit(this::runLoop);
    }

    public void stop() {
        stopSignal.countDown();
        if (executor != null) {
            executor.shutdown();
        }
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return executor == null || executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        stop();
    }

    public long completedRuns() {
        return completedRuns.get();
    }

    private void runLoop() {
        while (stopSignal.getCount() > 0) {
            ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));
            Duration delay = delayUntilNextMidnight(now);
            log.info("refresh.scheduled at={} inMs={}", now.plus(delay).toOffsetDateTime(), delay.toMillis());
            try {
                if (stopSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            runScheduledRefresh();
        }
        log.info("refresh.scheduler.stopped runs={}", completedRuns.get());
    }

    void runScheduledRefresh() {
        log.info("refresh.daily.start");
        try {
            refresher.refresh("scheduled");
            log.info("refresh.daily.complete");
        } catch (BuildException e) {
            log.error("refresh.daily.failed reason={}", e.getMessage(), e);
        } catch (RefreshRejectedException e) {
            log.warn("refresh.daily.skipped reason={}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("refresh.daily.failed reason={}", e.getMessage(), e);
        } finally {
            completedRuns.incrementAndGet();
        }
    }
}
