/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *     http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.dbmsampler.mysql.sampler;

import com.google.common.base.Ticker;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.dbmsampler.mysql.common.HostUtils;
import org.dbmsampler.mysql.config.CheckConfig;
import org.dbmsampler.mysql.config.SamplerConfig;
import org.dbmsampler.mysql.connection.SamplerConnectionProvider;
import org.dbmsampler.mysql.metrics.SamplerMetrics;
import org.dbmsampler.mysql.model.CollectionStrategy;
import org.dbmsampler.mysql.model.SampleContext;
import org.dbmsampler.mysql.model.StatementRow;
import org.dbmsampler.mysql.model.StatementSample;
import org.dbmsampler.mysql.sink.SampleSink;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives statement sample collection.
 *
 * <p>Each cycle waits on the rate limiter, resolves the collection strategy,
 * fetches new rows, filters them, collects plans and submits the samples.
 * Cycles run either in a background loop, one loop at a time, or as a single
 * synchronous pass on the caller's thread.
 *
 * <p>The background loop stops on its own once the check has not called
 * {@link #runSampler(List)} for more than twice its collection interval, when
 * {@link #stop()} is called, or on the first failed cycle. The next
 * {@link #runSampler(List)} call restarts it.
 *
 * <p>Loop and synchronous passes share the caches and the sampler connection,
 * so every cycle runs under one lock. A synchronous pass that finds the lock
 * taken is skipped.
 */
@Slf4j
@ApplicationScoped
public class StatementSampler {

    private static final double INITIAL_RATE = 1.0;
    private static final String THREAD_NAME = "mysql-statement-sampler";

    private final Lock cycleLock = new ReentrantLock();
    private static final long NO_LOOP = 0L;

    private final AtomicLong loopIds = new AtomicLong();
    // id of the loop allowed to run, NO_LOOP when none
    private final AtomicLong activeLoop = new AtomicLong(NO_LOOP);

    private final SamplerConfig config;
    private final SamplerConnectionProvider connectionProvider;
    private final CollectionStrategySelector strategySelector;
    private final StatementRowFetcher rowFetcher;
    private final StatementRowFilter rowFilter;
    private final StatementPlanCollector planCollector;
    private final SampleSink sink;
    private final SamplerMetrics metrics;
    private final ConstantRateLimiter rateLimiter;
    private final ExecutorService executor;
    private final Ticker ticker;
    private final String host;
    private final long inactivityLimitNanos;

    private volatile SampleContext context;
    private volatile long lastCheckRunNanos;
    private volatile Future<?> loopFuture;

    @Inject
    public StatementSampler(SamplerConfig config,
                            CheckConfig checkConfig,
                            SamplerConnectionProvider connectionProvider,
                            CollectionStrategySelector strategySelector,
                            StatementRowFetcher rowFetcher,
                            StatementRowFilter rowFilter,
                            StatementPlanCollector planCollector,
                            SampleSink sink,
                            SamplerMetrics metrics) {
        this(config, checkConfig, connectionProvider, strategySelector, rowFetcher, rowFilter, planCollector,
                sink, metrics, Ticker.systemTicker(), ConstantRateLimiter.Sleeper.SYSTEM,
                Executors.newSingleThreadExecutor(r -> {
                    Thread thread = new Thread(r, THREAD_NAME);
                    thread.setDaemon(true);
                    return thread;
                }));
    }

    StatementSampler(SamplerConfig config,
                     CheckConfig checkConfig,
                     SamplerConnectionProvider connectionProvider,
                     CollectionStrategySelector strategySelector,
                     StatementRowFetcher rowFetcher,
                     StatementRowFilter rowFilter,
                     StatementPlanCollector planCollector,
                     SampleSink sink,
                     SamplerMetrics metrics,
                     Ticker ticker,
                     ConstantRateLimiter.Sleeper sleeper,
                     ExecutorService executor) {
        validate(config, checkConfig);
        this.config = config;
        this.connectionProvider = connectionProvider;
        this.strategySelector = strategySelector;
        this.rowFetcher = rowFetcher;
        this.rowFilter = rowFilter;
        this.planCollector = planCollector;
        this.sink = sink;
        this.metrics = metrics;
        this.ticker = ticker;
        this.executor = executor;
        this.host = HostUtils.resolveDbHost(checkConfig.host());
        this.inactivityLimitNanos = checkConfig.minCollectionInterval().multipliedBy(2).toNanos();
        double initialRate = config.collectionsPerSecond() > 0 ? config.collectionsPerSecond() : INITIAL_RATE;
        this.rateLimiter = new ConstantRateLimiter(initialRate, ticker, sleeper);
        this.context = SampleContext.of(host, checkConfig.tags().orElse(List.of()));
        this.lastCheckRunNanos = ticker.read();
    }

    /**
     * Entry point called by the check on every run.
     *
     * <p>Records check activity, then either runs one synchronous pass or makes
     * sure the background loop is running.
     *
     * @param tags Check tags for the samples
     */
    public void runSampler(List<String> tags) {
        if (!config.enabled()) {
            return;
        }
        lastCheckRunNanos = ticker.read();
        context = SampleContext.of(host, tags);

        if (config.runSync()) {
            log.debug("Running statement sampler synchronously");
            runSyncPass();
            return;
        }

        long loopId = loopIds.incrementAndGet();
        if (activeLoop.compareAndSet(NO_LOOP, loopId)) {
            log.info("Starting statement sampler collection loop");
            try {
                loopFuture = executor.submit(() -> collectionLoop(loopId));
            } catch (RuntimeException e) {
                activeLoop.compareAndSet(loopId, NO_LOOP);
                throw e;
            }
        }
    }

    /**
     * Request the background loop to stop. A wait or a blocking call in progress is interrupted.
     */
    public void stop() {
        activeLoop.set(NO_LOOP);
        Future<?> future = loopFuture;
        if (future != null) {
            future.cancel(true);
        }
    }

    @PreDestroy
    void shutdown() {
        stop();
        executor.shutdownNow();
    }

    public boolean isRunning() {
        return activeLoop.get() != NO_LOOP;
    }

    Future<?> getLoopFuture() {
        return loopFuture;
    }

    ConstantRateLimiter getRateLimiter() {
        return rateLimiter;
    }

    /**
     * @param loopId Id this loop was started with; a loop that was stopped and
     *               replaced leaves the state of its successor alone
     */
    void collectionLoop(long loopId) {
        try {
            while (activeLoop.get() == loopId && !Thread.currentThread().isInterrupted()) {
                if (isCheckInactive()) {
                    log.info("Sampler collection loop stopping due to check inactivity");
                    metrics.incrementInactiveStop();
                    break;
                }
                cycleLock.lock();
                try {
                    runCycle();
                } finally {
                    cycleLock.unlock();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Statement sampler collection loop cancelled");
        } catch (Exception e) {
            log.error("Statement sampler collection loop crashed: {}", e.getMessage(), e);
            metrics.incrementError("collection-loop-failure-" + e.getClass().getSimpleName());
        } finally {
            activeLoop.compareAndSet(loopId, NO_LOOP);
            closeConnection();
            log.info("Stopped statement sampler collection loop");
        }
    }

    void runSyncPass() {
        if (!cycleLock.tryLock()) {
            log.debug("Collection cycle already in progress, skipping synchronous pass");
            return;
        }
        try {
            runCycle();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Synchronous statement sampler pass interrupted");
        } catch (Exception e) {
            log.error("Synchronous statement sampler pass failed: {}", e.getMessage(), e);
            metrics.incrementError("collection-loop-failure-" + e.getClass().getSimpleName());
        } finally {
            cycleLock.unlock();
        }
    }

    /**
     * One collection cycle. The caller holds the cycle lock.
     */
    void runCycle() throws SQLException, InterruptedException {
        rateLimiter.await();
        long start = ticker.read();

        Connection connection = connectionProvider.getConnection();
        CollectionStrategy strategy = strategySelector.select(connection);
        if (strategy == null) {
            return;
        }
        if (rateLimiter.getRate() != strategy.rateLimit()) {
            log.debug("Updating collection rate to {} per second", strategy.rateLimit());
            rateLimiter.setRate(strategy.rateLimit());
        }

        List<StatementRow> rows = rowFetcher.fetchNewStatements(
                connection, strategy.table(), config.eventsStatementsRowLimit());
        if (rows.isEmpty()) {
            // the cached table may have been disabled since it was chosen
            strategySelector.invalidate();
        }
        List<StatementSample> samples = planCollector.collectPlans(connection, rowFilter.filter(rows), context);
        int submitted = samples.isEmpty() ? 0 : sink.submit(samples);

        Duration elapsed = Duration.ofNanos(ticker.read() - start);
        metrics.recordCycle(strategy.table(), elapsed, submitted);
        log.debug("Collected {} statement samples from {} rows of {} in {} ms",
                submitted, rows.size(), strategy.table(), elapsed.toMillis());
    }

    private boolean isCheckInactive() {
        return ticker.read() - lastCheckRunNanos > inactivityLimitNanos;
    }

    private void closeConnection() {
        cycleLock.lock();
        try {
            connectionProvider.close();
        } finally {
            cycleLock.unlock();
        }
    }

    private static void validate(SamplerConfig config, CheckConfig checkConfig) {
        double rate = config.collectionsPerSecond();
        if (rate <= 0 && rate != -1) {
            throw new IllegalArgumentException("collections-per-second must be positive or -1: " + rate);
        }
        if (config.eventsStatementsRowLimit() <= 0) {
            throw new IllegalArgumentException(
                    "events-statements-row-limit must be positive: " + config.eventsStatementsRowLimit());
        }
        Duration interval = checkConfig.minCollectionInterval();
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("min-collection-interval must be positive: " + interval);
        }
    }
}
