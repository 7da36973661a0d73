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
package org.dbmsampler.mysql.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.dbmsampler.mysql.cache.ExpiringCache;
import org.dbmsampler.mysql.common.MetricNameBuilder;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Internal sampler metrics
 */
@Slf4j
@ApplicationScoped
public class SamplerMetrics {

    private static final String NAME_ERROR = MetricNameBuilder.samples("error");
    private static final String NAME_FETCH_DURATION = MetricNameBuilder.samples("fetch_duration");
    private static final String NAME_FETCH_ROWS = MetricNameBuilder.samples("fetch_rows");
    private static final String NAME_CYCLE_DURATION = MetricNameBuilder.samples("cycle_duration");
    private static final String NAME_EVENTS_SUBMITTED = MetricNameBuilder.samples("events_submitted");
    private static final String NAME_TRUNCATED_ROWS = MetricNameBuilder.samples("truncated_rows");
    private static final String NAME_EXPLAIN_DURATION = MetricNameBuilder.samples("explain_duration");
    private static final String NAME_INACTIVE_STOP = MetricNameBuilder.samples("collection_loop_inactive_stop");
    private static final String NAME_CACHE_SIZE = MetricNameBuilder.samples("cache_size");
    private static final String NAME_UP = MetricNameBuilder.build("up");

    private static final String TAG_TABLE = "events_statements_table";

    private final AtomicReference<Double> databaseUpGaugeValue = new AtomicReference<>(0.0);

    private final MeterRegistry registry;

    private Counter truncatedRowsCounter;
    private Counter inactiveStopCounter;
    private Timer explainDurationTimer;

    @Inject
    public SamplerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @PostConstruct
    public void init() {
        truncatedRowsCounter = Counter.builder(NAME_TRUNCATED_ROWS)
                .description("Rows dropped because their SQL text was truncated")
                .register(registry);
        inactiveStopCounter = Counter.builder(NAME_INACTIVE_STOP)
                .description("Times the collection loop stopped because the check went idle")
                .register(registry);
        explainDurationTimer = Timer.builder(NAME_EXPLAIN_DURATION)
                .description("Time spent collecting one execution plan")
                .register(registry);
        Gauge.builder(NAME_UP, databaseUpGaugeValue::get)
                .description("Whether the MySQL instance is reachable (1=up, 0=down)")
                .register(registry);
        log.info("Sampler metrics initialized");
    }

    /**
     * Increment the error counter for a failure kind, e.g. {@code sql-obfuscate}
     * or {@code explain-use-schema-SQLSyntaxErrorException}.
     *
     * @param kind Failure category
     */
    public void incrementError(String kind) {
        Counter.builder(NAME_ERROR)
                .tag("error", kind)
                .description("Statement sampler errors by kind")
                .register(registry)
                .increment();
    }

    public void recordFetch(String table, Duration duration, int rows) {
        Timer.builder(NAME_FETCH_DURATION)
                .tag("table", table)
                .description("Duration of one events_statements fetch")
                .register(registry)
                .record(duration);
        DistributionSummary.builder(NAME_FETCH_ROWS)
                .tag("table", table)
                .description("Rows returned by one events_statements fetch")
                .register(registry)
                .record(rows);
    }

    public void recordCycle(String table, Duration duration, int submitted) {
        Timer.builder(NAME_CYCLE_DURATION)
                .tag(TAG_TABLE, table)
                .description("Duration of one collection cycle")
                .register(registry)
                .record(duration);
        Counter.builder(NAME_EVENTS_SUBMITTED)
                .tag(TAG_TABLE, table)
                .description("Statement samples submitted to the sink")
                .register(registry)
                .increment(submitted);
    }

    public void incrementTruncatedRows(int count) {
        truncatedRowsCounter.increment(count);
    }

    public void incrementInactiveStop() {
        inactiveStopCounter.increment();
    }

    public void recordExplainDuration(Duration duration) {
        explainDurationTimer.record(duration);
    }

    /**
     * Expose the current size of a sampler cache as a gauge tagged with its name.
     */
    public void registerCacheSize(ExpiringCache<?, ?> cache) {
        Gauge.builder(NAME_CACHE_SIZE, cache, ExpiringCache::size)
                .tag("cache", cache.getName())
                .description("Number of entries in a sampler cache")
                .register(registry);
    }

    public void setMySqlUp(boolean up) {
        databaseUpGaugeValue.set(up ? 1.0 : 0.0);
    }
}
