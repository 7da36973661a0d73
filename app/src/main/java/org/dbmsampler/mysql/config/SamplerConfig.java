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
package org.dbmsampler.mysql.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Optional;

/**
 * Configuration of the statement sampler engine.
 */
@ConfigMapping(prefix = "app.statement-samples")
public interface SamplerConfig {

    @WithDefault("false")
    boolean enabled();

    /**
     * Run a single synchronous pass on every check run instead of a background loop.
     */
    @WithDefault("false")
    boolean runSync();

    /**
     * Try to enable disabled performance_schema statement consumers.
     * Requires UPDATE on performance_schema.setup_consumers.
     */
    @WithDefault("false")
    boolean autoEnableEventsStatementsConsumers();

    /**
     * Collections per second. Any positive value overrides the per-table default;
     * a negative value means "use the table default".
     */
    @WithDefault("-1")
    double collectionsPerSecond();

    @WithDefault("5000")
    int eventsStatementsRowLimit();

    /**
     * Pin collection to one events_statements table instead of walking the preference order.
     */
    Optional<String> eventsStatementsTable();

    /**
     * Definer-scoped explain procedure. Blank disables the mechanism.
     */
    @WithDefault("explain_statement")
    String explainProcedure();

    /**
     * Fully qualified explain procedure. Blank disables the mechanism.
     */
    @WithDefault("datadog.explain_statement")
    String fullyQualifiedExplainProcedure();

    @WithDefault("1000")
    int collectionStrategyCacheMaxsize();

    @WithDefault("300s")
    Duration collectionStrategyCacheTtl();

    @WithDefault("5000")
    int explainedStatementsCacheMaxsize();

    /**
     * How often the same query signature may be explained; cache TTL is one hour divided by this value.
     */
    @WithDefault("60")
    double explainedStatementsPerHourPerQuery();

    @WithDefault("10000")
    int seenSamplesCacheMaxsize();

    /**
     * How often the same (query, plan) pair may be emitted; cache TTL is one hour divided by this value.
     */
    @WithDefault("15")
    double samplesPerHourPerQuery();
}
