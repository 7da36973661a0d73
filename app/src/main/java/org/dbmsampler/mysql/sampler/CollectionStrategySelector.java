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
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.dbmsampler.mysql.cache.ExpiringCache;
import org.dbmsampler.mysql.common.Constants;
import org.dbmsampler.mysql.config.SamplerConfig;
import org.dbmsampler.mysql.metrics.SamplerMetrics;
import org.dbmsampler.mysql.model.CollectionStrategy;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which events_statements table to poll and at what rate.
 *
 * <p>Tables are tried in preference order:
 * <ol>
 *   <li>{@code events_statements_history_long}: longest history across all threads</li>
 *   <li>{@code events_statements_history}: recent statements, lost when the thread exits</li>
 *   <li>{@code events_statements_current}: in-flight statements only, last resort for short-lived sessions</li>
 * </ol>
 * The first enabled table holding at least one statement wins. The decision is
 * cached so that later cycles cost nothing until it expires, which keeps
 * topology changes (a replica promoted to primary) visible within one TTL.
 */
@Slf4j
@ApplicationScoped
public class CollectionStrategySelector {

    /**
     * Default collections per second per table.
     */
    static final Map<String, Double> DEFAULT_COLLECTIONS_PER_SECOND;

    static {
        Map<String, Double> defaults = new LinkedHashMap<>();
        defaults.put(Constants.TABLE_HISTORY_LONG, 1.0 / 10);
        defaults.put(Constants.TABLE_HISTORY, 1.0 / 10);
        defaults.put(Constants.TABLE_CURRENT, 1.0);
        DEFAULT_COLLECTIONS_PER_SECOND = Collections.unmodifiableMap(defaults);
    }

    static final List<String> PREFERRED_TABLES = List.copyOf(DEFAULT_COLLECTIONS_PER_SECOND.keySet());

    private static final String CACHE_KEY = "plan_collection_strategy";
    private static final int ER_OPTION_PREVENTS_STATEMENT = 1290;

    private static final String ENABLED_CONSUMERS_SQL =
            "SELECT name FROM performance_schema.setup_consumers WHERE enabled = 'YES'";
    private static final String ENABLE_CONSUMER_SQL =
            "UPDATE performance_schema.setup_consumers SET enabled = 'YES' WHERE name = ?";

    private final SamplerConfig config;
    private final StatementRowFetcher fetcher;
    private final List<String> preferredTables;
    private final ExpiringCache<String, CollectionStrategy> strategyCache;

    @Inject
    public CollectionStrategySelector(SamplerConfig config, StatementRowFetcher fetcher, SamplerMetrics metrics) {
        this(config, fetcher, metrics, Ticker.systemTicker());
    }

    CollectionStrategySelector(SamplerConfig config, StatementRowFetcher fetcher, SamplerMetrics metrics,
                               Ticker ticker) {
        this.config = config;
        this.fetcher = fetcher;
        this.preferredTables = resolvePreferredTables(config.eventsStatementsTable());
        this.strategyCache = new ExpiringCache<>("collection_strategy",
                config.collectionStrategyCacheMaxsize(),
                config.collectionStrategyCacheTtl(),
                ticker);
        metrics.registerCacheSize(strategyCache);
    }

    /**
     * Resolve the table and rate for the next cycle.
     *
     * @param connection Sampler connection
     * @return Strategy, or null if no table is usable right now
     * @throws SQLException if the enabled consumers cannot be read or a probe fails
     */
    public CollectionStrategy select(Connection connection) throws SQLException {
        CollectionStrategy cached = strategyCache.get(CACHE_KEY);
        if (cached != null) {
            log.debug("Using cached collection strategy: {}", cached);
            return cached;
        }

        Set<String> enabledConsumers = fetchEnabledConsumers(connection);
        for (String table : preferredTables) {
            if (!enabledConsumers.contains(table)) {
                if (!config.autoEnableEventsStatementsConsumers()) {
                    log.debug("performance_schema consumer for table {} not enabled", table);
                    continue;
                }
                if (!enableConsumer(connection, table)) {
                    continue;
                }
            }
            if (!fetcher.hasStatements(connection, table)) {
                log.debug("No statements found in {}", table);
                continue;
            }

            double rate = config.collectionsPerSecond() > 0
                    ? config.collectionsPerSecond()
                    : DEFAULT_COLLECTIONS_PER_SECOND.get(table);
            CollectionStrategy strategy = new CollectionStrategy(table, rate);
            log.debug("Chosen collection strategy: events_statements_table={}, rate_limit={}", table, rate);
            strategyCache.put(CACHE_KEY, strategy);
            return strategy;
        }

        log.info("No valid performance_schema.events_statements table found. Cannot collect statement samples.");
        return null;
    }

    /**
     * Drop the cached decision so the next {@link #select(Connection)} re-probes the tables.
     */
    public void invalidate() {
        strategyCache.remove(CACHE_KEY);
    }

    List<String> getPreferredTables() {
        return preferredTables;
    }

    private Set<String> fetchEnabledConsumers(Connection connection) throws SQLException {
        Set<String> enabled = new HashSet<>();
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(ENABLED_CONSUMERS_SQL)) {
            while (rs.next()) {
                enabled.add(rs.getString(1));
            }
        }
        log.debug("Loaded enabled consumers: {}", enabled);
        return enabled;
    }

    private boolean enableConsumer(Connection connection, String name) {
        try (PreparedStatement ps = connection.prepareStatement(ENABLE_CONSUMER_SQL)) {
            ps.setString(1, name);
            ps.executeUpdate();
            log.debug("Successfully enabled performance_schema consumer {}", name);
            return true;
        } catch (SQLException e) {
            if (e.getErrorCode() == ER_OPTION_PREVENTS_STATEMENT) {
                log.debug("Failed to enable performance_schema consumer {}: server is read-only", name);
            } else {
                log.debug("Failed to enable performance_schema consumer {}: {}", name, e.getMessage());
            }
            return false;
        }
    }

    private static List<String> resolvePreferredTables(Optional<String> configuredTable) {
        if (configuredTable.isEmpty() || configuredTable.get().isBlank()) {
            return PREFERRED_TABLES;
        }
        String table = configuredTable.get().trim();
        if (DEFAULT_COLLECTIONS_PER_SECOND.containsKey(table)) {
            log.info("Using configured events_statements_table: {}", table);
            return List.of(table);
        }
        log.warn("Invalid events_statements_table: {}. Must be one of {}",
                table, String.join(", ", PREFERRED_TABLES));
        return PREFERRED_TABLES;
    }
}
