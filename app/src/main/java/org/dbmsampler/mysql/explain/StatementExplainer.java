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
package org.dbmsampler.mysql.explain;

import com.google.common.base.Ticker;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.dbmsampler.mysql.cache.ExpiringCache;
import org.dbmsampler.mysql.config.SamplerConfig;
import org.dbmsampler.mysql.metrics.SamplerMetrics;
import org.dbmsampler.mysql.model.ExplainStrategy;
import org.dbmsampler.mysql.model.ExplainStrategyRecord;
import org.dbmsampler.mysql.obfuscation.SqlObfuscator;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Collects execution plans, remembering per schema which mechanism works.
 *
 * <p>Per schema the explainer moves through these states, kept in the strategy cache:
 * <ul>
 *   <li>untried: no cache entry, every enabled mechanism is tried in preference order</li>
 *   <li>working: the last successful mechanism is tried first, the others follow</li>
 *   <li>failed: a non-retryable error was seen, nothing is tried until the entry expires</li>
 * </ul>
 *
 * <p>Statements are explained on the sampler's dedicated connection. Selecting the
 * statement's schema changes that connection's default database, which the
 * fully qualified performance_schema queries do not depend on.
 */
@Slf4j
@ApplicationScoped
public class StatementExplainer {

    static final Set<String> VALID_EXPLAIN_STATEMENTS = Set.of(
            "select", "table", "delete", "insert", "replace", "update");

    private static final Pattern PROCEDURE_NAME = Pattern.compile("[A-Za-z0-9_$]+(\\.[A-Za-z0-9_$]+)?");
    private static final String NO_SCHEMA_KEY = "";

    private final SqlErrorClassifier errorClassifier;
    private final SqlObfuscator obfuscator;
    private final SamplerMetrics metrics;
    private final ExpiringCache<String, ExplainStrategyRecord> strategyCache;
    private final List<ExplainStrategy> preferredStrategies;
    private final String explainProcedure;
    private final String fullyQualifiedExplainProcedure;
    private final Ticker ticker;

    @Inject
    public StatementExplainer(SamplerConfig config,
                              SqlErrorClassifier errorClassifier,
                              SqlObfuscator obfuscator,
                              SamplerMetrics metrics) {
        this(config, errorClassifier, obfuscator, metrics, Ticker.systemTicker());
    }

    StatementExplainer(SamplerConfig config,
                       SqlErrorClassifier errorClassifier,
                       SqlObfuscator obfuscator,
                       SamplerMetrics metrics,
                       Ticker ticker) {
        this.errorClassifier = errorClassifier;
        this.obfuscator = obfuscator;
        this.metrics = metrics;
        this.ticker = ticker;
        this.explainProcedure = validateProcedureName(config.explainProcedure());
        this.fullyQualifiedExplainProcedure = validateProcedureName(config.fullyQualifiedExplainProcedure());
        this.preferredStrategies = buildPreferredStrategies();
        this.strategyCache = new ExpiringCache<>("explain_strategy",
                config.collectionStrategyCacheMaxsize(),
                config.collectionStrategyCacheTtl(),
                ticker);
        metrics.registerCacheSize(strategyCache);
        log.info("Explain strategies in preference order: {}", preferredStrategies);
    }

    /**
     * Explain a statement, never throwing.
     *
     * <p>Database errors are classified and recorded per schema; any other
     * failure is logged and counted, and the row simply goes without a plan.
     *
     * @param connection Sampler connection
     * @param statement  Raw statement text
     * @param schema     Schema the statement ran in (may be null)
     * @return Raw JSON plan, or null if none could be collected
     */
    public String explainSafe(Connection connection, String statement, String schema) {
        long start = ticker.read();
        try {
            String plan = explain(connection, statement, schema);
            metrics.recordExplainDuration(Duration.ofNanos(ticker.read() - start));
            return plan;
        } catch (Exception e) {
            metrics.incrementError("explain-" + e.getClass().getSimpleName());
            log.error("Failed to run explain on query {}: {}", safeObfuscate(statement), e.getMessage(), e);
            return null;
        }
    }

    /**
     * Try the enabled mechanisms for the statement's schema.
     *
     * @return Raw JSON plan, or null if the statement cannot be explained or every mechanism failed
     */
    String explain(Connection connection, String statement, String schema) {
        String obfuscatedStatement = safeObfuscate(statement);
        String cacheKey = schema != null ? schema : NO_SCHEMA_KEY;

        if (!canExplain(statement)) {
            log.debug("Skipping statement which cannot be explained: {}", obfuscatedStatement);
            return null;
        }

        ExplainStrategyRecord cached = strategyCache.get(cacheKey);
        if (cached != null && cached.failed()) {
            log.debug("Skipping statement due to cached collection failure: {}", obfuscatedStatement);
            return null;
        }

        try (Statement stmt = connection.createStatement()) {
            // unqualified table names in the statement resolve against its original schema
            if (schema != null && !schema.isEmpty()) {
                stmt.execute("USE " + quoteIdentifier(schema));
            }
            log.debug("Using schema={}", schema);
        } catch (SQLException e) {
            if (errorClassifier.isNonRetryable(e)) {
                strategyCache.put(cacheKey, ExplainStrategyRecord.permanentlyFailed());
            }
            metrics.incrementError("explain-use-schema-" + e.getClass().getSimpleName());
            log.debug("Failed to collect execution plan because schema could not be accessed. "
                            + "error={} ({}), schema={}, statement=\"{}\"",
                    e.getErrorCode(), e.getMessage(), schema, obfuscatedStatement);
            return null;
        }

        for (ExplainStrategy strategy : strategiesFor(cached)) {
            try {
                String plan = runStrategy(connection, strategy, statement);
                if (plan != null) {
                    strategyCache.put(cacheKey, ExplainStrategyRecord.working(strategy));
                    log.debug("Successfully collected execution plan. strategy={}, schema={}, statement=\"{}\"",
                            strategy, schema, obfuscatedStatement);
                    return plan;
                }
                log.debug("Explain returned no plan. strategy={}, schema={}", strategy, schema);
            } catch (SQLException e) {
                metrics.incrementError("explain-attempt-" + strategy + "-" + e.getClass().getSimpleName());
                log.debug("Failed to collect execution plan. error={} ({}), strategy={}, schema={}, statement=\"{}\"",
                        e.getErrorCode(), e.getMessage(), strategy, schema, obfuscatedStatement);
                if (errorClassifier.isNonRetryable(e)) {
                    strategyCache.put(cacheKey, ExplainStrategyRecord.permanentlyFailed());
                    return null;
                }
            }
        }
        return null;
    }

    /**
     * Whether the statement's leading keyword is one EXPLAIN accepts.
     */
    static boolean canExplain(String statement) {
        if (statement == null) {
            return false;
        }
        String trimmed = statement.strip();
        int end = 0;
        while (end < trimmed.length() && !Character.isWhitespace(trimmed.charAt(end)) && trimmed.charAt(end) != '(') {
            end++;
        }
        return VALID_EXPLAIN_STATEMENTS.contains(trimmed.substring(0, end).toLowerCase(Locale.ROOT));
    }

    List<ExplainStrategy> getPreferredStrategies() {
        return Collections.unmodifiableList(preferredStrategies);
    }

    ExpiringCache<String, ExplainStrategyRecord> getStrategyCache() {
        return strategyCache;
    }

    private List<ExplainStrategy> strategiesFor(ExplainStrategyRecord cached) {
        List<ExplainStrategy> strategies = new ArrayList<>(preferredStrategies);
        if (cached != null && cached.strategy() != null && strategies.remove(cached.strategy())) {
            strategies.add(0, cached.strategy());
        }
        return strategies;
    }

    private String runStrategy(Connection connection, ExplainStrategy strategy, String statement) throws SQLException {
        return switch (strategy) {
            case STATEMENT -> runExplain(connection, statement);
            case PROCEDURE -> runExplainProcedure(connection, explainProcedure, statement);
            case FQ_PROCEDURE -> runExplainProcedure(connection, fullyQualifiedExplainProcedure, statement);
        };
    }

    private String runExplain(Connection connection, String statement) throws SQLException {
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("EXPLAIN FORMAT=json " + statement)) {
            return rs.next() ? rs.getString(1) : null;
        }
    }

    private String runExplainProcedure(Connection connection, String procedure, String statement) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement("CALL " + procedure + "(?)")) {
            ps.setString(1, statement);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    private List<ExplainStrategy> buildPreferredStrategies() {
        List<ExplainStrategy> strategies = new ArrayList<>();
        strategies.add(ExplainStrategy.STATEMENT);
        if (explainProcedure != null) {
            strategies.add(ExplainStrategy.PROCEDURE);
        }
        if (fullyQualifiedExplainProcedure != null) {
            strategies.add(ExplainStrategy.FQ_PROCEDURE);
        }
        return strategies;
    }

    private String safeObfuscate(String statement) {
        try {
            return obfuscator.obfuscateSql(statement);
        } catch (RuntimeException e) {
            return "<unable to obfuscate>";
        }
    }

    /**
     * @return the trimmed name, or null if blank (mechanism disabled)
     * @throws IllegalArgumentException if the name is not a plain or schema-qualified identifier
     */
    static String validateProcedureName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        String trimmed = name.trim();
        if (!PROCEDURE_NAME.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("Invalid explain procedure name: " + name);
        }
        return trimmed;
    }

    static String quoteIdentifier(String identifier) {
        return "`" + identifier.replace("`", "``") + "`";
    }
}
