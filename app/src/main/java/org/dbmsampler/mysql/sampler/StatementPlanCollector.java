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
import org.dbmsampler.mysql.common.Signatures;
import org.dbmsampler.mysql.config.SamplerConfig;
import org.dbmsampler.mysql.explain.PlanCostParser;
import org.dbmsampler.mysql.explain.StatementExplainer;
import org.dbmsampler.mysql.metrics.SamplerMetrics;
import org.dbmsampler.mysql.model.SampleContext;
import org.dbmsampler.mysql.model.SampleKey;
import org.dbmsampler.mysql.model.StatementRow;
import org.dbmsampler.mysql.model.StatementSample;
import org.dbmsampler.mysql.obfuscation.SqlObfuscator;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns filtered rows into samples: obfuscates them, collects plans for
 * statement shapes not explained recently and drops (query, plan) pairs
 * already emitted within the seen-samples window.
 */
@Slf4j
@ApplicationScoped
public class StatementPlanCollector {

    /**
     * Columns promoted into named sample fields, or not worth shipping.
     */
    static final Set<String> EXCLUDED_PASSTHROUGH_COLUMNS = Set.of(
            StatementRow.SQL_TEXT,
            StatementRow.CURRENT_SCHEMA,
            StatementRow.DIGEST_TEXT,
            StatementRow.TIMER_END_TIME_S,
            "max_timer_wait_ns",
            StatementRow.TIMER_START,
            StatementRow.PROCESSLIST_HOST);

    private final StatementExplainer explainer;
    private final SqlObfuscator obfuscator;
    private final SamplerMetrics metrics;
    private final ExpiringCache<String, Boolean> explainedStatements;
    private final ExpiringCache<SampleKey, Boolean> seenSamples;

    @Inject
    public StatementPlanCollector(SamplerConfig config,
                                  StatementExplainer explainer,
                                  SqlObfuscator obfuscator,
                                  SamplerMetrics metrics) {
        this(config, explainer, obfuscator, metrics, Ticker.systemTicker());
    }

    StatementPlanCollector(SamplerConfig config,
                           StatementExplainer explainer,
                           SqlObfuscator obfuscator,
                           SamplerMetrics metrics,
                           Ticker ticker) {
        this.explainer = explainer;
        this.obfuscator = obfuscator;
        this.metrics = metrics;
        this.explainedStatements = new ExpiringCache<>("explained_statements",
                config.explainedStatementsCacheMaxsize(),
                ExpiringCache.ttlFromHourlyRate(config.explainedStatementsPerHourPerQuery()),
                ticker);
        this.seenSamples = new ExpiringCache<>("seen_samples",
                config.seenSamplesCacheMaxsize(),
                ExpiringCache.ttlFromHourlyRate(config.samplesPerHourPerQuery()),
                ticker);
        metrics.registerCacheSize(explainedStatements);
        metrics.registerCacheSize(seenSamples);
    }

    /**
     * Build samples for a batch of valid rows.
     *
     * @param connection Sampler connection used for EXPLAIN
     * @param rows       Filtered rows
     * @param context    Host, service and tags for the samples
     * @return New samples, in row order
     */
    public List<StatementSample> collectPlans(Connection connection, Iterable<StatementRow> rows,
                                              SampleContext context) {
        List<StatementSample> samples = new ArrayList<>();
        for (StatementRow row : rows) {
            StatementSample sample = collectPlan(connection, row, context);
            if (sample != null) {
                samples.add(sample);
            }
        }
        return samples;
    }

    private StatementSample collectPlan(Connection connection, StatementRow row, SampleContext context) {
        String obfuscatedStatement;
        String obfuscatedDigest;
        try {
            obfuscatedStatement = obfuscator.obfuscateSql(row.sqlText());
            obfuscatedDigest = obfuscator.obfuscateSql(row.digestText());
        } catch (RuntimeException e) {
            log.debug("Failed to obfuscate query: {}", e.getMessage());
            metrics.incrementError("sql-obfuscate");
            return null;
        }

        String querySignature = Signatures.sqlSignature(obfuscatedDigest);
        if (explainedStatements.containsKey(querySignature)) {
            return null;
        }
        // recorded before explaining so a failing statement is not retried every cycle
        explainedStatements.put(querySignature, Boolean.TRUE);

        String plan = explainer.explainSafe(connection, row.sqlText(), row.currentSchema());
        String obfuscatedPlan = null;
        String planSignature = null;
        Double planCost = null;
        if (plan != null) {
            try {
                // normalization strips cost_info, so the cost comes from the raw plan
                planCost = PlanCostParser.parseCost(plan);
                String normalizedPlan = obfuscator.obfuscateExecPlan(plan, true);
                obfuscatedPlan = obfuscator.obfuscateExecPlan(plan, false);
                planSignature = Signatures.planSignature(normalizedPlan);
            } catch (RuntimeException e) {
                log.debug("Failed to obfuscate plan for query {}: {}", obfuscatedStatement, e.getMessage());
                metrics.incrementError("plan-obfuscate");
                obfuscatedPlan = null;
                planSignature = null;
                planCost = null;
            }
        }

        SampleKey key = new SampleKey(querySignature, planSignature);
        if (seenSamples.containsKey(key)) {
            return null;
        }
        seenSamples.put(key, Boolean.TRUE);

        return new StatementSample(
                (long) (row.timerEndTimeS() * 1000),
                context.host(),
                context.service(),
                Constants.SOURCE,
                context.tags(),
                row.timerWaitNs(),
                new StatementSample.Network(new StatementSample.Client(row.processlistHost())),
                new StatementSample.Db(
                        row.currentSchema(),
                        new StatementSample.Plan(obfuscatedPlan, planCost, planSignature),
                        querySignature,
                        Signatures.sqlSignature(obfuscatedStatement),
                        obfuscatedStatement),
                passthroughColumns(row));
    }

    private static Map<String, Object> passthroughColumns(StatementRow row) {
        Map<String, Object> mysql = new LinkedHashMap<>();
        for (Map.Entry<String, Object> column : row.columns().entrySet()) {
            if (!EXCLUDED_PASSTHROUGH_COLUMNS.contains(column.getKey())) {
                mysql.put(column.getKey(), column.getValue());
            }
        }
        return mysql;
    }
}
