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

import com.google.common.testing.FakeTicker;
import org.dbmsampler.mysql.common.Signatures;
import org.dbmsampler.mysql.config.SamplerConfig;
import org.dbmsampler.mysql.explain.StatementExplainer;
import org.dbmsampler.mysql.metrics.SamplerMetrics;
import org.dbmsampler.mysql.model.SampleContext;
import org.dbmsampler.mysql.model.StatementRow;
import org.dbmsampler.mysql.model.StatementSample;
import org.dbmsampler.mysql.obfuscation.ObfuscationException;
import org.dbmsampler.mysql.obfuscation.SqlObfuscator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Connection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StatementPlanCollectorTest {

    private static final String PLAN = "{\"query_block\":{\"cost_info\":{\"query_cost\":\"1.20\"}}}";
    private static final SampleContext CONTEXT = new SampleContext("db-1", "orders", "env:prod,service:orders");

    @Mock
    private SamplerConfig config;

    @Mock
    private StatementExplainer explainer;

    @Mock
    private SqlObfuscator obfuscator;

    @Mock
    private SamplerMetrics metrics;

    @Mock
    private Connection connection;

    private FakeTicker ticker;
    private StatementPlanCollector collector;

    @BeforeEach
    void setUp() {
        ticker = new FakeTicker();
        lenient().when(config.explainedStatementsCacheMaxsize()).thenReturn(5000);
        lenient().when(config.explainedStatementsPerHourPerQuery()).thenReturn(60.0);
        lenient().when(config.seenSamplesCacheMaxsize()).thenReturn(10000);
        lenient().when(config.samplesPerHourPerQuery()).thenReturn(15.0);
        lenient().when(obfuscator.obfuscateSql(anyString())).thenAnswer(inv -> "obf(" + inv.getArgument(0) + ")");
        lenient().when(obfuscator.obfuscateExecPlan(PLAN, true)).thenReturn("normalized");
        lenient().when(obfuscator.obfuscateExecPlan(PLAN, false)).thenReturn("obfuscated");

        collector = new StatementPlanCollector(config, explainer, obfuscator, metrics, ticker);
    }

    private static StatementRow row(String sql, String digest) {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("current_schema", "shop");
        columns.put("sql_text", sql);
        columns.put("digest_text", digest);
        columns.put("timer_start", BigInteger.valueOf(42));
        columns.put("timer_end_time_s", new BigDecimal("1700000000.5"));
        columns.put("timer_wait_ns", new BigDecimal("2500.0"));
        columns.put("lock_time_ns", new BigDecimal("100.0"));
        columns.put("rows_examined", 7L);
        columns.put("processlist_user", "app");
        columns.put("processlist_host", "10.0.0.7");
        return StatementRow.fromColumns(columns);
    }

    @Test
    void testCollectPlans_BuildsSample() {
        // Setup
        when(explainer.explainSafe(connection, "SELECT 1", "shop")).thenReturn(PLAN);

        // Execute
        List<StatementSample> samples = collector.collectPlans(connection, List.of(row("SELECT 1", "SELECT ?")), CONTEXT);

        // Verify
        assertEquals(1, samples.size());
        StatementSample sample = samples.get(0);
        assertEquals(1700000000500L, sample.timestamp());
        assertEquals("db-1", sample.host());
        assertEquals("orders", sample.service());
        assertEquals("mysql", sample.source());
        assertEquals("env:prod,service:orders", sample.tags());
        assertEquals(2500.0, sample.duration());
        assertEquals("10.0.0.7", sample.network().client().ip());

        StatementSample.Db db = sample.db();
        assertEquals("shop", db.instance());
        assertEquals("obf(SELECT 1)", db.statement());
        assertEquals(Signatures.sqlSignature("obf(SELECT ?)"), db.querySignature());
        assertEquals(Signatures.sqlSignature("obf(SELECT 1)"), db.resourceHash());
        assertEquals("obfuscated", db.plan().definition());
        assertEquals(Signatures.planSignature("normalized"), db.plan().signature());
        assertEquals(1.2, db.plan().cost(), 1e-9);

        assertEquals(Map.of("lock_time_ns", 100.0, "rows_examined", 7L, "processlist_user", "app",
                "timer_wait_ns", 2500.0), normalizeNumbers(sample.mysql()));
    }

    private static Map<String, Object> normalizeNumbers(Map<String, Object> mysql) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        mysql.forEach((k, v) -> normalized.put(k, v instanceof BigDecimal d ? d.doubleValue() : v));
        return normalized;
    }

    @Test
    void testCollectPlans_SameQueryWithinWindow_ExplainedOnce() {
        // Setup
        when(explainer.explainSafe(any(), anyString(), anyString())).thenReturn(PLAN);

        // Execute
        List<StatementSample> first = collector.collectPlans(connection,
                List.of(row("SELECT 1", "SELECT ?"), row("SELECT 2", "SELECT ?")), CONTEXT);
        ticker.advance(59, TimeUnit.SECONDS);
        List<StatementSample> second = collector.collectPlans(connection,
                List.of(row("SELECT 3", "SELECT ?")), CONTEXT);

        // Verify
        assertEquals(1, first.size());
        assertTrue(second.isEmpty());
        verify(explainer, times(1)).explainSafe(any(), anyString(), anyString());
    }

    @Test
    void testCollectPlans_SamePlanPairEmittedOncePerSeenWindow() {
        // Setup
        when(explainer.explainSafe(any(), anyString(), anyString())).thenReturn(PLAN);
        List<StatementRow> batch = List.of(row("SELECT 1", "SELECT ?"));

        // Execute & Verify
        assertEquals(1, collector.collectPlans(connection, batch, CONTEXT).size());

        // explain window (60s) over, seen window (240s) still open
        ticker.advance(60, TimeUnit.SECONDS);
        assertTrue(collector.collectPlans(connection, batch, CONTEXT).isEmpty());

        ticker.advance(180, TimeUnit.SECONDS);
        assertEquals(1, collector.collectPlans(connection, batch, CONTEXT).size());

        verify(explainer, times(3)).explainSafe(any(), anyString(), anyString());
    }

    @Test
    void testCollectPlans_DifferentPlanForSameQuery_EmittedAgain() {
        // Setup
        String otherPlan = "{\"query_block\":{\"table\":{}}}";
        when(explainer.explainSafe(any(), anyString(), anyString())).thenReturn(PLAN, otherPlan);
        when(obfuscator.obfuscateExecPlan(otherPlan, true)).thenReturn("normalized-2");
        when(obfuscator.obfuscateExecPlan(otherPlan, false)).thenReturn("obfuscated-2");
        List<StatementRow> batch = List.of(row("SELECT 1", "SELECT ?"));

        // Execute
        List<StatementSample> first = collector.collectPlans(connection, batch, CONTEXT);
        ticker.advance(60, TimeUnit.SECONDS);
        List<StatementSample> second = collector.collectPlans(connection, batch, CONTEXT);

        // Verify
        assertEquals(1, first.size());
        assertEquals(1, second.size());
        assertEquals(0.0, second.get(0).db().plan().cost());
    }

    @Test
    void testCollectPlans_ObfuscationFails_RowSkipped() {
        // Setup
        when(obfuscator.obfuscateSql("SELECT 'oops")).thenThrow(new ObfuscationException("unterminated"));

        // Execute
        List<StatementSample> samples = collector.collectPlans(connection,
                List.of(row("SELECT 'oops", "SELECT ?")), CONTEXT);

        // Verify
        assertTrue(samples.isEmpty());
        verify(metrics).incrementError("sql-obfuscate");
        verifyNoInteractions(explainer);
    }

    @Test
    void testCollectPlans_PlanObfuscationFails_SampleWithoutPlan() {
        // Setup
        when(explainer.explainSafe(connection, "SELECT 1", "shop")).thenReturn("{broken");
        when(obfuscator.obfuscateExecPlan("{broken", true)).thenThrow(new ObfuscationException("bad json"));

        // Execute
        List<StatementSample> samples = collector.collectPlans(connection,
                List.of(row("SELECT 1", "SELECT ?")), CONTEXT);

        // Verify
        assertEquals(1, samples.size());
        StatementSample.Plan plan = samples.get(0).db().plan();
        assertNull(plan.definition());
        assertNull(plan.signature());
        assertNull(plan.cost());
        verify(metrics).incrementError("plan-obfuscate");
    }

    @Test
    void testCollectPlans_SecondPlanPassFails_NoCostWithoutPlan() {
        // Setup
        String plan = "{\"query_block\": {\"cost_info\": {\"query_cost\": \"12.50\"}}}";
        when(explainer.explainSafe(connection, "SELECT 1", "shop")).thenReturn(plan);
        when(obfuscator.obfuscateExecPlan(plan, true)).thenReturn("{}");
        when(obfuscator.obfuscateExecPlan(plan, false)).thenThrow(new ObfuscationException("bad json"));

        // Execute
        List<StatementSample> samples = collector.collectPlans(connection,
                List.of(row("SELECT 1", "SELECT ?")), CONTEXT);

        // Verify
        assertEquals(1, samples.size());
        StatementSample.Plan emitted = samples.get(0).db().plan();
        assertNull(emitted.definition());
        assertNull(emitted.signature());
        assertNull(emitted.cost());
        verify(metrics).incrementError("plan-obfuscate");
    }

    @Test
    void testCollectPlans_NoPlan_SampleStillEmitted() {
        // Setup
        when(explainer.explainSafe(connection, "SELECT 1", "shop")).thenReturn(null);

        // Execute
        List<StatementSample> samples = collector.collectPlans(connection,
                List.of(row("SELECT 1", "SELECT ?")), CONTEXT);

        // Verify
        assertEquals(1, samples.size());
        assertNull(samples.get(0).db().plan().definition());
        verify(obfuscator, never()).obfuscateExecPlan(anyString(), anyBoolean());
        verify(metrics, never()).incrementError(anyString());
    }

    @Test
    void testConstructor_InvalidHourlyRate_ThrowsException() {
        when(config.samplesPerHourPerQuery()).thenReturn(0.0);

        assertThrows(IllegalArgumentException.class,
                () -> new StatementPlanCollector(config, explainer, obfuscator, metrics, ticker));
    }
}
