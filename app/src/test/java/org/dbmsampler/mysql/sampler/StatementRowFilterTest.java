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

import org.dbmsampler.mysql.metrics.SamplerMetrics;
import org.dbmsampler.mysql.model.StatementRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StatementRowFilterTest {

    @Mock
    private SamplerMetrics metrics;

    private StatementRowFilter filter;

    @BeforeEach
    void setUp() {
        filter = new StatementRowFilter(metrics);
    }

    private static StatementRow row(String sql) {
        Map<String, Object> columns = new HashMap<>();
        columns.put("sql_text", sql);
        columns.put("digest_text", sql);
        columns.put("timer_start", BigInteger.ONE);
        columns.put("timer_end_time_s", 1700000000.0);
        columns.put("timer_wait_ns", 10.0);
        return StatementRow.fromColumns(columns);
    }

    private static List<StatementRow> collect(Iterable<StatementRow> rows) {
        List<StatementRow> result = new ArrayList<>();
        rows.forEach(result::add);
        return result;
    }

    @Test
    void testFilter_TruncatedRows_DroppedAndReportedOnce() {
        // Setup - 10 rows, 3 of them truncated by the server
        List<StatementRow> batch = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            batch.add(row(i % 3 == 0 && i > 0 ? "SELECT * FROM big_table WHERE a IN (1, 2, ..." : "SELECT " + i));
        }

        // Execute
        List<StatementRow> valid = collect(filter.filter(batch));

        // Verify
        assertEquals(7, valid.size());
        verify(metrics).incrementTruncatedRows(3);
        verify(metrics).incrementError("truncated-sql-text");
    }

    @Test
    void testFilter_IncompleteAndEmptyRows_DroppedSilently() {
        // Setup
        Map<String, Object> partial = new HashMap<>();
        partial.put("sql_text", "SELECT 1");
        Map<String, Object> unparseable = new HashMap<>(row("SELECT 3").columns());
        unparseable.put("timer_wait_ns", "");
        List<StatementRow> batch = new ArrayList<>();
        batch.add(StatementRow.fromColumns(partial));
        batch.add(StatementRow.fromColumns(unparseable));
        batch.add(row(""));
        batch.add(null);
        batch.add(row("SELECT 2"));

        // Execute
        List<StatementRow> valid = collect(filter.filter(batch));

        // Verify
        assertEquals(1, valid.size());
        assertEquals("SELECT 2", valid.get(0).sqlText());
        verify(metrics, never()).incrementTruncatedRows(anyInt());
        verify(metrics, never()).incrementError(anyString());
    }

    @Test
    void testFilter_IsLazy() {
        // Setup
        List<StatementRow> batch = List.of(row("SELECT 1"), row("SELECT 2 ..."));

        // Execute
        Iterator<StatementRow> iterator = filter.filter(batch).iterator();
        StatementRow first = iterator.next();

        // Verify - nothing reported until the batch is exhausted
        assertEquals("SELECT 1", first.sqlText());
        verifyNoInteractions(metrics);
        assertFalse(iterator.hasNext());
        assertFalse(iterator.hasNext());
        verify(metrics, times(1)).incrementTruncatedRows(1);
    }

    @Test
    void testFilter_EachIterationIsAFreshPass() {
        // Setup
        Iterable<StatementRow> rows = filter.filter(List.of(row("SELECT 1"), row("SELECT 2")));

        // Execute & Verify
        assertEquals(2, collect(rows).size());
        assertEquals(2, collect(rows).size());
    }
}
