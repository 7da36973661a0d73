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
package org.dbmsampler.mysql.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One row of a performance_schema events_statements table joined with thread metadata.
 *
 * <p>Typed accessors cover the columns the sampler reasons about; {@link #columns()}
 * keeps every column as returned by the driver so the remainder can be passed
 * through on the emitted sample.
 *
 * @param currentSchema    Default schema of the session that ran the statement (may be null)
 * @param sqlText          Raw statement text
 * @param digestText       Normalized statement text, falls back to sqlText in the query
 * @param timerStart       Statement start in server picoseconds; monotonic ordering key
 * @param timerEndTimeS    Statement end as unix epoch seconds
 * @param timerWaitNs      Statement duration in nanoseconds
 * @param lockTimeNs       Time spent waiting on locks in nanoseconds
 * @param processlistUser  Client user
 * @param processlistHost  Client host
 * @param processlistDb    Database of the client thread
 * @param columns          All columns of the row, in query order
 */
public record StatementRow(
        String currentSchema,
        String sqlText,
        String digestText,
        BigInteger timerStart,
        Double timerEndTimeS,
        Double timerWaitNs,
        Double lockTimeNs,
        String processlistUser,
        String processlistHost,
        String processlistDb,
        Map<String, Object> columns) {

    public static final String CURRENT_SCHEMA = "current_schema";
    public static final String SQL_TEXT = "sql_text";
    public static final String DIGEST_TEXT = "digest_text";
    public static final String TIMER_START = "timer_start";
    public static final String TIMER_END_TIME_S = "timer_end_time_s";
    public static final String TIMER_WAIT_NS = "timer_wait_ns";
    public static final String LOCK_TIME_NS = "lock_time_ns";
    public static final String PROCESSLIST_USER = "processlist_user";
    public static final String PROCESSLIST_HOST = "processlist_host";
    public static final String PROCESSLIST_DB = "processlist_db";

    /**
     * Columns a row must carry to be usable. A fetch that lost any of these was
     * truncated, typically because the history consumer was disabled mid-read.
     */
    public static final Set<String> REQUIRED_COLUMNS = Set.of(
            SQL_TEXT, DIGEST_TEXT, TIMER_START, TIMER_END_TIME_S, TIMER_WAIT_NS);

    public StatementRow {
        columns = columns == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    /**
     * Build a row from raw column values keyed by column label.
     *
     * @param columns Column label to value, as read from the driver
     * @return Typed row (never null; missing columns map to null fields)
     */
    public static StatementRow fromColumns(Map<String, Object> columns) {
        return new StatementRow(
                asString(columns.get(CURRENT_SCHEMA)),
                asString(columns.get(SQL_TEXT)),
                asString(columns.get(DIGEST_TEXT)),
                asBigInteger(columns.get(TIMER_START)),
                asDouble(columns.get(TIMER_END_TIME_S)),
                asDouble(columns.get(TIMER_WAIT_NS)),
                asDouble(columns.get(LOCK_TIME_NS)),
                asString(columns.get(PROCESSLIST_USER)),
                asString(columns.get(PROCESSLIST_HOST)),
                asString(columns.get(PROCESSLIST_DB)),
                columns);
    }

    /**
     * @return true if every required column is present and non-null, and the
     * timer columns converted to numbers
     */
    public boolean isComplete() {
        for (String column : REQUIRED_COLUMNS) {
            if (columns.get(column) == null) {
                return false;
            }
        }
        return timerStart != null && timerEndTimeS != null && timerWaitNs != null;
    }

    private static String asString(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        return value.toString();
    }

    private static Double asDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static BigInteger asBigInteger(Object value) {
        if (value instanceof BigInteger bigInteger) {
            return bigInteger;
        }
        if (value instanceof BigDecimal bigDecimal) {
            return bigDecimal.toBigInteger();
        }
        if (value instanceof Number number) {
            return BigInteger.valueOf(number.longValue());
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return new BigInteger(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
