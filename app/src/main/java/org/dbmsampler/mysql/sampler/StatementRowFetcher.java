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

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.dbmsampler.mysql.common.Constants;
import org.dbmsampler.mysql.metrics.SamplerMetrics;
import org.dbmsampler.mysql.model.StatementRow;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Pulls statements newer than the checkpoint from a performance_schema
 * events_statements table.
 *
 * <p>Rows come back ordered by wait time, longest first, so the most expensive
 * statements survive when the row limit cuts the batch short. The checkpoint is
 * the largest {@code timer_start} seen so far; it starts at zero, which replays
 * the whole table on the first fetch, and never moves backwards.
 */
@Slf4j
@ApplicationScoped
public class StatementRowFetcher {

    static final Set<String> KNOWN_TABLES = Set.of(
            Constants.TABLE_HISTORY_LONG,
            Constants.TABLE_HISTORY,
            Constants.TABLE_CURRENT);

    static final String EVENT_NAME_PATTERN = "statement/%";
    // does not catch every EXPLAIN spelling (comments, lower-case digests on some versions)
    static final String EXPLAIN_DIGEST_PATTERN = "EXPLAIN %";

    private static final String SQL = """
            SELECT current_schema,
                   sql_text,
                   IFNULL(digest_text, sql_text) AS digest_text,
                   timer_start,
                   UNIX_TIMESTAMP() - (SELECT VARIABLE_VALUE FROM performance_schema.global_status
                                       WHERE VARIABLE_NAME = 'UPTIME') + timer_end * 1e-12 AS timer_end_time_s,
                   timer_wait / 1000 AS timer_wait_ns,
                   lock_time / 1000 AS lock_time_ns,
                   rows_affected,
                   rows_sent,
                   rows_examined,
                   select_full_join,
                   select_full_range_join,
                   select_range,
                   select_range_check,
                   select_scan,
                   sort_merge_passes,
                   sort_range,
                   sort_rows,
                   sort_scan,
                   no_index_used,
                   no_good_index_used,
                   processlist_user,
                   processlist_host,
                   processlist_db
            FROM performance_schema.%s AS E
            LEFT JOIN performance_schema.threads AS T
                   ON E.thread_id = T.thread_id
            WHERE sql_text IS NOT NULL
              AND event_name LIKE ?
              AND (digest_text IS NULL OR digest_text NOT LIKE ?)
              AND timer_start > ?
            ORDER BY timer_wait DESC
            LIMIT ?
            """;

    private static final String DISABLE_SQL_NOTES = "SET @@SESSION.sql_notes = 0";

    private final SamplerMetrics metrics;

    private volatile BigInteger checkpoint = BigInteger.ZERO;

    @Inject
    public StatementRowFetcher(SamplerMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Fetch statements newer than the checkpoint and advance it.
     *
     * @param connection Sampler connection
     * @param table      One of the events_statements tables
     * @param rowLimit   Maximum rows to return (positive)
     * @return Rows ordered by wait time descending (never null, may be empty)
     * @throws SQLException if the query fails; the checkpoint is left untouched
     */
    public List<StatementRow> fetchNewStatements(Connection connection, String table, int rowLimit)
            throws SQLException {
        Instant start = Instant.now();
        List<StatementRow> rows = query(connection, table, rowLimit, checkpoint);
        if (rows.isEmpty()) {
            log.debug("No statements found in performance_schema.{}", table);
            return rows;
        }

        advanceCheckpoint(rows);
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(DISABLE_SQL_NOTES);
        }
        metrics.recordFetch(table, Duration.between(start, Instant.now()), rows.size());
        return rows;
    }

    /**
     * Check whether a table is populated at all. The checkpoint is neither read
     * nor advanced, so a table that was merely quiet since the last fetch still
     * counts as populated.
     */
    public boolean hasStatements(Connection connection, String table) throws SQLException {
        return !query(connection, table, 1, BigInteger.ZERO).isEmpty();
    }

    public BigInteger getCheckpoint() {
        return checkpoint;
    }

    private List<StatementRow> query(Connection connection, String table, int rowLimit, BigInteger since)
            throws SQLException {
        if (!KNOWN_TABLES.contains(table)) {
            throw new IllegalArgumentException("Unknown events_statements table: " + table);
        }
        if (rowLimit <= 0) {
            throw new IllegalArgumentException("Row limit must be positive: " + rowLimit);
        }

        log.debug("Fetching up to {} statements from performance_schema.{} after checkpoint {}",
                rowLimit, table, since);
        try (PreparedStatement ps = connection.prepareStatement(SQL.formatted(table))) {
            ps.setString(1, EVENT_NAME_PATTERN);
            ps.setString(2, EXPLAIN_DIGEST_PATTERN);
            ps.setBigDecimal(3, new BigDecimal(since));
            ps.setInt(4, rowLimit);
            try (ResultSet rs = ps.executeQuery()) {
                return readRows(rs);
            }
        }
    }

    private List<StatementRow> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData metaData = rs.getMetaData();
        int columnCount = metaData.getColumnCount();
        List<StatementRow> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> columns = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                columns.put(metaData.getColumnLabel(i).toLowerCase(Locale.ROOT), rs.getObject(i));
            }
            rows.add(StatementRow.fromColumns(columns));
        }
        return rows;
    }

    private void advanceCheckpoint(List<StatementRow> rows) {
        BigInteger max = checkpoint;
        for (StatementRow row : rows) {
            BigInteger timerStart = row.timerStart();
            if (timerStart != null && timerStart.compareTo(max) > 0) {
                max = timerStart;
            }
        }
        checkpoint = max;
    }
}
