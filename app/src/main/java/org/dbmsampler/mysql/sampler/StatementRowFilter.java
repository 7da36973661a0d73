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

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Drops rows that cannot produce a useful sample.
 *
 * <p>Rows missing a required column are skipped silently. Rows whose SQL text
 * was truncated by the server (it ends in {@code ...}) cannot be explained;
 * they are counted and reported in a single warning once the batch has been
 * fully consumed.
 */
@Slf4j
@ApplicationScoped
public class StatementRowFilter {

    private final SamplerMetrics metrics;

    @Inject
    public StatementRowFilter(SamplerMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Lazily filter a batch. Every call to {@link Iterable#iterator()} starts a
     * fresh pass with its own counters.
     *
     * @param rows Batch as fetched (never null)
     * @return Valid rows, in input order
     */
    public Iterable<StatementRow> filter(List<StatementRow> rows) {
        return () -> new ValidRowIterator(rows.iterator());
    }

    private final class ValidRowIterator implements Iterator<StatementRow> {
        private final Iterator<StatementRow> source;
        private StatementRow next;
        private int sent;
        private int truncated;
        private boolean reported;

        private ValidRowIterator(Iterator<StatementRow> source) {
            this.source = source;
        }

        @Override
        public boolean hasNext() {
            while (next == null && source.hasNext()) {
                StatementRow candidate = source.next();
                if (isValid(candidate)) {
                    next = candidate;
                }
            }
            if (next == null) {
                reportTruncated();
                return false;
            }
            return true;
        }

        @Override
        public StatementRow next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            StatementRow row = next;
            next = null;
            sent++;
            return row;
        }

        private boolean isValid(StatementRow row) {
            if (row == null || !row.isComplete()) {
                log.debug("Row was unexpectedly truncated or the events_statements table is not enabled");
                return false;
            }
            String sqlText = row.sqlText();
            if (sqlText.isEmpty()) {
                return false;
            }
            // performance_schema_max_sql_text_length cuts statements off with a marker
            if (sqlText.endsWith(Constants.TRUNCATION_MARKER)) {
                truncated++;
                return false;
            }
            return true;
        }

        private void reportTruncated() {
            if (reported || truncated == 0) {
                return;
            }
            reported = true;
            log.warn("Unable to collect {}/{} statement samples due to truncated SQL text. "
                            + "Consider raising `performance_schema_max_sql_text_length` to capture these queries.",
                    truncated, truncated + sent);
            metrics.incrementTruncatedRows(truncated);
            metrics.incrementError("truncated-sql-text");
        }
    }
}
