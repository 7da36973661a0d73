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
package org.dbmsampler.mysql.connection;

import io.agroal.api.AgroalDataSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Owns the sampler's dedicated connection.
 *
 * <p>The connection is opened lazily on first use and reused across cycles.
 * A closed or invalid connection is replaced on the next call. Only the
 * collection context holding the cycle lock may use it.
 */
@Slf4j
@ApplicationScoped
public class SamplerConnectionProvider {

    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final SamplerDatasourceFactory datasourceFactory;

    private AgroalDataSource dataSource;
    private Connection connection;

    @Inject
    public SamplerConnectionProvider(SamplerDatasourceFactory datasourceFactory) {
        this.datasourceFactory = datasourceFactory;
    }

    /**
     * Get the sampler connection, opening or reopening it if needed.
     *
     * @return Open connection in autocommit mode
     * @throws SQLException if no connection can be established
     */
    public synchronized Connection getConnection() throws SQLException {
        if (connection != null && isUsable(connection)) {
            return connection;
        }
        closeConnectionQuietly();
        if (dataSource == null) {
            dataSource = datasourceFactory.create();
        }
        connection = dataSource.getConnection();
        connection.setAutoCommit(true);
        log.debug("Opened sampler connection");
        return connection;
    }

    /**
     * Close the connection and its DataSource. A later {@link #getConnection()} starts over.
     */
    public synchronized void close() {
        closeConnectionQuietly();
        if (dataSource != null) {
            dataSource.close();
            dataSource = null;
            log.info("Closed sampler DataSource");
        }
    }

    private boolean isUsable(Connection conn) {
        try {
            return !conn.isClosed() && conn.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            log.debug("Sampler connection validation failed: {}", e.getMessage());
            return false;
        }
    }

    private void closeConnectionQuietly() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.debug("Error closing sampler connection: {}", e.getMessage());
        } finally {
            connection = null;
        }
    }
}
