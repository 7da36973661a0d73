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
import io.agroal.api.configuration.supplier.AgroalPropertiesReader;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Factory for the sampler's dedicated DataSource.
 *
 * <p>The sampler runs on its own connection so that {@code USE <schema>} and
 * session settings never leak into the pooled connections of the host check.
 * The DataSource is configured with:
 * <ul>
 *   <li>A single connection</li>
 *   <li>Short max lifetime (5 minutes) to avoid stale connections</li>
 *   <li>The same JDBC URL and credentials as the default datasource</li>
 * </ul>
 */
@Slf4j
@ApplicationScoped
public class SamplerDatasourceFactory {

    static final int CONNECTION_POOL_SIZE = 1;
    static final int CONNECTION_MAX_LIFETIME_SECONDS = 300;

    @ConfigProperty(name = "quarkus.datasource.jdbc.url")
    String jdbcUrl;

    @ConfigProperty(name = "quarkus.datasource.username")
    Optional<String> username;

    @ConfigProperty(name = "quarkus.datasource.password")
    Optional<String> password;

    /**
     * Create the sampler DataSource.
     *
     * @return Configured single-connection AgroalDataSource
     * @throws SQLException If DataSource creation fails
     */
    public AgroalDataSource create() throws SQLException {
        try {
            AgroalDataSource dataSource = AgroalDataSource.from(
                    new AgroalPropertiesReader().readProperties(buildProperties()).get()
            );
            log.debug("Created sampler DataSource with pool size {}", CONNECTION_POOL_SIZE);
            return dataSource;
        } catch (SQLException e) {
            log.error("Failed to create sampler DataSource: {}", e.getMessage());
            throw e;
        }
    }

    Map<String, String> buildProperties() {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalStateException("quarkus.datasource.jdbc.url is not configured");
        }
        Map<String, String> props = new HashMap<>();
        props.put(AgroalPropertiesReader.JDBC_URL, jdbcUrl);
        username.ifPresent(u -> props.put(AgroalPropertiesReader.PRINCIPAL, u));
        password.ifPresent(p -> props.put(AgroalPropertiesReader.CREDENTIAL, p));
        props.put(AgroalPropertiesReader.MAX_SIZE, String.valueOf(CONNECTION_POOL_SIZE));
        props.put(AgroalPropertiesReader.MIN_SIZE, "0");
        props.put(AgroalPropertiesReader.INITIAL_SIZE, "0");
        props.put(AgroalPropertiesReader.MAX_LIFETIME_S, String.valueOf(CONNECTION_MAX_LIFETIME_SECONDS));
        return props;
    }
}
