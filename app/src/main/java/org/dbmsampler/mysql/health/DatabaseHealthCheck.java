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
package org.dbmsampler.mysql.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.dbmsampler.mysql.db.DatabaseService;
import org.dbmsampler.mysql.sampler.StatementSampler;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Liveness;

/**
 * Liveness check reporting database connectivity and sampler loop state.
 * A stopped loop is reported as data only: the next check run restarts it.
 */
@Liveness
@ApplicationScoped
public class DatabaseHealthCheck implements HealthCheck {

    private final DatabaseService databaseService;
    private final StatementSampler sampler;

    @Inject
    public DatabaseHealthCheck(DatabaseService databaseService, StatementSampler sampler) {
        this.databaseService = databaseService;
        this.sampler = sampler;
    }

    @Override
    public HealthCheckResponse call() {
        boolean connected = databaseService.testConnection();

        return HealthCheckResponse.named("mysql-connection")
                .status(connected)
                .withData("accessible", connected)
                .withData("sampler-running", sampler.isRunning())
                .build();
    }
}
