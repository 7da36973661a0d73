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

import org.dbmsampler.mysql.db.DatabaseService;
import org.dbmsampler.mysql.sampler.StatementSampler;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DatabaseHealthCheckTest {

    @Mock
    private DatabaseService databaseService;

    @Mock
    private StatementSampler sampler;

    @InjectMocks
    private DatabaseHealthCheck healthCheck;

    @Test
    void testCall_Connected_Up() {
        // Setup
        when(databaseService.testConnection()).thenReturn(true);
        when(sampler.isRunning()).thenReturn(true);

        // Execute
        HealthCheckResponse response = healthCheck.call();

        // Verify
        assertEquals("mysql-connection", response.getName());
        assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
        assertEquals(Boolean.TRUE, response.getData().orElseThrow().get("sampler-running"));
    }

    @Test
    void testCall_Disconnected_Down() {
        // Setup
        when(databaseService.testConnection()).thenReturn(false);
        when(sampler.isRunning()).thenReturn(false);

        // Execute
        HealthCheckResponse response = healthCheck.call();

        // Verify
        assertEquals(HealthCheckResponse.Status.DOWN, response.getStatus());
        assertEquals(Boolean.FALSE, response.getData().orElseThrow().get("accessible"));
    }
}
