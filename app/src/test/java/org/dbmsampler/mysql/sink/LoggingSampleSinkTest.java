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
package org.dbmsampler.mysql.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dbmsampler.mysql.metrics.SamplerMetrics;
import org.dbmsampler.mysql.model.StatementSample;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LoggingSampleSinkTest {

    @Mock
    private SamplerMetrics metrics;

    private static StatementSample sample() {
        return new StatementSample(
                1700000000500L,
                "db-1",
                "orders",
                "mysql",
                "env:prod",
                2500.0,
                new StatementSample.Network(new StatementSample.Client("10.0.0.7")),
                new StatementSample.Db("shop",
                        new StatementSample.Plan("{}", 1.2, "abc"),
                        "1f2e", "3d4c", "SELECT ?"),
                Map.of("rows_examined", 7));
    }

    @Test
    void testSubmit_SerializesWireFieldNames() throws Exception {
        // Setup
        ObjectMapper objectMapper = new ObjectMapper();
        LoggingSampleSink sink = new LoggingSampleSink(objectMapper, metrics);

        // Execute
        int accepted = sink.submit(List.of(sample(), sample()));
        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(sample()));

        // Verify
        assertEquals(2, accepted);
        assertEquals("mysql", json.get("ddsource").asText());
        assertEquals("env:prod", json.get("ddtags").asText());
        assertEquals("1f2e", json.at("/db/query_signature").asText());
        assertEquals("3d4c", json.at("/db/resource_hash").asText());
        assertEquals("10.0.0.7", json.at("/network/client/ip").asText());
        assertEquals(7, json.at("/mysql/rows_examined").asInt());
        verifyNoInteractions(metrics);
    }

    @Test
    void testSubmit_SerializationFailure_CountedAndSkipped() throws Exception {
        // Setup
        ObjectMapper objectMapper = mock(ObjectMapper.class);
        when(objectMapper.writeValueAsString(any()))
                .thenThrow(new JsonProcessingException("boom") { })
                .thenReturn("{}");
        LoggingSampleSink sink = new LoggingSampleSink(objectMapper, metrics);

        // Execute
        int accepted = sink.submit(List.of(sample(), sample()));

        // Verify
        assertEquals(1, accepted);
        verify(metrics).incrementError("sink-serialize");
    }
}
