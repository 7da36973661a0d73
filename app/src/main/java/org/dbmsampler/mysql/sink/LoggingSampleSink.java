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
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.dbmsampler.mysql.metrics.SamplerMetrics;
import org.dbmsampler.mysql.model.StatementSample;

import java.util.List;

/**
 * Writes each sample as one JSON line to the {@code statement-samples} logger.
 */
@Slf4j(topic = "statement-samples")
@ApplicationScoped
public class LoggingSampleSink implements SampleSink {

    private final ObjectMapper objectMapper;
    private final SamplerMetrics metrics;

    @Inject
    public LoggingSampleSink(ObjectMapper objectMapper, SamplerMetrics metrics) {
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    @Override
    public int submit(List<StatementSample> samples) {
        int accepted = 0;
        for (StatementSample sample : samples) {
            try {
                log.info(objectMapper.writeValueAsString(sample));
                accepted++;
            } catch (JsonProcessingException e) {
                log.warn("Failed to serialize statement sample: {}", e.getMessage());
                metrics.incrementError("sink-serialize");
            }
        }
        return accepted;
    }
}
