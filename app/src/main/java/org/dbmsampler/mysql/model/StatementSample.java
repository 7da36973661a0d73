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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A finished statement sample handed to the sink. Immutable once built.
 *
 * @param timestamp Statement end time in epoch milliseconds
 * @param host      Identity of the monitored instance
 * @param service   Service tag
 * @param source    Always {@code mysql}
 * @param tags      Comma-joined tag string
 * @param duration  Statement duration in nanoseconds
 * @param network   Client network details
 * @param db        Statement, plan and signatures
 * @param mysql     Remaining performance_schema columns not promoted to fields above
 */
@JsonPropertyOrder({"timestamp", "host", "service", "ddsource", "ddtags", "duration", "network", "db", "mysql"})
public record StatementSample(
        long timestamp,
        String host,
        String service,
        @JsonProperty("ddsource") String source,
        @JsonProperty("ddtags") String tags,
        Double duration,
        Network network,
        Db db,
        Map<String, Object> mysql) {

    public StatementSample {
        mysql = mysql == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(mysql));
    }

    public record Network(Client client) {
    }

    public record Client(String ip) {
    }

    public record Db(
            String instance,
            Plan plan,
            @JsonProperty("query_signature") String querySignature,
            @JsonProperty("resource_hash") String resourceHash,
            String statement) {
    }

    /**
     * @param definition Obfuscated plan JSON, null when no plan was collected
     * @param cost       Total query cost, null when no plan was collected
     * @param signature  Signature of the normalized plan
     */
    public record Plan(String definition, Double cost, String signature) {
    }
}
