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
package org.dbmsampler.mysql.explain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the total query cost out of a MySQL JSON execution plan.
 */
@Slf4j
@UtilityClass
public final class PlanCostParser {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Parse {@code query_block.cost_info.query_cost}.
     *
     * <p>MySQL reports the cost as a quoted decimal string, e.g. {@code "1.20"}.
     *
     * @param plan Raw plan JSON (may be null)
     * @return The query cost, or 0.0 if the field is absent or the plan is malformed
     */
    public static double parseCost(String plan) {
        if (plan == null || plan.isBlank()) {
            return 0.0;
        }
        try {
            JsonNode cost = MAPPER.readTree(plan).path("query_block").path("cost_info").path("query_cost");
            if (cost.isNumber()) {
                return cost.asDouble();
            }
            if (cost.isTextual()) {
                return Double.parseDouble(cost.asText().trim());
            }
            return 0.0;
        } catch (JsonProcessingException | NumberFormatException e) {
            log.debug("Could not parse cost from execution plan: {}", e.getMessage());
            return 0.0;
        }
    }
}
