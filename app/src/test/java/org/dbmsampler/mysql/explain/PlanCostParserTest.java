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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PlanCostParserTest {

    @Test
    void testParseCost_QuotedDecimal() {
        String plan = "{\"query_block\":{\"select_id\":1,\"cost_info\":{\"query_cost\":\"12.45\"}}}";

        assertEquals(12.45, PlanCostParser.parseCost(plan));
    }

    @Test
    void testParseCost_Numeric() {
        String plan = "{\"query_block\":{\"cost_info\":{\"query_cost\":3.5}}}";

        assertEquals(3.5, PlanCostParser.parseCost(plan));
    }

    @Test
    void testParseCost_MissingField_ReturnsZero() {
        assertEquals(0.0, PlanCostParser.parseCost("{\"query_block\":{\"select_id\":1}}"));
        assertEquals(0.0, PlanCostParser.parseCost("{}"));
    }

    @Test
    void testParseCost_Malformed_ReturnsZero() {
        assertEquals(0.0, PlanCostParser.parseCost("{\"query_block\": "));
        assertEquals(0.0, PlanCostParser.parseCost("{\"query_block\":{\"cost_info\":{\"query_cost\":\"n/a\"}}}"));
        assertEquals(0.0, PlanCostParser.parseCost(null));
        assertEquals(0.0, PlanCostParser.parseCost(""));
    }
}
