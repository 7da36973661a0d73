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

import java.util.Objects;

/**
 * Cached explain outcome for one schema: either the mechanism known to work,
 * or a marker that the schema fails permanently until the entry expires.
 *
 * <p>A schema with no record has not been tried yet.
 *
 * @param strategy Working mechanism, null when {@code failed} is true
 * @param failed   Whether a non-retryable error disqualified the schema
 */
public record ExplainStrategyRecord(ExplainStrategy strategy, boolean failed) {

    private static final ExplainStrategyRecord FAILED = new ExplainStrategyRecord(null, true);

    public ExplainStrategyRecord {
        if (failed == (strategy != null)) {
            throw new IllegalArgumentException("A record is either failed or names a working strategy");
        }
    }

    public static ExplainStrategyRecord working(ExplainStrategy strategy) {
        return new ExplainStrategyRecord(Objects.requireNonNull(strategy, "strategy"), false);
    }

    public static ExplainStrategyRecord permanentlyFailed() {
        return FAILED;
    }
}
