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
package org.dbmsampler.mysql.common;

import lombok.experimental.UtilityClass;

/**
 * Prometheus metric names, {@code mysql_<name>} or {@code mysql_statement_samples_<name>}.
 */
@UtilityClass
public final class MetricNameBuilder {

    private static final String SEPARATOR = "_";

    /**
     * @param name Metric name without namespace
     * @return the name prefixed with the {@code mysql} namespace
     */
    public static String build(String name) {
        return String.join(SEPARATOR, Constants.NAMESPACE, name);
    }

    /**
     * Metric name inside the statement samples subsystem.
     */
    public static String samples(String name) {
        return String.join(SEPARATOR, Constants.NAMESPACE, Constants.SUBSYSTEM_STATEMENT_SAMPLES, name);
    }
}
