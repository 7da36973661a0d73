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
package org.dbmsampler.mysql.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Configuration of the host check that drives the sampler.
 */
@ConfigMapping(prefix = "app.check")
public interface CheckConfig {

    /**
     * Interval between check runs. The background sampler stops itself once no
     * check run has been seen for twice this interval.
     *
     * @return Check interval (default: 15 seconds)
     */
    @WithDefault("15s")
    Duration minCollectionInterval();

    /**
     * Host name of the monitored instance as reported on samples.
     */
    @WithDefault("localhost")
    String host();

    /**
     * Tags attached to every sample, e.g. {@code env:prod} or {@code service:billing-db}.
     */
    Optional<List<String>> tags();
}
