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

import org.dbmsampler.mysql.common.Constants;

import java.util.List;

/**
 * Identity stamped on every sample of a cycle.
 *
 * @param host    Host identity of the monitored instance
 * @param service Service name
 * @param tags    Comma-joined tag string
 */
public record SampleContext(String host, String service, String tags) {

    /**
     * Build the context from check tags. A {@code service:<name>} tag overrides
     * the default service.
     */
    public static SampleContext of(String host, List<String> tags) {
        String service = Constants.DEFAULT_SERVICE;
        if (tags == null) {
            return new SampleContext(host, service, "");
        }
        for (String tag : tags) {
            if (tag != null && tag.startsWith(Constants.SERVICE_TAG_PREFIX)
                    && tag.length() > Constants.SERVICE_TAG_PREFIX.length()) {
                service = tag.substring(Constants.SERVICE_TAG_PREFIX.length());
            }
        }
        return new SampleContext(host, service, String.join(",", tags));
    }
}
