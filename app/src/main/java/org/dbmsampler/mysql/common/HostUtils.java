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
import lombok.extern.slf4j.Slf4j;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Host name helpers for event identity and log output.
 */
@Slf4j
@UtilityClass
public final class HostUtils {

    private static final Set<String> LOOPBACK_HOSTS = Set.of("localhost", "127.0.0.1", "0.0.0.0", "::1");

    /**
     * Resolve the host identity reported on samples.
     *
     * <p>Loopback addresses are replaced with the local machine name since
     * they would otherwise collide between every monitored instance.
     *
     * @param configuredHost Host from configuration (may be null)
     * @return Host identity, never null
     */
    public static String resolveDbHost(String configuredHost) {
        return resolveDbHost(configuredHost, HostUtils::localHostName);
    }

    static String resolveDbHost(String configuredHost, Supplier<String> localHostName) {
        if (configuredHost == null || configuredHost.isBlank()
                || LOOPBACK_HOSTS.contains(configuredHost.trim().toLowerCase(Locale.ROOT))) {
            String local = localHostName.get();
            return local != null ? local : "localhost";
        }
        return configuredHost.trim();
    }

    /**
     * Mask credentials in connection strings for logging.
     *
     * @param url Database connection URL
     * @return Masked URL with password hidden
     */
    public static String maskSensitiveInfo(String url) {
        if (url == null) {
            return "not configured";
        }
        return url.replaceAll("password=[^&\\s]+", "password=***")
                .replaceAll(":[^:/@]+@", ":***@");
    }

    private static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("Could not resolve local host name", e);
            return null;
        }
    }
}
