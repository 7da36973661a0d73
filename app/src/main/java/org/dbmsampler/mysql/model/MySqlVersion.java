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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Represents a MySQL server version as reported by {@code SELECT VERSION()}.
 */
public record MySqlVersion(int major, int minor, int patch, String flavor, String rawVersion) {
    private static final Pattern VERSION_REGEX = Pattern.compile("^(\\d+)\\.(\\d+)\\.(\\d+)(?:-(.+))?$");

    private static final int MAJOR_GROUP = 1;
    private static final int MINOR_GROUP = 2;
    private static final int PATCH_GROUP = 3;
    private static final int FLAVOR_GROUP = 4;

    /**
     * Parse version from the server's VERSION() output, e.g. {@code 8.0.36-log}
     * or {@code 10.6.16-MariaDB}.
     *
     * @param versionString The version string
     * @return Parsed version or null if parsing fails
     */
    public static MySqlVersion parse(String versionString) {
        if (versionString == null || versionString.isBlank()) {
            return null;
        }
        final String input = versionString.trim();
        final Matcher matcher = VERSION_REGEX.matcher(input);
        if (!matcher.find()) {
            return null;
        }
        final int major = Integer.parseInt(matcher.group(MAJOR_GROUP));
        final int minor = Integer.parseInt(matcher.group(MINOR_GROUP));
        final int patch = Integer.parseInt(matcher.group(PATCH_GROUP));
        final String flavor = matcher.group(FLAVOR_GROUP);
        return new MySqlVersion(major, minor, patch, flavor, input);
    }

    public String fullVersion() {
        return major + "." + minor + "." + patch;
    }

    public boolean isMariaDb() {
        return flavor != null && flavor.toLowerCase().contains("mariadb");
    }

    /**
     * JSON explain output needs MySQL 5.6.5 or later, or MariaDB 10.1 or later.
     */
    public boolean supportsJsonExplain() {
        if (isMariaDb()) {
            return major > 10 || (major == 10 && minor >= 1);
        }
        return major > 5 || (major == 5 && (minor > 6 || (minor == 6 && patch >= 5)));
    }
}
