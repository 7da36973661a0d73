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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MySqlVersionTest {

    @Test
    void testParse_PlainVersion() {
        MySqlVersion version = MySqlVersion.parse("8.0.36");

        assertNotNull(version);
        assertEquals(8, version.major());
        assertEquals(0, version.minor());
        assertEquals(36, version.patch());
        assertNull(version.flavor());
        assertEquals("8.0.36", version.fullVersion());
        assertFalse(version.isMariaDb());
    }

    @Test
    void testParse_WithFlavor() {
        MySqlVersion version = MySqlVersion.parse("10.6.16-MariaDB-log");

        assertNotNull(version);
        assertEquals("MariaDB-log", version.flavor());
        assertTrue(version.isMariaDb());
        assertEquals("10.6.16-MariaDB-log", version.rawVersion());
    }

    @Test
    void testParse_InvalidInput_ReturnsNull() {
        assertNull(MySqlVersion.parse(null));
        assertNull(MySqlVersion.parse(""));
        assertNull(MySqlVersion.parse("not a version"));
        assertNull(MySqlVersion.parse("8.0"));
    }

    @Test
    void testSupportsJsonExplain() {
        assertTrue(MySqlVersion.parse("5.6.5").supportsJsonExplain());
        assertFalse(MySqlVersion.parse("5.6.4").supportsJsonExplain());
        assertFalse(MySqlVersion.parse("5.5.62").supportsJsonExplain());
        assertTrue(MySqlVersion.parse("5.7.44-log").supportsJsonExplain());
        assertTrue(MySqlVersion.parse("10.1.0-MariaDB").supportsJsonExplain());
        assertFalse(MySqlVersion.parse("10.0.38-MariaDB").supportsJsonExplain());
    }
}
