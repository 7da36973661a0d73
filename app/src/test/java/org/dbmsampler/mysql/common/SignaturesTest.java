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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SignaturesTest {

    @Test
    void testSqlSignature_StableAndHex() {
        String first = Signatures.sqlSignature("SELECT * FROM t WHERE id = ?");
        String second = Signatures.sqlSignature("SELECT * FROM t WHERE id = ?");

        assertEquals(first, second);
        assertTrue(first.matches("[0-9a-f]{1,16}"), first);
    }

    @Test
    void testSqlSignature_DifferentTextDiffers() {
        assertNotEquals(Signatures.sqlSignature("SELECT ?"), Signatures.sqlSignature("SELECT ? FROM t"));
    }

    @Test
    void testNullInput_ReturnsNull() {
        assertNull(Signatures.sqlSignature(null));
        assertNull(Signatures.planSignature(null));
    }
}
