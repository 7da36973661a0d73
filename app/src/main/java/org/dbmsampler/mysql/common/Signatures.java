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

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import lombok.experimental.UtilityClass;

import java.nio.charset.StandardCharsets;

/**
 * Signature hashes used to group statements and plans.
 *
 * <p>All signatures are the low 64 bits of murmur3_128 rendered as lowercase hex.
 */
@UtilityClass
public final class Signatures {

    private static final HashFunction MURMUR3 = Hashing.murmur3_128();

    /**
     * Signature of (already obfuscated) SQL text. Used for both the query
     * signature (digest text) and the resource hash (statement text).
     */
    public static String sqlSignature(String obfuscatedSql) {
        return hash(obfuscatedSql);
    }

    /**
     * Signature of a normalized execution plan.
     */
    public static String planSignature(String normalizedPlan) {
        return hash(normalizedPlan);
    }

    private static String hash(String value) {
        if (value == null) {
            return null;
        }
        long bits = MURMUR3.hashString(value, StandardCharsets.UTF_8).asLong();
        return Long.toHexString(bits);
    }
}
