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
package org.dbmsampler.mysql.obfuscation;

/**
 * Redacts literals from SQL text and execution plans before they leave the process.
 *
 * <p>Implementations signal failure with {@link ObfuscationException}; callers
 * skip the affected row rather than emitting unredacted text.
 */
public interface SqlObfuscator {

    /**
     * @param sql Raw SQL text
     * @return SQL with literal values replaced by placeholders
     * @throws ObfuscationException if the text cannot be processed
     */
    String obfuscateSql(String sql);

    /**
     * @param plan      Raw JSON execution plan
     * @param normalize Also drop values that vary between executions of the same plan
     *                  (costs, row estimates) so the result can be hashed into a plan signature
     * @return Obfuscated plan JSON
     * @throws ObfuscationException if the plan cannot be processed
     */
    String obfuscateExecPlan(String plan, boolean normalize);
}
