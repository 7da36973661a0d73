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
package org.dbmsampler.mysql.explain;

import jakarta.enterprise.context.ApplicationScoped;

import java.sql.SQLException;
import java.util.Set;

/**
 * MySQL error codes that disqualify a schema from explain attempts.
 */
@ApplicationScoped
public class MySqlErrorClassifier implements SqlErrorClassifier {

    static final Set<Integer> NON_RETRYABLE_ERROR_CODES = Set.of(
            1044, // ER_DBACCESS_DENIED_ERROR: access denied on database
            1046, // ER_NO_DB_ERROR: no database selected
            1049, // ER_BAD_DB_ERROR: unknown database
            1305, // ER_SP_DOES_NOT_EXIST: procedure does not exist
            1370  // ER_PROCACCESS_DENIED_ERROR: no EXECUTE on procedure
    );

    @Override
    public boolean isNonRetryable(SQLException e) {
        return e != null && NON_RETRYABLE_ERROR_CODES.contains(e.getErrorCode());
    }
}
