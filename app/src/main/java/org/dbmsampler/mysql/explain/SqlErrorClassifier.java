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

import java.sql.SQLException;

/**
 * Decides whether a database error will clear up on its own.
 *
 * <p>Non-retryable errors (missing permissions, unknown objects) need outside
 * intervention, so the explainer stops trying the affected schema until its
 * cached state expires.
 */
public interface SqlErrorClassifier {

    /**
     * @param e Error raised by the driver
     * @return true if retrying without outside intervention is pointless
     */
    boolean isNonRetryable(SQLException e);
}
