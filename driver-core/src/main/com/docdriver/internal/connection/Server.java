/*
 * Copyright 2008-present MongoDB, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.docdriver.internal.connection;

import com.docdriver.annotations.ThreadSafe;
import com.docdriver.connection.ServerDescription;

/**
 * A logical connection to a MongoDB server.
 *
 * <p>This class is not part of the public API and may be removed or changed at any time</p>
 */
@ThreadSafe
public interface Server {
    /**
     * Gets the description of this server.  Implementations of this method should not block if the server has not yet been
     * successfully contacted, but rather return immediately a {@code ServerDescription} in a {@code ServerConnectionState.CONNECTING}
     * state.
     *
     * @return the description of this server
     */
    ServerDescription getDescription();

    /**
     * Gets a connection to this server.  The connection should be checked in after the caller is done with it.
     *
     * @param operationContext the operation context
     * @return a connection this server
     * @throws com.docdriver.MongoConnectionPoolTimeoutException if no connection becomes available in time
     * @throws com.docdriver.MongoConnectionPoolClearedException if the pool is paused
     */
    Connection getConnection(OperationContext operationContext);

    /**
     * Check a connection back in, reporting how the operation ended.
     *
     * @param connection the connection, which must have been obtained from this server
     * @param outcome    the outcome
     */
    void checkIn(Connection connection, ConnectionOutcome outcome);
}
