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

package com.docdriver.event;

import com.docdriver.connection.ConnectionId;

import static com.docdriver.assertions.Assertions.notNull;

/**
 * An event for checking in a connection to the pool.
 */
public final class ConnectionCheckedInEvent {
    private final ConnectionId connectionId;
    private final long operationId;

    /**
     * Construct an instance
     *
     * @param connectionId the connection id
     * @param operationId  the operation id
     */
    public ConnectionCheckedInEvent(final ConnectionId connectionId, final long operationId) {
        this.connectionId = notNull("connectionId", connectionId);
        this.operationId = operationId;
    }

    /**
     * Gets the connection id.
     *
     * @return the connection id
     */
    public ConnectionId getConnectionId() {
        return connectionId;
    }

    /**
     * Gets the operation id.
     *
     * @return the operation id
     */
    public long getOperationId() {
        return operationId;
    }

    @Override
    public String toString() {
        return "ConnectionCheckedInEvent{"
               + "connectionId=" + connectionId
               + ", operationId=" + operationId
               + '}';
    }
}
