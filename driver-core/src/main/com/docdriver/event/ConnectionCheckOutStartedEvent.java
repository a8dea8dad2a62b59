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

import com.docdriver.connection.ServerId;

import static com.docdriver.assertions.Assertions.notNull;

/**
 * An event for the start of checking out a connection.
 */
public final class ConnectionCheckOutStartedEvent {
    private final ServerId serverId;
    private final long operationId;

    /**
     * Construct an instance
     *
     * @param serverId    the server id
     * @param operationId the operation id
     */
    public ConnectionCheckOutStartedEvent(final ServerId serverId, final long operationId) {
        this.serverId = notNull("serverId", serverId);
        this.operationId = operationId;
    }

    /**
     * Gets the server id.
     *
     * @return the server id
     */
    public ServerId getServerId() {
        return serverId;
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
        return "ConnectionCheckOutStartedEvent{"
               + "serverId=" + serverId
               + ", operationId=" + operationId
               + '}';
    }
}
