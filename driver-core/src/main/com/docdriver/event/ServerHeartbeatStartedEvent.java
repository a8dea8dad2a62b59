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
 * An event for the start of a server heartbeat.
 */
public final class ServerHeartbeatStartedEvent {
    private final ConnectionId connectionId;
    private final boolean awaited;

    /**
     * Construct an instance.
     *
     * @param connectionId the non-null connectionId
     * @param awaited {@code true} if and only if the heartbeat is for an awaitable {@code hello} command
     */
    public ServerHeartbeatStartedEvent(final ConnectionId connectionId, final boolean awaited) {
        this.connectionId = notNull("connectionId", connectionId);
        this.awaited = awaited;
    }

    /**
     * Gets the connectionId.
     *
     * @return the connectionId
     */
    public ConnectionId getConnectionId() {
        return connectionId;
    }

    /**
     * Gets whether the heartbeat is for an awaitable {@code hello} command sent by the streaming protocol.
     *
     * @return {@code true} if and only if the heartbeat is awaited
     */
    public boolean isAwaited() {
        return awaited;
    }

    @Override
    public String toString() {
        return "ServerHeartbeatStartedEvent{"
               + "connectionId=" + connectionId
               + ", server=" + connectionId.getServerId().getAddress()
               + ", clusterId=" + connectionId.getServerId().getClusterId()
               + ", awaited=" + awaited
               + '}';
    }
}
