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

package com.docdriver.connection;

import com.docdriver.annotations.Immutable;
import com.docdriver.lang.Nullable;
import org.bson.types.ObjectId;

import static com.docdriver.assertions.Assertions.notNull;

/**
 * A description of a connection to a MongoDB server, as learned from the connection handshake.
 */
@Immutable
public class ConnectionDescription {
    private final ConnectionId connectionId;
    private final int maxWireVersion;
    private final ServerType serverType;
    private final int maxDocumentSize;
    private final int maxMessageSize;
    @Nullable
    private final ObjectId serviceId;

    private static final int DEFAULT_MAX_MESSAGE_SIZE = 0x2000000;   // 32MB

    /**
     * Construct a defaulted connection description instance.
     *
     * @param serverId the server address
     */
    public ConnectionDescription(final ServerId serverId) {
        this(new ConnectionId(serverId), 0, ServerType.UNKNOWN, ServerDescription.getDefaultMaxDocumentSize(),
                DEFAULT_MAX_MESSAGE_SIZE, null);
    }

    /**
     * Construct an instance.
     *
     * @param connectionId    the connection id
     * @param maxWireVersion  the max wire version
     * @param serverType      the server type
     * @param maxDocumentSize the max document size in bytes
     * @param maxMessageSize  the max message size in bytes
     * @param serviceId       the service id reported by a load balanced server, which may be null
     */
    public ConnectionDescription(final ConnectionId connectionId, final int maxWireVersion, final ServerType serverType,
                                 final int maxDocumentSize, final int maxMessageSize, @Nullable final ObjectId serviceId) {
        this.connectionId = notNull("connectionId", connectionId);
        this.maxWireVersion = maxWireVersion;
        this.serverType = notNull("serverType", serverType);
        this.maxDocumentSize = maxDocumentSize;
        this.maxMessageSize = maxMessageSize;
        this.serviceId = serviceId;
    }

    /**
     * Creates a new connection description with the set connection id
     *
     * @param connectionId the connection id
     * @return the new connection description
     */
    public ConnectionDescription withConnectionId(final ConnectionId connectionId) {
        notNull("connectionId", connectionId);
        return new ConnectionDescription(connectionId, maxWireVersion, serverType, maxDocumentSize, maxMessageSize, serviceId);
    }

    /**
     * Gets the id of the server that this connection is to.
     *
     * @return the server id
     */
    public ServerId getServerId() {
        return connectionId.getServerId();
    }

    /**
     * Gets the id of the connection. If possible, this id will correlate with the connection id that the server puts in its log
     * messages.
     *
     * @return the connection id
     */
    public ConnectionId getConnectionId() {
        return connectionId;
    }

    /**
     * The latest version of the wire protocol that this server is capable of using to communicate with the driver.
     *
     * @return the server's version of the wire protocol.
     */
    public int getMaxWireVersion() {
        return maxWireVersion;
    }

    /**
     * The type of the server.
     *
     * @return the server type
     */
    public ServerType getServerType() {
        return serverType;
    }

    /**
     * Get the maximum document size in bytes.
     *
     * @return the maximum document size in bytes
     */
    public int getMaxDocumentSize() {
        return maxDocumentSize;
    }

    /**
     * Get the maximum message size in bytes.
     *
     * @return the maximum message size in bytes
     */
    public int getMaxMessageSize() {
        return maxMessageSize;
    }

    /**
     * Gets the service id, if this connection is to a load balanced server.
     *
     * @return the service id, which may be null
     */
    @Nullable
    public ObjectId getServiceId() {
        return serviceId;
    }

    /**
     * Get the default maximum message size.
     *
     * @return the default maximum message size.
     */
    public static int getDefaultMaxMessageSize() {
        return DEFAULT_MAX_MESSAGE_SIZE;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        ConnectionDescription that = (ConnectionDescription) o;

        if (maxWireVersion != that.maxWireVersion) {
            return false;
        }
        if (maxDocumentSize != that.maxDocumentSize) {
            return false;
        }
        if (maxMessageSize != that.maxMessageSize) {
            return false;
        }
        if (!connectionId.equals(that.connectionId)) {
            return false;
        }
        if (serverType != that.serverType) {
            return false;
        }
        return serviceId != null ? serviceId.equals(that.serviceId) : that.serviceId == null;
    }

    @Override
    public int hashCode() {
        int result = connectionId.hashCode();
        result = 31 * result + maxWireVersion;
        result = 31 * result + serverType.hashCode();
        result = 31 * result + maxDocumentSize;
        result = 31 * result + maxMessageSize;
        result = 31 * result + (serviceId != null ? serviceId.hashCode() : 0);
        return result;
    }

    @Override
    public String toString() {
        return "ConnectionDescription{"
               + "connectionId=" + connectionId
               + ", maxWireVersion=" + maxWireVersion
               + ", serverType=" + serverType
               + ", maxDocumentSize=" + maxDocumentSize
               + ", maxMessageSize=" + maxMessageSize
               + ", serviceId=" + serviceId
               + '}';
    }
}
