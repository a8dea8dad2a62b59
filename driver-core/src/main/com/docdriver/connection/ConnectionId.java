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

import java.util.concurrent.atomic.AtomicLong;

import static com.docdriver.assertions.Assertions.notNull;
import static java.lang.String.format;

/**
 * An immutable connection identifier of a connection to a server.  The local value is unique within the JVM; the server value, once
 * known, is the id the server assigned to the connection.
 */
@Immutable
public final class ConnectionId {
    private static final AtomicLong INCREMENTING_ID = new AtomicLong();

    private final ServerId serverId;
    private final long localValue;
    @Nullable
    private final Long serverValue;
    private final String stringValue;

    /**
     * Construct an instance with the given server id and a freshly generated local value.
     *
     * @param serverId the server id
     */
    public ConnectionId(final ServerId serverId) {
        this(serverId, INCREMENTING_ID.incrementAndGet(), null);
    }

    /**
     * Construct an instance.
     *
     * @param serverId    the server id
     * @param localValue  the local value
     * @param serverValue the server value, which may be null
     */
    public ConnectionId(final ServerId serverId, final long localValue, @Nullable final Long serverValue) {
        this.serverId = notNull("serverId", serverId);
        this.localValue = localValue;
        this.serverValue = serverValue;
        if (serverValue == null) {
            stringValue = format("connectionId{localValue:%s}", localValue);
        } else {
            stringValue = format("connectionId{localValue:%s, serverValue:%s}", localValue, serverValue);
        }
    }

    /**
     * Creates a new connection identifier with the given server value.
     *
     * @param serverValue the server value
     * @return the new connection id
     */
    public ConnectionId withServerValue(final long serverValue) {
        return new ConnectionId(serverId, localValue, serverValue);
    }

    /**
     * @return the server id
     */
    public ServerId getServerId() {
        return serverId;
    }

    /**
     * @return the local value
     */
    public long getLocalValue() {
        return localValue;
    }

    /**
     * @return the server value, which may be null
     */
    @Nullable
    public Long getServerValue() {
        return serverValue;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        ConnectionId that = (ConnectionId) o;

        if (localValue != that.localValue) {
            return false;
        }
        if (!serverId.equals(that.serverId)) {
            return false;
        }
        return serverValue != null ? serverValue.equals(that.serverValue) : that.serverValue == null;
    }

    @Override
    public int hashCode() {
        int result = serverId.hashCode();
        result = 31 * result + Long.hashCode(localValue);
        result = 31 * result + (serverValue != null ? serverValue.hashCode() : 0);
        return result;
    }

    @Override
    public String toString() {
        return stringValue;
    }
}
