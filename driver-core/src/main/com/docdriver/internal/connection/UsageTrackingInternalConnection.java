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

import com.docdriver.connection.ConnectionDescription;
import com.docdriver.connection.ServerDescription;
import org.bson.BsonDocument;

/**
 * An internal connection that tracks when it was opened and last used, so that the pool can expire it.
 */
class UsageTrackingInternalConnection implements InternalConnection {
    private volatile long openedAt;
    private volatile long lastUsedAt;
    private final InternalConnection wrapped;

    UsageTrackingInternalConnection(final InternalConnection wrapped) {
        this.wrapped = wrapped;
        openedAt = Long.MAX_VALUE;
        lastUsedAt = openedAt;
    }

    @Override
    public void open() {
        wrapped.open();
        openedAt = System.currentTimeMillis();
        lastUsedAt = openedAt;
    }

    @Override
    public void close() {
        wrapped.close();
    }

    @Override
    public boolean opened() {
        return wrapped.opened();
    }

    @Override
    public boolean isClosed() {
        return wrapped.isClosed();
    }

    @Override
    public int getGeneration() {
        return wrapped.getGeneration();
    }

    @Override
    public ConnectionDescription getDescription() {
        return wrapped.getDescription();
    }

    @Override
    public ServerDescription getInitialServerDescription() {
        return wrapped.getInitialServerDescription();
    }

    @Override
    public BsonDocument sendAndReceive(final CommandMessage message, final int additionalTimeoutMillis) {
        BsonDocument reply = wrapped.sendAndReceive(message, additionalTimeoutMillis);
        lastUsedAt = System.currentTimeMillis();
        return reply;
    }

    /**
     * Gets the time the connection was opened, in milliseconds since the epoch.
     */
    long getOpenedAt() {
        return openedAt;
    }

    /**
     * Gets the time the connection was last used, in milliseconds since the epoch.
     */
    long getLastUsedAt() {
        return lastUsedAt;
    }

    void markUsed() {
        lastUsedAt = System.currentTimeMillis();
    }
}
