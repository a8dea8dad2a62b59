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


package com.docdriver.internal.event;

import com.docdriver.ServerAddress;
import com.docdriver.connection.ConnectionId;
import com.docdriver.connection.ConnectionPoolSettings;
import com.docdriver.diagnostics.logging.Logger;
import com.docdriver.diagnostics.logging.Loggers;
import com.docdriver.event.ConnectionCheckOutFailedEvent;
import com.docdriver.event.ConnectionCheckOutStartedEvent;
import com.docdriver.event.ConnectionCheckedInEvent;
import com.docdriver.event.ConnectionCheckedOutEvent;
import com.docdriver.event.ConnectionClosedEvent;
import com.docdriver.event.ConnectionCreatedEvent;
import com.docdriver.event.ConnectionPoolClearedEvent;
import com.docdriver.event.ConnectionPoolClosedEvent;
import com.docdriver.event.ConnectionPoolCreatedEvent;
import com.docdriver.event.ConnectionPoolListener;
import com.docdriver.event.ConnectionPoolReadyEvent;
import com.docdriver.event.ConnectionReadyEvent;

import static java.lang.String.format;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Writes every connection pool event to the {@code com.docdriver.connection} logger at debug level.
 *
 * <p>This class is not part of the public API and may be removed or changed at any time</p>
 */
public final class ConnectionPoolLoggingListener implements ConnectionPoolListener {
    private static final Logger LOGGER = Loggers.getLogger("connection");

    @Override
    public void connectionPoolCreated(final ConnectionPoolCreatedEvent event) {
        if (LOGGER.isDebugEnabled()) {
            ConnectionPoolSettings settings = event.getSettings();
            LOGGER.debug(format("Connection pool created: %s, maxIdleTimeMS=%d, minPoolSize=%d, maxPoolSize=%d",
                    server(event.getServerId().getAddress()), settings.getMaxConnectionIdleTime(MILLISECONDS), settings.getMinSize(),
                    settings.getMaxSize()));
        }
    }

    @Override
    public void connectionPoolReady(final ConnectionPoolReadyEvent event) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(format("Connection pool ready: %s", server(event.getServerId().getAddress())));
        }
    }

    @Override
    public void connectionPoolCleared(final ConnectionPoolClearedEvent event) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(format("Connection pool cleared: %s", server(event.getServerId().getAddress())));
        }
    }

    @Override
    public void connectionPoolClosed(final ConnectionPoolClosedEvent event) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(format("Connection pool closed: %s", server(event.getServerId().getAddress())));
        }
    }

    @Override
    public void connectionCreated(final ConnectionCreatedEvent event) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(format("Connection created: %s", connection(event.getConnectionId())));
        }
    }

    @Override
    public void connectionReady(final ConnectionReadyEvent event) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(format("Connection ready: %s, durationMS=%d", connection(event.getConnectionId()),
                    event.getElapsedTime(MILLISECONDS)));
        }
    }

    @Override
    public void connectionClosed(final ConnectionClosedEvent event) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(format("Connection closed: %s, reason=%s", connection(event.getConnectionId()),
                    describe(event.getReason())));
        }
    }

    @Override
    public void connectionCheckOutStarted(final ConnectionCheckOutStartedEvent event) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(format("Connection checkout started: %s, operationId=%d", server(event.getServerId().getAddress()),
                    event.getOperationId()));
        }
    }

    @Override
    public void connectionCheckOutFailed(final ConnectionCheckOutFailedEvent event) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(format("Connection checkout failed: %s, operationId=%d, reason=%s, durationMS=%d",
                    server(event.getServerId().getAddress()), event.getOperationId(), describe(event.getReason()),
                    event.getElapsedTime(MILLISECONDS)));
        }
    }

    @Override
    public void connectionCheckedOut(final ConnectionCheckedOutEvent event) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(format("Connection checked out: %s, operationId=%d, durationMS=%d", connection(event.getConnectionId()),
                    event.getOperationId(), event.getElapsedTime(MILLISECONDS)));
        }
    }

    @Override
    public void connectionCheckedIn(final ConnectionCheckedInEvent event) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(format("Connection checked in: %s, operationId=%d", connection(event.getConnectionId()),
                    event.getOperationId()));
        }
    }

    static String server(final ServerAddress address) {
        return format("serverHost=%s, serverPort=%d", address.getHost(), address.getPort());
    }

    private static String connection(final ConnectionId connectionId) {
        return format("%s, driverConnectionId=%d", server(connectionId.getServerId().getAddress()), connectionId.getLocalValue());
    }

    static String describe(final ConnectionClosedEvent.Reason reason) {
        switch (reason) {
            case STALE:
                return "Connection became stale because the pool was cleared";
            case IDLE:
                return "Connection has been available but unused for longer than the configured max idle time";
            case EXPIRED:
                return "Connection has been open for longer than the configured max life time";
            case ERROR:
                return "An error occurred while using the connection";
            case POOL_CLOSED:
                return "Connection pool was closed";
            default:
                return reason.name();
        }
    }

    static String describe(final ConnectionCheckOutFailedEvent.Reason reason) {
        switch (reason) {
            case TIMEOUT:
                return "Wait queue timeout elapsed without a connection becoming available";
            case CONNECTION_ERROR:
                return "An error occurred while trying to establish a new connection";
            case POOL_CLOSED:
                return "Connection pool was closed";
            default:
                return "Unknown error";
        }
    }
}
