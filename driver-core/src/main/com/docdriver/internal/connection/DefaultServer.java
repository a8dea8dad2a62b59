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

import com.docdriver.MongoException;
import com.docdriver.MongoSocketException;
import com.docdriver.MongoSocketReadTimeoutException;
import com.docdriver.annotations.ThreadSafe;
import com.docdriver.connection.ClusterConnectionMode;
import com.docdriver.connection.ServerDescription;
import com.docdriver.connection.ServerId;
import com.docdriver.diagnostics.logging.Logger;
import com.docdriver.diagnostics.logging.Loggers;
import com.docdriver.event.ServerClosedEvent;
import com.docdriver.event.ServerDescriptionChangedEvent;
import com.docdriver.event.ServerListener;
import com.docdriver.event.ServerOpeningEvent;

import static com.docdriver.assertions.Assertions.isTrue;
import static com.docdriver.assertions.Assertions.isTrueArgument;
import static com.docdriver.assertions.Assertions.notNull;
import static com.docdriver.internal.connection.ServerDescriptionHelper.isStale;
import static com.docdriver.internal.connection.ServerDescriptionHelper.unknownConnectingServerDescription;
import static java.lang.String.format;

@ThreadSafe
class DefaultServer implements ClusterableServer {
    private static final Logger LOGGER = Loggers.getLogger("connection");

    private final ServerId serverId;
    private final ConnectionPool connectionPool;
    private final ClusterConnectionMode clusterConnectionMode;
    private final ServerMonitor serverMonitor;
    private final ServerListener serverListener;
    private final Cluster cluster;
    private final SdamServerDescriptionManager sdamServerDescriptionManager;
    private volatile ServerDescription description;
    private volatile boolean isClosed;

    DefaultServer(final ServerId serverId, final ClusterConnectionMode clusterConnectionMode, final ConnectionPool connectionPool,
                  final ServerMonitorFactory serverMonitorFactory, final ServerListener serverListener, final Cluster cluster) {
        this.serverListener = notNull("serverListener", serverListener);
        this.cluster = notNull("cluster", cluster);
        notNull("serverMonitorFactory", serverMonitorFactory);
        this.clusterConnectionMode = notNull("clusterConnectionMode", clusterConnectionMode);
        this.serverId = notNull("serverId", serverId);
        this.connectionPool = notNull("connectionPool", connectionPool);

        serverListener.serverOpening(new ServerOpeningEvent(serverId));

        description = unknownConnectingServerDescription(serverId.getAddress(), null);
        sdamServerDescriptionManager = new DefaultSdamServerDescriptionManager();
        serverMonitor = serverMonitorFactory.create(sdamServerDescriptionManager);
        serverMonitor.start();
    }

    @Override
    public ServerDescription getDescription() {
        isTrue("open", !isClosed());
        return description;
    }

    @Override
    public Connection getConnection(final OperationContext operationContext) {
        isTrue("open", !isClosed());
        int generation = connectionPool.getGeneration();
        try {
            return new DefaultConnection(connectionPool.get(operationContext), this);
        } catch (MongoException e) {
            sdamServerDescriptionManager.handleException(e, generation, true);
            throw e;
        }
    }

    @Override
    public void checkIn(final Connection connection, final ConnectionOutcome outcome) {
        isTrueArgument("connection belongs to this server",
                connection instanceof DefaultConnection && ((DefaultConnection) connection).getServer() == this);
        DefaultConnection defaultConnection = (DefaultConnection) connection;
        if (outcome == ConnectionOutcome.NETWORK_ERROR) {
            sdamServerDescriptionManager.handleException(new MongoSocketException("A network error was reported for connection "
                    + connection.getDescription().getConnectionId(), serverId.getAddress()), defaultConnection.getGeneration(), false);
        }
        defaultConnection.checkIn();
    }

    @Override
    public void connect() {
        serverMonitor.connect();
    }

    @Override
    public void close() {
        if (!isClosed()) {
            isClosed = true;
            connectionPool.close();
            serverMonitor.close();
            serverListener.serverClosed(new ServerClosedEvent(serverId));
        }
    }

    @Override
    public boolean isClosed() {
        return isClosed;
    }

    ServerId getServerId() {
        return serverId;
    }

    ConnectionPool getConnectionPool() {
        return connectionPool;
    }

    SdamServerDescriptionManager getSdamServerDescriptionManager() {
        return sdamServerDescriptionManager;
    }

    /**
     * Applies what the monitor and the operations using this server learn about it, in the order it arrives.
     */
    private final class DefaultSdamServerDescriptionManager implements SdamServerDescriptionManager {

        @Override
        public synchronized void monitorUpdate(final ServerDescription candidateDescription) {
            if (isClosed() || isStale(description, candidateDescription)) {
                return;
            }
            if (candidateDescription.getException() != null && clusterConnectionMode != ClusterConnectionMode.LOAD_BALANCED) {
                connectionPool.invalidate(candidateDescription.getException());
            } else if (candidateDescription.isOk()) {
                connectionPool.ready();
            }
            updateDescription(candidateDescription);
        }

        @Override
        public synchronized void handleException(final Throwable exception, final int connectionGeneration,
                                                 final boolean beforeHandshake) {
            if (isClosed() || connectionGeneration != connectionPool.getGeneration()) {
                return;
            }
            if (exception instanceof MongoSocketException
                    && (beforeHandshake || !(exception instanceof MongoSocketReadTimeoutException))) {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug(format("Network error on a connection to %s, clearing its connection pool", serverId.getAddress()));
                }
                updateDescription(unknownConnectingServerDescription(serverId.getAddress(), exception));
                connectionPool.invalidate(exception);
                serverMonitor.cancelCurrentCheck();
                serverMonitor.connect();
            }
        }

        private void updateDescription(final ServerDescription newDescription) {
            ServerDescription previousDescription = description;
            description = newDescription;
            ServerDescriptionChangedEvent serverDescriptionChangedEvent =
                    new ServerDescriptionChangedEvent(serverId, newDescription, previousDescription);
            if (!previousDescription.equals(newDescription)) {
                serverListener.serverDescriptionChanged(serverDescriptionChangedEvent);
            }
            cluster.onChange(serverDescriptionChangedEvent);
        }
    }
}
