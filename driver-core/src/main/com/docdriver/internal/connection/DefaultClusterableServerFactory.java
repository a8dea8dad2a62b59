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

import com.docdriver.ServerAddress;
import com.docdriver.connection.ClusterConnectionMode;
import com.docdriver.connection.ClusterId;
import com.docdriver.connection.ConnectionPoolSettings;
import com.docdriver.connection.ServerId;
import com.docdriver.connection.ServerSettings;
import com.docdriver.event.ServerListener;
import com.docdriver.lang.Nullable;

import static com.docdriver.internal.event.EventListenerHelper.serverListener;

class DefaultClusterableServerFactory implements ClusterableServerFactory {
    private final ClusterId clusterId;
    private final ClusterConnectionMode clusterConnectionMode;
    private final ServerSettings serverSettings;
    private final ConnectionPoolSettings connectionPoolSettings;
    private final StreamFactory streamFactory;
    private final StreamFactory heartbeatStreamFactory;
    @Nullable
    private final String applicationName;

    DefaultClusterableServerFactory(final ClusterId clusterId, final ClusterConnectionMode clusterConnectionMode,
                                    final ServerSettings serverSettings, final ConnectionPoolSettings connectionPoolSettings,
                                    final StreamFactory streamFactory, final StreamFactory heartbeatStreamFactory,
                                    @Nullable final String applicationName) {
        this.clusterId = clusterId;
        this.clusterConnectionMode = clusterConnectionMode;
        this.serverSettings = serverSettings;
        this.connectionPoolSettings = connectionPoolSettings;
        this.streamFactory = streamFactory;
        this.heartbeatStreamFactory = heartbeatStreamFactory;
        this.applicationName = applicationName;
    }

    @Override
    public ClusterableServer create(final Cluster cluster, final ServerAddress serverAddress) {
        final ServerId serverId = new ServerId(clusterId, serverAddress);
        ServerListener serverListener = serverListener(serverSettings.getServerListeners(), serverSettings.getMaxDocumentLength());

        ConnectionPool connectionPool = new DefaultConnectionPool(serverId,
                new InternalStreamConnectionFactory(clusterConnectionMode, streamFactory, applicationName), connectionPoolSettings);

        final InternalConnectionFactory heartbeatConnectionFactory =
                new InternalStreamConnectionFactory(clusterConnectionMode, heartbeatStreamFactory, applicationName);
        ServerMonitorFactory serverMonitorFactory = new ServerMonitorFactory() {
            @Override
            public ServerMonitor create(final SdamServerDescriptionManager sdamServerDescriptionManager) {
                return new DefaultServerMonitor(serverId, serverSettings, heartbeatConnectionFactory, sdamServerDescriptionManager);
            }
        };

        return new DefaultServer(serverId, clusterConnectionMode, connectionPool, serverMonitorFactory, serverListener, cluster);
    }

    @Override
    public ServerSettings getSettings() {
        return serverSettings;
    }
}
