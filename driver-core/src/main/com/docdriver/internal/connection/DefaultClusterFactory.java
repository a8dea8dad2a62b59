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

import com.docdriver.MongoConfigurationException;
import com.docdriver.connection.ClusterConnectionMode;
import com.docdriver.connection.ClusterId;
import com.docdriver.connection.ClusterSettings;
import com.docdriver.connection.ClusterType;
import com.docdriver.connection.ConnectionPoolSettings;
import com.docdriver.connection.ServerSettings;
import com.docdriver.connection.SocketSettings;
import com.docdriver.lang.Nullable;

import static com.docdriver.assertions.Assertions.notNull;
import static java.lang.String.format;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * The factory for the topology manager of a client.  Validates that the settings describe a topology that can exist, then creates a
 * cluster that immediately starts monitoring its seed servers.
 *
 * <p>This class is not part of the public API and may be removed or changed at any time</p>
 */
public final class DefaultClusterFactory {

    /**
     * Creates a cluster connected over plain sockets.
     *
     * @param clusterSettings        the cluster settings
     * @param serverSettings         the server monitoring settings
     * @param connectionPoolSettings the connection pool settings
     * @param socketSettings         the settings for application connections
     * @param applicationName        the application name sent in the handshake, which may be null
     * @return the cluster, already monitoring its seed servers
     * @throws MongoConfigurationException if the settings are contradictory
     */
    public Cluster createCluster(final ClusterSettings clusterSettings, final ServerSettings serverSettings,
                                 final ConnectionPoolSettings connectionPoolSettings, final SocketSettings socketSettings,
                                 @Nullable final String applicationName) {
        notNull("clusterSettings", clusterSettings);
        notNull("serverSettings", serverSettings);
        notNull("connectionPoolSettings", connectionPoolSettings);
        notNull("socketSettings", socketSettings);
        validate(clusterSettings);

        ClusterId clusterId = new ClusterId(clusterSettings.getDescription());
        SocketSettings heartbeatSocketSettings = SocketSettings.builder()
                .applySettings(socketSettings)
                .readTimeout(socketSettings.getConnectTimeout(MILLISECONDS), MILLISECONDS)
                .build();
        ClusterableServerFactory serverFactory = new DefaultClusterableServerFactory(clusterId, clusterSettings.getMode(),
                serverSettings, connectionPoolSettings, new SocketStreamFactory(socketSettings),
                new SocketStreamFactory(heartbeatSocketSettings), applicationName);
        return createCluster(clusterId, clusterSettings, serverFactory);
    }

    Cluster createCluster(final ClusterSettings clusterSettings, final ClusterableServerFactory serverFactory) {
        notNull("clusterSettings", clusterSettings);
        notNull("serverFactory", serverFactory);
        validate(clusterSettings);
        return createCluster(new ClusterId(clusterSettings.getDescription()), clusterSettings, serverFactory);
    }

    private Cluster createCluster(final ClusterId clusterId, final ClusterSettings clusterSettings,
                                  final ClusterableServerFactory serverFactory) {
        switch (clusterSettings.getMode()) {
            case SINGLE:
            case LOAD_BALANCED:
                return new SingleServerCluster(clusterId, clusterSettings, serverFactory);
            case MULTIPLE:
                return new MultiServerCluster(clusterId, clusterSettings, serverFactory);
            default:
                throw new UnsupportedOperationException("Unsupported cluster mode: " + clusterSettings.getMode());
        }
    }

    private static void validate(final ClusterSettings clusterSettings) {
        ClusterConnectionMode mode = clusterSettings.getMode();
        int hostCount = clusterSettings.getHosts().size();
        if (hostCount == 0) {
            throw new MongoConfigurationException("At least one seed host is required");
        }
        if (mode != ClusterConnectionMode.MULTIPLE && hostCount > 1) {
            throw new MongoConfigurationException(format("Connection mode %s requires exactly one host, but %d were supplied: %s",
                    mode, hostCount, clusterSettings.getHosts()));
        }
        if (mode == ClusterConnectionMode.LOAD_BALANCED && clusterSettings.getRequiredReplicaSetName() != null) {
            throw new MongoConfigurationException("A replica set name can not be required in load balanced mode");
        }
        ClusterType requiredClusterType = clusterSettings.getRequiredClusterType();
        if (clusterSettings.getRequiredReplicaSetName() != null && requiredClusterType != ClusterType.UNKNOWN
                && !requiredClusterType.isReplicaSet()) {
            throw new MongoConfigurationException(format("A required replica set name contradicts the required cluster type %s",
                    requiredClusterType));
        }
        if (mode == ClusterConnectionMode.LOAD_BALANCED && requiredClusterType != ClusterType.UNKNOWN
                && requiredClusterType != ClusterType.LOAD_BALANCED) {
            throw new MongoConfigurationException(format("Connection mode %s can not require a cluster type of %s",
                    mode, requiredClusterType));
        }
    }
}
