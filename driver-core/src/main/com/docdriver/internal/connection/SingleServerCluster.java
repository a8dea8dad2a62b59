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
import com.docdriver.ServerAddress;
import com.docdriver.connection.ClusterDescription;
import com.docdriver.connection.ClusterId;
import com.docdriver.connection.ClusterSettings;
import com.docdriver.connection.ClusterType;
import com.docdriver.connection.ServerDescription;
import com.docdriver.event.ServerDescriptionChangedEvent;
import com.docdriver.lang.Nullable;

import java.util.Collections;

import static com.docdriver.assertions.Assertions.isTrue;
import static com.docdriver.connection.ClusterConnectionMode.LOAD_BALANCED;
import static com.docdriver.connection.ClusterConnectionMode.SINGLE;
import static com.docdriver.connection.ServerType.LOAD_BALANCER;
import static com.docdriver.connection.ServerType.REPLICA_SET_GHOST;
import static com.docdriver.internal.connection.ServerDescriptionHelper.isStale;
import static com.docdriver.internal.connection.ServerDescriptionHelper.unknownConnectingServerDescription;
import static java.lang.String.format;

/**
 * This class needs to be final because we are leaking a reference to "this" from within the constructor
 */
final class SingleServerCluster extends BaseCluster {
    private final ClusterableServer server;
    private volatile ServerDescription serverDescription;

    SingleServerCluster(final ClusterId clusterId, final ClusterSettings settings, final ClusterableServerFactory serverFactory) {
        super(clusterId, settings, serverFactory);
        isTrue("one server in a direct cluster", settings.getHosts().size() == 1);
        isTrue("connection mode is single or load balanced",
                settings.getMode() == SINGLE || settings.getMode() == LOAD_BALANCED);

        if (LOGGER.isInfoEnabled()) {
            LOGGER.info(format("Cluster created with settings %s", settings.getShortDescription()));
        }

        ServerAddress serverAddress = settings.getHosts().get(0);
        serverDescription = unknownConnectingServerDescription(serverAddress, null);

        // synchronized in the constructor because the change listener is re-entrant to this instance.
        // In other words, we are leaking a reference to "this" from the constructor.
        getLock().lock();
        try {
            server = getServerFactory().create(this, serverAddress);
            publishDescription(serverDescription);
        } finally {
            getLock().unlock();
        }
    }

    @Override
    void connect() {
        server.connect();
    }

    @Override
    @Nullable
    ClusterableServer getServer(final ServerAddress serverAddress) {
        isTrue("open", !isClosed());
        return server.isClosed() ? null : server;
    }

    @Override
    public void onChange(final ServerDescriptionChangedEvent event) {
        getLock().lock();
        try {
            if (isClosed()) {
                return;
            }
            ServerDescription newDescription = event.getNewDescription();
            if (isStale(serverDescription, newDescription)) {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug(format("Ignoring stale description for server %s with topology version %s",
                            newDescription.getAddress(), newDescription.getTopologyVersion()));
                }
                return;
            }
            if (newDescription.isOk() && getSettings().getMode() == SINGLE) {
                newDescription = validateDirectDescription(newDescription);
            }
            serverDescription = newDescription;
            publishDescription(newDescription);
        } finally {
            getLock().unlock();
        }
    }

    private ServerDescription validateDirectDescription(final ServerDescription newDescription) {
        if (newDescription.getType() == LOAD_BALANCER) {
            return invalidDescription(newDescription,
                    "A load balancer was discovered but the cluster is not configured for load balanced mode");
        }
        String requiredReplicaSetName = getSettings().getRequiredReplicaSetName();
        if (requiredReplicaSetName != null && !requiredReplicaSetName.equals(newDescription.getSetName())) {
            return invalidDescription(newDescription, format("Replica set name '%s' does not match required replica set name of '%s'",
                    newDescription.getSetName(), requiredReplicaSetName));
        }
        ClusterType requiredClusterType = getSettings().getRequiredClusterType();
        if (requiredClusterType != ClusterType.UNKNOWN && newDescription.getType() != REPLICA_SET_GHOST
                && newDescription.getType().getClusterType() != requiredClusterType
                && !(requiredClusterType.isReplicaSet() && newDescription.isReplicaSetMember())) {
            return invalidDescription(newDescription, format("Expecting a server of cluster type %s, but found a %s",
                    requiredClusterType, newDescription.getType()));
        }
        return newDescription;
    }

    private ServerDescription invalidDescription(final ServerDescription newDescription, final String message) {
        LOGGER.error(format("%s at %s", message, newDescription.getAddress()));
        return ServerDescription.builder(unknownConnectingServerDescription(newDescription.getAddress(),
                        new MongoConfigurationException(message)))
                .topologyVersion(newDescription.getTopologyVersion())
                .build();
    }

    private void publishDescription(final ServerDescription serverDescription) {
        ClusterType clusterType = getSettings().getMode() == LOAD_BALANCED ? ClusterType.LOAD_BALANCED : ClusterType.SINGLE;
        updateDescription(new ClusterDescription(getSettings().getMode(), clusterType, Collections.singletonList(serverDescription),
                serverDescription.getSetName(), serverDescription.getElectionId(), serverDescription.getSetVersion(), getSettings(),
                getServerSettings()));
    }

    @Override
    public void close() {
        getLock().lock();
        try {
            if (!isClosed()) {
                server.close();
            }
        } finally {
            getLock().unlock();
        }
        super.close();
    }
}
