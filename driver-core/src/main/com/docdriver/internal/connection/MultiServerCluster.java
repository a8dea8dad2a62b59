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
import com.docdriver.connection.ClusterConnectionMode;
import com.docdriver.connection.ClusterDescription;
import com.docdriver.connection.ClusterId;
import com.docdriver.connection.ClusterSettings;
import com.docdriver.connection.ClusterType;
import com.docdriver.connection.ServerDescription;
import com.docdriver.event.ServerDescriptionChangedEvent;
import com.docdriver.lang.Nullable;
import org.bson.types.ObjectId;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.docdriver.assertions.Assertions.isTrue;
import static com.docdriver.connection.ClusterType.REPLICA_SET_NO_PRIMARY;
import static com.docdriver.connection.ClusterType.REPLICA_SET_WITH_PRIMARY;
import static com.docdriver.connection.ClusterType.SHARDED;
import static com.docdriver.connection.ClusterType.SINGLE;
import static com.docdriver.connection.ClusterType.UNKNOWN;
import static com.docdriver.connection.ServerConnectionState.CONNECTING;
import static com.docdriver.connection.ServerType.LOAD_BALANCER;
import static com.docdriver.connection.ServerType.REPLICA_SET_GHOST;
import static com.docdriver.connection.ServerType.STANDALONE;
import static com.docdriver.internal.connection.ServerDescriptionHelper.isStale;
import static com.docdriver.internal.connection.ServerDescriptionHelper.unknownConnectingServerDescription;
import static java.lang.String.format;

/**
 * A cluster discovered from a seed list, applying the server discovery and monitoring rules to every description its servers report.
 * Servers are added as they are discovered and closed as soon as they leave the cluster.
 */
final class MultiServerCluster extends BaseCluster {
    private ClusterType clusterType;
    private String replicaSetName;
    private ObjectId maxElectionId;
    private Integer maxSetVersion;

    private final Map<ServerAddress, ServerTuple> addressToServerTupleMap = new LinkedHashMap<ServerAddress, ServerTuple>();

    MultiServerCluster(final ClusterId clusterId, final ClusterSettings settings, final ClusterableServerFactory serverFactory) {
        super(clusterId, settings, serverFactory);
        isTrue("connection mode is multiple", settings.getMode() == ClusterConnectionMode.MULTIPLE);
        clusterType = settings.getRequiredClusterType();
        replicaSetName = settings.getRequiredReplicaSetName();

        if (LOGGER.isInfoEnabled()) {
            LOGGER.info(format("Cluster created with settings %s", settings.getShortDescription()));
        }

        getLock().lock();
        try {
            for (final ServerAddress serverAddress : settings.getHosts()) {
                addServer(serverAddress);
            }
            updateDescription();
        } finally {
            getLock().unlock();
        }
    }

    @Override
    void connect() {
        for (ClusterableServer server : getServers()) {
            server.connect();
        }
    }

    @Override
    public void close() {
        getLock().lock();
        try {
            if (!isClosed()) {
                for (final ServerTuple serverTuple : addressToServerTupleMap.values()) {
                    ((ClusterableServer) serverTuple.getServer()).close();
                }
                addressToServerTupleMap.clear();
            }
        } finally {
            getLock().unlock();
        }
        super.close();
    }

    @Override
    @Nullable
    ClusterableServer getServer(final ServerAddress serverAddress) {
        isTrue("is open", !isClosed());
        getLock().lock();
        try {
            ServerTuple serverTuple = addressToServerTupleMap.get(serverAddress);
            return serverTuple == null ? null : (ClusterableServer) serverTuple.getServer();
        } finally {
            getLock().unlock();
        }
    }

    @Override
    public void onChange(final ServerDescriptionChangedEvent event) {
        getLock().lock();
        try {
            if (isClosed()) {
                return;
            }

            ServerDescription newDescription = event.getNewDescription();

            if (LOGGER.isTraceEnabled()) {
                LOGGER.trace(format("Handling description changed event for server %s with description %s",
                        newDescription.getAddress(), newDescription));
            }

            ServerTuple serverTuple = addressToServerTupleMap.get(newDescription.getAddress());
            if (serverTuple == null) {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug(format("Ignoring description changed event for removed server %s", newDescription.getAddress()));
                }
                return;
            }

            if (isStale(serverTuple.getServerDescription(), newDescription)) {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug(format("Ignoring stale description for server %s with topology version %s",
                            newDescription.getAddress(), newDescription.getTopologyVersion()));
                }
                return;
            }

            if (newDescription.getType() == LOAD_BALANCER) {
                newDescription = unknownConnectingServerDescription(newDescription.getAddress(), new MongoConfigurationException(
                        "A load balancer was discovered but the cluster is not configured for load balanced mode"));
            }

            boolean shouldUpdateDescription = true;
            if (newDescription.isOk()) {
                if (clusterType == UNKNOWN && newDescription.getType() != REPLICA_SET_GHOST) {
                    clusterType = newDescription.getType().getClusterType();
                    if (LOGGER.isInfoEnabled()) {
                        LOGGER.info(format("Discovered cluster type of %s", clusterType));
                    }
                }

                switch (clusterType) {
                    case REPLICA_SET_NO_PRIMARY:
                    case REPLICA_SET_WITH_PRIMARY:
                        shouldUpdateDescription = handleReplicaSetMemberChanged(newDescription);
                        break;
                    case SHARDED:
                        shouldUpdateDescription = handleShardRouterChanged(newDescription);
                        break;
                    case SINGLE:
                        shouldUpdateDescription = handleStandAloneChanged(newDescription);
                        break;
                    default:
                        break;
                }
            }

            if (shouldUpdateDescription) {
                replaceServerDescription(newDescription);
            }
            updateDescription();
        } finally {
            getLock().unlock();
        }
    }

    private boolean handleReplicaSetMemberChanged(final ServerDescription newDescription) {
        if (!newDescription.isReplicaSetMember()) {
            LOGGER.error(format("Expecting replica set member, but found a %s.  Removing %s from client view of cluster.",
                    newDescription.getType(), newDescription.getAddress()));
            removeServer(newDescription.getAddress());
            return false;
        }

        if (newDescription.getType() == REPLICA_SET_GHOST) {
            if (LOGGER.isInfoEnabled()) {
                LOGGER.info(format("Server %s does not appear to be a member of an initiated replica set.", newDescription.getAddress()));
            }
            return true;
        }

        if (replicaSetName == null) {
            replicaSetName = newDescription.getSetName();
        }

        if (!replicaSetName.equals(newDescription.getSetName())) {
            LOGGER.error(format("Expecting replica set member from set '%s', but found one from set '%s'.  "
                    + "Removing %s from client view of cluster.", replicaSetName, newDescription.getSetName(),
                    newDescription.getAddress()));
            removeServer(newDescription.getAddress());
            return false;
        }

        if (newDescription.isPrimary()) {
            if (isStalePrimary(newDescription)) {
                LOGGER.warn(format("Invalidating potential primary %s whose (election id, set version) tuple of (%s, %d) "
                                + "is less than one already seen of (%s, %d)", newDescription.getAddress(),
                        newDescription.getElectionId(), newDescription.getSetVersion(), maxElectionId, maxSetVersion));
                replaceServerDescription(ServerDescription.builder()
                        .address(newDescription.getAddress())
                        .state(CONNECTING)
                        .topologyVersion(newDescription.getTopologyVersion())
                        .build());
                return false;
            }

            if (newDescription.getElectionId() != null || newDescription.getSetVersion() != null) {
                maxElectionId = newDescription.getElectionId();
                maxSetVersion = newDescription.getSetVersion();
            }

            invalidateOldPrimaries(newDescription.getAddress());
            addNewHosts(newDescription.getAllReplicaSetMembers());
            if (removeExtraHosts(newDescription)) {
                return false;
            }
        } else {
            if (!isAnyPrimaryKnown()) {
                addNewHosts(newDescription.getAllReplicaSetMembers());
            }
            if (newDescription.getCanonicalAddress() != null
                    && !newDescription.getAddress().equals(new ServerAddress(newDescription.getCanonicalAddress()))) {
                if (LOGGER.isInfoEnabled()) {
                    LOGGER.info(format("Canonical address %s does not match server address.  Removing %s from client view of cluster",
                            newDescription.getCanonicalAddress(), newDescription.getAddress()));
                }
                removeServer(newDescription.getAddress());
                return false;
            }
        }
        return true;
    }

    private boolean handleShardRouterChanged(final ServerDescription newDescription) {
        if (!newDescription.isShardRouter()) {
            LOGGER.error(format("Expecting a %s, but found a %s.  Removing %s from client view of cluster.",
                    SHARDED, newDescription.getType(), newDescription.getAddress()));
            removeServer(newDescription.getAddress());
            return false;
        }
        return true;
    }

    private boolean handleStandAloneChanged(final ServerDescription newDescription) {
        if (newDescription.getType() != STANDALONE) {
            LOGGER.error(format("Expecting a %s, but found a %s.  Removing %s from client view of cluster.",
                    STANDALONE, newDescription.getType(), newDescription.getAddress()));
            removeServer(newDescription.getAddress());
            return false;
        }
        Iterator<Map.Entry<ServerAddress, ServerTuple>> iterator = addressToServerTupleMap.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<ServerAddress, ServerTuple> entry = iterator.next();
            if (!entry.getKey().equals(newDescription.getAddress())) {
                if (LOGGER.isInfoEnabled()) {
                    LOGGER.info(format("Server %s is a standalone.  Removing %s from client view of cluster.",
                            newDescription.getAddress(), entry.getKey()));
                }
                iterator.remove();
                ((ClusterableServer) entry.getValue().getServer()).close();
            }
        }
        return true;
    }

    // (election id, set version) ordering, with the election id compared first and null lowest
    private boolean isStalePrimary(final ServerDescription description) {
        int electionIdComparison = compareNullable(description.getElectionId(), maxElectionId);
        if (electionIdComparison != 0) {
            return electionIdComparison < 0;
        }
        return compareNullable(description.getSetVersion(), maxSetVersion) < 0;
    }

    private static <T extends Comparable<T>> int compareNullable(@Nullable final T first, @Nullable final T second) {
        if (first == null) {
            return second == null ? 0 : -1;
        }
        if (second == null) {
            return 1;
        }
        return first.compareTo(second);
    }

    private boolean isAnyPrimaryKnown() {
        for (ServerTuple serverTuple : addressToServerTupleMap.values()) {
            if (serverTuple.getServerDescription().isPrimary()) {
                return true;
            }
        }
        return false;
    }

    private void invalidateOldPrimaries(final ServerAddress newPrimary) {
        for (final ServerTuple serverTuple : new ArrayList<ServerTuple>(addressToServerTupleMap.values())) {
            ServerDescription serverDescription = serverTuple.getServerDescription();
            if (!serverDescription.getAddress().equals(newPrimary) && serverDescription.isPrimary()) {
                if (LOGGER.isInfoEnabled()) {
                    LOGGER.info(format("Rediscovering type of existing primary %s", serverDescription.getAddress()));
                }
                replaceServerDescription(ServerDescription.builder()
                        .address(serverDescription.getAddress())
                        .state(CONNECTING)
                        .topologyVersion(serverDescription.getTopologyVersion())
                        .build());
                ((ClusterableServer) serverTuple.getServer()).connect();
            }
        }
    }

    private void addNewHosts(final Set<String> hosts) {
        for (final String cur : hosts) {
            addServer(new ServerAddress(cur));
        }
    }

    /**
     * Removes the members that the primary does not report.
     *
     * @return true if the primary itself was removed
     */
    private boolean removeExtraHosts(final ServerDescription primaryDescription) {
        Set<ServerAddress> allServerAddresses = getAllServerAddresses(primaryDescription);
        boolean primaryRemoved = false;
        for (final ServerAddress cur : new ArrayList<ServerAddress>(addressToServerTupleMap.keySet())) {
            if (!allServerAddresses.contains(cur)) {
                if (LOGGER.isInfoEnabled()) {
                    LOGGER.info(format("Server %s is no longer a member of the replica set.  Removing from client view of cluster.", cur));
                }
                removeServer(cur);
                primaryRemoved |= cur.equals(primaryDescription.getAddress());
            }
        }
        return primaryRemoved;
    }

    private Set<ServerAddress> getAllServerAddresses(final ServerDescription serverDescription) {
        Set<ServerAddress> retVal = new HashSet<ServerAddress>();
        for (final String host : serverDescription.getAllReplicaSetMembers()) {
            retVal.add(new ServerAddress(host));
        }
        return retVal;
    }

    private void addServer(final ServerAddress serverAddress) {
        if (!addressToServerTupleMap.containsKey(serverAddress)) {
            if (LOGGER.isInfoEnabled()) {
                LOGGER.info(format("Adding discovered server %s to client view of cluster", serverAddress));
            }
            ClusterableServer server = getServerFactory().create(this, serverAddress);
            addressToServerTupleMap.put(serverAddress, new ServerTuple(server,
                    unknownConnectingServerDescription(serverAddress, null)));
        }
    }

    private void removeServer(final ServerAddress serverAddress) {
        ServerTuple removed = addressToServerTupleMap.remove(serverAddress);
        if (removed != null) {
            ((ClusterableServer) removed.getServer()).close();
        }
    }

    private void replaceServerDescription(final ServerDescription newDescription) {
        ServerTuple serverTuple = addressToServerTupleMap.get(newDescription.getAddress());
        if (serverTuple != null) {
            addressToServerTupleMap.put(newDescription.getAddress(), new ServerTuple(serverTuple.getServer(), newDescription));
        }
    }

    private List<ClusterableServer> getServers() {
        getLock().lock();
        try {
            List<ClusterableServer> servers = new ArrayList<ClusterableServer>();
            for (final ServerTuple serverTuple : addressToServerTupleMap.values()) {
                servers.add((ClusterableServer) serverTuple.getServer());
            }
            return servers;
        } finally {
            getLock().unlock();
        }
    }

    private void updateDescription() {
        List<ServerDescription> newServerDescriptionList = getNewServerDescriptionList();
        updateDescription(new ClusterDescription(ClusterConnectionMode.MULTIPLE, getAggregateClusterType(newServerDescriptionList),
                newServerDescriptionList, replicaSetName, maxElectionId, maxSetVersion, getSettings(), getServerSettings()));
    }

    private ClusterType getAggregateClusterType(final List<ServerDescription> serverDescriptions) {
        if (serverDescriptions.isEmpty()) {
            return UNKNOWN;
        }
        if (clusterType.isReplicaSet()) {
            for (ServerDescription serverDescription : serverDescriptions) {
                if (serverDescription.isPrimary()) {
                    return REPLICA_SET_WITH_PRIMARY;
                }
            }
            return REPLICA_SET_NO_PRIMARY;
        }
        return clusterType;
    }

    private List<ServerDescription> getNewServerDescriptionList() {
        List<ServerDescription> serverDescriptions = new ArrayList<ServerDescription>();
        for (final ServerTuple cur : addressToServerTupleMap.values()) {
            serverDescriptions.add(cur.getServerDescription());
        }
        return serverDescriptions;
    }
}
