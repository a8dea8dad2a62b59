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

import com.docdriver.ServerAddress;
import com.docdriver.TagSet;
import com.docdriver.annotations.Immutable;
import com.docdriver.lang.Nullable;
import org.bson.types.ObjectId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.docdriver.assertions.Assertions.notNull;
import static java.lang.String.format;

/**
 * Immutable snapshot state of a cluster: the connection mode, the aggregate cluster type and one {@link ServerDescription} per
 * known server, in the order in which the servers were discovered.
 */
@Immutable
public class ClusterDescription {
    private final ClusterConnectionMode connectionMode;
    private final ClusterType type;
    private final Map<ServerAddress, ServerDescription> serverDescriptions;
    @Nullable
    private final String setName;
    @Nullable
    private final ObjectId maxElectionId;
    @Nullable
    private final Integer maxSetVersion;
    private final ClusterSettings clusterSettings;
    private final ServerSettings serverSettings;

    /**
     * Creates a new ClusterDescription.
     *
     * @param connectionMode     whether to connect directly to a single server or to multiple servers
     * @param type               what sort of cluster this is
     * @param serverDescriptions the descriptions of all the servers currently in this cluster
     */
    public ClusterDescription(final ClusterConnectionMode connectionMode, final ClusterType type,
                              final List<ServerDescription> serverDescriptions) {
        this(connectionMode, type, serverDescriptions, null, null, null, ClusterSettings.builder().build(),
                ServerSettings.builder().build());
    }

    /**
     * Creates a new ClusterDescription.
     *
     * @param connectionMode     whether to connect directly to a single server or to multiple servers
     * @param type               what sort of cluster this is
     * @param serverDescriptions the descriptions of all the servers currently in this cluster
     * @param setName            the replica set name, which may be null
     * @param maxElectionId      the greatest election id reported by a primary, which may be null
     * @param maxSetVersion      the greatest set version reported by a primary, which may be null
     * @param clusterSettings    the cluster settings
     * @param serverSettings     the server settings
     */
    public ClusterDescription(final ClusterConnectionMode connectionMode, final ClusterType type,
                              final List<ServerDescription> serverDescriptions, @Nullable final String setName,
                              @Nullable final ObjectId maxElectionId, @Nullable final Integer maxSetVersion,
                              final ClusterSettings clusterSettings, final ServerSettings serverSettings) {
        notNull("serverDescriptions", serverDescriptions);
        this.connectionMode = notNull("connectionMode", connectionMode);
        this.type = notNull("type", type);
        Map<ServerAddress, ServerDescription> byAddress = new LinkedHashMap<ServerAddress, ServerDescription>();
        for (ServerDescription cur : serverDescriptions) {
            byAddress.put(cur.getAddress(), cur);
        }
        this.serverDescriptions = Collections.unmodifiableMap(byAddress);
        this.setName = setName;
        this.maxElectionId = maxElectionId;
        this.maxSetVersion = maxSetVersion;
        this.clusterSettings = notNull("clusterSettings", clusterSettings);
        this.serverSettings = notNull("serverSettings", serverSettings);
    }

    /**
     * Gets the cluster settings this description was computed under.
     *
     * @return the cluster settings
     */
    public ClusterSettings getClusterSettings() {
        return clusterSettings;
    }

    /**
     * Gets the server settings this description was computed under.
     *
     * @return the server settings
     */
    public ServerSettings getServerSettings() {
        return serverSettings;
    }

    /**
     * Return whether all servers in the cluster are compatible with the driver.
     *
     * @return true if all servers in the cluster are compatible with the driver
     */
    public boolean isCompatibleWithDriver() {
        for (ServerDescription cur : serverDescriptions.values()) {
            if (!cur.isCompatibleWithDriver()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Return a server in the cluster that is incompatibly older than the driver.
     *
     * @return a server in the cluster that is incompatibly older than the driver, or null if there are none
     */
    @Nullable
    public ServerDescription findServerIncompatiblyOlderThanDriver() {
        for (ServerDescription cur : serverDescriptions.values()) {
            if (cur.isIncompatiblyOlderThanDriver()) {
                return cur;
            }
        }
        return null;
    }

    /**
     * Return a server in the cluster that is incompatibly newer than the driver.
     *
     * @return a server in the cluster that is incompatibly newer than the driver, or null if there are none
     */
    @Nullable
    public ServerDescription findServerIncompatiblyNewerThanDriver() {
        for (ServerDescription cur : serverDescriptions.values()) {
            if (cur.isIncompatiblyNewerThanDriver()) {
                return cur;
            }
        }
        return null;
    }

    /**
     * Gets the logical session timeout in minutes, or null if at least one of the known data-bearing servers does not support
     * logical sessions.
     *
     * @return the logical session timeout in minutes, which may be null
     */
    @Nullable
    public Integer getLogicalSessionTimeoutMinutes() {
        Integer retVal = null;
        for (ServerDescription cur : getServersByPredicate(new Predicate() {
            @Override
            public boolean apply(final ServerDescription serverDescription) {
                return serverDescription.isPrimary() || serverDescription.isSecondary();
            }
        })) {
            if (cur.getLogicalSessionTimeoutMinutes() == null) {
                return null;
            }
            if (retVal == null) {
                retVal = cur.getLogicalSessionTimeoutMinutes();
            } else {
                retVal = Math.min(retVal, cur.getLogicalSessionTimeoutMinutes());
            }
        }
        return retVal;
    }

    /**
     * Gets whether this cluster is connecting to a single server or multiple servers.
     *
     * @return the ClusterConnectionMode for this cluster
     */
    public ClusterConnectionMode getConnectionMode() {
        return connectionMode;
    }

    /**
     * Gets the specific type of this cluster
     *
     * @return a ClusterType enum representing the type of this cluster
     */
    public ClusterType getType() {
        return type;
    }

    /**
     * Gets the replica set name adopted by this cluster.
     *
     * @return the replica set name, or null if this is not a replica set or no member has reported one yet
     */
    @Nullable
    public String getSetName() {
        return setName;
    }

    /**
     * Gets the greatest election id reported by any primary accepted so far.
     *
     * @return the max election id, which may be null
     */
    @Nullable
    public ObjectId getMaxElectionId() {
        return maxElectionId;
    }

    /**
     * Gets the greatest set version reported by any primary accepted so far.
     *
     * @return the max set version, which may be null
     */
    @Nullable
    public Integer getMaxSetVersion() {
        return maxSetVersion;
    }

    /**
     * Returns the descriptions of all servers in the cluster, in discovery order.
     *
     * @return an unmodifiable list of the server descriptions
     */
    public List<ServerDescription> getServerDescriptions() {
        return Collections.unmodifiableList(new ArrayList<ServerDescription>(serverDescriptions.values()));
    }

    /**
     * Gets the description of the server with the given address.
     *
     * @param serverAddress the server address
     * @return the server description, or null if the server is not a member of the cluster
     */
    @Nullable
    public ServerDescription getByServerAddress(final ServerAddress serverAddress) {
        return serverDescriptions.get(serverAddress);
    }

    /**
     * Returns whether the cluster contains a server with the given address.
     *
     * @param serverAddress the server address
     * @return true if the server is a member of the cluster
     */
    public boolean containsServer(final ServerAddress serverAddress) {
        return serverDescriptions.containsKey(serverAddress);
    }

    /**
     * Get a list of all the primaries in this cluster.
     *
     * @return a List of ServerDescription instances
     */
    public List<ServerDescription> getPrimaries() {
        return getServersByPredicate(new Predicate() {
            public boolean apply(final ServerDescription serverDescription) {
                return serverDescription.isPrimary();
            }
        });
    }

    /**
     * Get a list of all the secondaries in this cluster
     *
     * @return a List of ServerDescription instances
     */
    public List<ServerDescription> getSecondaries() {
        return getServersByPredicate(new Predicate() {
            public boolean apply(final ServerDescription serverDescription) {
                return serverDescription.isSecondary();
            }
        });
    }

    /**
     * Get a list of all the secondaries in this cluster that match a given TagSet
     *
     * @param tagSet a Set of replica set tags
     * @return a List of ServerDescription instances
     */
    public List<ServerDescription> getSecondaries(final TagSet tagSet) {
        return getServersByPredicate(new Predicate() {
            public boolean apply(final ServerDescription serverDescription) {
                return serverDescription.isSecondary() && serverDescription.hasTags(tagSet);
            }
        });
    }

    /**
     * Gets a list of ServerDescriptions for all the servers in this cluster which are currently accessible.
     *
     * @return a List of ServerDescriptions for all servers that have a status of OK
     */
    public List<ServerDescription> getAny() {
        return getServersByPredicate(new Predicate() {
            public boolean apply(final ServerDescription serverDescription) {
                return serverDescription.isOk();
            }
        });
    }

    /**
     * Gets a list of all the primaries and secondaries in this cluster.
     *
     * @return a list of ServerDescriptions for all primary and secondary servers
     */
    public List<ServerDescription> getAnyPrimaryOrSecondary() {
        return getServersByPredicate(new Predicate() {
            public boolean apply(final ServerDescription serverDescription) {
                return serverDescription.isPrimary() || serverDescription.isSecondary();
            }
        });
    }

    /**
     * Gets a list of all the primaries and secondaries in this cluster that match the given replica set tags.
     *
     * @param tagSet a Set of replica set tags
     * @return a list of ServerDescriptions for all primary and secondary servers that contain all of the given tags
     */
    public List<ServerDescription> getAnyPrimaryOrSecondary(final TagSet tagSet) {
        return getServersByPredicate(new Predicate() {
            public boolean apply(final ServerDescription serverDescription) {
                return (serverDescription.isPrimary() || serverDescription.isSecondary()) && serverDescription.hasTags(tagSet);
            }
        });
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        ClusterDescription that = (ClusterDescription) o;

        if (connectionMode != that.connectionMode) {
            return false;
        }
        if (type != that.type) {
            return false;
        }
        if (!serverDescriptions.equals(that.serverDescriptions)) {
            return false;
        }
        if (setName != null ? !setName.equals(that.setName) : that.setName != null) {
            return false;
        }
        if (maxElectionId != null ? !maxElectionId.equals(that.maxElectionId) : that.maxElectionId != null) {
            return false;
        }
        return maxSetVersion != null ? maxSetVersion.equals(that.maxSetVersion) : that.maxSetVersion == null;
    }

    @Override
    public int hashCode() {
        int result = connectionMode.hashCode();
        result = 31 * result + type.hashCode();
        result = 31 * result + serverDescriptions.hashCode();
        result = 31 * result + (setName != null ? setName.hashCode() : 0);
        result = 31 * result + (maxElectionId != null ? maxElectionId.hashCode() : 0);
        result = 31 * result + (maxSetVersion != null ? maxSetVersion.hashCode() : 0);
        return result;
    }

    @Override
    public String toString() {
        return "ClusterDescription{"
               + "type=" + getType()
               + ", connectionMode=" + connectionMode
               + ", setName=" + setName
               + ", serverDescriptions=" + serverDescriptions.values()
               + '}';
    }

    /**
     * Returns a short, pretty description for this ClusterDescription.
     *
     * @return a String describing this cluster.
     */
    public String getShortDescription() {
        StringBuilder serverDescriptionsBuilder = new StringBuilder();
        String delimiter = "";
        for (final ServerDescription cur : serverDescriptions.values()) {
            serverDescriptionsBuilder.append(delimiter).append(cur.getShortDescription());
            delimiter = ", ";
        }
        return format("{type=%s, servers=[%s]}", type, serverDescriptionsBuilder.toString());
    }

    private interface Predicate {
        boolean apply(ServerDescription serverDescription);
    }

    private List<ServerDescription> getServersByPredicate(final Predicate predicate) {
        List<ServerDescription> membersByTag = new ArrayList<ServerDescription>();

        for (final ServerDescription cur : serverDescriptions.values()) {
            if (predicate.apply(cur)) {
                membersByTag.add(cur);
            }
        }

        return membersByTag;
    }
}
