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
import com.docdriver.annotations.NotThreadSafe;
import com.docdriver.lang.Nullable;
import org.bson.types.ObjectId;

import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static com.docdriver.assertions.Assertions.notNull;
import static com.docdriver.connection.ServerConnectionState.CONNECTED;
import static com.docdriver.connection.ServerType.LOAD_BALANCER;
import static com.docdriver.connection.ServerType.REPLICA_SET_ARBITER;
import static com.docdriver.connection.ServerType.REPLICA_SET_OTHER;
import static com.docdriver.connection.ServerType.REPLICA_SET_PRIMARY;
import static com.docdriver.connection.ServerType.REPLICA_SET_SECONDARY;
import static com.docdriver.connection.ServerType.SHARD_ROUTER;
import static com.docdriver.connection.ServerType.STANDALONE;
import static com.docdriver.connection.ServerType.UNKNOWN;
import static java.lang.String.format;

/**
 * Immutable snapshot state of a server, as produced by one health check.  A new instance is created for every check; instances are
 * never updated in place.
 */
@Immutable
public final class ServerDescription {

    /**
     * The minimum supported driver server version
     */
    public static final String MIN_DRIVER_SERVER_VERSION = "3.6";

    /**
     * The minimum supported driver wire version
     */
    public static final int MIN_DRIVER_WIRE_VERSION = 6;

    /**
     * The maximum supported driver wire version
     */
    public static final int MAX_DRIVER_WIRE_VERSION = 25;

    private static final int DEFAULT_MAX_DOCUMENT_SIZE = 0x1000000;  // 16MB

    private final ServerAddress address;

    private final ServerType type;

    @Nullable
    private final String canonicalAddress;
    private final Set<String> hosts;
    private final Set<String> passives;
    private final Set<String> arbiters;
    @Nullable
    private final String primary;
    private final int maxDocumentSize;
    private final TagSet tagSet;
    @Nullable
    private final String setName;
    private final long roundTripTimeNanos;
    private final boolean ok;
    private final ServerConnectionState state;

    private final int minWireVersion;
    private final int maxWireVersion;

    @Nullable
    private final ObjectId electionId;
    @Nullable
    private final Integer setVersion;
    @Nullable
    private final TopologyVersion topologyVersion;
    @Nullable
    private final Date lastWriteDate;
    private final long lastUpdateTimeNanos;

    @Nullable
    private final Integer logicalSessionTimeoutMinutes;

    @Nullable
    private final Throwable exception;

    /**
     * Gets a Builder for creating a new ServerDescription instance.
     *
     * @return a new Builder for ServerDescription.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a builder instance populated from the given description.
     *
     * @param serverDescription the description to copy
     * @return a new Builder
     */
    public static Builder builder(final ServerDescription serverDescription) {
        return new Builder(serverDescription);
    }

    /**
     * Gets the string representing the host name and port that this member of a replica set was configured with,
     * e.g. {@code "somehost:27019"}. This is typically derived from the "me" field from the "hello" command response.
     *
     * @return the host name and port that this replica set member is configured with.
     */
    @Nullable
    public String getCanonicalAddress() {
        return canonicalAddress;
    }

    /**
     * A builder for creating ServerDescription.
     */
    @NotThreadSafe
    public static class Builder {
        private ServerAddress address;
        private ServerType type = UNKNOWN;
        private String canonicalAddress;
        private Set<String> hosts = Collections.emptySet();
        private Set<String> passives = Collections.emptySet();
        private Set<String> arbiters = Collections.emptySet();
        private String primary;
        private int maxDocumentSize = DEFAULT_MAX_DOCUMENT_SIZE;
        private TagSet tagSet = new TagSet();
        private String setName;
        private long roundTripTimeNanos;
        private boolean ok;
        private ServerConnectionState state;
        private int minWireVersion = 0;
        private int maxWireVersion = 0;
        private ObjectId electionId;
        private Integer setVersion;
        private TopologyVersion topologyVersion;
        private Date lastWriteDate;
        private long lastUpdateTimeNanos = System.nanoTime();
        private Integer logicalSessionTimeoutMinutes;

        private Throwable exception;

        Builder() {
        }

        Builder(final ServerDescription serverDescription) {
            this.address = serverDescription.address;
            this.type = serverDescription.type;
            this.canonicalAddress = serverDescription.canonicalAddress;
            this.hosts = serverDescription.hosts;
            this.passives = serverDescription.passives;
            this.arbiters = serverDescription.arbiters;
            this.primary = serverDescription.primary;
            this.maxDocumentSize = serverDescription.maxDocumentSize;
            this.tagSet = serverDescription.tagSet;
            this.setName = serverDescription.setName;
            this.roundTripTimeNanos = serverDescription.roundTripTimeNanos;
            this.ok = serverDescription.ok;
            this.state = serverDescription.state;
            this.minWireVersion = serverDescription.minWireVersion;
            this.maxWireVersion = serverDescription.maxWireVersion;
            this.electionId = serverDescription.electionId;
            this.setVersion = serverDescription.setVersion;
            this.topologyVersion = serverDescription.topologyVersion;
            this.lastWriteDate = serverDescription.lastWriteDate;
            this.lastUpdateTimeNanos = serverDescription.lastUpdateTimeNanos;
            this.logicalSessionTimeoutMinutes = serverDescription.logicalSessionTimeoutMinutes;
            this.exception = serverDescription.exception;
        }

        /**
         * Sets the address of the server.
         *
         * @param address the address of the server
         * @return this
         */
        public Builder address(final ServerAddress address) {
            this.address = address;
            return this;
        }

        /**
         * Sets the canonical host name and port of this server. This is typically derived from the "me" field contained in the "hello"
         * command response.
         *
         * @param canonicalAddress the host name and port as a string
         * @return this
         */
        public Builder canonicalAddress(@Nullable final String canonicalAddress) {
            this.canonicalAddress = canonicalAddress;
            return this;
        }

        /**
         * Sets the type of the server, for example whether it's a standalone or in a replica set.
         *
         * @param type the Server type
         * @return this
         */
        public Builder type(final ServerType type) {
            this.type = notNull("type", type);
            return this;
        }

        /**
         * Sets all members of the replica set that are neither hidden, passive, nor arbiters.
         *
         * @param hosts A Set of strings in the format of "[hostname]:[port]" that contains all members of the replica set that are
         *              neither hidden, passive, nor arbiters.
         * @return this
         */
        public Builder hosts(@Nullable final Set<String> hosts) {
            this.hosts = hosts == null ? Collections.<String>emptySet() : Collections.unmodifiableSet(new LinkedHashSet<String>(hosts));
            return this;
        }

        /**
         * Sets the passive members of the replica set.
         *
         * @param passives A Set of strings in the format of "[hostname]:[port]" listing all members of the replica set which have a
         *                 priority of 0.
         * @return this
         */
        public Builder passives(@Nullable final Set<String> passives) {
            this.passives = passives == null ? Collections.<String>emptySet()
                                     : Collections.unmodifiableSet(new LinkedHashSet<String>(passives));
            return this;
        }

        /**
         * Sets the arbiters in the replica set
         *
         * @param arbiters A Set of strings in the format of "[hostname]:[port]" containing all members of the replica set that are
         *                 arbiters.
         * @return this
         */
        public Builder arbiters(@Nullable final Set<String> arbiters) {
            this.arbiters = arbiters == null ? Collections.<String>emptySet()
                                     : Collections.unmodifiableSet(new LinkedHashSet<String>(arbiters));
            return this;
        }

        /**
         * Sets the address of the current primary in the replica set
         *
         * @param primary A string in the format of "[hostname]:[port]" listing the current primary member of the replica set.
         * @return this
         */
        public Builder primary(@Nullable final String primary) {
            this.primary = primary;
            return this;
        }

        /**
         * The maximum permitted size of a BSON object in bytes for this mongod process. Defaults to 16MB.
         *
         * @param maxDocumentSize the maximum size a document can be
         * @return this
         */
        public Builder maxDocumentSize(final int maxDocumentSize) {
            this.maxDocumentSize = maxDocumentSize;
            return this;
        }

        /**
         * A set of any tags assigned to this replica set member.
         *
         * @param tagSet a TagSet with all the tags for this server.
         * @return this
         */
        public Builder tagSet(@Nullable final TagSet tagSet) {
            this.tagSet = tagSet == null ? new TagSet() : tagSet;
            return this;
        }

        /**
         * Set the weighted average time it took to make the round trip for requesting this information from the server
         *
         * @param roundTripTime the time taken
         * @param timeUnit      the units of the time taken
         * @return this
         */
        public Builder roundTripTime(final long roundTripTime, final TimeUnit timeUnit) {
            this.roundTripTimeNanos = timeUnit.toNanos(roundTripTime);
            return this;
        }

        /**
         * Sets the name of the replica set
         *
         * @param setName the name of the replica set
         * @return this
         */
        public Builder setName(@Nullable final String setName) {
            this.setName = setName;
            return this;
        }

        /**
         * The isOK() result from requesting this information from the server
         *
         * @param ok whether the server is running without error
         * @return this
         */
        public Builder ok(final boolean ok) {
            this.ok = ok;
            return this;
        }

        /**
         * The current state of the connection to the server.
         *
         * @param state ServerConnectionState representing whether the server has been successfully connected to
         * @return this
         */
        public Builder state(final ServerConnectionState state) {
            this.state = state;
            return this;
        }

        /**
         * Sets the minimum wire version
         *
         * @param minWireVersion the minimum wire version
         * @return this
         */
        public Builder minWireVersion(final int minWireVersion) {
            this.minWireVersion = minWireVersion;
            return this;
        }

        /**
         * Sets the maximum wire version
         *
         * @param maxWireVersion the maximum wire version
         * @return this
         */
        public Builder maxWireVersion(final int maxWireVersion) {
            this.maxWireVersion = maxWireVersion;
            return this;
        }

        /**
         * Sets the electionId reported by this server.
         *
         * @param electionId the electionId
         * @return this
         */
        public Builder electionId(@Nullable final ObjectId electionId) {
            this.electionId = electionId;
            return this;
        }

        /**
         * Sets the setVersion reported by this server.
         *
         * @param setVersion the set version
         * @return this
         */
        public Builder setVersion(@Nullable final Integer setVersion) {
            this.setVersion = setVersion;
            return this;
        }

        /**
         * Sets the topologyVersion reported by this server.
         *
         * @param topologyVersion the topology version
         * @return this
         */
        public Builder topologyVersion(@Nullable final TopologyVersion topologyVersion) {
            this.topologyVersion = topologyVersion;
            return this;
        }

        /**
         * Sets the lastWriteDate reported by this server
         *
         * @param lastWriteDate the last write date, which may be null for servers prior to 3.4
         * @return this
         */
        public Builder lastWriteDate(@Nullable final Date lastWriteDate) {
            this.lastWriteDate = lastWriteDate;
            return this;
        }

        /**
         * Sets the last update time for this description, which is simply the time that the server description was created.
         *
         * @param lastUpdateTimeNanos the last update time of this server description, in nanoseconds
         * @return this
         */
        public Builder lastUpdateTimeNanos(final long lastUpdateTimeNanos) {
            this.lastUpdateTimeNanos = lastUpdateTimeNanos;
            return this;
        }

        /**
         * Sets the session timeout in minutes.
         *
         * @param logicalSessionTimeoutMinutes the session timeout in minutes, or null if sessions are not supported by this server
         * @return this
         */
        public Builder logicalSessionTimeoutMinutes(@Nullable final Integer logicalSessionTimeoutMinutes) {
            this.logicalSessionTimeoutMinutes = logicalSessionTimeoutMinutes;
            return this;
        }

        /**
         * Sets the exception thrown while attempting to determine the server description.
         *
         * @param exception the exception
         * @return this
         */
        public Builder exception(@Nullable final Throwable exception) {
            this.exception = exception;
            return this;
        }

        /**
         * Create a new ServerDescription from the settings in this builder.
         *
         * @return a new server description
         */
        public ServerDescription build() {
            return new ServerDescription(this);
        }
    }

    /**
     * Return whether the server is compatible with the driver. An incompatible server is one that has a min wire version greater that
     * the driver's max wire version or a max wire version less than the driver's min wire version.
     *
     * @return true if the server is compatible with the driver.
     */
    public boolean isCompatibleWithDriver() {
        if (!ok) {
            return true;
        }

        if (isIncompatiblyOlderThanDriver()) {
            return false;
        }

        if (isIncompatiblyNewerThanDriver()) {
            return false;
        }

        return true;
    }

    /**
     * Return whether the server requires a newer driver, i.e. its min wire version is greater than the driver's max wire version.
     *
     * @return true if the server is too new for the driver.
     */
    public boolean isIncompatiblyNewerThanDriver() {
        return ok && minWireVersion > MAX_DRIVER_WIRE_VERSION;
    }

    /**
     * Return whether the server is too old for the driver, i.e. its max wire version is less than the driver's min wire version.
     *
     * @return true if the server is too old for the driver.
     */
    public boolean isIncompatiblyOlderThanDriver() {
        return ok && maxWireVersion < MIN_DRIVER_WIRE_VERSION;
    }

    /**
     * Get the default maximum document size.
     *
     * @return the default maximum document size
     */
    public static int getDefaultMaxDocumentSize() {
        return DEFAULT_MAX_DOCUMENT_SIZE;
    }

    /**
     * Gets the address of the server.
     *
     * @return the server address
     */
    public ServerAddress getAddress() {
        return address;
    }

    /**
     * Gets whether this server is a replica set member, ghosts included.
     *
     * @return true if this server is a member of a replica set
     */
    public boolean isReplicaSetMember() {
        return type.isReplicaSetMember();
    }

    /**
     * Gets whether this server is a replica set member that is neither a ghost nor unknown.
     *
     * @return true if this server is a replica set primary, secondary, arbiter or other member
     */
    public boolean isKnownReplicaSetMember() {
        return type == REPLICA_SET_PRIMARY || type == REPLICA_SET_SECONDARY || type == REPLICA_SET_ARBITER || type == REPLICA_SET_OTHER;
    }

    /**
     * Gets whether this server is a shard router (mongos)
     *
     * @return true if this server is a mongos
     */
    public boolean isShardRouter() {
        return type == SHARD_ROUTER;
    }

    /**
     * Gets whether this is a standalone server.
     *
     * @return true if this is a standalone server.
     */
    public boolean isStandAlone() {
        return type == STANDALONE;
    }

    /**
     * Gets whether this is a load balancer.
     *
     * @return true if this is a load balancer
     */
    public boolean isLoadBalancer() {
        return type == LOAD_BALANCER;
    }

    /**
     * Returns whether this can be treated as a primary server.
     *
     * @return true if this server is the primary in a replica set
     */
    public boolean isPrimary() {
        return ok && type == REPLICA_SET_PRIMARY;
    }

    /**
     * Returns whether this can be treated as a secondary server.
     *
     * @return true if this server is a secondary in a replica set
     */
    public boolean isSecondary() {
        return ok && type == REPLICA_SET_SECONDARY;
    }

    /**
     * Returns whether this server holds data that operations can read or write: primaries, secondaries, standalones, mongos and load
     * balancers.
     *
     * @return true if the server is data bearing
     */
    public boolean isDataBearing() {
        return ok && (type == REPLICA_SET_PRIMARY || type == REPLICA_SET_SECONDARY || type == STANDALONE || type == SHARD_ROUTER
                || type == LOAD_BALANCER);
    }

    /**
     * Get a Set of strings in the format of "[hostname]:[port]" that contains all members of the replica set that are neither hidden,
     * passive, nor arbiters.
     *
     * @return all members of the replica set that are neither hidden, passive, nor arbiters.
     */
    public Set<String> getHosts() {
        return hosts;
    }

    /**
     * Gets the passive members of the replica set.
     *
     * @return A set of passive members of the replica set.
     */
    public Set<String> getPassives() {
        return passives;
    }

    /**
     * Gets the arbiters in the replica set
     *
     * @return A Set of strings in the format of "[hostname]:[port]" containing all members of the replica set that are arbiters.
     */
    public Set<String> getArbiters() {
        return arbiters;
    }

    /**
     * Gets the address of the current primary in the replica set
     *
     * @return A string in the format of "[hostname]:[port]" listing the current primary member of the replica set.
     */
    @Nullable
    public String getPrimary() {
        return primary;
    }

    /**
     * The maximum permitted size of a BSON object in bytes for this mongod process. Defaults to 16MB.
     *
     * @return the maximum size a document can be
     */
    public int getMaxDocumentSize() {
        return maxDocumentSize;
    }

    /**
     * A set of all tags assigned to this replica set member.
     *
     * @return a TagSet with all the tags for this server.
     */
    public TagSet getTagSet() {
        return tagSet;
    }

    /**
     * Returns true if the server has the given tags.  A server of either type {@code ServerType.STANDALONE} or {@code
     * ServerType.SHARD_ROUTER} is considered to have all tags, so this method will always return true for instances of either of those
     * types.
     *
     * @param desiredTags the tags
     * @return true if this server has the given tags
     */
    public boolean hasTags(final TagSet desiredTags) {
        if (!ok) {
            return false;
        }

        if (type == STANDALONE || type == SHARD_ROUTER) {
            return true;
        }

        return tagSet.containsAll(desiredTags);
    }

    /**
     * Gets the name of the replica set
     *
     * @return the name of the replica set
     */
    @Nullable
    public String getSetName() {
        return setName;
    }

    /**
     * The isOK() result from requesting this information from MongoDB
     *
     * @return true if the request executed correctly.
     */
    public boolean isOk() {
        return ok;
    }

    /**
     * Gets the current state of the connection to the server.
     *
     * @return ServerConnectionState representing whether the server has been successfully connected to
     */
    public ServerConnectionState getState() {
        return state;
    }

    /**
     * Gets the type of the server
     *
     * @return a ServerType enum representing whether this is a standalone, secondary, primary, mongos etc.
     */
    public ServerType getType() {
        return type;
    }

    /**
     * Gets the minimum wire version
     *
     * @return the minimum wire version
     */
    public int getMinWireVersion() {
        return minWireVersion;
    }

    /**
     * Gets the maximum wire version
     *
     * @return the maximum wire version
     */
    public int getMaxWireVersion() {
        return maxWireVersion;
    }

    /**
     * The replica set electionid reported by this MongoDB server.
     *
     * @return the electionId, which may be null
     */
    @Nullable
    public ObjectId getElectionId() {
        return electionId;
    }

    /**
     * The replica set setVersion reported by this MongoDB server.
     *
     * @return the setVersion, which may be null
     */
    @Nullable
    public Integer getSetVersion() {
        return setVersion;
    }

    /**
     * The topologyVersion reported by this MongoDB server.
     *
     * @return the topologyVersion, which may be null
     */
    @Nullable
    public TopologyVersion getTopologyVersion() {
        return topologyVersion;
    }

    /**
     * Gets the last write date.
     *
     * @return the last write date, which may be null
     */
    @Nullable
    public Date getLastWriteDate() {
        return lastWriteDate;
    }

    /**
     * Gets the time that this server description was created, using a monotonic clock like {@link System#nanoTime()}.
     *
     * @param timeUnit the time unit
     * @return the last update time in the given unit
     */
    public long getLastUpdateTime(final TimeUnit timeUnit) {
        return timeUnit.convert(lastUpdateTimeNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Gets the session timeout in minutes.
     *
     * @return the session timeout in minutes, or null if sessions are not supported by this server
     */
    @Nullable
    public Integer getLogicalSessionTimeoutMinutes() {
        return logicalSessionTimeoutMinutes;
    }

    /**
     * Gets the exception thrown while attempting to determine the server description.  This is useful for diagnostic purposed when
     * determining the root cause of a connectivity failure.
     *
     * @return the exception, which may be null
     */
    @Nullable
    public Throwable getException() {
        return exception;
    }

    /**
     * Get the time it took to make the round trip for requesting this information from the server in nanoseconds.
     *
     * @return the time taken to request the information, in nano seconds
     */
    public long getRoundTripTimeNanos() {
        return roundTripTimeNanos;
    }

    /**
     * Returns true if the server description content is equal; the last update time is ignored.
     */
    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        ServerDescription that = (ServerDescription) o;

        if (maxDocumentSize != that.maxDocumentSize) {
            return false;
        }
        if (ok != that.ok) {
            return false;
        }
        if (roundTripTimeNanos != that.roundTripTimeNanos) {
            return false;
        }
        if (minWireVersion != that.minWireVersion) {
            return false;
        }
        if (maxWireVersion != that.maxWireVersion) {
            return false;
        }
        if (!address.equals(that.address)) {
            return false;
        }
        if (!arbiters.equals(that.arbiters)) {
            return false;
        }
        if (!Objects.equals(canonicalAddress, that.canonicalAddress)) {
            return false;
        }
        if (!hosts.equals(that.hosts)) {
            return false;
        }
        if (!passives.equals(that.passives)) {
            return false;
        }
        if (!Objects.equals(primary, that.primary)) {
            return false;
        }
        if (!Objects.equals(setName, that.setName)) {
            return false;
        }
        if (state != that.state) {
            return false;
        }
        if (!tagSet.equals(that.tagSet)) {
            return false;
        }
        if (type != that.type) {
            return false;
        }
        if (!Objects.equals(electionId, that.electionId)) {
            return false;
        }
        if (!Objects.equals(setVersion, that.setVersion)) {
            return false;
        }
        if (!Objects.equals(topologyVersion, that.topologyVersion)) {
            return false;
        }
        if (!Objects.equals(lastWriteDate, that.lastWriteDate)) {
            return false;
        }
        if (!Objects.equals(logicalSessionTimeoutMinutes, that.logicalSessionTimeoutMinutes)) {
            return false;
        }

        // Compare class equality and message as exceptions rarely override equals
        Class<?> thisExceptionClass = exception != null ? exception.getClass() : null;
        Class<?> thatExceptionClass = that.exception != null ? that.exception.getClass() : null;
        if (!Objects.equals(thisExceptionClass, thatExceptionClass)) {
            return false;
        }

        String thisExceptionMessage = exception != null ? exception.getMessage() : null;
        String thatExceptionMessage = that.exception != null ? that.exception.getMessage() : null;
        if (!Objects.equals(thisExceptionMessage, thatExceptionMessage)) {
            return false;
        }

        return true;
    }

    @Override
    public int hashCode() {
        int result = address.hashCode();
        result = 31 * result + type.hashCode();
        result = 31 * result + (canonicalAddress != null ? canonicalAddress.hashCode() : 0);
        result = 31 * result + hosts.hashCode();
        result = 31 * result + passives.hashCode();
        result = 31 * result + arbiters.hashCode();
        result = 31 * result + (primary != null ? primary.hashCode() : 0);
        result = 31 * result + maxDocumentSize;
        result = 31 * result + tagSet.hashCode();
        result = 31 * result + (setName != null ? setName.hashCode() : 0);
        result = 31 * result + (electionId != null ? electionId.hashCode() : 0);
        result = 31 * result + (setVersion != null ? setVersion.hashCode() : 0);
        result = 31 * result + (topologyVersion != null ? topologyVersion.hashCode() : 0);
        result = 31 * result + (lastWriteDate != null ? lastWriteDate.hashCode() : 0);
        result = 31 * result + (ok ? 1 : 0);
        result = 31 * result + state.hashCode();
        result = 31 * result + minWireVersion;
        result = 31 * result + maxWireVersion;
        result = 31 * result + (logicalSessionTimeoutMinutes != null ? logicalSessionTimeoutMinutes.hashCode() : 0);
        result = 31 * result + (exception == null ? 0 : exception.getClass().hashCode());
        result = 31 * result + (exception == null ? 0 : Objects.hashCode(exception.getMessage()));
        return result;
    }

    @Override
    public String toString() {
        return "ServerDescription{"
               + "address=" + address
               + ", type=" + type
               + ", state=" + state
               + (state == CONNECTED
                  ? ", ok=" + ok
                    + ", minWireVersion=" + minWireVersion
                    + ", maxWireVersion=" + maxWireVersion
                    + ", logicalSessionTimeoutMinutes=" + logicalSessionTimeoutMinutes
                    + ", roundTripTimeNanos=" + roundTripTimeNanos
                  : "")
               + (isReplicaSetMember()
                  ? ", setName='" + setName + '\''
                    + ", canonicalAddress=" + canonicalAddress
                    + ", hosts=" + hosts
                    + ", passives=" + passives
                    + ", arbiters=" + arbiters
                    + ", primary='" + primary + '\''
                    + ", tagSet=" + tagSet
                    + ", electionId=" + electionId
                    + ", setVersion=" + setVersion
                    + ", topologyVersion=" + topologyVersion
                    + ", lastWriteDate=" + lastWriteDate
                    + ", lastUpdateTimeNanos=" + lastUpdateTimeNanos
                  : "")
               + (exception == null ? "" : ", exception=" + translateExceptionToString())
               + '}';
    }

    /**
     * Returns a short, pretty description for this ServerDescription.
     *
     * @return a String containing the most pertinent information about this ServerDescription
     */
    public String getShortDescription() {
        return "{"
               + "address=" + address
               + ", type=" + type
               + (!tagSet.iterator().hasNext() ? "" : ", " + tagSet)
               + (state == CONNECTED ? (", roundTripTime=" + getRoundTripFormattedInMilliseconds() + " ms") : "")
               + ", state=" + state
               + (exception == null ? "" : ", exception=" + translateExceptionToString())
               + '}';
    }

    private String translateExceptionToString() {
        StringBuilder builder = new StringBuilder();
        builder.append("{");
        builder.append(exception);
        builder.append("}");
        Throwable cur = exception.getCause();
        while (cur != null) {
            builder.append(", caused by ");
            builder.append("{");
            builder.append(cur);
            builder.append("}");
            cur = cur.getCause();
        }

        return builder.toString();
    }

    private String getRoundTripFormattedInMilliseconds() {
        return format("%.1f", roundTripTimeNanos / 1000.0 / 1000.0);
    }

    ServerDescription(final Builder builder) {
        address = notNull("address", builder.address);
        type = notNull("type", builder.type);
        state = notNull("state", builder.state);
        canonicalAddress = builder.canonicalAddress;
        hosts = builder.hosts;
        passives = builder.passives;
        arbiters = builder.arbiters;
        primary = builder.primary;
        maxDocumentSize = builder.maxDocumentSize;
        tagSet = builder.tagSet;
        setName = builder.setName;
        roundTripTimeNanos = builder.roundTripTimeNanos;
        ok = builder.ok;
        minWireVersion = builder.minWireVersion;
        maxWireVersion = builder.maxWireVersion;
        electionId = builder.electionId;
        setVersion = builder.setVersion;
        topologyVersion = builder.topologyVersion;
        lastWriteDate = builder.lastWriteDate;
        lastUpdateTimeNanos = builder.lastUpdateTimeNanos;
        logicalSessionTimeoutMinutes = builder.logicalSessionTimeoutMinutes;
        exception = builder.exception;
    }

    /**
     * Gets every address this member claims belongs to its replica set: hosts, passives and arbiters.
     *
     * @return the set of member addresses, in the order hosts, passives, arbiters
     */
    public Set<String> getAllReplicaSetMembers() {
        Set<String> allMembers = new LinkedHashSet<String>();
        allMembers.addAll(hosts);
        allMembers.addAll(passives);
        allMembers.addAll(arbiters);
        return allMembers;
    }
}
