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

package com.docdriver;

import com.docdriver.annotations.Immutable;
import com.docdriver.connection.ClusterDescription;
import com.docdriver.connection.ServerDescription;
import com.docdriver.lang.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static com.docdriver.assertions.Assertions.isTrueArgument;
import static com.docdriver.assertions.Assertions.notNull;
import static java.lang.String.format;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Abstract class for all preference which can be combined with tags
 */
@Immutable
public abstract class TaggableReadPreference extends ReadPreference {
    private static final int SMALLEST_MAX_STALENESS_MS = 90000;
    private static final int IDLE_WRITE_PERIOD_MS = 10000;

    private final List<TagSet> tagSetList = new ArrayList<TagSet>();
    private final Long maxStalenessMS;

    TaggableReadPreference() {
        this.maxStalenessMS = null;
    }

    TaggableReadPreference(final List<TagSet> tagSetList, @Nullable final Long maxStaleness, final TimeUnit timeUnit) {
        notNull("tagSetList", tagSetList);
        isTrueArgument("maxStaleness is null or >= 0", maxStaleness == null || maxStaleness >= 0);
        this.maxStalenessMS = maxStaleness == null ? null : MILLISECONDS.convert(maxStaleness, timeUnit);

        this.tagSetList.addAll(tagSetList);
    }

    @Override
    public boolean isSecondaryOk() {
        return true;
    }

    /**
     * Gets the list of tag sets.  The list will be searched in order until a tag set yields at least one matching member.
     *
     * @return the list of tag sets
     */
    public List<TagSet> getTagSetList() {
        return Collections.unmodifiableList(tagSetList);
    }

    /**
     * Gets the maximum acceptable staleness of a secondary in order to be considered for read operations.
     *
     * @param timeUnit the time unit in which to return the value
     * @return the maximum acceptable staleness in the given time unit, or null if the value is not set
     */
    @Nullable
    public Long getMaxStaleness(final TimeUnit timeUnit) {
        notNull("timeUnit", timeUnit);
        if (maxStalenessMS == null) {
            return null;
        }
        return timeUnit.convert(maxStalenessMS, MILLISECONDS);
    }

    @Override
    public String toString() {
        return "ReadPreference{"
               + "name=" + getName()
               + (tagSetList.isEmpty() ? "" : ", tagSetList=" + tagSetList)
               + (maxStalenessMS == null ? "" : ", maxStalenessMS=" + maxStalenessMS)
               + '}';
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        TaggableReadPreference that = (TaggableReadPreference) o;

        if (maxStalenessMS != null ? !maxStalenessMS.equals(that.maxStalenessMS) : that.maxStalenessMS != null) {
            return false;
        }
        return tagSetList.equals(that.tagSetList);
    }

    @Override
    public int hashCode() {
        int result = tagSetList.hashCode();
        result = 31 * result + getName().hashCode();
        result = 31 * result + (maxStalenessMS != null ? maxStalenessMS.hashCode() : 0);
        return result;
    }

    @Override
    protected List<ServerDescription> chooseForNonReplicaSet(final ClusterDescription clusterDescription) {
        return selectFreshServers(clusterDescription, clusterDescription.getAny());
    }

    /**
     * Selects the secondaries matching the first tag set, in list order, that yields at least one fresh secondary.
     *
     * @param clusterDescription the cluster description
     * @return the matching secondaries
     */
    protected List<ServerDescription> getSecondaries(final ClusterDescription clusterDescription) {
        List<ServerDescription> freshSecondaries = selectFreshServers(clusterDescription, clusterDescription.getSecondaries());
        if (tagSetList.isEmpty()) {
            return freshSecondaries;
        }
        for (TagSet tagSet : tagSetList) {
            List<ServerDescription> matching = new ArrayList<ServerDescription>();
            for (ServerDescription cur : freshSecondaries) {
                if (cur.hasTags(tagSet)) {
                    matching.add(cur);
                }
            }
            if (!matching.isEmpty()) {
                return matching;
            }
        }
        return Collections.emptyList();
    }

    /**
     * Selects the primaries and secondaries matching the first tag set, in list order, that yields at least one member.
     *
     * @param clusterDescription the cluster description
     * @return the matching primary and secondaries
     */
    protected List<ServerDescription> getAnyPrimaryOrSecondary(final ClusterDescription clusterDescription) {
        List<ServerDescription> candidates = selectFreshServers(clusterDescription, clusterDescription.getAnyPrimaryOrSecondary());
        if (tagSetList.isEmpty()) {
            return candidates;
        }
        for (TagSet tagSet : tagSetList) {
            List<ServerDescription> matching = new ArrayList<ServerDescription>();
            for (ServerDescription cur : candidates) {
                if (cur.hasTags(tagSet)) {
                    matching.add(cur);
                }
            }
            if (!matching.isEmpty()) {
                return matching;
            }
        }
        return Collections.emptyList();
    }

    /**
     * Filters out servers whose estimated staleness exceeds the max staleness.  A primary is never stale.
     *
     * @param clusterDescription the cluster description
     * @param servers the candidate servers
     * @return the fresh servers
     * @throws MongoConfigurationException if max staleness is smaller than the allowed minimum
     */
    protected List<ServerDescription> selectFreshServers(final ClusterDescription clusterDescription,
                                                         final List<ServerDescription> servers) {
        Long maxStaleness = getMaxStaleness(MILLISECONDS);
        if (maxStaleness == null || !clusterDescription.getType().isReplicaSet()) {
            return servers;
        }

        long heartbeatFrequencyMS = clusterDescription.getServerSettings().getHeartbeatFrequency(MILLISECONDS);
        long smallestMaxStalenessMS = Math.max(SMALLEST_MAX_STALENESS_MS, heartbeatFrequencyMS + IDLE_WRITE_PERIOD_MS);
        if (maxStaleness < smallestMaxStalenessMS) {
            throw new MongoConfigurationException(format("Max staleness (%d ms) must be at least the heartbeat period (%d ms) "
                            + "plus the idle write period (%d ms), and at least %d ms",
                    maxStaleness, heartbeatFrequencyMS, IDLE_WRITE_PERIOD_MS, SMALLEST_MAX_STALENESS_MS));
        }

        List<ServerDescription> freshServers = new ArrayList<ServerDescription>(servers.size());
        ServerDescription primary = findPrimary(clusterDescription);
        if (primary != null) {
            for (ServerDescription cur : servers) {
                if (cur.isPrimary()) {
                    freshServers.add(cur);
                } else if (getStalenessOfSecondaryRelativeToPrimary(primary, cur, heartbeatFrequencyMS) <= maxStaleness) {
                    freshServers.add(cur);
                }
            }
        } else {
            ServerDescription mostUpToDateSecondary = findMostUpToDateSecondary(clusterDescription);
            for (ServerDescription cur : servers) {
                if (mostUpToDateSecondary == null || mostUpToDateSecondary.getLastWriteDate() == null
                            || cur.getLastWriteDate() == null) {
                    freshServers.add(cur);
                } else if (mostUpToDateSecondary.getLastWriteDate().getTime() - cur.getLastWriteDate().getTime()
                                   + heartbeatFrequencyMS <= maxStaleness) {
                    freshServers.add(cur);
                }
            }
        }
        return freshServers;
    }

    private long getStalenessOfSecondaryRelativeToPrimary(final ServerDescription primary, final ServerDescription serverDescription,
                                                          final long heartbeatFrequencyMS) {
        if (primary.getLastWriteDate() == null || serverDescription.getLastWriteDate() == null) {
            return 0;
        }
        return serverDescription.getLastUpdateTime(MILLISECONDS) - serverDescription.getLastWriteDate().getTime()
               - (primary.getLastUpdateTime(MILLISECONDS) - primary.getLastWriteDate().getTime())
               + heartbeatFrequencyMS;
    }

    @Nullable
    private ServerDescription findPrimary(final ClusterDescription clusterDescription) {
        for (ServerDescription cur : clusterDescription.getServerDescriptions()) {
            if (cur.isPrimary()) {
                return cur;
            }
        }
        return null;
    }

    @Nullable
    private ServerDescription findMostUpToDateSecondary(final ClusterDescription clusterDescription) {
        ServerDescription mostUpdateToDateSecondary = null;
        for (ServerDescription cur : clusterDescription.getSecondaries()) {
            if (cur.getLastWriteDate() == null) {
                continue;
            }
            if (mostUpdateToDateSecondary == null
                        || cur.getLastWriteDate().getTime() > mostUpdateToDateSecondary.getLastWriteDate().getTime()) {
                mostUpdateToDateSecondary = cur;
            }
        }
        return mostUpdateToDateSecondary;
    }

    /**
     * Read from secondary
     */
    static class SecondaryReadPreference extends TaggableReadPreference {
        SecondaryReadPreference() {
        }

        SecondaryReadPreference(final List<TagSet> tagSetList, @Nullable final Long maxStaleness, final TimeUnit timeUnit) {
            super(tagSetList, maxStaleness, timeUnit);
        }

        @Override
        public String getName() {
            return "secondary";
        }

        @Override
        protected List<ServerDescription> chooseForReplicaSet(final ClusterDescription clusterDescription) {
            return getSecondaries(clusterDescription);
        }
    }

    /**
     * Read from secondary if available, otherwise from primary, irrespective of tags.
     */
    static class SecondaryPreferredReadPreference extends SecondaryReadPreference {
        SecondaryPreferredReadPreference() {
        }

        SecondaryPreferredReadPreference(final List<TagSet> tagSetList, @Nullable final Long maxStaleness, final TimeUnit timeUnit) {
            super(tagSetList, maxStaleness, timeUnit);
        }

        @Override
        public String getName() {
            return "secondaryPreferred";
        }

        @Override
        protected List<ServerDescription> chooseForReplicaSet(final ClusterDescription clusterDescription) {
            List<ServerDescription> selectedServers = super.chooseForReplicaSet(clusterDescription);
            if (selectedServers.isEmpty()) {
                selectedServers = clusterDescription.getPrimaries();
            }
            return selectedServers;
        }
    }

    /**
     * Read from nearest node respective of tags.
     */
    static class NearestReadPreference extends TaggableReadPreference {
        NearestReadPreference() {
        }

        NearestReadPreference(final List<TagSet> tagSetList, @Nullable final Long maxStaleness, final TimeUnit timeUnit) {
            super(tagSetList, maxStaleness, timeUnit);
        }

        @Override
        public String getName() {
            return "nearest";
        }

        @Override
        protected List<ServerDescription> chooseForReplicaSet(final ClusterDescription clusterDescription) {
            return getAnyPrimaryOrSecondary(clusterDescription);
        }
    }

    /**
     * Read from primary if available, otherwise a secondary.
     */
    static class PrimaryPreferredReadPreference extends SecondaryReadPreference {
        PrimaryPreferredReadPreference() {
        }

        PrimaryPreferredReadPreference(final List<TagSet> tagSetList, @Nullable final Long maxStaleness, final TimeUnit timeUnit) {
            super(tagSetList, maxStaleness, timeUnit);
        }

        @Override
        public String getName() {
            return "primaryPreferred";
        }

        @Override
        protected List<ServerDescription> chooseForReplicaSet(final ClusterDescription clusterDescription) {
            List<ServerDescription> selectedServers = clusterDescription.getPrimaries();
            if (selectedServers.isEmpty()) {
                selectedServers = super.chooseForReplicaSet(clusterDescription);
            }
            return selectedServers;
        }
    }
}
