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

package com.docdriver.selector;

import com.docdriver.MongoConfigurationException;
import com.docdriver.ReadPreference;
import com.docdriver.ServerAddress;
import com.docdriver.Tag;
import com.docdriver.TagSet;
import com.docdriver.connection.ClusterConnectionMode;
import com.docdriver.connection.ClusterDescription;
import com.docdriver.connection.ClusterType;
import com.docdriver.connection.ServerDescription;
import com.docdriver.connection.ServerType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.HashSet;
import java.util.Set;

import static com.docdriver.connection.ServerConnectionState.CONNECTED;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ReadPreferenceServerSelectorTest {
    private static final long LAST_WRITE = 1000000;

    private final ServerDescription primary = member(ServerType.REPLICA_SET_PRIMARY, 27017, new Tag("dc", "ny"), LAST_WRITE);
    private final ServerDescription nySecondary = member(ServerType.REPLICA_SET_SECONDARY, 27018, new Tag("dc", "ny"), LAST_WRITE - 1000);
    private final ServerDescription sfSecondary = member(ServerType.REPLICA_SET_SECONDARY, 27019, new Tag("dc", "sf"),
            LAST_WRITE - 200000);

    private final ClusterDescription withPrimary = replicaSet(ClusterType.REPLICA_SET_WITH_PRIMARY, primary, nySecondary, sfSecondary);
    private final ClusterDescription noPrimary = replicaSet(ClusterType.REPLICA_SET_NO_PRIMARY, nySecondary, sfSecondary);
    private final ClusterDescription noSecondaries = replicaSet(ClusterType.REPLICA_SET_WITH_PRIMARY, primary);

    @Test
    public void testPrimary() {
        assertSelects(select(ReadPreference.primary(), withPrimary), primary);
        assertTrue(select(ReadPreference.primary(), noPrimary).isEmpty());
    }

    @Test
    public void testSecondary() {
        assertSelects(select(ReadPreference.secondary(), withPrimary), nySecondary, sfSecondary);
        assertTrue(select(ReadPreference.secondary(), noSecondaries).isEmpty());
    }

    @Test
    public void testPreferredModesFallBack() {
        assertSelects(select(ReadPreference.secondaryPreferred(), noSecondaries), primary);
        assertSelects(select(ReadPreference.secondaryPreferred(), withPrimary), nySecondary, sfSecondary);
        assertSelects(select(ReadPreference.primaryPreferred(), noPrimary), nySecondary, sfSecondary);
        assertSelects(select(ReadPreference.primaryPreferred(), withPrimary), primary);
    }

    @Test
    public void testNearest() {
        assertSelects(select(ReadPreference.nearest(), withPrimary), primary, nySecondary, sfSecondary);
        assertSelects(select(ReadPreference.nearest(new TagSet(new Tag("dc", "ny"))), withPrimary), primary, nySecondary);
    }

    @Test
    public void testTagSetsAreTriedInOrder() {
        ReadPreference readPreference = ReadPreference.secondary(Arrays.asList(
                new TagSet(new Tag("dc", "la")), new TagSet(new Tag("dc", "sf")), new TagSet()));

        assertSelects(select(readPreference, withPrimary), sfSecondary);
        assertSelects(select(ReadPreference.secondary(Arrays.asList(new TagSet(new Tag("dc", "la")), new TagSet())), withPrimary),
                nySecondary, sfSecondary);
        assertTrue(select(ReadPreference.secondary(new TagSet(new Tag("dc", "la"))), withPrimary).isEmpty());
    }

    @Test
    public void testMaxStalenessWithAPrimary() {
        assertSelects(select(ReadPreference.secondary(90, SECONDS), withPrimary), nySecondary);
        assertSelects(select(ReadPreference.nearest(90, SECONDS), withPrimary), primary, nySecondary);
    }

    @Test
    public void testMaxStalenessWithoutAPrimary() {
        assertSelects(select(ReadPreference.secondary(90, SECONDS), noPrimary), nySecondary);
    }

    @Test
    public void testMaxStalenessMustCoverTheHeartbeatAndIdleWritePeriods() {
        assertThrows(MongoConfigurationException.class, () -> select(ReadPreference.secondary(89, SECONDS), withPrimary));
    }

    @Test
    public void testNonReplicaSets() {
        ServerDescription router = ServerDescription.builder().address(new ServerAddress("router")).state(CONNECTED).ok(true)
                .type(ServerType.SHARD_ROUTER).build();
        ClusterDescription sharded = new ClusterDescription(ClusterConnectionMode.MULTIPLE, ClusterType.SHARDED,
                Collections.singletonList(router));

        assertSelects(select(ReadPreference.secondary(), sharded), router);
        assertSelects(select(ReadPreference.secondary(90, SECONDS), sharded), router);
        assertTrue(select(ReadPreference.primary(), new ClusterDescription(ClusterConnectionMode.MULTIPLE, ClusterType.UNKNOWN,
                Collections.<ServerDescription>emptyList())).isEmpty());
    }

    @Test
    public void testGetReadPreference() {
        assertEquals(ReadPreference.nearest(), new ReadPreferenceServerSelector(ReadPreference.nearest()).getReadPreference());
    }

    private static Collection<ServerDescription> select(final ReadPreference readPreference, final ClusterDescription description) {
        return new ReadPreferenceServerSelector(readPreference).select(description);
    }

    private static void assertSelects(final Collection<ServerDescription> selected, final ServerDescription... expected) {
        Set<ServerDescription> expectedSet = new HashSet<ServerDescription>(Arrays.asList(expected));
        assertEquals(expectedSet, new HashSet<ServerDescription>(selected));
    }

    private static ClusterDescription replicaSet(final ClusterType type, final ServerDescription... members) {
        return new ClusterDescription(ClusterConnectionMode.MULTIPLE, type, Arrays.asList(members));
    }

    private static ServerDescription member(final ServerType type, final int port, final Tag tag, final long lastWriteMillis) {
        return ServerDescription.builder()
                .address(new ServerAddress("localhost", port))
                .state(CONNECTED)
                .ok(true)
                .type(type)
                .setName("rs0")
                .tagSet(new TagSet(tag))
                .lastWriteDate(new Date(lastWriteMillis))
                .lastUpdateTimeNanos(0)
                .build();
    }
}
