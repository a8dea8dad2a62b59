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

import com.docdriver.MongoIncompatibleDriverException;
import com.docdriver.MongoServerSelectionTimeoutException;
import com.docdriver.ReadPreference;
import com.docdriver.ServerAddress;
import com.docdriver.connection.ClusterConnectionMode;
import com.docdriver.connection.ClusterId;
import com.docdriver.connection.ClusterSettings;
import com.docdriver.connection.ServerDescription;
import com.docdriver.connection.ServerSettings;
import com.docdriver.connection.ServerType;
import com.docdriver.selector.ReadPreferenceServerSelector;
import com.docdriver.selector.ServerAddressSelector;
import com.docdriver.selector.WritableServerSelector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.docdriver.connection.ServerConnectionState.CONNECTED;
import static java.util.Arrays.asList;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class BaseClusterTest {
    private final ServerAddress firstServer = new ServerAddress("localhost:27017");
    private final ServerAddress secondServer = new ServerAddress("localhost:27018");
    private final ServerAddress thirdServer = new ServerAddress("localhost:27019");

    private final TestClusterableServerFactory factory = new TestClusterableServerFactory(ServerSettings.builder()
            .minHeartbeatFrequency(10, MILLISECONDS)
            .build());
    private MultiServerCluster cluster;

    @AfterEach
    public void tearDown() {
        if (cluster != null) {
            cluster.close();
        }
    }

    private MultiServerCluster createCluster(final long serverSelectionTimeoutMS) {
        cluster = new MultiServerCluster(new ClusterId(), ClusterSettings.builder()
                .mode(ClusterConnectionMode.MULTIPLE)
                .hosts(asList(firstServer, secondServer, thirdServer))
                .serverSelectionTimeout(serverSelectionTimeoutMS, MILLISECONDS)
                .build(), factory);
        return cluster;
    }

    @Test
    public void shouldSelectThePrimaryForWrites() {
        createCluster(1000);
        factory.sendNotification(firstServer, member(firstServer, ServerType.REPLICA_SET_PRIMARY, 5));
        factory.sendNotification(secondServer, member(secondServer, ServerType.REPLICA_SET_SECONDARY, 5));

        ServerTuple serverTuple = cluster.selectServer(new WritableServerSelector(), new OperationContext());

        assertAll(
                () -> assertEquals(firstServer, serverTuple.getServerDescription().getAddress()),
                () -> assertSame(factory.getServer(firstServer), serverTuple.getServer())
        );
    }

    @Test
    public void shouldWaitForAMatchingServerToBeDiscovered() throws Exception {
        createCluster(5000);
        factory.sendNotification(firstServer, member(firstServer, ServerType.REPLICA_SET_PRIMARY, 5));

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<ServerTuple> selection = executor.submit(() ->
                    cluster.selectServer(new ReadPreferenceServerSelector(ReadPreference.secondary()), new OperationContext()));
            Thread.sleep(50);
            assertFalse(selection.isDone());

            factory.sendNotification(secondServer, member(secondServer, ServerType.REPLICA_SET_SECONDARY, 5));

            assertEquals(secondServer, selection.get(5, SECONDS).getServerDescription().getAddress());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void shouldTimeOutWithTheLastSnapshotWhenNoSecondaryIsAvailable() {
        createCluster(100);
        factory.sendNotification(firstServer, member(firstServer, ServerType.REPLICA_SET_PRIMARY, 5));

        MongoServerSelectionTimeoutException e = assertThrows(MongoServerSelectionTimeoutException.class,
                () -> cluster.selectServer(new ReadPreferenceServerSelector(ReadPreference.secondary()), new OperationContext()));

        assertAll(
                () -> assertEquals(cluster.getCurrentDescription(), e.getClusterDescription()),
                () -> assertTrue(e.getMessage().contains("secondary"), e.getMessage()),
                () -> assertTrue(factory.getServer(secondServer).getConnectCount() > 0)
        );
    }

    @Test
    public void shouldTimeOutWhenTheOperationTimeoutExpiresFirst() {
        createCluster(60000);

        long startNanos = System.nanoTime();
        MongoServerSelectionTimeoutException e = assertThrows(MongoServerSelectionTimeoutException.class,
                () -> cluster.selectServer(new WritableServerSelector(), new OperationContext(50L)));
        assertTrue(MILLISECONDS.convert(System.nanoTime() - startNanos, java.util.concurrent.TimeUnit.NANOSECONDS) < 10000);
        assertTrue(e.getMessage().startsWith("Timed out after 50 ms"), e.getMessage());
    }

    @Test
    public void shouldSelectOnlyWithinTheLatencyWindow() {
        createCluster(1000);
        factory.sendNotification(firstServer, member(firstServer, ServerType.REPLICA_SET_SECONDARY, 5));
        factory.sendNotification(secondServer, member(secondServer, ServerType.REPLICA_SET_SECONDARY, 8));
        factory.sendNotification(thirdServer, member(thirdServer, ServerType.REPLICA_SET_SECONDARY, 20));

        Set<ServerAddress> selected = new HashSet<ServerAddress>();
        for (int i = 0; i < 200; i++) {
            selected.add(cluster.selectServer(new ReadPreferenceServerSelector(ReadPreference.nearest()), new OperationContext())
                    .getServerDescription().getAddress());
        }

        assertEquals(new HashSet<ServerAddress>(asList(firstServer, secondServer)), selected);
    }

    @Test
    public void shouldSelectAServerByAddress() {
        createCluster(1000);
        factory.sendNotification(thirdServer, member(thirdServer, ServerType.REPLICA_SET_SECONDARY, 5));

        ServerTuple serverTuple = cluster.selectServer(new ServerAddressSelector(thirdServer), new OperationContext());

        assertEquals(thirdServer, serverTuple.getServerDescription().getAddress());
    }

    @Test
    public void shouldFailFastWhenAServerIsIncompatible() {
        createCluster(60000);
        factory.sendNotification(firstServer, ServerDescription.builder(member(firstServer, ServerType.REPLICA_SET_PRIMARY, 5))
                .maxWireVersion(2).build());

        MongoIncompatibleDriverException e = assertThrows(MongoIncompatibleDriverException.class,
                () -> cluster.selectServer(new WritableServerSelector(), new OperationContext()));
        assertTrue(e.getMessage().contains(firstServer.toString()), e.getMessage());
    }

    @Test
    public void shouldRejectSelectionOnAClosedCluster() {
        createCluster(1000);
        cluster.close();

        assertThrows(IllegalStateException.class, () -> cluster.selectServer(new WritableServerSelector(), new OperationContext()));
    }

    private ServerDescription member(final ServerAddress address, final ServerType type, final long roundTripTimeMillis) {
        return ServerDescription.builder()
                .address(address)
                .state(CONNECTED)
                .ok(true)
                .type(type)
                .maxWireVersion(17)
                .setName("rs0")
                .hosts(new LinkedHashSet<String>(asList(firstServer.toString(), secondServer.toString(), thirdServer.toString())))
                .roundTripTime(roundTripTimeMillis, MILLISECONDS)
                .build();
    }
}
