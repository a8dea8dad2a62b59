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

import com.docdriver.ServerAddress;
import com.docdriver.connection.ClusterConnectionMode;
import com.docdriver.connection.ClusterDescription;
import com.docdriver.connection.ClusterType;
import com.docdriver.connection.ServerDescription;
import com.docdriver.connection.ServerType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;

import static com.docdriver.connection.ServerConnectionState.CONNECTED;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class WritableServerSelectorTest {
    private final WritableServerSelector selector = new WritableServerSelector();

    @Test
    public void shouldSelectThePrimaryOfAReplicaSet() {
        ServerDescription primary = server(27017, ServerType.REPLICA_SET_PRIMARY, 10);
        ServerDescription secondary = server(27018, ServerType.REPLICA_SET_SECONDARY, 1);

        assertEquals(Collections.singletonList(primary), selector.select(new ClusterDescription(ClusterConnectionMode.MULTIPLE,
                ClusterType.REPLICA_SET_WITH_PRIMARY, Arrays.asList(primary, secondary))));
        assertTrue(selector.select(new ClusterDescription(ClusterConnectionMode.MULTIPLE, ClusterType.REPLICA_SET_NO_PRIMARY,
                Collections.singletonList(secondary))).isEmpty());
    }

    @Test
    public void shouldSelectAnyRouterOfAShardedCluster() {
        ServerDescription first = server(27017, ServerType.SHARD_ROUTER, 1);
        ServerDescription second = server(27018, ServerType.SHARD_ROUTER, 1);

        assertEquals(new HashSet<ServerDescription>(Arrays.asList(first, second)),
                new HashSet<ServerDescription>(selector.select(new ClusterDescription(ClusterConnectionMode.MULTIPLE,
                        ClusterType.SHARDED, Arrays.asList(first, second)))));
    }

    @Test
    public void shouldSelectAWritableServerOfADirectConnection() {
        for (ServerType type : Arrays.asList(ServerType.STANDALONE, ServerType.REPLICA_SET_PRIMARY, ServerType.SHARD_ROUTER)) {
            ServerDescription server = server(27017, type, 1);

            assertEquals(Collections.singletonList(server), selector.select(direct(server)), type.toString());
        }
    }

    @Test
    public void shouldNotWriteToADirectlyConnectedSecondary() {
        assertTrue(selector.select(direct(server(27018, ServerType.REPLICA_SET_SECONDARY, 1))).isEmpty());
    }

    @Test
    public void shouldNotWriteToADirectlyConnectedArbiter() {
        assertTrue(selector.select(direct(server(27019, ServerType.REPLICA_SET_ARBITER, 1))).isEmpty());
    }

    @Test
    public void shouldSelectALoadBalancer() {
        ServerDescription loadBalancer = server(27017, ServerType.LOAD_BALANCER, 1);

        assertEquals(Collections.singletonList(loadBalancer), selector.select(new ClusterDescription(
                ClusterConnectionMode.LOAD_BALANCED, ClusterType.LOAD_BALANCED, Collections.singletonList(loadBalancer))));
    }

    @Test
    public void shouldChainSelectorsInOrder() {
        ServerDescription primary = server(27017, ServerType.REPLICA_SET_PRIMARY, 30);
        ServerDescription secondary = server(27018, ServerType.REPLICA_SET_SECONDARY, 1);
        CompositeServerSelector composite = new CompositeServerSelector(Arrays.asList(selector,
                new LatencyMinimizingServerSelector(15, MILLISECONDS)));

        assertEquals(Collections.singletonList(primary), composite.select(new ClusterDescription(ClusterConnectionMode.MULTIPLE,
                ClusterType.REPLICA_SET_WITH_PRIMARY, Arrays.asList(primary, secondary))));
    }

    @Test
    public void shouldSelectAServerByAddress() {
        ServerDescription primary = server(27017, ServerType.REPLICA_SET_PRIMARY, 30);
        ServerDescription secondary = server(27018, ServerType.REPLICA_SET_SECONDARY, 1);
        ClusterDescription clusterDescription = new ClusterDescription(ClusterConnectionMode.MULTIPLE,
                ClusterType.REPLICA_SET_WITH_PRIMARY, Arrays.asList(primary, secondary));

        assertEquals(Collections.singletonList(secondary),
                new ServerAddressSelector(new ServerAddress("localhost", 27018)).select(clusterDescription));
        assertTrue(new ServerAddressSelector(new ServerAddress("localhost", 27019)).select(clusterDescription).isEmpty());
    }

    private static ClusterDescription direct(final ServerDescription server) {
        return new ClusterDescription(ClusterConnectionMode.SINGLE, ClusterType.SINGLE, Collections.singletonList(server));
    }

    private static ServerDescription server(final int port, final ServerType type, final long roundTripTimeMillis) {
        return ServerDescription.builder()
                .address(new ServerAddress("localhost", port))
                .state(CONNECTED)
                .ok(true)
                .type(type)
                .setName(type.getClusterType().isReplicaSet() ? "rs0" : null)
                .roundTripTime(roundTripTimeMillis, MILLISECONDS)
                .build();
    }
}
