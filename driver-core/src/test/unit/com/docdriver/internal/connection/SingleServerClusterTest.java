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
import com.docdriver.connection.ServerType;
import com.docdriver.connection.TopologyVersion;
import com.docdriver.selector.WritableServerSelector;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static com.docdriver.connection.ServerConnectionState.CONNECTED;
import static java.util.Collections.singletonList;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SingleServerClusterTest {
    private final ServerAddress address = new ServerAddress("localhost:27017");
    private final TestClusterableServerFactory factory = new TestClusterableServerFactory();
    private SingleServerCluster cluster;

    @AfterEach
    public void tearDown() {
        if (cluster != null) {
            cluster.close();
        }
    }

    private SingleServerCluster createCluster(final ClusterConnectionMode mode, final String requiredReplicaSetName) {
        cluster = new SingleServerCluster(new ClusterId(), ClusterSettings.builder()
                .mode(mode)
                .hosts(singletonList(address))
                .requiredReplicaSetName(requiredReplicaSetName)
                .build(), factory);
        return cluster;
    }

    @Test
    public void shouldPublishASingleClusterBeforeTheServerIsKnown() {
        createCluster(ClusterConnectionMode.SINGLE, null);

        ClusterDescription description = cluster.getCurrentDescription();
        assertAll(
                () -> assertEquals(ClusterType.SINGLE, description.getType()),
                () -> assertEquals(ServerType.UNKNOWN, description.getByServerAddress(address).getType())
        );
    }

    @Test
    public void shouldAcceptAnyServerTypeWhenConnectingDirectly() {
        createCluster(ClusterConnectionMode.SINGLE, null);

        factory.sendNotification(address, server(ServerType.REPLICA_SET_SECONDARY, "rs0"));

        ClusterDescription description = cluster.getCurrentDescription();
        assertAll(
                () -> assertEquals(ClusterType.SINGLE, description.getType()),
                () -> assertEquals(ServerType.REPLICA_SET_SECONDARY, description.getByServerAddress(address).getType()),
                () -> assertEquals(address, cluster.selectServer(
                        ClusterDescription::getAny, new OperationContext()).getServerDescription().getAddress())
        );
    }

    @Test
    public void shouldRejectAMemberOfTheWrongReplicaSet() {
        createCluster(ClusterConnectionMode.SINGLE, "required");

        factory.sendNotification(address, server(ServerType.REPLICA_SET_PRIMARY, "rs0"));

        ServerDescription description = cluster.getCurrentDescription().getByServerAddress(address);
        assertAll(
                () -> assertEquals(ServerType.UNKNOWN, description.getType()),
                () -> assertTrue(description.getException() instanceof MongoConfigurationException)
        );
    }

    @Test
    public void shouldRejectALoadBalancerWhenNotInLoadBalancedMode() {
        createCluster(ClusterConnectionMode.SINGLE, null);

        factory.sendNotification(address, server(ServerType.LOAD_BALANCER, null));

        assertTrue(cluster.getCurrentDescription().getByServerAddress(address).getException() instanceof MongoConfigurationException);
    }

    @Test
    public void shouldPublishALoadBalancedCluster() {
        createCluster(ClusterConnectionMode.LOAD_BALANCED, null);

        factory.sendNotification(address, server(ServerType.LOAD_BALANCER, null));

        ClusterDescription description = cluster.getCurrentDescription();
        assertAll(
                () -> assertEquals(ClusterType.LOAD_BALANCED, description.getType()),
                () -> assertEquals(ServerType.LOAD_BALANCER, description.getByServerAddress(address).getType()),
                () -> assertEquals(address, cluster.selectServer(new WritableServerSelector(), new OperationContext())
                        .getServerDescription().getAddress())
        );
    }

    @Test
    public void shouldIgnoreAStaleDescription() {
        createCluster(ClusterConnectionMode.SINGLE, null);
        ObjectId processId = new ObjectId();
        ServerDescription current = ServerDescription.builder(server(ServerType.STANDALONE, null))
                .topologyVersion(new TopologyVersion(processId, 5)).build();
        factory.sendNotification(address, current);

        factory.sendNotification(address, ServerDescription.builder(current)
                .topologyVersion(new TopologyVersion(processId, 4)).type(ServerType.SHARD_ROUTER).build());

        assertEquals(current, cluster.getCurrentDescription().getByServerAddress(address));
    }

    private ServerDescription server(final ServerType type, final String setName) {
        return ServerDescription.builder()
                .address(address)
                .state(CONNECTED)
                .ok(true)
                .type(type)
                .setName(setName)
                .maxWireVersion(17)
                .build();
    }
}
