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

import com.docdriver.ServerAddress;
import com.docdriver.connection.ServerDescription;
import com.docdriver.connection.ServerSettings;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

class TestClusterableServerFactory implements ClusterableServerFactory {
    private final Map<ServerAddress, TestServer> addressToServerMap = new ConcurrentHashMap<ServerAddress, TestServer>();
    private final ServerSettings settings;

    TestClusterableServerFactory() {
        this(ServerSettings.builder().build());
    }

    TestClusterableServerFactory(final ServerSettings settings) {
        this.settings = settings;
    }

    @Override
    public ClusterableServer create(final Cluster cluster, final ServerAddress serverAddress) {
        TestServer server = new TestServer(cluster, serverAddress);
        addressToServerMap.put(serverAddress, server);
        return server;
    }

    @Override
    public ServerSettings getSettings() {
        return settings;
    }

    TestServer getServer(final ServerAddress serverAddress) {
        return addressToServerMap.get(serverAddress);
    }

    void sendNotification(final ServerAddress serverAddress, final ServerDescription serverDescription) {
        getServer(serverAddress).sendNotification(serverDescription);
    }
}
