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
import com.docdriver.connection.ServerId;
import com.docdriver.event.ServerDescriptionChangedEvent;

import static com.docdriver.internal.connection.ServerDescriptionHelper.unknownConnectingServerDescription;

class TestServer implements ClusterableServer {
    private final Cluster cluster;
    private final ServerId serverId;
    private volatile ServerDescription description;
    private volatile boolean isClosed;
    private volatile int connectCount;

    TestServer(final Cluster cluster, final ServerAddress serverAddress) {
        this.cluster = cluster;
        this.serverId = new ServerId(cluster.getClusterId(), serverAddress);
        this.description = unknownConnectingServerDescription(serverAddress, null);
    }

    void sendNotification(final ServerDescription newDescription) {
        ServerDescription previousDescription = description;
        description = newDescription;
        cluster.onChange(new ServerDescriptionChangedEvent(serverId, newDescription, previousDescription));
    }

    int getConnectCount() {
        return connectCount;
    }

    @Override
    public ServerDescription getDescription() {
        return description;
    }

    @Override
    public Connection getConnection(final OperationContext operationContext) {
        throw new UnsupportedOperationException();
    }

    @Override
    public void checkIn(final Connection connection, final ConnectionOutcome outcome) {
        throw new UnsupportedOperationException();
    }

    @Override
    public void connect() {
        connectCount++;
    }

    @Override
    public void close() {
        isClosed = true;
    }

    @Override
    public boolean isClosed() {
        return isClosed;
    }
}
