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
import com.docdriver.connection.ClusterDescription;
import com.docdriver.connection.ServerDescription;

import java.util.Collections;
import java.util.List;

import static com.docdriver.assertions.Assertions.notNull;

/**
 * A server selector that chooses a server that matches the server address.
 */
public class ServerAddressSelector implements ServerSelector {
    private final ServerAddress serverAddress;

    /**
     * Constructs a new instance.
     *
     * @param serverAddress the server address
     */
    public ServerAddressSelector(final ServerAddress serverAddress) {
        this.serverAddress = notNull("serverAddress", serverAddress);
    }

    /**
     * Gets the server address.
     *
     * @return the server address
     */
    public ServerAddress getServerAddress() {
        return serverAddress;
    }

    @Override
    public List<ServerDescription> select(final ClusterDescription clusterDescription) {
        ServerDescription serverDescription = clusterDescription.getByServerAddress(serverAddress);
        if (serverDescription != null && serverDescription.isOk()) {
            return Collections.singletonList(serverDescription);
        }
        return Collections.emptyList();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return serverAddress.equals(((ServerAddressSelector) o).serverAddress);
    }

    @Override
    public int hashCode() {
        return serverAddress.hashCode();
    }

    @Override
    public String toString() {
        return "ServerAddressSelector{"
               + "serverAddress=" + serverAddress
               + '}';
    }
}
