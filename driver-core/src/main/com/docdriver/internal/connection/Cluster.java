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

import com.docdriver.annotations.ThreadSafe;
import com.docdriver.connection.ClusterDescription;
import com.docdriver.connection.ClusterId;
import com.docdriver.connection.ClusterSettings;
import com.docdriver.event.ServerDescriptionChangedEvent;
import com.docdriver.selector.ServerSelector;

import java.io.Closeable;

/**
 * Represents a cluster of MongoDB servers.  Implementations can define the behaviour depending upon the type of cluster.
 *
 * <p>This class is not part of the public API and may be removed or changed at any time</p>
 */
@ThreadSafe
public interface Cluster extends Closeable {

    /**
     * Gets the cluster settings with which this cluster was created.
     *
     * @return the cluster settings
     */
    ClusterSettings getSettings();

    /**
     * Get the cluster identifier.
     *
     * @return the cluster identifier
     */
    ClusterId getClusterId();

    /**
     * Get the current description of this cluster.  Never blocks.
     *
     * @return the current cluster description
     */
    ClusterDescription getCurrentDescription();

    /**
     * Get a server that matches the given selector, waiting until one does or the server selection timeout elapses.
     *
     * @param serverSelector   the server selector
     * @param operationContext the operation context
     * @return the selected server with the description it was selected with
     * @throws com.docdriver.MongoServerSelectionTimeoutException if no server matches before the deadline
     * @throws com.docdriver.MongoIncompatibleDriverException if a server is not compatible with the driver
     */
    ServerTuple selectServer(ServerSelector serverSelector, OperationContext operationContext);

    /**
     * Applies a new description of one of the servers in this cluster.  Descriptions are applied one at a time, in the order they
     * arrive.
     *
     * @param event the server description changed event
     */
    void onChange(ServerDescriptionChangedEvent event);

    /**
     * Closes connections to the servers in the cluster.  After this is called, this cluster instance can no longer be used.
     */
    @Override
    void close();

    /**
     * Whether all the servers in the cluster are closed or not.
     *
     * @return true if all the servers in this cluster have been closed
     */
    boolean isClosed();
}
