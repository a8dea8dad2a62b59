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

/**
 * An enumeration of all possible cluster types, as recomputed by the topology manager after each accepted server description.
 */
public enum ClusterType {
    /**
     * A single server, either a standalone or a server connected to directly.
     */
    SINGLE,

    /**
     * A replica set with no known primary.
     */
    REPLICA_SET_NO_PRIMARY,

    /**
     * A replica set with exactly one known primary.
     */
    REPLICA_SET_WITH_PRIMARY,

    /**
     * A sharded cluster, connected to via one or more mongos servers.
     */
    SHARDED,

    /**
     * A cluster behind a load balancer.
     */
    LOAD_BALANCED,

    /**
     * The cluster type is not yet known.
     */
    UNKNOWN;

    /**
     * @return true if this is one of the two replica set types
     */
    public boolean isReplicaSet() {
        return this == REPLICA_SET_NO_PRIMARY || this == REPLICA_SET_WITH_PRIMARY;
    }
}
