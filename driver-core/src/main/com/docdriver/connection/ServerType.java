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
 * The type of the server, as determined by its most recent health check.  The type decides whether the server is eligible to serve a
 * given operation.
 */
public enum ServerType {
    /**
     * A standalone mongod server.
     */
    STANDALONE,

    /**
     * A replica set primary.
     */
    REPLICA_SET_PRIMARY,

    /**
     * A replica set secondary.
     */
    REPLICA_SET_SECONDARY,

    /**
     * A replica set arbiter.
     */
    REPLICA_SET_ARBITER,

    /**
     * A replica set member that is none of the other types (a passive, for example).
     */
    REPLICA_SET_OTHER,

    /**
     * A replica set member that does not report a set name or a hosts list.
     */
    REPLICA_SET_GHOST,

    /**
     * A router to a sharded cluster, i.e. a mongos server.
     */
    SHARD_ROUTER,

    /**
     * A load balancer.
     */
    LOAD_BALANCER,

    /**
     * The server type is not yet known, or the last check of the server failed.
     */
    UNKNOWN;

    /**
     * @return true if this type is one of the replica set member types, ghosts included
     */
    public boolean isReplicaSetMember() {
        switch (this) {
            case REPLICA_SET_PRIMARY:
            case REPLICA_SET_SECONDARY:
            case REPLICA_SET_ARBITER:
            case REPLICA_SET_OTHER:
            case REPLICA_SET_GHOST:
                return true;
            default:
                return false;
        }
    }

    /**
     * Gets the cluster type family that a server of this type implies.  All replica set member types imply
     * {@link ClusterType#REPLICA_SET_NO_PRIMARY}; whether a primary exists is decided by the whole topology.
     *
     * @return the implied cluster type
     */
    public ClusterType getClusterType() {
        switch (this) {
            case STANDALONE:
                return ClusterType.SINGLE;
            case SHARD_ROUTER:
                return ClusterType.SHARDED;
            case LOAD_BALANCER:
                return ClusterType.LOAD_BALANCED;
            case UNKNOWN:
                return ClusterType.UNKNOWN;
            default:
                return ClusterType.REPLICA_SET_NO_PRIMARY;
        }
    }
}
