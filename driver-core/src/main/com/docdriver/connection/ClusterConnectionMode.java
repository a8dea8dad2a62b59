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
 * The cluster connection mode, fixed when the cluster is constructed.
 */
public enum ClusterConnectionMode {
    /**
     * Connect directly to a single server, regardless of its type.
     */
    SINGLE,

    /**
     * Discover the cluster from a seed list of one or more servers.
     */
    MULTIPLE,

    /**
     * Connect to a load balancer.
     */
    LOAD_BALANCED
}
