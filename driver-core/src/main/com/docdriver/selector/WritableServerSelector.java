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

import com.docdriver.annotations.ThreadSafe;
import com.docdriver.connection.ClusterDescription;
import com.docdriver.connection.ClusterType;
import com.docdriver.connection.ServerDescription;

import java.util.ArrayList;
import java.util.List;

/**
 * A server selector that chooses servers that are writable: a replica set primary, a standalone, a mongos or a load balancer.  A
 * direct connection to a secondary or an arbiter selects nothing.
 */
@ThreadSafe
public final class WritableServerSelector implements ServerSelector {

    @Override
    public List<ServerDescription> select(final ClusterDescription clusterDescription) {
        if (clusterDescription.getType() == ClusterType.SINGLE || clusterDescription.getType() == ClusterType.SHARDED
                || clusterDescription.getType() == ClusterType.LOAD_BALANCED) {
            List<ServerDescription> writable = new ArrayList<ServerDescription>();
            for (ServerDescription cur : clusterDescription.getAny()) {
                if (isWritable(cur)) {
                    writable.add(cur);
                }
            }
            return writable;
        }
        return clusterDescription.getPrimaries();
    }

    private static boolean isWritable(final ServerDescription serverDescription) {
        return serverDescription.isPrimary() || serverDescription.isStandAlone() || serverDescription.isShardRouter()
                || serverDescription.isLoadBalancer();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        return o != null && getClass() == o.getClass();
    }

    @Override
    public int hashCode() {
        return 0;
    }

    @Override
    public String toString() {
        return "WritableServerSelector";
    }
}
