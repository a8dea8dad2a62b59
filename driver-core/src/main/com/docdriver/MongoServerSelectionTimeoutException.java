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

package com.docdriver;

import com.docdriver.connection.ClusterDescription;

import static com.docdriver.assertions.Assertions.notNull;

/**
 * An exception indicating that no server matched the selection criteria before the server selection timeout elapsed.  The cluster
 * description in effect when the selection gave up is attached for diagnosis.
 */
public class MongoServerSelectionTimeoutException extends MongoTimeoutException {

    private static final long serialVersionUID = 2954735823512049624L;

    private final transient ClusterDescription clusterDescription;

    /**
     * Construct a new instance.
     *
     * @param message            the message
     * @param clusterDescription the last known cluster description
     */
    public MongoServerSelectionTimeoutException(final String message, final ClusterDescription clusterDescription) {
        super(message);
        this.clusterDescription = notNull("clusterDescription", clusterDescription);
    }

    /**
     * Gets the cluster description that was current when server selection timed out.
     *
     * @return the cluster description
     */
    public ClusterDescription getClusterDescription() {
        return clusterDescription;
    }
}
