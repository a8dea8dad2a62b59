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

package com.docdriver.reactivestreams.client.internal;

import com.docdriver.internal.connection.Cluster;
import com.docdriver.internal.connection.Connection;
import com.docdriver.internal.connection.OperationContext;
import com.docdriver.internal.connection.ServerTuple;
import com.docdriver.selector.ServerSelector;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import static com.docdriver.assertions.Assertions.notNull;

/**
 * Runs the blocking selection and checkout steps of a cluster on a scheduler, so that reactive callers never block.
 *
 * <p>This class is not part of the public API and may be removed or changed at any time</p>
 */
public final class ServerSelectionMono {
    private final Cluster cluster;
    private final Scheduler scheduler;

    public ServerSelectionMono(final Cluster cluster) {
        this(cluster, Schedulers.boundedElastic());
    }

    public ServerSelectionMono(final Cluster cluster, final Scheduler scheduler) {
        this.cluster = notNull("cluster", cluster);
        this.scheduler = notNull("scheduler", scheduler);
    }

    /**
     * Selects a server when subscribed to.  Each subscription runs a new selection.
     *
     * @param serverSelector   the selector
     * @param operationContext the operation context
     * @return a mono emitting the selected server, or the selection error
     */
    public Mono<ServerTuple> selectServer(final ServerSelector serverSelector, final OperationContext operationContext) {
        notNull("serverSelector", serverSelector);
        notNull("operationContext", operationContext);
        return Mono.fromCallable(() -> cluster.selectServer(serverSelector, operationContext))
                .subscribeOn(scheduler);
    }

    /**
     * Selects a server, then checks out a connection to it.
     *
     * @param serverSelector   the selector
     * @param operationContext the operation context, whose timeout spans both steps
     * @return a mono emitting a checked out connection, which the subscriber must release
     */
    public Mono<Connection> getConnection(final ServerSelector serverSelector, final OperationContext operationContext) {
        return selectServer(serverSelector, operationContext)
                .map(serverTuple -> serverTuple.getServer().getConnection(operationContext));
    }
}
