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

package com.docdriver.reactivestreams.client;

import com.docdriver.annotations.ThreadSafe;
import com.docdriver.diagnostics.logging.Logger;
import com.docdriver.diagnostics.logging.Loggers;
import com.docdriver.event.ClusterClosedEvent;
import com.docdriver.event.ClusterDescriptionChangedEvent;
import com.docdriver.event.ClusterListener;
import reactor.core.CoreSubscriber;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import static java.lang.String.format;

/**
 * A publisher of the topology changes of a single cluster.
 *
 * <p>Register an instance as a cluster listener before the cluster is created.  Changes are buffered without bound until the one
 * permitted subscriber arrives, and the publisher completes when the cluster closes.  A second subscriber is rejected with an
 * {@link IllegalStateException}.</p>
 *
 * <pre>{@code
 * ClusterDescriptionPublisher publisher = new ClusterDescriptionPublisher();
 * ClusterSettings settings = ClusterSettings.builder().hosts(hosts).addClusterListener(publisher).build();
 * }</pre>
 */
@ThreadSafe
public final class ClusterDescriptionPublisher extends Flux<ClusterDescriptionChangedEvent> implements ClusterListener {
    private static final Logger LOGGER = Loggers.getLogger("reactivestreams");

    private final Sinks.Many<ClusterDescriptionChangedEvent> sink = Sinks.many().unicast().onBackpressureBuffer();

    @Override
    public synchronized void clusterDescriptionChanged(final ClusterDescriptionChangedEvent event) {
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isFailure() && LOGGER.isDebugEnabled()) {
            LOGGER.debug(format("Dropped cluster description change for %s: %s", event.getClusterId(), result));
        }
    }

    @Override
    public synchronized void clusterClosed(final ClusterClosedEvent event) {
        sink.tryEmitComplete();
    }

    @Override
    public void subscribe(final CoreSubscriber<? super ClusterDescriptionChangedEvent> actual) {
        sink.asFlux().subscribe(actual);
    }
}
