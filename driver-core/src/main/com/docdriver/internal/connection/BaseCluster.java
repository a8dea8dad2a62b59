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

import com.docdriver.MongoIncompatibleDriverException;
import com.docdriver.MongoInterruptedException;
import com.docdriver.MongoServerSelectionTimeoutException;
import com.docdriver.ServerAddress;
import com.docdriver.connection.ClusterDescription;
import com.docdriver.connection.ClusterId;
import com.docdriver.connection.ClusterSettings;
import com.docdriver.connection.ServerDescription;
import com.docdriver.connection.ServerSettings;
import com.docdriver.diagnostics.logging.Logger;
import com.docdriver.diagnostics.logging.Loggers;
import com.docdriver.event.ClusterClosedEvent;
import com.docdriver.event.ClusterDescriptionChangedEvent;
import com.docdriver.event.ClusterListener;
import com.docdriver.event.ClusterOpeningEvent;
import com.docdriver.internal.time.Timeout;
import com.docdriver.lang.Nullable;
import com.docdriver.selector.CompositeServerSelector;
import com.docdriver.selector.LatencyMinimizingServerSelector;
import com.docdriver.selector.ServerSelector;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import static com.docdriver.assertions.Assertions.isTrue;
import static com.docdriver.assertions.Assertions.notNull;
import static com.docdriver.connection.ServerDescription.MAX_DRIVER_WIRE_VERSION;
import static com.docdriver.connection.ServerDescription.MIN_DRIVER_SERVER_VERSION;
import static com.docdriver.connection.ServerDescription.MIN_DRIVER_WIRE_VERSION;
import static com.docdriver.internal.event.EventListenerHelper.clusterListener;
import static java.lang.String.format;
import static java.util.Arrays.asList;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * The topology manager: the single writer of the cluster description.  Subclasses apply server description changes under
 * {@link #getLock()} and publish the result with {@link #updateDescription(ClusterDescription)}, which wakes every thread waiting to
 * select a server.
 */
abstract class BaseCluster implements Cluster {

    static final Logger LOGGER = Loggers.getLogger("cluster");

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicReference<CountDownLatch> phase = new AtomicReference<CountDownLatch>(new CountDownLatch(1));
    private final ClusterableServerFactory serverFactory;
    private final ClusterId clusterId;
    private final ClusterSettings settings;
    private final ClusterListener clusterListener;
    private volatile boolean isClosed;
    private volatile ClusterDescription description;

    BaseCluster(final ClusterId clusterId, final ClusterSettings settings, final ClusterableServerFactory serverFactory) {
        this.clusterId = notNull("clusterId", clusterId);
        this.settings = notNull("settings", settings);
        this.serverFactory = notNull("serverFactory", serverFactory);
        this.clusterListener = clusterListener(settings.getClusterListeners(),
                serverFactory.getSettings().getMaxDocumentLength());
        clusterListener.clusterOpening(new ClusterOpeningEvent(clusterId));
        description = new ClusterDescription(settings.getMode(), settings.getRequiredClusterType(),
                new ArrayList<ServerDescription>(), null, null, null, settings, serverFactory.getSettings());
    }

    @Override
    public ClusterId getClusterId() {
        return clusterId;
    }

    @Override
    public ClusterSettings getSettings() {
        return settings;
    }

    ServerSettings getServerSettings() {
        return serverFactory.getSettings();
    }

    ClusterableServerFactory getServerFactory() {
        return serverFactory;
    }

    ReentrantLock getLock() {
        return lock;
    }

    @Override
    public ClusterDescription getCurrentDescription() {
        return description;
    }

    @Override
    public ServerTuple selectServer(final ServerSelector serverSelector, final OperationContext operationContext) {
        isTrue("open", !isClosed());
        ServerSelector compositeServerSelector = getCompositeServerSelector(serverSelector);
        Timeout timeout = Timeout.earliest(
                Timeout.startNow(settings.getServerSelectionTimeout(MILLISECONDS), MILLISECONDS),
                operationContext.getOperationTimeout());

        boolean selectionWaitingLogged = false;
        long startTimeNanos = System.nanoTime();
        try {
            CountDownLatch currentPhase = phase.get();
            ClusterDescription curDescription = description;
            logServerSelectionStarted(serverSelector, curDescription);

            while (true) {
                isTrue("open", !isClosed());
                throwIfIncompatible(curDescription);
                ServerTuple serverTuple = selectServer(compositeServerSelector, curDescription);
                if (serverTuple != null) {
                    logServerSelectionSucceeded(serverTuple.getServerDescription().getAddress(), serverSelector, startTimeNanos);
                    return serverTuple;
                }

                if (timeout.expired()) {
                    throw createTimeoutException(serverSelector, curDescription, timeout);
                }

                if (!selectionWaitingLogged) {
                    if (LOGGER.isInfoEnabled()) {
                        LOGGER.info(format("No server chosen by %s from cluster description %s. Waiting for %s",
                                serverSelector, curDescription.getShortDescription(), timeout.isInfinite() ? "ever"
                                        : timeout.remaining(MILLISECONDS) + " ms before timing out"));
                    }
                    selectionWaitingLogged = true;
                }

                connect();
                currentPhase.await(getWaitNanos(timeout), NANOSECONDS);
                currentPhase = phase.get();
                curDescription = description;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MongoInterruptedException(format("Interrupted while waiting for a server that matches %s", serverSelector), e);
        }
    }

    private long getWaitNanos(final Timeout timeout) {
        long minWaitNanos = getServerSettings().getMinHeartbeatFrequency(NANOSECONDS);
        if (timeout.isInfinite()) {
            return minWaitNanos;
        }
        return Math.min(timeout.remaining(NANOSECONDS), minWaitNanos);
    }

    /**
     * Publish a new description, notify listeners if it differs from the previous one, and wake every waiting selection.  Must be
     * called while holding the lock.
     *
     * @param newDescription the new description
     */
    void updateDescription(final ClusterDescription newDescription) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(format("Updating cluster description to  %s", newDescription.getShortDescription()));
        }
        ClusterDescription previousDescription = description;
        description = newDescription;
        if (!newDescription.equals(previousDescription)) {
            clusterListener.clusterDescriptionChanged(new ClusterDescriptionChangedEvent(clusterId, newDescription, previousDescription));
        }
        updatePhase();
    }

    private void updatePhase() {
        phase.getAndSet(new CountDownLatch(1)).countDown();
    }

    @Override
    public void close() {
        if (!isClosed()) {
            isClosed = true;
            phase.get().countDown();
            clusterListener.clusterClosed(new ClusterClosedEvent(clusterId));
        }
    }

    @Override
    public boolean isClosed() {
        return isClosed;
    }

    /**
     * Gets the server for the given address, if it is still a member of the cluster.
     *
     * @param serverAddress the address
     * @return the server, or null if the address is no longer a member
     */
    @Nullable
    abstract ClusterableServer getServer(ServerAddress serverAddress);

    /**
     * Request an immediate check of every server.
     */
    abstract void connect();

    @Nullable
    private ServerTuple selectServer(final ServerSelector serverSelector, final ClusterDescription clusterDescription) {
        List<ServerDescription> candidates = new ArrayList<ServerDescription>(serverSelector.select(clusterDescription));
        while (!candidates.isEmpty()) {
            ServerDescription serverDescription = candidates.remove(ThreadLocalRandom.current().nextInt(candidates.size()));
            ClusterableServer server = getServer(serverDescription.getAddress());
            if (server != null) {
                return new ServerTuple(server, serverDescription);
            }
        }
        return null;
    }

    private ServerSelector getCompositeServerSelector(final ServerSelector serverSelector) {
        ServerSelector latencyMinimizingServerSelector =
                new LatencyMinimizingServerSelector(settings.getLocalThreshold(MILLISECONDS), MILLISECONDS);
        if (settings.getServerSelector() == null) {
            return new CompositeServerSelector(asList(serverSelector, latencyMinimizingServerSelector));
        } else {
            return new CompositeServerSelector(asList(serverSelector, settings.getServerSelector(), latencyMinimizingServerSelector));
        }
    }

    private void throwIfIncompatible(final ClusterDescription curDescription) {
        if (!curDescription.isCompatibleWithDriver()) {
            throw createIncompatibleException(curDescription);
        }
    }

    private MongoIncompatibleDriverException createIncompatibleException(final ClusterDescription curDescription) {
        String message;
        ServerDescription incompatibleServer = curDescription.findServerIncompatiblyOlderThanDriver();
        if (incompatibleServer != null) {
            message = format("Server at %s reports wire version %d, but this version of the driver requires at least %d (MongoDB %s).",
                    incompatibleServer.getAddress(), incompatibleServer.getMaxWireVersion(), MIN_DRIVER_WIRE_VERSION,
                    MIN_DRIVER_SERVER_VERSION);
        } else {
            incompatibleServer = curDescription.findServerIncompatiblyNewerThanDriver();
            if (incompatibleServer != null) {
                message = format("Server at %s requires wire version %d, but this version of the driver only supports up to %d.",
                        incompatibleServer.getAddress(), incompatibleServer.getMinWireVersion(), MAX_DRIVER_WIRE_VERSION);
            } else {
                throw new IllegalStateException("Server can't be both older than the driver and newer.");
            }
        }
        return new MongoIncompatibleDriverException(message, curDescription);
    }

    private MongoServerSelectionTimeoutException createTimeoutException(final ServerSelector serverSelector,
                                                                        final ClusterDescription curDescription,
                                                                        final Timeout timeout) {
        return new MongoServerSelectionTimeoutException(
                format("Timed out after %d ms while waiting for a server that matches %s. Client view of cluster state is %s",
                        timeout.getDuration(MILLISECONDS), serverSelector, curDescription.getShortDescription()),
                curDescription);
    }

    private void logServerSelectionStarted(final ServerSelector serverSelector, final ClusterDescription clusterDescription) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(format("Server selection started for %s with cluster description %s", serverSelector,
                    clusterDescription.getShortDescription()));
        }
    }

    private void logServerSelectionSucceeded(final ServerAddress serverAddress, final ServerSelector serverSelector,
                                             final long startTimeNanos) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(format("Selected server %s for %s in %d ms", serverAddress, serverSelector,
                    MILLISECONDS.convert(System.nanoTime() - startTimeNanos, NANOSECONDS)));
        }
    }
}
