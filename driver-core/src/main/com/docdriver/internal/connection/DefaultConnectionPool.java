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

import com.docdriver.MongoConnectionPoolClearedException;
import com.docdriver.MongoConnectionPoolTimeoutException;
import com.docdriver.annotations.ThreadSafe;
import com.docdriver.connection.ConnectionDescription;
import com.docdriver.connection.ConnectionId;
import com.docdriver.connection.ConnectionPoolSettings;
import com.docdriver.connection.ServerDescription;
import com.docdriver.connection.ServerId;
import com.docdriver.diagnostics.logging.Logger;
import com.docdriver.diagnostics.logging.Loggers;
import com.docdriver.event.ConnectionCheckOutFailedEvent;
import com.docdriver.event.ConnectionCheckOutStartedEvent;
import com.docdriver.event.ConnectionCheckedInEvent;
import com.docdriver.event.ConnectionCheckedOutEvent;
import com.docdriver.event.ConnectionClosedEvent;
import com.docdriver.event.ConnectionCreatedEvent;
import com.docdriver.event.ConnectionPoolClearedEvent;
import com.docdriver.event.ConnectionPoolClosedEvent;
import com.docdriver.event.ConnectionPoolCreatedEvent;
import com.docdriver.event.ConnectionPoolListener;
import com.docdriver.event.ConnectionPoolReadyEvent;
import com.docdriver.event.ConnectionReadyEvent;
import com.docdriver.internal.time.Timeout;
import com.docdriver.lang.Nullable;
import org.bson.BsonDocument;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import static com.docdriver.assertions.Assertions.isTrue;
import static com.docdriver.assertions.Assertions.notNull;
import static com.docdriver.internal.event.EventListenerHelper.connectionPoolListener;
import static java.lang.String.format;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * A connection pool for a single server.  Idle connections are reused most recently used first, and every connection is stamped with
 * the pool generation it was created under, so that clearing the pool invalidates connections without visiting them.
 *
 * <p>This class is not part of the public API and may be removed or changed at any time</p>
 */
@ThreadSafe
public class DefaultConnectionPool implements ConnectionPool {
    private static final Logger LOGGER = Loggers.getLogger("pool");

    enum State {
        PAUSED,
        READY,
        CLOSED
    }

    private final ServerId serverId;
    private final InternalConnectionFactory internalConnectionFactory;
    private final ConnectionPoolSettings settings;
    private final ConnectionPoolListener connectionPoolListener;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition availableCondition = lock.newCondition();
    private final Deque<UsageTrackingInternalConnection> available = new ArrayDeque<UsageTrackingInternalConnection>();
    private int totalCount;
    private int inUseCount;
    private State state = State.PAUSED;
    @Nullable
    private Throwable pauseCause;
    private volatile int generation;

    @Nullable
    private final ScheduledExecutorService maintenanceExecutor;

    public DefaultConnectionPool(final ServerId serverId, final InternalConnectionFactory internalConnectionFactory,
                                 final ConnectionPoolSettings settings) {
        this.serverId = notNull("serverId", serverId);
        this.internalConnectionFactory = notNull("internalConnectionFactory", internalConnectionFactory);
        this.settings = notNull("settings", settings);
        this.connectionPoolListener = connectionPoolListener(settings.getConnectionPoolListeners());
        this.maintenanceExecutor = createMaintenanceExecutor();
        connectionPoolListener.connectionPoolCreated(new ConnectionPoolCreatedEvent(serverId, settings));
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(format("Connection pool created for %s using options %s", serverId.getAddress(), settings));
        }
    }

    @Override
    public InternalConnection get(final OperationContext operationContext) {
        long startNanos = System.nanoTime();
        connectionPoolListener.connectionCheckOutStarted(new ConnectionCheckOutStartedEvent(serverId, operationContext.getId()));
        Timeout timeout = Timeout.earliest(Timeout.startNow(settings.getMaxWaitTime(MILLISECONDS), MILLISECONDS),
                operationContext.getOperationTimeout());

        UsageTrackingInternalConnection connection;
        try {
            connection = acquire(timeout);
        } catch (MongoConnectionPoolTimeoutException e) {
            emitCheckOutFailed(operationContext, ConnectionCheckOutFailedEvent.Reason.TIMEOUT, startNanos);
            throw e;
        } catch (IllegalStateException e) {
            emitCheckOutFailed(operationContext, ConnectionCheckOutFailedEvent.Reason.POOL_CLOSED, startNanos);
            throw e;
        } catch (MongoConnectionPoolClearedException e) {
            emitCheckOutFailed(operationContext, ConnectionCheckOutFailedEvent.Reason.CONNECTION_ERROR, startNanos);
            throw e;
        } catch (RuntimeException e) {
            emitCheckOutFailed(operationContext, ConnectionCheckOutFailedEvent.Reason.UNKNOWN, startNanos);
            throw e;
        }

        if (!connection.opened()) {
            try {
                openConnection(connection);
            } catch (RuntimeException e) {
                discardReservation();
                emitCheckOutFailed(operationContext, ConnectionCheckOutFailedEvent.Reason.CONNECTION_ERROR, startNanos);
                throw e;
            }
        }

        connectionPoolListener.connectionCheckedOut(new ConnectionCheckedOutEvent(connection.getDescription().getConnectionId(),
                operationContext.getId(), System.nanoTime() - startNanos));
        return new PooledConnection(connection, operationContext.getId());
    }

    /**
     * Returns an idle connection, or a new unopened connection for which a slot has been reserved.
     */
    private UsageTrackingInternalConnection acquire(final Timeout timeout) {
        List<UsageTrackingInternalConnection> toClose = new ArrayList<UsageTrackingInternalConnection>();
        int generationAtReservation;
        lock.lock();
        try {
            while (true) {
                throwIfClosedOrPaused();
                UsageTrackingInternalConnection idleConnection = pollAvailable(toClose);
                if (idleConnection != null) {
                    inUseCount++;
                    return idleConnection;
                }
                if (totalCount < settings.getMaxSize()) {
                    totalCount++;
                    inUseCount++;
                    generationAtReservation = generation;
                    break;
                }
                if (timeout.expired()) {
                    throw createTimeoutException();
                }
                timeout.awaitOn(availableCondition, "waiting for a connection");
            }
        } finally {
            lock.unlock();
            closeAll(toClose, ConnectionClosedEvent.Reason.STALE);
        }
        return new UsageTrackingInternalConnection(internalConnectionFactory.create(serverId, generationAtReservation));
    }

    private void throwIfClosedOrPaused() {
        if (state == State.CLOSED) {
            throw new IllegalStateException("The server at " + serverId.getAddress() + " is no longer available");
        }
        if (state == State.PAUSED) {
            throw new MongoConnectionPoolClearedException(serverId, pauseCause);
        }
    }

    private MongoConnectionPoolTimeoutException createTimeoutException() {
        return new MongoConnectionPoolTimeoutException(format("Timed out while waiting for a connection to server %s after %d ms. "
                        + "Details: maxPoolSize: %d, connections in use by operations: %d",
                serverId.getAddress(), settings.getMaxWaitTime(MILLISECONDS), settings.getMaxSize(), inUseCount),
                serverId.getAddress());
    }

    // must be called with the lock held; connections that can not be reused are added to toClose
    @Nullable
    private UsageTrackingInternalConnection pollAvailable(final List<UsageTrackingInternalConnection> toClose) {
        UsageTrackingInternalConnection connection;
        while ((connection = available.pollFirst()) != null) {
            if (shouldPrune(connection)) {
                totalCount--;
                toClose.add(connection);
            } else {
                return connection;
            }
        }
        return null;
    }

    private void openConnection(final UsageTrackingInternalConnection connection) {
        long startNanos = System.nanoTime();
        ConnectionId connectionId = connection.getDescription().getConnectionId();
        connectionPoolListener.connectionCreated(new ConnectionCreatedEvent(connectionId));
        try {
            connection.open();
        } catch (RuntimeException e) {
            connectionPoolListener.connectionClosed(new ConnectionClosedEvent(connectionId, ConnectionClosedEvent.Reason.ERROR));
            throw e;
        }
        connectionPoolListener.connectionReady(new ConnectionReadyEvent(connection.getDescription().getConnectionId(),
                System.nanoTime() - startNanos));
    }

    private void discardReservation() {
        lock.lock();
        try {
            totalCount--;
            inUseCount--;
            availableCondition.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private void release(final UsageTrackingInternalConnection connection, final long operationId) {
        ConnectionId connectionId = connection.getDescription().getConnectionId();
        connectionPoolListener.connectionCheckedIn(new ConnectionCheckedInEvent(connectionId, operationId));
        ConnectionClosedEvent.Reason closeReason = null;
        lock.lock();
        try {
            inUseCount--;
            if (state == State.CLOSED) {
                closeReason = ConnectionClosedEvent.Reason.POOL_CLOSED;
            } else if (connection.isClosed()) {
                closeReason = ConnectionClosedEvent.Reason.ERROR;
            } else if (connection.getGeneration() != generation) {
                closeReason = ConnectionClosedEvent.Reason.STALE;
            } else if (hasExceededLifeTime(connection)) {
                closeReason = ConnectionClosedEvent.Reason.EXPIRED;
            }
            if (closeReason == null) {
                connection.markUsed();
                available.addFirst(connection);
            } else {
                totalCount--;
            }
            availableCondition.signalAll();
        } finally {
            lock.unlock();
        }
        if (closeReason != null) {
            close(connection, closeReason);
        }
    }

    @Override
    public void invalidate(@Nullable final Throwable cause) {
        List<UsageTrackingInternalConnection> toClose;
        lock.lock();
        try {
            if (state == State.CLOSED) {
                return;
            }
            generation++;
            state = State.PAUSED;
            pauseCause = cause;
            toClose = new ArrayList<UsageTrackingInternalConnection>(available);
            totalCount -= available.size();
            available.clear();
            availableCondition.signalAll();
        } finally {
            lock.unlock();
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(format("Invalidating the connection pool for %s and marking it as 'paused'%s", serverId.getAddress(),
                    cause == null ? "" : format(" due to the exception: %s", cause)));
        }
        closeAll(toClose, ConnectionClosedEvent.Reason.STALE);
        connectionPoolListener.connectionPoolCleared(new ConnectionPoolClearedEvent(serverId));
    }

    @Override
    public void ready() {
        lock.lock();
        try {
            if (state != State.PAUSED) {
                return;
            }
            state = State.READY;
            pauseCause = null;
        } finally {
            lock.unlock();
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(format("Connection pool ready for %s", serverId.getAddress()));
        }
        connectionPoolListener.connectionPoolReady(new ConnectionPoolReadyEvent(serverId));
    }

    @Override
    public int getGeneration() {
        return generation;
    }

    @Override
    public void close() {
        List<UsageTrackingInternalConnection> toClose;
        lock.lock();
        try {
            if (state == State.CLOSED) {
                return;
            }
            state = State.CLOSED;
            toClose = new ArrayList<UsageTrackingInternalConnection>(available);
            totalCount -= available.size();
            available.clear();
            availableCondition.signalAll();
        } finally {
            lock.unlock();
        }
        if (maintenanceExecutor != null) {
            maintenanceExecutor.shutdownNow();
        }
        closeAll(toClose, ConnectionClosedEvent.Reason.POOL_CLOSED);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(format("Closed connection pool for %s", serverId.getAddress()));
        }
        connectionPoolListener.connectionPoolClosed(new ConnectionPoolClosedEvent(serverId));
    }

    /**
     * Prunes stale and expired idle connections, then opens connections until the pool holds at least {@code minSize}.
     */
    void doMaintenance() {
        List<UsageTrackingInternalConnection> toClose = new ArrayList<UsageTrackingInternalConnection>();
        lock.lock();
        try {
            Iterator<UsageTrackingInternalConnection> iterator = available.iterator();
            while (iterator.hasNext()) {
                UsageTrackingInternalConnection connection = iterator.next();
                if (shouldPrune(connection)) {
                    iterator.remove();
                    totalCount--;
                    toClose.add(connection);
                }
            }
        } finally {
            lock.unlock();
        }
        for (UsageTrackingInternalConnection connection : toClose) {
            close(connection, getReasonForClosing(connection));
        }
        ensureMinSize();
    }

    private void ensureMinSize() {
        while (true) {
            int generationAtReservation;
            lock.lock();
            try {
                if (state != State.READY || totalCount >= settings.getMinSize()) {
                    return;
                }
                totalCount++;
                generationAtReservation = generation;
            } finally {
                lock.unlock();
            }

            UsageTrackingInternalConnection connection =
                    new UsageTrackingInternalConnection(internalConnectionFactory.create(serverId, generationAtReservation));
            try {
                openConnection(connection);
            } catch (RuntimeException e) {
                lock.lock();
                try {
                    totalCount--;
                    availableCondition.signalAll();
                } finally {
                    lock.unlock();
                }
                LOGGER.info(format("Exception while populating the connection pool for %s to its minimum size", serverId.getAddress()), e);
                return;
            }

            boolean added = false;
            lock.lock();
            try {
                if (state == State.READY && connection.getGeneration() == generation) {
                    available.addLast(connection);
                    added = true;
                    availableCondition.signalAll();
                } else {
                    totalCount--;
                }
            } finally {
                lock.unlock();
            }
            if (!added) {
                close(connection, ConnectionClosedEvent.Reason.STALE);
                return;
            }
        }
    }

    private boolean shouldPrune(final UsageTrackingInternalConnection connection) {
        return connection.isClosed() || connection.getGeneration() != generation || hasExceededIdleTime(connection)
                || hasExceededLifeTime(connection);
    }

    private ConnectionClosedEvent.Reason getReasonForClosing(final UsageTrackingInternalConnection connection) {
        if (connection.isClosed()) {
            return ConnectionClosedEvent.Reason.ERROR;
        } else if (connection.getGeneration() != generation) {
            return ConnectionClosedEvent.Reason.STALE;
        } else if (hasExceededIdleTime(connection)) {
            return ConnectionClosedEvent.Reason.IDLE;
        } else {
            return ConnectionClosedEvent.Reason.EXPIRED;
        }
    }

    private boolean hasExceededIdleTime(final UsageTrackingInternalConnection connection) {
        long maxIdleTime = settings.getMaxConnectionIdleTime(MILLISECONDS);
        return maxIdleTime != 0 && System.currentTimeMillis() - connection.getLastUsedAt() > maxIdleTime;
    }

    private boolean hasExceededLifeTime(final UsageTrackingInternalConnection connection) {
        long maxLifeTime = settings.getMaxConnectionLifeTime(MILLISECONDS);
        return maxLifeTime != 0 && System.currentTimeMillis() - connection.getOpenedAt() > maxLifeTime;
    }

    private void closeAll(final List<UsageTrackingInternalConnection> connections, final ConnectionClosedEvent.Reason reason) {
        for (UsageTrackingInternalConnection connection : connections) {
            close(connection, reason);
        }
    }

    private void close(final UsageTrackingInternalConnection connection, final ConnectionClosedEvent.Reason reason) {
        connection.close();
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(format("Closed connection [%s] to %s because %s.", connection.getDescription().getConnectionId(),
                    serverId.getAddress(), reason.name().toLowerCase()));
        }
        connectionPoolListener.connectionClosed(new ConnectionClosedEvent(connection.getDescription().getConnectionId(), reason));
    }

    private void emitCheckOutFailed(final OperationContext operationContext, final ConnectionCheckOutFailedEvent.Reason reason,
                                    final long startNanos) {
        connectionPoolListener.connectionCheckOutFailed(new ConnectionCheckOutFailedEvent(serverId, operationContext.getId(), reason,
                System.nanoTime() - startNanos));
    }

    @Nullable
    private ScheduledExecutorService createMaintenanceExecutor() {
        long frequency = settings.getMaintenanceFrequency(MILLISECONDS);
        if (frequency <= 0) {
            return null;
        }
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("MaintenanceTimer"));
        executor.scheduleAtFixedRate(() -> {
            try {
                doMaintenance();
            } catch (Exception e) {
                LOGGER.warn(format("Exception in the maintenance task of the connection pool for %s", serverId.getAddress()), e);
            }
        }, settings.getMaintenanceInitialDelay(MILLISECONDS), frequency, MILLISECONDS);
        return executor;
    }

    State getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    int getAvailableCount() {
        lock.lock();
        try {
            return available.size();
        } finally {
            lock.unlock();
        }
    }

    int getInUseCount() {
        lock.lock();
        try {
            return inUseCount;
        } finally {
            lock.unlock();
        }
    }

    int getTotalCount() {
        lock.lock();
        try {
            return totalCount;
        } finally {
            lock.unlock();
        }
    }

    /**
     * The connection handed to callers.  Closing it checks the wrapped connection back in to the pool, exactly once.
     */
    private class PooledConnection implements InternalConnection {
        private final UsageTrackingInternalConnection wrapped;
        private final long operationId;
        private final AtomicBoolean isReleased = new AtomicBoolean();

        PooledConnection(final UsageTrackingInternalConnection wrapped, final long operationId) {
            this.wrapped = wrapped;
            this.operationId = operationId;
        }

        @Override
        public void open() {
            isTrue("open", !isReleased.get());
            wrapped.open();
        }

        @Override
        public void close() {
            isTrue("connection not already released", !isReleased.getAndSet(true));
            release(wrapped, operationId);
        }

        @Override
        public boolean opened() {
            return !isReleased.get() && wrapped.opened();
        }

        @Override
        public boolean isClosed() {
            return isReleased.get() || wrapped.isClosed();
        }

        @Override
        public int getGeneration() {
            return wrapped.getGeneration();
        }

        @Override
        public ConnectionDescription getDescription() {
            return wrapped.getDescription();
        }

        @Override
        public ServerDescription getInitialServerDescription() {
            return wrapped.getInitialServerDescription();
        }

        @Override
        public BsonDocument sendAndReceive(final CommandMessage message, final int additionalTimeoutMillis) {
            isTrue("open", !isReleased.get());
            return wrapped.sendAndReceive(message, additionalTimeoutMillis);
        }
    }
}
