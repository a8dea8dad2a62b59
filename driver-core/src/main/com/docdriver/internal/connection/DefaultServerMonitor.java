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

import com.docdriver.MongoInterruptedException;
import com.docdriver.MongoSocketException;
import com.docdriver.annotations.ThreadSafe;
import com.docdriver.connection.ConnectionId;
import com.docdriver.connection.ServerDescription;
import com.docdriver.connection.ServerId;
import com.docdriver.connection.ServerMonitoringMode;
import com.docdriver.connection.ServerSettings;
import com.docdriver.connection.ServerType;
import com.docdriver.connection.TopologyVersion;
import com.docdriver.diagnostics.logging.Logger;
import com.docdriver.diagnostics.logging.Loggers;
import com.docdriver.event.ServerHeartbeatFailedEvent;
import com.docdriver.event.ServerHeartbeatStartedEvent;
import com.docdriver.event.ServerHeartbeatSucceededEvent;
import com.docdriver.event.ServerMonitorListener;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonInt64;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import static com.docdriver.assertions.Assertions.notNull;
import static com.docdriver.internal.connection.DescriptionHelper.createServerDescription;
import static com.docdriver.internal.connection.ServerDescriptionHelper.unknownConnectingServerDescription;
import static com.docdriver.internal.event.EventListenerHelper.serverMonitorListener;
import static java.lang.String.format;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * Monitors a single server on a dedicated daemon thread, either by polling it with {@code hello} once per heartbeat interval or by
 * streaming awaitable {@code hello} responses, in which case a second thread measures the round trip time.
 */
@ThreadSafe
class DefaultServerMonitor implements ServerMonitor {

    private static final Logger LOGGER = Loggers.getLogger("monitor");
    private static final double ROUND_TRIP_TIME_ALPHA = 0.2;

    private final ServerId serverId;
    private final ServerMonitorListener serverMonitorListener;
    private final SdamServerDescriptionManager sdamProvider;
    private final InternalConnectionFactory internalConnectionFactory;
    private final ServerSettings serverSettings;
    private final ServerMonitorRunnable monitor;
    private final Thread monitorThread;
    private final RoundTripTimeMonitor roundTripTimeMonitor;
    private final ExponentiallyWeightedMovingAverage averageRoundTripTime =
            new ExponentiallyWeightedMovingAverage(ROUND_TRIP_TIME_ALPHA);
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition condition = lock.newCondition();
    // guarded by lock
    private boolean checkRequested;
    private volatile boolean isClosed;

    DefaultServerMonitor(final ServerId serverId, final ServerSettings serverSettings,
                         final InternalConnectionFactory internalConnectionFactory,
                         final SdamServerDescriptionManager sdamProvider) {
        this.serverSettings = notNull("serverSettings", serverSettings);
        this.serverId = notNull("serverId", serverId);
        this.serverMonitorListener = serverMonitorListener(serverSettings.getServerMonitorListeners(),
                serverSettings.getMaxDocumentLength());
        this.internalConnectionFactory = notNull("internalConnectionFactory", internalConnectionFactory);
        this.sdamProvider = notNull("sdamProvider", sdamProvider);
        monitor = new ServerMonitorRunnable();
        monitorThread = new Thread(monitor, "cluster-" + serverId.getClusterId() + "-" + serverId.getAddress());
        monitorThread.setDaemon(true);
        roundTripTimeMonitor = new RoundTripTimeMonitor();
    }

    @Override
    public void start() {
        monitorThread.start();
    }

    @Override
    public void connect() {
        lock.lock();
        try {
            checkRequested = true;
            condition.signal();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void cancelCurrentCheck() {
        monitor.cancelCurrentCheck();
    }

    @Override
    public void close() {
        isClosed = true;
        monitor.close();
        monitorThread.interrupt();
        roundTripTimeMonitor.close();
    }

    boolean isClosed() {
        return isClosed;
    }

    Thread getMonitorThread() {
        return monitorThread;
    }

    class ServerMonitorRunnable implements Runnable {
        private volatile InternalConnection connection = null;
        private volatile boolean currentCheckCancelled;

        void close() {
            InternalConnection localConnection = connection;
            if (localConnection != null) {
                localConnection.close();
            }
        }

        @Override
        public void run() {
            ServerDescription currentServerDescription = unknownConnectingServerDescription(serverId.getAddress(), null);
            try {
                while (!isClosed) {
                    ServerDescription previousServerDescription = currentServerDescription;
                    currentServerDescription = lookupServerDescription(currentServerDescription);

                    if (isClosed) {
                        continue;
                    }

                    if (currentCheckCancelled) {
                        waitForNext();
                        currentCheckCancelled = false;
                        continue;
                    }

                    logStateChange(previousServerDescription, currentServerDescription);
                    sdamProvider.monitorUpdate(currentServerDescription);

                    if (shouldStreamResponses(currentServerDescription)
                            || (currentServerDescription.getException() instanceof MongoSocketException
                                && previousServerDescription.getType() != ServerType.UNKNOWN)) {
                        continue;
                    }
                    waitForNext();
                }
            } catch (MongoInterruptedException e) {
                LOGGER.debug(format("Server monitor for %s interrupted while closing", serverId.getAddress()));
            } catch (RuntimeException e) {
                LOGGER.error(format("Server monitor for %s stopped working. You may want to recreate the client", serverId), e);
            } finally {
                if (connection != null) {
                    connection.close();
                }
            }
        }

        private ServerDescription lookupServerDescription(final ServerDescription currentServerDescription) {
            clearCheckRequest();
            ConnectionId connectionId = null;
            boolean shouldStream = false;
            long start = System.nanoTime();
            try {
                if (connection == null || connection.isClosed()) {
                    currentCheckCancelled = false;
                    InternalConnection newConnection = internalConnectionFactory.create(serverId);
                    connectionId = newConnection.getDescription().getConnectionId();
                    serverMonitorListener.serverHeartbeatStarted(new ServerHeartbeatStartedEvent(connectionId, false));
                    newConnection.open();
                    connection = newConnection;
                    connectionId = connection.getDescription().getConnectionId();
                    averageRoundTripTime.addSample(connection.getInitialServerDescription().getRoundTripTimeNanos());
                    serverMonitorListener.serverHeartbeatSucceeded(new ServerHeartbeatSucceededEvent(connectionId, new BsonDocument(),
                            System.nanoTime() - start, false));
                    return ServerDescription.builder(connection.getInitialServerDescription())
                            .roundTripTime(averageRoundTripTime.getAverage(), NANOSECONDS)
                            .build();
                }

                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug(format("Checking status of %s", serverId.getAddress()));
                }
                connectionId = connection.getDescription().getConnectionId();
                shouldStream = shouldStreamResponses(currentServerDescription);
                serverMonitorListener.serverHeartbeatStarted(new ServerHeartbeatStartedEvent(connectionId, shouldStream));

                BsonDocument helloResult;
                if (shouldStream) {
                    roundTripTimeMonitor.start();
                    helloResult = connection.sendAndReceive(
                            new CommandMessage("admin", createHelloCommand(currentServerDescription, true)),
                            (int) serverSettings.getHeartbeatFrequency(MILLISECONDS));
                } else {
                    helloResult = connection.sendAndReceive(new CommandMessage("admin", createHelloCommand(currentServerDescription,
                            false)));
                }

                long elapsedTimeNanos = System.nanoTime() - start;
                if (!shouldStream) {
                    averageRoundTripTime.addSample(elapsedTimeNanos);
                }
                serverMonitorListener.serverHeartbeatSucceeded(new ServerHeartbeatSucceededEvent(connectionId, helloResult,
                        elapsedTimeNanos, shouldStream));

                return createServerDescription(serverId.getAddress(), helloResult, averageRoundTripTime.getAverage());
            } catch (Exception t) {
                averageRoundTripTime.reset();
                InternalConnection localConnection = connection;
                connection = null;
                if (localConnection != null) {
                    localConnection.close();
                }
                if (connectionId != null) {
                    serverMonitorListener.serverHeartbeatFailed(new ServerHeartbeatFailedEvent(connectionId, System.nanoTime() - start,
                            shouldStream, t));
                }
                return unknownConnectingServerDescription(serverId.getAddress(), t);
            }
        }

        private void waitForNext() {
            long timeRemaining = waitForSignalOrTimeout();
            long timeWaiting = serverSettings.getHeartbeatFrequency(NANOSECONDS) - timeRemaining;
            long minimumNanosToWait = serverSettings.getMinHeartbeatFrequency(NANOSECONDS);
            if (timeWaiting < minimumNanosToWait) {
                long millisToSleep = MILLISECONDS.convert(minimumNanosToWait - timeWaiting, NANOSECONDS);
                if (millisToSleep > 0) {
                    try {
                        Thread.sleep(millisToSleep);
                    } catch (InterruptedException e) {
                        throw new MongoInterruptedException("Interrupted while waiting for the minimum heartbeat frequency", e);
                    }
                }
            }
        }

        /**
         * Waits for the heartbeat interval or a check request, whichever comes first.  A request that arrived while the previous check
         * was running is honored without waiting.
         *
         * @return the nanoseconds of the heartbeat interval that were not spent waiting
         */
        private long waitForSignalOrTimeout() {
            lock.lock();
            try {
                if (checkRequested) {
                    return serverSettings.getHeartbeatFrequency(NANOSECONDS);
                }
                return condition.awaitNanos(serverSettings.getHeartbeatFrequency(NANOSECONDS));
            } catch (InterruptedException e) {
                throw new MongoInterruptedException("Interrupted while waiting for the next heartbeat", e);
            } finally {
                lock.unlock();
            }
        }

        private void clearCheckRequest() {
            lock.lock();
            try {
                checkRequested = false;
            } finally {
                lock.unlock();
            }
        }

        void cancelCurrentCheck() {
            InternalConnection localConnection = connection;
            if (localConnection != null && !currentCheckCancelled) {
                currentCheckCancelled = true;
                localConnection.close();
            }
        }
    }

    boolean shouldStreamResponses(final ServerDescription currentServerDescription) {
        ServerMonitoringMode mode = serverSettings.getServerMonitoringMode();
        return mode != ServerMonitoringMode.POLL && currentServerDescription.getTopologyVersion() != null;
    }

    BsonDocument createHelloCommand(final ServerDescription currentServerDescription, final boolean awaitable) {
        BsonDocument helloCommand = new BsonDocument("hello", new BsonInt32(1)).append("helloOk", BsonBoolean.TRUE);
        TopologyVersion topologyVersion = currentServerDescription.getTopologyVersion();
        if (awaitable && topologyVersion != null) {
            helloCommand.append("topologyVersion", topologyVersion.asDocument());
            helloCommand.append("maxAwaitTimeMS", new BsonInt64(serverSettings.getHeartbeatFrequency(MILLISECONDS)));
        }
        return helloCommand;
    }

    private void logStateChange(final ServerDescription previousServerDescription, final ServerDescription currentServerDescription) {
        if (shouldLogStageChange(previousServerDescription, currentServerDescription)) {
            if (currentServerDescription.getException() != null) {
                LOGGER.info(format("Exception in monitor thread while connecting to server %s", serverId.getAddress()),
                        currentServerDescription.getException());
            } else {
                LOGGER.info(format("Monitor thread successfully connected to server with description %s", currentServerDescription));
            }
        }
    }

    static boolean shouldLogStageChange(final ServerDescription previous, final ServerDescription current) {
        if (previous.isOk() != current.isOk()) {
            return true;
        }
        if (!previous.getAddress().equals(current.getAddress())) {
            return true;
        }
        if (previous.getType() != current.getType()) {
            return true;
        }
        if (previous.getState() != current.getState()) {
            return true;
        }
        Throwable previousException = previous.getException();
        Throwable currentException = current.getException();
        Class<?> thisExceptionClass = previousException != null ? previousException.getClass() : null;
        Class<?> thatExceptionClass = currentException != null ? currentException.getClass() : null;
        if (thisExceptionClass != null ? !thisExceptionClass.equals(thatExceptionClass) : thatExceptionClass != null) {
            return true;
        }
        String thisExceptionMessage = previousException != null ? previousException.getMessage() : null;
        String thatExceptionMessage = currentException != null ? currentException.getMessage() : null;
        return thisExceptionMessage != null ? !thisExceptionMessage.equals(thatExceptionMessage) : thatExceptionMessage != null;
    }

    /**
     * Measures the round trip time on its own connection while the main monitor thread is blocked on an awaitable {@code hello}.
     */
    private class RoundTripTimeMonitor implements Runnable {
        private volatile InternalConnection connection = null;
        private volatile Thread roundTripTimeThread;

        synchronized void start() {
            if (roundTripTimeThread == null && !isClosed) {
                roundTripTimeThread = new Thread(this, "cluster-rtt-" + serverId.getClusterId() + "-" + serverId.getAddress());
                roundTripTimeThread.setDaemon(true);
                roundTripTimeThread.start();
            }
        }

        synchronized void close() {
            InternalConnection localConnection = connection;
            if (localConnection != null) {
                localConnection.close();
                connection = null;
            }
            if (roundTripTimeThread != null) {
                roundTripTimeThread.interrupt();
            }
        }

        @Override
        public void run() {
            try {
                while (!isClosed) {
                    try {
                        if (connection == null || connection.isClosed()) {
                            initialize();
                        } else {
                            pingServer(connection);
                        }
                    } catch (MongoInterruptedException e) {
                        throw e;
                    } catch (RuntimeException e) {
                        if (LOGGER.isDebugEnabled()) {
                            LOGGER.debug(format("Round trip time check of %s failed", serverId.getAddress()), e);
                        }
                        if (connection != null) {
                            connection.close();
                            connection = null;
                        }
                    }
                    waitForNext();
                }
            } catch (MongoInterruptedException e) {
                LOGGER.debug(format("Round trip time monitor for %s interrupted while closing", serverId.getAddress()));
            } finally {
                if (connection != null) {
                    connection.close();
                }
            }
        }

        private void initialize() {
            connection = null;
            InternalConnection newConnection = internalConnectionFactory.create(serverId);
            newConnection.open();
            connection = newConnection;
            averageRoundTripTime.addSample(newConnection.getInitialServerDescription().getRoundTripTimeNanos());
        }

        private void pingServer(final InternalConnection connection) {
            long start = System.nanoTime();
            connection.sendAndReceive(new CommandMessage("admin", new BsonDocument("hello", new BsonInt32(1))));
            averageRoundTripTime.addSample(System.nanoTime() - start);
        }

        private void waitForNext() {
            try {
                Thread.sleep(serverSettings.getHeartbeatFrequency(MILLISECONDS));
            } catch (InterruptedException e) {
                throw new MongoInterruptedException("Interrupted while waiting for the next round trip time check", e);
            }
        }
    }
}
