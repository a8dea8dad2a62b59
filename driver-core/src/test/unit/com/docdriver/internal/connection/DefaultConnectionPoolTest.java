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
import com.docdriver.MongoSocketOpenException;
import com.docdriver.ServerAddress;
import com.docdriver.connection.ClusterId;
import com.docdriver.connection.ConnectionPoolSettings;
import com.docdriver.connection.ServerId;
import com.docdriver.event.ConnectionCheckOutFailedEvent;
import com.docdriver.event.ConnectionCheckedInEvent;
import com.docdriver.event.ConnectionCheckedOutEvent;
import com.docdriver.event.ConnectionClosedEvent;
import com.docdriver.event.ConnectionCreatedEvent;
import com.docdriver.event.ConnectionPoolClearedEvent;
import com.docdriver.event.ConnectionPoolClosedEvent;
import com.docdriver.event.ConnectionPoolCreatedEvent;
import com.docdriver.event.ConnectionPoolReadyEvent;
import com.docdriver.event.ConnectionReadyEvent;
import com.docdriver.internal.event.CapturedLog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static java.util.concurrent.TimeUnit.HOURS;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DefaultConnectionPoolTest {
    private static final ServerId SERVER_ID = new ServerId(new ClusterId(), new ServerAddress("localhost", 27017));

    private TestInternalConnectionFactory connectionFactory;
    private TestConnectionPoolListener listener;
    private DefaultConnectionPool pool;

    @BeforeEach
    public void setUp() {
        connectionFactory = new TestInternalConnectionFactory();
        listener = new TestConnectionPoolListener();
    }

    @AfterEach
    public void tearDown() {
        if (pool != null) {
            pool.close();
        }
    }

    private DefaultConnectionPool createPool(final ConnectionPoolSettings.Builder builder) {
        pool = new DefaultConnectionPool(SERVER_ID, connectionFactory,
                builder.maintenanceInitialDelay(1, HOURS).addConnectionPoolListener(listener).build());
        return pool;
    }

    private DefaultConnectionPool createReadyPool(final ConnectionPoolSettings.Builder builder) {
        createPool(builder).ready();
        return pool;
    }

    @Test
    public void shouldStartPausedAndRejectCheckOut() {
        createPool(ConnectionPoolSettings.builder());

        assertAll(
                () -> assertEquals(DefaultConnectionPool.State.PAUSED, pool.getState()),
                () -> assertThrows(MongoConnectionPoolClearedException.class, () -> pool.get(new OperationContext())),
                () -> assertEquals(ConnectionCheckOutFailedEvent.Reason.CONNECTION_ERROR,
                        listener.getEvents(ConnectionCheckOutFailedEvent.class).get(0).getReason()),
                () -> assertEquals(1, listener.countEvents(ConnectionPoolCreatedEvent.class)),
                () -> assertEquals(0, connectionFactory.getNumCreatedConnections())
        );
    }

    @Test
    public void shouldLogPoolEventsWithoutARegisteredListener() {
        try (CapturedLog log = CapturedLog.capture("com.docdriver.connection")) {
            pool = new DefaultConnectionPool(SERVER_ID, connectionFactory,
                    ConnectionPoolSettings.builder().maxSize(5).maintenanceInitialDelay(1, HOURS).build());
            pool.ready();
            pool.get(new OperationContext()).close();

            assertAll(
                    () -> assertEquals(Collections.singletonList("Connection pool created: serverHost=localhost, serverPort=27017, "
                            + "maxIdleTimeMS=0, minPoolSize=0, maxPoolSize=5"), log.getMessagesStartingWith("Connection pool created:")),
                    () -> assertEquals(1, log.getMessagesStartingWith("Connection pool ready:").size()),
                    () -> assertEquals(1, log.getMessagesStartingWith("Connection created:").size()),
                    () -> assertEquals(1, log.getMessagesStartingWith("Connection checked out:").size()),
                    () -> assertEquals(1, log.getMessagesStartingWith("Connection checked in:").size())
            );
        }
    }

    @Test
    public void shouldOpenConnectionOnCheckOutAndReuseItAfterCheckIn() {
        createReadyPool(ConnectionPoolSettings.builder());

        InternalConnection first = pool.get(new OperationContext());
        first.close();
        InternalConnection second = pool.get(new OperationContext());

        assertAll(
                () -> assertEquals(1, connectionFactory.getNumCreatedConnections()),
                () -> assertEquals(first.getDescription().getConnectionId(), second.getDescription().getConnectionId()),
                () -> assertTrue(second.opened()),
                () -> assertEquals(1, listener.countEvents(ConnectionPoolReadyEvent.class)),
                () -> assertEquals(1, listener.countEvents(ConnectionCreatedEvent.class)),
                () -> assertEquals(1, listener.countEvents(ConnectionReadyEvent.class)),
                () -> assertEquals(2, listener.countEvents(ConnectionCheckedOutEvent.class)),
                () -> assertEquals(1, listener.countEvents(ConnectionCheckedInEvent.class)),
                () -> assertEquals(1, pool.getInUseCount()),
                () -> assertEquals(1, pool.getTotalCount())
        );
    }

    @Test
    public void shouldHandOutTheMostRecentlyReturnedConnectionFirst() {
        createReadyPool(ConnectionPoolSettings.builder());

        InternalConnection first = pool.get(new OperationContext());
        InternalConnection second = pool.get(new OperationContext());
        first.close();
        second.close();

        InternalConnection next = pool.get(new OperationContext());
        assertEquals(second.getDescription().getConnectionId(), next.getDescription().getConnectionId());
    }

    @Test
    public void shouldNeverLendOneConnectionToTwoCallersAtOnce() throws Exception {
        createReadyPool(ConnectionPoolSettings.builder().maxSize(1).maxWaitTime(10, SECONDS));
        int numThreads = 8;
        int iterations = 50;
        AtomicInteger concurrentHolders = new AtomicInteger();
        AtomicInteger maxConcurrentHolders = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        try {
            List<Future<?>> futures = new ArrayList<Future<?>>();
            for (int i = 0; i < numThreads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int j = 0; j < iterations; j++) {
                        InternalConnection connection = pool.get(new OperationContext());
                        int holders = concurrentHolders.incrementAndGet();
                        maxConcurrentHolders.accumulateAndGet(holders, Math::max);
                        Thread.yield();
                        concurrentHolders.decrementAndGet();
                        connection.close();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertAll(
                () -> assertEquals(1, maxConcurrentHolders.get()),
                () -> assertEquals(1, connectionFactory.getNumCreatedConnections()),
                () -> assertEquals(numThreads * iterations, listener.countEvents(ConnectionCheckedOutEvent.class)),
                () -> assertEquals(0, pool.getInUseCount())
        );
    }

    @Test
    public void shouldTimeOutWhenThePoolIsExhausted() {
        createReadyPool(ConnectionPoolSettings.builder().maxSize(1).maxWaitTime(50, MILLISECONDS));
        pool.get(new OperationContext());

        long startNanos = System.nanoTime();
        assertThrows(MongoConnectionPoolTimeoutException.class, () -> pool.get(new OperationContext()));
        long elapsedMillis = MILLISECONDS.convert(System.nanoTime() - startNanos, java.util.concurrent.TimeUnit.NANOSECONDS);

        assertAll(
                () -> assertTrue(elapsedMillis >= 40, "waited " + elapsedMillis + " ms"),
                () -> assertEquals(ConnectionCheckOutFailedEvent.Reason.TIMEOUT,
                        listener.getEvents(ConnectionCheckOutFailedEvent.class).get(0).getReason())
        );
    }

    @Test
    public void shouldRespectTheOperationTimeoutWhenItIsShorterThanTheWaitQueueTimeout() {
        createReadyPool(ConnectionPoolSettings.builder().maxSize(1).maxWaitTime(1, HOURS));
        pool.get(new OperationContext());

        assertThrows(MongoConnectionPoolTimeoutException.class, () -> pool.get(new OperationContext(20L)));
    }

    @Test
    public void shouldWakeAWaiterWhenAConnectionIsCheckedIn() throws Exception {
        createReadyPool(ConnectionPoolSettings.builder().maxSize(1).maxWaitTime(10, SECONDS));
        InternalConnection held = pool.get(new OperationContext());

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<InternalConnection> waiter = executor.submit(() -> pool.get(new OperationContext()));
            Thread.sleep(50);
            assertFalse(waiter.isDone());
            held.close();
            InternalConnection received = waiter.get(5, SECONDS);
            assertEquals(held.getDescription().getConnectionId(), received.getDescription().getConnectionId());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void shouldDestroyConnectionsFromAnOlderGenerationOnCheckIn() {
        createReadyPool(ConnectionPoolSettings.builder());
        InternalConnection checkedOut = pool.get(new OperationContext());
        InternalConnection idle = pool.get(new OperationContext());
        idle.close();

        pool.invalidate(null);

        assertAll(
                () -> assertEquals(1, pool.getGeneration()),
                () -> assertEquals(DefaultConnectionPool.State.PAUSED, pool.getState()),
                () -> assertEquals(0, pool.getAvailableCount()),
                () -> assertTrue(connectionFactory.getCreatedConnections().get(1).isClosed()),
                () -> assertFalse(checkedOut.isClosed()),
                () -> assertEquals(1, listener.countEvents(ConnectionPoolClearedEvent.class))
        );

        pool.ready();
        checkedOut.close();

        List<ConnectionClosedEvent> closedEvents = listener.getEvents(ConnectionClosedEvent.class);
        assertAll(
                () -> assertEquals(2, closedEvents.size()),
                () -> assertEquals(ConnectionClosedEvent.Reason.STALE, closedEvents.get(1).getReason()),
                () -> assertEquals(0, pool.getAvailableCount()),
                () -> assertEquals(0, pool.getTotalCount())
        );

        InternalConnection fresh = pool.get(new OperationContext());
        assertEquals(1, fresh.getGeneration());
    }

    @Test
    public void shouldFailWaitersWhenThePoolIsCleared() throws Exception {
        createReadyPool(ConnectionPoolSettings.builder().maxSize(1).maxWaitTime(10, SECONDS));
        pool.get(new OperationContext());

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<InternalConnection> waiter = executor.submit(() -> pool.get(new OperationContext()));
            Thread.sleep(50);
            MongoSocketOpenException cause = new MongoSocketOpenException("unreachable", SERVER_ID.getAddress());
            pool.invalidate(cause);
            java.util.concurrent.ExecutionException e = assertThrows(java.util.concurrent.ExecutionException.class,
                    () -> waiter.get(5, SECONDS));
            assertTrue(e.getCause() instanceof MongoConnectionPoolClearedException);
            assertSame(cause, e.getCause().getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void shouldRejectASecondCheckInOfTheSameConnection() {
        createReadyPool(ConnectionPoolSettings.builder());
        InternalConnection connection = pool.get(new OperationContext());
        connection.close();

        assertThrows(IllegalStateException.class, connection::close);
        assertEquals(1, listener.countEvents(ConnectionCheckedInEvent.class));
    }

    @Test
    public void shouldReleaseTheReservationWhenOpeningFails() {
        createReadyPool(ConnectionPoolSettings.builder().maxSize(1));
        connectionFactory.failOpen(true);

        assertThrows(MongoSocketOpenException.class, () -> pool.get(new OperationContext()));

        assertAll(
                () -> assertEquals(0, pool.getTotalCount()),
                () -> assertEquals(0, pool.getInUseCount()),
                () -> assertEquals(ConnectionClosedEvent.Reason.ERROR,
                        listener.getEvents(ConnectionClosedEvent.class).get(0).getReason()),
                () -> assertEquals(ConnectionCheckOutFailedEvent.Reason.CONNECTION_ERROR,
                        listener.getEvents(ConnectionCheckOutFailedEvent.class).get(0).getReason())
        );

        connectionFactory.failOpen(false);
        pool.get(new OperationContext());
        assertEquals(2, connectionFactory.getNumCreatedConnections());
    }

    @Test
    public void shouldCloseCheckedInConnectionsAfterThePoolIsClosed() {
        createReadyPool(ConnectionPoolSettings.builder());
        InternalConnection connection = pool.get(new OperationContext());
        pool.close();

        assertThrows(IllegalStateException.class, () -> pool.get(new OperationContext()));
        connection.close();

        assertAll(
                () -> assertEquals(DefaultConnectionPool.State.CLOSED, pool.getState()),
                () -> assertEquals(ConnectionClosedEvent.Reason.POOL_CLOSED,
                        listener.getEvents(ConnectionClosedEvent.class).get(0).getReason()),
                () -> assertEquals(ConnectionCheckOutFailedEvent.Reason.POOL_CLOSED,
                        listener.getEvents(ConnectionCheckOutFailedEvent.class).get(0).getReason()),
                () -> assertEquals(1, listener.countEvents(ConnectionPoolClosedEvent.class))
        );
    }

    @Test
    public void shouldIgnoreInvalidateAfterClose() {
        createReadyPool(ConnectionPoolSettings.builder());
        pool.close();
        pool.invalidate(null);

        assertAll(
                () -> assertEquals(0, pool.getGeneration()),
                () -> assertEquals(0, listener.countEvents(ConnectionPoolClearedEvent.class))
        );
    }

    @Test
    public void shouldPopulateToMinSizeOnlyWhenReady() {
        createPool(ConnectionPoolSettings.builder().minSize(2));

        pool.doMaintenance();
        assertEquals(0, connectionFactory.getNumCreatedConnections());

        pool.ready();
        pool.doMaintenance();

        assertAll(
                () -> assertEquals(2, pool.getAvailableCount()),
                () -> assertEquals(2, pool.getTotalCount()),
                () -> assertTrue(connectionFactory.getCreatedConnections().get(0).opened())
        );
    }

    @Test
    public void shouldPruneIdleConnectionsDuringMaintenance() throws InterruptedException {
        createReadyPool(ConnectionPoolSettings.builder().maxConnectionIdleTime(5, MILLISECONDS));
        pool.get(new OperationContext()).close();
        Thread.sleep(30);

        pool.doMaintenance();

        assertAll(
                () -> assertEquals(0, pool.getAvailableCount()),
                () -> assertEquals(ConnectionClosedEvent.Reason.IDLE,
                        listener.getEvents(ConnectionClosedEvent.class).get(0).getReason())
        );
    }

    @Test
    public void shouldNotReuseAConnectionThatHasExceededItsLifeTime() throws InterruptedException {
        createReadyPool(ConnectionPoolSettings.builder().maxConnectionLifeTime(5, MILLISECONDS));
        InternalConnection first = pool.get(new OperationContext());
        Thread.sleep(30);
        first.close();

        InternalConnection second = pool.get(new OperationContext());

        assertAll(
                () -> assertNotEquals(first.getDescription().getConnectionId(), second.getDescription().getConnectionId()),
                () -> assertEquals(ConnectionClosedEvent.Reason.EXPIRED,
                        listener.getEvents(ConnectionClosedEvent.class).get(0).getReason())
        );
    }
}
