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

import com.docdriver.MongoServerSelectionTimeoutException;
import com.docdriver.ServerAddress;
import com.docdriver.connection.ClusterConnectionMode;
import com.docdriver.connection.ClusterDescription;
import com.docdriver.connection.ClusterType;
import com.docdriver.connection.ServerDescription;
import com.docdriver.connection.ServerType;
import com.docdriver.internal.connection.Cluster;
import com.docdriver.internal.connection.Connection;
import com.docdriver.internal.connection.OperationContext;
import com.docdriver.internal.connection.Server;
import com.docdriver.internal.connection.ServerTuple;
import com.docdriver.selector.WritableServerSelector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicReference;

import static com.docdriver.connection.ServerConnectionState.CONNECTED;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class ServerSelectionMonoTest {
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final Scheduler scheduler = Schedulers.newSingle("test-selection");
    private final OperationContext operationContext = new OperationContext();
    private final ServerDescription serverDescription = ServerDescription.builder()
            .address(new ServerAddress())
            .state(CONNECTED)
            .ok(true)
            .type(ServerType.STANDALONE)
            .build();

    @Mock
    private Cluster cluster;
    @Mock
    private Server server;
    @Mock
    private Connection connection;

    @AfterEach
    public void tearDown() {
        scheduler.dispose();
    }

    @Test
    public void shouldSelectOnTheSchedulerWhenSubscribed() {
        AtomicReference<String> selectingThread = new AtomicReference<String>();
        ServerTuple serverTuple = new ServerTuple(server, serverDescription);
        when(cluster.selectServer(any(WritableServerSelector.class), any(OperationContext.class))).thenAnswer(invocation -> {
            selectingThread.set(Thread.currentThread().getName());
            return serverTuple;
        });
        ServerSelectionMono serverSelectionMono = new ServerSelectionMono(cluster, scheduler);

        StepVerifier.create(serverSelectionMono.selectServer(new WritableServerSelector(), operationContext))
                .expectNext(serverTuple)
                .expectComplete()
                .verify(TIMEOUT);

        assertTrue(selectingThread.get().startsWith("test-selection"));
    }

    @Test
    public void shouldBeLazyAndSelectOncePerSubscription() {
        when(cluster.selectServer(any(WritableServerSelector.class), any(OperationContext.class)))
                .thenReturn(new ServerTuple(server, serverDescription));
        ServerSelectionMono serverSelectionMono = new ServerSelectionMono(cluster, scheduler);

        Mono<ServerTuple> mono = serverSelectionMono.selectServer(new WritableServerSelector(), operationContext);
        verify(cluster, never()).selectServer(any(), any());

        mono.block(TIMEOUT);
        mono.block(TIMEOUT);
        verify(cluster, times(2)).selectServer(any(), any());
    }

    @Test
    public void shouldSignalSelectionErrors() {
        when(cluster.selectServer(any(WritableServerSelector.class), any(OperationContext.class)))
                .thenThrow(new MongoServerSelectionTimeoutException("Timed out", new ClusterDescription(ClusterConnectionMode.MULTIPLE,
                        ClusterType.UNKNOWN, Collections.<ServerDescription>emptyList())));
        ServerSelectionMono serverSelectionMono = new ServerSelectionMono(cluster, scheduler);

        StepVerifier.create(serverSelectionMono.selectServer(new WritableServerSelector(), operationContext))
                .expectError(MongoServerSelectionTimeoutException.class)
                .verify(TIMEOUT);
    }

    @Test
    public void shouldCheckOutAConnectionFromTheSelectedServer() {
        when(cluster.selectServer(any(WritableServerSelector.class), any(OperationContext.class)))
                .thenReturn(new ServerTuple(server, serverDescription));
        when(server.getConnection(operationContext)).thenReturn(connection);
        ServerSelectionMono serverSelectionMono = new ServerSelectionMono(cluster, scheduler);

        StepVerifier.create(serverSelectionMono.getConnection(new WritableServerSelector(), operationContext))
                .expectNext(connection)
                .expectComplete()
                .verify(TIMEOUT);
    }
}
