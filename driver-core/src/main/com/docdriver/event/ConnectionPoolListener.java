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

package com.docdriver.event;

import java.util.EventListener;

/**
 * A listener for connection pool-related events.
 */
public interface ConnectionPoolListener extends EventListener {
    /**
     * Invoked when a connection pool is created.
     *
     * @param event the event
     */
    default void connectionPoolCreated(final ConnectionPoolCreatedEvent event) {
    }

    /**
     * Invoked when a connection pool is cleared and paused.
     *
     * @param event the event
     */
    default void connectionPoolCleared(final ConnectionPoolClearedEvent event) {
    }

    /**
     * Invoked when a connection pool is marked as ready.
     *
     * @param event the event
     */
    default void connectionPoolReady(final ConnectionPoolReadyEvent event) {
    }

    /**
     * Invoked when a connection pool is closed.
     *
     * @param event the event
     */
    default void connectionPoolClosed(final ConnectionPoolClosedEvent event) {
    }

    /**
     * Invoked when attempting to check out a connection from a pool.
     *
     * @param event the event
     */
    default void connectionCheckOutStarted(final ConnectionCheckOutStartedEvent event) {
    }

    /**
     * Invoked when a connection is checked out of a pool.
     *
     * @param event the event
     */
    default void connectionCheckedOut(final ConnectionCheckedOutEvent event) {
    }

    /**
     * Invoked when an attempt to check out a connection from a pool fails.
     *
     * @param event the event
     */
    default void connectionCheckOutFailed(final ConnectionCheckOutFailedEvent event) {
    }

    /**
     * Invoked when a connection is checked in to a pool.
     *
     * @param event the event
     */
    default void connectionCheckedIn(final ConnectionCheckedInEvent event) {
    }

    /**
     * Invoked when a connection is created.
     *
     * @param event the event
     */
    default void connectionCreated(final ConnectionCreatedEvent event) {
    }

    /**
     * Invoked when a connection is ready for use.
     *
     * @param event the event
     */
    default void connectionReady(final ConnectionReadyEvent event) {
    }

    /**
     * Invoked when a connection is removed from a pool.
     *
     * @param event the event
     */
    default void connectionClosed(final ConnectionClosedEvent event) {
    }
}
