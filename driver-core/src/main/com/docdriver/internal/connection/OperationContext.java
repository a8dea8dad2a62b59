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

import com.docdriver.internal.time.Timeout;
import com.docdriver.lang.Nullable;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * <p>This class is not part of the public API and may be removed or changed at any time</p>
 */
public class OperationContext {
    private static final AtomicLong NEXT_ID = new AtomicLong(0);
    private final long id;
    private final Timeout operationTimeout;

    public OperationContext() {
        this(null);
    }

    /**
     * @param timeoutMS the overall timeout of the operation, or null if the operation has no overall timeout
     */
    public OperationContext(@Nullable final Long timeoutMS) {
        this.id = NEXT_ID.incrementAndGet();
        this.operationTimeout = timeoutMS == null ? Timeout.infinite() : Timeout.startNow(timeoutMS, TimeUnit.MILLISECONDS);
    }

    public long getId() {
        return id;
    }

    /**
     * Gets the overall timeout of the operation, which caps every blocking step it performs.
     *
     * @return the operation timeout, which is infinite if none was given
     */
    public Timeout getOperationTimeout() {
        return operationTimeout;
    }
}
