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

package com.docdriver.connection;

import com.docdriver.annotations.Immutable;
import com.docdriver.lang.Nullable;
import org.bson.BsonDocument;
import org.bson.BsonInt64;
import org.bson.BsonNumber;
import org.bson.BsonObjectId;
import org.bson.types.ObjectId;

import java.util.Objects;

import static com.docdriver.assertions.Assertions.notNull;

/**
 * A server's topology version: a process id plus a counter that the server increments on every state change.  It orders the health
 * reports of one server.
 */
@Immutable
public final class TopologyVersion implements Comparable<TopologyVersion> {
    private static final BsonObjectId DEFAULT_OBJECT_ID = new BsonObjectId(new ObjectId("000000000000000000000000"));
    private final ObjectId processId;
    private final long counter;

    /**
     * Construct an instance
     *
     * @param topologyVersion the topology version document
     */
    public TopologyVersion(final BsonDocument topologyVersion) {
        this.processId = topologyVersion.getObjectId("processId", DEFAULT_OBJECT_ID).getValue();
        BsonNumber counter = topologyVersion.getNumber("counter", new BsonInt64(0));
        this.counter = counter.longValue();
    }

    /**
     * Construct an instance
     *
     * @param processId the process id
     * @param counter   the counter
     */
    public TopologyVersion(final ObjectId processId, final long counter) {
        this.processId = notNull("processId", processId);
        this.counter = counter;
    }

    /**
     * @return the process id
     */
    public ObjectId getProcessId() {
        return processId;
    }

    /**
     * @return the counter
     */
    public long getCounter() {
        return counter;
    }

    /**
     * @return this topology version as the document sent with a streaming hello command
     */
    public BsonDocument asDocument() {
        return new BsonDocument("processId", new BsonObjectId(processId))
                .append("counter", new BsonInt64(counter));
    }

    /**
     * Returns whether this version is strictly newer than the given one.  A {@code null} version, or one from a different process, is
     * always older.
     *
     * @param that the version to compare against, which may be null
     * @return true if this version is newer
     */
    public boolean isNewerThan(@Nullable final TopologyVersion that) {
        return compareTo(that) > 0;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final TopologyVersion that = (TopologyVersion) o;
        return processId.equals(that.processId) && counter == that.counter;
    }

    @Override
    public String toString() {
        return "TopologyVersion{"
                + "processId=" + processId
                + ", counter=" + counter
                + '}';
    }

    @Override
    public int hashCode() {
        return Objects.hash(processId, counter);
    }

    @Override
    public int compareTo(@Nullable final TopologyVersion that) {
        // Assume greater
        if (that == null) {
            return 1;
        }

        if (processId.equals(that.processId)) {
            return Long.compare(counter, that.counter);
        }

        // Assume greater
        return 1;
    }
}
