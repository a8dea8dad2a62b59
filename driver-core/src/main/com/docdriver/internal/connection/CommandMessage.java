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

import org.bson.BsonBinaryWriter;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.bson.ByteBuf;
import org.bson.codecs.BsonDocumentCodec;
import org.bson.codecs.EncoderContext;
import org.bson.io.BasicOutputBuffer;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static com.docdriver.assertions.Assertions.notNull;

/**
 * A command sent to a server as an {@code OP_MSG} with a single body section.
 *
 * <p>This class is not part of the public API and may be removed or changed at any time</p>
 */
public final class CommandMessage {
    /**
     * The opcode of an {@code OP_MSG} message.
     */
    public static final int OP_MSG = 2013;
    static final int MESSAGE_HEADER_LENGTH = 16;
    private static final byte PAYLOAD_TYPE_0 = 0;
    private static final AtomicInteger REQUEST_ID = new AtomicInteger(1);

    private final String database;
    private final BsonDocument command;
    private final int requestId;

    /**
     * Construct a message for the given command, to be run against the given database.
     *
     * @param database the database name
     * @param command  the command document
     */
    public CommandMessage(final String database, final BsonDocument command) {
        this.database = notNull("database", database);
        this.command = notNull("command", command);
        this.requestId = REQUEST_ID.getAndIncrement();
    }

    public String getDatabase() {
        return database;
    }

    public BsonDocument getCommand() {
        return command;
    }

    public int getRequestId() {
        return requestId;
    }

    /**
     * Encode the message into the given buffer.
     *
     * @param outputBuffer the buffer to write to
     * @return the encoded buffers, ready to be written to a stream
     */
    public List<ByteBuf> encode(final BasicOutputBuffer outputBuffer) {
        int messageStartPosition = outputBuffer.getPosition();
        outputBuffer.writeInt32(0); // length, backpatched below
        outputBuffer.writeInt32(requestId);
        outputBuffer.writeInt32(0);
        outputBuffer.writeInt32(OP_MSG);
        outputBuffer.writeInt32(0); // flag bits
        outputBuffer.writeByte(PAYLOAD_TYPE_0);

        BsonDocument commandToEncode = new BsonDocument();
        commandToEncode.putAll(command);
        commandToEncode.put("$db", new BsonString(database));
        new BsonDocumentCodec().encode(new BsonBinaryWriter(outputBuffer), commandToEncode, EncoderContext.builder().build());

        outputBuffer.writeInt32(messageStartPosition, outputBuffer.getPosition() - messageStartPosition);
        return outputBuffer.getByteBuffers();
    }

    @Override
    public String toString() {
        return "CommandMessage{"
                + "database='" + database + '\''
                + ", command=" + command.getFirstKey()
                + ", requestId=" + requestId
                + '}';
    }
}
