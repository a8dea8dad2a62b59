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

import com.docdriver.MongoCommandException;
import com.docdriver.MongoException;
import com.docdriver.MongoInternalException;
import com.docdriver.MongoInterruptedException;
import com.docdriver.MongoSocketClosedException;
import com.docdriver.MongoSocketReadException;
import com.docdriver.MongoSocketReadTimeoutException;
import com.docdriver.MongoSocketWriteException;
import com.docdriver.ServerAddress;
import com.docdriver.annotations.NotThreadSafe;
import com.docdriver.connection.ConnectionDescription;
import com.docdriver.connection.ServerDescription;
import com.docdriver.connection.ServerId;
import com.docdriver.diagnostics.logging.Logger;
import com.docdriver.diagnostics.logging.Loggers;
import org.bson.BsonBinaryReader;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.ByteBuf;
import org.bson.codecs.BsonDocumentCodec;
import org.bson.codecs.DecoderContext;
import org.bson.io.BasicOutputBuffer;
import org.bson.io.ByteBufferBsonInput;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.nio.channels.ClosedByInterruptException;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.docdriver.assertions.Assertions.isTrue;
import static com.docdriver.assertions.Assertions.notNull;
import static com.docdriver.connection.ServerConnectionState.CONNECTING;
import static com.docdriver.connection.ServerType.UNKNOWN;
import static com.docdriver.internal.connection.ReplyHeader.REPLY_HEADER_LENGTH;
import static java.lang.String.format;

/**
 * A connection that runs commands over a {@link Stream}, one at a time.
 *
 * <p>This class is not part of the public API and may be removed or changed at any time</p>
 */
@NotThreadSafe
public class InternalStreamConnection implements InternalConnection {
    private static final Logger LOGGER = Loggers.getLogger("connection");
    private static final byte PAYLOAD_TYPE_0 = 0;

    private final ServerId serverId;
    private final StreamFactory streamFactory;
    private final InternalConnectionInitializer connectionInitializer;
    private final int generation;

    private final AtomicBoolean isClosed = new AtomicBoolean();
    private final AtomicBoolean opened = new AtomicBoolean();

    private volatile ConnectionDescription description;
    private volatile ServerDescription initialServerDescription;
    private volatile Stream stream;

    public InternalStreamConnection(final ServerId serverId, final StreamFactory streamFactory,
                                    final InternalConnectionInitializer connectionInitializer, final int generation) {
        this.serverId = notNull("serverId", serverId);
        this.streamFactory = notNull("streamFactory", streamFactory);
        this.connectionInitializer = notNull("connectionInitializer", connectionInitializer);
        this.generation = generation;
        description = new ConnectionDescription(serverId);
        initialServerDescription = ServerDescription.builder()
                .address(serverId.getAddress())
                .type(UNKNOWN)
                .state(CONNECTING)
                .build();
    }

    @Override
    public ConnectionDescription getDescription() {
        return description;
    }

    @Override
    public ServerDescription getInitialServerDescription() {
        return initialServerDescription;
    }

    @Override
    public int getGeneration() {
        return generation;
    }

    @Override
    public void open() {
        isTrue("Open already called", stream == null);
        stream = streamFactory.create(serverId.getAddress());
        try {
            stream.open();
            InternalConnectionInitializationDescription initializationDescription = connectionInitializer.initialize(this);
            description = initializationDescription.getConnectionDescription();
            initialServerDescription = initializationDescription.getServerDescription();
            opened.set(true);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(format("Opened connection [%s] to %s", description.getConnectionId(), serverId.getAddress()));
            }
        } catch (Throwable t) {
            close();
            if (t instanceof MongoException) {
                throw (MongoException) t;
            } else {
                throw new MongoException(t.toString(), t);
            }
        }
    }

    @Override
    public void close() {
        if (!isClosed.getAndSet(true) && stream != null) {
            stream.close();
        }
    }

    @Override
    public boolean opened() {
        return opened.get();
    }

    @Override
    public boolean isClosed() {
        return isClosed.get();
    }

    @Override
    public BsonDocument sendAndReceive(final CommandMessage message, final int additionalTimeoutMillis) {
        notNull("open", stream);
        if (isClosed()) {
            throw new MongoSocketClosedException("Cannot write to a closed stream", getServerAddress());
        }
        try (BasicOutputBuffer outputBuffer = new BasicOutputBuffer()) {
            stream.write(message.encode(outputBuffer));
        } catch (Throwable t) {
            close();
            throw translateWriteException(t);
        }

        BsonDocument reply;
        try {
            reply = receiveReply(message, additionalTimeoutMillis);
        } catch (Throwable t) {
            close();
            throw translateReadException(t);
        }

        if (reply.getNumber("ok", new BsonInt32(0)).intValue() != 1) {
            throw new MongoCommandException(reply, getServerAddress());
        }
        return reply;
    }

    private BsonDocument receiveReply(final CommandMessage message, final int additionalTimeoutMillis) throws IOException {
        ReplyHeader replyHeader;
        ByteBuf headerByteBuffer = stream.read(REPLY_HEADER_LENGTH, additionalTimeoutMillis);
        try {
            replyHeader = new ReplyHeader(new ByteBufferBsonInput(headerByteBuffer), description.getMaxMessageSize());
        } finally {
            headerByteBuffer.release();
        }
        if (replyHeader.getResponseTo() != message.getRequestId()) {
            throw new MongoInternalException(format("The responseTo (%d) in the reply does not match the requestId (%d) in the request",
                    replyHeader.getResponseTo(), message.getRequestId()));
        }

        ByteBuf bodyByteBuffer = stream.read(replyHeader.getMessageLength() - REPLY_HEADER_LENGTH, additionalTimeoutMillis);
        try {
            ByteBufferBsonInput bodyInput = new ByteBufferBsonInput(bodyByteBuffer);
            bodyInput.readInt32(); // flag bits
            byte payloadType = bodyInput.readByte();
            if (payloadType != PAYLOAD_TYPE_0) {
                throw new MongoInternalException(format("Unexpected reply section kind %d", payloadType));
            }
            try (BsonBinaryReader reader = new BsonBinaryReader(bodyInput)) {
                return new BsonDocumentCodec().decode(reader, DecoderContext.builder().build());
            }
        } finally {
            bodyByteBuffer.release();
        }
    }

    private ServerAddress getServerAddress() {
        return serverId.getAddress();
    }

    private MongoException translateWriteException(final Throwable e) {
        if (e instanceof MongoException) {
            return (MongoException) e;
        } else if (e instanceof IOException) {
            return new MongoSocketWriteException("Exception sending message", getServerAddress(), e);
        } else {
            return new MongoInternalException("Unexpected exception", e);
        }
    }

    private MongoException translateReadException(final Throwable e) {
        if (e instanceof MongoException) {
            return (MongoException) e;
        } else if (e instanceof SocketTimeoutException) {
            return new MongoSocketReadTimeoutException("Timeout while receiving message", getServerAddress(), e);
        } else if (e instanceof InterruptedIOException) {
            return new MongoInterruptedException("Interrupted while receiving message", (InterruptedIOException) e);
        } else if (e instanceof ClosedByInterruptException) {
            return new MongoInterruptedException("Interrupted while receiving message", (ClosedByInterruptException) e);
        } else if (e instanceof IOException) {
            return new MongoSocketReadException("Exception receiving message", getServerAddress(), e);
        } else if (e instanceof RuntimeException) {
            return new MongoInternalException("Unexpected runtime exception", e);
        } else {
            return new MongoInternalException("Unexpected exception", e);
        }
    }
}
