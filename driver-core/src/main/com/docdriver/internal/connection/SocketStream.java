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

import com.docdriver.MongoSocketOpenException;
import com.docdriver.MongoSocketReadException;
import com.docdriver.ServerAddress;
import com.docdriver.connection.SocketSettings;
import com.docdriver.diagnostics.logging.Logger;
import com.docdriver.diagnostics.logging.Loggers;
import org.bson.ByteBuf;
import org.bson.ByteBufNIO;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.util.List;

import static com.docdriver.assertions.Assertions.notNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * A blocking {@link Stream} over a {@link Socket}.
 *
 * <p>This class is not part of the public API and may be removed or changed at any time</p>
 */
public class SocketStream implements Stream {
    private static final Logger LOGGER = Loggers.getLogger("connection");
    private final ServerAddress address;
    private final SocketSettings settings;
    private volatile Socket socket;
    private volatile OutputStream outputStream;
    private volatile InputStream inputStream;
    private volatile boolean isClosed;

    public SocketStream(final ServerAddress address, final SocketSettings settings) {
        this.address = notNull("address", address);
        this.settings = notNull("settings", settings);
    }

    @Override
    public void open() throws IOException {
        try {
            socket = new Socket();
            socket.setTcpNoDelay(true);
            socket.setKeepAlive(true);
            socket.setSoTimeout(settings.getReadTimeout(MILLISECONDS));
            if (settings.getReceiveBufferSize() > 0) {
                socket.setReceiveBufferSize(settings.getReceiveBufferSize());
            }
            if (settings.getSendBufferSize() > 0) {
                socket.setSendBufferSize(settings.getSendBufferSize());
            }
            socket.connect(new InetSocketAddress(address.getHost(), address.getPort()), settings.getConnectTimeout(MILLISECONDS));
            outputStream = socket.getOutputStream();
            inputStream = socket.getInputStream();
        } catch (IOException e) {
            close();
            throw new MongoSocketOpenException("Exception opening socket", getAddress(), e);
        }
    }

    @Override
    public void write(final List<ByteBuf> buffers) throws IOException {
        for (final ByteBuf cur : buffers) {
            byte[] bytes = new byte[cur.remaining()];
            cur.get(bytes);
            outputStream.write(bytes);
        }
        outputStream.flush();
    }

    @Override
    public ByteBuf read(final int numBytes, final int additionalTimeoutMillis) throws IOException {
        int readTimeout = settings.getReadTimeout(MILLISECONDS);
        if (additionalTimeoutMillis > 0 && readTimeout > 0) {
            socket.setSoTimeout(readTimeout + additionalTimeoutMillis);
        }
        try {
            byte[] bytes = new byte[numBytes];
            int totalBytesRead = 0;
            while (totalBytesRead < numBytes) {
                int bytesRead = inputStream.read(bytes, totalBytesRead, numBytes - totalBytesRead);
                if (bytesRead == -1) {
                    close();
                    throw new MongoSocketReadException("Prematurely reached end of stream", getAddress());
                }
                totalBytesRead += bytesRead;
            }
            return new ByteBufNIO(ByteBuffer.wrap(bytes));
        } finally {
            if (additionalTimeoutMillis > 0 && readTimeout > 0 && !isClosed) {
                socket.setSoTimeout(readTimeout);
            }
        }
    }

    @Override
    public ServerAddress getAddress() {
        return address;
    }

    @Override
    public void close() {
        isClosed = true;
        try {
            if (socket != null) {
                socket.close();
            }
        } catch (IOException e) {
            LOGGER.debug(String.format("Exception closing socket to %s", address), e);
        }
    }

    @Override
    public boolean isClosed() {
        return isClosed;
    }
}
