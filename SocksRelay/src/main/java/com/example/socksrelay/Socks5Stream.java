package com.example.socksrelay;

import java.io.Closeable;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * A duplex byte stream the handshake and relay run over. Implemented by
 * {@link SocketStream} for real connections and by in-memory streams in tests.
 */
public interface Socks5Stream extends Closeable {
    InputStream getInputStream();

    /**
     * Writes may be buffered, callers flush.
     */
    OutputStream getOutputStream();
}
