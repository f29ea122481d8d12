package com.example.socksrelay;

import java.io.IOException;

/**
 * Malformed or unsupported bytes during the SOCKS5 handshake. The connection is
 * dropped without a reply.
 */
public class Socks5ProtocolException extends IOException {
    public Socks5ProtocolException(String message) {
        super(message);
    }

    public Socks5ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
