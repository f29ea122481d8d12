package com.example.socksrelay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Server side of the SOCKS5 handshake for one connection.
 * <p>
 * {@link #accept(Socks5Stream)} negotiates the auth method and parses the request.
 * The returned acceptor must then be answered exactly once, with
 * {@link #replySuccess(Address, int)} before relaying or with
 * {@link #replyFailure(FailStatus)} before dropping the connection.
 */
public final class Acceptor {
    private static final Logger logger = LoggerFactory.getLogger(Acceptor.class);

    static final int VERSION = 0x05;
    static final int METHOD_NO_AUTH = 0x00;
    static final int REPLY_SUCCEEDED = 0x00;
    static final int RSV = 0x00;

    private final Socks5Stream stream;
    private final Request request;
    private final boolean ipv6;
    private boolean replied;

    private Acceptor(Socks5Stream stream, Request request) {
        this.stream = stream;
        this.request = request;
        this.ipv6 = request.getAddress().isIpv6();
    }

    public static Acceptor accept(Socks5Stream stream) throws IOException {
        InputStream in = stream.getInputStream();
        OutputStream out = stream.getOutputStream();

        int ver = IoUtil.readUnsignedByte(in, "SOCKS version");
        if (ver != VERSION) {
            throw new Socks5ProtocolException("Invalid SOCKS version: " + ver);
        }
        int nMethods = IoUtil.readUnsignedByte(in, "auth method count");
        byte[] methods = IoUtil.readFully(in, nMethods, "auth methods");
        if (!contains(methods, METHOD_NO_AUTH)) {
            throw new Socks5ProtocolException("Only no-auth is supported");
        }
        out.write(new byte[]{VERSION, METHOD_NO_AUTH});
        out.flush();

        ver = IoUtil.readUnsignedByte(in, "request SOCKS version");
        if (ver != VERSION) {
            throw new Socks5ProtocolException("Invalid request SOCKS version: " + ver);
        }
        int cmd = IoUtil.readUnsignedByte(in, "command");
        IoUtil.readUnsignedByte(in, "reserved byte");
        Address address = Address.parse(in);
        int port = IoUtil.readUnsignedShort(in, "port");

        Command command = Command.fromCode(cmd);
        if (command == null) {
            throw new Socks5ProtocolException("Unsupported command: " + cmd);
        }
        return new Acceptor(stream, new Request(command, address, port));
    }

    public Request getRequest() {
        return request;
    }

    /**
     * Sends the success reply and hands the stream back for relaying.
     */
    public Socks5Stream replySuccess(Address bound, int port) throws IOException {
        markReplied();
        writeReply(REPLY_SUCCEEDED, bound, port);
        return stream;
    }

    /**
     * Sends a failure reply. Write errors are dropped, the connection is going away anyway.
     */
    public void replyFailure(FailStatus status) {
        markReplied();
        try {
            writeReply(status.code(), Address.unspecified(ipv6), 0);
        } catch (IOException e) {
            logger.debug("Failed to send {} reply to {}: {}", status, stream, e.getMessage());
        }
    }

    private void markReplied() {
        if (replied) {
            throw new IllegalStateException("Already replied to " + request);
        }
        replied = true;
    }

    private void writeReply(int rep, Address bound, int port) throws IOException {
        ByteArrayOutputStream resp = new ByteArrayOutputStream(22);
        resp.write(VERSION);
        resp.write(rep);
        resp.write(RSV);
        bound.write(resp);
        IoUtil.writeShort(resp, port);

        OutputStream out = stream.getOutputStream();
        out.write(resp.toByteArray());
        out.flush();
    }

    private static boolean contains(byte[] methods, int method) {
        for (byte m : methods) {
            if ((m & 0xFF) == method) {
                return true;
            }
        }
        return false;
    }
}
