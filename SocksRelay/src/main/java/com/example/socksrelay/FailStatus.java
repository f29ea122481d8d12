package com.example.socksrelay;

import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;

/**
 * Failure codes of the SOCKS5 reply (RFC 1928, section 6).
 */
public enum FailStatus {
    GENERAL_FAILURE(0x01, "general SOCKS server failure"),
    NOT_ALLOWED(0x02, "connection not allowed by ruleset"),
    NETWORK_UNREACHABLE(0x03, "network unreachable"),
    HOST_UNREACHABLE(0x04, "host unreachable"),
    CONNECTION_REFUSED(0x05, "connection refused"),
    TTL_EXPIRED(0x06, "TTL expired"),
    COMMAND_NOT_SUPPORTED(0x07, "command not supported"),
    ADDRESS_TYPE_NOT_SUPPORTED(0x08, "address type not supported");

    private final int code;
    private final String description;

    FailStatus(int code, String description) {
        this.code = code;
        this.description = description;
    }

    public int code() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    public static FailStatus fromCode(int code) {
        for (FailStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        throw new IllegalArgumentException("Not a failure status: " + code);
    }

    /**
     * Classifies an error raised while connecting upstream.
     */
    public static FailStatus of(IOException e) {
        if (e instanceof ConnectionNotAllowedException) {
            return NOT_ALLOWED;
        }
        if (e instanceof UnsupportedCommandException) {
            return COMMAND_NOT_SUPPORTED;
        }
        String message = e.getMessage() != null ? e.getMessage().toLowerCase() : "";
        if (e instanceof ConnectException) {
            // ETIMEDOUT also surfaces as ConnectException
            return message.contains("timed out") ? HOST_UNREACHABLE : CONNECTION_REFUSED;
        }
        if (e instanceof NoRouteToHostException
                || e instanceof UnknownHostException
                || e instanceof SocketTimeoutException) {
            return HOST_UNREACHABLE;
        }
        if (e instanceof SocketException && message.contains("network is unreachable")) {
            return NETWORK_UNREACHABLE;
        }
        return GENERAL_FAILURE;
    }
}
