package com.example.socksrelay;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class FailStatusTest {

    @Test
    public void wireValuesInOrder() {
        FailStatus[] all = FailStatus.values();
        assertEquals(8, all.length);
        for (int i = 0; i < all.length; i++) {
            assertEquals(i + 1, all[i].code());
            assertEquals(all[i], FailStatus.fromCode(i + 1));
        }
        assertEquals(1, FailStatus.GENERAL_FAILURE.code());
        assertEquals(5, FailStatus.CONNECTION_REFUSED.code());
        assertEquals(7, FailStatus.COMMAND_NOT_SUPPORTED.code());
        assertEquals(8, FailStatus.ADDRESS_TYPE_NOT_SUPPORTED.code());
    }

    @Test
    public void successIsNotAFailure() {
        assertThrows(IllegalArgumentException.class, () -> FailStatus.fromCode(0));
        assertThrows(IllegalArgumentException.class, () -> FailStatus.fromCode(9));
    }

    @Test
    public void connectErrorMapping() {
        assertEquals(FailStatus.CONNECTION_REFUSED, FailStatus.of(new ConnectException("Connection refused")));
        assertEquals(FailStatus.HOST_UNREACHABLE, FailStatus.of(new ConnectException("Connection timed out")));
        assertEquals(FailStatus.HOST_UNREACHABLE, FailStatus.of(new NoRouteToHostException("No route to host")));
        assertEquals(FailStatus.HOST_UNREACHABLE, FailStatus.of(new UnknownHostException("nowhere.invalid")));
        assertEquals(FailStatus.HOST_UNREACHABLE, FailStatus.of(new SocketTimeoutException("Connect timed out")));
        assertEquals(FailStatus.NETWORK_UNREACHABLE, FailStatus.of(new SocketException("Network is unreachable")));
        assertEquals(FailStatus.GENERAL_FAILURE, FailStatus.of(new SocketException("Socket closed")));
        assertEquals(FailStatus.GENERAL_FAILURE, FailStatus.of(new IOException()));
    }

    @Test
    public void rejectionMapping() {
        assertEquals(FailStatus.COMMAND_NOT_SUPPORTED, FailStatus.of(new UnsupportedCommandException(Command.BIND)));
        assertEquals(FailStatus.NOT_ALLOWED, FailStatus.of(new ConnectionNotAllowedException("example.com")));
    }
}
