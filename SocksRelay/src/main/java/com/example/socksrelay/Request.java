package com.example.socksrelay;

import java.util.Objects;

/**
 * A parsed SOCKS5 request: command, destination address and port.
 */
public final class Request {
    private final Command command;
    private final Address address;
    private final int port;

    public Request(Command command, Address address, int port) {
        if (port < 0 || port > 0xFFFF) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }
        this.command = Objects.requireNonNull(command, "command");
        this.address = Objects.requireNonNull(address, "address");
        this.port = port;
    }

    public static Request connect(Address address, int port) {
        return new Request(Command.CONNECT, address, port);
    }

    public Command getCommand() {
        return command;
    }

    public Address getAddress() {
        return address;
    }

    public int getPort() {
        return port;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Request)) return false;
        Request other = (Request) o;
        return command == other.command && port == other.port && address.equals(other.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(command, address, port);
    }

    @Override
    public String toString() {
        return command + " " + address + ":" + port;
    }
}
