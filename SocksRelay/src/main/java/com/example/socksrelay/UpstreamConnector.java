package com.example.socksrelay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.UnknownHostException;

/**
 * Opens the outbound connection for a CONNECT request.
 */
public class UpstreamConnector {
    private static final Logger logger = LoggerFactory.getLogger(UpstreamConnector.class);

    private final int connectTimeout;
    private final ACLManager aclManager;
    private final Shutdown shutdown;
    private final Resolver resolver;

    public UpstreamConnector(int connectTimeout, ACLManager aclManager, Shutdown shutdown) {
        this(connectTimeout, aclManager, shutdown, InetAddress::getAllByName);
    }

    UpstreamConnector(int connectTimeout, ACLManager aclManager, Shutdown shutdown, Resolver resolver) {
        this.connectTimeout = connectTimeout;
        this.aclManager = aclManager;
        this.shutdown = shutdown;
        this.resolver = resolver;
    }

    /**
     * Connects to the request's destination. A domain is tried on each of its
     * addresses in resolver order until one accepts. The returned upstream stays
     * registered with the shutdown signal until the caller closes it.
     *
     * @throws UnsupportedCommandException for anything but CONNECT, before any I/O
     * @throws ConnectionNotAllowedException if the access list rejects the host
     * @throws IOException the error of the last address tried
     */
    public Upstream connect(Request req) throws IOException {
        switch (req.getCommand()) {
            case CONNECT:
                break;
            case BIND:
            case UDP_ASSOCIATE:
                throw new UnsupportedCommandException(req.getCommand());
        }
        Address address = req.getAddress();
        if (aclManager != null && !aclManager.permit(address)) {
            throw new ConnectionNotAllowedException(address.getHost());
        }

        InetAddress[] candidates;
        if (address.getType() == AddressType.DOMAIN) {
            candidates = resolver.resolve(address.getDomain());
        } else {
            candidates = new InetAddress[]{address.getIp()};
        }

        IOException last = null;
        for (InetAddress candidate : candidates) {
            try {
                return connect(new InetSocketAddress(candidate, req.getPort()));
            } catch (CancelledException e) {
                throw e;
            } catch (IOException e) {
                logger.debug("Connecting to {}:{} failed: {}", candidate.getHostAddress(), req.getPort(), e.getMessage());
                last = e;
            }
        }
        if (last == null) {
            throw new UnknownHostException(address.getHost());
        }
        throw last;
    }

    private Upstream connect(InetSocketAddress target) throws IOException {
        Socket remote = new Socket();
        // registered before connecting so a shutdown aborts a pending connect
        Shutdown.Registration registration = shutdown.register(remote);
        try {
            remote.connect(target, connectTimeout);
            logger.debug("Connected to {} from {}", remote.getRemoteSocketAddress(), remote.getLocalSocketAddress());
            return new Upstream(remote, registration);
        } catch (IOException | RuntimeException e) {
            registration.close();
            IoUtil.closeQuietly(remote);
            throw e;
        }
    }

    /**
     * Name lookup for domain requests.
     */
    interface Resolver {
        InetAddress[] resolve(String host) throws IOException;
    }

    /**
     * A connected upstream socket together with its shutdown registration.
     */
    public static final class Upstream implements AutoCloseable {
        private final Socket socket;
        private final Shutdown.Registration registration;

        Upstream(Socket socket, Shutdown.Registration registration) {
            this.socket = socket;
            this.registration = registration;
        }

        public Socket getSocket() {
            return socket;
        }

        public Address getBoundAddress() {
            return Address.ip(socket.getLocalAddress());
        }

        public int getBoundPort() {
            return socket.getLocalPort();
        }

        @Override
        public void close() {
            registration.close();
            IoUtil.closeQuietly(socket);
        }
    }
}
