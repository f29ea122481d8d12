package com.example.socksrelay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.Socket;
import java.net.SocketAddress;

/**
 * Serves one client connection: handshake, upstream connect, reply, relay.
 */
public class Socks5Handler implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(Socks5Handler.class);

    private final Socket client;
    private final UpstreamConnector connector;
    private final Relay relay;
    private final Shutdown shutdown;
    private final SocketAddress peer;

    public Socks5Handler(Socket client, UpstreamConnector connector, Relay relay, Shutdown shutdown) {
        this.client = client;
        this.connector = connector;
        this.relay = relay;
        this.shutdown = shutdown;
        this.peer = client.getRemoteSocketAddress();
    }

    @Override
    public void run() {
        try (Shutdown.Registration ignored = shutdown.register(client)) {
            handle();
        } catch (CancelledException e) {
            logger.debug("Dropping {}: shutdown in progress", peer);
        } catch (IOException e) {
            if (shutdown.isTriggered()) {
                logger.debug("Connection from {} cancelled: {}", peer, e.getMessage());
            } else {
                logger.warn("Error handling connection from {}: {}", peer, e.getMessage());
            }
        } catch (RuntimeException e) {
            logger.error("Unexpected error handling connection from {}", peer, e);
        } finally {
            IoUtil.closeQuietly(client);
            logger.debug("Disconnected: {}", peer);
        }
    }

    private void handle() throws IOException {
        SocketStream stream = new SocketStream(client);
        Acceptor acceptor;
        try {
            acceptor = Acceptor.accept(stream);
        } catch (IOException e) {
            throw new IOException("Accepting socks5 connection: " + e.getMessage(), e);
        }
        Request req = acceptor.getRequest();
        logger.info("Proxying {} for {}", req, peer);

        UpstreamConnector.Upstream upstream;
        try {
            upstream = connector.connect(req);
        } catch (IOException e) {
            FailStatus status = FailStatus.of(e);
            acceptor.replyFailure(status);
            throw new IOException("Connecting to " + req + " (replied " + status + "): " + e.getMessage(), e);
        } catch (RuntimeException e) {
            acceptor.replyFailure(FailStatus.GENERAL_FAILURE);
            throw e;
        }

        try (UpstreamConnector.Upstream up = upstream) {
            logger.info("Connected to {}", req);
            Socks5Stream clientStream;
            try {
                clientStream = acceptor.replySuccess(up.getBoundAddress(), up.getBoundPort());
            } catch (IOException e) {
                throw new IOException("Replying to socks5 conn: " + e.getMessage(), e);
            }

            Relay.Result result = relay.run(clientStream, new SocketStream(up.getSocket()));
            if (result.getError() != null) {
                throw new IOException("Copying data for " + req + ", " + result, result.getError());
            }
            logger.debug("Disconnecting from {}, uploaded {} bytes, downloaded {} bytes",
                    req, result.getUploaded(), result.getDownloaded());
        }
    }
}
