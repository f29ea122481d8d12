package com.example.socksrelay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ServerSocketFactory;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Listens for SOCKS5 clients and runs one {@link Socks5Handler} per connection.
 * <p>
 * {@link #stop(long)} fires the shutdown signal, which closes the listening socket and
 * every socket owned by a live connection, then waits for the connection tasks to end.
 */
public class Socks5Server {
    private static final Logger logger = LoggerFactory.getLogger(Socks5Server.class);
    static final long ACCEPT_BACKOFF_MILLIS = 100;

    private final Config cfg;
    private final Shutdown shutdown = new Shutdown();
    private final ExecutorService executor;
    private final UpstreamConnector connector;
    private final Relay relay;
    private final ServerSocketFactory serverSocketFactory;
    private volatile ServerSocket serverSocket;
    private Thread acceptThread;

    public Socks5Server(Config cfg, ACLManager aclManager) {
        this(cfg, aclManager, ServerSocketFactory.getDefault());
    }

    Socks5Server(Config cfg, ACLManager aclManager, ServerSocketFactory serverSocketFactory) {
        this.cfg = cfg;
        this.serverSocketFactory = serverSocketFactory;
        this.executor = Executors.newCachedThreadPool(new ConnectionThreadFactory());
        this.connector = new UpstreamConnector(cfg.connectTimeout, aclManager, shutdown);
        this.relay = new Relay(executor);
    }

    /**
     * Binds the listening socket and starts accepting on a background thread.
     *
     * @throws IOException if the socket cannot be bound
     */
    public synchronized void start() throws IOException {
        if (serverSocket != null) {
            throw new IllegalStateException("Server already started");
        }
        ServerSocket ss = serverSocketFactory.createServerSocket();
        try {
            ss.bind(new InetSocketAddress(InetAddress.getByName(cfg.bindAddress), cfg.port));
        } catch (IOException e) {
            IoUtil.closeQuietly(ss);
            throw new IOException("Binding " + cfg.bindAddress + ":" + cfg.port + ": " + e.getMessage(), e);
        }
        serverSocket = ss;
        shutdown.register(ss);
        logger.info("Listening on {}", ss.getLocalSocketAddress());

        acceptThread = new Thread(this::acceptLoop, "socks5-accept-" + ss.getLocalPort());
        acceptThread.start();
    }

    private void acceptLoop() {
        ServerSocket ss = serverSocket;
        while (!shutdown.isTriggered()) {
            Socket client;
            try {
                client = ss.accept();
            } catch (IOException e) {
                // accept() fails once shutdown closes the socket
                if (shutdown.isTriggered() || ss.isClosed()) {
                    break;
                }
                // e.g. EMFILE, which keeps failing until some connection ends
                logger.error("Accepting connection failed, retrying in {} ms", ACCEPT_BACKOFF_MILLIS, e);
                try {
                    Thread.sleep(ACCEPT_BACKOFF_MILLIS);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }
            logger.debug("Accepted connection from {}", client.getRemoteSocketAddress());
            try {
                executor.execute(new Socks5Handler(client, connector, relay, shutdown));
            } catch (RejectedExecutionException e) {
                logger.debug("Rejected connection from {}: shutting down", client.getRemoteSocketAddress());
                IoUtil.closeQuietly(client);
            }
        }
        logger.info("Stopped accepting connections");
    }

    /**
     * Stops accepting, cancels live connections and waits for them to finish.
     *
     * @return true if every connection task ended within {@code timeoutMillis}
     */
    public boolean stop(long timeoutMillis) throws InterruptedException {
        logger.info("Shutting down...");
        shutdown.trigger();
        executor.shutdown();
        Thread t;
        synchronized (this) {
            t = acceptThread;
        }
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        if (t != null) {
            t.join(Math.max(1, timeoutMillis));
        }
        long remaining = Math.max(0, deadline - System.nanoTime());
        boolean done = executor.awaitTermination(remaining, TimeUnit.NANOSECONDS);
        if (done) {
            logger.info("Shutdown complete");
        } else {
            logger.warn("Connections still running after {} ms", timeoutMillis);
        }
        return done;
    }

    public boolean isRunning() {
        return serverSocket != null && !shutdown.isTriggered();
    }

    /**
     * @return the bound port, or -1 before {@link #start()}
     */
    public int getLocalPort() {
        ServerSocket ss = serverSocket;
        return ss != null ? ss.getLocalPort() : -1;
    }

    private static final class ConnectionThreadFactory implements ThreadFactory {
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            return new Thread(r, "socks5-conn-" + count.incrementAndGet());
        }
    }
}
