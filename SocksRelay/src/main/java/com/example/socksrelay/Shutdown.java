package com.example.socksrelay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide cancellation signal.
 * <p>
 * Blocking socket calls are cancelled by closing the socket, so anything a
 * connection may block on is registered here and closed when the signal fires.
 * Registering after the signal has fired closes the resource right away.
 */
public final class Shutdown {
    private static final Logger logger = LoggerFactory.getLogger(Shutdown.class);

    private final Set<Closeable> resources = ConcurrentHashMap.newKeySet();
    private volatile boolean triggered;

    /**
     * Ties {@code resource} to this signal until the returned registration is closed.
     *
     * @throws CancelledException if the signal already fired; the resource is closed
     */
    public Registration register(Closeable resource) throws CancelledException {
        resources.add(resource);
        // trigger() may have drained the set before the add
        if (triggered) {
            resources.remove(resource);
            IoUtil.closeQuietly(resource);
            throw new CancelledException();
        }
        return () -> resources.remove(resource);
    }

    public boolean isTriggered() {
        return triggered;
    }

    /**
     * Fires the signal and closes every registered resource. Idempotent.
     */
    public void trigger() {
        if (triggered) {
            return;
        }
        triggered = true;
        logger.debug("Shutdown triggered, cancelling {} resources", resources.size());
        for (Closeable resource : resources) {
            resources.remove(resource);
            try {
                resource.close();
            } catch (IOException e) {
                logger.debug("Error closing {} on shutdown: {}", resource, e.getMessage());
            }
        }
    }

    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
