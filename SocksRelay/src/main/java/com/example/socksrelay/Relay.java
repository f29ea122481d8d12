package com.example.socksrelay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Full-duplex byte pump between two streams. The whole relay ends as soon as one
 * direction hits EOF or an error; both streams are closed at that point.
 */
public class Relay {
    private static final Logger logger = LoggerFactory.getLogger(Relay.class);
    private static final int BUFFER_SIZE = 8192;

    private final Executor executor;

    public Relay(Executor executor) {
        this.executor = executor;
    }

    /**
     * Runs the client to upstream direction on the calling thread and the other one
     * on the executor. Returns once both directions have stopped.
     */
    public Result run(Socks5Stream client, Socks5Stream upstream) {
        AtomicBoolean finished = new AtomicBoolean();
        AtomicLong uploaded = new AtomicLong();
        AtomicLong downloaded = new AtomicLong();
        AtomicReference<IOException> firstError = new AtomicReference<>();

        Runnable download = () -> pipe(upstream, client, downloaded, finished, firstError);
        CompletableFuture<Void> downloadDone;
        try {
            downloadDone = CompletableFuture.runAsync(download, executor);
        } catch (RuntimeException e) {
            // executor already shut down
            closeBoth(client, upstream);
            return new Result(0, 0, new IOException("Relay rejected: " + e.getMessage(), e));
        }
        pipe(client, upstream, uploaded, finished, firstError);

        try {
            downloadDone.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            logger.warn("Relay download task failed", e.getCause());
        }
        return new Result(uploaded.get(), downloaded.get(), firstError.get());
    }

    private void pipe(Socks5Stream from, Socks5Stream to, AtomicLong counter,
                      AtomicBoolean finished, AtomicReference<IOException> firstError) {
        InputStream in = from.getInputStream();
        OutputStream out = to.getOutputStream();
        byte[] buf = new byte[BUFFER_SIZE];
        IOException error = null;
        try {
            int len;
            while ((len = in.read(buf)) != -1) {
                out.write(buf, 0, len);
                out.flush();
                counter.addAndGet(len);
            }
        } catch (IOException e) {
            error = e;
        } finally {
            // the direction that stops first decides the outcome, the other one
            // only fails because its streams were closed under it
            if (finished.compareAndSet(false, true)) {
                firstError.set(error);
                closeBoth(from, to);
            }
        }
    }

    private static void closeBoth(Socks5Stream a, Socks5Stream b) {
        IoUtil.closeQuietly(a);
        IoUtil.closeQuietly(b);
    }

    public static final class Result {
        private final long uploaded;
        private final long downloaded;
        private final IOException error;

        public Result(long uploaded, long downloaded, IOException error) {
            this.uploaded = uploaded;
            this.downloaded = downloaded;
            this.error = error;
        }

        public long getUploaded() {
            return uploaded;
        }

        public long getDownloaded() {
            return downloaded;
        }

        /**
         * @return the error that ended the relay, or null on EOF
         */
        public IOException getError() {
            return error;
        }

        @Override
        public String toString() {
            return "uploaded " + uploaded + " bytes, downloaded " + downloaded + " bytes"
                    + (error != null ? ", error: " + error.getMessage() : "");
        }
    }
}
