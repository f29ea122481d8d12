package com.example.socksrelay;

import org.junit.jupiter.api.Assumptions;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.List;

/**
 * Loopback listener that never accepts and whose accept queue is full, so any
 * further connect to it hangs until its timeout.
 */
class SaturatedListener implements AutoCloseable {
    private static final int MAX_FILLERS = 256;

    private final ServerSocket serverSocket;
    private final List<Socket> fillers = new ArrayList<>();

    private SaturatedListener() throws IOException {
        serverSocket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
    }

    static SaturatedListener open() throws IOException {
        SaturatedListener listener = new SaturatedListener();
        InetSocketAddress target = new InetSocketAddress(InetAddress.getLoopbackAddress(), listener.getPort());
        for (int i = 0; i < MAX_FILLERS; i++) {
            Socket s = new Socket();
            try {
                s.connect(target, 250);
                listener.fillers.add(s);
            } catch (SocketTimeoutException e) {
                s.close();
                return listener;
            } catch (IOException e) {
                s.close();
                break;
            }
        }
        listener.close();
        Assumptions.abort("accept queue could not be filled on this platform");
        return null;
    }

    int getPort() {
        return serverSocket.getLocalPort();
    }

    @Override
    public void close() throws IOException {
        for (Socket s : fillers) {
            s.close();
        }
        serverSocket.close();
    }
}
