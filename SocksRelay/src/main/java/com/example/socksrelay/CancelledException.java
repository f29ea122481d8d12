package com.example.socksrelay;

import java.io.IOException;

/**
 * Thrown when a resource is registered after the shutdown signal has fired.
 */
public class CancelledException extends IOException {
    public CancelledException() {
        super("Shutdown in progress");
    }
}
