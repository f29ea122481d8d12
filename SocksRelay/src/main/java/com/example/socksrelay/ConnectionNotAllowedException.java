package com.example.socksrelay;

import java.io.IOException;

public class ConnectionNotAllowedException extends IOException {
    public ConnectionNotAllowedException(String host) {
        super("Connection to " + host + " not allowed by ruleset");
    }
}
