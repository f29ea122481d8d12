package com.example.socksrelay;

import java.io.IOException;

public class UnsupportedCommandException extends IOException {
    private final Command command;

    public UnsupportedCommandException(Command command) {
        super(command + " not supported");
        this.command = command;
    }

    public Command getCommand() {
        return command;
    }
}
