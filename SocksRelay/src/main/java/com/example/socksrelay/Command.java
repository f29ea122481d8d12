package com.example.socksrelay;

public enum Command {
    CONNECT(0x01),
    BIND(0x02),
    UDP_ASSOCIATE(0x03);

    private final int code;

    Command(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Command fromCode(int code) {
        for (Command cmd : values()) {
            if (cmd.code == code) {
                return cmd;
            }
        }
        return null;
    }
}
