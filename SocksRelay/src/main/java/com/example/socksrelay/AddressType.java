package com.example.socksrelay;

// ATYP byte of requests and replies
public enum AddressType {
    IPV4(0x01),
    DOMAIN(0x03),
    IPV6(0x04);

    private final int code;

    AddressType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * @return the matching type, or null for an unassigned tag
     */
    public static AddressType fromCode(int code) {
        for (AddressType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        return null;
    }
}
