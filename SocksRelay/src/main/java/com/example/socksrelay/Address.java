package com.example.socksrelay;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.UnknownHostException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A SOCKS5 address: an IPv4 or IPv6 literal, or a domain name of at most 255 UTF-8 bytes.
 */
public final class Address {
    public static final int MAX_DOMAIN_LENGTH = 255;

    private final AddressType type;
    private final InetAddress ip;
    private final String domain;

    private Address(AddressType type, InetAddress ip, String domain) {
        this.type = type;
        this.ip = ip;
        this.domain = domain;
    }

    public static Address ip(InetAddress ip) {
        Objects.requireNonNull(ip, "ip");
        // mapped IPv6 literals come back from getByAddress as Inet4Address
        if (ip instanceof Inet4Address) {
            return new Address(AddressType.IPV4, ip, null);
        } else if (ip instanceof Inet6Address) {
            return new Address(AddressType.IPV6, ip, null);
        }
        throw new IllegalArgumentException("Unsupported address: " + ip);
    }

    public static Address domain(String domain) {
        Objects.requireNonNull(domain, "domain");
        int len = domain.getBytes(StandardCharsets.UTF_8).length;
        if (len > MAX_DOMAIN_LENGTH) {
            throw new IllegalArgumentException("Domain name is " + len + " bytes, limit is " + MAX_DOMAIN_LENGTH);
        }
        return new Address(AddressType.DOMAIN, null, domain);
    }

    /**
     * The unspecified address of one family, sent in failure replies.
     */
    public static Address unspecified(boolean ipv6) {
        try {
            return ip(InetAddress.getByAddress(new byte[ipv6 ? 16 : 4]));
        } catch (UnknownHostException e) {
            throw new IllegalStateException(e);
        }
    }

    public static Address parse(InputStream in) throws IOException {
        int tag = IoUtil.readUnsignedByte(in, "address type");
        AddressType type = AddressType.fromCode(tag);
        if (type == null) {
            throw new Socks5ProtocolException("Unsupported address type: " + tag);
        }
        switch (type) {
            case IPV4:
                return new Address(type, InetAddress.getByAddress(IoUtil.readFully(in, 4, "IPv4 address")), null);
            case IPV6:
                return new Address(type, toInet6(IoUtil.readFully(in, 16, "IPv6 address")), null);
            case DOMAIN:
                int len = IoUtil.readUnsignedByte(in, "domain length");
                return new Address(type, null, decodeUtf8(IoUtil.readFully(in, len, "domain")));
            default:
                throw new Socks5ProtocolException("Unsupported address type: " + type);
        }
    }

    public void write(OutputStream out) throws IOException {
        out.write(type.code());
        switch (type) {
            case IPV4:
            case IPV6:
                out.write(ip.getAddress());
                break;
            case DOMAIN:
                byte[] bytes = domain.getBytes(StandardCharsets.UTF_8);
                out.write(bytes.length);
                out.write(bytes);
                break;
        }
    }

    public AddressType getType() {
        return type;
    }

    public boolean isIpv6() {
        return type == AddressType.IPV6;
    }

    /**
     * @return the IP literal, or null for a domain address
     */
    public InetAddress getIp() {
        return ip;
    }

    /**
     * @return the domain name, or null for an IP address
     */
    public String getDomain() {
        return domain;
    }

    public String getHost() {
        return type == AddressType.DOMAIN ? domain : ip.getHostAddress();
    }

    // getByAddress would turn ::ffff:a.b.c.d into an Inet4Address
    private static InetAddress toInet6(byte[] raw) throws UnknownHostException {
        return Inet6Address.getByAddress(null, raw, (NetworkInterface) null);
    }

    private static String decodeUtf8(byte[] raw) throws Socks5ProtocolException {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new Socks5ProtocolException("Domain name is not valid UTF-8", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Address)) return false;
        Address other = (Address) o;
        return type == other.type && Objects.equals(ip, other.ip) && Objects.equals(domain, other.domain);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, ip, domain);
    }

    @Override
    public String toString() {
        return type == AddressType.IPV6 ? "[" + ip.getHostAddress() + "]" : getHost();
    }
}
