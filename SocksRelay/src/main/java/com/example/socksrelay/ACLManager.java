package com.example.socksrelay;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Destination filter. Deny entries win over allow entries; with an allow list
 * present, anything not on it is denied.
 * <p>
 * A domain entry matches that name and its subdomains. An IP entry matches an
 * IP-literal request for the same address, in whatever notation it was written.
 */
public class ACLManager {
    private static final Pattern IPV4_LITERAL = Pattern.compile("\\d{1,3}(\\.\\d{1,3}){3}");

    private final List<Entry> allow;
    private final List<Entry> deny;

    public ACLManager(Config.ACL cfg) {
        this.allow = (cfg != null ? parse(cfg.allow) : null);
        this.deny = (cfg != null ? parse(cfg.deny) : null);
    }

    public boolean permit(Address destination) {
        if (deny != null) {
            for (Entry d : deny) {
                if (d.matches(destination)) return false;
            }
        }
        if (allow != null) {
            for (Entry a : allow) {
                if (a.matches(destination)) return true;
            }
            return false;
        }
        return true;
    }

    private static List<Entry> parse(List<String> entries) {
        if (entries == null) {
            return null;
        }
        List<Entry> parsed = new ArrayList<>(entries.size());
        for (String entry : entries) {
            parsed.add(Entry.of(entry));
        }
        return parsed;
    }

    private static final class Entry {
        private final InetAddress ip;
        private final String domain;

        private Entry(InetAddress ip, String domain) {
            this.ip = ip;
            this.domain = domain;
        }

        static Entry of(String raw) {
            String host = raw.trim().toLowerCase().replace("[", "").replace("]", "");
            boolean ipv6 = host.contains(":");
            if (ipv6 || IPV4_LITERAL.matcher(host).matches()) {
                try {
                    // brackets make getByName reject a bad literal instead of asking DNS
                    if (!ipv6 && !validOctets(host)) {
                        throw new UnknownHostException(host);
                    }
                    return new Entry(InetAddress.getByName(ipv6 ? "[" + host + "]" : host), null);
                } catch (UnknownHostException e) {
                    throw new IllegalArgumentException("Invalid IP entry in ACL: " + raw, e);
                }
            }
            return new Entry(null, host);
        }

        private static boolean validOctets(String ipv4) {
            for (String octet : ipv4.split("\\.")) {
                if (Integer.parseInt(octet) > 255) {
                    return false;
                }
            }
            return true;
        }

        boolean matches(Address destination) {
            if (destination.getType() == AddressType.DOMAIN) {
                if (domain == null) {
                    return false;
                }
                String host = destination.getDomain().toLowerCase();
                return host.equals(domain) || host.endsWith("." + domain);
            }
            return ip != null && ip.equals(destination.getIp());
        }
    }
}
