package com.example.socksrelay;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.File;
import java.io.IOException;
import java.util.List;

public class Config {
    // dual-stack wildcard
    public String bindAddress = "::";
    public int port = 6000;
    /** Milliseconds, 0 waits as long as the OS does. */
    public int connectTimeout = 10000;
    /** Milliseconds to wait for live connections after shutdown is signalled. */
    public long shutdownTimeout = 10000;
    public ACL acl;

    public static class ACL {
        public List<String> allow;
        public List<String> deny;
    }

    public Config() {}

    public Config(String bindAddress, int port) {
        this.bindAddress = bindAddress;
        this.port = port;
    }

    public static Config load(File file) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        Config cfg = mapper.readValue(file, Config.class);
        // an empty document maps to null
        return cfg != null ? cfg : new Config();
    }

    /**
     * Loads {@code path}, or returns the defaults if the file does not exist.
     */
    public static Config loadOrDefault(String path) throws IOException {
        File file = new File(path);
        if (!file.isFile()) {
            return new Config();
        }
        return load(file);
    }
}
