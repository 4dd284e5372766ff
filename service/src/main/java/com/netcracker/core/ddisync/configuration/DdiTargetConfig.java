package com.netcracker.core.ddisync.configuration;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.util.Objects;

/**
 * Connection details of one target DDI store.
 */
@Value
public class DdiTargetConfig {
    public static final String DEFAULT_API_ROOT = "wapi";
    public static final String DEFAULT_API_VERSION = "2.13.1";

    String host;
    String username;
    @ToString.Exclude
    String password;
    String apiRoot;
    String apiVersion;
    boolean trustAll;

    @Builder
    private DdiTargetConfig(String host,
                            String username,
                            String password,
                            String apiRoot,
                            String apiVersion,
                            boolean trustAll) {
        this.host = Objects.requireNonNull(host, "host").trim();
        this.username = Objects.requireNonNull(username, "username");
        this.password = Objects.requireNonNull(password, "password");
        this.apiRoot = (apiRoot != null ? apiRoot : DEFAULT_API_ROOT);
        this.apiVersion = (apiVersion != null ? apiVersion : DEFAULT_API_VERSION);
        this.trustAll = trustAll;
        validate();
    }

    private void validate() {
        if (host.isEmpty())
            throw new IllegalArgumentException("host must not be blank");
        if (username.isBlank())
            throw new IllegalArgumentException("username must not be blank");
        if (password.isEmpty())
            throw new IllegalArgumentException("password must not be empty");
    }

    /**
     * Versioned API base, always ending with a slash: {@code https://host/wapi/v2.13.1/}.
     */
    public String baseUrl() {
        String root = host.contains("://") ? host : "https://" + host;
        while (root.endsWith("/")) {
            root = root.substring(0, root.length() - 1);
        }
        return "%s/%s/v%s/".formatted(root, apiRoot, apiVersion);
    }
}
