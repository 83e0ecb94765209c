package com.trophykit.core.auth.psn;

import java.net.URI;
import java.util.Objects;

/** Sony account endpoints. Only tests point these somewhere else. */
public record PsnAuthEndpoints(URI authorizeUri, URI tokenUri) {
    public static final String SSO_COOKIE_URL = "https://ca.account.sony.com/api/v1/ssocookie";

    public PsnAuthEndpoints {
        Objects.requireNonNull(authorizeUri, "authorizeUri");
        Objects.requireNonNull(tokenUri, "tokenUri");
    }

    public static PsnAuthEndpoints defaults() {
        return new PsnAuthEndpoints(
                URI.create("https://ca.account.sony.com/api/authz/v3/oauth/authorize"),
                URI.create("https://ca.account.sony.com/api/authz/v3/oauth/token"));
    }

    /** Both endpoints under one base, e.g. a local stub server. */
    public static PsnAuthEndpoints under(String baseUrl) {
        String b = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return new PsnAuthEndpoints(URI.create(b + "/authorize"), URI.create(b + "/token"));
    }
}
