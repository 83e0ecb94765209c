package com.trophykit.core.auth.xbox;

import java.net.URI;
import java.util.Objects;

public record XboxAuthEndpoints(URI userAuthenticateUri, URI xstsAuthorizeUri) {

    public XboxAuthEndpoints {
        Objects.requireNonNull(userAuthenticateUri, "userAuthenticateUri");
        Objects.requireNonNull(xstsAuthorizeUri, "xstsAuthorizeUri");
    }

    public static XboxAuthEndpoints defaults() {
        return new XboxAuthEndpoints(
                URI.create("https://user.auth.xboxlive.com/user/authenticate"),
                URI.create("https://xsts.auth.xboxlive.com/xsts/authorize"));
    }

    public static XboxAuthEndpoints under(String baseUrl) {
        String b = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return new XboxAuthEndpoints(URI.create(b + "/user/authenticate"), URI.create(b + "/xsts/authorize"));
    }
}
