package com.trophykit.core.http;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/** "Send a request, get status + headers + body". Tests plug in scripted senders here. */
@FunctionalInterface
public interface HttpSender {
    HttpResponse<String> send(HttpRequest request) throws IOException, InterruptedException;

    static HttpSender of(HttpClient client) {
        Objects.requireNonNull(client, "client");
        return req -> client.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }
}
