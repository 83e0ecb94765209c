package com.trophykit.core.support;

import com.trophykit.core.http.HttpSender;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Replays queued outcomes in order and records every request it sees.
 * Once the queue is drained the last outcome repeats.
 */
public final class ScriptedSender implements HttpSender {

    private interface Outcome {
        HttpResponse<String> apply(HttpRequest req) throws IOException;
    }

    private final Deque<Outcome> script = new ArrayDeque<>();
    public final List<HttpRequest> requests = new ArrayList<>();
    private Outcome last;

    public ScriptedSender respond(int status, String body) {
        return respond(status, Map.of(), body);
    }

    public ScriptedSender respond(int status, Map<String, List<String>> headers, String body) {
        script.add(req -> new StubResponse(status, headers, body, req));
        return this;
    }

    public ScriptedSender fail(IOException e) {
        script.add(req -> { throw e; });
        return this;
    }

    public int calls() { return requests.size(); }

    public HttpRequest lastRequest() { return requests.get(requests.size() - 1); }

    @Override
    public HttpResponse<String> send(HttpRequest request) throws IOException {
        requests.add(request);
        Outcome next = script.poll();
        if (next != null) last = next;
        if (last == null) throw new IllegalStateException("no scripted response for " + request.uri());
        return last.apply(request);
    }
}
