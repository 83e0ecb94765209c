package com.trophykit.core.support;

import java.net.http.HttpRequest;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;

/** Drains a request's body publisher so scripted senders can assert on form and JSON bodies. */
public final class BodyReader {
    private BodyReader() {}

    public static String read(HttpRequest req) {
        if (req.bodyPublisher().isEmpty()) return "";
        StringBuilder sb = new StringBuilder();
        CountDownLatch done = new CountDownLatch(1);
        req.bodyPublisher().get().subscribe(new Flow.Subscriber<ByteBuffer>() {
            @Override public void onSubscribe(Flow.Subscription s) { s.request(Long.MAX_VALUE); }
            @Override public void onNext(ByteBuffer item) {
                byte[] b = new byte[item.remaining()];
                item.get(b);
                sb.append(new String(b, StandardCharsets.UTF_8));
            }
            @Override public void onError(Throwable t) { done.countDown(); }
            @Override public void onComplete() { done.countDown(); }
        });
        try {
            if (!done.await(5, TimeUnit.SECONDS)) throw new IllegalStateException("body publisher did not complete");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
        return sb.toString();
    }
}
