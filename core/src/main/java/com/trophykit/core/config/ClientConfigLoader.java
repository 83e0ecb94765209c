package com.trophykit.core.config;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * Reads trophykit.yml into {@link ClientConfig}. Missing keys keep their defaults.
 *
 * Expected keys:
 * retry:
 *   maxRetries: 3
 *   baseDelayMs: 1000
 *   maxDelayMs: 30000
 *   jitterFactor: 0.2
 * timeoutMs: 30000
 * connectTimeoutMs: 10000
 * userAgent: "Mozilla/5.0 ..."
 * retroachievements:
 *   connectUserAgent: "myapp/1.0"
 */
public final class ClientConfigLoader {
    public static final String DEFAULT_FILE = "trophykit.yml";

    private ClientConfigLoader() {}

    /** ./trophykit.yml when present, defaults otherwise. */
    public static ClientConfig loadDefault() throws IOException {
        Path p = Path.of(DEFAULT_FILE);
        return Files.exists(p) ? load(p) : validated(ClientConfig.defaults());
    }

    public static ClientConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException(DEFAULT_FILE + " not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    /** Classpath resource, e.g. a bundled default. */
    public static ClientConfig loadResource(String resource) throws IOException {
        try (InputStream in = ClientConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) throw new IOException("resource not found: " + resource);
            return load(in);
        }
    }

    static ClientConfig load(InputStream in) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);
        ClientConfig cfg = ClientConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            return validated(cfg);
        }

        Map<?, ?> retry = getMap(map, "retry");
        if (retry != null) {
            ClientConfig.Retry r = cfg.retry();
            setInt(retry, "maxRetries", r::setMaxRetries);
            setLong(retry, "baseDelayMs", r::setBaseDelayMs);
            setLong(retry, "maxDelayMs", r::setMaxDelayMs);
            setDouble(retry, "jitterFactor", r::setJitterFactor);
        }
        setLongAsDurationMs(map, "timeoutMs", cfg::setTimeout);
        setLongAsDurationMs(map, "connectTimeoutMs", cfg::setConnectTimeout);
        setString(map, "userAgent", cfg::setUserAgent);

        Map<?, ?> ra = getMap(map, "retroachievements");
        if (ra != null) {
            setString(ra, "connectUserAgent", cfg::setRetroConnectUserAgent);
        }
        return validated(cfg);
    }

    private static ClientConfig validated(ClientConfig cfg) {
        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    private static Map<?, ?> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        return (v instanceof Map<?, ?> m) ? m : null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }

    private static void setDouble(Map<?, ?> map, String key, DoubleConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.doubleValue());
        else if (v != null) setter.accept(Double.parseDouble(String.valueOf(v).trim()));
    }

    private static void setLongAsDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        setter.accept(Duration.ofMillis(ms));
    }
}
