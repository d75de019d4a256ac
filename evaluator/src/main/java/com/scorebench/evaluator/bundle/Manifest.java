package com.scorebench.evaluator.bundle;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Line-oriented "key: value" description of one unit of work, as read by the
 * compute worker (run.txt) or the scoring program (input.txt).
 *
 * Keys keep insertion order. Values are signed URLs or plain literals.
 */
public final class Manifest {

    private final Map<String, String> entries = new LinkedHashMap<>();

    public Manifest put(String key, Object value) {
        entries.put(key, String.valueOf(value));
        return this;
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public Map<String, String> entries() {
        return Collections.unmodifiableMap(entries);
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> e : entries.entrySet()) {
            if (sb.length() > 0) sb.append('\n');
            sb.append(e.getKey()).append(": ").append(e.getValue());
        }
        return sb.toString();
    }

    public byte[] toBytes() {
        return render().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Parse a rendered manifest. Splits each line on the first ": " so values
     * that are URLs (and contain ':') survive intact.
     */
    public static Manifest parse(String text) {
        Manifest manifest = new Manifest();
        for (String line : text.split("\n")) {
            int sep = line.indexOf(": ");
            if (sep > 0) {
                manifest.put(line.substring(0, sep).strip(), line.substring(sep + 2).strip());
            }
        }
        return manifest;
    }

    @Override
    public String toString() {
        return render();
    }
}
