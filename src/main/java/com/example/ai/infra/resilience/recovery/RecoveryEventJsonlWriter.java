package com.example.ai.infra.resilience.recovery;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Appends recovery events to a file, one JSON object per line.
 *
 * <p>Fail-soft: a write error is logged and the event dropped. Details are clipped and common API-key
 * shapes redacted.</p>
 */
public final class RecoveryEventJsonlWriter implements RecoveryEventListener {

    private static final Logger log = LoggerFactory.getLogger(RecoveryEventJsonlWriter.class);

    private static final Pattern OPENAI_KEY = Pattern.compile("\\bsk-[A-Za-z0-9]{10,}\\b");
    private static final Pattern BEARER = Pattern.compile("(?i)\\bbearer\\s+[A-Za-z0-9._\\-]{10,}");
    private static final int MAX_DETAILS = 512;

    private final ObjectMapper om;
    private final Path path;
    private final boolean enabled;

    public RecoveryEventJsonlWriter(ObjectMapper om, Path path, boolean enabled) {
        this.om = om;
        this.path = path;
        this.enabled = enabled;
    }

    @Override
    public void onEvent(RecoveryEvent event) {
        if (!enabled || event == null) {
            return;
        }
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("ts", event.timestampMs());
            row.put("type", event.type().code());
            row.put("service", event.service());
            if (event.details() != null) {
                row.put("details", clip(redact(event.details()), MAX_DETAILS));
            }
            if (!event.metrics().isEmpty()) {
                row.put("metrics", event.metrics());
            }
            String line = om.writeValueAsString(row);
            synchronized (this) {
                try (BufferedWriter w = Files.newBufferedWriter(
                        path,
                        StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.WRITE,
                        StandardOpenOption.APPEND)) {
                    w.write(line);
                    w.newLine();
                }
            }
        } catch (Exception e) {
            log.warn("[RecoveryEventJsonl] write failed path={} err={}", path, e.toString());
        }
    }

    Path path() {
        return path;
    }

    private static String redact(String s) {
        String t = OPENAI_KEY.matcher(s).replaceAll("sk-REDACTED");
        return BEARER.matcher(t).replaceAll("Bearer REDACTED");
    }

    private static String clip(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }
}
