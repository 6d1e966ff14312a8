package com.jguard.observability;

import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Logback converter that redacts PII and secrets from log messages.
 * Additional patterns come from jguard.security.pii.redact-patterns
 * through LoggingConfig at startup.
 */
public class PiiRedactionConverter extends ClassicConverter {

    private static final List<Pattern> DEFAULT_PATTERNS = List.of(
            Pattern.compile("[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}"),           // Email
            Pattern.compile("[MN][A-Za-z\\d]{23,25}\\.[\\w-]{6}\\.[\\w-]{27,38}")        // Discord bot token
    );

    private static volatile List<Pattern> configuredPatterns = null;
    private static volatile boolean enabled = true;

    public static void setConfiguredPatterns(List<String> patterns) {
        List<Pattern> compiled = new ArrayList<>(DEFAULT_PATTERNS);
        if (patterns != null) {
            for (String p : patterns) {
                compiled.add(Pattern.compile(p));
            }
        }
        configuredPatterns = compiled;
    }

    public static void setEnabled(boolean redact) {
        enabled = redact;
    }

    @Override
    public String convert(ILoggingEvent event) {
        String message = event.getFormattedMessage();
        if (message == null) return "";
        if (!enabled) return message;

        List<Pattern> patterns = configuredPatterns != null ? configuredPatterns : DEFAULT_PATTERNS;
        for (Pattern pattern : patterns) {
            message = pattern.matcher(message).replaceAll("[REDACTED]");
        }
        return message;
    }
}
