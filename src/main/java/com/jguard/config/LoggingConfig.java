package com.jguard.config;

import com.jguard.observability.PiiRedactionConverter;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Pushes configured PII redaction patterns into the Logback
 * PiiRedactionConverter via its static holder.
 */
@Configuration
public class LoggingConfig {

    private static final Logger log = LoggerFactory.getLogger(LoggingConfig.class);

    private final JguardProperties properties;

    public LoggingConfig(JguardProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void configurePiiRedaction() {
        JguardProperties.PiiProperties pii = properties.getSecurity().getPii();
        PiiRedactionConverter.setEnabled(pii.isRedactInLogs());
        List<String> patterns = pii.getRedactPatterns();
        if (patterns != null && !patterns.isEmpty()) {
            log.info("Configuring {} additional PII redaction patterns", patterns.size());
            PiiRedactionConverter.setConfiguredPatterns(patterns);
        } else {
            log.info("Using default PII redaction patterns (email, bot token)");
        }
    }
}
