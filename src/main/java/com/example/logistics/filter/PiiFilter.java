package com.example.logistics.filter;

import java.util.List;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;

@Component
public class PiiFilter {

    private static final Logger log = LoggerFactory.getLogger(PiiFilter.class);
    private static final String REDACTED = "[REDACTED]";
    private static final int LOG_PREVIEW_LENGTH = 80;

    private record PiiPattern(String name, Pattern pattern) {}

    private static final List<PiiPattern> PATTERNS = List.of(
        new PiiPattern("email",
            Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b")),
        new PiiPattern("phone",
            Pattern.compile("\\+91[\\s-]?[6-9]\\d{9}\\b|\\b[6-9]\\d{9}\\b"))
    );

    public String scrub(String text) {
        if (text == null || text.isEmpty()) return text;

        String result = text;
        boolean piiFound = false;

        for (var pii : PATTERNS) {
            var matcher = pii.pattern().matcher(result);
            if (matcher.find()) {
                piiFound = true;
                log.debug("PII detected (type={}), redacting", pii.name());
                result = matcher.replaceAll(REDACTED);
            }
        }

        if (piiFound) {
            Span.current().addEvent("logistics.pii_redacted", Attributes.of(
                AttributeKey.booleanKey("logistics.pii_redacted"), true
            ));
        }

        return result;
    }

    public String preview(String text) {
        String scrubbed = scrub(text);
        if (scrubbed == null) return "";
        return scrubbed.length() > LOG_PREVIEW_LENGTH
            ? scrubbed.substring(0, LOG_PREVIEW_LENGTH) + "..."
            : scrubbed;
    }
}
