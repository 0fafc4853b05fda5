package com.example.logistics.extraction;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.logistics.model.EntitySet;
import com.example.logistics.model.PaymentMode;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

@Component
public class EntityExtractor {

    private static final Logger log = LoggerFactory.getLogger(EntityExtractor.class);

    private final LocationRecognizer locationRecognizer;
    private final Tracer tracer;

    public EntityExtractor(LocationRecognizer locationRecognizer) {
        this.locationRecognizer = locationRecognizer;
        this.tracer = GlobalOpenTelemetry.getTracer("logistics-assistant");
    }

    public record Locations(String pickup, String drop) {}

    public EntitySet extract(String text) {
        Span span = tracer.spanBuilder("extract_entities")
            .setAttribute("logistics.stage", "extract")
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            String raw = text == null ? "" : text;
            Locations locations = extractLocations(raw);

            EntitySet entities = new EntitySet(
                locations.pickup(),
                locations.drop(),
                extractWeight(raw),
                extractPackages(raw),
                extractTime(raw),
                extractFragile(raw),
                extractPaymentMode(raw),
                extractPhoneNumber(raw)
            );

            log.debug("Extracted entities: {}", entities);
            return entities;

        } finally {
            span.end();
        }
    }

    // Two or more candidates: first is pickup, second is drop. A lone candidate needs a cue.
    public Locations extractLocations(String text) {
        List<String> candidates = locationCandidates(text);
        String lower = text.toLowerCase(Locale.ROOT);

        if (candidates.size() >= 2) {
            return new Locations(candidates.get(0), candidates.get(1));
        }
        if (candidates.size() == 1) {
            if (containsAny(lower, ExtractionRules.PICKUP_CUES) || ExtractionRules.PICKUP_PARTICLE.matcher(lower).find()) {
                return new Locations(candidates.get(0), null);
            }
            if (containsAny(lower, ExtractionRules.DELIVERY_CUES)) {
                return new Locations(null, candidates.get(0));
            }
        }
        return new Locations(null, null);
    }

    List<String> locationCandidates(String text) {
        Set<String> candidates = new LinkedHashSet<>();
        for (LocationRecognizer.RecognizedSpan span : locationRecognizer.recognize(text)) {
            candidates.add(span.text());
        }

        String lower = text.toLowerCase(Locale.ROOT);
        for (String place : ExtractionRules.GAZETTEER) {
            if (lower.contains(place)) {
                candidates.add(titleCase(place));
            }
        }
        return new ArrayList<>(candidates);
    }

    public Double extractWeight(String text) {
        Matcher m = ExtractionRules.WEIGHT.matcher(text.toLowerCase(Locale.ROOT));
        return m.find() ? Double.parseDouble(m.group(1)) : null;
    }

    public Integer extractPackages(String text) {
        Matcher m = ExtractionRules.PACKAGES.matcher(text.toLowerCase(Locale.ROOT));
        if (!m.find()) return null;
        try {
            return Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            log.debug("Package count out of range: {}", m.group(1));
            return null;
        }
    }

    // Symbolic day and time-of-day words win over clock times.
    public String extractTime(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> keyword : ExtractionRules.TIME_KEYWORDS.entrySet()) {
            if (lower.contains(keyword.getKey())) {
                return keyword.getValue();
            }
        }
        for (Pattern clock : ExtractionRules.CLOCK_TIMES) {
            Matcher m = clock.matcher(lower);
            if (m.find()) {
                return m.group().strip();
            }
        }
        return null;
    }

    public boolean extractFragile(String text) {
        return containsAny(text.toLowerCase(Locale.ROOT), ExtractionRules.FRAGILE_KEYWORDS);
    }

    public PaymentMode extractPaymentMode(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, PaymentMode> keyword : ExtractionRules.PAYMENT_KEYWORDS.entrySet()) {
            if (lower.contains(keyword.getKey())) {
                return keyword.getValue();
            }
        }
        return null;
    }

    public String extractPhoneNumber(String text) {
        Matcher m = ExtractionRules.PHONE.matcher(text);
        return m.find() ? m.group() : null;
    }

    private static boolean containsAny(String haystack, List<String> needles) {
        for (String needle : needles) {
            if (haystack.contains(needle)) return true;
        }
        return false;
    }

    static String titleCase(String place) {
        var sb = new StringBuilder(place.length());
        boolean startOfWord = true;
        for (char c : place.toCharArray()) {
            sb.append(startOfWord ? Character.toUpperCase(c) : c);
            startOfWord = !Character.isLetter(c);
        }
        return sb.toString();
    }
}
