package com.example.logistics.decision;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.logistics.decision.IntentRequirements.Requirement;
import com.example.logistics.model.ActionDirective;
import com.example.logistics.model.EntityField;
import com.example.logistics.model.EntitySet;
import com.example.logistics.model.Intent;
import com.example.logistics.model.IntentResult;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

@Component
public class ActionDecider {

    private static final Logger log = LoggerFactory.getLogger(ActionDecider.class);

    private static final Map<Intent, Function<EntitySet, ActionDirective>> TERMINAL;
    static {
        var terminal = new EnumMap<Intent, Function<EntitySet, ActionDirective>>(Intent.class);
        terminal.put(Intent.CHECK_RATE, ActionDecider::calculateRate);
        terminal.put(Intent.CHECK_SERVICEABILITY, ActionDecider::checkServiceArea);
        terminal.put(Intent.BOOK_PICKUP, ActionDecider::bookPickup);
        terminal.put(Intent.TRACK_ORDER, e -> ActionDirective.prompt(ActionDirective.ASK_TRACKING_INFO,
            "Please provide your AWB number or order ID to track",
            details("required_info", "awb_number", "contact", e.phoneNumber())));
        terminal.put(Intent.CANCEL_ORDER, e -> ActionDirective.prompt(ActionDirective.ASK_ORDER_ID,
            "Please provide your order ID or AWB number to cancel",
            details("required_info", "order_id")));
        terminal.put(Intent.RESCHEDULE_PICKUP, e -> ActionDirective.prompt(ActionDirective.ASK_ORDER_ID,
            "Please provide your booking ID to reschedule",
            details("required_info", "booking_id", "new_time", e.pickupTime())));
        terminal.put(Intent.RAISE_COMPLAINT, e -> ActionDirective.prompt(ActionDirective.CREATE_TICKET,
            "I will create a complaint ticket. Please describe your issue.",
            details("ticket_type", "complaint", "contact", e.phoneNumber())));
        terminal.put(Intent.CONNECT_TO_AGENT, e -> ActionDirective.prompt(ActionDirective.TRANSFER_TO_AGENT,
            "Connecting you to a customer service agent...",
            details("priority", "normal")));
        terminal.put(Intent.PAYMENT_QUERY, e -> ActionDirective.prompt(ActionDirective.PROVIDE_PAYMENT_INFO,
            "We accept COD, UPI, cards, and online payment. Which option would you prefer?",
            details("available_modes", List.of("COD", "UPI", "Card", "Net Banking"))));
        terminal.put(Intent.DOCUMENT_UPLOAD_QUERY, e -> ActionDirective.prompt(ActionDirective.PROVIDE_UPLOAD_LINK,
            "You can upload documents through our portal or app. What document do you need to upload?",
            details("upload_options", List.of("Invoice", "KYC", "GST Certificate", "ID Proof"))));
        TERMINAL = Collections.unmodifiableMap(terminal);
    }

    private final Tracer tracer;

    public ActionDecider() {
        this.tracer = GlobalOpenTelemetry.getTracer("logistics-assistant");
    }

    public ActionDirective decide(IntentResult intent, EntitySet entities) {
        return decide(intent.intent().name(), entities, intent.confidence());
    }

    public ActionDirective decide(String intentLabel, EntitySet entities, double confidence) {
        Span span = tracer.spanBuilder("decide_action")
            .setAttribute("logistics.stage", "decide")
            .setAttribute("logistics.intent", String.valueOf(intentLabel))
            .setAttribute("logistics.confidence", confidence)
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            ActionDirective directive = apply(intentLabel, entities == null ? EntitySet.empty() : entities);

            span.setAttribute("logistics.next_action", directive.nextAction());
            if (directive.missingFields() != null) {
                span.setAttribute("logistics.missing_fields", (long) directive.missingFields().size());
            }
            log.debug("Decided {} for intent={} (confidence={})", directive.nextAction(), intentLabel, confidence);
            return directive;

        } finally {
            span.end();
        }
    }

    ActionDirective apply(String intentLabel, EntitySet entities) {
        Optional<Intent> intent = Intent.fromLabel(intentLabel);
        Optional<Requirement> requirement = intent.flatMap(IntentRequirements::forIntent);
        if (intent.isEmpty() || requirement.isEmpty() || !TERMINAL.containsKey(intent.get())) {
            return ActionDirective.unknown(intentLabel);
        }

        List<EntityField> missing = findMissing(requirement.get().required(), entities);
        if (!missing.isEmpty()) {
            return ActionDirective.askMissing(keys(missing), missingFieldsMessage(missing));
        }
        return TERMINAL.get(intent.get()).apply(entities);
    }

    public List<String> findMissingFields(String intentLabel, EntitySet entities) {
        return Intent.fromLabel(intentLabel)
            .flatMap(IntentRequirements::forIntent)
            .map(r -> keys(findMissing(r.required(), entities)))
            .orElse(List.of());
    }

    private static List<EntityField> findMissing(List<EntityField> fields, EntitySet entities) {
        List<EntityField> missing = new ArrayList<>();
        for (EntityField field : fields) {
            if (field.isAbsentIn(entities)) {
                missing.add(field);
            }
        }
        return missing;
    }

    private static ActionDirective calculateRate(EntitySet e) {
        var parameters = new LinkedHashMap<String, Object>();
        parameters.put("from", e.pickupLocation());
        parameters.put("to", e.dropLocation());
        parameters.put("weight", e.weightKg());
        return ActionDirective.apiCall(ActionDirective.CALCULATE_RATE,
            "Fetching rate information...", "pricing_api", parameters);
    }

    private static ActionDirective checkServiceArea(EntitySet e) {
        var parameters = new LinkedHashMap<String, Object>();
        parameters.put("location", e.dropLocation());
        return ActionDirective.apiCall(ActionDirective.CHECK_SERVICE_AREA,
            "Checking serviceability...", "serviceability_api", parameters);
    }

    private static ActionDirective bookPickup(EntitySet e) {
        List<EntityField> recommended = findMissing(IntentRequirements.BOOKING_RECOMMENDED, e);
        if (!recommended.isEmpty()) {
            List<String> keys = keys(recommended);
            return ActionDirective.askOptional(keys,
                "I can book your pickup. Would you like to specify " + String.join(", ", keys) + "?");
        }

        var parameters = new LinkedHashMap<String, Object>();
        for (EntityField field : EntityField.values()) {
            parameters.put(field.key(), field.valueIn(e));
        }
        return ActionDirective.apiCall(ActionDirective.CREATE_BOOKING,
            "Creating your pickup booking...", "booking_api", parameters);
    }

    static String missingFieldsMessage(List<EntityField> missing) {
        List<String> labels = missing.stream().map(EntityField::label).toList();
        if (labels.size() == 1) {
            return "Please provide " + labels.get(0) + ".";
        }
        return "Please provide " + String.join(", ", labels.subList(0, labels.size() - 1))
            + " and " + labels.get(labels.size() - 1) + ".";
    }

    private static List<String> keys(List<EntityField> fields) {
        return fields.stream().map(EntityField::key).toList();
    }

    private static Map<String, Object> details(Object... pairs) {
        var details = new LinkedHashMap<String, Object>();
        for (int i = 0; i < pairs.length; i += 2) {
            if (pairs[i + 1] != null) {
                details.put((String) pairs[i], pairs[i + 1]);
            }
        }
        return details;
    }
}
