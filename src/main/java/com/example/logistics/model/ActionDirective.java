package com.example.logistics.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ActionDirective(
    String nextAction,
    String message,
    List<String> missingFields,
    List<String> optionalFields,
    String apiCall,
    Map<String, Object> parameters,
    Boolean canProceed,
    Map<String, Object> details
) {

    public static final String ASK_MISSING_FIELDS = "ASK_MISSING_FIELDS";
    public static final String ASK_OPTIONAL_FIELDS = "ASK_OPTIONAL_FIELDS";
    public static final String CALCULATE_RATE = "CALCULATE_RATE";
    public static final String CHECK_SERVICE_AREA = "CHECK_SERVICE_AREA";
    public static final String CREATE_BOOKING = "CREATE_BOOKING";
    public static final String ASK_TRACKING_INFO = "ASK_TRACKING_INFO";
    public static final String ASK_ORDER_ID = "ASK_ORDER_ID";
    public static final String CREATE_TICKET = "CREATE_TICKET";
    public static final String TRANSFER_TO_AGENT = "TRANSFER_TO_AGENT";
    public static final String PROVIDE_PAYMENT_INFO = "PROVIDE_PAYMENT_INFO";
    public static final String PROVIDE_UPLOAD_LINK = "PROVIDE_UPLOAD_LINK";
    public static final String UNKNOWN = "UNKNOWN";
    public static final String MODEL_UNAVAILABLE = "MODEL_UNAVAILABLE";

    public static ActionDirective askMissing(List<String> missingFields, String message) {
        return new ActionDirective(ASK_MISSING_FIELDS, message, List.copyOf(missingFields),
            null, null, null, null, null);
    }

    public static ActionDirective askOptional(List<String> optionalFields, String message) {
        return new ActionDirective(ASK_OPTIONAL_FIELDS, message, null,
            List.copyOf(optionalFields), null, null, true, null);
    }

    public static ActionDirective apiCall(String nextAction, String message, String apiCall,
                                          Map<String, Object> parameters) {
        return new ActionDirective(nextAction, message, null, null, apiCall, parameters, null, null);
    }

    public static ActionDirective prompt(String nextAction, String message, Map<String, Object> details) {
        return new ActionDirective(nextAction, message, null, null, null, null, null,
            details == null || details.isEmpty() ? null : details);
    }

    public static ActionDirective unknown(String rawIntent) {
        var details = new LinkedHashMap<String, Object>();
        details.put("intent", rawIntent);
        return prompt(UNKNOWN,
            "I am not sure how to help with that. Please contact customer support.", details);
    }

    public static ActionDirective modelUnavailable() {
        return prompt(MODEL_UNAVAILABLE,
            "Intent model is unavailable right now. Please try again later.", null);
    }
}
