package com.example.logistics.extraction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.example.logistics.model.PaymentMode;

final class ExtractionRules {

    private ExtractionRules() {}

    // Known places, matched as case-insensitive substrings in this order.
    static final List<String> GAZETTEER = List.of(
        "mumbai", "delhi", "bangalore", "pune", "chennai", "kolkata",
        "hyderabad", "ahmedabad", "gurgaon", "noida", "thane", "navi mumbai",
        "andheri", "powai", "bandra", "worli", "kurla", "ghatkopar",
        "khargar", "vashi", "panvel", "whitefield", "koramangala",
        "indiranagar", "malleswaram", "mg road", "connaught place",
        "saket", "vasant kunj", "dwarka", "rohini", "ghaziabad",
        "faridabad", "kashmir", "tier"
    );

    static final List<String> PICKUP_CUES = List.of("pickup");
    static final Pattern PICKUP_PARTICLE = Pattern.compile("\\bse\\b");
    static final List<String> DELIVERY_CUES = List.of("drop", "delivery");

    static final Pattern WEIGHT = Pattern.compile("(\\d+\\.?\\d*)\\s*(?:kgs|kg|kilograms?|kilos)");

    static final Pattern PACKAGES = Pattern.compile("(\\d+)\\s*(?:box(?:es)?|packages?|parcels?|items?)");

    static final Map<String, String> TIME_KEYWORDS = ordered(
        "morning", "morning",
        "afternoon", "afternoon",
        "evening", "evening",
        "night", "night",
        "kal", "tomorrow",
        "aaj", "today",
        "parso", "day_after_tomorrow"
    );

    static final List<Pattern> CLOCK_TIMES = List.of(
        Pattern.compile("(\\d{1,2})\\s*(am|pm)"),
        Pattern.compile("(\\d{1,2}):(\\d{2})\\s*(am|pm)?"),
        Pattern.compile("(\\d{1,2})\\s*baje")
    );

    static final List<String> FRAGILE_KEYWORDS = List.of("fragile", "breakable", "handle carefully", "delicate");

    static final Map<String, PaymentMode> PAYMENT_KEYWORDS;
    static {
        var payment = new LinkedHashMap<String, PaymentMode>();
        payment.put("cod", PaymentMode.COD);
        payment.put("cash on delivery", PaymentMode.COD);
        payment.put("cash", PaymentMode.COD);
        payment.put("prepaid", PaymentMode.PREPAID);
        payment.put("online", PaymentMode.PREPAID);
        payment.put("upi", PaymentMode.PREPAID);
        payment.put("card", PaymentMode.PREPAID);
        PAYMENT_KEYWORDS = Collections.unmodifiableMap(payment);
    }

    static final Pattern PHONE = Pattern.compile("\\+91[\\s-]?[6-9]\\d{9}\\b|\\b[6-9]\\d{9}\\b");

    private static Map<String, String> ordered(String... pairs) {
        var map = new LinkedHashMap<String, String>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }
}
