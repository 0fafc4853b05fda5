package com.example.logistics.nlp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class FeatureSpace {

    private static final Pattern TOKEN = Pattern.compile("\\b\\w\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    private final List<String> terms;
    private final Map<String, Integer> index;
    private final double[] idf;

    private FeatureSpace(List<String> terms, double[] idf) {
        this.terms = List.copyOf(terms);
        this.idf = idf.clone();
        this.index = new HashMap<>(terms.size() * 2);
        for (int i = 0; i < terms.size(); i++) {
            index.put(terms.get(i), i);
        }
    }

    public record SparseVector(int[] indices, double[] values) {}

    // Ranked by corpus count times smoothed idf, ties alphabetical; kept terms indexed alphabetically.
    public static FeatureSpace fit(List<String> normalizedDocs, int maxFeatures) {
        if (normalizedDocs.isEmpty()) {
            throw new IllegalArgumentException("Cannot fit a feature space on an empty corpus");
        }

        Map<String, Integer> termCounts = new HashMap<>();
        Map<String, Integer> docFrequency = new HashMap<>();
        for (String doc : normalizedDocs) {
            Map<String, Integer> counts = countTerms(doc);
            counts.forEach((term, count) -> {
                termCounts.merge(term, count, Integer::sum);
                docFrequency.merge(term, 1, Integer::sum);
            });
        }

        int n = normalizedDocs.size();
        Map<String, Double> idfByTerm = new HashMap<>(docFrequency.size() * 2);
        docFrequency.forEach((term, df) -> idfByTerm.put(term, smoothIdf(n, df)));

        List<String> ranked = new ArrayList<>(termCounts.keySet());
        ranked.sort(Comparator
            .comparingDouble((String t) -> termCounts.get(t) * idfByTerm.get(t)).reversed()
            .thenComparing(Comparator.naturalOrder()));

        List<String> kept = new ArrayList<>(ranked.subList(0, Math.min(maxFeatures, ranked.size())));
        Collections.sort(kept);

        double[] idf = new double[kept.size()];
        for (int i = 0; i < kept.size(); i++) {
            idf[i] = idfByTerm.get(kept.get(i));
        }
        return new FeatureSpace(kept, idf);
    }

    public static FeatureSpace restore(List<String> terms, double[] idf) {
        if (terms.size() != idf.length) {
            throw new IllegalArgumentException(
                "Vocabulary has " + terms.size() + " terms but " + idf.length + " idf weights");
        }
        return new FeatureSpace(terms, idf);
    }

    // Projects normalized text into this space; the result is L2-normalized.
    public SparseVector transform(String normalizedText) {
        Map<Integer, Double> weights = new LinkedHashMap<>();
        countTerms(normalizedText).forEach((term, count) -> {
            Integer i = index.get(term);
            if (i != null) {
                weights.put(i, count * idf[i]);
            }
        });

        double norm = 0.0;
        for (double w : weights.values()) norm += w * w;
        norm = Math.sqrt(norm);

        int[] indices = new int[weights.size()];
        double[] values = new double[weights.size()];
        int k = 0;
        for (var e : weights.entrySet()) {
            indices[k] = e.getKey();
            values[k] = norm > 0 ? e.getValue() / norm : 0.0;
            k++;
        }
        return new SparseVector(indices, values);
    }

    static List<String> analyze(String normalizedText) {
        List<String> tokens = new ArrayList<>();
        Matcher m = TOKEN.matcher(normalizedText);
        while (m.find()) {
            tokens.add(m.group());
        }

        List<String> grams = new ArrayList<>(tokens.size() * 2);
        grams.addAll(tokens);
        for (int i = 0; i + 1 < tokens.size(); i++) {
            grams.add(tokens.get(i) + " " + tokens.get(i + 1));
        }
        return grams;
    }

    private static Map<String, Integer> countTerms(String normalizedText) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String gram : analyze(normalizedText)) {
            counts.merge(gram, 1, Integer::sum);
        }
        return counts;
    }

    private static double smoothIdf(int docCount, int docFrequency) {
        return Math.log((1.0 + docCount) / (1.0 + docFrequency)) + 1.0;
    }

    public int size() {
        return terms.size();
    }

    public List<String> terms() {
        return terms;
    }

    public double[] idf() {
        return idf.clone();
    }

    public boolean contains(String term) {
        return index.containsKey(term);
    }
}
