package com.example.logistics.model;

import java.util.Map;

public record TrainingReport(
    double accuracy,
    Map<String, ClassMetrics> perClass,
    ClassMetrics macroAvg,
    ClassMetrics weightedAvg,
    int trainSize,
    int testSize
) {

    public String format() {
        var sb = new StringBuilder();
        sb.append(String.format("%-24s %9s %9s %9s %9s%n", "", "precision", "recall", "f1-score", "support"));
        perClass.forEach((label, m) -> sb.append(row(label, m)));
        sb.append(String.format("%n%-24s %9s %9s %9.2f %9d%n", "accuracy", "", "", accuracy, testSize));
        sb.append(row("macro avg", macroAvg));
        sb.append(row("weighted avg", weightedAvg));
        return sb.toString();
    }

    private static String row(String label, ClassMetrics m) {
        return String.format("%-24s %9.2f %9.2f %9.2f %9d%n", label, m.precision(), m.recall(), m.f1(), m.support());
    }
}
