package com.example.logistics.nlp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.logistics.model.ClassMetrics;
import com.example.logistics.model.Intent;
import com.example.logistics.model.TrainingExample;
import com.example.logistics.model.TrainingReport;
import com.example.logistics.nlp.FeatureSpace.SparseVector;

public class IntentTrainer {

    private static final Logger log = LoggerFactory.getLogger(IntentTrainer.class);
    private static final int MIN_EXAMPLES_PER_CLASS = 2;

    public record Outcome(IntentModel model, TrainingReport report) {}

    record Split(List<TrainingExample> train, List<TrainingExample> test) {}

    public Outcome fit(List<TrainingExample> examples, TrainingOptions options) {
        Split split = stratifiedSplit(examples, options.testFraction(), options.seed());

        List<String> trainTexts = split.train().stream()
            .map(e -> TextNormalizer.normalize(e.text()))
            .toList();
        FeatureSpace features = FeatureSpace.fit(trainTexts, options.maxFeatures());

        List<SparseVector> rows = new ArrayList<>(trainTexts.size());
        for (String text : trainTexts) {
            rows.add(features.transform(text));
        }
        List<Intent> targets = split.train().stream().map(TrainingExample::intent).toList();

        LogisticClassifier classifier = LogisticClassifier.fit(rows, targets, features.terms(), options);
        IntentModel model = new IntentModel(features, classifier);

        TrainingReport report = evaluate(model, split);
        log.info("Intent model trained: classes={} features={} train={} test={} accuracy={}",
            model.labels().size(), features.size(), split.train().size(), split.test().size(),
            String.format("%.2f%%", report.accuracy() * 100));
        return new Outcome(model, report);
    }

    Split stratifiedSplit(List<TrainingExample> examples, double testFraction, long seed) {
        if (examples.isEmpty()) {
            throw new DatasetFormatException("Dataset contains no examples");
        }

        Map<Intent, List<TrainingExample>> byIntent = new EnumMap<>(Intent.class);
        for (TrainingExample e : examples) {
            byIntent.computeIfAbsent(e.intent(), k -> new ArrayList<>()).add(e);
        }
        if (byIntent.size() < 2) {
            throw new DatasetFormatException("Dataset needs at least 2 intents, found " + byIntent.keySet());
        }
        byIntent.forEach((intent, members) -> {
            if (members.size() < MIN_EXAMPLES_PER_CLASS) {
                throw new DatasetFormatException("Intent " + intent + " has " + members.size()
                    + " example(s); at least " + MIN_EXAMPLES_PER_CLASS + " are needed for a stratified split");
            }
        });

        Random random = new Random(seed);
        List<TrainingExample> train = new ArrayList<>();
        List<TrainingExample> test = new ArrayList<>();
        for (List<TrainingExample> members : byIntent.values()) {
            List<TrainingExample> shuffled = new ArrayList<>(members);
            Collections.shuffle(shuffled, random);
            int testCount = (int) Math.max(1, Math.round(shuffled.size() * testFraction));
            testCount = Math.min(testCount, shuffled.size() - 1);
            test.addAll(shuffled.subList(0, testCount));
            train.addAll(shuffled.subList(testCount, shuffled.size()));
        }
        return new Split(train, test);
    }

    TrainingReport evaluate(IntentModel model, Split split) {
        Map<Intent, int[]> counts = new EnumMap<>(Intent.class); // tp, fp, fn, support
        int correct = 0;
        for (TrainingExample e : split.test()) {
            Intent predicted = model.predictNormalized(TextNormalizer.normalize(e.text())).intent();
            counts.computeIfAbsent(e.intent(), k -> new int[4])[3]++;
            if (predicted == e.intent()) {
                correct++;
                counts.get(e.intent())[0]++;
            } else {
                counts.computeIfAbsent(predicted, k -> new int[4])[1]++;
                counts.get(e.intent())[2]++;
            }
        }

        Map<String, ClassMetrics> perClass = new LinkedHashMap<>();
        double macroP = 0, macroR = 0, macroF = 0;
        double weightedP = 0, weightedR = 0, weightedF = 0;
        int total = split.test().size();
        for (var entry : counts.entrySet()) {
            int[] c = entry.getValue();
            double precision = ratio(c[0], c[0] + c[1]);
            double recall = ratio(c[0], c[0] + c[2]);
            double f1 = precision + recall > 0 ? 2 * precision * recall / (precision + recall) : 0.0;
            perClass.put(entry.getKey().name(), new ClassMetrics(precision, recall, f1, c[3]));

            macroP += precision;
            macroR += recall;
            macroF += f1;
            weightedP += precision * c[3];
            weightedR += recall * c[3];
            weightedF += f1 * c[3];
        }

        int classes = perClass.size();
        ClassMetrics macro = new ClassMetrics(macroP / classes, macroR / classes, macroF / classes, total);
        ClassMetrics weighted = new ClassMetrics(weightedP / total, weightedR / total, weightedF / total, total);
        return new TrainingReport(ratio(correct, total), perClass, macro, weighted,
            split.train().size(), total);
    }

    private static double ratio(int numerator, int denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator;
    }
}
