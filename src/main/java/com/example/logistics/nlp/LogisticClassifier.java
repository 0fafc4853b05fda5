package com.example.logistics.nlp;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.logistics.model.Intent;
import com.example.logistics.nlp.FeatureSpace.SparseVector;

import opennlp.tools.ml.AbstractEventTrainer;
import opennlp.tools.ml.EventTrainer;
import opennlp.tools.ml.TrainerFactory;
import opennlp.tools.ml.maxent.io.BinaryQNModelReader;
import opennlp.tools.ml.maxent.io.BinaryQNModelWriter;
import opennlp.tools.ml.maxent.quasinewton.QNTrainer;
import opennlp.tools.ml.model.AbstractModel;
import opennlp.tools.ml.model.Event;
import opennlp.tools.util.ObjectStream;
import opennlp.tools.util.ObjectStreamUtils;
import opennlp.tools.util.TrainingParameters;

// Multinomial logistic regression over TF-IDF rows, trained by OpenNLP's L-BFGS maxent trainer.
public final class LogisticClassifier {

    private static final Logger log = LoggerFactory.getLogger(LogisticClassifier.class);

    // Always-on predicate standing in for the intercept; never a vocabulary term.
    static final String BIAS = "*bias*";

    private final AbstractModel model;
    private final List<Intent> labels;

    LogisticClassifier(AbstractModel model) {
        if (model.getModelType() != AbstractModel.ModelType.MaxentQn) {
            throw new IllegalArgumentException("Expected a MAXENT_QN model, got " + model.getModelType());
        }
        List<Intent> outcomes = new ArrayList<>(model.getNumOutcomes());
        for (int k = 0; k < model.getNumOutcomes(); k++) {
            String outcome = model.getOutcome(k);
            outcomes.add(Intent.fromLabel(outcome)
                .orElseThrow(() -> new IllegalArgumentException("Unknown outcome '" + outcome + "'")));
        }
        if (outcomes.size() < 2 || new HashSet<>(outcomes).size() != outcomes.size()) {
            throw new IllegalArgumentException("Classifier outcomes must be at least 2 distinct intents: " + outcomes);
        }
        this.model = model;
        this.labels = List.copyOf(outcomes);
    }

    static LogisticClassifier fit(List<SparseVector> rows, List<Intent> targets, List<String> terms,
                                  TrainingOptions options) {
        List<Event> events = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            SparseVector x = rows.get(i);
            events.add(new Event(targets.get(i).name(), predicates(x, terms), strengths(x)));
        }

        TrainingParameters params = new TrainingParameters();
        params.put(TrainingParameters.ALGORITHM_PARAM, QNTrainer.MAXENT_QN_VALUE);
        params.put(AbstractEventTrainer.DATA_INDEXER_PARAM, AbstractEventTrainer.DATA_INDEXER_ONE_PASS_REAL_VALUE);
        params.put(TrainingParameters.CUTOFF_PARAM, 0);
        params.put(TrainingParameters.ITERATIONS_PARAM, options.maxIterations());
        params.put(TrainingParameters.THREADS_PARAM, 1);
        params.put(QNTrainer.L1COST_PARAM, 0.0);
        // Summed log-loss plus ||w||^2 / (2C)
        params.put(QNTrainer.L2COST_PARAM, 1.0 / (2.0 * options.regularization()));

        Map<String, String> report = new HashMap<>();
        EventTrainer trainer = TrainerFactory.getEventTrainer(params, report);
        try (ObjectStream<Event> stream = ObjectStreamUtils.createObjectStream(events)) {
            LogisticClassifier classifier = new LogisticClassifier((AbstractModel) trainer.train(stream));
            log.debug("Logistic classifier fit: classes={} rows={} report={}",
                classifier.labels.size(), rows.size(), report);
            return classifier;
        } catch (IOException e) {
            throw new DatasetFormatException("Intent classifier training failed: " + e.getMessage(), e);
        }
    }

    public double[] probabilities(SparseVector x, List<String> terms) {
        return model.eval(predicates(x, terms), strengths(x));
    }

    public List<Intent> labels() {
        return labels;
    }

    byte[] toBytes() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            new BinaryQNModelWriter(model, new DataOutputStream(out)).persist();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize intent classifier", e);
        }
        return out.toByteArray();
    }

    static LogisticClassifier fromBytes(byte[] blob) throws IOException {
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(blob))) {
            return new LogisticClassifier(new BinaryQNModelReader(in).getModel());
        }
    }

    private static String[] predicates(SparseVector x, List<String> terms) {
        int[] indices = x.indices();
        String[] context = new String[indices.length + 1];
        for (int j = 0; j < indices.length; j++) {
            context[j] = terms.get(indices[j]);
        }
        context[indices.length] = BIAS;
        return context;
    }

    private static float[] strengths(SparseVector x) {
        double[] values = x.values();
        float[] out = new float[values.length + 1];
        for (int j = 0; j < values.length; j++) {
            out[j] = (float) values[j];
        }
        out[values.length] = 1.0f;
        return out;
    }
}
