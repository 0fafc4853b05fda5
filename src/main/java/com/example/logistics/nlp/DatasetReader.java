package com.example.logistics.nlp;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.logistics.model.Intent;
import com.example.logistics.model.TrainingExample;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

public class DatasetReader {

    private static final Logger log = LoggerFactory.getLogger(DatasetReader.class);
    static final String TEXT_COLUMN = "text";
    static final String INTENT_COLUMN = "intent";

    private final CsvMapper mapper;

    public DatasetReader() {
        this.mapper = CsvMapper.builder()
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();
    }

    public List<TrainingExample> read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            List<TrainingExample> examples = read(in);
            log.info("Loaded {} examples from {}", examples.size(), path);
            return examples;
        } catch (NoSuchFileException e) {
            throw new DatasetFormatException("Dataset not found: " + path, e);
        } catch (IOException e) {
            throw new DatasetFormatException("Failed to read dataset " + path + ": " + e.getMessage(), e);
        }
    }

    public List<TrainingExample> read(InputStream in) {
        Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
        CsvSchema schema = CsvSchema.emptySchema().withHeader();

        List<TrainingExample> examples = new ArrayList<>();
        try (MappingIterator<Map<String, String>> rows = mapper.readerForMapOf(String.class)
            .with(schema)
            .readValues(reader)) {

            int line = 1;
            while (rows.hasNextValue()) {
                Map<String, String> row = rows.nextValue();
                line++;
                if (line == 2) {
                    requireColumn(row, TEXT_COLUMN);
                    requireColumn(row, INTENT_COLUMN);
                }
                String text = row.get(TEXT_COLUMN);
                if (text == null || text.isBlank()) {
                    continue;
                }
                String label = row.get(INTENT_COLUMN);
                final int rowLine = line;
                Intent intent = Intent.fromLabel(label).orElseThrow(() -> new DatasetFormatException(
                    "Unknown intent '" + label + "' on line " + rowLine));
                examples.add(new TrainingExample(text, intent));
            }
        } catch (DatasetFormatException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new DatasetFormatException("Malformed dataset: " + e.getMessage(), e);
        }

        if (examples.isEmpty()) {
            throw new DatasetFormatException("Dataset contains no examples");
        }
        return examples;
    }

    private static void requireColumn(Map<String, String> row, String column) {
        if (!row.containsKey(column)) {
            throw new DatasetFormatException("Dataset is missing required column '" + column + "'");
        }
    }
}
