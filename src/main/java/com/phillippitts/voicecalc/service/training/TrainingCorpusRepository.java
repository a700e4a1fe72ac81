package com.phillippitts.voicecalc.service.training;

import com.phillippitts.voicecalc.domain.IntentLabel;
import com.phillippitts.voicecalc.domain.TrainingSample;
import com.phillippitts.voicecalc.exception.TrainingCorpusException;
import com.phillippitts.voicecalc.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * File-backed store of labeled training transcripts.
 *
 * <p>The corpus is a JSON array of {@code {"text": ..., "label": ...}} objects. When the file
 * does not exist it is created from the built-in default dataset on first access. Every
 * {@link #append(String, String)} rewrites the whole file through a temporary sibling and an
 * atomic move, so a crash never leaves a half-written corpus behind.
 *
 * <p>Access is serialized on this instance.
 */
public class TrainingCorpusRepository {

    private static final Logger LOG = LogManager.getLogger(TrainingCorpusRepository.class);

    static final String DEFAULT_DATASET_RESOURCE = "/intent/default-dataset.json";

    private final Path datasetPath;
    private List<TrainingSample> samples;

    public TrainingCorpusRepository(Path datasetPath) {
        this.datasetPath = Objects.requireNonNull(datasetPath, "datasetPath must not be null");
    }

    /**
     * Returns all samples in insertion order.
     *
     * @throws TrainingCorpusException if the file cannot be read or parsed
     */
    public synchronized List<TrainingSample> list() {
        return List.copyOf(loaded());
    }

    /**
     * Validates and persists one sample.
     *
     * @param text  transcript, must not be blank
     * @param label wire label such as {@code "clear"}
     * @return the stored sample
     * @throws com.phillippitts.voicecalc.exception.InvalidIntentLabelException for unsupported labels
     * @throws IllegalArgumentException if the text is blank
     * @throws TrainingCorpusException if the corpus cannot be written
     */
    public synchronized TrainingSample append(String text, String label) {
        IntentLabel intent = IntentLabel.fromWire(label);
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Training text must not be blank");
        }
        TrainingSample sample = new TrainingSample(text.strip(), intent);
        List<TrainingSample> updated = new ArrayList<>(loaded());
        updated.add(sample);
        write(updated);
        samples = updated;
        LOG.info("Appended training sample label={} (corpus size={})", intent.wireName(), updated.size());
        LOG.debug("Appended training text='{}'", LogSanitizer.truncate(sample.text()));
        return sample;
    }

    private List<TrainingSample> loaded() {
        if (samples == null) {
            if (!Files.exists(datasetPath)) {
                List<TrainingSample> defaults = loadDefaults();
                write(defaults);
                LOG.info("Seeded training corpus {} with {} default samples", datasetPath, defaults.size());
            }
            samples = read(datasetPath);
        }
        return samples;
    }

    private static List<TrainingSample> read(Path path) {
        try {
            return parse(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new TrainingCorpusException("Failed to read training corpus: " + path, e);
        }
    }

    static List<TrainingSample> loadDefaults() {
        try (InputStream in = TrainingCorpusRepository.class.getResourceAsStream(DEFAULT_DATASET_RESOURCE)) {
            if (in == null) {
                throw new TrainingCorpusException("Default dataset resource missing: " + DEFAULT_DATASET_RESOURCE);
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new TrainingCorpusException("Failed to read default dataset", e);
        }
    }

    static List<TrainingSample> parse(String json) {
        try {
            JSONArray array = new JSONArray(json);
            List<TrainingSample> parsed = new ArrayList<>(array.length());
            for (int i = 0; i < array.length(); i++) {
                JSONObject entry = array.getJSONObject(i);
                parsed.add(new TrainingSample(entry.getString("text"), IntentLabel.fromWire(entry.getString("label"))));
            }
            return parsed;
        } catch (JSONException e) {
            throw new TrainingCorpusException("Malformed training corpus: " + e.getMessage(), e);
        }
    }

    private void write(List<TrainingSample> records) {
        JSONArray array = new JSONArray();
        for (TrainingSample sample : records) {
            array.put(new JSONObject().put("text", sample.text()).put("label", sample.label().wireName()));
        }
        try {
            Path parent = datasetPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = datasetPath.resolveSibling(datasetPath.getFileName() + ".tmp");
            Files.writeString(tmp, array.toString(2), StandardCharsets.UTF_8);
            Files.move(tmp, datasetPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new TrainingCorpusException("Failed to write training corpus: " + datasetPath, e);
        }
    }
}
