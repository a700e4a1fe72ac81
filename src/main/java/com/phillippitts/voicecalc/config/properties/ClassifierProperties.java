package com.phillippitts.voicecalc.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Intent classifier training settings. Binds to {@code voice.classifier}.
 *
 * <pre>
 * voice.classifier.dataset-path=data/voice_intent_dataset.json
 * voice.classifier.synthetic-corpus=true
 * </pre>
 *
 * @param datasetPath     JSON training corpus; created from the built-in dataset when missing
 * @param syntheticCorpus whether generated expression phrases are merged into training
 */
@ConfigurationProperties(prefix = "voice.classifier")
@Validated
public record ClassifierProperties(
        @NotBlank(message = "Dataset path must not be blank")
        @DefaultValue("data/voice_intent_dataset.json")
        String datasetPath,

        @DefaultValue("true")
        boolean syntheticCorpus
) {
}
