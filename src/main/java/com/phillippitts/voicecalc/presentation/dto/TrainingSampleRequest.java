package com.phillippitts.voicecalc.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Body of {@code POST /voice/training-samples}. The label is checked against the supported
 * intent set by the corpus repository.
 */
public record TrainingSampleRequest(
        @NotBlank(message = "Training text must not be blank") String text,
        @NotNull(message = "Label is required") String label
) {
}
