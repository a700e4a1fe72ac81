package com.phillippitts.voicecalc.presentation.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Body of {@code POST /voice/interpret}.
 */
public record InterpretRequest(@NotBlank(message = "Empty transcript") String transcript) {
}
