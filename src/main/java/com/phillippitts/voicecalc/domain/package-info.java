/**
 * Immutable domain values shared across the pipeline.
 *
 * <p>{@link com.phillippitts.voicecalc.domain.Token} and
 * {@link com.phillippitts.voicecalc.domain.NormalizedExpression} are transient per-utterance
 * values; {@link com.phillippitts.voicecalc.domain.IntentResult} is the single interpretation of
 * one utterance; {@link com.phillippitts.voicecalc.domain.SessionState} is owned exclusively by
 * the voice session.
 *
 * @since 1.0
 */
package com.phillippitts.voicecalc.domain;
