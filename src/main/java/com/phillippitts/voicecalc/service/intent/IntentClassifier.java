package com.phillippitts.voicecalc.service.intent;

import com.phillippitts.voicecalc.domain.ClassifierOutput;

/**
 * Maps a transcript to one coarse intent label with a confidence.
 *
 * <p>Implementations must be deterministic for a fixed trained state and safe to call from
 * multiple threads. Blank input yields {@link ClassifierOutput#noop()}.
 */
public interface IntentClassifier {

    ClassifierOutput classify(String text);
}
