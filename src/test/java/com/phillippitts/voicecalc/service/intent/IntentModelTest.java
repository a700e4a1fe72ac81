package com.phillippitts.voicecalc.service.intent;

import com.phillippitts.voicecalc.domain.ClassifierOutput;
import com.phillippitts.voicecalc.domain.IntentLabel;
import com.phillippitts.voicecalc.exception.TrainingCorpusException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntentModelTest {

    @Test
    void reloadSwapsInFreshClassifier() {
        AtomicInteger generation = new AtomicInteger();
        IntentModel model = new IntentModel(() -> {
            IntentLabel label = generation.getAndIncrement() == 0 ? IntentLabel.CLEAR : IntentLabel.STOP;
            return text -> new ClassifierOutput(label, 0.9);
        });
        IntentClassifier first = model.current();

        assertThat(model.classify("anything").label()).isEqualTo(IntentLabel.CLEAR);
        model.reload();

        assertThat(model.classify("anything").label()).isEqualTo(IntentLabel.STOP);
        assertThat(model.current()).isNotSameAs(first);
    }

    @Test
    void failedReloadKeepsCurrentClassifier() {
        AtomicInteger calls = new AtomicInteger();
        IntentModel model = new IntentModel(() -> {
            if (calls.getAndIncrement() > 0) {
                throw new TrainingCorpusException("corpus unreadable");
            }
            return text -> new ClassifierOutput(IntentLabel.CLEAR, 0.9);
        });
        IntentClassifier before = model.current();

        assertThatThrownBy(model::reload).isInstanceOf(TrainingCorpusException.class);
        assertThat(model.current()).isSameAs(before);
    }

    @Test
    void inFlightClassifyFinishesOnOldInstance() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger generation = new AtomicInteger();
        IntentModel model = new IntentModel(() -> {
            if (generation.getAndIncrement() == 0) {
                return text -> {
                    entered.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return new ClassifierOutput(IntentLabel.CLEAR, 0.9);
                };
            }
            return text -> new ClassifierOutput(IntentLabel.STOP, 0.9);
        });

        CompletableFuture<ClassifierOutput> inFlight = CompletableFuture.supplyAsync(() -> model.classify("x"));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        model.reload();
        release.countDown();

        assertThat(inFlight.get(5, TimeUnit.SECONDS).label()).isEqualTo(IntentLabel.CLEAR);
        assertThat(model.classify("x").label()).isEqualTo(IntentLabel.STOP);
    }
}
