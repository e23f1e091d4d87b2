package com.phillippitts.factopinion.service.ensemble;

import com.phillippitts.factopinion.exception.ClassifierException;
import com.phillippitts.factopinion.testutil.FakeSentenceClassifier;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ClassifierEnsembleTest {

    @Test
    void averagesAllMembers() {
        FakeSentenceClassifier a = new FakeSentenceClassifier("a", 0.9);
        FakeSentenceClassifier b = new FakeSentenceClassifier("b", 0.6);
        FakeSentenceClassifier c = new FakeSentenceClassifier("c", 0.3);
        ClassifierEnsemble ensemble = new ClassifierEnsemble(List.of(a, b, c));

        EnsembleResult result = ensemble.classify("句子。");

        assertThat(result.memberCount()).isEqualTo(3);
        assertThat(result.factProbability()).isCloseTo(0.6, within(1e-9));
        assertThat(result.average().notFact()).isCloseTo(0.4, within(1e-9));
        assertThat(List.of(a.calls(), b.calls(), c.calls())).containsOnly(1);
    }

    @Test
    void worksWithAnyEnsembleSize() {
        ClassifierEnsemble single = new ClassifierEnsemble(List.of(new FakeSentenceClassifier("solo", 0.7)));
        ClassifierEnsemble five = new ClassifierEnsemble(List.of(
                new FakeSentenceClassifier("1", 0.1),
                new FakeSentenceClassifier("2", 0.2),
                new FakeSentenceClassifier("3", 0.3),
                new FakeSentenceClassifier("4", 0.4),
                new FakeSentenceClassifier("5", 0.5)));

        assertThat(single.classify("x").factProbability()).isCloseTo(0.7, within(1e-9));
        assertThat(five.classify("x").factProbability()).isCloseTo(0.3, within(1e-9));
        assertThat(five.size()).isEqualTo(5);
        assertThat(five.memberNames()).containsExactly("1", "2", "3", "4", "5");
    }

    @Test
    void requiresAtLeastOneMember() {
        assertThatThrownBy(() -> new ClassifierEnsemble(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void failingMemberFailsTheCall() {
        ClassifierEnsemble ensemble = new ClassifierEnsemble(List.of(
                new FakeSentenceClassifier("ok", 0.5),
                FakeSentenceClassifier.failing("broken")));

        assertThatThrownBy(() -> ensemble.classify("x"))
                .isInstanceOfSatisfying(ClassifierException.class,
                        e -> assertThat(e.getClassifierName()).isEqualTo("broken"));
    }

    @Test
    void unexpectedRuntimeErrorIsWrapped() {
        SentenceClassifier npe = new SentenceClassifier() {
            @Override
            public ClassProbabilities classify(String sentence) {
                throw new IllegalStateException("model not loaded");
            }

            @Override
            public String getName() {
                return "npe";
            }
        };
        ClassifierEnsemble ensemble = new ClassifierEnsemble(List.of(npe));

        assertThatThrownBy(() -> ensemble.classify("x"))
                .isInstanceOf(ClassifierException.class)
                .hasMessageContaining("model not loaded")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void nullVectorIsRejected() {
        ClassifierEnsemble ensemble = new ClassifierEnsemble(List.of(stub("nil", null)));

        assertThatThrownBy(() -> ensemble.classify("x"))
                .isInstanceOf(ClassifierException.class)
                .hasMessageContaining("no probabilities");
    }

    @Test
    void unnormalizedVectorIsRejected() {
        ClassifierEnsemble ensemble = new ClassifierEnsemble(List.of(stub("skewed", new ClassProbabilities(0.5, 0.6))));

        assertThatThrownBy(() -> ensemble.classify("x"))
                .isInstanceOf(ClassifierException.class)
                .hasMessageContaining("do not sum to 1")
                .hasMessageContaining("skewed");
    }

    private static SentenceClassifier stub(String name, ClassProbabilities answer) {
        return new SentenceClassifier() {
            @Override
            public ClassProbabilities classify(String sentence) {
                return answer;
            }

            @Override
            public String getName() {
                return name;
            }
        };
    }
}
