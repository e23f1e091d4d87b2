package com.phillippitts.factopinion.service.rules;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LexiconTest {

    @Test
    void stripsBlanksAndDuplicatesKeepingOrder() {
        Lexicon lexicon = Lexicon.of(Arrays.asList(" 我觉得 ", "", null, "可能", "我觉得"), List.of(), List.of());

        assertThat(lexicon.opinionCues()).containsExactly("我觉得", "可能");
    }

    @Test
    void nullCollectionsBecomeEmpty() {
        Lexicon lexicon = Lexicon.of(null, null, null);

        assertThat(lexicon.opinionCues()).isEmpty();
        assertThat(lexicon.factCues()).isEmpty();
        assertThat(lexicon.degreeAdverbs()).isEmpty();
    }

    @Test
    void setsAreUnmodifiable() {
        Lexicon lexicon = Lexicon.of(List.of("可能"), List.of("根据"), List.of("很"));

        assertThatThrownBy(() -> lexicon.factCues().add("统计"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
