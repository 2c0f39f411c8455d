package com.recbench.evaluation.model;

import com.recbench.evaluation.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SampleSetTest {

    @Test
    void limitTruncatesInInputOrder() {
        SampleSet set = SampleSet.of(List.of(new Sample("a", "1"), new Sample("b", "2"), new Sample("c", "3")), 2);

        assertThat(set.size()).isEqualTo(2);
        assertThat(set.asList()).extracting(Sample::getClinicalScenario).containsExactly("a", "b");
        assertThat(SampleSet.of(List.of(new Sample("a", "1")), 0).size()).isEqualTo(1);
    }

    @Test
    void rejectsEmptyOrHoleyInput() {
        assertThatThrownBy(() -> SampleSet.of(new ArrayList<>())).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> SampleSet.of(null)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> SampleSet.of(Arrays.asList(new Sample("a", "1"), null)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("index 1");
    }

    @Test
    void isReadOnly() {
        SampleSet set = SampleSet.of(List.of(new Sample("a", "1")));

        assertThatThrownBy(() -> set.asList().add(new Sample("b", "2"))).isInstanceOf(UnsupportedOperationException.class);
    }
}
