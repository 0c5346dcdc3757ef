package com.phillippitts.syd.service.aggregate;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StarIdOrderingTest {

    @Test
    void numericIdsFirstByValueThenOthersLexicographically() {
        List<String> ids = new ArrayList<>(List.of("10", "KIC2", "2", "1A", "1"));

        ids.sort(StarIdOrdering.INSTANCE);

        assertThat(ids).containsExactly("1", "2", "10", "1A", "KIC2");
    }

    @Test
    void handlesIdsBeyondLongRange() {
        assertThat(StarIdOrdering.INSTANCE.compare("99999999999999999999", "100000000000000000000"))
                .isNegative();
    }

    @Test
    void leadingZerosKeepDistinctOrder() {
        assertThat(StarIdOrdering.INSTANCE.compare("007", "7")).isNotZero();
        assertThat(StarIdOrdering.isNumeric("")).isFalse();
    }
}
