package com.pipesql.sql.pq;

import com.pipesql.test.TestBase;
import com.pipesql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SplitRules")
@TestCategories.Unit
public class SplitRulesTest extends TestBase {

    @ParameterizedTest(name = "{0} then {1}: split={2}")
    @CsvSource({
        "Aggregate, Filter,    false",
        "Aggregate, Sort,      false",
        "Aggregate, Aggregate, true",
        "Aggregate, Compute,   true",
        "Filter,    Aggregate, false",
        "Filter,    Join,      true",
        "Compute,   Filter,    true",
        "Sort,      Take,      false",
        "Sort,      Join,      true",
        "Take,      Filter,    true",
        "Take,      Sort,      true",
        "Distinct,  Take,      true",
        "Union,     Sort,      true",
        "Join,      Filter,    false",
        "From,      Join,      false"
    })
    @DisplayName("transforms SQL evaluates earlier force a split")
    void splitRequired(String kind, String following, boolean expected) {
        assertThat(SplitRules.splitRequired(kind, Set.of(following))).isEqualTo(expected);
    }

    @Test
    @DisplayName("a loop must end its statement")
    void loop() {
        assertThat(SplitRules.splitRequired("Loop", Set.of())).isFalse();
        assertThat(SplitRules.splitRequired("Loop", Set.of("Select"))).isTrue();
    }

    @Test
    @DisplayName("kinds without rules never split")
    void noRules() {
        assertThat(SplitRules.splitRequired("Select", Set.of("From", "Join"))).isFalse();
    }
}
