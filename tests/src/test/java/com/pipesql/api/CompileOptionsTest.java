package com.pipesql.api;

import com.pipesql.test.TestBase;
import com.pipesql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CompileOptions")
@TestCategories.Unit
public class CompileOptionsTest extends TestBase {

    @Test
    @DisplayName("defaults format and sign for any target")
    void defaults() {
        CompileOptions options = CompileOptions.defaults();

        assertThat(options.format()).isTrue();
        assertThat(options.signatureComment()).isTrue();
        assertThat(options.target()).isEqualTo("sql.any");
        assertThat(options.color()).isFalse();
    }

    @Test
    @DisplayName("toBuilder copies every option")
    void toBuilder() {
        CompileOptions original = CompileOptions.builder()
            .format(false)
            .target("sql.duckdb")
            .signatureComment(false)
            .color(true)
            .build();

        CompileOptions copy = original.toBuilder().build();

        assertThat(copy.format()).isFalse();
        assertThat(copy.target()).isEqualTo("sql.duckdb");
        assertThat(copy.signatureComment()).isFalse();
        assertThat(copy.color()).isTrue();
    }

    @Test
    @DisplayName("a null target means sql.any")
    void nullTarget() {
        assertThat(CompileOptions.builder().target(null).build().target()).isEqualTo("sql.any");
    }

    @Test
    @DisplayName("an unknown target is rejected when building")
    void unknownTarget() {
        assertThatThrownBy(() -> CompileOptions.builder().target("postgres"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown target: 'postgres'");
    }
}
