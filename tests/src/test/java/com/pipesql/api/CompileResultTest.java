package com.pipesql.api;

import com.pipesql.diagnostic.Diagnostic;
import com.pipesql.exception.ErrorKind;
import com.pipesql.test.TestBase;
import com.pipesql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CompileResult")
@TestCategories.Unit
public class CompileResultTest extends TestBase {

    @Test
    void success() {
        try (CompileResult result = CompileResult.success("SELECT 1")) {
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.output()).isEqualTo("SELECT 1");
            assertThat(result.diagnostics()).isEmpty();
        }
    }

    @Test
    @DisplayName("a failure has empty output")
    void failure() {
        Diagnostic diagnostic = new Diagnostic(ErrorKind.CODEGEN, "E0007", "boom", List.of(), null, "Error: boom", null);

        try (CompileResult result = CompileResult.failure(List.of(diagnostic))) {
            assertThat(result.isSuccess()).isFalse();
            assertThat(result.output()).isEmpty();
            assertThat(result.diagnostics()).containsExactly(diagnostic);
        }
    }

    @Test
    @DisplayName("accessing a closed result fails")
    void closed() {
        CompileResult result = CompileResult.success("SELECT 1");
        result.close();
        result.close();

        assertThat(result.isClosed()).isTrue();
        assertThatThrownBy(result::output)
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("CompileResult is closed");
        assertThatThrownBy(result::diagnostics).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(result::isSuccess).isInstanceOf(IllegalStateException.class);
    }
}
