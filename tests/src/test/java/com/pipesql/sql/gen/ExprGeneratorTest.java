package com.pipesql.sql.gen;

import com.pipesql.exception.CodegenException;
import com.pipesql.ir.Literal;
import com.pipesql.ir.rq.Expr;
import com.pipesql.ir.rq.ExprKind;
import com.pipesql.ir.rq.Range;
import com.pipesql.sql.Dialect;
import com.pipesql.test.TestBase;
import com.pipesql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Expression generation")
@TestCategories.Unit
public class ExprGeneratorTest extends TestBase {

    private static Expr integer(long value) {
        return Expr.of(new ExprKind.Lit(new Literal.Int(value)));
    }

    private static Range range(Long start, Long end) {
        return new Range(start == null ? null : integer(start), end == null ? null : integer(end));
    }

    @Nested
    @DisplayName("Merging take ranges")
    class TakeRanges {

        @Test
        @DisplayName("a single bounded range is kept")
        void single() {
            ExprGenerator.IntRange merged = ExprGenerator.rangeOfRanges(List.of(range(3L, 10L)));

            assertThat(merged).isEqualTo(new ExprGenerator.IntRange(3L, 10L));
        }

        @Test
        @DisplayName("a later range is relative to the earlier one")
        void nested() {
            ExprGenerator.IntRange merged = ExprGenerator.rangeOfRanges(List.of(range(3L, 10L), range(2L, 4L)));

            assertThat(merged).isEqualTo(new ExprGenerator.IntRange(4L, 6L));
        }

        @Test
        @DisplayName("the smaller end wins")
        void smallerEnd() {
            ExprGenerator.IntRange merged = ExprGenerator.rangeOfRanges(List.of(range(null, 5L), range(null, 10L)));

            assertThat(merged).isEqualTo(new ExprGenerator.IntRange(null, 5L));
        }

        @Test
        @DisplayName("an inverted range selects no rows")
        void empty() {
            ExprGenerator.IntRange merged = ExprGenerator.rangeOfRanges(List.of(range(10L, 5L)));

            assertThat(merged).isEqualTo(new ExprGenerator.IntRange(null, 0L));
        }

        @Test
        @DisplayName("an open range keeps the earlier start")
        void openStart() {
            ExprGenerator.IntRange merged = ExprGenerator.rangeOfRanges(List.of(range(5L, null), range(null, 3L)));

            assertThat(merged).isEqualTo(new ExprGenerator.IntRange(5L, 7L));
        }

        @Test
        @DisplayName("bounds must be integer literals")
        void nonInteger() {
            Range bad = new Range(Expr.of(new ExprKind.Lit(new Literal.Str("x"))), null);

            assertThatThrownBy(() -> ExprGenerator.rangeOfRanges(List.of(bad)))
                .isInstanceOf(CodegenException.class)
                .hasMessageContaining("expected an integer literal");
        }
    }

    @Nested
    @DisplayName("Float literals")
    class Floats {

        @Test
        void keepsFraction() {
            assertThat(ExprGenerator.formatReal(1.0)).isEqualTo("1.0");
            assertThat(ExprGenerator.formatReal(2.5)).isEqualTo("2.5");
            assertThat(ExprGenerator.formatReal(-0.25)).isEqualTo("-0.25");
        }

        @Test
        @DisplayName("no exponent notation")
        void plain() {
            assertThat(ExprGenerator.formatReal(1.0E10)).isEqualTo("10000000000.0");
            assertThat(ExprGenerator.formatReal(1.5E-7)).isEqualTo("0.00000015");
        }
    }

    @Nested
    @DisplayName("Operator templates")
    class Templates {

        @Test
        @DisplayName("placeholders carry their index and strength")
        void parsesPlaceholders() {
            OperatorTemplate template = OperatorTemplate.of("{0:10} - {1:11}");

            assertThat(template.parts()).containsExactly(
                new OperatorTemplate.Arg(0, 10),
                new OperatorTemplate.Text(" - "),
                new OperatorTemplate.Arg(1, 11));
            assertThat(template.arity()).isEqualTo(2);
        }

        @Test
        @DisplayName("arguments may appear out of order")
        void reordered() {
            OperatorTemplate template = OperatorTemplate.of("ROUND({1:0}, {0:0})");

            assertThat(template.arity()).isEqualTo(2);
            assertThat(template.parts().get(0)).isEqualTo(new OperatorTemplate.Text("ROUND("));
            assertThat(template.parts().get(1)).isEqualTo(new OperatorTemplate.Arg(1, 0));
        }

        @Test
        @DisplayName("dialect overrides replace the generic template")
        void overrides() {
            assertThat(StdOperators.find("std.text.length", Dialect.GENERIC)).get()
                .isEqualTo(OperatorTemplate.of("CHAR_LENGTH({0:0})"));
            assertThat(StdOperators.find("std.text.length", Dialect.MSSQL)).get()
                .isEqualTo(OperatorTemplate.of("LEN({0:0})"));
        }

        @Test
        @DisplayName("sum coalesces to zero")
        void sumCoalesce() {
            OperatorTemplate sum = StdOperators.find("std.sum", Dialect.GENERIC).orElseThrow();

            assertThat(sum.coalesce()).isEqualTo("0");
            assertThat(sum.windowFrame()).isTrue();
        }

        @Test
        @DisplayName("functions a dialect cannot express are errors")
        void unsupported() {
            assertThatThrownBy(() -> StdOperators.find("std.regex_search", Dialect.MSSQL))
                .isInstanceOf(CodegenException.class)
                .hasMessageContaining("not supported for dialect");
        }

        @Test
        void unknownFunction() {
            assertThat(StdOperators.find("std.nope", Dialect.GENERIC)).isEmpty();
            assertThat(StdOperators.isRegistered("std.add")).isTrue();
        }
    }
}
