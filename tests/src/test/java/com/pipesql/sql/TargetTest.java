package com.pipesql.sql;

import com.pipesql.exception.CodegenException;
import com.pipesql.ir.QueryDef;
import com.pipesql.test.TestBase;
import com.pipesql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Target and Dialect")
@TestCategories.Unit
public class TargetTest extends TestBase {

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @ParameterizedTest
        @EnumSource(Dialect.class)
        @DisplayName("every dialect parses back from its target name")
        void parsesTargetNames(Dialect dialect) {
            Target target = Target.parse(dialect.targetName());

            assertThat(target.dialect()).isEqualTo(dialect);
            assertThat(target.name()).isEqualTo("sql." + dialect.shortName());
        }

        @Test
        @DisplayName("sql.any and null parse to the sentinel")
        void anyTarget() {
            assertThat(Target.parse("sql.any").isAny()).isTrue();
            assertThat(Target.parse(null)).isEqualTo(Target.ANY);
            assertThat(Target.ANY.dialect()).isNull();
        }

        @Test
        @DisplayName("names are trimmed and case insensitive")
        void caseInsensitive() {
            assertThat(Target.parse(" SQL.Postgres ").dialect()).isEqualTo(Dialect.POSTGRES);
        }

        @Test
        @DisplayName("an unknown name lists the valid values")
        void unknownTarget() {
            assertThatThrownBy(() -> Target.parse("sql.oracle"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown target: 'sql.oracle'")
                .hasMessageContaining("sql.any")
                .hasMessageContaining("sql.mssql");
        }

        @Test
        @DisplayName("names() starts with sql.any and covers every dialect")
        void names() {
            assertThat(Target.names())
                .startsWith("sql.any")
                .hasSize(Dialect.values().length + 1)
                .contains("sql.duckdb", "sql.snowflake");
        }
    }

    @Nested
    @DisplayName("Resolution against the query header")
    class Resolution {

        @Test
        @DisplayName("an explicit target wins over the header")
        void explicitWins() {
            Dialect dialect = Target.of(Dialect.MYSQL).resolve(new QueryDef(null, "sql.mssql"));

            assertThat(dialect).isEqualTo(Dialect.MYSQL);
        }

        @Test
        @DisplayName("sql.any defers to the header")
        void anyDefers() {
            assertThat(Target.ANY.resolve(new QueryDef(null, "sql.sqlite"))).isEqualTo(Dialect.SQLITE);
        }

        @Test
        @DisplayName("generic is the fallback without a header target")
        void genericFallback() {
            assertThat(Target.ANY.resolve(QueryDef.EMPTY)).isEqualTo(Dialect.GENERIC);
            assertThat(Target.ANY.resolve(null)).isEqualTo(Dialect.GENERIC);
            assertThat(Target.ANY.resolve(new QueryDef(null, "sql.any"))).isEqualTo(Dialect.GENERIC);
        }

        @Test
        @DisplayName("an unknown header target is a codegen error")
        void unknownHeaderTarget() {
            assertThatThrownBy(() -> Target.ANY.resolve(new QueryDef(null, "sql.oracle")))
                .isInstanceOf(CodegenException.class)
                .hasMessageContaining("sql.oracle");
        }
    }

    @Nested
    @DisplayName("Dialect capabilities")
    class Capabilities {

        @Test
        void onlyMssqlUsesTop() {
            for (Dialect dialect : Dialect.values()) {
                assertThat(dialect.useTop()).isEqualTo(dialect == Dialect.MSSQL);
            }
        }

        @Test
        void identifierQuotes() {
            assertThat(Dialect.MYSQL.identQuote()).isEqualTo('`');
            assertThat(Dialect.BIGQUERY.identQuote()).isEqualTo('`');
            assertThat(Dialect.POSTGRES.identQuote()).isEqualTo('"');
        }

        @Test
        void columnExclusion() {
            assertThat(Dialect.DUCKDB.columnExclude()).isEqualTo(Dialect.ColumnExclude.EXCLUDE);
            assertThat(Dialect.BIGQUERY.columnExclude()).isEqualTo(Dialect.ColumnExclude.EXCEPT);
            assertThat(Dialect.GENERIC.columnExclude()).isNull();
        }

        @Test
        void distinctOn() {
            assertThat(Dialect.POSTGRES.supportsDistinctOn()).isTrue();
            assertThat(Dialect.DUCKDB.supportsDistinctOn()).isTrue();
            assertThat(Dialect.MSSQL.supportsDistinctOn()).isFalse();
        }
    }
}
