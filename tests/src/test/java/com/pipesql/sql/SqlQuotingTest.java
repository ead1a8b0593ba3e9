package com.pipesql.sql;

import com.pipesql.test.TestBase;
import com.pipesql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SqlQuoting")
@TestCategories.Unit
public class SqlQuotingTest extends TestBase {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiter = '|', value = {
        "salary        | salary",
        "first_name    | first_name",
        "_x1           | _x1",
        "*             | *",
        "Salary        | \"Salary\"",
        "from          | \"from\"",
        "Order         | \"Order\"",
        "my col        | \"my col\"",
        "1st           | \"1st\"",
        "a\"b          | \"a\"\"b\"",
        "{{ ref }}     | {{ ref }}"
    })
    @DisplayName("identifiers are quoted only when needed")
    void quotesIdentifiers(String identifier, String expected) {
        assertThat(SqlQuoting.quoteIdentifier(identifier, Dialect.GENERIC)).isEqualTo(expected);
    }

    @Test
    @DisplayName("MySQL quotes with backticks")
    void mysqlBackticks() {
        assertThat(SqlQuoting.quoteIdentifier("select", Dialect.MYSQL)).isEqualTo("`select`");
        assertThat(SqlQuoting.quoteIdentifier("a`b", Dialect.MYSQL)).isEqualTo("`a``b`");
    }

    @Test
    @DisplayName("reserved words are matched case insensitively")
    void reserved() {
        assertThat(SqlQuoting.isReserved("where")).isTrue();
        assertThat(SqlQuoting.isReserved("Join")).isTrue();
        assertThat(SqlQuoting.isReserved("salary")).isFalse();
    }

    @Test
    @DisplayName("empty identifiers are rejected")
    void emptyIdentifier() {
        assertThatThrownBy(() -> SqlQuoting.quoteIdentifier("", Dialect.GENERIC))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("string literals double single quotes")
    void literals() {
        assertThat(SqlQuoting.quoteLiteral("O'Reilly")).isEqualTo("'O''Reilly'");
        assertThat(SqlQuoting.quoteLiteral("")).isEqualTo("''");
        assertThat(SqlQuoting.quoteLiteral(null)).isEqualTo("NULL");
    }
}
