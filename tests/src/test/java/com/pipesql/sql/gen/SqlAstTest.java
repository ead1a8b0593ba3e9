package com.pipesql.sql.gen;

import com.pipesql.test.TestBase;
import com.pipesql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SqlAst rendering")
@TestCategories.Unit
public class SqlAstTest extends TestBase {

    private static SqlAst.Select select(List<String> projection, String table, String where) {
        return new SqlAst.Select(null, null, projection,
            List.of(new SqlAst.TableWithJoins(new SqlAst.Table(table, null), List.of())),
            where, List.of(), null);
    }

    @Test
    @DisplayName("clauses render in SQL order")
    void clauseOrder() {
        SqlAst.Select body = new SqlAst.Select(null, null, List.of("department", "COUNT(*) AS n"),
            List.of(new SqlAst.TableWithJoins(new SqlAst.Table("employees", "e"), List.of())),
            "age > 30", List.of("department"), "COUNT(*) > 1");
        SqlAst.Query query = new SqlAst.Query(List.of(), false, body, List.of("n DESC"), 10L, 5L, false);

        assertThat(query.toSql()).isEqualTo(
            "SELECT department, COUNT(*) AS n FROM employees AS e WHERE age > 30 "
                + "GROUP BY department HAVING COUNT(*) > 1 ORDER BY n DESC LIMIT 10 OFFSET 5");
    }

    @Test
    @DisplayName("TOP and FETCH render for MSSQL style limits")
    void topAndFetch() {
        SqlAst.Select top = new SqlAst.Select(null, 3L, List.of("*"),
            List.of(new SqlAst.TableWithJoins(new SqlAst.Table("t", null), List.of())), null, List.of(), null);
        assertThat(SqlAst.Query.of(top).toSql()).isEqualTo("SELECT TOP (3) * FROM t");

        SqlAst.Query fetch = new SqlAst.Query(List.of(), false, select(List.of("*"), "t", null),
            List.of("(SELECT NULL)"), 5L, 10L, true);
        assertThat(fetch.toSql())
            .isEqualTo("SELECT * FROM t ORDER BY (SELECT NULL) OFFSET 10 ROWS FETCH NEXT 5 ROWS ONLY");
    }

    @Test
    @DisplayName("CTEs are prepended and RECURSIVE is sticky")
    void ctes() {
        SqlAst.Query inner = SqlAst.Query.of(select(List.of("a"), "t", null));
        SqlAst.Query main = SqlAst.Query.of(select(List.of("a"), "table_1", null))
            .withCtes(List.of(new SqlAst.Cte("table_1", SqlAst.Query.of(select(List.of("a"), "table_0", null)))),
                      false)
            .withCtes(List.of(new SqlAst.Cte("table_0", inner)), true);

        assertThat(main.recursive()).isTrue();
        assertThat(main.toSql()).isEqualTo(
            "WITH RECURSIVE table_0 AS (SELECT a FROM t), table_1 AS (SELECT a FROM table_0) "
                + "SELECT a FROM table_1");
    }

    @Test
    @DisplayName("joins and set operations")
    void joinsAndSetOperations() {
        SqlAst.Join join = new SqlAst.Join("LEFT JOIN", new SqlAst.Table("departments", "d"), "e.dept = d.id");
        SqlAst.Select left = new SqlAst.Select(null, null, List.of("e.name"),
            List.of(new SqlAst.TableWithJoins(new SqlAst.Table("employees", "e"), List.of(join))),
            null, List.of(), null);
        SqlAst.SetOperation union = new SqlAst.SetOperation("UNION", "ALL", left,
            SqlAst.Select.star(new SqlAst.Table("archive", null)));

        assertThat(SqlAst.Query.of(union).toSql()).isEqualTo(
            "SELECT e.name FROM employees AS e LEFT JOIN departments AS d ON e.dept = d.id "
                + "UNION ALL SELECT * FROM archive");
    }

    @Test
    @DisplayName("queries with a limit are not simple")
    void simplicity() {
        SqlAst.Query plain = SqlAst.Query.of(select(List.of("a"), "t", "a > 1"));
        SqlAst.Query limited = new SqlAst.Query(List.of(), false, plain.body(), List.of(), 1L, null, false);

        assertThat(plain.isSimple()).isTrue();
        assertThat(limited.isSimple()).isFalse();
        assertThat(SqlAst.Select.star(new SqlAst.Derived(limited, "table_0")).toSql())
            .isEqualTo("SELECT * FROM (SELECT a FROM t WHERE a > 1 LIMIT 1) AS table_0");
    }
}
