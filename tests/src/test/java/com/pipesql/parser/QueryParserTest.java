package com.pipesql.parser;

import com.pipesql.ast.BinOp;
import com.pipesql.ast.Expr;
import com.pipesql.ast.ExprKind;
import com.pipesql.ast.Stmt;
import com.pipesql.exception.CompilationFailedException;
import com.pipesql.exception.ErrorKind;
import com.pipesql.lexer.Lexer;
import com.pipesql.lexer.Token;
import com.pipesql.lexer.TokenKind;
import com.pipesql.test.TestBase;
import com.pipesql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("QueryParser")
@Tag("parser")
@TestCategories.Unit
public class QueryParserTest extends TestBase {

    @Test
    @DisplayName("the main pipeline is a pipeline of calls")
    void mainPipeline() {
        List<Stmt> stmts = QueryParser.parse("from employees | filter has_dog | select salary");

        assertThat(stmts).hasSize(1);
        Stmt.StmtKind.VarDef main = (Stmt.StmtKind.VarDef) stmts.get(0).kind();
        assertThat(main.kind()).isEqualTo(Stmt.VarDefKind.MAIN);
        assertThat(main.value().kind()).isInstanceOf(ExprKind.Pipeline.class);

        List<Expr> steps = ((ExprKind.Pipeline) main.value().kind()).exprs();
        assertThat(steps).hasSize(3);
        assertThat(steps).allSatisfy(step -> assertThat(step.kind()).isInstanceOf(ExprKind.FuncCall.class));
        assertThat(((ExprKind.FuncCall) steps.get(0).kind()).name().toString()).isEqualTo("from");
    }

    @Test
    @DisplayName("new lines separate pipeline steps")
    void newLines() {
        List<Stmt> stmts = QueryParser.parse("from employees\nfilter has_dog\nselect salary\n");

        Stmt.StmtKind.VarDef main = (Stmt.StmtKind.VarDef) stmts.get(0).kind();
        assertThat(((ExprKind.Pipeline) main.value().kind()).exprs()).hasSize(3);
    }

    @Test
    @DisplayName("the header comes first and carries the target")
    void header() {
        List<Stmt> stmts = QueryParser.parse("prql target:sql.mssql\n\nfrom t");

        assertThat(stmts).hasSize(2);
        Stmt.StmtKind.Header header = (Stmt.StmtKind.Header) stmts.get(0).kind();
        assertThat(header.def().target()).isEqualTo("sql.mssql");
    }

    @Test
    @DisplayName("let declarations precede the main pipeline")
    void letDeclaration() {
        List<Stmt> stmts = QueryParser.parse("let top_paid = (from employees | sort {-salary} | take 5)\n\nfrom top_paid");

        assertThat(stmts).extracting(s -> ((Stmt.StmtKind.VarDef) s.kind()).kind())
            .containsExactly(Stmt.VarDefKind.LET, Stmt.VarDefKind.MAIN);
        assertThat(((Stmt.StmtKind.VarDef) stmts.get(0).kind()).name()).isEqualTo("top_paid");
    }

    @Test
    @DisplayName("multiplication binds tighter than addition")
    void precedence() {
        Expr expr = QueryParser.parseExpression("a + b * c");

        ExprKind.Binary add = (ExprKind.Binary) expr.kind();
        assertThat(add.op()).isEqualTo(BinOp.ADD);
        assertThat(((ExprKind.Binary) add.right().kind()).op()).isEqualTo(BinOp.MUL);
    }

    @Test
    @DisplayName("syntax errors are parse errors with a span")
    void syntaxError() {
        assertThatThrownBy(() -> QueryParser.parse("from t | select {a"))
            .isInstanceOfSatisfying(CompilationFailedException.class, e -> {
                assertThat(e.errors()).isNotEmpty();
                assertThat(e.errors().get(0).kind()).isEqualTo(ErrorKind.PARSE);
                assertThat(e.errors().get(0).span()).isNotNull();
            });
    }

    @Test
    @DisplayName("errors of statements after a broken one are reported too")
    void errorsInLaterStatements() {
        // Given: three statements, each with its own syntax error
        String source = "from e | select {a,, b}\nlet = 3\nfrom x | )";

        // When/Then: every statement contributes an error
        assertThatThrownBy(() -> QueryParser.parse(source))
            .isInstanceOfSatisfying(CompilationFailedException.class, e -> {
                assertThat(e.errors()).allSatisfy(error -> assertThat(error.kind()).isEqualTo(ErrorKind.PARSE));
                assertThat(e.errors()).extracting(error -> error.span().start())
                    .anySatisfy(start -> assertThat(start).isLessThan(23))
                    .anySatisfy(start -> assertThat(start).isBetween(24, 30))
                    .anySatisfy(start -> assertThat(start).isGreaterThanOrEqualTo(32));
            });
    }

    @Test
    @DisplayName("statements split at let declarations but not between pipeline lines")
    void statementBoundaries() {
        List<List<Token>> statements = QueryParser.splitStatements(
            Lexer.tokenize("@{binding_strength=1}\nlet a = (\n  from x\n)\nfrom a\nselect b"));

        assertThat(statements).hasSize(2);
        assertThat(statements.get(0).get(0).kind()).isEqualTo(TokenKind.ANNOTATE);
        assertThat(statements.get(1).get(0).value()).isEqualTo("from");
        assertThat(statements.get(1)).extracting(Token::kind).contains(TokenKind.NEW_LINE);
    }

    @Test
    @DisplayName("unknown header arguments are rejected")
    void unknownHeaderArgument() {
        assertThatThrownBy(() -> QueryParser.parse("prql dialect:sql.mssql\nfrom t"))
            .isInstanceOf(CompilationFailedException.class)
            .hasMessageContaining("Unknown query definition argument `dialect`");
    }
}
