package com.pipesql.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipesql.exception.LoweringException;
import com.pipesql.ir.pl.Stmt;
import com.pipesql.ir.rq.RelationalQuery;
import com.pipesql.lowering.Lowerer;
import com.pipesql.parser.QueryParser;
import com.pipesql.semantic.AstExpander;
import com.pipesql.semantic.Resolver;
import com.pipesql.test.TestBase;
import com.pipesql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("IrJson")
@TestCategories.Unit
public class IrJsonTest extends TestBase {

    private static final String QUERY = "from employees | filter age > 30 | select {name, salary}";

    private static List<Stmt> pl(String source) {
        return AstExpander.expand(QueryParser.parse(source));
    }

    @Test
    @DisplayName("PL survives a trip through JSON")
    void plRoundTrip() {
        String json = IrJson.plToJson(pl(QUERY));

        assertThat(IrJson.plToJson(IrJson.plFromJson(json))).isEqualTo(json);
    }

    @Test
    @DisplayName("RQ survives a trip through JSON")
    void rqRoundTrip() {
        RelationalQuery rq = Lowerer.lower(Resolver.resolve(pl(QUERY)));
        String json = IrJson.rqToJson(rq);

        RelationalQuery decoded = IrJson.rqFromJson(json);

        assertThat(IrJson.rqToJson(decoded)).isEqualTo(json);
        assertThat(decoded.tables()).hasSameSizeAs(rq.tables());
    }

    @Test
    @DisplayName("RQ JSON lists the tables the query reads")
    void rqShape() throws Exception {
        String json = IrJson.rqToJson(Lowerer.lower(Resolver.resolve(pl(QUERY))));

        JsonNode root = IrJson.mapper().readTree(json);
        assertThat(root.has("tables")).isTrue();
        assertThat(root.has("relation")).isTrue();
        assertThat(json).contains("employees");
    }

    @Test
    @DisplayName("malformed input is a lowering error")
    void invalidJson() {
        assertThatThrownBy(() -> IrJson.rqFromJson("{\"tables\": ["))
            .isInstanceOf(LoweringException.class)
            .hasMessageContaining("Invalid RQ JSON");
        assertThatThrownBy(() -> IrJson.plFromJson("not json"))
            .isInstanceOf(LoweringException.class)
            .hasMessageContaining("Invalid PL JSON");
    }
}
