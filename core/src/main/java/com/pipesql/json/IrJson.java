package com.pipesql.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.pipesql.exception.LoweringException;
import com.pipesql.ir.pl.Stmt;
import com.pipesql.ir.rq.RelationalQuery;

import java.util.List;

/**
 * JSON encoding of the intermediate representations.
 *
 * <p>Polymorphic nodes are written as single-key wrapper objects such as
 * {@code {"FuncCall": {...}}}; absent optional fields are omitted.
 */
public final class IrJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private static final TypeReference<List<Stmt>> STMTS = new TypeReference<>() {
    };

    private IrJson() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String plToJson(List<Stmt> stmts) {
        return write(stmts);
    }

    public static List<Stmt> plFromJson(String json) {
        try {
            return MAPPER.readValue(json, STMTS);
        } catch (JsonProcessingException e) {
            throw new LoweringException("Invalid PL JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static String rqToJson(RelationalQuery query) {
        return write(query);
    }

    public static RelationalQuery rqFromJson(String json) {
        try {
            return MAPPER.readValue(json, RelationalQuery.class);
        } catch (JsonProcessingException e) {
            throw new LoweringException("Invalid RQ JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
