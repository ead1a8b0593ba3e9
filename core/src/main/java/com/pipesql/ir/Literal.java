package com.pipesql.ir;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Literal values shared by every intermediate representation.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
    @JsonSubTypes.Type(value = Literal.Null.class, name = "Null"),
    @JsonSubTypes.Type(value = Literal.Int.class, name = "Integer"),
    @JsonSubTypes.Type(value = Literal.Real.class, name = "Float"),
    @JsonSubTypes.Type(value = Literal.Bool.class, name = "Boolean"),
    @JsonSubTypes.Type(value = Literal.Str.class, name = "String"),
    @JsonSubTypes.Type(value = Literal.Date.class, name = "Date"),
    @JsonSubTypes.Type(value = Literal.Time.class, name = "Time"),
    @JsonSubTypes.Type(value = Literal.Timestamp.class, name = "Timestamp"),
    @JsonSubTypes.Type(value = Literal.ValueAndUnit.class, name = "ValueAndUnit")
})
public sealed interface Literal {

    Null NULL = new Null();

    record Null() implements Literal {
        @Override
        public String toString() {
            return "null";
        }
    }

    record Int(long value) implements Literal {
        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    record Real(double value) implements Literal {
        @Override
        public String toString() {
            return BigDecimal.valueOf(value).toPlainString();
        }
    }

    record Bool(boolean value) implements Literal {
        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    record Str(String value) implements Literal {
        public Str {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String toString() {
            return '"' + value + '"';
        }
    }

    record Date(String value) implements Literal {
        @Override
        public String toString() {
            return "@" + value;
        }
    }

    record Time(String value) implements Literal {
        @Override
        public String toString() {
            return "@" + value;
        }
    }

    record Timestamp(String value) implements Literal {
        @Override
        public String toString() {
            return "@" + value;
        }
    }

    record ValueAndUnit(long n, String unit) implements Literal {
        @Override
        public String toString() {
            return n + unit;
        }
    }
}
