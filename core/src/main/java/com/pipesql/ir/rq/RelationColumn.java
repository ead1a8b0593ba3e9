package com.pipesql.ir.rq;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A column exposed by a relation: a named (or unnamed) single column, or the
 * wildcard standing for all columns not otherwise known.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
    @JsonSubTypes.Type(value = RelationColumn.Single.class, name = "Single"),
    @JsonSubTypes.Type(value = RelationColumn.Wildcard.class, name = "Wildcard")
})
public sealed interface RelationColumn {

    Wildcard WILDCARD = new Wildcard();

    record Single(String name) implements RelationColumn {
        @Override
        public String toString() {
            return name == null ? "?" : name;
        }
    }

    record Wildcard() implements RelationColumn {
        @Override
        public String toString() {
            return "*";
        }
    }
}
