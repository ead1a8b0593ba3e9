package com.pipesql.ir.rq;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
    @JsonSubTypes.Type(value = RelationKind.ExternRef.class, name = "ExternRef"),
    @JsonSubTypes.Type(value = RelationKind.Pipeline.class, name = "Pipeline"),
    @JsonSubTypes.Type(value = RelationKind.Literal.class, name = "Literal"),
    @JsonSubTypes.Type(value = RelationKind.SString.class, name = "SString")
})
public sealed interface RelationKind {

    /** A table of the database, by its (possibly schema qualified) name. */
    record ExternRef(List<String> parts) implements RelationKind {
        public ExternRef {
            parts = List.copyOf(parts);
        }
    }

    /** A sequence of transforms, always ending with a Select. */
    record Pipeline(List<Transform> transforms) implements RelationKind {
        public Pipeline {
            transforms = List.copyOf(transforms);
        }
    }

    /** Rows written in the query itself. */
    record Literal(List<String> columns, List<List<com.pipesql.ir.Literal>> rows) implements RelationKind {
        public Literal {
            columns = List.copyOf(columns);
            rows = rows.stream().map(List::copyOf).toList();
        }
    }

    record SString(List<InterpolateItem> items) implements RelationKind {
        public SString {
            items = List.copyOf(items);
        }
    }
}
