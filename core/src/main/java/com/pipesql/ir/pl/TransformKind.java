package com.pipesql.ir.pl;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.pipesql.ir.ColumnSort;
import com.pipesql.ir.JoinSide;
import com.pipesql.ir.WindowKind;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Resolved transforms and their arguments.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
    @JsonSubTypes.Type(value = TransformKind.Derive.class, name = "Derive"),
    @JsonSubTypes.Type(value = TransformKind.Select.class, name = "Select"),
    @JsonSubTypes.Type(value = TransformKind.Filter.class, name = "Filter"),
    @JsonSubTypes.Type(value = TransformKind.Aggregate.class, name = "Aggregate"),
    @JsonSubTypes.Type(value = TransformKind.Sort.class, name = "Sort"),
    @JsonSubTypes.Type(value = TransformKind.Take.class, name = "Take"),
    @JsonSubTypes.Type(value = TransformKind.Join.class, name = "Join"),
    @JsonSubTypes.Type(value = TransformKind.Group.class, name = "Group"),
    @JsonSubTypes.Type(value = TransformKind.Window.class, name = "Window"),
    @JsonSubTypes.Type(value = TransformKind.Append.class, name = "Append"),
    @JsonSubTypes.Type(value = TransformKind.Loop.class, name = "Loop")
})
public sealed interface TransformKind {

    record Derive(List<Expr> assigns) implements TransformKind {
        public Derive {
            assigns = List.copyOf(assigns);
        }

        @Override
        public String toString() {
            return "derive " + assigns;
        }
    }

    record Select(List<Expr> assigns) implements TransformKind {
        public Select {
            assigns = List.copyOf(assigns);
        }

        @Override
        public String toString() {
            return "select " + assigns;
        }
    }

    record Filter(Expr filter) implements TransformKind {
        @Override
        public String toString() {
            return "filter " + filter;
        }
    }

    record Aggregate(List<Expr> assigns) implements TransformKind {
        public Aggregate {
            assigns = List.copyOf(assigns);
        }

        @Override
        public String toString() {
            return "aggregate " + assigns;
        }
    }

    record Sort(List<ColumnSort<Expr>> by) implements TransformKind {
        public Sort {
            by = List.copyOf(by);
        }

        @Override
        public String toString() {
            return by.stream()
                .map(s -> (s.direction() == com.pipesql.ir.SortDirection.DESC ? "-" : "") + s.column())
                .collect(Collectors.joining(", ", "sort {", "}"));
        }
    }

    record Take(ExprKind.Range range) implements TransformKind {
        @Override
        public String toString() {
            return "take " + range;
        }
    }

    record Join(JoinSide side, Expr with, Expr filter) implements TransformKind {
        @Override
        public String toString() {
            return "join side:" + side.name().toLowerCase() + " " + with + " " + filter;
        }
    }

    /**
     * Group with its inner pipeline. The innermost input of {@code pipeline} is a
     * placeholder whose id is {@code param}; flattening substitutes the group's input.
     */
    record Group(List<Expr> by, Expr pipeline, int param) implements TransformKind {
        public Group {
            by = List.copyOf(by);
        }

        @Override
        public String toString() {
            return "group " + by + " (" + pipeline + ")";
        }
    }

    /** Window with its inner pipeline, placeholder as in {@link Group}. */
    record Window(WindowKind kind, ExprKind.Range range, Expr pipeline, int param) implements TransformKind {
        @Override
        public String toString() {
            return "window " + kind.name().toLowerCase() + ":" + range + " (" + pipeline + ")";
        }
    }

    record Append(Expr bottom) implements TransformKind {
        @Override
        public String toString() {
            return "append " + bottom;
        }
    }

    /** Recursive step, placeholder as in {@link Group}. */
    record Loop(Expr pipeline, int param) implements TransformKind {
        @Override
        public String toString() {
            return "loop (" + pipeline + ")";
        }
    }
}
