package com.pipesql.ir.pl;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The frame of a relation: its ordered columns and the inputs they come from.
 *
 * <p>Each input is a namespace. A column is either a single named (or unnamed)
 * column, or the wildcard of one input meaning "every column of that input not
 * otherwise known".
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class Lineage {

    @JsonProperty("columns")
    private final List<Column> columns;

    @JsonProperty("inputs")
    private final List<Input> inputs;

    @JsonCreator
    public Lineage(@JsonProperty("columns") List<Column> columns,
                   @JsonProperty("inputs") List<Input> inputs) {
        this.columns = columns == null ? new ArrayList<>() : new ArrayList<>(columns);
        this.inputs = inputs == null ? new ArrayList<>() : new ArrayList<>(inputs);
    }

    public Lineage() {
        this(null, null);
    }

    public Lineage copy() {
        return new Lineage(columns, inputs);
    }

    public List<Column> columns() {
        return columns;
    }

    public List<Input> inputs() {
        return inputs;
    }

    public Input findInput(String name) {
        for (Input input : inputs) {
            if (input.name().equals(name)) {
                return input;
            }
        }
        return null;
    }

    /**
     * Renames every input to the given alias, as in {@code from e = employees}.
     */
    public void rename(String alias) {
        for (int i = 0; i < inputs.size(); i++) {
            Input input = inputs.get(i);
            inputs.set(i, new Input(input.id(), alias, input.table()));
        }
        for (int i = 0; i < columns.size(); i++) {
            Column column = columns.get(i);
            if (column instanceof Column.All all) {
                columns.set(i, new Column.All(alias, all.except()));
            } else {
                Column.Single single = (Column.Single) column;
                if (single.name() != null) {
                    columns.set(i, new Column.Single(alias, single.name(), single.targetId(), single.targetName()));
                }
            }
        }
    }

    /**
     * Names of the known columns, qualified with their input where they have one.
     */
    public List<String> displayNames() {
        List<String> names = new ArrayList<>();
        for (Column column : columns) {
            names.add(column.toString());
        }
        return names;
    }

    @Override
    public String toString() {
        return columns.stream().map(Column::toString).collect(Collectors.joining(", ", "[", "]"));
    }

    /**
     * A relation input in scope: a table instance or a nested relation.
     *
     * @param id id of the expression that declares the input
     * @param name local name, the alias or the table's own name
     * @param table fully qualified name of the table declaration
     */
    public record Input(int id, String name, String table) {
        public Input {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
    @JsonSubTypes({
        @JsonSubTypes.Type(value = Column.Single.class, name = "Single"),
        @JsonSubTypes.Type(value = Column.All.class, name = "All")
    })
    public sealed interface Column {

        /**
         * @param namespace input the column belongs to, or null for computed columns
         * @param name column name, or null when the column is unnamed
         * @param targetId id of the defining expression or input
         * @param targetName name within the input when the target is an input
         */
        @JsonInclude(JsonInclude.Include.NON_NULL)
        record Single(String namespace, String name, int targetId, String targetName) implements Column {
            @Override
            public String toString() {
                if (name == null) {
                    return "?";
                }
                return namespace == null ? name : namespace + "." + name;
            }
        }

        record All(String inputName, Set<String> except) implements Column {
            public All {
                except = except == null ? Set.of() : new LinkedHashSet<>(except);
            }

            @Override
            public String toString() {
                return inputName + ".*";
            }
        }
    }
}
