package com.pipesql.semantic;

import com.pipesql.diagnostic.Span;
import com.pipesql.exception.ErrorCodes;
import com.pipesql.exception.NameResolutionException;
import com.pipesql.ir.pl.Lineage;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Looks up column names in a frame.
 *
 * <p>Exact matches win. A computed column hides input columns of the same name,
 * and the most recently computed one wins. Columns of inputs match when only one
 * input knows the name; two inputs knowing it make the name ambiguous.
 */
public final class NameLookup {

    /** Prefix referring to the current relation. */
    public static final String THIS = "this";

    /** Prefix referring to the other relation of a join. */
    public static final String THAT = "that";

    private NameLookup() {
    }

    /**
     * Finds a column matching {@code parts} exactly.
     *
     * @return the column, or null when no known column matches
     * @throws NameResolutionException when more than one input knows the name
     */
    public static Lineage.Column.Single findExact(Lineage frame, List<String> parts, Span span) {
        if (parts.size() == 1) {
            String name = parts.get(0);
            Lineage.Column.Single computed = null;
            List<Lineage.Column.Single> namespaced = new ArrayList<>();
            for (Lineage.Column column : frame.columns()) {
                if (column instanceof Lineage.Column.Single single && name.equals(single.name())) {
                    if (single.namespace() == null) {
                        computed = single;
                    } else {
                        namespaced.add(single);
                    }
                }
            }
            if (computed != null) {
                return computed;
            }
            Set<String> namespaces = namespaced.stream()
                .map(Lineage.Column.Single::namespace)
                .collect(Collectors.toCollection(LinkedHashSet::new));
            if (namespaces.size() > 1) {
                String candidates = namespaces.stream()
                    .map(ns -> ns + "." + name)
                    .collect(Collectors.joining(", "));
                throw (NameResolutionException) new NameResolutionException(
                    ErrorCodes.AMBIGUOUS_NAME, "Ambiguous name `" + name + "`", span)
                    .withHint("could be any of: " + candidates);
            }
            return namespaced.isEmpty() ? null : namespaced.get(0);
        }
        if (parts.size() == 2) {
            for (Lineage.Column column : frame.columns()) {
                if (column instanceof Lineage.Column.Single single
                    && parts.get(0).equals(single.namespace())
                    && parts.get(1).equals(single.name())) {
                    return single;
                }
            }
        }
        return null;
    }

    /**
     * Returns the wildcards a bare name may belong to, or the wildcard of the named
     * input for a qualified name.
     */
    public static List<Lineage.Column.All> wildcards(Lineage frame, List<String> parts) {
        List<Lineage.Column.All> result = new ArrayList<>();
        for (Lineage.Column column : frame.columns()) {
            if (column instanceof Lineage.Column.All all) {
                if (parts.size() == 1 && !all.except().contains(parts.get(0))) {
                    result.add(all);
                } else if (parts.size() == 2 && all.inputName().equals(parts.get(0))) {
                    result.add(all);
                }
            }
        }
        return result;
    }

    /**
     * Names of the known columns, listed in hints of unknown-name errors.
     */
    public static String available(Lineage frame) {
        return frame.columns().stream()
            .filter(c -> c instanceof Lineage.Column.Single single && single.name() != null)
            .map(Lineage.Column::toString)
            .collect(Collectors.joining(", "));
    }
}
