package com.pipesql.sql.gen;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SQL spelling of a standard library function.
 *
 * <p>Placeholders refer to arguments by position: {@code {0}} or {@code {0:11}},
 * where the number after the colon is the binding strength the argument must
 * have to be written without parentheses. Without it, the template's own
 * strength applies.
 *
 * @param parts template text split at placeholders
 * @param bindingStrength strength of the rendered expression, or null for the default
 * @param windowFrame whether a window frame may be attached when used as a window function
 * @param coalesce value substituted for NULL outside of windows, or null
 */
public record OperatorTemplate(List<Part> parts, Integer bindingStrength, boolean windowFrame, String coalesce) {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\d+)(?::(\\d+))?}");

    public sealed interface Part {}

    public record Text(String text) implements Part {}

    public record Arg(int index, Integer strength) implements Part {}

    public OperatorTemplate {
        parts = List.copyOf(parts);
    }

    public static OperatorTemplate of(String template) {
        return new OperatorTemplate(parse(template), null, false, null);
    }

    public OperatorTemplate withStrength(int strength) {
        return new OperatorTemplate(parts, strength, windowFrame, coalesce);
    }

    public OperatorTemplate withWindowFrame() {
        return new OperatorTemplate(parts, bindingStrength, true, coalesce);
    }

    public OperatorTemplate withCoalesce(String value) {
        return new OperatorTemplate(parts, bindingStrength, windowFrame, value);
    }

    /** Number of arguments the template refers to. */
    public int arity() {
        int max = -1;
        for (Part part : parts) {
            if (part instanceof Arg arg) {
                max = Math.max(max, arg.index());
            }
        }
        return max + 1;
    }

    static List<Part> parse(String template) {
        List<Part> parts = new ArrayList<>();
        Matcher m = PLACEHOLDER.matcher(template);
        int last = 0;
        while (m.find()) {
            if (m.start() > last) {
                parts.add(new Text(template.substring(last, m.start())));
            }
            Integer strength = m.group(2) == null ? null : Integer.valueOf(m.group(2));
            parts.add(new Arg(Integer.parseInt(m.group(1)), strength));
            last = m.end();
        }
        if (last < template.length()) {
            parts.add(new Text(template.substring(last)));
        }
        return parts;
    }
}
