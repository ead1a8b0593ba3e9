package com.pipesql.api;

import com.pipesql.sql.Target;

/**
 * Options of a compilation.
 *
 * <pre>{@code
 * CompileOptions options = CompileOptions.builder()
 *     .target("sql.postgres")
 *     .signatureComment(false)
 *     .build();
 * }</pre>
 */
public final class CompileOptions {

    private static final CompileOptions DEFAULTS = builder().build();

    private final boolean format;
    private final String target;
    private final boolean signatureComment;
    private final boolean color;

    private CompileOptions(Builder builder) {
        this.format = builder.format;
        this.target = builder.target;
        this.signatureComment = builder.signatureComment;
        this.color = builder.color;
    }

    public static CompileOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Whether the SQL is pretty-printed. */
    public boolean format() {
        return format;
    }

    /** Target name, {@code sql.any} to use the target of the query header. */
    public String target() {
        return target;
    }

    public boolean signatureComment() {
        return signatureComment;
    }

    /** Accepted for compatibility; output is always plain text. */
    public boolean color() {
        return color;
    }

    public Builder toBuilder() {
        return new Builder()
            .format(format)
            .target(target)
            .signatureComment(signatureComment)
            .color(color);
    }

    @Override
    public String toString() {
        return "CompileOptions{format=" + format + ", target=" + target
            + ", signatureComment=" + signatureComment + "}";
    }

    public static class Builder {
        private boolean format = true;
        private String target = Target.ANY_NAME;
        private boolean signatureComment = true;
        private boolean color;

        public Builder format(boolean format) {
            this.format = format;
            return this;
        }

        /**
         * Sets the target.
         *
         * @throws IllegalArgumentException if the name is not a known target
         */
        public Builder target(String target) {
            Target.parse(target);
            this.target = target == null ? Target.ANY_NAME : target;
            return this;
        }

        public Builder signatureComment(boolean signatureComment) {
            this.signatureComment = signatureComment;
            return this;
        }

        public Builder color(boolean color) {
            this.color = color;
            return this;
        }

        public CompileOptions build() {
            return new CompileOptions(this);
        }
    }
}
