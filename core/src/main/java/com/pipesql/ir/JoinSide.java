package com.pipesql.ir;

/**
 * Join kinds accepted by the {@code join} transform.
 */
public enum JoinSide {
    INNER,
    LEFT,
    RIGHT,
    FULL;

    /**
     * Parses the value of the {@code side:} argument.
     *
     * @return the side, or null when the name is not a join side
     */
    public static JoinSide parse(String name) {
        return switch (name) {
            case "inner" -> INNER;
            case "left" -> LEFT;
            case "right" -> RIGHT;
            case "full" -> FULL;
            default -> null;
        };
    }
}
