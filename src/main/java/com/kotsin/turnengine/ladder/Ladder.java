package com.kotsin.turnengine.ladder;

/**
 * Clamped stepping over an ordered enum whose constants are declared worst to best.
 */
public final class Ladder {

    private Ladder() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Move {@code steps} rungs toward the best value (negative moves toward the worst),
     * stopping at either end.
     */
    public static <E extends Enum<E>> E shift(E value, int steps) {
        E[] rungs = value.getDeclaringClass().getEnumConstants();
        int target = (int) Math.max(0, Math.min(rungs.length - 1, (long) value.ordinal() + steps));
        return rungs[target];
    }

    public static <E extends Enum<E>> boolean isTop(E value) {
        return value.ordinal() == value.getDeclaringClass().getEnumConstants().length - 1;
    }

    public static <E extends Enum<E>> boolean isBottom(E value) {
        return value.ordinal() == 0;
    }
}
