package com.dimensional.units;

/** Two units were combined additively although their dimensions differ (e.g. mass + length). */
public class DimensionMismatchException extends UnitException {

    private final UnitComposition left;
    private final UnitComposition right;

    public DimensionMismatchException(UnitComposition left, UnitComposition right) {
        super("Cannot add '%s' and '%s': dimensions differ".formatted(left.render(), right.render()));
        this.left = left;
        this.right = right;
    }

    public UnitComposition left() {
        return left;
    }

    public UnitComposition right() {
        return right;
    }
}
