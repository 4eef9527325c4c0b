package com.dimensional.units;

/**
 * Base class for every failure raised by the units library.
 *
 * <p>All failures are local to one parse or one algebra call and are never retried: the same
 * input always fails the same way.
 */
public class UnitException extends RuntimeException {

    public UnitException(String message) {
        super(message);
    }
}
