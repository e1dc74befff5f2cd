package org.carball.querymon.instrument;

/**
 * The wrapped database call. May throw whatever the underlying client throws.
 */
@FunctionalInterface
public interface QueryCall<T, E extends Exception> {

    T proceed() throws E;
}
