package com.skein.saga;

/**
 * Derives a record's {@link IndexProjection}.  May read from the stores (e.g. to
 * resolve labels) but must not write to them.
 */
@FunctionalInterface
public interface Projector {

    IndexProjection project() throws Exception;
}
