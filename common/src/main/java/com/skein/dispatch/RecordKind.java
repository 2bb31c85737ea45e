package com.skein.dispatch;

/**
 * A record type the indexer understands.  Implemented by an enum in the domain module,
 * one constant per collection.
 */
public interface RecordKind {

    /** Collection NSID, e.g. {@code pub.chive.eprint.submission}. */
    String getCollection();

    /** Class the record JSON is decoded into before it reaches a handler. */
    Class<?> getRecordClass();
}
