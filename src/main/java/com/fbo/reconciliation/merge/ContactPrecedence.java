package com.fbo.reconciliation.merge;

/**
 * How contact, fee and rating conflicts are settled when both records carry a
 * non-import provenance label and both have a value for the field.
 */
public enum ContactPrecedence {
    /**
     * The incoming value wins only when the incoming record is at least as recent as the
     * existing one.
     */
    MOST_RECENT,

    /**
     * The incoming value always wins.
     */
    INCOMING_WINS
}
