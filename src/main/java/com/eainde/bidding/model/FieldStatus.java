package com.eainde.bidding.model;

public enum FieldStatus {
    FOUND,
    NOT_FOUND,
    /** The owning agent failed for this field or did not finish in time. */
    UNAVAILABLE
}
