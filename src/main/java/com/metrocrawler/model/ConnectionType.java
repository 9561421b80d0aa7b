package com.metrocrawler.model;

public enum ConnectionType {
    /** Consecutive stations on the same line. */
    ADJACENT,
    /** Passenger interchange between lines. */
    TRANSFER
}
