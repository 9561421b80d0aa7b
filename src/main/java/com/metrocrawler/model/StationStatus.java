package com.metrocrawler.model;

/**
 * Why a station is not (yet or any more) in service. Stations in service have
 * no status.
 */
public enum StationStatus {
    PLANNED,
    UNDER_CONSTRUCTION,
    CLOSED
}
