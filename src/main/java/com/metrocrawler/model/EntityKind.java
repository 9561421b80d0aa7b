package com.metrocrawler.model;

public enum EntityKind {
    SYSTEM,
    LINE,
    STATION
}
