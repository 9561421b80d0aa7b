package com.metrocrawler.model;

public enum IdStrategy {
    ENTITY_ID,
    NAME
}
