package com.metrocrawler.model;

import lombok.Value;

@Value
public class GeoPosition {
    double latitude;
    double longitude;
}
