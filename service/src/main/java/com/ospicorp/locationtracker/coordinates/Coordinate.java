package com.ospicorp.locationtracker.coordinates;

public record Coordinate(String id, String title, double latitude, double longitude) {}
