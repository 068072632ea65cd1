package com.ospicorp.locationtracker.coordinates;

import java.util.List;

/** San Francisco landmarks written by the test-data endpoint. Ids are fixed, so rewrites overwrite. */
final class SampleCoordinates {

  static final List<Coordinate> SAN_FRANCISCO = List.of(
      new Coordinate("test-1", "Golden Gate Bridge", 37.8199, -122.4783),
      new Coordinate("test-2", "Alcatraz Island", 37.8267, -122.4233),
      new Coordinate("test-3", "Fisherman's Wharf", 37.8080, -122.4177),
      new Coordinate("test-4", "Lombard Street", 37.8021, -122.4187),
      new Coordinate("test-5", "Union Square", 37.7880, -122.4074));

  private SampleCoordinates() {
  }
}
