package com.koreatech.room_maker.modules.room.domain.model;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;

import java.util.List;

/**
 * Ordered sequence of segments where each segment ends where the next one starts.
 * The same loop bounds both the walls and the floor of a room.
 */
public final class CurveLoop {

    private final List<LineSegment> segments;

    public CurveLoop(List<LineSegment> segments) {
        this.segments = List.copyOf(segments);
    }

    public List<LineSegment> getSegments() {
        return segments;
    }

    public int size() {
        return segments.size();
    }

    /**
     * Index of the first segment whose end point differs from the start of its successor, or -1.
     */
    public int findDiscontinuity() {
        for (int i = 0; i < segments.size(); i++) {
            LineSegment current = segments.get(i);
            LineSegment next = segments.get((i + 1) % segments.size());
            if (!current.end().equals(next.start())) {
                return i;
            }
        }
        return -1;
    }

    public boolean isClosed() {
        return !segments.isEmpty()
            && segments.get(segments.size() - 1).end().equals(segments.get(0).start());
    }

    /**
     * Loop vertices with the first repeated at the end, as JTS rings expect.
     */
    public Coordinate[] toCoordinates() {
        Coordinate[] coordinates = new Coordinate[segments.size() + 1];
        for (int i = 0; i < segments.size(); i++) {
            coordinates[i] = segments.get(i).start().toCoordinate();
        }
        coordinates[segments.size()] = segments.get(0).start().toCoordinate();
        return coordinates;
    }

    public LinearRing toLinearRing(GeometryFactory geometryFactory) {
        return geometryFactory.createLinearRing(toCoordinates());
    }

    public Polygon toPolygon(GeometryFactory geometryFactory) {
        return geometryFactory.createPolygon(toLinearRing(geometryFactory));
    }
}
