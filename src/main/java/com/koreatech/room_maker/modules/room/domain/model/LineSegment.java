package com.koreatech.room_maker.modules.room.domain.model;

import com.koreatech.room_maker.shared.domain.Point3D;

/**
 * A bounded straight line between two points.
 */
public record LineSegment(Point3D start, Point3D end) {

    public double length() {
        return start.distanceTo(end);
    }
}
