package com.koreatech.room_maker.modules.room.application.service;

import com.koreatech.room_maker.shared.domain.Point3D;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class RectangleGeometryBuilder {

    /**
     * Footprint corners on the z=0 plane, counter-clockwise from the origin:
     * (0,0), (L,0), (L,W), (0,W).
     */
    public List<Point3D> buildCorners(double length, double width) {
        return List.of(
            Point3D.of(0, 0, 0),
            Point3D.of(length, 0, 0),
            Point3D.of(length, width, 0),
            Point3D.of(0, width, 0)
        );
    }
}
