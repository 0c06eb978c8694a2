package com.koreatech.room_maker.shared.domain;

import jakarta.persistence.Embeddable;
import lombok.*;
import org.locationtech.jts.geom.Coordinate;

/**
 * A point in document length units (feet). Embedded into element tables as x/y/z columns.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class Point3D {

    private Double x;
    private Double y;
    private Double z;

    public static Point3D of(double x, double y, double z) {
        return new Point3D(x, y, z);
    }

    public Point3D copy() {
        return new Point3D(x, y, z);
    }

    public double distanceTo(Point3D other) {
        double dx = this.x - other.x;
        double dy = this.y - other.y;
        double dz = this.z - other.z;
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }

    public Coordinate toCoordinate() {
        return new Coordinate(x, y, z);
    }

    @Override
    public String toString() {
        return String.format("(%.4f, %.4f, %.4f)", x, y, z);
    }
}
