package com.koreatech.room_maker.modules.wall.application.dto.response;

import com.koreatech.room_maker.modules.wall.domain.model.Wall;
import com.koreatech.room_maker.shared.domain.Point3D;

import java.util.UUID;

public record WallResponse(
    UUID id,
    UUID levelId,
    UUID wallTypeId,
    int sequenceOrder,
    PointResponse start,
    PointResponse end,
    double height,
    Double length
) {
    public record PointResponse(double x, double y, double z) {
        public static PointResponse from(Point3D point) {
            return new PointResponse(point.getX(), point.getY(), point.getZ());
        }
    }

    public static WallResponse from(Wall wall) {
        return new WallResponse(
            wall.getId(),
            wall.getLevel().getId(),
            wall.getWallType().getId(),
            wall.getSequenceOrder(),
            PointResponse.from(wall.getStartPoint()),
            PointResponse.from(wall.getEndPoint()),
            wall.getHeight(),
            wall.getLength()
        );
    }
}
