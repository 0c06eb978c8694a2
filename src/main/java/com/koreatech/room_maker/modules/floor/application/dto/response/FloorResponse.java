package com.koreatech.room_maker.modules.floor.application.dto.response;

import com.koreatech.room_maker.modules.floor.domain.model.Floor;

import java.util.UUID;

public record FloorResponse(
    UUID id,
    UUID levelId,
    UUID floorTypeId,
    int boundarySegmentCount,
    Double area
) {
    public static FloorResponse from(Floor floor) {
        return new FloorResponse(
            floor.getId(),
            floor.getLevel().getId(),
            floor.getFloorType().getId(),
            floor.getBoundary().size(),
            floor.getArea()
        );
    }
}
