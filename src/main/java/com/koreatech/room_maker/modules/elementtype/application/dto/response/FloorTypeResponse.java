package com.koreatech.room_maker.modules.elementtype.application.dto.response;

import com.koreatech.room_maker.modules.elementtype.domain.model.FloorType;

import java.util.UUID;

public record FloorTypeResponse(
    UUID id,
    String name,
    Double thickness
) {
    public static FloorTypeResponse from(FloorType floorType) {
        return new FloorTypeResponse(floorType.getId(), floorType.getName(), floorType.getThickness());
    }
}
