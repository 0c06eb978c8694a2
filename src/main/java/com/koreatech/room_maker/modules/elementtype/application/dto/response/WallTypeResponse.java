package com.koreatech.room_maker.modules.elementtype.application.dto.response;

import com.koreatech.room_maker.modules.elementtype.domain.model.WallKind;
import com.koreatech.room_maker.modules.elementtype.domain.model.WallType;

import java.util.UUID;

public record WallTypeResponse(
    UUID id,
    String name,
    WallKind kind,
    Double width
) {
    public static WallTypeResponse from(WallType wallType) {
        return new WallTypeResponse(
            wallType.getId(),
            wallType.getName(),
            wallType.getKind(),
            wallType.getWidth()
        );
    }
}
