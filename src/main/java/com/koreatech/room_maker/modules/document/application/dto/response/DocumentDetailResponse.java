package com.koreatech.room_maker.modules.document.application.dto.response;

import com.koreatech.room_maker.modules.document.domain.model.Document;
import com.koreatech.room_maker.modules.elementtype.application.dto.response.FloorTypeResponse;
import com.koreatech.room_maker.modules.elementtype.application.dto.response.WallTypeResponse;
import com.koreatech.room_maker.modules.floor.application.dto.response.FloorResponse;
import com.koreatech.room_maker.modules.level.application.dto.response.LevelResponse;
import com.koreatech.room_maker.modules.wall.application.dto.response.WallResponse;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public record DocumentDetailResponse(
    UUID id,
    String name,
    String description,
    List<LevelResponse> levels,
    List<WallTypeResponse> wallTypes,
    List<FloorTypeResponse> floorTypes,
    List<WallResponse> walls,
    List<FloorResponse> floors,
    LocalDateTime createdAt,
    LocalDateTime updatedAt
) {
    public static DocumentDetailResponse of(
            Document document,
            List<LevelResponse> levels,
            List<WallTypeResponse> wallTypes,
            List<FloorTypeResponse> floorTypes,
            List<WallResponse> walls,
            List<FloorResponse> floors
    ) {
        return new DocumentDetailResponse(
            document.getId(),
            document.getName(),
            document.getDescription(),
            levels,
            wallTypes,
            floorTypes,
            walls,
            floors,
            document.getCreatedAt(),
            document.getUpdatedAt()
        );
    }
}
