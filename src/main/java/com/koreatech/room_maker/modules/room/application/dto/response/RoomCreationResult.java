package com.koreatech.room_maker.modules.room.application.dto.response;

import com.koreatech.room_maker.modules.floor.domain.model.Floor;
import com.koreatech.room_maker.modules.room.domain.model.ResolvedModel;
import com.koreatech.room_maker.modules.room.domain.model.RoomDimensions;
import com.koreatech.room_maker.modules.wall.domain.model.Wall;
import com.koreatech.room_maker.shared.domain.BaseEntity;
import com.koreatech.room_maker.shared.exception.ErrorCode;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of one room generation run. Either everything was committed, or nothing was and
 * {@code errorCode} tells why.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoomCreationResult(
    boolean committed,
    ErrorCode errorCode,
    String message,
    UUID documentId,
    UUID levelId,
    Boolean levelCreated,
    UUID wallTypeId,
    UUID floorTypeId,
    List<UUID> wallIds,
    UUID floorId,
    RoomDimensions dimensions
) {
    public static RoomCreationResult committed(ResolvedModel model, List<Wall> walls, Floor floor,
                                               RoomDimensions dimensions) {
        return new RoomCreationResult(
            true,
            null,
            "Room created",
            model.document().getId(),
            model.level().getId(),
            model.levelCreated(),
            model.wallType().getId(),
            model.floorType().getId(),
            walls.stream().map(BaseEntity::getId).toList(),
            floor.getId(),
            dimensions
        );
    }

    public static RoomCreationResult failed(UUID documentId, ErrorCode errorCode, String message) {
        return new RoomCreationResult(
            false,
            errorCode,
            message,
            documentId,
            null,
            null,
            null,
            null,
            List.of(),
            null,
            null
        );
    }
}
