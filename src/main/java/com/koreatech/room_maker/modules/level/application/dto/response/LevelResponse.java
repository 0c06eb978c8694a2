package com.koreatech.room_maker.modules.level.application.dto.response;

import com.koreatech.room_maker.modules.level.domain.model.Level;

import java.util.UUID;

public record LevelResponse(
    UUID id,
    String name,
    double elevation
) {
    public static LevelResponse from(Level level) {
        return new LevelResponse(level.getId(), level.getName(), level.getElevation());
    }
}
