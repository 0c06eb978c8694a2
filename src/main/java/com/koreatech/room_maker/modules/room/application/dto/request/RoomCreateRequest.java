package com.koreatech.room_maker.modules.room.application.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record RoomCreateRequest(
    @NotNull(message = "room is required")
    @Valid
    RoomSpec room
) {}
