package com.koreatech.room_maker.modules.elementtype.application.dto.request;

import com.koreatech.room_maker.modules.elementtype.domain.model.WallKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record WallTypeCreateRequest(
    @NotBlank(message = "Wall type name is required")
    @Size(max = 100, message = "Wall type name must be at most 100 characters")
    String name,

    @NotNull(message = "Wall kind is required")
    WallKind kind,

    @Positive(message = "Width must be positive")
    Double width
) {}
