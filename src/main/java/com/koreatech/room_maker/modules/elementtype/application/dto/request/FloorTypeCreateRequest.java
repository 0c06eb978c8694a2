package com.koreatech.room_maker.modules.elementtype.application.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record FloorTypeCreateRequest(
    @NotBlank(message = "Floor type name is required")
    @Size(max = 100, message = "Floor type name must be at most 100 characters")
    String name,

    @Positive(message = "Thickness must be positive")
    Double thickness
) {}
