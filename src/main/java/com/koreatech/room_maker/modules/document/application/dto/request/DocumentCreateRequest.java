package com.koreatech.room_maker.modules.document.application.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record DocumentCreateRequest(
    @NotBlank(message = "Document name is required")
    @Size(max = 100, message = "Document name must be at most 100 characters")
    String name,

    @Size(max = 1000, message = "Description must be at most 1000 characters")
    String description
) {}
