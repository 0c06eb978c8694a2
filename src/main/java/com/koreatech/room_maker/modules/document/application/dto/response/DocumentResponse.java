package com.koreatech.room_maker.modules.document.application.dto.response;

import com.koreatech.room_maker.modules.document.domain.model.Document;

import java.time.LocalDateTime;
import java.util.UUID;

public record DocumentResponse(
    UUID id,
    String name,
    String description,
    LocalDateTime createdAt,
    LocalDateTime updatedAt
) {
    public static DocumentResponse from(Document document) {
        return new DocumentResponse(
            document.getId(),
            document.getName(),
            document.getDescription(),
            document.getCreatedAt(),
            document.getUpdatedAt()
        );
    }
}
