package com.koreatech.room_maker.shared.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class EntityNotFoundException extends BusinessException {

    private final UUID entityId;

    public EntityNotFoundException(ErrorCode errorCode, UUID entityId) {
        super(errorCode, errorCode.getMessage() + ": " + entityId);
        this.entityId = entityId;
    }
}
