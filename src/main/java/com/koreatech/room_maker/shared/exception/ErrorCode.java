package com.koreatech.room_maker.shared.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INVALID_INPUT_VALUE(HttpStatus.BAD_REQUEST, "C001", "Invalid input value"),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C002", "Internal server error"),
    DATA_CONFLICT(HttpStatus.CONFLICT, "C003", "Request conflicts with stored data"),

    // Document
    DOCUMENT_NOT_FOUND(HttpStatus.NOT_FOUND, "D001", "Document not found"),

    // Element type
    ELEMENT_TYPE_ALREADY_EXISTS(HttpStatus.CONFLICT, "T001", "Element type already exists"),

    // Room generation
    MISSING_HOST_ENTITY(HttpStatus.UNPROCESSABLE_ENTITY, "R001", "Required element type not found in document"),
    GEOMETRY_DEGENERATE(HttpStatus.BAD_REQUEST, "R002", "Room geometry is degenerate"),
    RESOLUTION_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, "R003", "Level resolution failed"),
    CREATION_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, "R004", "Element creation failed"),
    TRANSACTION_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, "R005", "Transaction commit failed");

    private final HttpStatus status;
    private final String code;
    private final String message;
}
