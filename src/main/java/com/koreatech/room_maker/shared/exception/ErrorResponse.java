package com.koreatech.room_maker.shared.exception;

import io.swagger.v3.oas.annotations.media.Schema;
import org.springframework.http.HttpStatus;

import java.time.LocalDateTime;

@Schema(description = "에러 응답")
public record ErrorResponse(
    @Schema(description = "에러 발생 시각", example = "2026-10-18T12:00:00")
    LocalDateTime timestamp,

    @Schema(description = "에러 코드", example = "T001")
    String code,

    @Schema(description = "에러 메시지", example = "Wall type 'Generic - 200mm' already exists")
    String message,

    @Schema(description = "HTTP 상태 코드", example = "409")
    int status
) {
    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return of(errorCode.getStatus(), errorCode.getCode(), message);
    }

    public static ErrorResponse of(HttpStatus status, String code, String message) {
        return new ErrorResponse(LocalDateTime.now(), code, message, status.value());
    }
}
