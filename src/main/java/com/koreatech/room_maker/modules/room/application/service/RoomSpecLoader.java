package com.koreatech.room_maker.modules.room.application.service;

import com.koreatech.room_maker.modules.room.application.dto.request.RoomCreateRequest;
import com.koreatech.room_maker.modules.room.application.dto.request.RoomSpec;
import com.koreatech.room_maker.shared.exception.BusinessException;
import com.koreatech.room_maker.shared.exception.ErrorCode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads a room specification file of the form {@code {"room": {"length_m", "width_m", "height_m"}}}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomSpecLoader {

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public RoomSpec load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT_VALUE,
                "Room specification not found: " + path.toAbsolutePath());
        }

        RoomCreateRequest request;
        try {
            request = objectMapper.readValue(path.toFile(), RoomCreateRequest.class);
        } catch (IOException e) {
            throw new BusinessException(ErrorCode.INVALID_INPUT_VALUE,
                "Malformed room specification " + path + ": " + e.getMessage(), e);
        }

        Set<ConstraintViolation<RoomCreateRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .map(ConstraintViolation::getMessage)
                .collect(Collectors.joining(", "));
            throw new BusinessException(ErrorCode.INVALID_INPUT_VALUE,
                "Invalid room specification " + path + ": " + message);
        }

        log.info("Loaded room specification from {}", path);
        return request.room();
    }
}
