package com.koreatech.room_maker.modules.room.interfaces.controller;

import com.koreatech.room_maker.modules.room.application.command.RoomCreator;
import com.koreatech.room_maker.modules.room.application.dto.request.RoomCreateRequest;
import com.koreatech.room_maker.modules.room.application.dto.response.RoomCreationResult;
import com.koreatech.room_maker.modules.room.interfaces.RoomApi;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequiredArgsConstructor
public class RoomController implements RoomApi {

    private final RoomCreator roomCreator;

    @PostMapping("/api/v1/documents/{documentId}/rooms")
    public ResponseEntity<RoomCreationResult> createRoom(
            @PathVariable UUID documentId,
            @Valid @RequestBody RoomCreateRequest request
    ) {
        RoomCreationResult result = roomCreator.create(documentId, request.room());
        HttpStatus status = result.committed() ? HttpStatus.CREATED : result.errorCode().getStatus();
        return ResponseEntity.status(status).body(result);
    }
}
