package com.koreatech.room_maker.modules.elementtype.interfaces.controller;

import com.koreatech.room_maker.modules.elementtype.application.command.ElementTypeCreator;
import com.koreatech.room_maker.modules.elementtype.application.dto.request.FloorTypeCreateRequest;
import com.koreatech.room_maker.modules.elementtype.application.dto.request.WallTypeCreateRequest;
import com.koreatech.room_maker.modules.elementtype.application.dto.response.FloorTypeResponse;
import com.koreatech.room_maker.modules.elementtype.application.dto.response.WallTypeResponse;
import com.koreatech.room_maker.modules.elementtype.application.query.ElementTypeReader;
import com.koreatech.room_maker.modules.elementtype.interfaces.ElementTypeApi;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/documents/{documentId}")
@RequiredArgsConstructor
public class ElementTypeController implements ElementTypeApi {

    private final ElementTypeCreator elementTypeCreator;
    private final ElementTypeReader elementTypeReader;

    @PostMapping("/wall-types")
    public ResponseEntity<WallTypeResponse> addWallType(
            @PathVariable UUID documentId,
            @Valid @RequestBody WallTypeCreateRequest request
    ) {
        WallTypeResponse response = elementTypeCreator.createWallType(documentId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/wall-types")
    public ResponseEntity<List<WallTypeResponse>> getWallTypes(@PathVariable UUID documentId) {
        return ResponseEntity.ok(elementTypeReader.findWallTypes(documentId));
    }

    @PostMapping("/floor-types")
    public ResponseEntity<FloorTypeResponse> addFloorType(
            @PathVariable UUID documentId,
            @Valid @RequestBody FloorTypeCreateRequest request
    ) {
        FloorTypeResponse response = elementTypeCreator.createFloorType(documentId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/floor-types")
    public ResponseEntity<List<FloorTypeResponse>> getFloorTypes(@PathVariable UUID documentId) {
        return ResponseEntity.ok(elementTypeReader.findFloorTypes(documentId));
    }
}
