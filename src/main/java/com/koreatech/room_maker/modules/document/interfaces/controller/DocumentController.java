package com.koreatech.room_maker.modules.document.interfaces.controller;

import com.koreatech.room_maker.modules.document.application.command.DocumentCreator;
import com.koreatech.room_maker.modules.document.application.dto.request.DocumentCreateRequest;
import com.koreatech.room_maker.modules.document.application.dto.response.DocumentDetailResponse;
import com.koreatech.room_maker.modules.document.application.dto.response.DocumentResponse;
import com.koreatech.room_maker.modules.document.application.query.DocumentReader;
import com.koreatech.room_maker.modules.document.interfaces.DocumentApi;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/documents")
@RequiredArgsConstructor
public class DocumentController implements DocumentApi {

    private final DocumentCreator documentCreator;
    private final DocumentReader documentReader;

    @PostMapping
    public ResponseEntity<DocumentResponse> createDocument(@Valid @RequestBody DocumentCreateRequest request) {
        DocumentResponse response = documentCreator.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<List<DocumentResponse>> getDocuments() {
        return ResponseEntity.ok(documentReader.findAll());
    }

    @GetMapping("/{id}")
    public ResponseEntity<DocumentDetailResponse> getDocument(@PathVariable UUID id) {
        return ResponseEntity.ok(documentReader.findById(id));
    }
}
