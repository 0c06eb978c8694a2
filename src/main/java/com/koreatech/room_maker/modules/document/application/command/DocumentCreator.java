package com.koreatech.room_maker.modules.document.application.command;

import com.koreatech.room_maker.modules.document.application.dto.request.DocumentCreateRequest;
import com.koreatech.room_maker.modules.document.application.dto.response.DocumentResponse;
import com.koreatech.room_maker.modules.document.domain.model.Document;
import com.koreatech.room_maker.modules.document.domain.repository.DocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class DocumentCreator {

    private final DocumentRepository documentRepository;

    public DocumentResponse create(DocumentCreateRequest request) {
        Document document = Document.builder()
            .name(request.name())
            .description(request.description())
            .build();

        Document saved = documentRepository.save(document);
        log.info("Created document: {} ({})", saved.getName(), saved.getId());
        return DocumentResponse.from(saved);
    }
}
