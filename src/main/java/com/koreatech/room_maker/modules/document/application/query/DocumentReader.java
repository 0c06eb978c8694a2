package com.koreatech.room_maker.modules.document.application.query;

import com.koreatech.room_maker.modules.document.application.dto.response.DocumentDetailResponse;
import com.koreatech.room_maker.modules.document.application.dto.response.DocumentResponse;
import com.koreatech.room_maker.modules.document.domain.model.Document;
import com.koreatech.room_maker.modules.document.domain.repository.DocumentRepository;
import com.koreatech.room_maker.modules.elementtype.application.dto.response.FloorTypeResponse;
import com.koreatech.room_maker.modules.elementtype.application.dto.response.WallTypeResponse;
import com.koreatech.room_maker.modules.elementtype.domain.repository.FloorTypeRepository;
import com.koreatech.room_maker.modules.elementtype.domain.repository.WallTypeRepository;
import com.koreatech.room_maker.modules.floor.application.dto.response.FloorResponse;
import com.koreatech.room_maker.modules.floor.domain.repository.FloorRepository;
import com.koreatech.room_maker.modules.level.application.dto.response.LevelResponse;
import com.koreatech.room_maker.modules.level.domain.repository.LevelRepository;
import com.koreatech.room_maker.modules.wall.application.dto.response.WallResponse;
import com.koreatech.room_maker.modules.wall.domain.repository.WallRepository;
import com.koreatech.room_maker.shared.exception.EntityNotFoundException;
import com.koreatech.room_maker.shared.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class DocumentReader {

    private final DocumentRepository documentRepository;
    private final LevelRepository levelRepository;
    private final WallTypeRepository wallTypeRepository;
    private final FloorTypeRepository floorTypeRepository;
    private final WallRepository wallRepository;
    private final FloorRepository floorRepository;

    public List<DocumentResponse> findAll() {
        return documentRepository.findAllByOrderByCreatedAtAsc().stream()
            .map(DocumentResponse::from)
            .toList();
    }

    public DocumentDetailResponse findById(UUID id) {
        Document document = findEntityById(id);

        return DocumentDetailResponse.of(
            document,
            levelRepository.findByDocumentIdOrderByElevationAsc(id).stream()
                .map(LevelResponse::from)
                .toList(),
            wallTypeRepository.findByDocumentIdOrderByNameAsc(id).stream()
                .map(WallTypeResponse::from)
                .toList(),
            floorTypeRepository.findByDocumentIdOrderByNameAsc(id).stream()
                .map(FloorTypeResponse::from)
                .toList(),
            wallRepository.findByDocumentIdOrderByCreatedAtAscSequenceOrderAsc(id).stream()
                .map(WallResponse::from)
                .toList(),
            floorRepository.findByDocumentIdOrderByCreatedAtAsc(id).stream()
                .map(FloorResponse::from)
                .toList()
        );
    }

    public Document findEntityById(UUID id) {
        return documentRepository.findById(id)
            .orElseThrow(() -> new EntityNotFoundException(ErrorCode.DOCUMENT_NOT_FOUND, id));
    }
}
