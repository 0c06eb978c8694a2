package com.koreatech.room_maker.modules.elementtype.application.query;

import com.koreatech.room_maker.modules.document.domain.repository.DocumentRepository;
import com.koreatech.room_maker.modules.elementtype.application.dto.response.FloorTypeResponse;
import com.koreatech.room_maker.modules.elementtype.application.dto.response.WallTypeResponse;
import com.koreatech.room_maker.modules.elementtype.domain.repository.FloorTypeRepository;
import com.koreatech.room_maker.modules.elementtype.domain.repository.WallTypeRepository;
import com.koreatech.room_maker.shared.exception.BusinessException;
import com.koreatech.room_maker.shared.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ElementTypeReader {

    private final DocumentRepository documentRepository;
    private final WallTypeRepository wallTypeRepository;
    private final FloorTypeRepository floorTypeRepository;

    public List<WallTypeResponse> findWallTypes(UUID documentId) {
        requireDocument(documentId);
        return wallTypeRepository.findByDocumentIdOrderByNameAsc(documentId).stream()
            .map(WallTypeResponse::from)
            .toList();
    }

    public List<FloorTypeResponse> findFloorTypes(UUID documentId) {
        requireDocument(documentId);
        return floorTypeRepository.findByDocumentIdOrderByNameAsc(documentId).stream()
            .map(FloorTypeResponse::from)
            .toList();
    }

    private void requireDocument(UUID documentId) {
        if (!documentRepository.existsById(documentId)) {
            throw new BusinessException(ErrorCode.DOCUMENT_NOT_FOUND);
        }
    }
}
