package com.koreatech.room_maker.modules.elementtype.application.command;

import com.koreatech.room_maker.modules.document.application.query.DocumentReader;
import com.koreatech.room_maker.modules.document.domain.model.Document;
import com.koreatech.room_maker.modules.elementtype.application.dto.request.FloorTypeCreateRequest;
import com.koreatech.room_maker.modules.elementtype.application.dto.request.WallTypeCreateRequest;
import com.koreatech.room_maker.modules.elementtype.application.dto.response.FloorTypeResponse;
import com.koreatech.room_maker.modules.elementtype.application.dto.response.WallTypeResponse;
import com.koreatech.room_maker.modules.elementtype.domain.model.FloorType;
import com.koreatech.room_maker.modules.elementtype.domain.model.WallType;
import com.koreatech.room_maker.modules.elementtype.domain.repository.FloorTypeRepository;
import com.koreatech.room_maker.modules.elementtype.domain.repository.WallTypeRepository;
import com.koreatech.room_maker.shared.exception.BusinessException;
import com.koreatech.room_maker.shared.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class ElementTypeCreator {

    private final DocumentReader documentReader;
    private final WallTypeRepository wallTypeRepository;
    private final FloorTypeRepository floorTypeRepository;

    public WallTypeResponse createWallType(UUID documentId, WallTypeCreateRequest request) {
        Document document = documentReader.findEntityById(documentId);

        if (wallTypeRepository.existsByDocumentIdAndName(documentId, request.name())) {
            throw new BusinessException(ErrorCode.ELEMENT_TYPE_ALREADY_EXISTS,
                "Wall type '" + request.name() + "' already exists");
        }

        WallType wallType = WallType.builder()
            .document(document)
            .name(request.name())
            .kind(request.kind())
            .width(request.width())
            .build();

        WallType saved = wallTypeRepository.save(wallType);
        log.info("Created {} wall type '{}' in document {}", saved.getKind(), saved.getName(), documentId);
        return WallTypeResponse.from(saved);
    }

    public FloorTypeResponse createFloorType(UUID documentId, FloorTypeCreateRequest request) {
        Document document = documentReader.findEntityById(documentId);

        if (floorTypeRepository.existsByDocumentIdAndName(documentId, request.name())) {
            throw new BusinessException(ErrorCode.ELEMENT_TYPE_ALREADY_EXISTS,
                "Floor type '" + request.name() + "' already exists");
        }

        FloorType floorType = FloorType.builder()
            .document(document)
            .name(request.name())
            .thickness(request.thickness())
            .build();

        FloorType saved = floorTypeRepository.save(floorType);
        log.info("Created floor type '{}' in document {}", saved.getName(), documentId);
        return FloorTypeResponse.from(saved);
    }
}
