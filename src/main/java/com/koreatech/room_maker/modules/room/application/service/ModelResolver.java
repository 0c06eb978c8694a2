package com.koreatech.room_maker.modules.room.application.service;

import com.koreatech.room_maker.modules.document.domain.model.Document;
import com.koreatech.room_maker.modules.document.domain.repository.DocumentRepository;
import com.koreatech.room_maker.modules.elementtype.domain.model.FloorType;
import com.koreatech.room_maker.modules.elementtype.domain.model.WallKind;
import com.koreatech.room_maker.modules.elementtype.domain.model.WallType;
import com.koreatech.room_maker.modules.elementtype.domain.repository.FloorTypeRepository;
import com.koreatech.room_maker.modules.elementtype.domain.repository.WallTypeRepository;
import com.koreatech.room_maker.modules.level.domain.model.Level;
import com.koreatech.room_maker.modules.level.domain.repository.LevelRepository;
import com.koreatech.room_maker.modules.room.domain.model.ResolvedModel;
import com.koreatech.room_maker.shared.exception.BusinessException;
import com.koreatech.room_maker.shared.exception.EntityNotFoundException;
import com.koreatech.room_maker.shared.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Finds the base level and the element types a new room depends on.
 * Element types are never created here; the base level is created when the document has none at zero elevation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@Transactional(propagation = Propagation.MANDATORY)
public class ModelResolver {

    static final double BASE_ELEVATION = 0.0;
    static final double ELEVATION_TOLERANCE = 0.001;
    static final String DEFAULT_LEVEL_NAME = "Level 0";

    private final DocumentRepository documentRepository;
    private final LevelRepository levelRepository;
    private final WallTypeRepository wallTypeRepository;
    private final FloorTypeRepository floorTypeRepository;

    public ResolvedModel resolve(UUID documentId) {
        try {
            Document document = documentRepository.findById(documentId)
                .orElseThrow(() -> new EntityNotFoundException(ErrorCode.DOCUMENT_NOT_FOUND, documentId));

            WallType wallType = wallTypeRepository
                .findFirstByDocumentIdAndKindOrderByCreatedAtAsc(documentId, WallKind.BASIC)
                .orElseThrow(() -> new BusinessException(ErrorCode.MISSING_HOST_ENTITY,
                    "No basic wall type found in document " + documentId));

            FloorType floorType = floorTypeRepository.findFirstByDocumentIdOrderByCreatedAtAsc(documentId)
                .orElseThrow(() -> new BusinessException(ErrorCode.MISSING_HOST_ENTITY,
                    "No floor type found in document " + documentId));

            Optional<Level> existing = findBaseLevel(documentId);
            Level level = existing.orElseGet(() -> createBaseLevel(document));

            log.debug("Resolved level '{}', wall type '{}', floor type '{}' for document {}",
                level.getName(), wallType.getName(), floorType.getName(), documentId);
            return new ResolvedModel(document, level, existing.isEmpty(), wallType, floorType);
        } catch (DataAccessException e) {
            throw new BusinessException(ErrorCode.RESOLUTION_FAILURE,
                "Failed to resolve model for document " + documentId + ": " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    private Optional<Level> findBaseLevel(UUID documentId) {
        return levelRepository.findByDocumentIdOrderByElevationAsc(documentId).stream()
            .filter(level -> level.isNearElevation(BASE_ELEVATION, ELEVATION_TOLERANCE))
            .findFirst();
    }

    private Level createBaseLevel(Document document) {
        Level level = Level.builder()
            .document(document)
            .name(DEFAULT_LEVEL_NAME)
            .elevation(BASE_ELEVATION)
            .build();

        Level saved = levelRepository.saveAndFlush(level);
        log.info("Created level '{}' at elevation {} in document {}",
            saved.getName(), saved.getElevation(), document.getId());
        return saved;
    }
}
