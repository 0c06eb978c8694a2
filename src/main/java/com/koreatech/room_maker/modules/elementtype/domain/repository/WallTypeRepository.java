package com.koreatech.room_maker.modules.elementtype.domain.repository;

import com.koreatech.room_maker.modules.elementtype.domain.model.WallKind;
import com.koreatech.room_maker.modules.elementtype.domain.model.WallType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface WallTypeRepository extends JpaRepository<WallType, UUID> {

    List<WallType> findByDocumentIdOrderByNameAsc(UUID documentId);

    Optional<WallType> findFirstByDocumentIdAndKindOrderByCreatedAtAsc(UUID documentId, WallKind kind);

    boolean existsByDocumentIdAndName(UUID documentId, String name);
}
