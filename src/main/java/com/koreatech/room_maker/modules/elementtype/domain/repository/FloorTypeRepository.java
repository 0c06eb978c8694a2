package com.koreatech.room_maker.modules.elementtype.domain.repository;

import com.koreatech.room_maker.modules.elementtype.domain.model.FloorType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface FloorTypeRepository extends JpaRepository<FloorType, UUID> {

    List<FloorType> findByDocumentIdOrderByNameAsc(UUID documentId);

    Optional<FloorType> findFirstByDocumentIdOrderByCreatedAtAsc(UUID documentId);

    boolean existsByDocumentIdAndName(UUID documentId, String name);
}
