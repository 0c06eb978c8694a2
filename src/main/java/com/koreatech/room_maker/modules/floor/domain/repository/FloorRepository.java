package com.koreatech.room_maker.modules.floor.domain.repository;

import com.koreatech.room_maker.modules.floor.domain.model.Floor;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface FloorRepository extends JpaRepository<Floor, UUID> {

    List<Floor> findByDocumentIdOrderByCreatedAtAsc(UUID documentId);

    long countByDocumentId(UUID documentId);
}
