package com.koreatech.room_maker.modules.wall.domain.repository;

import com.koreatech.room_maker.modules.wall.domain.model.Wall;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface WallRepository extends JpaRepository<Wall, UUID> {

    List<Wall> findByDocumentIdOrderByCreatedAtAscSequenceOrderAsc(UUID documentId);

    long countByDocumentId(UUID documentId);
}
