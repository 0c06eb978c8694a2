package com.koreatech.room_maker.modules.level.domain.repository;

import com.koreatech.room_maker.modules.level.domain.model.Level;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface LevelRepository extends JpaRepository<Level, UUID> {

    List<Level> findByDocumentIdOrderByElevationAsc(UUID documentId);

    long countByDocumentId(UUID documentId);
}
