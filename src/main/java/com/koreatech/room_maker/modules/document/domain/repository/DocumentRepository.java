package com.koreatech.room_maker.modules.document.domain.repository;

import com.koreatech.room_maker.modules.document.domain.model.Document;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface DocumentRepository extends JpaRepository<Document, UUID> {

    List<Document> findAllByOrderByCreatedAtAsc();
}
