package com.koreatech.room_maker.modules.document.domain.model;

import com.koreatech.room_maker.shared.domain.BaseEntity;
import jakarta.persistence.*;
import lombok.*;

/**
 * A building-information document. Levels, element types, walls and floors all belong to exactly one document.
 */
@Entity
@Table(name = "documents")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class Document extends BaseEntity {

    @Column(nullable = false)
    private String name;

    @Column(length = 1000)
    private String description;
}
