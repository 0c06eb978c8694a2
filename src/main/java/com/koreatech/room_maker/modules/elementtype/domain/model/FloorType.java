package com.koreatech.room_maker.modules.elementtype.domain.model;

import com.koreatech.room_maker.modules.document.domain.model.Document;
import com.koreatech.room_maker.shared.domain.BaseEntity;
import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "floor_types", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"document_id", "name"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class FloorType extends BaseEntity {

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "document_id", nullable = false)
    private Document document;

    @Column(nullable = false)
    private String name;

    // feet
    @Column
    private Double thickness;
}
