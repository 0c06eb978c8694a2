package com.koreatech.room_maker.modules.floor.domain.model;

import com.koreatech.room_maker.modules.document.domain.model.Document;
import com.koreatech.room_maker.modules.elementtype.domain.model.FloorType;
import com.koreatech.room_maker.modules.level.domain.model.Level;
import com.koreatech.room_maker.shared.domain.BaseEntity;
import jakarta.persistence.*;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * A floor slab bounded by one closed loop of segments, stored in loop order.
 */
@Entity
@Table(name = "floors")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class Floor extends BaseEntity {

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "document_id", nullable = false)
    private Document document;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "level_id", nullable = false)
    private Level level;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "floor_type_id", nullable = false)
    private FloorType floorType;

    @ElementCollection
    @CollectionTable(name = "floor_boundary_segments", joinColumns = @JoinColumn(name = "floor_id"))
    @OrderColumn(name = "sequence_order")
    @Builder.Default
    private List<BoundarySegment> boundary = new ArrayList<>();

    // square feet
    @Column
    private Double area;

    public void addBoundarySegment(BoundarySegment segment) {
        boundary.add(segment);
    }
}
