package com.koreatech.room_maker.modules.wall.domain.model;

import com.koreatech.room_maker.modules.document.domain.model.Document;
import com.koreatech.room_maker.modules.elementtype.domain.model.WallType;
import com.koreatech.room_maker.modules.level.domain.model.Level;
import com.koreatech.room_maker.shared.domain.BaseEntity;
import com.koreatech.room_maker.shared.domain.Point3D;
import jakarta.persistence.*;
import lombok.*;

/**
 * A straight wall running from {@code startPoint} to {@code endPoint} on its base level.
 * Coordinates, height and offset are in document units (feet).
 */
@Entity
@Table(name = "walls")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class Wall extends BaseEntity {

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "document_id", nullable = false)
    private Document document;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "level_id", nullable = false)
    private Level level;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "wall_type_id", nullable = false)
    private WallType wallType;

    @Column(nullable = false)
    private int sequenceOrder;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "x", column = @Column(name = "start_x")),
        @AttributeOverride(name = "y", column = @Column(name = "start_y")),
        @AttributeOverride(name = "z", column = @Column(name = "start_z"))
    })
    private Point3D startPoint;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "x", column = @Column(name = "end_x")),
        @AttributeOverride(name = "y", column = @Column(name = "end_y")),
        @AttributeOverride(name = "z", column = @Column(name = "end_z"))
    })
    private Point3D endPoint;

    @Column(nullable = false)
    private double height;

    @Column(nullable = false)
    private double baseOffset;

    @Column(nullable = false)
    private boolean structural;

    @Column(nullable = false)
    private boolean flipped;

    @Column
    private Double length;

    @PrePersist
    @PreUpdate
    private void calculateLength() {
        if (startPoint != null && endPoint != null) {
            this.length = startPoint.distanceTo(endPoint);
        }
    }
}
