package com.koreatech.room_maker.modules.level.domain.model;

import com.koreatech.room_maker.modules.document.domain.model.Document;
import com.koreatech.room_maker.shared.domain.BaseEntity;
import jakarta.persistence.*;
import lombok.*;

/**
 * Horizontal reference plane that walls and floors attach to. Elevation is in document units (feet).
 */
@Entity
@Table(name = "levels")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class Level extends BaseEntity {

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "document_id", nullable = false)
    private Document document;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private double elevation;

    public boolean isNearElevation(double target, double tolerance) {
        return Math.abs(elevation - target) < tolerance;
    }
}
