package com.koreatech.room_maker.modules.floor.domain.model;

import com.koreatech.room_maker.shared.domain.Point3D;
import jakarta.persistence.*;
import lombok.*;

@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class BoundarySegment {

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
}
