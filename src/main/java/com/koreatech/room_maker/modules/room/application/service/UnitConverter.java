package com.koreatech.room_maker.modules.room.application.service;

import com.koreatech.room_maker.modules.room.application.dto.request.RoomSpec;
import com.koreatech.room_maker.modules.room.domain.model.RoomDimensions;
import org.springframework.stereotype.Component;

/**
 * Converts metric input to the document's internal length unit (feet).
 */
@Component
public class UnitConverter {

    public static final double FEET_PER_METER = 3.2808399;

    public double toInternalLength(double valueMeters) {
        return valueMeters * FEET_PER_METER;
    }

    public RoomDimensions convert(RoomSpec spec) {
        return new RoomDimensions(
            toInternalLength(spec.lengthM()),
            toInternalLength(spec.widthM()),
            toInternalLength(spec.heightM())
        );
    }
}
