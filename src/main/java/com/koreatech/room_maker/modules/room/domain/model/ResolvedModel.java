package com.koreatech.room_maker.modules.room.domain.model;

import com.koreatech.room_maker.modules.document.domain.model.Document;
import com.koreatech.room_maker.modules.elementtype.domain.model.FloorType;
import com.koreatech.room_maker.modules.elementtype.domain.model.WallType;
import com.koreatech.room_maker.modules.level.domain.model.Level;

/**
 * Existing or newly created entities that the room geometry is attached to.
 */
public record ResolvedModel(
    Document document,
    Level level,
    boolean levelCreated,
    WallType wallType,
    FloorType floorType
) {
}
