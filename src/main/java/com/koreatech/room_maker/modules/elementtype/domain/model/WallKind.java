package com.koreatech.room_maker.modules.elementtype.domain.model;

public enum WallKind {
    BASIC,
    CURTAIN,
    STACKED
}
