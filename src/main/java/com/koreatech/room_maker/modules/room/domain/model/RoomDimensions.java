package com.koreatech.room_maker.modules.room.domain.model;

/**
 * Room size converted to document units (feet).
 */
public record RoomDimensions(double length, double width, double height) {
}
