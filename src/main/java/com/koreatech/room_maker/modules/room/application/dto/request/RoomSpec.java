package com.koreatech.room_maker.modules.room.application.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

@Schema(description = "방 치수 (미터)")
public record RoomSpec(
    @Schema(description = "길이 (m)", example = "4.0")
    @NotNull(message = "length_m is required")
    @JsonProperty("length_m")
    Double lengthM,

    @Schema(description = "너비 (m)", example = "3.0")
    @NotNull(message = "width_m is required")
    @JsonProperty("width_m")
    Double widthM,

    @Schema(description = "높이 (m)", example = "2.5")
    @NotNull(message = "height_m is required")
    @JsonProperty("height_m")
    Double heightM
) {}
