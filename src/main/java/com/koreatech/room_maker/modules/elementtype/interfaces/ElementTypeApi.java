package com.koreatech.room_maker.modules.elementtype.interfaces;

import com.koreatech.room_maker.modules.elementtype.application.dto.request.FloorTypeCreateRequest;
import com.koreatech.room_maker.modules.elementtype.application.dto.request.WallTypeCreateRequest;
import com.koreatech.room_maker.modules.elementtype.application.dto.response.FloorTypeResponse;
import com.koreatech.room_maker.modules.elementtype.application.dto.response.WallTypeResponse;
import com.koreatech.room_maker.shared.exception.ErrorResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.UUID;

@Tag(name = "ElementType", description = "벽/바닥 타입 관리 API")
public interface ElementTypeApi {

    @Operation(summary = "벽 타입 추가", description = "문서에 벽 타입을 추가합니다. 방 생성에는 BASIC 종류가 필요합니다.")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "벽 타입 생성 성공"),
        @ApiResponse(responseCode = "404", description = "문서를 찾을 수 없음",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "409", description = "같은 이름의 타입이 이미 존재함",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    ResponseEntity<WallTypeResponse> addWallType(
        @Parameter(description = "문서 ID", required = true) UUID documentId,
        WallTypeCreateRequest request
    );

    @Operation(summary = "벽 타입 목록 조회", description = "문서의 벽 타입을 이름 순으로 조회합니다.")
    @ApiResponse(responseCode = "200", description = "벽 타입 목록 조회 성공")
    ResponseEntity<List<WallTypeResponse>> getWallTypes(
        @Parameter(description = "문서 ID", required = true) UUID documentId
    );

    @Operation(summary = "바닥 타입 추가", description = "문서에 바닥 타입을 추가합니다.")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "바닥 타입 생성 성공"),
        @ApiResponse(responseCode = "404", description = "문서를 찾을 수 없음",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "409", description = "같은 이름의 타입이 이미 존재함",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    ResponseEntity<FloorTypeResponse> addFloorType(
        @Parameter(description = "문서 ID", required = true) UUID documentId,
        FloorTypeCreateRequest request
    );

    @Operation(summary = "바닥 타입 목록 조회", description = "문서의 바닥 타입을 이름 순으로 조회합니다.")
    @ApiResponse(responseCode = "200", description = "바닥 타입 목록 조회 성공")
    ResponseEntity<List<FloorTypeResponse>> getFloorTypes(
        @Parameter(description = "문서 ID", required = true) UUID documentId
    );
}
