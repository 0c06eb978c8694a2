package com.koreatech.room_maker.modules.room.interfaces;

import com.koreatech.room_maker.modules.room.application.dto.request.RoomCreateRequest;
import com.koreatech.room_maker.modules.room.application.dto.response.RoomCreationResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;

import java.util.UUID;

@Tag(name = "Room", description = "방 생성 API")
public interface RoomApi {

    @Operation(summary = "직사각형 방 생성",
        description = """
            미터 단위 길이/너비/높이로 방을 생성합니다.
            높이 0 레벨을 찾거나 만들고, 벽 4개와 바닥 1개를 하나의 트랜잭션에서 생성합니다.
            실패 시 어떤 변경도 남지 않습니다.
            """)
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "방 생성 및 커밋 성공"),
        @ApiResponse(responseCode = "400", description = "잘못된 입력값 또는 퇴화된 형상",
            content = @Content(schema = @Schema(implementation = RoomCreationResult.class))),
        @ApiResponse(responseCode = "404", description = "문서를 찾을 수 없음",
            content = @Content(schema = @Schema(implementation = RoomCreationResult.class))),
        @ApiResponse(responseCode = "422", description = "BASIC 벽 타입 또는 바닥 타입이 문서에 없음",
            content = @Content(schema = @Schema(implementation = RoomCreationResult.class))),
        @ApiResponse(responseCode = "500", description = "생성 또는 커밋 실패 (전체 롤백)",
            content = @Content(schema = @Schema(implementation = RoomCreationResult.class)))
    })
    ResponseEntity<RoomCreationResult> createRoom(
        @Parameter(description = "문서 ID", required = true) UUID documentId,
        RoomCreateRequest request
    );
}
