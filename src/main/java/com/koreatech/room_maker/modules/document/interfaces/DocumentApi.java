package com.koreatech.room_maker.modules.document.interfaces;

import com.koreatech.room_maker.modules.document.application.dto.request.DocumentCreateRequest;
import com.koreatech.room_maker.modules.document.application.dto.response.DocumentDetailResponse;
import com.koreatech.room_maker.modules.document.application.dto.response.DocumentResponse;
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

@Tag(name = "Document", description = "문서 관리 API")
public interface DocumentApi {

    @Operation(summary = "문서 생성", description = "새로운 건물 정보 문서를 생성합니다.")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "문서 생성 성공"),
        @ApiResponse(responseCode = "400", description = "잘못된 입력값",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    ResponseEntity<DocumentResponse> createDocument(DocumentCreateRequest request);

    @Operation(summary = "문서 목록 조회", description = "모든 문서 목록을 생성 순으로 조회합니다.")
    @ApiResponse(responseCode = "200", description = "문서 목록 조회 성공")
    ResponseEntity<List<DocumentResponse>> getDocuments();

    @Operation(summary = "문서 상세 조회", description = "레벨, 벽/바닥 타입, 벽, 바닥을 포함한 문서 상세 정보를 조회합니다.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "문서 조회 성공"),
        @ApiResponse(responseCode = "404", description = "문서를 찾을 수 없음",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    ResponseEntity<DocumentDetailResponse> getDocument(
        @Parameter(description = "문서 ID", required = true) UUID id
    );
}
