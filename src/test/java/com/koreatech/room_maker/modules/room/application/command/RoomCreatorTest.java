package com.koreatech.room_maker.modules.room.application.command;

import com.koreatech.room_maker.modules.document.domain.model.Document;
import com.koreatech.room_maker.modules.elementtype.domain.model.FloorType;
import com.koreatech.room_maker.modules.elementtype.domain.model.WallKind;
import com.koreatech.room_maker.modules.elementtype.domain.model.WallType;
import com.koreatech.room_maker.modules.floor.application.command.FloorBuilder;
import com.koreatech.room_maker.modules.floor.domain.model.Floor;
import com.koreatech.room_maker.modules.level.domain.model.Level;
import com.koreatech.room_maker.modules.room.application.dto.request.RoomSpec;
import com.koreatech.room_maker.modules.room.application.dto.response.RoomCreationResult;
import com.koreatech.room_maker.modules.room.application.service.ClosedLoopAssembler;
import com.koreatech.room_maker.modules.room.application.service.ModelResolver;
import com.koreatech.room_maker.modules.room.application.service.RectangleGeometryBuilder;
import com.koreatech.room_maker.modules.room.application.service.UnitConverter;
import com.koreatech.room_maker.modules.room.domain.model.CurveLoop;
import com.koreatech.room_maker.modules.room.domain.model.ResolvedModel;
import com.koreatech.room_maker.modules.wall.application.command.WallBuilder;
import com.koreatech.room_maker.modules.wall.domain.model.Wall;
import com.koreatech.room_maker.shared.exception.BusinessException;
import com.koreatech.room_maker.shared.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RoomCreatorTest {

    @Mock
    private PlatformTransactionManager transactionManager;
    @Mock
    private ModelResolver modelResolver;
    @Mock
    private WallBuilder wallBuilder;
    @Mock
    private FloorBuilder floorBuilder;

    private RoomCreator roomCreator;

    private UUID documentId;
    private ResolvedModel model;
    private SimpleTransactionStatus transactionStatus;

    @BeforeEach
    void setUp() {
        roomCreator = new RoomCreator(
            transactionManager,
            new UnitConverter(),
            new RectangleGeometryBuilder(),
            new ClosedLoopAssembler(),
            modelResolver,
            wallBuilder,
            floorBuilder
        );

        documentId = UUID.randomUUID();
        Document document = Document.builder().name("문서").build();
        ReflectionTestUtils.setField(document, "id", documentId);
        Level level = Level.builder().document(document).name("Level 0").elevation(0.0).build();
        ReflectionTestUtils.setField(level, "id", UUID.randomUUID());
        WallType wallType = WallType.builder().document(document).name("기본 벽").kind(WallKind.BASIC).build();
        ReflectionTestUtils.setField(wallType, "id", UUID.randomUUID());
        FloorType floorType = FloorType.builder().document(document).name("기본 바닥").build();
        ReflectionTestUtils.setField(floorType, "id", UUID.randomUUID());
        model = new ResolvedModel(document, level, true, wallType, floorType);

        transactionStatus = new SimpleTransactionStatus();
    }

    private List<Wall> createWalls() {
        List<Wall> walls = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            Wall wall = Wall.builder().sequenceOrder(i).build();
            ReflectionTestUtils.setField(wall, "id", UUID.randomUUID());
            walls.add(wall);
        }
        return walls;
    }

    private Floor createFloor() {
        Floor floor = Floor.builder().build();
        ReflectionTestUtils.setField(floor, "id", UUID.randomUUID());
        return floor;
    }

    @Test
    @DisplayName("모든 단계가 성공하면 커밋하고 벽 4개, 바닥 1개를 반환한다")
    void create_success_commits() {
        List<Wall> walls = createWalls();
        Floor floor = createFloor();
        when(transactionManager.getTransaction(any())).thenReturn(transactionStatus);
        when(modelResolver.resolve(documentId)).thenReturn(model);
        when(wallBuilder.build(eq(model), any(CurveLoop.class), anyDouble())).thenReturn(walls);
        when(floorBuilder.build(eq(model), any(CurveLoop.class))).thenReturn(floor);

        RoomCreationResult result = roomCreator.create(documentId, new RoomSpec(4.0, 3.0, 2.5));

        assertThat(result.committed()).isTrue();
        assertThat(result.errorCode()).isNull();
        assertThat(result.wallIds()).hasSize(4);
        assertThat(result.floorId()).isEqualTo(floor.getId());
        assertThat(result.levelId()).isEqualTo(model.level().getId());
        assertThat(result.levelCreated()).isTrue();
        assertThat(result.dimensions().length()).isCloseTo(13.1234, within(1e-4));
        assertThat(result.dimensions().width()).isCloseTo(9.8425, within(1e-4));
        verify(transactionManager).commit(transactionStatus);
        verify(transactionManager, never()).rollback(any());
    }

    @Test
    @DisplayName("벽과 바닥은 같은 닫힌 루프를 받고, 벽 높이는 변환된 높이다")
    void create_wallsAndFloorShareLoop() {
        when(transactionManager.getTransaction(any())).thenReturn(transactionStatus);
        when(modelResolver.resolve(documentId)).thenReturn(model);
        when(wallBuilder.build(eq(model), any(CurveLoop.class), anyDouble())).thenReturn(createWalls());
        when(floorBuilder.build(eq(model), any(CurveLoop.class))).thenReturn(createFloor());

        roomCreator.create(documentId, new RoomSpec(4.0, 3.0, 2.5));

        ArgumentCaptor<CurveLoop> wallLoop = ArgumentCaptor.forClass(CurveLoop.class);
        ArgumentCaptor<Double> height = ArgumentCaptor.forClass(Double.class);
        ArgumentCaptor<CurveLoop> floorLoop = ArgumentCaptor.forClass(CurveLoop.class);
        verify(wallBuilder).build(eq(model), wallLoop.capture(), height.capture());
        verify(floorBuilder).build(eq(model), floorLoop.capture());

        assertThat(floorLoop.getValue()).isSameAs(wallLoop.getValue());
        assertThat(wallLoop.getValue().isClosed()).isTrue();
        assertThat(height.getValue()).isCloseTo(8.2021, within(1e-4));
    }

    @Test
    @DisplayName("BASIC 벽 타입이 없으면 롤백하고 벽을 하나도 만들지 않는다")
    void create_missingWallType_rollsBack() {
        when(transactionManager.getTransaction(any())).thenReturn(transactionStatus);
        when(modelResolver.resolve(documentId))
            .thenThrow(new BusinessException(ErrorCode.MISSING_HOST_ENTITY, "No basic wall type found"));

        RoomCreationResult result = roomCreator.create(documentId, new RoomSpec(4.0, 3.0, 2.5));

        assertThat(result.committed()).isFalse();
        assertThat(result.errorCode()).isEqualTo(ErrorCode.MISSING_HOST_ENTITY);
        assertThat(result.message()).contains("No basic wall type");
        assertThat(result.wallIds()).isEmpty();
        verify(transactionManager).rollback(transactionStatus);
        verify(transactionManager, never()).commit(any());
        verifyNoInteractions(wallBuilder, floorBuilder);
    }

    @Test
    @DisplayName("벽 생성 후 바닥 생성이 실패하면 전체 롤백한다")
    void create_floorFailsAfterWalls_rollsBack() {
        when(transactionManager.getTransaction(any())).thenReturn(transactionStatus);
        when(modelResolver.resolve(documentId)).thenReturn(model);
        when(wallBuilder.build(eq(model), any(CurveLoop.class), anyDouble())).thenReturn(createWalls());
        when(floorBuilder.build(eq(model), any(CurveLoop.class)))
            .thenThrow(new BusinessException(ErrorCode.CREATION_FAILURE, "Floor was rejected"));

        RoomCreationResult result = roomCreator.create(documentId, new RoomSpec(4.0, 3.0, 2.5));

        assertThat(result.committed()).isFalse();
        assertThat(result.errorCode()).isEqualTo(ErrorCode.CREATION_FAILURE);
        assertThat(result.floorId()).isNull();
        verify(transactionManager).rollback(transactionStatus);
        verify(transactionManager, never()).commit(any());
    }

    @Test
    @DisplayName("커밋이 거부되면 TRANSACTION_FAILURE")
    void create_commitRejected_returnsTransactionFailure() {
        when(transactionManager.getTransaction(any())).thenReturn(transactionStatus);
        when(modelResolver.resolve(documentId)).thenReturn(model);
        when(wallBuilder.build(eq(model), any(CurveLoop.class), anyDouble())).thenReturn(createWalls());
        when(floorBuilder.build(eq(model), any(CurveLoop.class))).thenReturn(createFloor());
        doThrow(new TransactionSystemException("commit rejected")).when(transactionManager).commit(transactionStatus);

        RoomCreationResult result = roomCreator.create(documentId, new RoomSpec(4.0, 3.0, 2.5));

        assertThat(result.committed()).isFalse();
        assertThat(result.errorCode()).isEqualTo(ErrorCode.TRANSACTION_FAILURE);
        assertThat(result.message()).contains("commit rejected");
    }

    @Test
    @DisplayName("너비가 0 이하이면 트랜잭션을 열기 전에 GEOMETRY_DEGENERATE")
    void create_nonPositiveWidth_failsBeforeTransaction() {
        RoomCreationResult result = roomCreator.create(documentId, new RoomSpec(4.0, 0.0, 2.5));

        assertThat(result.committed()).isFalse();
        assertThat(result.errorCode()).isEqualTo(ErrorCode.GEOMETRY_DEGENERATE);
        assertThat(result.message()).contains("width_m");
        verifyNoInteractions(transactionManager, modelResolver, wallBuilder, floorBuilder);
    }

    @Test
    @DisplayName("음수 높이와 NaN 길이도 GEOMETRY_DEGENERATE")
    void create_negativeOrNaN_failsBeforeTransaction() {
        assertThat(roomCreator.create(documentId, new RoomSpec(4.0, 3.0, -2.5)).errorCode())
            .isEqualTo(ErrorCode.GEOMETRY_DEGENERATE);
        assertThat(roomCreator.create(documentId, new RoomSpec(Double.NaN, 3.0, 2.5)).errorCode())
            .isEqualTo(ErrorCode.GEOMETRY_DEGENERATE);

        verifyNoInteractions(transactionManager);
    }

    @Test
    @DisplayName("피트로 변환하면 무한대가 되는 높이는 트랜잭션 전에 GEOMETRY_DEGENERATE")
    void create_heightOverflowingFeet_failsBeforeTransaction() {
        RoomCreationResult result = roomCreator.create(documentId, new RoomSpec(4.0, 3.0, 1e308));

        assertThat(result.committed()).isFalse();
        assertThat(result.errorCode()).isEqualTo(ErrorCode.GEOMETRY_DEGENERATE);
        assertThat(result.message()).contains("height_m");
        verifyNoInteractions(transactionManager, modelResolver, wallBuilder, floorBuilder);
    }

    @Test
    @DisplayName("피트로 변환하면 무한대가 되는 길이는 해당 필드 이름으로 거부된다")
    void create_lengthOverflowingFeet_namesField() {
        RoomCreationResult result = roomCreator.create(documentId, new RoomSpec(1e308, 3.0, 2.5));

        assertThat(result.errorCode()).isEqualTo(ErrorCode.GEOMETRY_DEGENERATE);
        assertThat(result.message()).contains("length_m").doesNotContain("self-intersects");
        verifyNoInteractions(transactionManager);
    }

    @Test
    @DisplayName("치수가 빠져 있으면 INVALID_INPUT_VALUE")
    void create_missingField_failsWithInvalidInput() {
        RoomCreationResult result = roomCreator.create(documentId, new RoomSpec(4.0, null, 2.5));

        assertThat(result.committed()).isFalse();
        assertThat(result.errorCode()).isEqualTo(ErrorCode.INVALID_INPUT_VALUE);
        verifyNoInteractions(transactionManager);
    }
}
