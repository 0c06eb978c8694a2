package com.koreatech.room_maker.modules.room.application.command;

import com.koreatech.room_maker.modules.floor.application.command.FloorBuilder;
import com.koreatech.room_maker.modules.floor.domain.model.Floor;
import com.koreatech.room_maker.modules.room.application.dto.request.RoomSpec;
import com.koreatech.room_maker.modules.room.application.dto.response.RoomCreationResult;
import com.koreatech.room_maker.modules.room.application.service.ClosedLoopAssembler;
import com.koreatech.room_maker.modules.room.application.service.ModelResolver;
import com.koreatech.room_maker.modules.room.application.service.RectangleGeometryBuilder;
import com.koreatech.room_maker.modules.room.application.service.UnitConverter;
import com.koreatech.room_maker.modules.room.domain.model.CurveLoop;
import com.koreatech.room_maker.modules.room.domain.model.ResolvedModel;
import com.koreatech.room_maker.modules.room.domain.model.RoomDimensions;
import com.koreatech.room_maker.modules.wall.application.command.WallBuilder;
import com.koreatech.room_maker.modules.wall.domain.model.Wall;
import com.koreatech.room_maker.shared.exception.BusinessException;
import com.koreatech.room_maker.shared.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.UUID;

/**
 * Generates a rectangular room (base level if missing, four walls, one floor) in a single transaction.
 *
 * <p>Geometry is computed and checked before the transaction opens. Level resolution and all element
 * creation run inside it; any failure rolls back every change, including a newly created level.
 * Failures are reported through {@link RoomCreationResult} rather than thrown.
 */
@Slf4j
@Service
public class RoomCreator {

    private final TransactionTemplate transactionTemplate;
    private final UnitConverter unitConverter;
    private final RectangleGeometryBuilder rectangleGeometryBuilder;
    private final ClosedLoopAssembler closedLoopAssembler;
    private final ModelResolver modelResolver;
    private final WallBuilder wallBuilder;
    private final FloorBuilder floorBuilder;

    public RoomCreator(PlatformTransactionManager transactionManager,
                       UnitConverter unitConverter,
                       RectangleGeometryBuilder rectangleGeometryBuilder,
                       ClosedLoopAssembler closedLoopAssembler,
                       ModelResolver modelResolver,
                       WallBuilder wallBuilder,
                       FloorBuilder floorBuilder) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setName("Create room");
        this.unitConverter = unitConverter;
        this.rectangleGeometryBuilder = rectangleGeometryBuilder;
        this.closedLoopAssembler = closedLoopAssembler;
        this.modelResolver = modelResolver;
        this.wallBuilder = wallBuilder;
        this.floorBuilder = floorBuilder;
    }

    public RoomCreationResult create(UUID documentId, RoomSpec spec) {
        log.info("Creating room in document {}: {}", documentId, spec);

        try {
            validate(spec);
            RoomDimensions dimensions = unitConverter.convert(spec);
            requireFinite(dimensions);
            CurveLoop loop = closedLoopAssembler.assemble(
                rectangleGeometryBuilder.buildCorners(dimensions.length(), dimensions.width()));

            RoomCreationResult result = transactionTemplate.execute(
                status -> createInTransaction(documentId, dimensions, loop));

            log.info("Committed room in document {}: {} walls, floor {}",
                documentId, result.wallIds().size(), result.floorId());
            return result;
        } catch (BusinessException e) {
            log.warn("Room creation failed for document {} [{}]: {}",
                documentId, e.getErrorCode().getCode(), e.getMessage());
            return RoomCreationResult.failed(documentId, e.getErrorCode(), e.getMessage());
        } catch (TransactionException | DataAccessException e) {
            log.error("Room transaction could not be committed for document {}", documentId, e);
            return RoomCreationResult.failed(documentId, ErrorCode.TRANSACTION_FAILURE, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure while creating room in document {}", documentId, e);
            return RoomCreationResult.failed(documentId, ErrorCode.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    private RoomCreationResult createInTransaction(UUID documentId, RoomDimensions dimensions, CurveLoop loop) {
        ResolvedModel model = modelResolver.resolve(documentId);
        List<Wall> walls = wallBuilder.build(model, loop, dimensions.height());
        Floor floor = floorBuilder.build(model, loop);
        return RoomCreationResult.committed(model, walls, floor, dimensions);
    }

    private void validate(RoomSpec spec) {
        if (spec == null || spec.lengthM() == null || spec.widthM() == null || spec.heightM() == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT_VALUE,
                "length_m, width_m and height_m are all required");
        }
        requirePositive("length_m", spec.lengthM());
        requirePositive("width_m", spec.widthM());
        requirePositive("height_m", spec.heightM());
    }

    // Finite metres can still overflow once converted to feet.
    private void requireFinite(RoomDimensions dimensions) {
        requireFiniteFeet("length_m", dimensions.length());
        requireFiniteFeet("width_m", dimensions.width());
        requireFiniteFeet("height_m", dimensions.height());
    }

    private void requireFiniteFeet(String field, double feet) {
        if (!Double.isFinite(feet)) {
            throw new BusinessException(ErrorCode.GEOMETRY_DEGENERATE,
                field + " is too large to convert to feet");
        }
    }

    private void requirePositive(String field, double value) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new BusinessException(ErrorCode.GEOMETRY_DEGENERATE,
                field + " must be a positive finite number but was " + value);
        }
    }
}
