package com.koreatech.room_maker.modules.floor.application.command;

import com.koreatech.room_maker.modules.floor.domain.model.BoundarySegment;
import com.koreatech.room_maker.modules.floor.domain.model.Floor;
import com.koreatech.room_maker.modules.floor.domain.repository.FloorRepository;
import com.koreatech.room_maker.modules.room.domain.model.CurveLoop;
import com.koreatech.room_maker.modules.room.domain.model.LineSegment;
import com.koreatech.room_maker.modules.room.domain.model.ResolvedModel;
import com.koreatech.room_maker.shared.exception.BusinessException;
import com.koreatech.room_maker.shared.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.PrecisionModel;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Component
@RequiredArgsConstructor
@Transactional(propagation = Propagation.MANDATORY)
public class FloorBuilder {

    private final FloorRepository floorRepository;
    private final GeometryFactory geometryFactory = new GeometryFactory(new PrecisionModel(), 0);

    public Floor build(ResolvedModel model, CurveLoop loop) {
        Polygon footprint = loop.toPolygon(geometryFactory);

        Floor floor = Floor.builder()
            .document(model.document())
            .level(model.level())
            .floorType(model.floorType())
            .area(footprint.getArea())
            .build();

        for (LineSegment segment : loop.getSegments()) {
            floor.addBoundarySegment(new BoundarySegment(segment.start().copy(), segment.end().copy()));
        }

        try {
            Floor saved = floorRepository.saveAndFlush(floor);
            log.debug("Created floor with {} boundary segments, area {}", saved.getBoundary().size(), saved.getArea());
            return saved;
        } catch (DataAccessException e) {
            throw new BusinessException(ErrorCode.CREATION_FAILURE,
                "Floor was rejected: " + e.getMostSpecificCause().getMessage(), e);
        }
    }
}
