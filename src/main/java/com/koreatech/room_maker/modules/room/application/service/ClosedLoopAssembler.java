package com.koreatech.room_maker.modules.room.application.service;

import com.koreatech.room_maker.modules.room.domain.model.CurveLoop;
import com.koreatech.room_maker.modules.room.domain.model.LineSegment;
import com.koreatech.room_maker.shared.domain.Point3D;
import com.koreatech.room_maker.shared.exception.BusinessException;
import com.koreatech.room_maker.shared.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.PrecisionModel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
public class ClosedLoopAssembler {

    static final int RECTANGLE_CORNERS = 4;
    static final double MIN_SEGMENT_LENGTH = 1e-9;

    private final GeometryFactory geometryFactory = new GeometryFactory(new PrecisionModel(), 0);

    /**
     * Joins consecutive corners with segments, closing back to the first corner.
     *
     * @throws BusinessException {@link ErrorCode#GEOMETRY_DEGENERATE} if a segment has no length,
     *                           the loop does not close or the footprint self-intersects
     */
    public CurveLoop assemble(List<Point3D> corners) {
        if (corners.size() != RECTANGLE_CORNERS) {
            throw new BusinessException(ErrorCode.GEOMETRY_DEGENERATE,
                "Expected " + RECTANGLE_CORNERS + " corners but got " + corners.size());
        }

        List<LineSegment> segments = new ArrayList<>(corners.size());
        for (int i = 0; i < corners.size(); i++) {
            LineSegment segment = new LineSegment(corners.get(i), corners.get((i + 1) % corners.size()));
            if (segment.length() < MIN_SEGMENT_LENGTH) {
                throw new BusinessException(ErrorCode.GEOMETRY_DEGENERATE,
                    "Segment " + (i + 1) + " from " + segment.start() + " to " + segment.end() + " has zero length");
            }
            segments.add(segment);
        }

        CurveLoop loop = new CurveLoop(segments);
        int gap = loop.findDiscontinuity();
        if (gap >= 0 || !loop.isClosed()) {
            throw new BusinessException(ErrorCode.GEOMETRY_DEGENERATE,
                "Curve loop is open after segment " + (gap + 1));
        }

        LinearRing ring = loop.toLinearRing(geometryFactory);
        if (!ring.isValid()) {
            throw new BusinessException(ErrorCode.GEOMETRY_DEGENERATE, "Curve loop self-intersects");
        }

        log.debug("Assembled closed loop of {} segments", loop.size());
        return loop;
    }
}
