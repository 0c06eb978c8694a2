package com.koreatech.room_maker.modules.wall.application.command;

import com.koreatech.room_maker.modules.room.domain.model.CurveLoop;
import com.koreatech.room_maker.modules.room.domain.model.LineSegment;
import com.koreatech.room_maker.modules.room.domain.model.ResolvedModel;
import com.koreatech.room_maker.modules.wall.domain.model.Wall;
import com.koreatech.room_maker.modules.wall.domain.repository.WallRepository;
import com.koreatech.room_maker.shared.exception.BusinessException;
import com.koreatech.room_maker.shared.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Creates one wall per loop segment, in loop order. Stops at the first rejected wall.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@Transactional(propagation = Propagation.MANDATORY)
public class WallBuilder {

    private static final double BASE_OFFSET = 0.0;

    private final WallRepository wallRepository;

    public List<Wall> build(ResolvedModel model, CurveLoop loop, double height) {
        List<LineSegment> segments = loop.getSegments();
        List<Wall> walls = new ArrayList<>(segments.size());

        for (int i = 0; i < segments.size(); i++) {
            LineSegment segment = segments.get(i);

            Wall wall = Wall.builder()
                .document(model.document())
                .level(model.level())
                .wallType(model.wallType())
                .sequenceOrder(i)
                .startPoint(segment.start().copy())
                .endPoint(segment.end().copy())
                .height(height)
                .baseOffset(BASE_OFFSET)
                .structural(false)
                .flipped(false)
                .build();

            try {
                walls.add(wallRepository.saveAndFlush(wall));
            } catch (DataAccessException e) {
                throw new BusinessException(ErrorCode.CREATION_FAILURE,
                    "Wall " + (i + 1) + " of " + segments.size() + " was rejected: "
                        + e.getMostSpecificCause().getMessage(), e);
            }
        }

        log.debug("Created {} walls of height {} on level '{}'", walls.size(), height, model.level().getName());
        return walls;
    }
}
