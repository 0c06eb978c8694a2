package com.koreatech.room_maker.modules.room.application.job;

import com.koreatech.room_maker.modules.room.application.command.RoomCreator;
import com.koreatech.room_maker.modules.room.application.dto.request.RoomSpec;
import com.koreatech.room_maker.modules.room.application.dto.response.RoomCreationResult;
import com.koreatech.room_maker.modules.room.application.service.RoomSpecLoader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Batch mode: generates one room from a specification file at startup. A failed run aborts startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "room-maker.job", name = "enabled", havingValue = "true")
public class RoomJobRunner implements ApplicationRunner {

    private final RoomSpecLoader roomSpecLoader;
    private final RoomCreator roomCreator;

    @Value("${room-maker.job.spec-path:room.json}")
    private String specPath;

    @Value("${room-maker.job.document-id:}")
    private String documentId;

    @Override
    public void run(ApplicationArguments args) {
        if (!StringUtils.hasText(documentId)) {
            throw new IllegalStateException("room-maker.job.document-id must be set when the room job is enabled");
        }

        UUID targetDocument = UUID.fromString(documentId.trim());
        RoomSpec spec = roomSpecLoader.load(Path.of(specPath));
        RoomCreationResult result = roomCreator.create(targetDocument, spec);

        if (!result.committed()) {
            throw new IllegalStateException("Room job failed [" + result.errorCode().getCode() + "]: "
                + result.message());
        }
        log.info("Room job succeeded for document {}: level {}, {} walls, floor {}",
            targetDocument, result.levelId(), result.wallIds().size(), result.floorId());
    }
}
