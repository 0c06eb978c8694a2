package com.koreatech.room_maker.e2e;

import com.koreatech.room_maker.modules.document.domain.model.Document;
import com.koreatech.room_maker.modules.document.domain.repository.DocumentRepository;
import com.koreatech.room_maker.modules.elementtype.application.dto.request.FloorTypeCreateRequest;
import com.koreatech.room_maker.modules.elementtype.application.dto.request.WallTypeCreateRequest;
import com.koreatech.room_maker.modules.elementtype.domain.model.WallKind;
import com.koreatech.room_maker.modules.elementtype.domain.repository.FloorTypeRepository;
import com.koreatech.room_maker.modules.elementtype.domain.repository.WallTypeRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;

import java.util.UUID;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultHandlers.print;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class ElementTypeControllerE2ETest extends BaseE2ETest {

    @Autowired
    private DocumentRepository documentRepository;
    @Autowired
    private WallTypeRepository wallTypeRepository;
    @Autowired
    private FloorTypeRepository floorTypeRepository;

    private Document document;

    @BeforeEach
    void setUp() {
        document = documentRepository.save(Document.builder().name("Type Catalog").build());
    }

    @AfterEach
    void tearDown() {
        wallTypeRepository.deleteAll();
        floorTypeRepository.deleteAll();
        documentRepository.deleteAll();
    }

    @Nested
    @DisplayName("POST /api/v1/documents/{documentId}/wall-types")
    class AddWallType {

        @Test
        @DisplayName("should add basic wall type")
        void addWallType_WithValidRequest_ReturnsCreated() throws Exception {
            WallTypeCreateRequest request = new WallTypeCreateRequest("Generic - 200mm", WallKind.BASIC, 0.656);

            mockMvc.perform(post("/api/v1/documents/{documentId}/wall-types", document.getId())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(request)))
                    .andDo(print())
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.name").value("Generic - 200mm"))
                    .andExpect(jsonPath("$.kind").value("BASIC"));
        }

        @Test
        @DisplayName("should return 409 when name already exists in document")
        void addWallType_WithDuplicateName_ReturnsConflict() throws Exception {
            WallTypeCreateRequest request = new WallTypeCreateRequest("Generic - 200mm", WallKind.BASIC, null);
            String body = objectMapper.writeValueAsString(request);

            mockMvc.perform(post("/api/v1/documents/{documentId}/wall-types", document.getId())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isCreated());

            mockMvc.perform(post("/api/v1/documents/{documentId}/wall-types", document.getId())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andDo(print())
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.code").value("T001"));
        }

        @Test
        @DisplayName("should return 404 when document not found")
        void addWallType_WhenDocumentNotExists_ReturnsNotFound() throws Exception {
            WallTypeCreateRequest request = new WallTypeCreateRequest("Generic - 200mm", WallKind.BASIC, null);

            mockMvc.perform(post("/api/v1/documents/{documentId}/wall-types", UUID.randomUUID())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(request)))
                    .andDo(print())
                    .andExpect(status().isNotFound());
        }
    }

    @Nested
    @DisplayName("GET /api/v1/documents/{documentId}/floor-types")
    class GetFloorTypes {

        @Test
        @DisplayName("should list floor types by name")
        void getFloorTypes_ReturnsSortedByName() throws Exception {
            for (String name : new String[]{"Wood Joist", "Concrete 300mm"}) {
                mockMvc.perform(post("/api/v1/documents/{documentId}/floor-types", document.getId())
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(objectMapper.writeValueAsString(new FloorTypeCreateRequest(name, null))))
                        .andExpect(status().isCreated());
            }

            mockMvc.perform(get("/api/v1/documents/{documentId}/floor-types", document.getId()))
                    .andDo(print())
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$", hasSize(2)))
                    .andExpect(jsonPath("$[0].name").value("Concrete 300mm"));
        }
    }
}
