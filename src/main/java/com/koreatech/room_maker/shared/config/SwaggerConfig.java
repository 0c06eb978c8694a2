package com.koreatech.room_maker.shared.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Room Maker API")
                .description("""
                    직사각형 방 자동 생성 API

                    ## 주요 기능
                    - 문서(건물 정보 모델) 관리
                    - 벽 타입 / 바닥 타입 카탈로그 관리
                    - 방 치수(미터) 입력으로 레벨, 벽 4개, 바닥 1개를 하나의 트랜잭션으로 생성

                    ## 단위
                    입력은 미터, 문서 내부 길이 단위는 피트입니다.
                    """)
                .version("1.0.0")
                .contact(new Contact()
                    .name("KoreaTech Room Maker Team")))
            .tags(List.of(
                new Tag().name("Document").description("문서 관리 API"),
                new Tag().name("ElementType").description("벽/바닥 타입 관리 API"),
                new Tag().name("Room").description("방 생성 API")
            ));
    }
}
