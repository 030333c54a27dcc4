package org.nowstart.scalper.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@RequiredArgsConstructor
public class SwaggerConfig {

    private final BuildProperties buildProperties;

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("valr-scalper API")
                        .description("VALR 스캘핑 엔진의 상태 조회 및 수동 제어 API 문서입니다.")
                        .version(buildProperties.getVersion()))
                .externalDocs(new ExternalDocumentation()
                        .description("VALR API")
                        .url("https://docs.valr.com"));
    }
}
