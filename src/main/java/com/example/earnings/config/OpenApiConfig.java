package com.example.earnings.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("earnings-quality-lite API")
                        .version("0.1.0")
                        .description("은행 세전이익(PBT) 성장의 이익의 질 분해: T12M/QoQ/YoY/Annual 기준 핵심수익·비용·비경상 기여도"));
    }
}
