package org.sharehub.thumbnails.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI(@Value("${openapi.service.title:ShareHub Thumbnails}") String serviceTitle,
                                 @Value("${openapi.service.version:1.0.0}") String serviceVersion,
                                 @Value("${openapi.service.url:http://localhost:8081}") String url) {
        return new OpenAPI()
                .servers(List.of(new Server().url(url)))
                .info(new Info().title(serviceTitle)
                        .version(serviceVersion)
                        .description("API for slide thumbnail generation, quota and maintenance sweeps"));
    }

}
