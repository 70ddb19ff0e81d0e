package uk.gegc.reviewscheduler.shared.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI reviewSchedulerOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Review Scheduler API")
                        .description("Spaced-repetition scheduling, due lists, statistics and reminders")
                        .version("v1"))
                .components(new Components()
                        .addSecuritySchemes("bearerAuth", new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("JWT")));
    }

    @Bean
    public GroupedOpenApi reviewGroup() {
        return GroupedOpenApi.builder()
                .group("review")
                .displayName("Review Scheduling")
                .pathsToMatch("/api/v1/review/records/**", "/api/v1/review/due", "/api/v1/review/history",
                        "/api/v1/review/reminders")
                .build();
    }

    @Bean
    public GroupedOpenApi statisticsGroup() {
        return GroupedOpenApi.builder()
                .group("statistics")
                .displayName("Review Statistics")
                .pathsToMatch("/api/v1/review/statistics", "/api/v1/review/upcoming", "/api/v1/review/summary/**")
                .build();
    }
}
