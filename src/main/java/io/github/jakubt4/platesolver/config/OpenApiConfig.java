package io.github.jakubt4.platesolver.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API description served at {@code /v3/api-docs}, browsable under {@code /swagger}.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    OpenAPI plateSolverOpenApi(@Value("${astrometry.api-version:0.1.0}") final String version) {
        return new OpenAPI().info(new Info()
                .title("Plate Solver API")
                .version(version)
                .description("Plate-solving of astronomical images with the offline astrometry.net engine")
                .license(new License().name("GPL-3.0").url("https://www.gnu.org/licenses/gpl-3.0.en.html")));
    }
}
