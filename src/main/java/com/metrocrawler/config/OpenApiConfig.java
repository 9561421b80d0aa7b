package com.metrocrawler.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

        @Bean
        public OpenAPI metroCrawlerOpenAPI() {
                return new OpenAPI()
                                .info(new Info()
                                                .title("Metro Crawler API")
                                                .description(
                                                                "Harvests the topology of a transit network from Wikidata. "
                                                                                + "Give it a transport system and one of its stations; "
                                                                                + "it returns every line and station it can reach, with names, "
                                                                                + "coordinates, colors and connections.")
                                                .version("v0.1.0")
                                                .license(new License().name("Apache 2.0")))
                                .servers(List.of(
                                                new Server().url("http://localhost:8080")
                                                                .description("Local Development")));
        }
}
