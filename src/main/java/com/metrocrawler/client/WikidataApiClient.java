package com.metrocrawler.client;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;

@Component
public class WikidataApiClient implements WikidataApi {

        private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT = new ParameterizedTypeReference<>() {
        };

        private final WebClient webClient;
        private final WikidataRateLimiter rateLimiter;

        @Value("${wikidata.api.timeout}")
        private int apiTimeout;

        public WikidataApiClient(WebClient.Builder webClientBuilder, WikidataRateLimiter rateLimiter,
                        @Value("${wikidata.api.base-url}") String baseUrl,
                        @Value("${wikidata.api.user-agent}") String userAgent) {
                this.rateLimiter = rateLimiter;
                this.webClient = webClientBuilder
                                .baseUrl(baseUrl)
                                .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
                                .codecs(configurer -> configurer
                                                .defaultCodecs()
                                                .maxInMemorySize(8 * 1024 * 1024)) // large interchange hubs
                                .build();
        }

        @Override
        public Map<String, Object> getEntity(String entityId) {
                rateLimiter.acquire();
                return webClient.get()
                                .uri(uriBuilder -> uriBuilder
                                                .path("/w/api.php")
                                                .queryParam("action", "wbgetentities")
                                                .queryParam("format", "json")
                                                .queryParam("props", "{props}")
                                                .queryParam("ids", "{id}")
                                                .build("labels|descriptions|claims|sitelinks", entityId))
                                .retrieve()
                                .bodyToMono(JSON_OBJECT)
                                .timeout(Duration.ofSeconds(apiTimeout))
                                .block();
        }

        @Override
        public Map<String, Object> getClaims(String entityId, String property) {
                rateLimiter.acquire();
                return webClient.get()
                                .uri(uriBuilder -> uriBuilder
                                                .path("/w/api.php")
                                                .queryParam("action", "wbgetclaims")
                                                .queryParam("format", "json")
                                                .queryParam("entity", "{id}")
                                                .queryParam("property", "{property}")
                                                .build(entityId, property))
                                .retrieve()
                                .bodyToMono(JSON_OBJECT)
                                .timeout(Duration.ofSeconds(apiTimeout))
                                .block();
        }
}
