package com.voxnote.api.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class WebClientConfig {

    @Bean
    public WebClient llmWebClient(@Value("${voxnote.llm.base-url:https://api.openai.com}") String baseUrl,
                                  @Value("${voxnote.llm.api-key:}") String apiKey,
                                  @Value("${voxnote.llm.timeout-seconds:60}") long timeoutSeconds) {
        WebClient.Builder builder = authorisedBuilder(baseUrl, apiKey, timeoutSeconds);
        builder.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        builder.defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        return builder.build();
    }

    /**
     * Speech-to-text uploads are multipart, so no JSON content type is preset here.
     */
    @Bean
    public WebClient speechWebClient(@Value("${voxnote.speech.base-url:https://api.openai.com}") String baseUrl,
                                     @Value("${voxnote.speech.api-key:}") String apiKey,
                                     @Value("${voxnote.speech.timeout-seconds:120}") long timeoutSeconds) {
        WebClient.Builder builder = authorisedBuilder(baseUrl, apiKey, timeoutSeconds);
        builder.defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        return builder.build();
    }

    private WebClient.Builder authorisedBuilder(String baseUrl, String apiKey, long timeoutSeconds) {
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(baseUrl)
                .exchangeStrategies(exchangeStrategies());
        if (timeoutSeconds > 0) {
            HttpClient httpClient = HttpClient.create()
                    .responseTimeout(Duration.ofSeconds(timeoutSeconds));
            builder.clientConnector(new ReactorClientHttpConnector(httpClient));
        }
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        return builder;
    }

    private ExchangeStrategies exchangeStrategies() {
        return ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                .build();
    }
}
