package com.rewardradar.client.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rewardradar.client.Credentials;
import com.rewardradar.client.RewardsApiClient;
import com.rewardradar.client.WebClientRewardsApiClient;
import io.netty.channel.ChannelOption;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Outbound HTTP client for the rewards API.
 */
@Configuration
@EnableConfigurationProperties(RewardsApiProperties.class)
public class RewardsClientConfig {

    @Bean
    public RewardsApiClient rewardsApiClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                                             RewardsApiProperties properties) {
        Duration readTimeout = Duration.ofSeconds(properties.getReadTimeoutSeconds());
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, properties.getConnectTimeoutSeconds() * 1000)
                .responseTimeout(readTimeout);
        WebClient.Builder builder = webClientBuilder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient));
        return new WebClientRewardsApiClient(builder, objectMapper, properties.getAuthUrl(),
                properties.getGraphqlUrl(), readTimeout);
    }

    @Bean
    public Credentials rewardsCredentials(RewardsApiProperties properties) {
        return new Credentials(properties.getEmail(), properties.getPassword());
    }
}
