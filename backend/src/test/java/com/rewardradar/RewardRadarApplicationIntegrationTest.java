package com.rewardradar;

import com.rewardradar.client.AccessToken;
import com.rewardradar.client.Credentials;
import com.rewardradar.client.GridRewardsPeriod;
import com.rewardradar.client.RewardsApiClient;
import com.rewardradar.domain.RateLimiterStateRepository;
import com.rewardradar.fetch.RewardPeriods;
import com.rewardradar.polling.PollSummary;
import com.rewardradar.polling.RewardsPollJob;
import com.rewardradar.ratelimit.RateLimiterStateService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atMost;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest
@AutoConfigureWebTestClient
@Testcontainers(disabledWithoutDocker = true)
class RewardRadarApplicationIntegrationTest {

    private static final String HOME = "96a14971-525a-4420-aae9-e5aedaa129ff";

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    WebTestClient webTestClient;
    @Autowired
    RewardsPollJob rewardsPollJob;
    @Autowired
    RewardPeriods rewardPeriods;
    @Autowired
    RateLimiterStateService rateLimiterStateService;
    @Autowired
    RateLimiterStateRepository rateLimiterStateRepository;

    @MockBean
    RewardsApiClient rewardsApiClient;

    @Test
    @DisplayName("poll fills every slot through the full stack and the limiter state is persisted")
    void pollAndPersist() {
        when(rewardsApiClient.login(any(Credentials.class))).thenReturn("token-1");
        when(rewardsApiClient.fetchGridRewards(any(AccessToken.class), anyString(), any(Instant.class), any(Instant.class)))
                .thenAnswer(inv -> new GridRewardsPeriod(new BigDecimal("1.00"), new BigDecimal("2.00"),
                        new BigDecimal("3.00"), "EUR", inv.getArgument(2), inv.getArgument(3)));
        int distinctPeriods = (int) rewardPeriods.standardPeriods(HOME).values().stream()
                .map(r -> r.from() + "/" + r.to())
                .distinct()
                .count();

        PollSummary summary = rewardsPollJob.pollRewards();

        assertThat(summary.periods()).isEqualTo(12);
        assertThat(summary.failed()).isZero();
        verify(rewardsApiClient, atMost(1)).login(any(Credentials.class));

        webTestClient.get()
                .uri("/api/v1/rewards")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(12);

        webTestClient.get()
                .uri("/api/v1/diagnostics")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.rateLimiter.hourlyCount").isEqualTo(distinctPeriods)
                .jsonPath("$.cache.entries").isEqualTo(distinctPeriods);

        rateLimiterStateService.flushIfDirty();
        assertThat(rateLimiterStateRepository.findById("default"))
                .hasValueSatisfying(state -> assertThat(state.getHourlyCount()).isEqualTo(distinctPeriods));
    }
}
