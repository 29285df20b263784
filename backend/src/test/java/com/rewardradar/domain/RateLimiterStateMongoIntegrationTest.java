package com.rewardradar.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DataMongoTest
@Testcontainers(disabledWithoutDocker = true)
class RateLimiterStateMongoIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    RateLimiterStateRepository repository;

    @Test
    @DisplayName("persist, overwrite and delete the limiter document by state id")
    void persistAndOverwrite() {
        RateLimiterState state = new RateLimiterState();
        state.setId("default");
        state.setHourlyCount(58);
        state.setHourlyWindowStart(Instant.parse("2024-05-10T12:00:00Z"));
        state.setBurstCount(3);
        state.setBurstWindowStart(Instant.parse("2024-05-10T12:10:00Z"));
        state.setUpdatedAt(Instant.parse("2024-05-10T12:11:00Z"));
        repository.save(state);

        state.setHourlyCount(59);
        repository.save(state);

        assertThat(repository.count()).isEqualTo(1);
        RateLimiterState loaded = repository.findById("default").orElseThrow();
        assertThat(loaded.getHourlyCount()).isEqualTo(59);
        assertThat(loaded.getBurstCount()).isEqualTo(3);
        assertThat(loaded.getHourlyWindowStart()).isEqualTo(Instant.parse("2024-05-10T12:00:00Z"));
        assertThat(loaded.getBurstWindowStart()).isEqualTo(Instant.parse("2024-05-10T12:10:00Z"));

        repository.deleteById("default");
        assertThat(repository.findById("default")).isEmpty();
    }
}
