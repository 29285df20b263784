package com.rewardradar.auth.config;

import com.rewardradar.auth.TokenStore;
import com.rewardradar.client.Credentials;
import com.rewardradar.client.RewardsApiClient;
import com.rewardradar.common.RetryPolicy;
import com.rewardradar.common.Sleeper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(AuthProperties.class)
public class AuthConfig {

    @Bean
    public TokenStore tokenStore(RewardsApiClient rewardsApiClient, Credentials rewardsCredentials,
                                 RetryPolicy retryPolicy, Sleeper sleeper, Clock clock, AuthProperties properties) {
        return new TokenStore(rewardsApiClient, rewardsCredentials, retryPolicy, sleeper, clock,
                properties.getTokenLifetime(), properties.getRefreshBuffer());
    }
}
