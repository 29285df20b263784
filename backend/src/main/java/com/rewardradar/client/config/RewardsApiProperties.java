package com.rewardradar.client.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Remote endpoints, timeouts and account. Documented in application.yml under rewardradar.api.
 */
@ConfigurationProperties(prefix = "rewardradar.api")
@NoArgsConstructor
@Getter
@Setter
public class RewardsApiProperties {

    private String authUrl = "https://app.tibber.com/login.credentials";

    private String graphqlUrl = "https://app.tibber.com/v4/gql";

    private int connectTimeoutSeconds = 10;

    /** Upper bound for one request/response exchange. */
    private int readTimeoutSeconds = 30;

    private String email;

    private String password;

    /** Home whose rewards are polled. Must be a UUID. */
    private String homeId;
}
