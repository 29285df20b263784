package com.rewardradar.auth.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Token lifetime and refresh margin. The login response carries no expiry, so the lifetime is assumed.
 */
@ConfigurationProperties(prefix = "rewardradar.auth")
@NoArgsConstructor
@Getter
@Setter
public class AuthProperties {

    private Duration tokenLifetime = Duration.ofHours(1);

    /** A token is refreshed once less than this remains. */
    private Duration refreshBuffer = Duration.ofMinutes(10);
}
