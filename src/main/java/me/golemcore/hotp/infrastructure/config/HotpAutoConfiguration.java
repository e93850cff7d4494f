package me.golemcore.hotp.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;

import java.time.Clock;

/**
 * Spring auto-configuration that registers the HOTP services, the users file
 * adapter and the crypto adapters.
 *
 * <p>
 * Registered in
 * {@code META-INF/spring/org.springframework.boot.autoconfigure.AutoConfiguration.imports},
 * so any Spring Boot application with this library on the classpath can inject
 * {@link me.golemcore.hotp.domain.service.HotpAuthenticationService}. Settings
 * come from {@code hotp.*}, see {@link HotpProperties}.
 */
@AutoConfiguration
@ComponentScan(basePackages = { "me.golemcore.hotp.domain", "me.golemcore.hotp.adapter" })
@EnableConfigurationProperties(HotpProperties.class)
@RequiredArgsConstructor
@Slf4j
public class HotpAutoConfiguration {

    private final HotpProperties properties;

    @Bean
    @ConditionalOnMissingBean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @PostConstruct
    public void init() {
        if (properties.getWindow() < 0) {
            throw new IllegalStateException("hotp.window must not be negative: " + properties.getWindow());
        }
        if (properties.getMaxSecretLength() <= 0) {
            throw new IllegalStateException(
                    "hotp.max-secret-length must be positive: " + properties.getMaxSecretLength());
        }
        log.info("[Hotp] Users file: {}", properties.getUsersFile());
        log.info("[Hotp] Window: {}, max secret length: {} bytes", properties.getWindow(),
                properties.getMaxSecretLength());
    }
}
