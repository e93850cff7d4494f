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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties bound from the {@code hotp.*} prefix.
 *
 * <ul>
 * <li>{@code hotp.users-file} - credential store used when the caller does not
 * name one</li>
 * <li>{@code hotp.window} - default number of counters searched past the stored
 * one</li>
 * <li>{@code hotp.max-secret-length} - largest decoded secret, in bytes,
 * accepted from the users file</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "hotp")
@Data
public class HotpProperties {

    private String usersFile = "/etc/users.oath";
    private int window = 5;
    private int maxSecretLength = 20;
}
