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

package me.golemcore.hotp.domain.model;

import java.util.Optional;

/**
 * Token type column of a users file line. Only these spellings mark a line as
 * a credential record; any other first token makes the line opaque.
 */
public enum TokenType {

    HOTP("HOTP", 6),

    HOTP_E("HOTP/E", 6),

    HOTP_E_6("HOTP/E/6", 6),

    HOTP_E_7("HOTP/E/7", 7),

    HOTP_E_8("HOTP/E/8", 8);

    private final String token;
    private final int digits;

    TokenType(String token, int digits) {
        this.token = token;
        this.digits = digits;
    }

    public String getToken() {
        return token;
    }

    public int getDigits() {
        return digits;
    }

    public static Optional<TokenType> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        for (TokenType type : values()) {
            if (type.token.equals(token)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
