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

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;

/**
 * Last-success timestamp column: local time as {@code YYYY-MM-DDTHH:MM:SSL},
 * always 20 characters.
 */
public final class UsersFileTimestamp {

    public static final int LENGTH = 20;

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter
            .ofPattern("uuuu-MM-dd'T'HH:mm:ss'L'", Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT);

    private UsersFileTimestamp() {
    }

    public static String format(LocalDateTime time) throws HotpException {
        String formatted;
        try {
            formatted = FORMATTER.format(time);
        } catch (RuntimeException e) {
            throw new HotpException(HotpErrorCode.TIME_ERROR, "Cannot format timestamp: " + e.getMessage(), e);
        }
        if (formatted.length() != LENGTH) {
            throw new HotpException(HotpErrorCode.TIME_ERROR,
                    "Timestamp has unexpected length " + formatted.length() + ": " + formatted);
        }
        return formatted;
    }

    public static LocalDateTime parse(String token) throws HotpException {
        if (token.length() != LENGTH) {
            throw new HotpException(HotpErrorCode.INVALID_TIMESTAMP, "Malformed timestamp: " + token);
        }
        try {
            return LocalDateTime.parse(token, FORMATTER);
        } catch (DateTimeParseException e) {
            throw new HotpException(HotpErrorCode.INVALID_TIMESTAMP, "Malformed timestamp: " + token, e);
        }
    }
}
