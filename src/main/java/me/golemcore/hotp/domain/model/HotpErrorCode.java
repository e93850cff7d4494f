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

/**
 * Failure reasons reported by the HOTP algorithm and the users file store.
 *
 * <p>
 * Codes are grouped by origin:
 * <ul>
 * <li>algorithm - {@link #INVALID_DIGITS}, {@link #CRYPTO_ERROR},
 * {@link #FORMAT_ERROR}, {@link #INVALID_OTP}</li>
 * <li>record parsing - {@link #UNKNOWN_USER}, {@link #BAD_PASSWORD},
 * {@link #INVALID_COUNTER}, {@link #INVALID_TIMESTAMP}, {@link #INVALID_HEX},
 * {@link #SECRET_TOO_LONG}</li>
 * <li>store I/O - everything prefixed {@code FILE_}, plus {@link #NO_SUCH_FILE}
 * and {@link #TIME_ERROR}</li>
 * </ul>
 *
 * <p>
 * A replayed OTP is not an error and has no code here, see
 * {@link AuthenticationResult.Status#REPLAYED}.
 */
public enum HotpErrorCode {

    INVALID_DIGITS("Unsupported number of OTP digits"),

    CRYPTO_ERROR("Cryptographic error"),

    FORMAT_ERROR("Failed to format OTP value"),

    INVALID_OTP("The OTP is not valid within the search window"),

    UNKNOWN_USER("Cannot find information about user"),

    BAD_PASSWORD("Supplied password does not match stored password"),

    INVALID_COUNTER("Cannot parse counter value in users file"),

    INVALID_TIMESTAMP("Cannot parse last-success timestamp in users file"),

    INVALID_HEX("Hex string is invalid"),

    SECRET_TOO_LONG("Decoded secret exceeds the configured maximum length"),

    NO_SUCH_FILE("Users file does not exist or cannot be opened"),

    FILE_READ_ERROR("Failed to read users file"),

    FILE_SEEK_ERROR("Cannot rewind users file"),

    FILE_CREATE_ERROR("Cannot create companion file"),

    FILE_LOCK_ERROR("Cannot lock users file"),

    FILE_WRITE_ERROR("Failed to write updated users file"),

    FILE_RENAME_ERROR("Cannot move updated users file into place"),

    FILE_UNLINK_ERROR("Cannot remove lock file"),

    TIME_ERROR("Cannot produce last-success timestamp");

    private final String description;

    HotpErrorCode(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
