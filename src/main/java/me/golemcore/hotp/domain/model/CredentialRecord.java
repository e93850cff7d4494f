package me.golemcore.hotp.domain.model;

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

import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * One user's HOTP state as read from a users file line:
 *
 * <pre>
 * &lt;type&gt; &lt;username&gt; &lt;password|-&gt; &lt;secret-hex&gt; [&lt;moving-factor&gt;] [&lt;last-otp&gt;] [&lt;last-timestamp&gt;]
 * </pre>
 *
 * <p>
 * String fields hold the raw tokens exactly as they appear in the file, so the
 * record can be written back without re-encoding. {@code movingFactor} is an
 * unsigned 64-bit value.
 */
@Data
@Builder
public class CredentialRecord {

    public static final String NO_PASSWORD = "-";

    /** Zero-based index of the record's line within the file. */
    private int lineIndex;

    private String typeToken;
    private TokenType tokenType;
    private String username;

    @ToString.Exclude
    private String password;

    @ToString.Exclude
    private String secretHex;

    @ToString.Exclude
    private byte[] secret;

    private long movingFactor;

    @ToString.Exclude
    private String lastOtp;

    private LocalDateTime lastTimestamp;

    public int getDigits() {
        return tokenType.getDigits();
    }

    public boolean hasPassword() {
        return password != null && !NO_PASSWORD.equals(password);
    }
}
