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

import java.time.LocalDateTime;

/**
 * Non-error outcome of a users file authentication. Failures are reported as
 * {@link HotpException} instead.
 */
@Data
@Builder
public class AuthenticationResult {

    public enum Status {
        /**
         * OTP matched within the window; counter advanced and persisted.
         */
        AUTHENTICATED,

        /**
         * OTP equals the last accepted one; nothing was changed.
         */
        REPLAYED
    }

    private Status status;
    private int offset;
    private long previousMovingFactor;
    private long newMovingFactor;

    /**
     * Timestamp of the last successful authentication as stored before this call,
     * or {@code null} when the record carried none.
     */
    private LocalDateTime lastSuccess;

    private String newTimestamp;

    public boolean isAuthenticated() {
        return status == Status.AUTHENTICATED;
    }

    public boolean isReplayed() {
        return status == Status.REPLAYED;
    }

    public static AuthenticationResult authenticated(CredentialRecord record, int offset, long newMovingFactor,
            String newTimestamp) {
        return AuthenticationResult.builder()
                .status(Status.AUTHENTICATED)
                .offset(offset)
                .previousMovingFactor(record.getMovingFactor())
                .newMovingFactor(newMovingFactor)
                .lastSuccess(record.getLastTimestamp())
                .newTimestamp(newTimestamp)
                .build();
    }

    public static AuthenticationResult replayed(CredentialRecord record) {
        return AuthenticationResult.builder()
                .status(Status.REPLAYED)
                .previousMovingFactor(record.getMovingFactor())
                .newMovingFactor(record.getMovingFactor())
                .lastSuccess(record.getLastTimestamp())
                .build();
    }
}
