package me.golemcore.hotp.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.hotp.domain.component.OtpComparator;
import me.golemcore.hotp.domain.model.AuthenticationResult;
import me.golemcore.hotp.domain.model.CredentialRecord;
import me.golemcore.hotp.domain.model.HotpException;
import me.golemcore.hotp.domain.model.UsersFileTimestamp;
import me.golemcore.hotp.infrastructure.config.HotpProperties;
import me.golemcore.hotp.port.outbound.CredentialStorePort;
import me.golemcore.hotp.port.outbound.CredentialStoreSession;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Objects;

/**
 * Entry point for HOTP authentication against a users file, plus thin
 * delegates for bare OTP generation and validation.
 *
 * <p>
 * An authentication runs to completion or to the first failure:
 * <ol>
 * <li>open the users file ({@code NO_SUCH_FILE})</li>
 * <li>find the user's record (parse errors, {@code UNKNOWN_USER},
 * {@code BAD_PASSWORD})</li>
 * <li>if the OTP equals the last accepted one, report {@code REPLAYED} without
 * touching the file</li>
 * <li>search the window from the stored counter ({@code INVALID_OTP})</li>
 * <li>stamp the current local time ({@code TIME_ERROR})</li>
 * <li>persist counter + offset, the OTP and the timestamp (store I/O
 * errors)</li>
 * </ol>
 * Nothing is retried. Only the last step holds the file lock, so two
 * simultaneous attempts may both validate; the file then ends up as written by
 * whichever one locked last.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HotpAuthenticationService {

    private final HotpGenerator generator;
    private final HotpValidator validator;
    private final CredentialStorePort credentialStore;
    private final HotpProperties properties;
    private final Clock clock;

    /**
     * Authenticate against the configured users file and window.
     */
    public AuthenticationResult authenticate(String username, String otp, String password) throws HotpException {
        Path usersFile = Paths.get(properties.getUsersFile());
        return authenticate(usersFile, username, otp, properties.getWindow(), password);
    }

    /**
     * @param password
     *            password to check, or {@code null} to ignore stored passwords
     * @return {@code AUTHENTICATED} with the new counter, or {@code REPLAYED} with
     *         the stored timestamp of the last success
     */
    public AuthenticationResult authenticate(Path usersFile, String username, String otp, int window,
            String password) throws HotpException {
        Objects.requireNonNull(usersFile, "usersFile");
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(otp, "otp");
        if (window < 0) {
            throw new IllegalArgumentException("window must not be negative: " + window);
        }

        try (CredentialStoreSession session = credentialStore.open(usersFile)) {
            CredentialRecord record = session.findRecord(username, password);
            try {
                return authenticate(session, record, otp, window);
            } finally {
                Arrays.fill(record.getSecret(), (byte) 0);
            }
        } catch (HotpException e) {
            log.warn("[Hotp] Authentication failed for user {}: {}", username, e.getCode());
            throw e;
        }
    }

    private AuthenticationResult authenticate(CredentialStoreSession session, CredentialRecord record, String otp,
            int window) throws HotpException {
        if (isReplay(record, otp)) {
            log.warn("[Hotp] Replayed OTP for user {} (last success {})", record.getUsername(),
                    record.getLastTimestamp());
            return AuthenticationResult.replayed(record);
        }

        long start = record.getMovingFactor();
        int offset = validator.validate(record.getSecret(), start, window, record.getDigits(),
                OtpComparator.plaintext(otp));
        long newMovingFactor = start + offset;

        String timestamp = UsersFileTimestamp.format(LocalDateTime.now(clock));
        session.update(record, otp, timestamp, newMovingFactor);

        log.info("[Hotp] User {} authenticated, counter {} -> {}", record.getUsername(),
                Long.toUnsignedString(start), Long.toUnsignedString(newMovingFactor));
        return AuthenticationResult.authenticated(record, offset, newMovingFactor, timestamp);
    }

    private boolean isReplay(CredentialRecord record, String otp) {
        String lastOtp = record.getLastOtp();
        // the stored token holds raw file bytes, one char per byte
        return lastOtp != null && MessageDigest.isEqual(lastOtp.getBytes(StandardCharsets.ISO_8859_1),
                otp.getBytes(StandardCharsets.UTF_8));
    }

    public String generateOtp(byte[] secret, long movingFactor, int digits) throws HotpException {
        return generator.generate(secret, movingFactor, digits);
    }

    public int validateOtp(byte[] secret, long startMovingFactor, int window, int digits, String otp)
            throws HotpException {
        return validator.validate(secret, startMovingFactor, window, digits, otp);
    }

    public int validateOtpWithComparator(byte[] secret, long startMovingFactor, int window, int digits,
            OtpComparator comparator) throws HotpException {
        return validator.validate(secret, startMovingFactor, window, digits, comparator);
    }
}
