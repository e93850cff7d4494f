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

package me.golemcore.hotp.adapter.outbound.usersfile;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.hotp.domain.model.CredentialRecord;
import me.golemcore.hotp.domain.model.HotpErrorCode;
import me.golemcore.hotp.domain.model.HotpException;
import me.golemcore.hotp.domain.model.TokenType;
import me.golemcore.hotp.domain.model.UsersFileTimestamp;
import me.golemcore.hotp.infrastructure.config.HotpProperties;
import me.golemcore.hotp.port.outbound.SecretDecoderPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Locates a user's record in a users file.
 *
 * <p>
 * Lines are scanned top to bottom and split on blanks, tabs and line breaks.
 * The first line whose type token is known and whose username matches is the
 * record; lines with an unknown type, another user, no secret, or (when a
 * password is checked) no password column are passed over. Once the record
 * line is found its remaining columns must parse, otherwise the matching error
 * is raised rather than trying further lines.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UsersFileParser {

    private static final int TYPE = 0;
    private static final int USERNAME = 1;
    private static final int PASSWORD = 2;
    private static final int SECRET = 3;
    private static final int MOVING_FACTOR = 4;
    private static final int LAST_OTP = 5;
    private static final int LAST_TIMESTAMP = 6;

    private final SecretDecoderPort secretDecoder;
    private final HotpProperties properties;

    /**
     * @param username
     *            user to look up
     * @param password
     *            password to verify, or {@code null} to skip password checks
     */
    CredentialRecord findRecord(RawLineReader lines, String username, String password)
            throws HotpException {
        String fileUsername = UsersFileFormat.toFileText(username);
        String filePassword = UsersFileFormat.toFileText(password);

        int lineIndex = 0;
        String line;
        while ((line = readLine(lines)) != null) {
            Optional<CredentialRecord> record = parseLine(line, lineIndex, fileUsername, filePassword);
            if (record.isPresent()) {
                return record.get();
            }
            lineIndex++;
        }

        log.debug("[UsersFile] No record for user {}", username);
        throw new HotpException(HotpErrorCode.UNKNOWN_USER, "Unknown user: " + username);
    }

    private Optional<CredentialRecord> parseLine(String line, int lineIndex, String username, String password)
            throws HotpException {
        List<String> tokens = UsersFileFormat.tokenize(line);
        if (tokens.isEmpty()) {
            return Optional.empty();
        }

        Optional<TokenType> type = TokenType.fromToken(tokens.get(TYPE));
        if (type.isEmpty()) {
            return Optional.empty();
        }

        String user = token(tokens, USERNAME);
        if (user == null || !user.equals(username)) {
            return Optional.empty();
        }

        String storedPassword = token(tokens, PASSWORD);
        if (password != null) {
            if (storedPassword == null) {
                return Optional.empty();
            }
            if (CredentialRecord.NO_PASSWORD.equals(storedPassword) || !passwordMatches(storedPassword, password)) {
                throw new HotpException(HotpErrorCode.BAD_PASSWORD, "Bad password for user: " + username);
            }
        }

        String secretHex = token(tokens, SECRET);
        if (secretHex == null) {
            return Optional.empty();
        }
        byte[] secret = decodeSecret(secretHex);

        try {
            return Optional.of(CredentialRecord.builder()
                    .lineIndex(lineIndex)
                    .typeToken(tokens.get(TYPE))
                    .tokenType(type.get())
                    .username(user)
                    .password(storedPassword)
                    .secretHex(secretHex)
                    .secret(secret)
                    .movingFactor(parseMovingFactor(token(tokens, MOVING_FACTOR)))
                    .lastOtp(token(tokens, LAST_OTP))
                    .lastTimestamp(parseTimestamp(token(tokens, LAST_TIMESTAMP)))
                    .build());
        } catch (HotpException e) {
            Arrays.fill(secret, (byte) 0);
            throw e;
        }
    }

    private byte[] decodeSecret(String secretHex) throws HotpException {
        byte[] secret = secretDecoder.decodeHex(secretHex);
        if (secret.length > properties.getMaxSecretLength()) {
            int length = secret.length;
            Arrays.fill(secret, (byte) 0);
            throw new HotpException(HotpErrorCode.SECRET_TOO_LONG,
                    "Secret of " + length + " bytes exceeds limit of " + properties.getMaxSecretLength());
        }
        return secret;
    }

    private long parseMovingFactor(String token) throws HotpException {
        if (token == null) {
            return 0L;
        }
        try {
            return Long.parseUnsignedLong(token);
        } catch (NumberFormatException e) {
            throw new HotpException(HotpErrorCode.INVALID_COUNTER, "Invalid counter: " + token, e);
        }
    }

    private LocalDateTime parseTimestamp(String token) throws HotpException {
        return token == null ? null : UsersFileTimestamp.parse(token);
    }

    private boolean passwordMatches(String stored, String supplied) {
        return MessageDigest.isEqual(stored.getBytes(StandardCharsets.ISO_8859_1),
                supplied.getBytes(StandardCharsets.ISO_8859_1));
    }

    private String readLine(RawLineReader lines) throws HotpException {
        try {
            return lines.nextLine();
        } catch (IOException e) {
            throw new HotpException(HotpErrorCode.FILE_READ_ERROR, "Failed to read users file", e);
        }
    }

    private static String token(List<String> tokens, int index) {
        return index < tokens.size() ? tokens.get(index) : null;
    }
}
