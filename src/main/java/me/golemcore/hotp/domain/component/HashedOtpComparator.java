package me.golemcore.hotp.domain.component;

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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Compares candidates against a SHA-256 digest of the target OTP, so the
 * plaintext OTP never has to be present where validation runs.
 */
public final class HashedOtpComparator implements OtpComparator {

    private static final String DIGEST_ALGORITHM = "SHA-256";
    private static final int DIGEST_LENGTH = 32;

    private final byte[] targetDigest;

    private HashedOtpComparator(byte[] targetDigest) {
        if (targetDigest == null || targetDigest.length != DIGEST_LENGTH) {
            throw new IllegalArgumentException("SHA-256 digest must be " + DIGEST_LENGTH + " bytes");
        }
        this.targetDigest = targetDigest.clone();
    }

    public static HashedOtpComparator fromDigest(byte[] sha256Digest) {
        return new HashedOtpComparator(sha256Digest);
    }

    public static HashedOtpComparator fromHex(String sha256Hex) {
        return new HashedOtpComparator(HexFormat.of().parseHex(sha256Hex));
    }

    /**
     * Hashes {@code otp} right away and keeps only the digest.
     */
    public static HashedOtpComparator of(String otp) {
        return new HashedOtpComparator(sha256(otp));
    }

    public static byte[] sha256(String otp) {
        try {
            return MessageDigest.getInstance(DIGEST_ALGORITHM).digest(otp.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(DIGEST_ALGORITHM + " not available", e);
        }
    }

    @Override
    public boolean matches(String candidateOtp) {
        return MessageDigest.isEqual(targetDigest, sha256(candidateOtp));
    }
}
