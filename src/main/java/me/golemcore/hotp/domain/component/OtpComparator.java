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
import java.util.Objects;

/**
 * Decides whether a candidate OTP produced during window validation is the one
 * the user presented. The validator only ever hands candidates to the
 * comparator, so an implementation may keep the target in any form it likes
 * (plaintext, hashed, held by a remote service).
 *
 * @see HashedOtpComparator
 */
@FunctionalInterface
public interface OtpComparator {

    /**
     * @param candidateOtp
     *            zero-padded decimal OTP generated for one counter value
     * @return {@code true} if the candidate equals the target
     */
    boolean matches(String candidateOtp);

    /**
     * Constant-time comparison against a plaintext OTP.
     */
    static OtpComparator plaintext(String otp) {
        Objects.requireNonNull(otp, "otp");
        byte[] expected = otp.getBytes(StandardCharsets.UTF_8);
        return candidate -> MessageDigest.isEqual(expected, candidate.getBytes(StandardCharsets.UTF_8));
    }
}
