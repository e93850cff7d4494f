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

package me.golemcore.hotp.domain.service;

import lombok.RequiredArgsConstructor;
import me.golemcore.hotp.domain.model.HotpErrorCode;
import me.golemcore.hotp.domain.model.HotpException;
import me.golemcore.hotp.port.outbound.MacPort;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.util.Locale;
import java.util.Objects;

/**
 * HOTP value generation (RFC 4226).
 *
 * <p>
 * The counter is fed to HMAC-SHA1 as 8 big-endian bytes. The low nibble of the
 * last digest byte selects four bytes which, with the top bit cleared, form a
 * 31-bit integer; the OTP is that integer modulo 10<sup>digits</sup>, padded
 * with leading zeros.
 *
 * <p>
 * Only dynamic truncation without a checksum digit is implemented. The
 * {@code addChecksum} and {@code truncationOffset} arguments are accepted for
 * API compatibility and have no effect.
 */
@Service
@RequiredArgsConstructor
public class HotpGenerator {

    /** Let the digest choose the truncation offset. */
    public static final int DYNAMIC_TRUNCATION = -1;

    public static final int MIN_DIGITS = 6;
    public static final int MAX_DIGITS = 8;

    private static final int[] POWERS_OF_TEN = { 1, 10, 100, 1_000, 10_000, 100_000, 1_000_000, 10_000_000,
            100_000_000 };

    private final MacPort macPort;

    public String generate(byte[] secret, long movingFactor, int digits) throws HotpException {
        return generate(secret, movingFactor, digits, false, DYNAMIC_TRUNCATION);
    }

    public String generate(byte[] secret, long movingFactor, int digits, boolean addChecksum,
            int truncationOffset) throws HotpException {
        Objects.requireNonNull(secret, "secret");
        if (!isSupportedDigits(digits)) {
            throw new HotpException(HotpErrorCode.INVALID_DIGITS, "Unsupported OTP length: " + digits);
        }

        byte[] counter = ByteBuffer.allocate(Long.BYTES).putLong(movingFactor).array();
        byte[] hash = macPort.hmacSha1(secret, counter);
        if (hash == null || hash.length < 20) {
            throw new HotpException(HotpErrorCode.CRYPTO_ERROR, "HMAC-SHA1 returned a short digest");
        }

        int offset = hash[hash.length - 1] & 0x0f;
        int binary = ((hash[offset] & 0x7f) << 24)
                | ((hash[offset + 1] & 0xff) << 16)
                | ((hash[offset + 2] & 0xff) << 8)
                | (hash[offset + 3] & 0xff);

        int value = binary % POWERS_OF_TEN[digits];
        String otp = String.format(Locale.ROOT, "%0" + digits + "d", value);
        if (otp.length() != digits) {
            throw new HotpException(HotpErrorCode.FORMAT_ERROR, "Formatted OTP has length " + otp.length());
        }
        return otp;
    }

    public static boolean isSupportedDigits(int digits) {
        return digits >= MIN_DIGITS && digits <= MAX_DIGITS;
    }
}
