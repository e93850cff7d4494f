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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.hotp.domain.component.OtpComparator;
import me.golemcore.hotp.domain.model.HotpErrorCode;
import me.golemcore.hotp.domain.model.HotpException;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Searches a window of counter values for an OTP accepted by an
 * {@link OtpComparator}.
 *
 * <p>
 * Counters {@code start}, {@code start + 1}, ..., {@code start + window} are
 * tried in order and the offset of the first match is returned, so a window of
 * 0 checks the start counter only. Generation errors abort the search.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HotpValidator {

    private final HotpGenerator generator;

    /**
     * @return offset from {@code startMovingFactor} of the matching counter
     * @throws HotpException
     *             {@code INVALID_OTP} when nothing in the window matches, or any
     *             generator error
     */
    public int validate(byte[] secret, long startMovingFactor, int window, int digits, OtpComparator comparator)
            throws HotpException {
        Objects.requireNonNull(comparator, "comparator");
        if (window < 0) {
            throw new IllegalArgumentException("window must not be negative: " + window);
        }

        // long so that window == Integer.MAX_VALUE terminates
        for (long iter = 0; iter <= window; iter++) {
            String candidate = generator.generate(secret, startMovingFactor + iter, digits);
            if (comparator.matches(candidate)) {
                log.debug("[Hotp] OTP matched at offset {} of window {}", iter, window);
                return (int) iter;
            }
        }
        throw new HotpException(HotpErrorCode.INVALID_OTP);
    }

    public int validate(byte[] secret, long startMovingFactor, int window, int digits, String otp)
            throws HotpException {
        return validate(secret, startMovingFactor, window, digits, OtpComparator.plaintext(otp));
    }

    /**
     * Validate a plaintext OTP whose length gives the number of digits.
     */
    public int validate(byte[] secret, long startMovingFactor, int window, String otp) throws HotpException {
        Objects.requireNonNull(otp, "otp");
        return validate(secret, startMovingFactor, window, otp.length(), OtpComparator.plaintext(otp));
    }
}
