package me.golemcore.hotp.port.outbound;

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

import me.golemcore.hotp.domain.model.HotpException;

/**
 * Port for the keyed MAC primitive underlying HOTP.
 */
public interface MacPort {

    /**
     * Compute HMAC-SHA1 of {@code message} under {@code key}.
     *
     * @return the 20-byte digest
     * @throws HotpException
     *             with {@code CRYPTO_ERROR} if the MAC cannot be computed
     */
    byte[] hmacSha1(byte[] key, byte[] message) throws HotpException;
}
