package me.golemcore.hotp.adapter.outbound.crypto;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.hotp.domain.model.HotpErrorCode;
import me.golemcore.hotp.domain.model.HotpException;
import me.golemcore.hotp.port.outbound.MacPort;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;

/**
 * HMAC-SHA1 through the JCA provider configured in the running JVM.
 */
@Component
@Slf4j
public class JcaHmacSha1Adapter implements MacPort {

    private static final String HMAC_ALGORITHM = "HmacSHA1";

    // HMAC zero-pads the key, so a single zero byte yields the empty-key MAC
    private static final byte[] EMPTY_KEY = new byte[1];

    @Override
    public byte[] hmacSha1(byte[] key, byte[] message) throws HotpException {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(key.length == 0 ? EMPTY_KEY : key, HMAC_ALGORITHM));
            return mac.doFinal(message);
        } catch (GeneralSecurityException e) {
            log.debug("[Crypto] HMAC-SHA1 failed: {}", e.getMessage());
            throw new HotpException(HotpErrorCode.CRYPTO_ERROR, "HMAC-SHA1 failed: " + e.getMessage(), e);
        }
    }
}
