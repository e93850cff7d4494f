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

import me.golemcore.hotp.domain.model.HotpErrorCode;
import me.golemcore.hotp.domain.model.HotpException;
import me.golemcore.hotp.port.outbound.SecretDecoderPort;
import org.springframework.stereotype.Component;

import java.util.HexFormat;

/**
 * Case-insensitive hex decoding via {@link HexFormat}.
 */
@Component
public class HexSecretDecoder implements SecretDecoderPort {

    private static final HexFormat HEX = HexFormat.of();

    @Override
    public byte[] decodeHex(String hex) throws HotpException {
        try {
            return HEX.parseHex(hex);
        } catch (IllegalArgumentException e) {
            throw new HotpException(HotpErrorCode.INVALID_HEX, "Invalid hex secret", e);
        }
    }
}
