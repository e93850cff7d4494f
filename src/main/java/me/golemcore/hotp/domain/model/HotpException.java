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

/**
 * Checked failure of an HOTP generation, validation or users file operation.
 * The {@link HotpErrorCode} identifies what went wrong; callers must treat any
 * instance as a failed authentication and assume the users file unchanged.
 */
public class HotpException extends Exception {

    private static final long serialVersionUID = 1L;

    private final HotpErrorCode code;

    public HotpException(HotpErrorCode code) {
        this(code, code.getDescription());
    }

    public HotpException(HotpErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public HotpException(HotpErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public HotpErrorCode getCode() {
        return code;
    }
}
