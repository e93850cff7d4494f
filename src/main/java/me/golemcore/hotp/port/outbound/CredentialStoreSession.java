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

import me.golemcore.hotp.domain.model.CredentialRecord;
import me.golemcore.hotp.domain.model.HotpException;

/**
 * An opened credential store. Reads go against the content seen at open time;
 * {@link #update} publishes a complete new version of the store.
 */
public interface CredentialStoreSession extends AutoCloseable {

    /**
     * Locate the record for {@code username}.
     *
     * @param password
     *            password to check against the record, or {@code null} to ignore
     *            stored passwords entirely
     * @throws HotpException
     *             {@code UNKNOWN_USER}, {@code BAD_PASSWORD}, {@code INVALID_HEX},
     *             {@code SECRET_TOO_LONG}, {@code INVALID_COUNTER},
     *             {@code INVALID_TIMESTAMP} or {@code FILE_READ_ERROR}
     */
    CredentialRecord findRecord(String username, String password) throws HotpException;

    /**
     * Replace the record previously returned by {@link #findRecord} with the new
     * counter, OTP and timestamp, leaving every other line untouched.
     */
    void update(CredentialRecord record, String otp, String timestamp, long newMovingFactor)
            throws HotpException;

    @Override
    void close();
}
