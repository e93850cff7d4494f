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

import java.nio.file.Path;

/**
 * Port for the credential store holding per-user HOTP state.
 */
public interface CredentialStorePort {

    /**
     * Open the store for one authentication attempt. The returned session must be
     * closed by the caller.
     *
     * @throws HotpException
     *             with {@code NO_SUCH_FILE} if the store cannot be opened
     */
    CredentialStoreSession open(Path usersFile) throws HotpException;
}
