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

package me.golemcore.hotp.adapter.outbound.usersfile;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.hotp.domain.model.CredentialRecord;
import me.golemcore.hotp.domain.model.HotpErrorCode;
import me.golemcore.hotp.domain.model.HotpException;
import me.golemcore.hotp.port.outbound.CredentialStorePort;
import me.golemcore.hotp.port.outbound.CredentialStoreSession;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Flat-file implementation of CredentialStorePort (the "users file" format
 * used by PAM OATH deployments).
 *
 * <p>
 * The file stays open for the whole session: the record is parsed from it and
 * the rewrite streams it again from the start, so both see the same content
 * even if another process replaces the file in between.
 *
 * @see UsersFileParser
 * @see UsersFileUpdater
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UsersFileAdapter implements CredentialStorePort {

    private final UsersFileParser parser;
    private final UsersFileUpdater updater;

    @Override
    public CredentialStoreSession open(Path usersFile) throws HotpException {
        try {
            FileChannel channel = FileChannel.open(usersFile, StandardOpenOption.READ);
            log.debug("[UsersFile] Opened {}", usersFile);
            return new Session(usersFile, channel);
        } catch (IOException e) {
            throw new HotpException(HotpErrorCode.NO_SUCH_FILE, "Cannot open users file " + usersFile, e);
        }
    }

    private final class Session implements CredentialStoreSession {

        private final Path usersFile;
        private final FileChannel channel;

        private Session(Path usersFile, FileChannel channel) {
            this.usersFile = usersFile;
            this.channel = channel;
        }

        @Override
        public CredentialRecord findRecord(String username, String password) throws HotpException {
            try {
                channel.position(0L);
            } catch (IOException e) {
                throw new HotpException(HotpErrorCode.FILE_SEEK_ERROR, "Cannot rewind users file", e);
            }
            RawLineReader lines = new RawLineReader(Channels.newReader(channel, UsersFileFormat.FILE_CHARSET));
            return parser.findRecord(lines, username, password);
        }

        @Override
        public void update(CredentialRecord record, String otp, String timestamp, long newMovingFactor)
                throws HotpException {
            updater.apply(channel, usersFile, record, otp, timestamp, newMovingFactor);
        }

        @Override
        public void close() {
            try {
                channel.close();
            } catch (IOException e) {
                log.warn("[UsersFile] Failed to close {}: {}", usersFile, e.getMessage());
            }
        }
    }
}
