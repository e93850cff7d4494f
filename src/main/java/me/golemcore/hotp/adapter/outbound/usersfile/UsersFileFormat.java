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

import me.golemcore.hotp.domain.model.CredentialRecord;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.StringTokenizer;

/**
 * Line format shared by {@link UsersFileParser} and {@link UsersFileUpdater}.
 *
 * <p>
 * File content is handled as ISO-8859-1 so each byte maps to exactly one char
 * and untouched lines are written back byte for byte. Strings coming from
 * callers are UTF-8 and go through {@link #toFileText(String)} before they are
 * compared with or written into the file.
 */
final class UsersFileFormat {

    static final Charset FILE_CHARSET = StandardCharsets.ISO_8859_1;

    static final String WHITESPACE = " \t\r\n";

    static final String LOCK_SUFFIX = ".lock";
    static final String NEW_SUFFIX = ".new";

    private UsersFileFormat() {
    }

    static List<String> tokenize(String line) {
        StringTokenizer tokenizer = new StringTokenizer(line, WHITESPACE);
        List<String> tokens = new ArrayList<>();
        while (tokenizer.hasMoreTokens()) {
            tokens.add(tokenizer.nextToken());
        }
        return tokens;
    }

    static String toFileText(String value) {
        if (value == null) {
            return null;
        }
        return new String(value.getBytes(StandardCharsets.UTF_8), FILE_CHARSET);
    }

    static String formatRecord(CredentialRecord record, long movingFactor, String otp, String timestamp) {
        String password = record.getPassword() != null ? record.getPassword() : CredentialRecord.NO_PASSWORD;
        String secret = record.getSecretHex() != null ? record.getSecretHex() : CredentialRecord.NO_PASSWORD;
        return record.getTypeToken() + '\t'
                + record.getUsername() + '\t'
                + password + '\t'
                + secret + '\t'
                + Long.toUnsignedString(movingFactor) + '\t'
                + otp + '\t'
                + timestamp + '\n';
    }

    static Path companion(Path usersFile, String suffix) {
        return usersFile.resolveSibling(usersFile.getFileName() + suffix);
    }
}
