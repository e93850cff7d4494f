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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.hotp.domain.model.CredentialRecord;
import me.golemcore.hotp.domain.model.HotpErrorCode;
import me.golemcore.hotp.domain.model.HotpException;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Rewrites a users file with one record replaced.
 *
 * <p>
 * Protocol:
 * <ol>
 * <li>Rewind the already opened source file</li>
 * <li>Open {@code <file>.lock} and take an exclusive lock on it, blocking until
 * it is free</li>
 * <li>Stream every source line into {@code <file>.new}, replacing the record's
 * line, then fsync</li>
 * <li>Move {@code <file>.new} over {@code <file>} atomically</li>
 * <li>Release the lock and delete {@code <file>.lock}</li>
 * </ol>
 *
 * <p>
 * Readers see either the old or the new file, never a partial one. If writing
 * fails the new file is discarded and the users file stays as it was.
 *
 * <p>
 * JDK file locks belong to the whole process, so threads of this JVM are also
 * serialized on a {@link ReentrantLock} per lock file.
 */
@Component
@Slf4j
public class UsersFileUpdater {

    // one entry per users file path ever updated, never evicted
    private static final ConcurrentMap<Path, ReentrantLock> THREAD_LOCKS = new ConcurrentHashMap<>();

    public void apply(FileChannel source, Path usersFile, CredentialRecord record, String otp, String timestamp,
            long newMovingFactor) throws HotpException {
        rewind(source);

        Path lockPath = UsersFileFormat.companion(usersFile, UsersFileFormat.LOCK_SUFFIX);
        Path newPath = UsersFileFormat.companion(usersFile, UsersFileFormat.NEW_SUFFIX);
        String replacement = UsersFileFormat.formatRecord(record, newMovingFactor,
                UsersFileFormat.toFileText(otp), UsersFileFormat.toFileText(timestamp));

        ReentrantLock threadLock = THREAD_LOCKS.computeIfAbsent(lockPath.toAbsolutePath().normalize(),
                path -> new ReentrantLock());
        threadLock.lock();
        try {
            HotpException failure = null;
            boolean locked = false;
            try (FileChannel lockChannel = openLockFile(lockPath);
                    FileLock lock = acquire(lockChannel, lockPath)) {
                locked = lock.isValid();
                log.debug("[UsersFile] Locked {}", lockPath);
                writeNewFile(source, newPath, record, replacement);
                failure = publish(newPath, usersFile);
            } catch (HotpException e) {
                if (!locked) {
                    throw e;
                }
                failure = e;
            } catch (IOException e) {
                // only lock release or lock file close end up here
                log.warn("[UsersFile] Failed to release lock {}: {}", lockPath, e.getMessage());
            }

            removeLockFile(lockPath, failure);
            log.debug("[UsersFile] Updated record at line {} of {}", record.getLineIndex(), usersFile);
        } finally {
            threadLock.unlock();
        }
    }

    /**
     * Deletes the lock file, then reports the earlier failure if any. A rename
     * failure wins over an unlink failure, which is attached to it as suppressed.
     */
    private void removeLockFile(Path lockPath, HotpException failure) throws HotpException {
        try {
            deleteLockFile(lockPath);
        } catch (IOException e) {
            if (failure != null) {
                failure.addSuppressed(e);
                throw failure;
            }
            throw new HotpException(HotpErrorCode.FILE_UNLINK_ERROR, "Cannot remove lock file " + lockPath, e);
        }
        if (failure != null) {
            throw failure;
        }
    }

    private void rewind(FileChannel source) throws HotpException {
        try {
            source.position(0L);
        } catch (IOException e) {
            throw new HotpException(HotpErrorCode.FILE_SEEK_ERROR, "Cannot rewind users file", e);
        }
    }

    private FileChannel openLockFile(Path lockPath) throws HotpException {
        try {
            return FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING);
        } catch (IOException e) {
            throw new HotpException(HotpErrorCode.FILE_CREATE_ERROR, "Cannot create lock file " + lockPath, e);
        }
    }

    private FileLock acquire(FileChannel lockChannel, Path lockPath) throws HotpException {
        // FileChannel.lock() blocks indefinitely and retries EINTR itself
        try {
            return lockChannel.lock();
        } catch (IOException | OverlappingFileLockException e) {
            throw new HotpException(HotpErrorCode.FILE_LOCK_ERROR, "Cannot lock " + lockPath, e);
        }
    }

    private void writeNewFile(FileChannel source, Path newPath, CredentialRecord record, String replacement)
            throws HotpException {
        FileChannel out;
        try {
            out = FileChannel.open(newPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING);
        } catch (IOException e) {
            throw new HotpException(HotpErrorCode.FILE_CREATE_ERROR, "Cannot create " + newPath, e);
        }

        try {
            try (Writer writer = new BufferedWriter(Channels.newWriter(out, UsersFileFormat.FILE_CHARSET))) {
                copyLines(source, writer, record, replacement);
                writer.flush();
                sync(out);
            }
        } catch (IOException e) {
            discard(newPath);
            throw new HotpException(HotpErrorCode.FILE_WRITE_ERROR, "Failed to write " + newPath, e);
        } catch (HotpException e) {
            discard(newPath);
            throw e;
        }
    }

    private void copyLines(FileChannel source, Writer writer, CredentialRecord record, String replacement)
            throws IOException, HotpException {
        RawLineReader lines = new RawLineReader(Channels.newReader(source, UsersFileFormat.FILE_CHARSET));
        boolean replaced = false;
        int lineIndex = 0;
        String line;
        while ((line = readLine(lines)) != null) {
            if (lineIndex == record.getLineIndex()) {
                List<String> tokens = UsersFileFormat.tokenize(line);
                if (tokens.size() < 2 || !record.getUsername().equals(tokens.get(1))) {
                    throw new HotpException(HotpErrorCode.FILE_READ_ERROR,
                            "Record line " + lineIndex + " changed while updating");
                }
                writer.write(replacement);
                replaced = true;
            } else {
                writer.write(line);
            }
            lineIndex++;
        }
        if (!replaced) {
            throw new HotpException(HotpErrorCode.FILE_READ_ERROR,
                    "Record line " + record.getLineIndex() + " vanished while updating");
        }
    }

    private String readLine(RawLineReader lines) throws HotpException {
        try {
            return lines.nextLine();
        } catch (IOException e) {
            throw new HotpException(HotpErrorCode.FILE_READ_ERROR, "Failed to read users file", e);
        }
    }

    private HotpException publish(Path newPath, Path usersFile) {
        try {
            moveIntoPlace(newPath, usersFile);
            return null;
        } catch (IOException e) {
            discard(newPath);
            return new HotpException(HotpErrorCode.FILE_RENAME_ERROR,
                    "Cannot move " + newPath + " to " + usersFile, e);
        }
    }

    void moveIntoPlace(Path newPath, Path usersFile) throws IOException {
        try {
            Files.move(newPath, usersFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[UsersFile] Atomic move not supported, using regular move");
            Files.move(newPath, usersFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    void sync(FileChannel out) throws IOException {
        out.force(true);
    }

    void deleteLockFile(Path lockPath) throws IOException {
        Files.deleteIfExists(lockPath);
    }

    private void discard(Path newPath) {
        try {
            Files.deleteIfExists(newPath);
        } catch (IOException e) {
            log.warn("[UsersFile] Failed to cleanup {}: {}", newPath, e.getMessage());
        }
    }
}
