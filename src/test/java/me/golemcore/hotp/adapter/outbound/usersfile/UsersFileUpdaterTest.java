package me.golemcore.hotp.adapter.outbound.usersfile;

import me.golemcore.hotp.domain.model.CredentialRecord;
import me.golemcore.hotp.domain.model.HotpErrorCode;
import me.golemcore.hotp.domain.model.HotpException;
import me.golemcore.hotp.domain.model.TokenType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UsersFileUpdaterTest {

    private static final String SECRET_HEX = "3132333435363738393031323334353637383930";
    private static final String TIMESTAMP = "2026-03-01T10:15:30L";

    @TempDir
    Path tempDir;

    private Path usersFile;
    private UsersFileUpdater updater;

    @BeforeEach
    void setUp() {
        usersFile = tempDir.resolve("users.oath");
        updater = new UsersFileUpdater();
    }

    private static CredentialRecord record(int lineIndex, String username, String password) {
        return CredentialRecord.builder()
                .lineIndex(lineIndex)
                .typeToken("HOTP/E")
                .tokenType(TokenType.HOTP_E)
                .username(username)
                .password(password)
                .secretHex(SECRET_HEX)
                .build();
    }

    private void apply(Path source, Path target, CredentialRecord record, long counter) throws HotpException,
            IOException {
        try (FileChannel channel = FileChannel.open(source, StandardOpenOption.READ)) {
            // simulate the parser having consumed the file already
            channel.position(channel.size());
            updater.apply(channel, target, record, "755224", TIMESTAMP, counter);
        }
    }

    @Test
    void shouldReplaceOnlyRecordLine() throws Exception {
        String before = "# users\n"
                + "HOTP bob - " + SECRET_HEX + " 3\n"
                + "HOTP/E alice pw " + SECRET_HEX + " 7 111111 2009-12-07T05:03:09L\n"
                + "HOTP carol - " + SECRET_HEX + "\n";
        Files.writeString(usersFile, before, StandardCharsets.ISO_8859_1);

        apply(usersFile, usersFile, record(2, "alice", "pw"), 9L);

        String after = Files.readString(usersFile, StandardCharsets.ISO_8859_1);
        assertEquals("# users\n"
                + "HOTP bob - " + SECRET_HEX + " 3\n"
                + "HOTP/E\talice\tpw\t" + SECRET_HEX + "\t9\t755224\t" + TIMESTAMP + "\n"
                + "HOTP carol - " + SECRET_HEX + "\n", after);
    }

    @Test
    void shouldPreserveUnrelatedBytesExactly() throws Exception {
        byte[] head = "# été \r\n\n  \t\nHOTP jürgen - 00 1\r\n".getBytes(StandardCharsets.UTF_8);
        byte[] recordLine = ("HOTP alice - " + SECRET_HEX + "\n").getBytes(StandardCharsets.US_ASCII);
        byte[] tail = new byte[] { 'x', (byte) 0xff, (byte) 0xfe, '\r', '\n', 'n', 'o', '-', 'e', 'o', 'l' };
        Files.write(usersFile, concat(head, recordLine, tail));

        apply(usersFile, usersFile, record(4, "alice", null), 1L);

        byte[] expectedRecord = ("HOTP/E\talice\t-\t" + SECRET_HEX + "\t1\t755224\t" + TIMESTAMP + "\n")
                .getBytes(StandardCharsets.US_ASCII);
        assertArrayEquals(concat(head, expectedRecord, tail), Files.readAllBytes(usersFile));
    }

    @Test
    void shouldWriteUnsignedCounter() throws Exception {
        Files.writeString(usersFile, "HOTP alice - " + SECRET_HEX + "\n");

        apply(usersFile, usersFile, record(0, "alice", null), -1L);

        assertTrue(Files.readString(usersFile).contains("\t18446744073709551615\t"));
    }

    @Test
    void shouldRemoveCompanionFiles() throws Exception {
        Files.writeString(usersFile, "HOTP alice - " + SECRET_HEX + "\n");

        apply(usersFile, usersFile, record(0, "alice", null), 1L);

        assertFalse(Files.exists(tempDir.resolve("users.oath.lock")));
        assertFalse(Files.exists(tempDir.resolve("users.oath.new")));
    }

    @Test
    void shouldFailWhenLockFileCannotBeCreated() throws Exception {
        Files.writeString(usersFile, "HOTP alice - " + SECRET_HEX + "\n");
        Files.createDirectory(tempDir.resolve("users.oath.lock"));

        HotpException ex = assertThrows(HotpException.class,
                () -> apply(usersFile, usersFile, record(0, "alice", null), 1L));

        assertEquals(HotpErrorCode.FILE_CREATE_ERROR, ex.getCode());
        assertTrue(Files.readString(usersFile).startsWith("HOTP alice - "));
    }

    @Test
    void shouldFailWhenNewFileCannotBeCreated() throws Exception {
        String before = "HOTP alice - " + SECRET_HEX + "\n";
        Files.writeString(usersFile, before);
        Files.createDirectory(tempDir.resolve("users.oath.new"));

        HotpException ex = assertThrows(HotpException.class,
                () -> apply(usersFile, usersFile, record(0, "alice", null), 1L));

        assertEquals(HotpErrorCode.FILE_CREATE_ERROR, ex.getCode());
        assertEquals(before, Files.readString(usersFile));
        assertFalse(Files.exists(tempDir.resolve("users.oath.lock")));
    }

    @Test
    void shouldFailWithRenameErrorWhenTargetCannotBeReplaced() throws Exception {
        Path source = tempDir.resolve("source.oath");
        Files.writeString(source, "HOTP alice - " + SECRET_HEX + "\n");
        Path target = tempDir.resolve("target");
        Files.createDirectory(target);
        Files.writeString(target.resolve("occupied"), "x");

        HotpException ex = assertThrows(HotpException.class,
                () -> apply(source, target, record(0, "alice", null), 1L));

        assertEquals(HotpErrorCode.FILE_RENAME_ERROR, ex.getCode());
        assertFalse(Files.exists(tempDir.resolve("target.new")));
        assertFalse(Files.exists(tempDir.resolve("target.lock")));
    }

    @Test
    void shouldRefuseToPublishWhenRecordLineChanged() throws Exception {
        String before = "HOTP bob - " + SECRET_HEX + "\n";
        Files.writeString(usersFile, before);

        HotpException ex = assertThrows(HotpException.class,
                () -> apply(usersFile, usersFile, record(0, "alice", null), 1L));

        assertEquals(HotpErrorCode.FILE_READ_ERROR, ex.getCode());
        assertEquals(before, Files.readString(usersFile));
        assertFalse(Files.exists(tempDir.resolve("users.oath.new")));
    }

    @Test
    void shouldRefuseToPublishWhenRecordLineVanished() throws Exception {
        String before = "HOTP alice - " + SECRET_HEX + "\n";
        Files.writeString(usersFile, before);

        HotpException ex = assertThrows(HotpException.class,
                () -> apply(usersFile, usersFile, record(5, "alice", null), 1L));

        assertEquals(HotpErrorCode.FILE_READ_ERROR, ex.getCode());
        assertEquals(before, Files.readString(usersFile));
    }

    @Test
    void shouldFailWithSeekErrorOnClosedSource() throws Exception {
        Files.writeString(usersFile, "HOTP alice - " + SECRET_HEX + "\n");
        FileChannel channel = FileChannel.open(usersFile, StandardOpenOption.READ);
        channel.close();

        HotpException ex = assertThrows(HotpException.class,
                () -> updater.apply(channel, usersFile, record(0, "alice", null), "755224", TIMESTAMP, 1L));

        assertEquals(HotpErrorCode.FILE_SEEK_ERROR, ex.getCode());
    }

    @Test
    void shouldFailWithLockErrorWhenLockIsHeldElsewhere() throws Exception {
        String before = "HOTP alice - " + SECRET_HEX + "\n";
        Files.writeString(usersFile, before);
        Path lockPath = tempDir.resolve("users.oath.lock");

        try (FileChannel holder = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                FileLock held = holder.lock()) {
            HotpException ex = assertThrows(HotpException.class,
                    () -> apply(usersFile, usersFile, record(0, "alice", null), 1L));

            assertEquals(HotpErrorCode.FILE_LOCK_ERROR, ex.getCode());
            assertTrue(held.isValid());
        }
        assertEquals(before, Files.readString(usersFile));
        assertFalse(Files.exists(tempDir.resolve("users.oath.new")));
    }

    @Test
    void shouldDiscardNewFileWhenSyncFails() throws Exception {
        String before = "HOTP alice - " + SECRET_HEX + "\n";
        Files.writeString(usersFile, before);
        updater = new UsersFileUpdater() {
            @Override
            void sync(FileChannel out) throws IOException {
                throw new IOException("No space left on device");
            }
        };

        HotpException ex = assertThrows(HotpException.class,
                () -> apply(usersFile, usersFile, record(0, "alice", null), 1L));

        assertEquals(HotpErrorCode.FILE_WRITE_ERROR, ex.getCode());
        assertEquals(before, Files.readString(usersFile));
        assertFalse(Files.exists(tempDir.resolve("users.oath.new")));
        assertFalse(Files.exists(tempDir.resolve("users.oath.lock")));
    }

    @Test
    void shouldReportUnlinkErrorAfterSuccessfulRename() throws Exception {
        Files.writeString(usersFile, "HOTP alice - " + SECRET_HEX + "\n");
        updater = new UsersFileUpdater() {
            @Override
            void deleteLockFile(Path lockPath) throws IOException {
                throw new IOException("Permission denied");
            }
        };

        HotpException ex = assertThrows(HotpException.class,
                () -> apply(usersFile, usersFile, record(0, "alice", null), 1L));

        assertEquals(HotpErrorCode.FILE_UNLINK_ERROR, ex.getCode());
        assertEquals("Permission denied", ex.getCause().getMessage());
        assertEquals("HOTP/E\talice\t-\t" + SECRET_HEX + "\t1\t755224\t" + TIMESTAMP + "\n",
                Files.readString(usersFile));
        assertTrue(Files.exists(tempDir.resolve("users.oath.lock")));
    }

    @Test
    void shouldPreferRenameErrorAndKeepUnlinkErrorAsSuppressed() throws Exception {
        String before = "HOTP alice - " + SECRET_HEX + "\n";
        Files.writeString(usersFile, before);
        updater = new UsersFileUpdater() {
            @Override
            void moveIntoPlace(Path newPath, Path target) throws IOException {
                throw new IOException("Read-only file system");
            }

            @Override
            void deleteLockFile(Path lockPath) throws IOException {
                throw new IOException("Permission denied");
            }
        };

        HotpException ex = assertThrows(HotpException.class,
                () -> apply(usersFile, usersFile, record(0, "alice", null), 1L));

        assertEquals(HotpErrorCode.FILE_RENAME_ERROR, ex.getCode());
        assertEquals("Read-only file system", ex.getCause().getMessage());
        assertEquals(1, ex.getSuppressed().length);
        assertEquals("Permission denied", ex.getSuppressed()[0].getMessage());
        assertEquals(before, Files.readString(usersFile));
        assertFalse(Files.exists(tempDir.resolve("users.oath.new")));
    }

    private static byte[] concat(byte[]... parts) {
        int length = 0;
        for (byte[] part : parts) {
            length += part.length;
        }
        byte[] result = new byte[length];
        int pos = 0;
        for (byte[] part : parts) {
            System.arraycopy(part, 0, result, pos, part.length);
            pos += part.length;
        }
        return result;
    }
}
