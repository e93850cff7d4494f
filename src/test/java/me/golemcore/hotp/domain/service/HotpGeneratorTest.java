package me.golemcore.hotp.domain.service;

import me.golemcore.hotp.adapter.outbound.crypto.JcaHmacSha1Adapter;
import me.golemcore.hotp.domain.model.HotpErrorCode;
import me.golemcore.hotp.domain.model.HotpException;
import me.golemcore.hotp.port.outbound.MacPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HotpGeneratorTest {

    private static final byte[] RFC_SECRET = "12345678901234567890".getBytes(StandardCharsets.US_ASCII);

    private HotpGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new HotpGenerator(new JcaHmacSha1Adapter());
    }

    // ===== RFC 4226 Appendix D =====

    @ParameterizedTest
    @CsvSource({
            "0, 755224", "1, 287082", "2, 359152", "3, 969429", "4, 338314",
            "5, 254676", "6, 287922", "7, 162583", "8, 399871", "9, 520489"
    })
    void shouldReproduceRfcSixDigitValues(long counter, String expected) throws HotpException {
        assertEquals(expected, generator.generate(RFC_SECRET, counter, 6));
    }

    @ParameterizedTest
    @CsvSource({
            "0, 84755224", "1, 94287082", "2, 37359152", "3, 26969429", "4, 40338314",
            "5, 68254676", "6, 18287922", "7, 82162583", "8, 73399871", "9, 45520489"
    })
    void shouldReproduceRfcEightDigitValues(long counter, String expected) throws HotpException {
        assertEquals(expected, generator.generate(RFC_SECRET, counter, 8));
    }

    @Test
    void shouldPadSevenDigitValueWithLeadingZero() throws HotpException {
        // truncated value for counter 4 is 1640338314
        assertEquals("0338314", generator.generate(RFC_SECRET, 4, 7));
    }

    @ParameterizedTest
    @ValueSource(ints = { 6, 7, 8 })
    void shouldProduceExactlyRequestedNumberOfDecimalDigits(int digits) throws HotpException {
        byte[] secret = { 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16, 17, 18, 19, 20, 21, 22, 23, 24 };
        for (long counter = 0; counter < 200; counter++) {
            String otp = generator.generate(secret, counter, digits);
            assertEquals(digits, otp.length());
            assertTrue(otp.chars().allMatch(Character::isDigit), otp);
        }
    }

    @Test
    void shouldBeDeterministic() throws HotpException {
        assertEquals(generator.generate(RFC_SECRET, 42, 6), generator.generate(RFC_SECRET, 42, 6));
    }

    @Test
    void shouldDifferForDifferentCounters() throws HotpException {
        assertNotEquals(generator.generate(RFC_SECRET, 0, 8), generator.generate(RFC_SECRET, 1, 8));
    }

    @Test
    void shouldTreatCounterAsUnsigned() throws HotpException {
        // 2^64 - 1 must be fed to the MAC as eight 0xFF bytes, not rejected
        String otp = generator.generate(RFC_SECRET, -1L, 6);
        assertEquals(6, otp.length());
    }

    // ===== Ignored parameters =====

    @Test
    void shouldIgnoreChecksumFlag() throws HotpException {
        assertEquals("755224", generator.generate(RFC_SECRET, 0, 6, true, HotpGenerator.DYNAMIC_TRUNCATION));
    }

    @Test
    void shouldIgnoreFixedTruncationOffset() throws HotpException {
        assertEquals("287082", generator.generate(RFC_SECRET, 1, 6, false, 3));
    }

    // ===== Failures =====

    @ParameterizedTest
    @ValueSource(ints = { -1, 0, 5, 9, 10 })
    void shouldRejectUnsupportedDigits(int digits) {
        HotpException ex = assertThrows(HotpException.class, () -> generator.generate(RFC_SECRET, 0, digits));
        assertEquals(HotpErrorCode.INVALID_DIGITS, ex.getCode());
    }

    @Test
    void shouldCheckDigitsBeforeComputingMac() throws HotpException {
        MacPort macPort = mock(MacPort.class);
        HotpGenerator mocked = new HotpGenerator(macPort);

        assertThrows(HotpException.class, () -> mocked.generate(RFC_SECRET, 0, 4));
        verify(macPort, never()).hmacSha1(any(), any());
    }

    @Test
    void shouldPropagateCryptoError() throws HotpException {
        MacPort macPort = mock(MacPort.class);
        when(macPort.hmacSha1(any(), any())).thenThrow(new HotpException(HotpErrorCode.CRYPTO_ERROR));
        HotpGenerator mocked = new HotpGenerator(macPort);

        HotpException ex = assertThrows(HotpException.class, () -> mocked.generate(RFC_SECRET, 0, 6));
        assertEquals(HotpErrorCode.CRYPTO_ERROR, ex.getCode());
    }

    @Test
    void shouldReportCryptoErrorForShortDigest() throws HotpException {
        MacPort macPort = mock(MacPort.class);
        when(macPort.hmacSha1(any(), any())).thenReturn(new byte[4]);
        HotpGenerator mocked = new HotpGenerator(macPort);

        HotpException ex = assertThrows(HotpException.class, () -> mocked.generate(RFC_SECRET, 0, 6));
        assertEquals(HotpErrorCode.CRYPTO_ERROR, ex.getCode());
    }

    @Test
    void shouldGenerateOtpForEmptySecret() throws HotpException {
        String otp = generator.generate(new byte[0], 0, 6);

        assertEquals("328482", otp);
        assertEquals(generator.generate(new byte[1], 0, 6), otp);
    }

    @Test
    void shouldAcceptSecretsLongerThanTwentyBytes() throws HotpException {
        byte[] longSecret = new byte[64];
        longSecret[0] = 1;
        assertEquals(6, generator.generate(longSecret, 0, 6).length());
    }
}
