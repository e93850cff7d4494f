package me.golemcore.hotp.adapter.outbound.usersfile;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class RawLineReaderTest {

    @Test
    void shouldKeepLineTerminators() throws IOException {
        RawLineReader reader = new RawLineReader(new StringReader("a\nb\r\n\nlast"));

        assertEquals("a\n", reader.nextLine());
        assertEquals("b\r\n", reader.nextLine());
        assertEquals("\n", reader.nextLine());
        assertEquals("last", reader.nextLine());
        assertNull(reader.nextLine());
    }

    @Test
    void shouldReturnNullForEmptyInput() throws IOException {
        assertNull(new RawLineReader(new StringReader("")).nextLine());
    }

    @Test
    void shouldNotSplitOnCarriageReturnAlone() throws IOException {
        RawLineReader reader = new RawLineReader(new StringReader("a\rb\n"));

        assertEquals("a\rb\n", reader.nextLine());
        assertNull(reader.nextLine());
    }
}
