package com.urbanairship.flightcube.io;

import com.urbanairship.flightcube.records.RawRecord;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.EOFException;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class ChunkedCsvReaderTest {
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private static ChunkedCsvReader reader(String contents, int chunkSize) throws IOException {
        return new ChunkedCsvReader(new StringReader(contents), chunkSize);
    }

    @Test
    public void testChunks() throws IOException {
        try (ChunkedCsvReader reader = reader("a,b\n1,2\n3,4\n5,6\n7,8\n9,10\n", 2)) {
            assertEquals(2, reader.next().size());
            assertEquals(2, reader.next().size());
            List<RawRecord> last = reader.next();
            assertEquals(1, last.size());
            assertEquals("10", last.get(0).get("b"));
            assertFalse(reader.hasNext());
        }
    }

    @Test(expected = NoSuchElementException.class)
    public void testNextAfterEnd() throws IOException {
        try (ChunkedCsvReader reader = reader("a,b\n1,2\n", 5)) {
            reader.next();
            reader.next();
        }
    }

    @Test
    public void testShortRowsAndQuotes() throws IOException {
        try (ChunkedCsvReader reader = reader("state,airport,cause\n\"Washington, D.C.\",DCA\n", 10)) {
            RawRecord record = reader.next().get(0);
            assertEquals("Washington, D.C.", record.get("state"));
            assertEquals("DCA", record.get("airport"));
            assertEquals("", record.get("cause"));
            assertNull(record.get("month"));
        }
    }

    @Test
    public void testByteOrderMarkAndBlankLines() throws IOException {
        Path file = tmp.newFile("bom.csv").toPath();
        Files.write(file, "\uFEFFmonth,airline\n1,AA\n\n2,DL\n".getBytes(StandardCharsets.UTF_8));
        try (ChunkedCsvReader reader = ChunkedCsvReader.open(file, 10)) {
            assertTrue(reader.getHeader().contains("month"));
            List<RawRecord> chunk = reader.next();
            assertEquals(2, chunk.size());
            assertEquals("DL", chunk.get(1).get("airline"));
        }
    }

    @Test
    public void testHeaderOnly() throws IOException {
        try (ChunkedCsvReader reader = reader("a,b\n", 10)) {
            assertFalse(reader.hasNext());
        }
    }

    @Test(expected = EOFException.class)
    public void testEmpty() throws IOException {
        reader("", 10);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBadChunkSize() throws IOException {
        reader("a\n1\n", 0);
    }
}
