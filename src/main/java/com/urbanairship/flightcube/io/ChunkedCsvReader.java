/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.flightcube.io;

import com.codahale.metrics.Meter;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvValidationException;
import com.urbanairship.flightcube.metrics.Metrics;
import com.urbanairship.flightcube.records.RawRecord;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Reads a comma separated file with a header row and returns its rows a chunk at a time. A chunk
 * holds at most chunkSize rows, only the last one may be smaller. Rows shorter than the header
 * are padded with empty values. Quoting follows RFC 4180, backslashes are plain text.
 *
 * Read errors after opening are thrown as {@link UncheckedIOException}.
 */
public class ChunkedCsvReader implements Iterator<List<RawRecord>>, Closeable {
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final Meter recordsRead = Metrics.meter(ChunkedCsvReader.class, "recordsRead");

    private final CSVReader csvReader;
    private final RawRecord.Header header;
    private final int chunkSize;

    private String[] nextLine;

    /**
     * @param reader the file contents; closed when this reader is closed
     * @throws IOException if the header can't be read
     * @throws EOFException if there is no header row
     */
    public ChunkedCsvReader(Reader reader, int chunkSize) throws IOException {
        Preconditions.checkArgument(chunkSize > 0, "chunkSize must be positive, got %s", chunkSize);
        this.chunkSize = chunkSize;
        this.csvReader = new CSVReaderBuilder(reader)
                .withCSVParser(new RFC4180ParserBuilder().build())
                .build();

        String[] headerLine = readLine();
        if (headerLine == null) {
            csvReader.close();
            throw new EOFException("No header row");
        }
        if (headerLine.length > 0 && !headerLine[0].isEmpty() && headerLine[0].charAt(0) == BYTE_ORDER_MARK) {
            headerLine[0] = headerLine[0].substring(1);
        }
        this.header = new RawRecord.Header(Arrays.asList(headerLine));
        this.nextLine = readLine();
    }

    public static ChunkedCsvReader open(Path path, int chunkSize) throws IOException {
        return new ChunkedCsvReader(Files.newBufferedReader(path, StandardCharsets.UTF_8), chunkSize);
    }

    public RawRecord.Header getHeader() {
        return header;
    }

    /**
     * The next row, skipping blank lines, or null at the end of the file.
     */
    private String[] readLine() throws IOException {
        try {
            String[] line = csvReader.readNext();
            while (line != null && line.length == 1 && line[0].isEmpty()) {
                line = csvReader.readNext();
            }
            return line;
        } catch (CsvValidationException e) {
            throw new IOException("Invalid CSV at line " + e.getLineNumber(), e);
        }
    }

    @Override
    public boolean hasNext() {
        return nextLine != null;
    }

    @Override
    public List<RawRecord> next() {
        if (nextLine == null) {
            throw new NoSuchElementException();
        }
        List<RawRecord> chunk = Lists.newArrayListWithCapacity(Math.min(chunkSize, 1024));
        try {
            while (nextLine != null && chunk.size() < chunkSize) {
                chunk.add(new RawRecord(header, nextLine));
                nextLine = readLine();
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        recordsRead.mark(chunk.size());
        return chunk;
    }

    @Override
    public void close() throws IOException {
        csvReader.close();
    }
}
