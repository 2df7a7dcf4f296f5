/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.flightcube.io;

import com.codahale.metrics.Counter;
import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;
import com.opencsv.CSVWriter;
import com.urbanairship.flightcube.Rollup;
import com.urbanairship.flightcube.finalize.CubeRow;
import com.urbanairship.flightcube.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Writes each cube table as a CSV file with a header row into one directory, creating the
 * directory if needed. Tables are written to temporary files and only moved over their published
 * names on {@link #commit()}, so a run that fails part way leaves the previous tables in place.
 *
 * Not thread safe.
 */
public class CsvCubeTableSink implements CubeTableSink {
    private static final Logger log = LoggerFactory.getLogger(CsvCubeTableSink.class);

    private final Counter rowsWritten = Metrics.counter(CsvCubeTableSink.class, "rowsWritten");

    private final Path outputDir;

    // Temp file to published name, in write order
    private final Map<Path, Path> staged = Maps.newLinkedHashMap();

    public CsvCubeTableSink(Path outputDir) {
        this.outputDir = Preconditions.checkNotNull(outputDir);
    }

    @Override
    public void write(Rollup rollup, List<CubeRow> rows) throws IOException {
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(CubeTables.fileName(rollup));
        Path tmp = Files.createTempFile(outputDir, CubeTables.FILE_PREFIX + rollup.getName(), ".tmp");
        try {
            try (CSVWriter csvWriter = new CSVWriter(Files.newBufferedWriter(tmp, StandardCharsets.UTF_8))) {
                csvWriter.writeNext(CubeTables.columns(rollup).toArray(new String[0]), false);
                for (CubeRow row : rows) {
                    csvWriter.writeNext(CubeTables.values(row), false);
                }
                if (csvWriter.checkError()) {
                    throw new IOException("Failed writing " + tmp, csvWriter.getException());
                }
            }
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
        Path replaced = staged.put(tmp, target);
        Preconditions.checkState(replaced == null, "Temp file %s staged twice", tmp);
        rowsWritten.inc(rows.size());
        log.debug("Staged {} rows for {} in {}", rows.size(), target, tmp);
    }

    @Override
    public void commit() throws IOException {
        Iterator<Map.Entry<Path, Path>> it = staged.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Path, Path> table = it.next();
            moveIntoPlace(table.getKey(), table.getValue());
            it.remove();
            log.info("Published {}", table.getValue());
        }
    }

    @Override
    public void abort() {
        for (Path tmp : staged.keySet()) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                log.warn("Couldn't delete staged table " + tmp, e);
            }
        }
        if (!staged.isEmpty()) {
            log.info("Dropped {} unpublished tables", staged.size());
        }
        staged.clear();
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, replacing it", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
