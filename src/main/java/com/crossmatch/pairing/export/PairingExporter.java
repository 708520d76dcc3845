package com.crossmatch.pairing.export;

import com.crossmatch.pairing.accumulate.PairingResult;
import com.crossmatch.pairing.batch.ProgressCallback;

import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Writes a {@link PairingResult} in a specific format.
 */
public interface PairingExporter {

    /**
     * @param result   the pairing outputs
     * @param writer   destination; flushed but not closed
     * @param callback optional progress callback
     * @throws java.io.UncheckedIOException if writing fails
     */
    ExportResult export(PairingResult result, Writer writer, ProgressCallback callback);

    /**
     * Writes UTF-8 to the stream; flushed but not closed.
     */
    default ExportResult export(PairingResult result, OutputStream output, ProgressCallback callback) {
        return export(result, new OutputStreamWriter(output, StandardCharsets.UTF_8), callback);
    }

    /**
     * Format produced by this exporter, e.g. "csv".
     */
    String getFormat();
}
