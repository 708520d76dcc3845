package com.crossmatch.pairing.export;

import com.crossmatch.pairing.accumulate.PairingResult;
import com.crossmatch.pairing.batch.ProgressCallback;
import com.crossmatch.pairing.core.model.Catalogue;
import com.crossmatch.pairing.logging.LogContext;
import com.crossmatch.pairing.resolution.CounterpartMatch;
import com.crossmatch.pairing.resolution.FieldAssignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * CSV exporter with one section per output list.
 *
 * <pre>
 * # COUNTERPARTS
 * aIndex,bIndex,probability,separationArcsec,eta,xi,contaminationFluxA,contaminationFluxB,contaminationProbA,contaminationProbB
 * 0,1,0.93,0.05,0.0,4.2,0.0,0.0,,
 *
 * # FIELD A
 * index,probability
 * 6,1.0
 *
 * # FIELD B
 * index,probability
 * 2,1.0
 * </pre>
 *
 * Per-level contamination probabilities are joined with {@code ;} inside their column.
 */
public class CsvPairingExporter implements PairingExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvPairingExporter.class);
    private static final int PROGRESS_INTERVAL = 10_000;

    @Override
    public ExportResult export(PairingResult result, Writer writer, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        PrintWriter pw = new PrintWriter(new BufferedWriter(writer));
        long total = result.getCounterparts().size() + result.getField(Catalogue.A).size()
                + result.getField(Catalogue.B).size();
        long written = 0;

        try (LogContext ctx = LogContext.forExport(getFormat())) {
            pw.println("# COUNTERPARTS");
            pw.println("aIndex,bIndex,probability,separationArcsec,eta,xi,"
                    + "contaminationFluxA,contaminationFluxB,contaminationProbA,contaminationProbB");
            for (CounterpartMatch m : result.getCounterparts()) {
                pw.println(m.aIndex() + "," + m.bIndex() + "," + number(m.probability()) + ","
                        + number(m.separationArcsec()) + "," + number(m.eta()) + "," + number(m.xi()) + ","
                        + number(m.contaminationFluxA()) + "," + number(m.contaminationFluxB()) + ","
                        + levels(m.contaminationProbA()) + "," + levels(m.contaminationProbB()));
                written = progress(cb, written + 1, total);
            }
            long fieldA = writeField(pw, "FIELD A", result.getField(Catalogue.A));
            written = progress(cb, written + fieldA, total);
            long fieldB = writeField(pw, "FIELD B", result.getField(Catalogue.B));
            written = progress(cb, written + fieldB, total);

            pw.flush();
            if (pw.checkError()) {
                throw new UncheckedIOException(new IOException("CSV export failed while writing"));
            }
            ExportResult exported = new ExportResult(result.getCounterparts().size(), fieldA, fieldB);
            cb.onProgress(written, total, "Export completed");
            log.info("export.completed result={}", exported);
            return exported;
        }
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    private long writeField(PrintWriter pw, String section, List<FieldAssignment> field) {
        pw.println();
        pw.println("# " + section);
        pw.println("index,probability");
        for (FieldAssignment f : field) {
            pw.println(f.index() + "," + number(f.probability()));
        }
        return field.size();
    }

    private long progress(ProgressCallback cb, long written, long total) {
        if (written % PROGRESS_INTERVAL == 0) {
            cb.onProgress(written, total, "Exported " + written + " records");
        }
        return written;
    }

    private static String levels(double[] values) {
        if (values.length == 0) {
            return "";
        }
        return Arrays.stream(values)
                .mapToObj(CsvPairingExporter::number)
                .collect(Collectors.joining(";"));
    }

    private static String number(double value) {
        return Double.toString(value);
    }
}
