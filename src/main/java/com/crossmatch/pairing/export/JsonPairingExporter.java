package com.crossmatch.pairing.export;

import com.crossmatch.pairing.accumulate.PairingResult;
import com.crossmatch.pairing.accumulate.ReconciliationWarning;
import com.crossmatch.pairing.batch.IslandAnomaly;
import com.crossmatch.pairing.batch.ProgressCallback;
import com.crossmatch.pairing.core.model.Catalogue;
import com.crossmatch.pairing.logging.LogContext;
import com.crossmatch.pairing.resolution.CounterpartMatch;
import com.crossmatch.pairing.resolution.FieldAssignment;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;

/**
 * Writes a pairing result as one JSON document:
 *
 * <pre>
 * {
 *   "counterparts": [{"aIndex": 0, "bIndex": 1, "probability": 0.93, ...}],
 *   "fieldA": [{"index": 6, "probability": 1.0}],
 *   "fieldB": [...],
 *   "warnings": [{"catalogue": "a", "direction": "MISSING", "count": 2, "message": "..."}],
 *   "anomalies": [...]
 * }
 * </pre>
 *
 * Non-finite values (eta and xi under zero priors) are written as strings.
 */
public class JsonPairingExporter implements PairingExporter {
    private static final Logger log = LoggerFactory.getLogger(JsonPairingExporter.class);

    private final ObjectMapper objectMapper;

    public JsonPairingExporter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public JsonPairingExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public ExportResult export(PairingResult result, Writer writer, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        try (LogContext ctx = LogContext.forExport(getFormat())) {
            ObjectNode root = objectMapper.createObjectNode();

            ArrayNode counterparts = root.putArray("counterparts");
            for (CounterpartMatch m : result.getCounterparts()) {
                ObjectNode node = counterparts.addObject();
                node.put("aIndex", m.aIndex());
                node.put("bIndex", m.bIndex());
                node.put("probability", m.probability());
                node.put("separationArcsec", m.separationArcsec());
                node.put("eta", m.eta());
                node.put("xi", m.xi());
                node.put("contaminationFluxA", m.contaminationFluxA());
                node.put("contaminationFluxB", m.contaminationFluxB());
                ArrayNode probA = node.putArray("contaminationProbA");
                for (double p : m.contaminationProbA()) {
                    probA.add(p);
                }
                ArrayNode probB = node.putArray("contaminationProbB");
                for (double p : m.contaminationProbB()) {
                    probB.add(p);
                }
            }
            cb.onProgress(result.getCounterparts().size(), -1, "Serialised counterparts");

            writeField(root.putArray("fieldA"), result.getField(Catalogue.A));
            writeField(root.putArray("fieldB"), result.getField(Catalogue.B));

            ArrayNode warnings = root.putArray("warnings");
            for (ReconciliationWarning w : result.getWarnings()) {
                ObjectNode node = warnings.addObject();
                node.put("catalogue", w.catalogue().label());
                node.put("direction", w.direction().name());
                node.put("count", w.count());
                node.put("message", w.message());
            }
            ArrayNode anomalies = root.putArray("anomalies");
            for (IslandAnomaly a : result.getAnomalies()) {
                ObjectNode node = anomalies.addObject();
                node.put("island", a.islandIndex());
                node.put("aCount", a.aCount());
                node.put("bCount", a.bCount());
                node.put("reason", a.reason());
            }

            objectMapper.writer()
                    .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                    .writeValue(writer, root);
            writer.flush();

            ExportResult exported = new ExportResult(result.getCounterparts().size(),
                    result.getField(Catalogue.A).size(), result.getField(Catalogue.B).size());
            cb.onProgress(exported.total(), exported.total(), "Export completed");
            log.info("export.completed result={}", exported);
            return exported;
        } catch (IOException e) {
            log.error("export.failed format={} error={}", getFormat(), e.getMessage());
            throw new UncheckedIOException("JSON export failed", e);
        }
    }

    @Override
    public String getFormat() {
        return "json";
    }

    private static void writeField(ArrayNode array, List<FieldAssignment> field) {
        for (FieldAssignment f : field) {
            ObjectNode node = array.addObject();
            node.put("index", f.index());
            node.put("probability", f.probability());
        }
    }
}
