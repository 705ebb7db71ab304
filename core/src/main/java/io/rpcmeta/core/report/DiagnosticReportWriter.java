package io.rpcmeta.core.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.rpcmeta.core.error.AggregatedDerivationException;
import io.rpcmeta.core.error.CycleException;
import io.rpcmeta.core.error.DerivationException;
import io.rpcmeta.core.error.Diagnostic;
import io.rpcmeta.core.error.MetadataException;
import io.rpcmeta.core.error.SchemaDefinitionException;
import java.io.UncheckedIOException;

/**
 * Renders derivation failures as JSON for the build pipeline.
 *
 * <pre>{@code
 * {
 *   "type": "urn:rpc-metadata:error:derivation",
 *   "schema": "com.acme.ApiMeta",
 *   "interface": "com.acme.UserApi",
 *   "phase": "MATCHING",
 *   "detail": "...",
 *   "diagnostics": [
 *     {"kind": "NO_MATCH", "parameter": "...", "declarations": ["..."], "message": "..."}
 *   ]
 * }
 * }</pre>
 *
 * <p>
 * Thread-safe and immutable.
 */
public final class DiagnosticReportWriter {

    static final String SCHEMA_URN = "urn:rpc-metadata:error:schema";
    static final String CYCLE_URN = "urn:rpc-metadata:error:cycle";
    static final String DERIVATION_URN = "urn:rpc-metadata:error:derivation";
    static final String CONSTRUCTION_URN = "urn:rpc-metadata:error:construction";

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /** Builds the JSON report of a failure. */
    public JsonNode build(MetadataException exception) {
        ObjectNode report = MAPPER.createObjectNode();
        report.put("type", resolveUrn(exception));
        report.put("schema", exception.schemaType());
        if (exception instanceof DerivationException derivation) {
            report.put("interface", derivation.interfaceName());
        }
        report.put("phase", exception.phase().name());
        report.put("detail", exception.getMessage());

        if (exception instanceof SchemaDefinitionException schema) {
            if (schema.parameter() != null) {
                report.put("parameter", schema.parameter());
            } else {
                report.putNull("parameter");
            }
        }
        if (exception instanceof CycleException cycle) {
            ArrayNode path = report.putArray("cycle");
            cycle.cycle().forEach(path::add);
        }
        if (exception instanceof AggregatedDerivationException aggregated) {
            ArrayNode diagnostics = report.putArray("diagnostics");
            for (Diagnostic diagnostic : aggregated.diagnostics()) {
                diagnostics.add(toJson(diagnostic));
            }
        }
        return report;
    }

    /** Renders the JSON report of a failure as indented text. */
    public String write(MetadataException exception) {
        try {
            return MAPPER.writeValueAsString(build(exception));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("cannot render diagnostic report", e);
        }
    }

    private static ObjectNode toJson(Diagnostic diagnostic) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("kind", diagnostic.kind().name());
        if (diagnostic.parameter() != null) {
            node.put("parameter", diagnostic.parameter());
        } else {
            node.putNull("parameter");
        }
        ArrayNode declarations = node.putArray("declarations");
        diagnostic.declarations().forEach(declarations::add);
        node.put("message", diagnostic.message());
        return node;
    }

    private static String resolveUrn(MetadataException exception) {
        if (exception instanceof CycleException) {
            return CYCLE_URN;
        } else if (exception instanceof SchemaDefinitionException) {
            return SCHEMA_URN;
        } else if (exception instanceof AggregatedDerivationException) {
            return DERIVATION_URN;
        }
        return CONSTRUCTION_URN;
    }
}
