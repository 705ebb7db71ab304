package io.rpcmeta.core.report;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.rpcmeta.core.error.AggregatedDerivationException;
import io.rpcmeta.core.error.CycleException;
import io.rpcmeta.core.error.Diagnostic;
import io.rpcmeta.core.error.MetadataException;
import io.rpcmeta.core.error.SchemaConfigurationException;
import io.rpcmeta.core.error.ValueConstructionException;
import java.util.List;
import org.junit.jupiter.api.Test;

class DiagnosticReportWriterTest {

    private final DiagnosticReportWriter writer = new DiagnosticReportWriter();

    @Test
    void derivationFailureListsDiagnostics() {
        var ex = new AggregatedDerivationException(
                "com.acme.ApiMeta",
                "com.acme.UserApi",
                MetadataException.Phase.MATCHING,
                List.of(
                        new Diagnostic(
                                Diagnostic.Kind.AMBIGUOUS_MATCH,
                                "parameter 'getter' of schema ApiMeta",
                                List.of("com.acme.UserApi#a()", "com.acme.UserApi#b()"),
                                "multiple real methods match"),
                        new Diagnostic(Diagnostic.Kind.UNMATCHED_MEMBER, null, List.of(), "method c is unmatched")));

        JsonNode report = writer.build(ex);

        assertThat(report.get("type").asText()).isEqualTo("urn:rpc-metadata:error:derivation");
        assertThat(report.get("schema").asText()).isEqualTo("com.acme.ApiMeta");
        assertThat(report.get("interface").asText()).isEqualTo("com.acme.UserApi");
        assertThat(report.get("phase").asText()).isEqualTo("MATCHING");
        assertThat(report.get("detail").asText()).startsWith("Cannot derive com.acme.ApiMeta");
        assertThat(report.get("diagnostics")).hasSize(2);

        JsonNode first = report.get("diagnostics").get(0);
        assertThat(first.get("kind").asText()).isEqualTo("AMBIGUOUS_MATCH");
        assertThat(first.get("declarations").get(1).asText()).isEqualTo("com.acme.UserApi#b()");
        assertThat(report.get("diagnostics").get(1).get("parameter").isNull()).isTrue();
    }

    @Test
    void schemaFailureHasParameterButNoInterface() {
        JsonNode report = writer.build(
                new SchemaConfigurationException("bad", "com.acme.Meta", "parameter 'x' of schema Meta"));

        assertThat(report.get("type").asText()).isEqualTo("urn:rpc-metadata:error:schema");
        assertThat(report.get("phase").asText()).isEqualTo("SCHEMA");
        assertThat(report.get("parameter").asText()).isEqualTo("parameter 'x' of schema Meta");
        assertThat(report.has("interface")).isFalse();
        assertThat(report.has("diagnostics")).isFalse();
    }

    @Test
    void cycleFailureListsPath() {
        JsonNode report =
                writer.build(new CycleException("cycle", "com.acme.A", "p", List.of("A", "B", "A")));

        assertThat(report.get("type").asText()).isEqualTo("urn:rpc-metadata:error:cycle");
        assertThat(report.get("cycle")).extracting(JsonNode::asText).containsExactly("A", "B", "A");
    }

    @Test
    void constructionFailureIsFinalization() {
        JsonNode report = writer.build(new ValueConstructionException(
                "constructor rejected", new IllegalStateException(), "com.acme.Meta", "com.acme.Api"));

        assertThat(report.get("type").asText()).isEqualTo("urn:rpc-metadata:error:construction");
        assertThat(report.get("phase").asText()).isEqualTo("FINALIZATION");
        assertThat(report.get("interface").asText()).isEqualTo("com.acme.Api");
    }

    @Test
    void writtenReportParsesBack() throws Exception {
        var ex = new SchemaConfigurationException("bad", "com.acme.Meta", null);

        String json = writer.write(ex);

        assertThat(json).contains(System.lineSeparator());
        assertThat(new ObjectMapper().readTree(json)).isEqualTo(writer.build(ex));
    }
}
