package io.rpcmeta.core.error;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Two-tier exception hierarchy: common fields, phases and every concrete type.
 */
class ExceptionHierarchyTest {

    private static final Diagnostic NO_MATCH = new Diagnostic(
            Diagnostic.Kind.NO_MATCH, "parameter 'getter' of schema RestMeta", List.of("com.acme.Api"), "nothing found");

    // --- Hierarchy structure ---

    @Test
    void metadataExceptionIsAbstractAndRoot() {
        assertThat(MetadataException.class).isAbstract();
        assertThat(MetadataException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void secondTierIsAbstract() {
        assertThat(SchemaDefinitionException.class).isAbstract();
        assertThat(SchemaDefinitionException.class.getSuperclass()).isEqualTo(MetadataException.class);
        assertThat(DerivationException.class).isAbstract();
        assertThat(DerivationException.class.getSuperclass()).isEqualTo(MetadataException.class);
    }

    // --- Schema definition errors ---

    @Test
    void schemaConfigurationExceptionCarriesParameter() {
        var ex = new SchemaConfigurationException("bad parameter", "com.acme.Meta", "parameter 'x' of schema Meta");

        assertThat(ex).isInstanceOf(SchemaDefinitionException.class);
        assertThat(ex.schemaType()).isEqualTo("com.acme.Meta");
        assertThat(ex.parameter()).isEqualTo("parameter 'x' of schema Meta");
        assertThat(ex.detail()).isEqualTo("bad parameter");
        assertThat(ex.phase()).isEqualTo(MetadataException.Phase.SCHEMA);
    }

    @Test
    void schemaConfigurationExceptionKeepsCause() {
        var cause = new IllegalArgumentException("conflict");
        var ex = new SchemaConfigurationException("bad", cause, "com.acme.Meta", null);

        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.parameter()).isNull();
    }

    @Test
    void cycleExceptionCopiesCycle() {
        var ex = new CycleException("cycle", "com.acme.A", "parameter 'b' of schema A", List.of("A", "B", "A"));

        assertThat(ex).isInstanceOf(SchemaDefinitionException.class);
        assertThat(ex.phase()).isEqualTo(MetadataException.Phase.SCHEMA);
        assertThat(ex.cycle()).containsExactly("A", "B", "A");
        assertThatThrownBy(() -> ex.cycle().add("C")).isInstanceOf(UnsupportedOperationException.class);
    }

    // --- Derivation errors ---

    @Test
    void aggregatedDerivationExceptionRendersEveryDiagnostic() {
        var lookup = new Diagnostic(Diagnostic.Kind.LOOKUP_FAILURE, "parameter 'clock'", null, "no Clock");
        var ex = new AggregatedDerivationException(
                "com.acme.Meta", "com.acme.Api", MetadataException.Phase.MATCHING, List.of(NO_MATCH, lookup));

        assertThat(ex).isInstanceOf(DerivationException.class);
        assertThat(ex.interfaceName()).isEqualTo("com.acme.Api");
        assertThat(ex.phase()).isEqualTo(MetadataException.Phase.MATCHING);
        assertThat(ex.diagnostics()).containsExactly(NO_MATCH, lookup);
        assertThat(ex.has(Diagnostic.Kind.LOOKUP_FAILURE)).isTrue();
        assertThat(ex.has(Diagnostic.Kind.DUPLICATE_NAME)).isFalse();
        assertThat(ex.getMessage())
                .startsWith("Cannot derive com.acme.Meta for com.acme.Api: 2 problem(s)")
                .contains("[NO_MATCH] nothing found (at com.acme.Api)")
                .contains("[LOOKUP_FAILURE] no Clock");
    }

    @Test
    void aggregatedDerivationExceptionNeedsDiagnostics() {
        assertThatThrownBy(() -> new AggregatedDerivationException(
                        "com.acme.Meta", "com.acme.Api", MetadataException.Phase.MATCHING, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void valueConstructionExceptionIsFinalization() {
        var cause = new IllegalStateException("rejected");
        var ex = new ValueConstructionException("constructor failed", cause, "com.acme.Meta", "com.acme.Api");

        assertThat(ex).isInstanceOf(DerivationException.class);
        assertThat(ex.phase()).isEqualTo(MetadataException.Phase.FINALIZATION);
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void diagnosticRendersWithoutDeclarations() {
        var diagnostic = new Diagnostic(Diagnostic.Kind.UNMATCHED_MEMBER, null, null, "method x is unmatched");

        assertThat(diagnostic.declarations()).isEmpty();
        assertThat(diagnostic.render()).isEqualTo("[UNMATCHED_MEMBER] method x is unmatched");
    }
}
