package io.rpcmeta.core.error;

import java.util.List;
import java.util.Objects;

/**
 * Every independent failure found while deriving a schema against one
 * interface, in discovery order. Thrown in the {@link Phase#MATCHING} phase for
 * structural failures and in the {@link Phase#FINALIZATION} phase for
 * unresolved non-strict contextual lookups.
 */
public final class AggregatedDerivationException extends DerivationException {

    private static final long serialVersionUID = 1L;

    private final List<Diagnostic> diagnostics;

    public AggregatedDerivationException(
            String schemaType, String interfaceName, Phase phase, List<Diagnostic> diagnostics) {
        super(render(schemaType, interfaceName, diagnostics), schemaType, interfaceName, phase);
        Objects.requireNonNull(diagnostics, "diagnostics must not be null");
        if (diagnostics.isEmpty()) {
            throw new IllegalArgumentException("diagnostics must not be empty");
        }
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    /** Returns {@code true} if any diagnostic is of the given kind. */
    public boolean has(Diagnostic.Kind kind) {
        return diagnostics.stream().anyMatch(d -> d.kind() == kind);
    }

    private static String render(String schemaType, String interfaceName, List<Diagnostic> diagnostics) {
        StringBuilder sb = new StringBuilder();
        sb.append("Cannot derive ")
                .append(schemaType)
                .append(" for ")
                .append(interfaceName)
                .append(": ")
                .append(diagnostics == null ? 0 : diagnostics.size())
                .append(" problem(s)");
        if (diagnostics != null) {
            for (Diagnostic diagnostic : diagnostics) {
                sb.append(System.lineSeparator()).append("  - ").append(diagnostic.render());
            }
        }
        return sb.toString();
    }
}
