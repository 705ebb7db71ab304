package io.rpcmeta.core.engine;

import io.rpcmeta.core.error.Diagnostic;
import io.rpcmeta.core.model.Cardinality;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies exactly-one / zero-or-one / many semantics to a filtered, ordered
 * candidate list. Pure function: no state, no side effects.
 */
public final class CardinalityResolver {

    private CardinalityResolver() {}

    /**
     * Resolves the candidates for one schema parameter.
     *
     * @param cardinality the parameter's cardinality
     * @param candidates  qualifying candidates in declaration order
     * @param parameter   description of the schema parameter, for diagnostics
     * @param what        what the candidates are (e.g. "real method",
     *                    "annotation"), for diagnostics
     * @param site        source position of the scope that was searched, for
     *                    diagnostics
     * @return the accepted candidates, declaration order preserved, or the
     *         cardinality violations
     */
    public static <T> Res<List<Candidate<T>>> resolve(
            Cardinality cardinality, List<Candidate<T>> candidates, String parameter, String what, String site) {
        return switch (cardinality) {
            case EXACTLY_ONE -> {
                if (candidates.isEmpty()) {
                    yield Res.fail(new Diagnostic(
                            Diagnostic.Kind.NO_MATCH,
                            parameter,
                            List.of(site),
                            "no " + what + " found that would match " + parameter));
                }
                yield candidates.size() == 1 ? Res.ok(List.copyOf(candidates)) : ambiguous(candidates, parameter, what);
            }
            case ZERO_OR_ONE -> candidates.size() <= 1
                    ? Res.ok(List.copyOf(candidates))
                    : ambiguous(candidates, parameter, what);
            case MANY_LISTED -> Res.ok(List.copyOf(candidates));
            case MANY_NAMED -> named(candidates, parameter, what);
        };
    }

    private static <T> Res<List<Candidate<T>>> ambiguous(
            List<Candidate<T>> candidates, String parameter, String what) {
        return Res.fail(new Diagnostic(
                Diagnostic.Kind.AMBIGUOUS_MATCH,
                parameter,
                sources(candidates),
                "multiple " + what + "s match " + parameter + ": " + names(candidates)));
    }

    private static <T> Res<List<Candidate<T>>> named(List<Candidate<T>> candidates, String parameter, String what) {
        Map<String, List<Candidate<T>>> byName = new LinkedHashMap<>();
        for (Candidate<T> candidate : candidates) {
            byName.computeIfAbsent(candidate.name(), n -> new ArrayList<>()).add(candidate);
        }
        List<Diagnostic> collisions = new ArrayList<>();
        byName.forEach((name, group) -> {
            if (group.size() > 1) {
                collisions.add(new Diagnostic(
                        Diagnostic.Kind.DUPLICATE_NAME,
                        parameter,
                        sources(group),
                        "multiple " + what + "s named '" + name + "' map to " + parameter
                                + "; disambiguate them with @RpcName"));
            }
        });
        return collisions.isEmpty() ? Res.ok(List.copyOf(candidates)) : Res.fail(collisions);
    }

    private static <T> List<String> sources(List<Candidate<T>> candidates) {
        return candidates.stream().map(Candidate::source).toList();
    }

    private static <T> String names(List<Candidate<T>> candidates) {
        return String.join(", ", candidates.stream().map(Candidate::source).toList());
    }
}
