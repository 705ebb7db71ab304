package io.rpcmeta.core.engine;

import io.rpcmeta.core.config.ConsumptionPolicy;
import io.rpcmeta.core.config.DerivationConfig;
import io.rpcmeta.core.error.Diagnostic;
import io.rpcmeta.core.model.RealDeclaration;
import io.rpcmeta.core.model.Strategy;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Matches the per-method or per-parameter schema parameters of one schema
 * against the members (methods of an interface, parameters of a method) of one
 * real declaration.
 *
 * <p>
 * Each member is offered, in declaration order, to every member-matching
 * parameter whose tag restriction accepts it. A claim succeeds when the
 * parameter's nested schema can be built for the member. A member may be
 * consumed by at most one non-auxiliary parameter; auxiliary parameters match
 * without consuming. Failed claims are reported only for members nothing else
 * consumed. Matched members are finally grouped per parameter and checked
 * against its cardinality.
 */
final class MemberMapper {

    private static final Logger LOG = LoggerFactory.getLogger(MemberMapper.class);

    private final SchemaConstructor constructor;
    private final TagMatcher tags;
    private final DerivationConfig config;

    MemberMapper(SchemaConstructor constructor, TagMatcher tags, DerivationConfig config) {
        this.constructor = constructor;
        this.tags = tags;
        this.config = config;
    }

    /** Outcome of mapping the members of one declaration. */
    static final class Mapping {

        private final Map<SchemaParam, Res<ValuePlan>> values;
        private final List<Diagnostic> unattributed;

        private Mapping(Map<SchemaParam, Res<ValuePlan>> values, List<Diagnostic> unattributed) {
            this.values = values;
            this.unattributed = unattributed;
        }

        /**
         * The value plan of one member-matching parameter, or the failures that
         * prevent it.
         */
        Res<ValuePlan> valueOf(SchemaParam param) {
            Res<ValuePlan> value = values.get(param);
            if (value == null) {
                throw new IllegalStateException("parameter was not mapped: " + param);
            }
            return value;
        }

        /**
         * Failures concerning members rather than a single parameter (duplicate
         * or missing consumption).
         */
        List<Diagnostic> unattributed() {
            return unattributed;
        }
    }

    Mapping map(SchemaType schema, RealDeclaration subject, List<? extends RealDeclaration> members) {
        List<SchemaParam> params = schema.memberParams();
        Map<SchemaParam, List<Candidate<ValuePlan>>> matches = new LinkedHashMap<>();
        Map<SchemaParam, List<Diagnostic>> failures = new HashMap<>();
        for (SchemaParam param : params) {
            matches.put(param, new ArrayList<>());
            failures.put(param, new ArrayList<>());
        }
        List<Diagnostic> unattributed = new ArrayList<>();

        for (RealDeclaration member : members) {
            List<SchemaParam> consumers = new ArrayList<>();
            Map<SchemaParam, List<Diagnostic>> rejected = new LinkedHashMap<>();
            for (SchemaParam param : params) {
                if (!claims(param, member)) {
                    continue;
                }
                if (!param.auxiliary()
                        && !consumers.isEmpty()
                        && config.consumptionPolicy() == ConsumptionPolicy.FIRST_MATCH) {
                    continue;
                }
                List<Candidate<ValuePlan>> matched = matches.get(param);
                Res<ValuePlan> attempt = constructor.construct(param.nested(), member, matched.size());
                if (attempt.isOk()) {
                    matched.add(new Candidate<>(member.rpcName(), member.source(), attempt.value()));
                    if (!param.auxiliary()) {
                        consumers.add(param);
                    }
                    LOG.debug("Matched {} to {}", member.source(), param.description());
                } else {
                    rejected.put(param, attempt.failures());
                    LOG.debug(
                            "Rejected {} for {}: {} problem(s)",
                            member.source(),
                            param.description(),
                            attempt.failures().size());
                }
            }

            if (consumers.size() > 1) {
                unattributed.add(new Diagnostic(
                        Diagnostic.Kind.DUPLICATE_CONSUMPTION,
                        String.join(", ", consumers.stream().map(SchemaParam::description).toList()),
                        List.of(member.source()),
                        member.scope().label() + " " + member.name() + " is consumed by " + consumers.size()
                                + " schema parameters; mark all but one @Auxiliary or restrict them with @Tagged"));
            } else if (consumers.isEmpty()) {
                if (!rejected.isEmpty()) {
                    rejected.forEach((param, problems) -> failures.get(param).addAll(problems));
                } else if (config.requireAllMembersMatched()) {
                    unattributed.add(new Diagnostic(
                            Diagnostic.Kind.UNMATCHED_MEMBER,
                            null,
                            List.of(member.source()),
                            member.scope().label() + " " + member.name() + " is not matched by any parameter of "
                                    + schema.description()));
                }
            }
        }

        Map<SchemaParam, Res<ValuePlan>> values = new HashMap<>();
        for (SchemaParam param : params) {
            values.put(param, resolve(param, subject, matches.get(param), failures.get(param)));
        }
        return new Mapping(values, unattributed);
    }

    private boolean claims(SchemaParam param, RealDeclaration member) {
        TagConfig family = param.strategy().kind() == Strategy.Kind.PER_METHOD
                ? param.owner().methodTags()
                : param.owner().paramTags();
        return tags.accepts(param.tagged(), family, member);
    }

    private Res<ValuePlan> resolve(
            SchemaParam param,
            RealDeclaration subject,
            List<Candidate<ValuePlan>> matched,
            List<Diagnostic> memberFailures) {
        String what = param.strategy().kind() == Strategy.Kind.PER_METHOD ? "real method" : "real parameter";
        Res<List<Candidate<ValuePlan>>> resolved =
                CardinalityResolver.resolve(param.cardinality(), matched, param.description(), what, subject.source());
        if (!resolved.isOk()) {
            // a member that failed its nested match already explains the missing one
            boolean onlyNoMatch = resolved.failures().stream().allMatch(d -> d.kind() == Diagnostic.Kind.NO_MATCH);
            if (onlyNoMatch && !memberFailures.isEmpty()) {
                return Res.fail(memberFailures);
            }
            return Res.<ValuePlan>fail(resolved.failures()).withFailures(memberFailures);
        }
        return resolved.map(accepted -> ValuePlan.collect(param.cardinality(), accepted))
                .withFailures(memberFailures);
    }
}
