package io.rpcmeta.core.engine;

import io.rpcmeta.core.config.DerivationConfig;
import io.rpcmeta.core.error.Diagnostic;
import io.rpcmeta.core.model.RealDeclaration;
import io.rpcmeta.core.model.RealInterface;
import io.rpcmeta.core.model.RealMethod;
import io.rpcmeta.core.spi.ContextResolver;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;

/**
 * Matches one schema against one real declaration, at any scope. Embedded
 * parameters are resolved against the same declaration; per-method and
 * per-parameter parameters descend into its members through
 * {@link MemberMapper}, which calls back here for each member.
 *
 * <p>
 * One instance serves one derivation and is not thread-safe.
 */
final class SchemaConstructor {

    private final DirectMaterializer direct;
    private final MemberMapper members;

    SchemaConstructor(TagMatcher tags, ContextResolver resolver, DerivationConfig config) {
        this.direct = new DirectMaterializer(tags, resolver);
        this.members = new MemberMapper(this, tags, config);
    }

    /**
     * Builds the value plan of {@code schema} for {@code subject}.
     *
     * @param indexInMatched index of {@code subject} among the matches of the
     *                       enclosing parameter
     */
    Res<ValuePlan> construct(SchemaType schema, RealDeclaration subject, int indexInMatched) {
        Res<Void> typed = checkDescribedType(schema, subject);
        if (!typed.isOk()) {
            return Res.fail(typed.failures());
        }
        MemberMapper.Mapping mapping = members.map(schema, subject, membersOf(subject));
        return assemble(schema, subject, indexInMatched, mapping).withFailures(mapping.unattributed());
    }

    private Res<ValuePlan> assemble(
            SchemaType schema, RealDeclaration subject, int indexInMatched, MemberMapper.Mapping mapping) {
        List<Res<ValuePlan>> arguments = new ArrayList<>();
        for (SchemaParam param : schema.params()) {
            arguments.add(switch (param.strategy().kind()) {
                case EMBEDDED -> {
                    Res<Void> typed = checkDescribedType(param.nested(), subject);
                    yield typed.isOk()
                            ? assemble(param.nested(), subject, indexInMatched, mapping)
                            : Res.fail(typed.failures());
                }
                case PER_METHOD, PER_PARAMETER -> mapping.valueOf(param);
                default -> direct.materialize(param, subject, indexInMatched);
            });
        }
        return Res.all(arguments).map(values -> new ValuePlan.Construct(schema, values, subject.source()));
    }

    private static Res<Void> checkDescribedType(SchemaType schema, RealDeclaration subject) {
        Type described = schema.describedType();
        if (described == null || described.equals(subject.type())) {
            return Res.ok(null);
        }
        String parameter = schema.enclosing() != null ? schema.enclosing().description() : schema.description();
        return Res.fail(new Diagnostic(
                Diagnostic.Kind.INCOMPATIBLE_TYPE,
                parameter,
                List.of(subject.source()),
                schema.description() + " describes " + described.getTypeName() + " but "
                        + subject.scope().label() + " " + subject.name() + " has type "
                        + subject.type().getTypeName()));
    }

    private static List<? extends RealDeclaration> membersOf(RealDeclaration subject) {
        if (subject instanceof RealInterface iface) {
            return iface.methods();
        }
        if (subject instanceof RealMethod method) {
            return method.parameters();
        }
        return List.of();
    }
}
