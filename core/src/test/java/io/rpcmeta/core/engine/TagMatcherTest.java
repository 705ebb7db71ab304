package io.rpcmeta.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.rpcmeta.core.annotation.RpcName;
import io.rpcmeta.core.engine.Fixtures.CachedGET;
import io.rpcmeta.core.engine.Fixtures.Doc;
import io.rpcmeta.core.engine.Fixtures.GET;
import io.rpcmeta.core.engine.Fixtures.POST;
import io.rpcmeta.core.engine.Fixtures.Verb;
import io.rpcmeta.core.engine.reflect.ReflectiveInterfaceModel;
import io.rpcmeta.core.model.RealInterface;
import io.rpcmeta.core.model.RealMethod;
import java.lang.annotation.Annotation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TagMatcher")
class TagMatcherTest {

    private final ReflectiveInterfaceModel model = new ReflectiveInterfaceModel();
    private TagMatcher matcher;

    @BeforeEach
    void setUp() {
        matcher = new TagMatcher();
    }

    private RealMethod method(Class<?> iface, String name) {
        RealInterface described = model.describe(iface);
        return described.methods().stream()
                .filter(m -> m.name().equals(name))
                .findFirst()
                .orElseThrow();
    }

    @Nested
    @DisplayName("tag hierarchy")
    class Hierarchy {

        @Test
        void tagRefinesItselfAndItsAncestors() {
            assertThat(TagMatcher.refines(GET.class, GET.class)).isTrue();
            assertThat(TagMatcher.refines(GET.class, Verb.class)).isTrue();
            assertThat(TagMatcher.refines(CachedGET.class, Verb.class)).isTrue();
        }

        @Test
        void siblingsAndDescendantsDoNotRefine() {
            assertThat(TagMatcher.refines(GET.class, POST.class)).isFalse();
            assertThat(TagMatcher.refines(Verb.class, GET.class)).isFalse();
            assertThat(TagMatcher.refines(GET.class, CachedGET.class)).isFalse();
        }

        @Test
        void onlyRpcTagAnnotatedTypesAreTags() {
            assertThat(TagMatcher.isTag(GET.class)).isTrue();
            assertThat(TagMatcher.isTag(Doc.class)).isFalse();
            assertThat(TagMatcher.isTag(RpcName.class)).isFalse();
            assertThat(TagMatcher.isTag(null)).isFalse();
        }

        @Test
        void annotationIsAssignableToItsTypeAndToAncestorTags() throws Exception {
            Annotation cached = Fixtures.TwoGets.class.getMethod("second").getAnnotation(CachedGET.class);

            assertThat(TagMatcher.isAssignable(cached, CachedGET.class)).isTrue();
            assertThat(TagMatcher.isAssignable(cached, GET.class)).isTrue();
            assertThat(TagMatcher.isAssignable(cached, Verb.class)).isTrue();
            assertThat(TagMatcher.isAssignable(cached, POST.class)).isFalse();
            assertThat(TagMatcher.isAssignable(cached, Annotation.class)).isTrue();
        }
    }

    @Nested
    @DisplayName("effective tags")
    class EffectiveTags {

        private final TagConfig verbs = new TagConfig(Verb.class, null);
        private final TagConfig verbsDefaultPost = new TagConfig(Verb.class, POST.class);

        @Test
        void ownTagIsEffective() {
            assertThat(matcher.effectiveTag(method(Fixtures.TwoGets.class, "second"), verbs))
                    .contains(CachedGET.class);
        }

        @Test
        void untaggedMethodGetsTheDefault() {
            RealMethod ping = method(Fixtures.Untagged.class, "ping");

            assertThat(matcher.effectiveTag(ping, verbs)).isEmpty();
            assertThat(matcher.effectiveTag(ping, verbsDefaultPost)).contains(POST.class);
        }

        @Test
        void tagsOutsideTheFamilyAreIgnored() {
            TagConfig postsOnly = new TagConfig(POST.class, null);

            assertThat(matcher.effectiveTag(method(Fixtures.TwoGets.class, "first"), postsOnly))
                    .isEmpty();
        }

        @Test
        void anyTagCountsWithoutAFamily() {
            assertThat(matcher.effectiveTag(method(Fixtures.TwoGets.class, "first"), TagConfig.NONE))
                    .contains(GET.class);
        }
    }

    @Nested
    @DisplayName("acceptance")
    class Acceptance {

        private final TagConfig verbs = new TagConfig(Verb.class, null);

        @Test
        void restrictionAcceptsRefinements() {
            RealMethod second = method(Fixtures.TwoGets.class, "second");

            assertThat(matcher.accepts(GET.class, verbs, second)).isTrue();
            assertThat(matcher.accepts(CachedGET.class, verbs, second)).isTrue();
            assertThat(matcher.accepts(POST.class, verbs, second)).isFalse();
        }

        @Test
        void unrestrictedParameterRequiresTheFamilyBase() {
            assertThat(matcher.accepts(null, verbs, method(Fixtures.GetAndPost.class, "write")))
                    .isTrue();
            assertThat(matcher.accepts(null, verbs, method(Fixtures.Untagged.class, "ping")))
                    .isFalse();
        }

        @Test
        void noFamilyAcceptsEverything() {
            assertThat(matcher.accepts(null, TagConfig.NONE, method(Fixtures.Untagged.class, "ping")))
                    .isTrue();
        }

        @Test
        void untaggedMethodIsRejectedByTagRestrictionWithoutDefault() {
            assertThat(matcher.accepts(GET.class, TagConfig.NONE, method(Fixtures.Untagged.class, "ping")))
                    .isFalse();
        }
    }

    @Test
    @DisplayName("inherited annotations follow own annotations")
    void annotationsIncludeInherited() {
        RealMethod find = method(Fixtures.DocumentedDerived.class, "find");

        assertThat(matcher.annotationsOf(find))
                .filteredOn(a -> a instanceof Doc)
                .extracting(a -> ((Doc) a).value())
                .containsExactly("derived", "base");
    }
}
