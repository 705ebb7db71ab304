package io.rpcmeta.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.rpcmeta.core.error.Diagnostic;
import java.util.List;
import org.junit.jupiter.api.Test;

class ResTest {

    private static Diagnostic diagnostic(String parameter) {
        return new Diagnostic(Diagnostic.Kind.NO_MATCH, parameter, List.of(), "missing " + parameter);
    }

    @Test
    void allCollectsEveryFailureInOrder() {
        Res<List<Integer>> combined = Res.all(List.of(
                Res.ok(1), Res.<Integer>fail(diagnostic("a")), Res.ok(3), Res.<Integer>fail(diagnostic("b"))));

        assertThat(combined.isOk()).isFalse();
        assertThat(combined.failures()).extracting(Diagnostic::parameter).containsExactly("a", "b");
    }

    @Test
    void allSucceedsWithValuesInOrder() {
        assertThat(Res.all(List.of(Res.ok(1), Res.ok(2))).value()).containsExactly(1, 2);
    }

    @Test
    void withFailuresTurnsSuccessIntoFailure() {
        Res<String> result = Res.ok("x").withFailures(List.of(diagnostic("late")));

        assertThat(result.isOk()).isFalse();
        assertThatThrownBy(result::value).isInstanceOf(IllegalStateException.class);
        assertThat(Res.ok("x").withFailures(List.of()).value()).isEqualTo("x");
    }

    @Test
    void mapSkipsFailures() {
        Res<Integer> failed = Res.fail(diagnostic("a"));

        assertThat(failed.map(i -> i + 1).failures()).hasSize(1);
        assertThat(Res.ok(1).map(i -> i + 1).value()).isEqualTo(2);
    }

    @Test
    void failureNeedsADiagnostic() {
        assertThatThrownBy(() -> Res.fail(List.of())).isInstanceOf(IllegalArgumentException.class);
    }
}
