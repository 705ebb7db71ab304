package io.rpcmeta.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ParamFlagsTest {

    @Test
    void ofSetsOnlyRequestedBits() {
        ParamFlags flags = ParamFlags.of(true, false, true, false, false);

        assertThat(flags.bits()).isEqualTo(ParamFlags.CONTEXTUAL | ParamFlags.VARIADIC);
        assertThat(flags.isContextual()).isTrue();
        assertThat(flags.isVariadic()).isTrue();
        assertThat(flags.isLazy()).isFalse();
        assertThat(flags.hasDefault()).isFalse();
        assertThat(flags.isSynthetic()).isFalse();
        assertThat(flags).hasToString("ParamFlags[contextual, variadic]");
    }

    @Test
    void unknownBitsAreRejected() {
        assertThatThrownBy(() -> new ParamFlags(1 << 5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void negativePositionsAreRejected() {
        assertThatThrownBy(() -> new ParamPosition(0, 0, -1, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
