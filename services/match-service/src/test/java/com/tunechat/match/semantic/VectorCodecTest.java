package com.tunechat.match.semantic;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class VectorCodecTest {

    @Test
    void providerVectorMustMatchDimension() {
        assertThat(VectorCodec.fromProvider(List.of(0.5, -0.25), 2)).containsExactly(0.5f, -0.25f);

        assertThatThrownBy(() -> VectorCodec.fromProvider(List.of(0.5), 2))
            .isInstanceOf(InvalidVectorException.class)
            .hasMessageContaining("dimension");
        assertThatThrownBy(() -> VectorCodec.fromProvider(List.of(), 2))
            .isInstanceOf(InvalidVectorException.class);
        assertThatThrownBy(() -> VectorCodec.fromProvider(null, 2))
            .isInstanceOf(InvalidVectorException.class);
    }

    @Test
    void providerVectorMustBeFinite() {
        assertThatThrownBy(() -> VectorCodec.fromProvider(List.of(0.1, Double.POSITIVE_INFINITY), 2))
            .isInstanceOf(InvalidVectorException.class)
            .hasMessageContaining("non_finite");
        assertThatThrownBy(() -> VectorCodec.fromProvider(Arrays.asList(0.1, null), 2))
            .isInstanceOf(InvalidVectorException.class);
    }

    @Test
    void parsesStoredLiteral() {
        assertThat(VectorCodec.parseLiteral("[0.1, -2,3e-1]")).containsExactly(0.1f, -2f, 0.3f);
        assertThat(VectorCodec.parseLiteral("[]")).isEmpty();
        assertThat(VectorCodec.parseLiteral(null)).isNull();
    }

    @Test
    void rejectsMalformedLiteral() {
        assertThatThrownBy(() -> VectorCodec.parseLiteral("0.1,0.2")).isInstanceOf(InvalidVectorException.class);
        assertThatThrownBy(() -> VectorCodec.parseLiteral("[0.1,abc]")).isInstanceOf(InvalidVectorException.class);
        assertThatThrownBy(() -> VectorCodec.parseLiteral("[NaN,0.2]")).isInstanceOf(InvalidVectorException.class);
    }

    @Test
    void literalRoundTripsThroughParser() {
        float[] vector = {0.25f, -1f, 0f};

        assertThat(VectorCodec.toLiteral(vector)).isEqualTo("[0.25,-1.0,0.0]");
        assertThat(VectorCodec.parseLiteral(VectorCodec.toLiteral(vector))).containsExactly(vector);
    }
}
