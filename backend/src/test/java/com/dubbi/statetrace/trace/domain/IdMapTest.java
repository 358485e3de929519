package com.dubbi.statetrace.trace.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.Test;

class IdMapTest {

    @Test
    void assignsSequentialIdsInFirstAppearanceOrder() {
        IdMap.Builder builder = IdMap.builder(IdMap.SCREEN_PREFIX);

        assertThat(builder.assign("h1")).isEqualTo("S1");
        assertThat(builder.assign("h2")).isEqualTo("S2");
        assertThat(builder.assign("h1")).isEqualTo("S1");
        assertThat(builder.assign("h3")).isEqualTo("S3");

        IdMap map = builder.build();
        assertThat(map.size()).isEqualTo(3);
        assertThat(map.canonicalToOriginal()).containsExactly(
                Map.entry("S1", "h1"),
                Map.entry("S2", "h2"),
                Map.entry("S3", "h3")
        );
    }

    @Test
    void bothDirectionsFormOneBijection() {
        IdMap.Builder builder = IdMap.builder(IdMap.TRANSITION_PREFIX);
        for (String h : new String[]{"x", "y", "z", "y", "x"}) {
            builder.assign(h);
        }
        IdMap map = builder.build();

        map.originalToCanonical().forEach((original, canonical) ->
                assertThat(map.canonicalToOriginal().get(canonical)).isEqualTo(original));
        map.canonicalToOriginal().forEach((canonical, original) ->
                assertThat(map.originalToCanonical().get(original)).isEqualTo(canonical));
        assertThat(map.originalOf("T2")).contains("y");
        assertThat(map.canonicalOf("z")).contains("T3");
        assertThat(map.canonicalOf("missing")).isEmpty();
    }

    @Test
    void builtMapIsImmutableAndDetachedFromBuilder() {
        IdMap.Builder builder = IdMap.builder(IdMap.SCREEN_PREFIX);
        builder.assign("h1");
        IdMap map = builder.build();
        builder.assign("h2");

        assertThat(map.size()).isEqualTo(1);
        assertThatThrownBy(() -> map.canonicalToOriginal().put("S9", "h9"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void numberOfParsesNumericSuffixOnly() {
        assertThat(IdMap.numberOf("S12")).isEqualTo(12);
        assertThat(IdMap.numberOf("T1")).isEqualTo(1);
        assertThat(IdMap.numberOf("S")).isEqualTo(-1);
        assertThat(IdMap.numberOf("S1X")).isEqualTo(-1);
        assertThat(IdMap.numberOf(null)).isEqualTo(-1);
    }
}
