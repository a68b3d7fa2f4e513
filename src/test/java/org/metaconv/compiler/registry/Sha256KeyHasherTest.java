package org.metaconv.compiler.registry;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class Sha256KeyHasherTest {

    @Test
    void hash_isTruncatedSha256() {
        assertThat(new Sha256KeyHasher().hash("abc")).isEqualTo("ba7816bf8f01cfea");
        assertThat(new Sha256KeyHasher(64).hash("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        assertThat(new Sha256KeyHasher(8).hash("abc")).isEqualTo("ba7816bf");
    }

    @Test
    void hash_isStableAcrossInstances() {
        String key = "VALUE_TRANSFORM:(Symbol VALUE \"val\" 0)";
        assertThat(new Sha256KeyHasher().hash(key)).isEqualTo(new Sha256KeyHasher().hash(key));
        assertThat(new Sha256KeyHasher().hash(key)).isNotEqualTo(new Sha256KeyHasher().hash(key + " "));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 7, 65})
    void constructor_rejectsLengthOutOfRange(int length) {
        assertThatThrownBy(() -> new Sha256KeyHasher(length))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("between 8 and 64");
    }
}
