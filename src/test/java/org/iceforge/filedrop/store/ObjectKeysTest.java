package org.iceforge.filedrop.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ObjectKeysTest {

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "../etc/passwd", "a/b", "key.json", "has space", "ключ"})
    void requireValid_rejectsMalformedKeys(String key) {
        assertThatThrownBy(() -> ObjectKeys.requireValid(key, "publicKey"))
                .isInstanceOf(InvalidKeyException.class)
                .hasMessageStartingWith("publicKey");
    }

    @Test
    void requireValid_rejectsNullAndOverlongKeys() {
        assertThatThrownBy(() -> ObjectKeys.requireValid(null, "privateKey"))
                .isInstanceOf(InvalidKeyException.class)
                .hasMessage("privateKey is required");
        assertThatThrownBy(() -> ObjectKeys.requireValid("a".repeat(ObjectKeys.MAX_LENGTH + 1), "privateKey"))
                .isInstanceOf(InvalidKeyException.class);
    }

    @Test
    void requireValid_acceptsTokenCharacters() {
        assertThat(ObjectKeys.requireValid("nonexistent-key_01", "key")).isEqualTo("nonexistent-key_01");
    }

    @Test
    void abbreviate_keepsOnlyAPrefix() {
        assertThat(ObjectKeys.abbreviate("0123456789abcdef")).isEqualTo("01234567...");
        assertThat(ObjectKeys.abbreviate("short")).isEqualTo("short");
        assertThat(ObjectKeys.abbreviate(null)).isEqualTo("null");
    }
}
