package dev.nuclr.pdf.cache;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PageKeyTest {

    @Test
    void equalOnlyWhenEveryFieldMatches() {
        PageKey key = new PageKey("a.pdf", 3, 1.5f, 90);

        assertThat(key).isEqualTo(new PageKey("a.pdf", 3, 1.5f, 90));
        assertThat(key).isNotEqualTo(new PageKey("a.pdf", 3, 1.5f, 0));
        assertThat(key).isNotEqualTo(new PageKey("a.pdf", 3, 1.5001f, 90));
        assertThat(key).isNotEqualTo(new PageKey("b.pdf", 3, 1.5f, 90));
        assertThat(key.belongsTo("a.pdf")).isTrue();
    }

    @Test
    void rejectsMalformedFields() {
        assertThatThrownBy(() -> PageKey.of(" ", 0, 1.0f)).isInstanceOf(InvalidKeyException.class);
        assertThatThrownBy(() -> PageKey.of(null, 0, 1.0f)).isInstanceOf(InvalidKeyException.class);
        assertThatThrownBy(() -> PageKey.of("a.pdf", -1, 1.0f)).isInstanceOf(InvalidKeyException.class);
        assertThatThrownBy(() -> PageKey.of("a.pdf", 0, 0f)).isInstanceOf(InvalidKeyException.class);
        assertThatThrownBy(() -> PageKey.of("a.pdf", 0, Float.NaN)).isInstanceOf(InvalidKeyException.class);
        assertThatThrownBy(() -> PageKey.of("a.pdf", 0, Float.POSITIVE_INFINITY))
                .isInstanceOf(InvalidKeyException.class);
        assertThatThrownBy(() -> new PageKey("a.pdf", 0, 1.0f, 45))
                .isInstanceOf(InvalidKeyException.class)
                .hasMessageContaining("rotation");
    }

    @Test
    void invalidKeyIsAnIllegalArgument() {
        assertThatThrownBy(() -> PageKey.of("a.pdf", -2, 1.0f)).isInstanceOf(IllegalArgumentException.class);
    }
}
