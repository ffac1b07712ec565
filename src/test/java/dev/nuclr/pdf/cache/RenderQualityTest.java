package dev.nuclr.pdf.cache;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RenderQualityTest {

    @Test
    void levelsMapToScaleFactors() {
        assertThat(RenderQuality.fromLevel(1)).isEqualTo(RenderQuality.DRAFT);
        assertThat(RenderQuality.fromLevel(2).apply(1.5f)).isEqualTo(3.0f);
        assertThat(RenderQuality.fromLevel(3).scaleFactor()).isEqualTo(2.75f);
    }

    @Test
    void rejectsLevelsOutsideHostRange() {
        assertThatThrownBy(() -> RenderQuality.fromLevel(0)).isInstanceOf(InvalidKeyException.class);
        assertThatThrownBy(() -> RenderQuality.fromLevel(4)).isInstanceOf(InvalidKeyException.class);
    }

    @Test
    void parsesHostCacheTypes() {
        assertThat(InvalidationScope.fromHostValue("page")).isEqualTo(InvalidationScope.PAGE);
        assertThat(InvalidationScope.fromHostValue(" Document ")).isEqualTo(InvalidationScope.DOCUMENT);
        assertThat(InvalidationScope.fromHostValue(null)).isEqualTo(InvalidationScope.ALL);
        assertThatThrownBy(() -> InvalidationScope.fromHostValue("thumbnails"))
                .isInstanceOf(InvalidKeyException.class);
    }
}
