package com.phillippitts.voiceinput.service.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ModelCatalogTest {

    @Test
    void normalizesLegacyAndBlankNames() {
        assertThat(ModelCatalog.normalize("tiny")).isEqualTo("small");
        assertThat(ModelCatalog.normalize(" Base ")).isEqualTo("small");
        assertThat(ModelCatalog.normalize(null)).isEqualTo("small");
        assertThat(ModelCatalog.normalize("")).isEqualTo("small");
        assertThat(ModelCatalog.normalize("MEDIUM")).isEqualTo("medium");
    }

    @Test
    void knowsSelectableFamilies() {
        assertThat(ModelCatalog.isKnown("small")).isTrue();
        assertThat(ModelCatalog.isKnown("medium")).isTrue();
        assertThat(ModelCatalog.isKnown("Large")).isTrue();
        assertThat(ModelCatalog.isKnown("tiny")).isTrue();
        assertThat(ModelCatalog.isKnown("huge")).isFalse();
    }

    @Test
    void sizedFamiliesNeedEnglishAndMultilingualArtifacts() {
        assertThat(ModelCatalog.artifactsFor("medium"))
                .containsExactly("ggml-medium.en.bin", "ggml-medium.bin");
    }

    @Test
    void largeNeedsOneArtifact() {
        assertThat(ModelCatalog.artifactsFor("large")).containsExactly("ggml-large-v2.bin");
        assertThat(ModelCatalog.artifactFor("large", "en")).isEqualTo("ggml-large-v2.bin");
    }

    @Test
    void artifactFollowsLanguage() {
        assertThat(ModelCatalog.artifactFor("small", "en")).isEqualTo("ggml-small.en.bin");
        assertThat(ModelCatalog.artifactFor("small", "de")).isEqualTo("ggml-small.bin");
    }

    @Test
    void unknownFamilyFallsBackToBaseArtifacts() {
        assertThat(ModelCatalog.artifactFor("odd", "fr")).isEqualTo("ggml-base.bin");
    }
}
