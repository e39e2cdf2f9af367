package com.phillippitts.voiceinput.service.model;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Maps model families to whisper.cpp artifact files.
 *
 * <p>{@code base}, {@code small} and {@code medium} ship an English-only file
 * ({@code ggml-<m>.en.bin}) and a multilingual one ({@code ggml-<m>.bin}); {@code large}
 * is multilingual only. The legacy names {@code base} and {@code tiny} are normalized to
 * {@code small}.
 */
public final class ModelCatalog {

    public static final String DEFAULT_FAMILY = "small";
    public static final String LARGE = "large";

    private static final String LARGE_ARTIFACT = "ggml-large-v2.bin";
    private static final String FALLBACK_SIZE = "base";
    private static final Set<String> SIZED = Set.of("base", "small", "medium");
    private static final Set<String> LEGACY = Set.of("base", "tiny");

    private ModelCatalog() {}

    /** Lower-cases, trims and maps legacy names; blank becomes the default family. */
    public static String normalize(String name) {
        if (name == null || name.isBlank()) {
            return DEFAULT_FAMILY;
        }
        String n = name.trim().toLowerCase(Locale.ROOT);
        return LEGACY.contains(n) ? DEFAULT_FAMILY : n;
    }

    /** @return true for families a user may select (after normalization) */
    public static boolean isKnown(String family) {
        String n = normalize(family);
        return LARGE.equals(n) || SIZED.contains(n);
    }

    /** Every artifact a family needs, English-only file first. */
    public static List<String> artifactsFor(String family) {
        if (LARGE.equals(family)) {
            return List.of(LARGE_ARTIFACT);
        }
        String size = SIZED.contains(family) ? family : FALLBACK_SIZE;
        return List.of(englishArtifact(size), multilingualArtifact(size));
    }

    /** The single artifact used to transcribe {@code language} with {@code family}. */
    public static String artifactFor(String family, String language) {
        if (LARGE.equals(family)) {
            return LARGE_ARTIFACT;
        }
        String size = SIZED.contains(family) ? family : FALLBACK_SIZE;
        return "en".equalsIgnoreCase(language) ? englishArtifact(size) : multilingualArtifact(size);
    }

    private static String englishArtifact(String size) {
        return "ggml-" + size + ".en.bin";
    }

    private static String multilingualArtifact(String size) {
        return "ggml-" + size + ".bin";
    }
}
