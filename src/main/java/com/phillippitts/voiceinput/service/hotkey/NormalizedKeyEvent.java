package com.phillippitts.voiceinput.service.hotkey;

import java.util.Locale;
import java.util.Set;

/**
 * Library-independent key edge. Key and modifier names are upper-case canonical forms
 * (see {@link KeyNameMapper}).
 */
public record NormalizedKeyEvent(Type type, String key, Set<String> modifiers, long whenMillis) {

    public enum Type { PRESSED, RELEASED }

    public NormalizedKeyEvent {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        key = key.toUpperCase(Locale.ROOT);
        modifiers = modifiers == null ? Set.of()
                : Set.copyOf(modifiers.stream().map(m -> m.toUpperCase(Locale.ROOT)).toList());
    }

    public static NormalizedKeyEvent pressed(String key, String... modifiers) {
        return new NormalizedKeyEvent(Type.PRESSED, key, Set.of(modifiers), System.currentTimeMillis());
    }

    public static NormalizedKeyEvent released(String key, String... modifiers) {
        return new NormalizedKeyEvent(Type.RELEASED, key, Set.of(modifiers), System.currentTimeMillis());
    }

    public boolean isPressed() {
        return type == Type.PRESSED;
    }
}
