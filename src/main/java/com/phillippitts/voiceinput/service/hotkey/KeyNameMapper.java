package com.phillippitts.voiceinput.service.hotkey;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Canonicalizes key and modifier names so configuration and hook adapters agree,
 * and checks them against an allow-list.
 */
public final class KeyNameMapper {

    private static final Set<String> GENERIC_MODIFIERS = Set.of("META", "SHIFT", "CONTROL", "ALT");

    private static final Set<String> SIDED_MODIFIERS = Set.of(
            "LEFT_META", "RIGHT_META", "LEFT_SHIFT", "RIGHT_SHIFT",
            "LEFT_CONTROL", "RIGHT_CONTROL", "LEFT_ALT", "RIGHT_ALT");

    private static final Set<String> ALLOWED_KEYS;

    static {
        Set<String> keys = new HashSet<>();
        for (char c = 'A'; c <= 'Z'; c++) {
            keys.add(String.valueOf(c));
        }
        for (char c = '0'; c <= '9'; c++) {
            keys.add(String.valueOf(c));
        }
        IntStream.rangeClosed(1, 24).forEach(i -> keys.add("F" + i));
        keys.addAll(List.of("ESCAPE", "ENTER", "TAB", "SPACE", "BACKSPACE", "CAPS_LOCK",
                "SCROLL_LOCK", "PAUSE", "INSERT"));
        // Modifiers double as keys when the hook reports them as primary edges
        keys.addAll(GENERIC_MODIFIERS);
        keys.addAll(SIDED_MODIFIERS);
        ALLOWED_KEYS = Set.copyOf(keys);
    }

    private KeyNameMapper() {}

    /** Canonicalize a key name: case-insensitive, spaces to underscores, common aliases. */
    public static String normalizeKey(String keyText) {
        if (keyText == null || keyText.isBlank()) {
            return "UNKNOWN";
        }
        String k = keyText.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
        return switch (k) {
            case "CTRL" -> "CONTROL";
            case "CMD", "COMMAND" -> "META";
            case "OPTION" -> "ALT";
            case "CAPSLOCK", "CAPS" -> "CAPS_LOCK";
            case "ESC" -> "ESCAPE";
            case "RETURN" -> "ENTER";
            default -> normalizeModifier(k);
        };
    }

    /** Normalize a single modifier alias to canonical form. */
    public static String normalizeModifier(String mod) {
        if (mod == null) {
            return "";
        }
        return mod.trim().toUpperCase(Locale.ROOT)
                .replace(' ', '_')
                .replace("COMMAND", "META")
                .replace("CMD", "META")
                .replace("CTRL", "CONTROL")
                .replace("OPTION", "ALT");
    }

    public static Set<String> normalizeModifiers(List<String> mods) {
        if (mods == null) {
            return Set.of();
        }
        return mods.stream()
                .map(KeyNameMapper::normalizeModifier)
                .collect(Collectors.toUnmodifiableSet());
    }

    public static boolean isValidKey(String key) {
        return ALLOWED_KEYS.contains(normalizeKey(key));
    }

    public static boolean isValidModifier(String mod) {
        String m = normalizeModifier(mod);
        return GENERIC_MODIFIERS.contains(m) || SIDED_MODIFIERS.contains(m);
    }

    /**
     * Maps a sided modifier to its generic family: LEFT_CONTROL and RIGHT_CONTROL to CONTROL.
     * Other names are returned normalized.
     */
    public static String genericModifier(String name) {
        String m = normalizeModifier(name);
        if (m.startsWith("LEFT_")) {
            return m.substring("LEFT_".length());
        }
        if (m.startsWith("RIGHT_")) {
            return m.substring("RIGHT_".length());
        }
        return m;
    }

    /**
     * True when {@code key} is the configured modifier itself or one of its sided variants.
     * A sided configuration (LEFT_ALT) only matches that side.
     */
    public static boolean matchesModifier(String configured, String key) {
        String c = normalizeModifier(configured);
        String k = normalizeKey(key);
        if (c.equals(k)) {
            return true;
        }
        return GENERIC_MODIFIERS.contains(c) && c.equals(genericModifier(k));
    }

    /**
     * Compare a configured hotkey (mods + key) against a reserved combo string
     * like "META+TAB" or "META+SHIFT+D".
     */
    public static boolean matchesReserved(Set<String> configuredMods, String configuredKey, String reservedSpec) {
        if (reservedSpec == null || reservedSpec.isBlank()) {
            return false;
        }
        Set<String> rmods = new HashSet<>();
        String rkey = null;
        for (String p : reservedSpec.split("\\+")) {
            String n = p.trim();
            if (n.isEmpty()) {
                continue;
            }
            if (isValidModifier(n)) {
                rmods.add(genericModifier(n));
            } else {
                rkey = normalizeKey(n);
            }
        }
        Set<String> cmods = configuredMods.stream()
                .map(KeyNameMapper::genericModifier)
                .collect(Collectors.toSet());
        return normalizeKey(configuredKey).equals(rkey) && cmods.equals(rmods);
    }
}
