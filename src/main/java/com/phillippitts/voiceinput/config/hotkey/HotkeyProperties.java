package com.phillippitts.voiceinput.config.hotkey;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Typed properties for the dictation gesture.
 *
 * Holding {@code modifier} and pressing {@code trigger} starts dictation; releasing
 * {@code trigger} ends it. Pressing {@code trigger} while holding {@code translateModifier}
 * toggles translate mode. Key names use the canonical forms of {@code KeyNameMapper}
 * (e.g. CONTROL, ALT, META, CAPS_LOCK, F13).
 */
@Validated
@ConfigurationProperties(prefix = "hotkey")
public class HotkeyProperties {

    @NotBlank
    private final String modifier;

    @NotBlank
    private final String trigger;

    /** Optional; blank disables the translate toggle. */
    private final String translateModifier;

    /** Reserved OS shortcuts to flag as conflicts (e.g., META+TAB, META+L). */
    private final List<String> reserved;

    @ConstructorBinding
    public HotkeyProperties(String modifier,
                            String trigger,
                            String translateModifier,
                            List<String> reserved) {
        this.modifier = (modifier == null || modifier.isBlank()) ? "CONTROL" : modifier;
        this.trigger = (trigger == null || trigger.isBlank()) ? "CAPS_LOCK" : trigger;
        this.translateModifier = (translateModifier == null || translateModifier.isBlank()) ? null : translateModifier;
        this.reserved = (reserved == null || reserved.isEmpty())
                ? List.of("META+TAB", "META+L")
                : List.copyOf(reserved);
    }

    public String getModifier() { return modifier; }
    public String getTrigger() { return trigger; }
    public String getTranslateModifier() { return translateModifier; }
    public List<String> getReserved() { return reserved; }
}
