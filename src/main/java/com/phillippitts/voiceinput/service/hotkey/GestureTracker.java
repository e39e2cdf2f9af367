package com.phillippitts.voiceinput.service.hotkey;

import java.util.Objects;

/**
 * Edge tracker turning raw press/release edges of a modifier and a trigger key into one
 * begin/end pair per dictation gesture.
 *
 * <p>State is two flags: modifier held and gesture active. The trigger pressed while the
 * modifier is held begins a gesture; releasing the trigger ends it exactly once whatever
 * the modifier is doing. Releasing the modifier never ends a gesture, and auto-repeat
 * presses are absorbed while a gesture is active.
 *
 * <p>Not thread-safe: owned by the router thread.
 */
public final class GestureTracker {

    public enum Intent { NONE, BEGIN, END, TOGGLE_TRANSLATE }

    private final String modifier;
    private final String trigger;
    private final String translateModifier;

    private boolean modifierHeld;
    private boolean translateHeld;
    private boolean active;

    /**
     * @param translateModifier modifier that turns a trigger press into a translate toggle;
     *                          null disables toggling
     */
    public GestureTracker(String modifier, String trigger, String translateModifier) {
        this.modifier = KeyNameMapper.normalizeModifier(Objects.requireNonNull(modifier, "modifier"));
        this.trigger = KeyNameMapper.normalizeKey(Objects.requireNonNull(trigger, "trigger"));
        this.translateModifier = translateModifier == null ? null : KeyNameMapper.normalizeModifier(translateModifier);
    }

    public Intent onEvent(NormalizedKeyEvent e) {
        return e.isPressed() ? onPressed(e) : onReleased(e);
    }

    private Intent onPressed(NormalizedKeyEvent e) {
        if (KeyNameMapper.matchesModifier(modifier, e.key())) {
            modifierHeld = true;
            return Intent.NONE;
        }
        if (translateModifier != null && KeyNameMapper.matchesModifier(translateModifier, e.key())) {
            translateHeld = true;
            return Intent.NONE;
        }
        if (!e.key().equals(trigger) || active) {
            return Intent.NONE;
        }
        boolean dictationModifier = modifierHeld || carries(e, modifier);
        boolean toggleModifier = translateModifier != null && (translateHeld || carries(e, translateModifier));
        if (toggleModifier && !dictationModifier) {
            return Intent.TOGGLE_TRANSLATE;
        }
        if (dictationModifier) {
            active = true;
            return Intent.BEGIN;
        }
        return Intent.NONE;
    }

    private Intent onReleased(NormalizedKeyEvent e) {
        if (KeyNameMapper.matchesModifier(modifier, e.key())) {
            modifierHeld = false;
            return Intent.NONE;
        }
        if (translateModifier != null && KeyNameMapper.matchesModifier(translateModifier, e.key())) {
            translateHeld = false;
            return Intent.NONE;
        }
        if (active && e.key().equals(trigger)) {
            active = false;
            return Intent.END;
        }
        return Intent.NONE;
    }

    private static boolean carries(NormalizedKeyEvent e, String configured) {
        return e.modifiers().contains(KeyNameMapper.genericModifier(configured));
    }

    public boolean isActive() {
        return active;
    }

    public String describe() {
        return modifier + "+" + trigger;
    }
}
