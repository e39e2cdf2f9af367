package com.phillippitts.voiceinput.config.typing;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties controlling how transcribed text reaches the focused application.
 *
 * Privacy defaults: clipboard restore enabled; INFO logs never include full text.
 */
@Validated
@ConfigurationProperties(prefix = "typing")
public class TypingProperties {

    /** If false, text is only announced, never pasted. */
    private final boolean enabled;

    /** Whether to restore prior clipboard contents after paste. */
    private final boolean restoreClipboard;

    /** Paste shortcut: os-default | META+V | CONTROL+V. */
    private final String pasteShortcut;

    /** Wait after placing text on the clipboard before sending the shortcut. */
    @Min(0)
    @Max(2000)
    private final int settleDelayMs;

    /** Wait after the shortcut before the prior clipboard is restored. */
    @Min(0)
    @Max(5000)
    private final int restoreDelayMs;

    @ConstructorBinding
    public TypingProperties(Boolean enabled,
                            Boolean restoreClipboard,
                            String pasteShortcut,
                            Integer settleDelayMs,
                            Integer restoreDelayMs) {
        this.enabled = enabled == null || enabled;
        this.restoreClipboard = restoreClipboard == null || restoreClipboard;
        this.pasteShortcut = (pasteShortcut == null || pasteShortcut.isBlank()) ? "os-default" : pasteShortcut;
        this.settleDelayMs = settleDelayMs == null ? 120 : settleDelayMs;
        this.restoreDelayMs = restoreDelayMs == null ? 350 : restoreDelayMs;
    }

    public boolean isEnabled() { return enabled; }
    public boolean isRestoreClipboard() { return restoreClipboard; }
    public String getPasteShortcut() { return pasteShortcut; }
    public int getSettleDelayMs() { return settleDelayMs; }
    public int getRestoreDelayMs() { return restoreDelayMs; }
}
