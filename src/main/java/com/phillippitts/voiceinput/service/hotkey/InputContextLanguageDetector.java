package com.phillippitts.voiceinput.service.hotkey;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.awt.AWTError;
import java.awt.im.InputContext;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Reads the locale of the active AWT input method. Falls back to the configured default
 * when no input context is available (headless, no display, unsupported platform).
 */
public class InputContextLanguageDetector implements LanguageDetector {

    private static final Logger LOG = LogManager.getLogger(InputContextLanguageDetector.class);

    private final String defaultLanguage;
    private final Supplier<Locale> localeSource;

    public InputContextLanguageDetector(String defaultLanguage) {
        this(defaultLanguage, InputContextLanguageDetector::inputMethodLocale);
    }

    // Package-private for tests
    InputContextLanguageDetector(String defaultLanguage, Supplier<Locale> localeSource) {
        this.defaultLanguage = Objects.requireNonNull(defaultLanguage, "defaultLanguage");
        this.localeSource = Objects.requireNonNull(localeSource, "localeSource");
    }

    @Override
    public String detect() {
        try {
            return toCode(localeSource.get());
        } catch (RuntimeException | AWTError e) {
            LOG.debug("Input locale unavailable ({}); using '{}'", e.toString(), defaultLanguage);
            return defaultLanguage;
        }
    }

    String toCode(Locale locale) {
        if (locale == null || locale.getLanguage().length() < 2) {
            return defaultLanguage;
        }
        return locale.getLanguage().substring(0, 2).toLowerCase(Locale.ROOT);
    }

    private static Locale inputMethodLocale() {
        InputContext context = InputContext.getInstance();
        return context == null ? null : context.getLocale();
    }
}
