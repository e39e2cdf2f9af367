package com.phillippitts.voiceinput.service.hotkey;

/** Resolves the language the user is currently typing in, as a two-letter code. */
@FunctionalInterface
public interface LanguageDetector {

    String detect();
}
