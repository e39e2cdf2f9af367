/**
 * whisper.cpp command-line integration: process management, command building and
 * output parsing (plain text or JSON).
 */
package com.phillippitts.voiceinput.service.stt.whisper;
