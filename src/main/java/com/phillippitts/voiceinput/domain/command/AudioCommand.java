package com.phillippitts.voiceinput.domain.command;

/** Commands accepted by the audio worker. */
public interface AudioCommand {

    record Start() implements AudioCommand {}

    record Stop() implements AudioCommand {}

    record Shutdown() implements AudioCommand {}
}
