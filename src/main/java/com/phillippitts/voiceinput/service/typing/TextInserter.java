package com.phillippitts.voiceinput.service.typing;

/** Strategy for delivering text to the focused application. */
interface TextInserter {

    /** @return true if the strategy works in the current environment */
    boolean canInsert();

    /** @return true on success */
    boolean insert(String text);

    /** Name for logs. */
    String name();
}
