package com.rms.relay.core.error;

/**
 * A desired-state entry is missing a required field or carries an
 * unparseable relay mode.
 */
public class MalformedDesiredStateException extends RelayException {

    private final String entryKey;

    public MalformedDesiredStateException(String entryKey, String message) {
        super("Desired-state entry '" + entryKey + "': " + message);
        this.entryKey = entryKey;
    }

    public String entryKey() {
        return entryKey;
    }
}
