package com.chemked.data.lookup;

/** The registry could not be reached or answered with something other than found/not found. */
public final class LookupUnavailableException extends Exception {

    public LookupUnavailableException(String message) {
        super(message);
    }

    public LookupUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
