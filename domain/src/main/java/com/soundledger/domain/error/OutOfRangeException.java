package com.soundledger.domain.error;

/**
 * A share fraction or balance outside its permitted range. Raised at the point of mutation,
 * always correctable by the caller.
 */
public final class OutOfRangeException extends IllegalArgumentException {
    public OutOfRangeException(String message) {
        super(message);
    }
}
