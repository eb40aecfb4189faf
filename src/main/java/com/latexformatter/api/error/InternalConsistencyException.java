package com.latexformatter.api.error;

/**
 * A placeholder token could not be restored after the pass pipeline ran. This always
 * means a formatting pass touched protected text; it is a defect in the formatter and
 * never a problem with the user's input.
 */
public class InternalConsistencyException extends RuntimeException {
    private final String token;

    public InternalConsistencyException(String message, String token) {
        super(message);
        this.token = token;
    }

    public String getToken() {
        return token;
    }
}
