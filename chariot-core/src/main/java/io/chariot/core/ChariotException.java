package io.chariot.core;

public class ChariotException extends RuntimeException {

    public ChariotException(Throwable cause) {
        super(cause);
    }

    public ChariotException(String message, Throwable cause) {
        super(message, cause);
    }

    public ChariotException(String message) {
        super(message);
    }

}
