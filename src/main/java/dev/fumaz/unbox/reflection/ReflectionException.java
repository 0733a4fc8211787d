package dev.fumaz.unbox.reflection;

import dev.fumaz.unbox.exception.UnboxException;

public class ReflectionException extends UnboxException {

    public ReflectionException(String message) {
        super(message);
    }

    public ReflectionException(String message, Throwable cause) {
        super(message, cause);
    }

}
