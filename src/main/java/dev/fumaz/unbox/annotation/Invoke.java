package dev.fumaz.unbox.annotation;

import java.lang.annotation.*;

/**
 * Marks the method invoked when an object is passed to {@code call} on its own.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Invoke {
}
