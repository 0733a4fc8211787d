package dev.fumaz.unbox.annotation;

import java.lang.annotation.*;

/**
 * Overrides the name a parameter is resolved by.
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Named {
    String value();
}
