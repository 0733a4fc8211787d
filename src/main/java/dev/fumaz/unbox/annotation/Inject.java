package dev.fumaz.unbox.annotation;

import java.lang.annotation.*;

/**
 * Marks the constructor used by {@code create}, or a parameter that may fall back to its default value.
 */
@Target({ElementType.CONSTRUCTOR, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Inject {
    boolean optional() default false;
}
