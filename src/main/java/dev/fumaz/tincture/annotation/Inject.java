package dev.fumaz.tincture.annotation;

import java.lang.annotation.*;

/**
 * Marks the constructor the container should use, or a constructor parameter that may be left unresolved.
 */
@Target({ElementType.CONSTRUCTOR, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Inject {
    boolean optional() default false;
}
