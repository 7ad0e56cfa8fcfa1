package dev.fumaz.tincture.annotation;

import java.lang.annotation.*;

/**
 * Overrides the name a constructor parameter is matched against when fixed parameters are applied.
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Named {
    String value();
}
