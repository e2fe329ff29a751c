package com.tangle.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as a statement-ordering valuer that can be registered and looked up by name.
 * Use with a valuer registry to register; the class must implement the valuer contract.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface TangleValuer {

    /** Unique valuer name (used on the command line and in the registry), e.g. "wrange". */
    String name();

    /** One-line description shown when listing valuers. */
    String description() default "";

    /** True if the valuer draws from a random source, so repeated scoring of one order may differ. */
    boolean randomized() default false;
}
