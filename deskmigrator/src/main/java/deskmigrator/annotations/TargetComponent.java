package deskmigrator.annotations;

import java.lang.annotation.*;

/**
 * Marks a class as the target adapter for one or more components.
 *
 * <p>The annotated class must implement {@link deskmigrator.adapter.TargetAdapter}
 * and have a no-arg constructor. With no component names, the class becomes
 * the default target adapter.
 *
 * @see SourceComponent
 * @see deskmigrator.scanner.AdapterScanner
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface TargetComponent {

    /** Component names served by the adapter; empty for the default adapter. */
    String[] value() default {};
}
