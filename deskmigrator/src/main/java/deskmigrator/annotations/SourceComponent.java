package deskmigrator.annotations;

import java.lang.annotation.*;

/**
 * Marks a class as the source adapter for one or more components.
 *
 * <p>The annotated class must implement {@link deskmigrator.adapter.SourceAdapter}
 * and have a no-arg constructor. With no component names, the class becomes
 * the default source adapter, used for every component without a dedicated one.
 *
 * <h2>Example:</h2>
 * <pre>
 * {@literal @}SourceComponent({"groups", "macros"})
 * public class HelpdeskApiSource implements SourceAdapter {
 *     public List&lt;MigrationRecord&gt; fetch(String component, SourceSpec source) { ... }
 * }
 * </pre>
 *
 * @see deskmigrator.scanner.AdapterScanner
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface SourceComponent {

    /** Component names served by the adapter; empty for the default adapter. */
    String[] value() default {};
}
