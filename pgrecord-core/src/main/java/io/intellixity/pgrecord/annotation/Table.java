package io.intellixity.pgrecord.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Overrides the table a record type maps to.
 *
 * <p>Defaults to the record's simple class name. A dotted value ({@code "sales.products"})
 * is quoted per segment.</p>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface Table {
  String value();
}
