package se.kth.castor.scopemock;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method, or every method of a type, as overridable by the scopemock agent. Annotated
 * methods consult their slot in the global {@link MockRegistry} before running their body.
 * <p>
 * Abstract, native, synthetic and bridge methods as well as constructors are never rewritten.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface Mockable {

}
