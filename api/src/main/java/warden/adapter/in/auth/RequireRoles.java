package warden.adapter.in.auth;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the roles a caller must hold to reach a resource method.
 *
 * <p>All listed roles are required. With no roles, any authenticated caller is
 * admitted. A method-level annotation replaces a class-level one.
 *
 * @see RequireRolesFilter
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface RequireRoles {

    String[] value() default {};
}
