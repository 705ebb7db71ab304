package io.rpcmeta.core.annotation;

import java.lang.annotation.Annotation;
import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Restricts a member-matching schema parameter to real declarations whose
 * effective tag is the given tag or a refinement of it. The value must be an
 * annotation type meta-annotated with {@link RpcTag}.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface Tagged {

    Class<? extends Annotation> value();
}
