package io.rpcmeta.core.annotation;

import java.lang.annotation.Annotation;
import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Configures parameter tagging. May be placed on an interface-scope schema
 * (applies to every method), on a per-method schema parameter, or on a
 * method-scope schema class; the closest one wins. See {@link MethodTag} for
 * the meaning of {@code base} and {@code defaultTag}.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.PARAMETER})
public @interface ParamTag {

    Class<? extends Annotation> base();

    /**
     * Tag assumed for untagged parameters. {@code RpcTag.class} itself means
     * "no default".
     */
    Class<? extends Annotation> defaultTag() default RpcTag.class;
}
