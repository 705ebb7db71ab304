package io.rpcmeta.core.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Gives a real interface, method or parameter an externally-facing name that
 * differs from its Java identifier. Typically used to disambiguate overloaded
 * methods, which would otherwise collide in name-keyed metadata.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.PARAMETER})
public @interface RpcName {

    /** The externally-facing name. */
    String value();
}
