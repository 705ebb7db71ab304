package io.rpcmeta.core.annotation;

import java.lang.annotation.Annotation;
import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Meta-annotation that turns an annotation type into a tag. Tags classify real
 * methods and parameters so that schema parameters can restrict (see
 * {@link Tagged}) or default (see {@link MethodTag}, {@link ParamTag}) which
 * declarations they match.
 *
 * <p>
 * Tags form a hierarchy through {@link #parent()}:
 *
 * <pre>{@code
 * @RpcTag
 * @Retention(RUNTIME)
 * public @interface RestMethod {}
 *
 * @RpcTag(parent = RestMethod.class)
 * @Retention(RUNTIME)
 * public @interface GET {}
 * }</pre>
 *
 * <p>
 * Here {@code GET} refines {@code RestMethod}: a schema parameter tagged
 * {@code RestMethod} accepts methods annotated {@code @GET}.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.ANNOTATION_TYPE)
public @interface RpcTag {

    /**
     * The tag this tag refines. {@code RpcTag.class} itself means "no parent".
     */
    Class<? extends Annotation> parent() default RpcTag.class;
}
