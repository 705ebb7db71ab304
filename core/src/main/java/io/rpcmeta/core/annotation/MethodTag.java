package io.rpcmeta.core.annotation;

import java.lang.annotation.Annotation;
import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Configures method tagging for an interface-scope schema.
 *
 * <p>
 * {@link #base()} is the root of the tag family recognized on real methods;
 * {@link #defaultTag()} is assumed for real methods that carry no tag of that
 * family. Schema parameters without {@link Tagged} accept any method whose
 * effective tag refines {@code base}.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.PARAMETER})
public @interface MethodTag {

    Class<? extends Annotation> base();

    /**
     * Tag assumed for untagged methods. {@code RpcTag.class} itself means "no
     * default".
     */
    Class<? extends Annotation> defaultTag() default RpcTag.class;
}
