package io.rpcmeta.core.engine;

import java.lang.annotation.Annotation;

/**
 * Tag family of one kind of member (methods or parameters) as configured by
 * {@code @MethodTag} or {@code @ParamTag}.
 *
 * @param base       root of the recognized tag family, or {@code null} for any
 *                   tag
 * @param defaultTag tag assumed for members without one, or {@code null} for
 *                   none
 */
public record TagConfig(Class<? extends Annotation> base, Class<? extends Annotation> defaultTag) {

    /**
     * No tag family configured: untagged schema parameters accept every member.
     */
    public static final TagConfig NONE = new TagConfig(null, null);
}
