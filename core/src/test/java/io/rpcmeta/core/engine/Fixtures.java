package io.rpcmeta.core.engine;

import io.rpcmeta.core.annotation.Auxiliary;
import io.rpcmeta.core.annotation.Checked;
import io.rpcmeta.core.annotation.Composite;
import io.rpcmeta.core.annotation.HasAnnot;
import io.rpcmeta.core.annotation.Infer;
import io.rpcmeta.core.annotation.MethodTag;
import io.rpcmeta.core.annotation.Multi;
import io.rpcmeta.core.annotation.ReifyAnnot;
import io.rpcmeta.core.annotation.ReifyFlags;
import io.rpcmeta.core.annotation.ReifyName;
import io.rpcmeta.core.annotation.ReifyPosition;
import io.rpcmeta.core.annotation.RpcName;
import io.rpcmeta.core.annotation.RpcTag;
import io.rpcmeta.core.annotation.Tagged;
import io.rpcmeta.core.annotation.ZeroOrOne;
import io.rpcmeta.core.model.ParamFlags;
import io.rpcmeta.core.model.ParamPosition;
import io.rpcmeta.core.model.TypedMetadata;
import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Schemas, tags and interfaces shared by the engine tests. */
final class Fixtures {

    private Fixtures() {}

    // --- Tags ---

    @RpcTag
    @Retention(RetentionPolicy.RUNTIME)
    @Target({ElementType.METHOD, ElementType.PARAMETER})
    @interface Verb {}

    @RpcTag(parent = Verb.class)
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.METHOD)
    @interface GET {}

    @RpcTag(parent = Verb.class)
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.METHOD)
    @interface POST {}

    @RpcTag(parent = GET.class)
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.METHOD)
    @interface CachedGET {}

    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.METHOD)
    @Repeatable(Notes.class)
    @interface Note {
        String value();
    }

    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.METHOD)
    @interface Notes {
        Note[] value();
    }

    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.METHOD)
    @interface Doc {
        String value();
    }

    // --- Schemas ---

    record ParamMeta(
            @ReifyName String name, @ReifyPosition ParamPosition position, @ReifyFlags ParamFlags flags) {}

    record CallMeta(@ReifyName(rpcName = true) String name, @Multi Map<String, ParamMeta> params) {}

    record ApiMeta(@ReifyName String name, @Multi Map<String, CallMeta> calls) {}

    record MethodInfo(@ReifyName String name, @ReifyName(rpcName = true) String rpcName) {}

    @MethodTag(base = Verb.class, defaultTag = POST.class)
    record RestMeta(
            @Tagged(GET.class) MethodInfo getter, @Tagged(POST.class) @Multi Map<String, MethodInfo> posts) {}

    @MethodTag(base = Verb.class, defaultTag = GET.class)
    record GetByDefault(
            @Tagged(GET.class) @ZeroOrOne Optional<MethodInfo> getter,
            @Tagged(POST.class) @ZeroOrOne Optional<MethodInfo> poster) {}

    @MethodTag(base = Verb.class, defaultTag = POST.class)
    record PostByDefault(
            @Tagged(GET.class) @ZeroOrOne Optional<MethodInfo> getter,
            @Tagged(POST.class) @ZeroOrOne Optional<MethodInfo> poster) {}

    @MethodTag(base = Verb.class)
    record TwoGetters(@Tagged(GET.class) MethodInfo getter, @Tagged(POST.class) MethodInfo poster) {}

    @MethodTag(base = Verb.class)
    record AuxiliaryMeta(
            @Tagged(GET.class) MethodInfo getter, @Auxiliary @Multi Map<String, MethodInfo> everything) {}

    @MethodTag(base = Verb.class)
    record GettersOnly(@Tagged(GET.class) @Multi Map<String, MethodInfo> getters) {}

    record PositionsApi(@Multi Map<String, PositionsCall> calls) {}

    record PositionsCall(@Multi List<ParamMeta> params) {}

    record OneArgCall(@ReifyName String name, ParamMeta arg) {}

    record OneArgApi(@Multi Map<String, OneArgCall> calls) {}

    record DocMeta(
            @ReifyName String name,
            @ReifyAnnot @ZeroOrOne Optional<Doc> doc,
            @HasAnnot(GET.class) boolean get,
            @HasAnnot(Verb.class) boolean anyVerb) {}

    record DocApi(@Multi Map<String, DocMeta> calls) {}

    record AllDocs(@ReifyName String name, @ReifyAnnot @Multi List<Doc> docs) {}

    record AllDocsApi(@Multi Map<String, AllDocs> calls) {}

    record OneDoc(@ReifyAnnot Doc doc) {}

    record OneDocApi(@Multi Map<String, OneDoc> calls) {}

    record StringResult(@ReifyName String name) implements TypedMetadata<String> {}

    record OnlyStrings(@Multi Map<String, StringResult> strings) {}

    record StringsFirst(@Multi Map<String, StringResult> strings, @Multi Map<String, MethodInfo> others) {}

    record NeedsClock(@Infer @Checked Clock clock, @ReifyName String name) {}

    record Steering(@Multi Map<String, NeedsClock> clocked, @Multi Map<String, MethodInfo> plain) {}

    record LazyClock(@Infer Clock clock) {}

    record StrictClock(@Infer @Checked Clock clock) {}

    record Described(@ReifyName String name, @Composite Summary summary) {}

    record Summary(@ReifyName(rpcName = true) String rpcName, @Multi Map<String, MethodInfo> calls) {}

    record NotedCall(
            @ReifyName String name, @ReifyAnnot @Multi List<Note> notes, @HasAnnot(Note.class) boolean noted) {}

    record NotedApi(@Multi Map<String, NotedCall> calls) {}

    // --- Interfaces ---

    interface UserApi {
        @GET
        String find(String id);

        void create(String name, int age);

        @RpcName("remove")
        void delete(String id);
    }

    interface OneGet {
        @GET
        String find();

        void save();

        void delete();
    }

    interface NoGet {
        void save();
    }

    interface TwoGets {
        @GET
        String first();

        @CachedGET
        String second();
    }

    interface DuplicateGetApi {
        String get(String id);

        @RpcName("get")
        String fetch(String id);
    }

    interface Untagged {
        void ping();
    }

    interface PostOnly {
        @POST
        void save(String value);
    }

    interface GetAndPost {
        @GET
        String read();

        @POST
        void write(String value);
    }

    interface Mixed {
        void ok(String a);

        void none();

        void two(String a, String b);
    }

    interface Documented {
        @Doc("finds")
        @GET
        String find();

        void other();
    }

    interface DocumentedBase {
        @Doc("base")
        String find();
    }

    interface DocumentedDerived extends DocumentedBase {
        @Doc("derived")
        @Override
        String find();
    }

    interface Typed {
        String text();

        int count();
    }

    interface Empty {}

    interface Store<T> {
        @Note("stored")
        void put(T value);
    }

    interface StringStore extends Store<String> {
        @Override
        void put(String value);
    }

    interface Reader {
        String read();
    }

    interface NotedReader {
        @Note("cached")
        String read();
    }

    interface BothReaders extends Reader, NotedReader {}

    interface MultiNoted {
        @Note("a")
        @Note("b")
        void call();

        void plain();
    }

    interface WithDefault {
        void call();

        default void helper() {}
    }
}
