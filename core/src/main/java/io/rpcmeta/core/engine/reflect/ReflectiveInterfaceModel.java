package io.rpcmeta.core.engine.reflect;

import io.rpcmeta.core.annotation.Contextual;
import io.rpcmeta.core.annotation.WhenAbsent;
import io.rpcmeta.core.config.DerivationConfig;
import io.rpcmeta.core.model.ParamFlags;
import io.rpcmeta.core.model.RealInterface;
import io.rpcmeta.core.model.RealMethod;
import io.rpcmeta.core.model.RealParam;
import io.rpcmeta.core.spi.InterfaceModel;
import java.lang.annotation.Annotation;
import java.lang.annotation.Repeatable;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link InterfaceModel} backed by Java reflection.
 *
 * <p>
 * Methods are the abstract methods of the interface: its own in declaration
 * order, followed by those inherited from superinterfaces and not redeclared.
 * Overriding is decided on erased signatures after substituting the type
 * arguments the interface passes to its superinterfaces, so {@code put(String)}
 * in {@code StringStore extends Store<String>} overrides {@code Store.put(T)}.
 * A method lists every superinterface method it overrides, and each of its
 * parameters the parameter at the same index of those methods, so annotations
 * on supertypes are inherited. A method inherited from several superinterfaces
 * without being redeclared is described once, overriding all of them.
 *
 * <p>
 * Static methods, synthetic methods and redeclarations of {@code Object}
 * methods are skipped; default methods are skipped unless configured otherwise.
 * Repeated annotations are unwrapped from their container. Parameter names need
 * the interface compiled with {@code -parameters}.
 *
 * <p>
 * Descriptions are cached; thread-safe.
 */
public final class ReflectiveInterfaceModel implements InterfaceModel {

    private static final Logger LOG = LoggerFactory.getLogger(ReflectiveInterfaceModel.class);

    private final boolean includeDefaultMethods;
    private final Map<Class<?>, RealInterface> cache = new ConcurrentHashMap<>();

    public ReflectiveInterfaceModel() {
        this(DerivationConfig.DEFAULT);
    }

    /** Only {@link DerivationConfig#includeDefaultMethods()} applies here. */
    public ReflectiveInterfaceModel(DerivationConfig config) {
        this.includeDefaultMethods = config.includeDefaultMethods();
    }

    @Override
    public RealInterface describe(Class<?> iface) {
        if (!iface.isInterface() || iface.isAnnotation()) {
            throw new IllegalArgumentException(iface.getName() + " is not an interface");
        }
        RealInterface cached = cache.get(iface);
        if (cached != null) {
            return cached;
        }
        RealInterface described = build(iface);
        RealInterface previous = cache.putIfAbsent(iface, described);
        return previous != null ? previous : described;
    }

    private RealInterface build(Class<?> iface) {
        List<RealInterface> supertypes = new ArrayList<>();
        for (Class<?> supertype : iface.getInterfaces()) {
            supertypes.add(describe(supertype));
        }
        TypeBindings bindings = TypeBindings.of(iface);

        Map<String, List<RealMethod>> inherited = new LinkedHashMap<>();
        supertypes.stream()
                .flatMap(s -> s.methods().stream())
                .distinct()
                .forEach(m -> inherited
                        .computeIfAbsent(signature(m, bindings), k -> new ArrayList<>())
                        .add(m));
        inherited.replaceAll((signature, group) -> mostSpecific(group));

        Map<String, RealMethod> methods = new LinkedHashMap<>();
        for (Method method : DeclarationOrder.sort(iface, iface.getDeclaredMethods())) {
            if (isDescribed(method)) {
                String signature = signature(method);
                methods.put(signature, method(iface, method, inherited.getOrDefault(signature, List.of())));
            }
        }
        inherited.forEach((signature, group) -> {
            if (!methods.containsKey(signature)) {
                methods.put(signature, group.size() == 1 ? group.get(0) : merged(iface, group, bindings));
            }
        });

        LOG.debug("Described interface {}: {} method(s)", iface.getName(), methods.size());
        return new RealInterface(
                iface.getSimpleName(),
                iface,
                expandRepeated(iface.getDeclaredAnnotations()),
                supertypes,
                new ArrayList<>(methods.values()),
                iface.getName());
    }

    private boolean isDescribed(Method method) {
        int modifiers = method.getModifiers();
        if (Modifier.isStatic(modifiers) || method.isSynthetic() || method.isBridge()) {
            return false;
        }
        if (method.isDefault() && !includeDefaultMethods) {
            return false;
        }
        return !redeclaresObjectMethod(method);
    }

    private static boolean redeclaresObjectMethod(Method method) {
        try {
            Object.class.getMethod(method.getName(), method.getParameterTypes());
            return true;
        } catch (NoSuchMethodException e) {
            return false;
        }
    }

    private static RealMethod method(Class<?> iface, Method method, List<RealMethod> overridden) {
        String source = source(iface, method.getName(), Arrays.asList(method.getParameterTypes()));
        Parameter[] parameters = method.getParameters();
        List<RealParam> params = new ArrayList<>();
        for (int i = 0; i < parameters.length; i++) {
            Parameter parameter = parameters[i];
            params.add(new RealParam(
                    parameter.getName(),
                    parameter.getParameterizedType(),
                    i,
                    0,
                    i,
                    flags(method, parameter, i == parameters.length - 1),
                    expandRepeated(parameter.getAnnotations()),
                    overriddenParams(overridden, i),
                    source + " parameter " + parameter.getName()));
        }
        return new RealMethod(
                method.getName(),
                method.getGenericReturnType(),
                expandRepeated(method.getDeclaredAnnotations()),
                List.of(params),
                overridden,
                source);
    }

    /**
     * One method standing for several superinterface methods with the same
     * signature. It declares nothing itself and overrides all of them.
     */
    private static RealMethod merged(Class<?> iface, List<RealMethod> group, TypeBindings bindings) {
        RealMethod primary = group.get(0);
        for (RealMethod candidate : group) {
            Class<?> result = bindings.erase(candidate.resultType());
            if (group.stream().allMatch(m -> bindings.erase(m.resultType()).isAssignableFrom(result))) {
                primary = candidate;
                break;
            }
        }
        List<Class<?>> erased = primary.parameters().stream()
                .map(p -> bindings.erase(p.type()))
                .collect(Collectors.toList());
        String source = source(iface, primary.name(), erased);
        List<RealParam> params = new ArrayList<>();
        for (RealParam param : primary.parameters()) {
            params.add(new RealParam(
                    param.name(),
                    bindings.resolve(param.type()),
                    param.index(),
                    param.indexOfGroup(),
                    param.indexInGroup(),
                    param.flags(),
                    List.of(),
                    overriddenParams(group, param.index()),
                    source + " parameter " + param.name()));
        }
        return new RealMethod(
                primary.name(),
                bindings.resolve(primary.resultType()),
                List.of(),
                List.of(params),
                group,
                source);
    }

    private static List<RealParam> overriddenParams(List<RealMethod> overridden, int index) {
        return overridden.stream()
                .map(RealMethod::parameters)
                .filter(ps -> ps.size() > index)
                .map(ps -> ps.get(index))
                .toList();
    }

    /** Drops methods already overridden by another method of the group. */
    private static List<RealMethod> mostSpecific(List<RealMethod> group) {
        if (group.size() == 1) {
            return group;
        }
        Set<RealMethod> shadowed = Collections.newSetFromMap(new IdentityHashMap<>());
        for (RealMethod method : group) {
            Deque<RealMethod> queue = new ArrayDeque<>(method.overridden());
            while (!queue.isEmpty()) {
                RealMethod ancestor = queue.poll();
                if (shadowed.add(ancestor)) {
                    queue.addAll(ancestor.overridden());
                }
            }
        }
        return group.stream().filter(m -> !shadowed.contains(m)).toList();
    }

    private static ParamFlags flags(Method method, Parameter parameter, boolean last) {
        Class<?> type = parameter.getType();
        return ParamFlags.of(
                type.isAnnotationPresent(Contextual.class),
                type == Supplier.class,
                method.isVarArgs() && last,
                parameter.isAnnotationPresent(WhenAbsent.class),
                parameter.isSynthetic() || parameter.isImplicit());
    }

    /**
     * Annotations in declaration order, with repeated ones taken out of their
     * container.
     */
    private static List<Annotation> expandRepeated(Annotation[] declared) {
        List<Annotation> result = new ArrayList<>(declared.length);
        for (Annotation annotation : declared) {
            Annotation[] repeated = repeated(annotation);
            if (repeated != null) {
                result.addAll(Arrays.asList(repeated));
            } else {
                result.add(annotation);
            }
        }
        return result;
    }

    private static Annotation[] repeated(Annotation container) {
        Method value;
        try {
            value = container.annotationType().getDeclaredMethod("value");
        } catch (NoSuchMethodException e) {
            return null;
        }
        Class<?> returnType = value.getReturnType();
        if (!returnType.isArray() || !returnType.getComponentType().isAnnotation()) {
            return null;
        }
        Repeatable repeatable = returnType.getComponentType().getAnnotation(Repeatable.class);
        if (repeatable == null || repeatable.value() != container.annotationType()) {
            return null;
        }
        try {
            value.setAccessible(true);
            return (Annotation[]) value.invoke(container);
        } catch (ReflectiveOperationException | RuntimeException e) {
            throw new IllegalStateException("cannot read repeated annotations of " + container, e);
        }
    }

    private static String source(Class<?> iface, String name, List<Class<?>> parameterTypes) {
        return iface.getName() + "#" + name + "("
                + parameterTypes.stream().map(Class::getSimpleName).collect(Collectors.joining(", "))
                + ")";
    }

    private static String signature(Method method) {
        return method.getName()
                + Arrays.stream(method.getParameterTypes())
                        .map(Class::getName)
                        .collect(Collectors.joining(",", "(", ")"));
    }

    /**
     * Erased signature of a superinterface method as seen from the interface
     * being described.
     */
    private static String signature(RealMethod method, TypeBindings bindings) {
        return method.name()
                + method.parameters().stream()
                        .map(p -> bindings.erase(p.type()).getName())
                        .collect(Collectors.joining(",", "(", ")"));
    }
}
