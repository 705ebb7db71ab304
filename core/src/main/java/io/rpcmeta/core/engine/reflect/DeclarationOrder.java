package io.rpcmeta.core.engine.reflect;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recovers source declaration order of methods, which
 * {@link Class#getDeclaredMethods()} does not guarantee. The order is read from
 * the method table of the class file; when the class file is not available the
 * methods are sorted by name and descriptor so the result is still stable.
 */
final class DeclarationOrder {

    private static final Logger LOG = LoggerFactory.getLogger(DeclarationOrder.class);

    private DeclarationOrder() {}

    static List<Method> sort(Class<?> owner, Method[] methods) {
        List<Method> sorted = new ArrayList<>(Arrays.asList(methods));
        Map<String, Integer> order = readOrder(owner);
        Comparator<Method> bySignature = Comparator.comparing(DeclarationOrder::key);
        if (order.isEmpty()) {
            sorted.sort(bySignature);
        } else {
            sorted.sort(Comparator.<Method>comparingInt(m -> order.getOrDefault(key(m), Integer.MAX_VALUE))
                    .thenComparing(bySignature));
        }
        return sorted;
    }

    private static String key(Method method) {
        return method.getName() + Type.getMethodDescriptor(method);
    }

    private static Map<String, Integer> readOrder(Class<?> owner) {
        String resource = owner.getName().replace('.', '/') + ".class";
        ClassLoader loader = owner.getClassLoader();
        try (InputStream in = loader != null
                ? loader.getResourceAsStream(resource)
                : ClassLoader.getSystemResourceAsStream(resource)) {
            if (in == null) {
                LOG.debug("Class file of {} not found, ordering methods by signature", owner.getName());
                return Map.of();
            }
            Map<String, Integer> order = new HashMap<>();
            new ClassReader(in)
                    .accept(
                            new ClassVisitor(Opcodes.ASM9) {
                                @Override
                                public MethodVisitor visitMethod(
                                        int access, String name, String descriptor, String signature, String[] exceptions) {
                                    order.putIfAbsent(name + descriptor, order.size());
                                    return null;
                                }
                            },
                            ClassReader.SKIP_CODE | ClassReader.SKIP_DEBUG | ClassReader.SKIP_FRAMES);
            return order;
        } catch (IOException | RuntimeException e) {
            LOG.debug("Cannot read class file of {}, ordering methods by signature: {}", owner.getName(), e.toString());
            return Map.of();
        }
    }
}
