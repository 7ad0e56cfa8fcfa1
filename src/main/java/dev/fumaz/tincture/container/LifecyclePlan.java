package dev.fumaz.tincture.container;

import dev.fumaz.tincture.annotation.PostConstruct;
import dev.fumaz.tincture.annotation.PreDestroy;
import dev.fumaz.tincture.exception.ConfigurationException;
import org.jetbrains.annotations.NotNull;

import java.lang.annotation.Annotation;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.ToIntFunction;

/**
 * The {@link PostConstruct} and {@link PreDestroy} methods of a class, ordered by priority.
 */
final class LifecyclePlan {

    private static final ClassValue<LifecyclePlan> PLANS = new ClassValue<>() {
        @Override
        protected LifecyclePlan computeValue(Class<?> type) {
            return new LifecyclePlan(type);
        }
    };

    private final List<Method> postConstructMethods;
    private final List<Method> preDestroyMethods;

    private LifecyclePlan(Class<?> type) {
        this.postConstructMethods = collect(type, PostConstruct.class, PostConstruct::priority);
        this.preDestroyMethods = collect(type, PreDestroy.class, PreDestroy::priority);
    }

    static @NotNull LifecyclePlan of(@NotNull Class<?> type) {
        return PLANS.get(type);
    }

    boolean hasPreDestroy() {
        return !preDestroyMethods.isEmpty();
    }

    void postConstruct(@NotNull Object instance) throws Throwable {
        invokeAll(postConstructMethods, instance);
    }

    void preDestroy(@NotNull Object instance) throws Throwable {
        invokeAll(preDestroyMethods, instance);
    }

    private static void invokeAll(List<Method> methods, Object instance) throws Throwable {
        for (Method method : methods) {
            try {
                method.invoke(instance);
            } catch (InvocationTargetException e) {
                throw e.getTargetException() != null ? e.getTargetException() : e;
            }
        }
    }

    private static <A extends Annotation> List<Method> collect(Class<?> type,
                                                               Class<A> annotation,
                                                               ToIntFunction<A> priority) {
        List<Method> methods = new ArrayList<>();
        Set<String> overridden = new HashSet<>();

        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            Method[] declared = current.getDeclaredMethods();

            for (Method method : declared) {
                if (!method.isAnnotationPresent(annotation) || isOverridden(method, overridden)) {
                    continue;
                }

                if (method.getParameterCount() != 0 || Modifier.isStatic(method.getModifiers())) {
                    throw new ConfigurationException("@" + annotation.getSimpleName() + " method "
                            + method.toGenericString() + " must be an instance method without parameters");
                }

                method.setAccessible(true);
                methods.add(method);
            }

            for (Method method : declared) {
                if (overridable(method)) {
                    overridden.add(method.getName());
                }
            }
        }

        if (methods.isEmpty()) {
            return Collections.emptyList();
        }

        methods.sort(Comparator.comparingInt(method -> priority.applyAsInt(method.getAnnotation(annotation))));
        return Collections.unmodifiableList(methods);
    }

    private static boolean isOverridden(Method method, Set<String> overridden) {
        return overridable(method) && overridden.contains(method.getName());
    }

    // lifecycle methods take no parameters, so the name identifies the override
    private static boolean overridable(Method method) {
        int modifiers = method.getModifiers();
        return method.getParameterCount() == 0 && !Modifier.isPrivate(modifiers) && !Modifier.isStatic(modifiers)
                && !method.isBridge() && !method.isSynthetic();
    }
}
