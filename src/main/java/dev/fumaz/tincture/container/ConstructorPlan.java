package dev.fumaz.tincture.container;

import dev.fumaz.tincture.annotation.Inject;
import dev.fumaz.tincture.annotation.Named;
import dev.fumaz.tincture.exception.ConfigurationException;
import dev.fumaz.tincture.exception.ConstructionFailedException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * The constructor the container uses for a concrete type, with one slot per parameter describing where its
 * argument comes from.
 */
final class ConstructorPlan {

    private static final MethodHandles.Lookup LOOKUP = MethodHandles.lookup();
    private static final Object[] NO_ARGUMENTS = new Object[0];

    private final @NotNull Class<?> type;
    private final @NotNull Constructor<?> constructor;
    private final @NotNull ParameterSlot[] slots;
    private final @NotNull Set<String> parameterNames;
    private final @NotNull MethodHandle invoker;

    ConstructorPlan(@NotNull Class<?> type) {
        ensureInstantiable(type);

        this.type = type;
        this.constructor = select(type);

        Parameter[] parameters = constructor.getParameters();
        Set<String> names = new LinkedHashSet<>();
        this.slots = new ParameterSlot[parameters.length];

        for (int i = 0; i < parameters.length; i++) {
            ParameterSlot slot = new ParameterSlot(parameters[i], type);

            if (!names.add(slot.name)) {
                throw new ConfigurationException("Constructor " + constructor.toGenericString()
                        + " declares parameter name '" + slot.name + "' more than once");
            }

            slots[i] = slot;
        }

        this.parameterNames = Collections.unmodifiableSet(names);
        this.invoker = createInvoker(constructor);
    }

    /**
     * Resolves one argument per constructor parameter. Fixed parameters take precedence over registered
     * capabilities, which take precedence over the built-in container and logger arguments.
     */
    @NotNull Object[] resolveArguments(@NotNull DefaultContainer container,
                                       @NotNull Class<?> capability,
                                       @NotNull Map<String, ?> fixedParameters) {
        for (String name : fixedParameters.keySet()) {
            if (!parameterNames.contains(name)) {
                throw new ConstructionFailedException(capability, "Fixed parameter '" + name
                        + "' does not match any parameter of " + constructor.toGenericString(), null);
            }
        }

        if (slots.length == 0) {
            return NO_ARGUMENTS;
        }

        Object[] arguments = new Object[slots.length];

        for (int i = 0; i < slots.length; i++) {
            arguments[i] = slots[i].resolve(container, capability, fixedParameters);
        }

        return arguments;
    }

    @NotNull Object instantiate(@NotNull Object[] arguments) throws Throwable {
        return invoker.invoke(arguments);
    }

    private static void ensureInstantiable(Class<?> type) {
        if (type.isInterface() || type.isPrimitive() || type.isArray() || Modifier.isAbstract(type.getModifiers())) {
            throw new ConfigurationException("Cannot construct " + type.getName() + ": type is not instantiable");
        }

        if (type.isMemberClass() && !Modifier.isStatic(type.getModifiers())) {
            throw new ConfigurationException("Cannot construct inner class " + type.getName()
                    + " without an enclosing instance; declare it static");
        }
    }

    private static Constructor<?> select(Class<?> type) {
        Constructor<?>[] declared = type.getDeclaredConstructors();
        Constructor<?> injectable = null;
        Constructor<?> noArguments = null;

        for (Constructor<?> candidate : declared) {
            if (candidate.isAnnotationPresent(Inject.class)) {
                if (injectable != null) {
                    throw new ConfigurationException("Multiple @Inject constructors found for type " + type.getName());
                }

                injectable = candidate;
            }

            if (candidate.getParameterCount() == 0) {
                noArguments = candidate;
            }
        }

        if (injectable != null) {
            return injectable;
        }

        if (declared.length == 1) {
            return declared[0];
        }

        if (noArguments != null) {
            return noArguments;
        }

        throw new ConfigurationException("No suitable constructor found for " + type.getName()
                + "; annotate one with @Inject");
    }

    private static MethodHandle createInvoker(Constructor<?> constructor) {
        constructor.setAccessible(true);

        try {
            MethodHandle handle = LOOKUP.unreflectConstructor(constructor);
            handle = handle.asSpreader(Object[].class, constructor.getParameterCount());
            return handle.asType(MethodType.methodType(Object.class, Object[].class));
        } catch (IllegalAccessException e) {
            throw new ConfigurationException("Unable to access constructor " + constructor.toGenericString(), e);
        }
    }

    private static final class ParameterSlot {

        private final Class<?> type;
        private final String name;
        private final boolean optional;
        private final Class<?> declaringType;

        private ParameterSlot(Parameter parameter, Class<?> declaringType) {
            Named named = parameter.getAnnotation(Named.class);
            Inject inject = parameter.getAnnotation(Inject.class);

            this.type = parameter.getType();
            this.name = named != null ? named.value() : parameter.getName();
            this.optional = inject != null && inject.optional();
            this.declaringType = declaringType;

            if (optional && type.isPrimitive()) {
                throw new ConfigurationException("Optional constructor parameter '" + name + "' in "
                        + declaringType.getName() + " cannot target primitive type " + type.getName());
            }
        }

        private @Nullable Object resolve(DefaultContainer container, Class<?> capability, Map<String, ?> fixedParameters) {
            if (fixedParameters.containsKey(name)) {
                Object value = fixedParameters.get(name);

                if (!accepts(value)) {
                    throw new ConstructionFailedException(capability, "Fixed parameter '" + name + "' of type "
                            + (value == null ? "null" : value.getClass().getName())
                            + " is not assignable to " + type.getName() + " in " + declaringType.getName(), null);
                }

                return value;
            }

            if (container.isRegistered(type)) {
                return container.resolve(type);
            }

            if (type == Container.class) {
                return container;
            }

            if (type == Logger.class) {
                return Logger.getLogger(declaringType.getName());
            }

            if (optional) {
                return null;
            }

            throw new ConstructionFailedException(capability, "No registration or fixed parameter satisfies"
                    + " parameter '" + name + "' of type " + type.getName() + " in " + declaringType.getName(), null);
        }

        private boolean accepts(@Nullable Object value) {
            if (value == null) {
                return !type.isPrimitive();
            }

            return box(type).isInstance(value);
        }

        private static Class<?> box(Class<?> type) {
            if (!type.isPrimitive()) {
                return type;
            }

            if (type == int.class) {
                return Integer.class;
            } else if (type == long.class) {
                return Long.class;
            } else if (type == boolean.class) {
                return Boolean.class;
            } else if (type == double.class) {
                return Double.class;
            } else if (type == float.class) {
                return Float.class;
            } else if (type == char.class) {
                return Character.class;
            } else if (type == byte.class) {
                return Byte.class;
            } else if (type == short.class) {
                return Short.class;
            }

            return Void.class;
        }
    }
}
