package io.lion.registry;

import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Discovers which candidate classes implement {@link io.lion.integration.EventMapper} or
 * {@link io.lion.integration.FlexibleEventMapper}, and for which notification type.
 *
 * <p>The whole type hierarchy of each candidate is walked, so a mapper inherits its
 * capability from an abstract base class or a sub-interface:
 * <pre>{@code
 * abstract class BaseMapper<N> implements EventMapper<N> { ... }
 * class UserMapper extends BaseMapper<UserCreatedNotification> { ... }
 * // -> EventMapper<UserCreatedNotification> -> UserMapper
 * }</pre>
 *
 * <p>Candidates that cannot be instantiated (interfaces, abstract classes, enums, inner,
 * local and anonymous classes) are skipped. A capability whose type argument does not
 * resolve to a class is skipped with a warning.
 */
public final class MapperTypeScanner {

    private static final Logger logger = Logger.getLogger(MapperTypeScanner.class.getName());

    private MapperTypeScanner() {
    }

    /**
     * Scans candidate classes for mapper capabilities.
     *
     * @param candidates the classes to inspect
     * @return registrations in candidate order, without duplicates
     */
    public static List<MapperRegistration> scan(Collection<? extends Class<?>> candidates) {
        Objects.requireNonNull(candidates, "candidates");
        Set<MapperRegistration> result = new LinkedHashSet<>();
        for (Class<?> candidate : candidates) {
            result.addAll(scan(candidate));
        }
        return List.copyOf(result);
    }

    /**
     * Scans a single class for mapper capabilities.
     *
     * @param candidate the class to inspect
     * @return registrations for every capability the class implements, possibly empty
     */
    public static List<MapperRegistration> scan(Class<?> candidate) {
        Objects.requireNonNull(candidate, "candidate");
        if (!isInstantiable(candidate)) {
            return List.of();
        }
        Set<MapperKey> keys = new LinkedHashSet<>();
        visitClass(candidate, Map.of(), candidate, keys);
        List<MapperRegistration> registrations = new ArrayList<>(keys.size());
        for (MapperKey key : keys) {
            registrations.add(new MapperRegistration(key, candidate));
        }
        return registrations;
    }

    /**
     * Returns whether instances of the class can be created through a constructor.
     */
    public static boolean isInstantiable(Class<?> type) {
        if (type.isInterface() || type.isArray() || type.isPrimitive() || type.isEnum()) {
            return false;
        }
        if (Modifier.isAbstract(type.getModifiers())) {
            return false;
        }
        if (type.isAnonymousClass() || type.isLocalClass()) {
            return false;
        }
        return !type.isMemberClass() || Modifier.isStatic(type.getModifiers());
    }

    private static void visitClass(
            Class<?> type, Map<TypeVariable<?>, Type> bindings, Class<?> candidate, Set<MapperKey> keys) {
        for (Type parent : type.getGenericInterfaces()) {
            visitType(parent, bindings, candidate, keys);
        }
        Type superclass = type.getGenericSuperclass();
        if (superclass != null && superclass != Object.class) {
            visitType(superclass, bindings, candidate, keys);
        }
    }

    private static void visitType(
            Type type, Map<TypeVariable<?>, Type> bindings, Class<?> candidate, Set<MapperKey> keys) {
        if (type instanceof Class<?> raw) {
            if (MapperKind.of(raw) != null) {
                logger.warning(candidate.getName() + " implements raw " + raw.getSimpleName()
                        + " without a type argument; skipped");
                return;
            }
            visitClass(raw, Map.of(), candidate, keys);
            return;
        }
        if (!(type instanceof ParameterizedType parameterized)) {
            return;
        }
        Class<?> raw = (Class<?>) parameterized.getRawType();
        Type[] arguments = parameterized.getActualTypeArguments();
        for (int i = 0; i < arguments.length; i++) {
            arguments[i] = resolve(arguments[i], bindings);
        }

        MapperKind kind = MapperKind.of(raw);
        if (kind != null) {
            Class<?> notificationType = toClass(arguments[0]);
            if (notificationType == null) {
                logger.warning(candidate.getName() + " implements " + raw.getSimpleName()
                        + "<" + arguments[0].getTypeName() + "> with an unresolved type argument; skipped");
                return;
            }
            keys.add(new MapperKey(kind, notificationType));
            return;
        }

        TypeVariable<?>[] parameters = raw.getTypeParameters();
        Map<TypeVariable<?>, Type> inner = new HashMap<>();
        for (int i = 0; i < parameters.length && i < arguments.length; i++) {
            inner.put(parameters[i], arguments[i]);
        }
        visitClass(raw, inner, candidate, keys);
    }

    private static Type resolve(Type type, Map<TypeVariable<?>, Type> bindings) {
        if (type instanceof TypeVariable<?> variable) {
            Type bound = bindings.get(variable);
            return bound != null ? bound : variable;
        }
        return type;
    }

    private static Class<?> toClass(Type type) {
        if (type instanceof Class<?> c) {
            return c;
        }
        if (type instanceof ParameterizedType p) {
            return (Class<?>) p.getRawType();
        }
        return null;
    }
}
