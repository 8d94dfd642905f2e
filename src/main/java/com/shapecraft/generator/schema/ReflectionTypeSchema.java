package com.shapecraft.generator.schema;

import java.lang.annotation.Annotation;
import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Schema that inspects compiled classes: bean properties, record components and
 * public fields. Member nullability comes from annotations named
 * {@code Nullable}, {@code NonNull}, {@code NotNull} or {@code Nonnull}, whatever
 * their package; primitives are always non-null.
 */
public class ReflectionTypeSchema implements TypeSchema {
    private static final Logger log = LoggerFactory.getLogger(ReflectionTypeSchema.class);

    private static final Set<String> NULLABLE_ANNOTATIONS = Set.of("Nullable", "CheckForNull");
    private static final Set<String> NON_NULL_ANNOTATIONS = Set.of("NonNull", "NotNull", "Nonnull");

    private final ClassLoader classLoader;
    private final String fingerprint;
    private final Map<String, Optional<TypeInfo>> cache = new ConcurrentHashMap<>();

    /**
     * @param classLoader loader the described classes come from
     * @param fingerprint value identifying the class path content, e.g. its entries
     *                    and modification times
     */
    public ReflectionTypeSchema(ClassLoader classLoader, String fingerprint) {
        this.classLoader = classLoader;
        this.fingerprint = "reflection:" + fingerprint;
    }

    @Override
    public Optional<TypeInfo> describe(String typeName) {
        if (TypeNames.isPrimitive(typeName) || TypeNames.isJdkType(typeName)) {
            return Optional.empty();
        }
        return cache.computeIfAbsent(typeName, name -> loadClass(name).map(this::introspect));
    }

    @Override
    public Set<String> typeNames() {
        return Set.copyOf(cache.keySet());
    }

    @Override
    public String fingerprint() {
        return fingerprint;
    }

    private Optional<Class<?>> loadClass(String typeName) {
        String candidate = typeName;
        while (true) {
            try {
                return Optional.of(Class.forName(candidate, false, classLoader));
            } catch (ClassNotFoundException | LinkageError e) {
                int dot = candidate.lastIndexOf('.');
                if (dot < 0) {
                    log.debug("Class {} not found on the schema class path", typeName);
                    return Optional.empty();
                }
                // nested classes: com.acme.Outer.Inner -> com.acme.Outer$Inner
                candidate = candidate.substring(0, dot) + '$' + candidate.substring(dot + 1);
            }
        }
    }

    private TypeInfo introspect(Class<?> type) {
        TypeInfo.TypeInfoBuilder info = TypeInfo.builder()
                .name(type.getCanonicalName() != null ? type.getCanonicalName() : type.getName())
                .defaultConstructible(hasPublicNoArgConstructor(type));

        Map<String, MemberInfo> members = new LinkedHashMap<>();
        if (type.isRecord()) {
            for (RecordComponent component : type.getRecordComponents()) {
                members.put(component.getName(), MemberInfo.builder()
                        .name(component.getName())
                        .type(toTypeRef(component.getGenericType()))
                        .nullability(nullability(component.getType(), component, component.getAccessor()))
                        .readAccess(AccessStyle.RECORD)
                        .writeAccess(AccessStyle.NONE)
                        .build());
            }
        } else {
            collectProperties(type, members);
            collectPublicFields(type, members);
        }
        members.values().forEach(info::member);

        log.debug("Introspected {} with {} member(s)", type.getName(), members.size());
        return info.build();
    }

    private void collectProperties(Class<?> type, Map<String, MemberInfo> members) {
        Method[] methods = type.getMethods();
        Arrays.sort(methods, Comparator.comparing(Method::getName));
        for (Method getter : methods) {
            String property = propertyName(getter);
            if (property == null || members.containsKey(property)) {
                continue;
            }
            Method setter = findSetter(type, getter);
            Field backing = findField(type, property);
            members.put(property, MemberInfo.builder()
                    .name(property)
                    .type(toTypeRef(getter.getGenericReturnType()))
                    .nullability(nullability(getter.getReturnType(), getter, backing))
                    .readAccess(AccessStyle.GETTER)
                    .getterName(getter.getName())
                    .writeAccess(setter != null ? AccessStyle.SETTER : AccessStyle.NONE)
                    .setterName(setter != null ? setter.getName() : null)
                    .build());
        }
    }

    private void collectPublicFields(Class<?> type, Map<String, MemberInfo> members) {
        for (Field field : type.getFields()) {
            if (Modifier.isStatic(field.getModifiers()) || members.containsKey(field.getName())) {
                continue;
            }
            members.put(field.getName(), MemberInfo.builder()
                    .name(field.getName())
                    .type(toTypeRef(field.getGenericType()))
                    .nullability(nullability(field.getType(), field))
                    .readAccess(AccessStyle.FIELD)
                    .writeAccess(Modifier.isFinal(field.getModifiers()) ? AccessStyle.NONE : AccessStyle.FIELD)
                    .build());
        }
    }

    private String propertyName(Method method) {
        if (method.getParameterCount() != 0 || Modifier.isStatic(method.getModifiers())
                || method.getDeclaringClass() == Object.class || method.getReturnType() == void.class) {
            return null;
        }
        String name = method.getName();
        if (name.startsWith("get") && name.length() > 3) {
            return decapitalize(name.substring(3));
        }
        if (name.startsWith("is") && name.length() > 2 && method.getReturnType() == boolean.class) {
            return decapitalize(name.substring(2));
        }
        return null;
    }

    private Method findSetter(Class<?> type, Method getter) {
        String setterName = "set" + getter.getName().substring(getter.getName().startsWith("is") ? 2 : 3);
        try {
            Method setter = type.getMethod(setterName, getter.getReturnType());
            return Modifier.isStatic(setter.getModifiers()) ? null : setter;
        } catch (NoSuchMethodException e) {
            return null;
        }
    }

    private Field findField(Class<?> type, String name) {
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            try {
                return current.getDeclaredField(name);
            } catch (NoSuchFieldException e) {
                log.trace("No field {} declared on {}", name, current.getName());
            }
        }
        return null;
    }

    private Nullability nullability(Class<?> rawType, AnnotatedElement... elements) {
        if (rawType.isPrimitive()) {
            return Nullability.NON_NULL;
        }
        for (AnnotatedElement element : elements) {
            if (element == null) {
                continue;
            }
            for (Annotation annotation : element.getAnnotations()) {
                String simpleName = annotation.annotationType().getSimpleName();
                if (NULLABLE_ANNOTATIONS.contains(simpleName)) {
                    return Nullability.NULLABLE;
                }
                if (NON_NULL_ANNOTATIONS.contains(simpleName)) {
                    return Nullability.NON_NULL;
                }
            }
        }
        return Nullability.UNKNOWN;
    }

    private boolean hasPublicNoArgConstructor(Class<?> type) {
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers()) || type.isRecord() || type.isEnum()) {
            return false;
        }
        for (Constructor<?> constructor : type.getConstructors()) {
            if (constructor.getParameterCount() == 0) {
                return true;
            }
        }
        return false;
    }

    TypeRef toTypeRef(Type type) {
        if (type instanceof Class<?> cls) {
            if (cls.isPrimitive()) {
                return TypeRef.primitive(cls.getName());
            }
            if (cls.isArray()) {
                return TypeRef.array(toTypeRef(cls.getComponentType()));
            }
            String name = cls.getCanonicalName() != null ? cls.getCanonicalName() : cls.getName();
            return TypeNames.containerKind(name)
                    .map(kind -> TypeRef.collection(kind, name, TypeRef.named("java.lang.Object")))
                    .orElseGet(() -> TypeRef.named(name));
        }
        if (type instanceof ParameterizedType parameterized) {
            Class<?> raw = (Class<?>) parameterized.getRawType();
            String name = raw.getCanonicalName();
            Type[] arguments = parameterized.getActualTypeArguments();
            return TypeNames.containerKind(name)
                    .map(kind -> TypeRef.collection(kind, name,
                            arguments.length > 0 ? toTypeRef(arguments[0]).boxed() : TypeRef.named("java.lang.Object")))
                    .orElseGet(() -> toTypeRef(raw));
        }
        if (type instanceof GenericArrayType array) {
            return TypeRef.array(toTypeRef(array.getGenericComponentType()));
        }
        if (type instanceof WildcardType wildcard) {
            return toTypeRef(wildcard.getUpperBounds()[0]);
        }
        if (type instanceof TypeVariable<?> variable) {
            return toTypeRef(variable.getBounds()[0]);
        }
        return TypeRef.UNRESOLVED;
    }

    private static String decapitalize(String name) {
        if (name.length() > 1 && Character.isUpperCase(name.charAt(1)) && Character.isUpperCase(name.charAt(0))) {
            return name;
        }
        return Character.toLowerCase(name.charAt(0)) + name.substring(1);
    }
}
