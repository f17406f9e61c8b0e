package com.vuong.simpledata.core.domain.metadata;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Utility class exposing the declaration order of entity fields.
 * The JPA metamodel hands out attributes as unordered sets, so attribute names are
 * ordered against this list. Results are cached to avoid repeated reflection costs.
 */
public final class DeclaredFields {
    // Cache to avoid repeated reflection cost
    private static final Map<Class<?>, List<String>> cache = new ConcurrentHashMap<>();

    private DeclaredFields() {
    }

    /**
     * Returns the names of the instance fields of a class in declaration order,
     * starting with the topmost superclass.
     * @param type the class to inspect
     * @return immutable list of field names
     */
    public static List<String> getFieldNames(Class<?> type) {
        return cache.computeIfAbsent(type, cls -> {
            List<String> names = new ArrayList<>();
            for (Field f : getAllFields(cls)) {
                if (!Modifier.isStatic(f.getModifiers()) && !f.isSynthetic()) {
                    names.add(f.getName());
                }
            }
            return List.copyOf(names);
        });
    }

    /**
     * Returns the position of a field in {@link #getFieldNames(Class)}, or
     * {@link Integer#MAX_VALUE} when the class declares no such field.
     * @param type the class to inspect
     * @param name the field name
     * @return the declaration index
     */
    public static int indexOf(Class<?> type, String name) {
        int index = getFieldNames(type).indexOf(name);
        return index < 0 ? Integer.MAX_VALUE : index;
    }

    private static List<Field> getAllFields(Class<?> type) {
        List<Class<?>> hierarchy = new ArrayList<>();
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            hierarchy.add(0, c);
        }
        List<Field> fields = new ArrayList<>();
        for (Class<?> c : hierarchy) {
            fields.addAll(Arrays.asList(c.getDeclaredFields()));
        }
        return fields;
    }
}
