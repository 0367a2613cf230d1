package io.lighting.metakit.cursor;

import io.lighting.metakit.page.PageMetadata;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Picks the values that identify a row's position, to be encoded as the next cursor.
 *
 * @param <T> row type
 */
@FunctionalInterface
public interface CursorKeyExtractor<T> {
    String KEY_ID = "id";
    String KEY_PAGE = "page";

    /**
     * @param row      last row of the current page
     * @param metadata finalized metadata of the current page
     * @return ordered cursor entries; must contain the cursor field
     */
    Map<String, Object> extract(T row, PageMetadata metadata);

    /**
     * Reads {@code id}, the cursor field and the sort field (when set) from map rows,
     * record components or bean fields, and adds the current page number. Names match
     * case-insensitively and {@code snake_case} matches {@code camelCase}.
     *
     * @throws IllegalArgumentException from {@link #extract} when the row has no value
     *                                  for the cursor field
     */
    static <T> CursorKeyExtractor<T> reflective() {
        return (row, metadata) -> {
            Objects.requireNonNull(row, "row");
            Map<String, Object> values = new LinkedHashMap<>();
            Object id = read(row, KEY_ID);
            if (id != null) {
                values.put(KEY_ID, id);
            }
            String cursorField = metadata.getCursorField();
            Object cursorValue = read(row, cursorField);
            if (cursorValue == null) {
                throw new IllegalArgumentException(
                    "Row of type " + row.getClass().getSimpleName() + " has no value for cursor field '"
                        + cursorField + "'"
                );
            }
            values.put(cursorField, cursorValue);
            String sort = metadata.getSort();
            if (!sort.isEmpty() && !values.containsKey(sort)) {
                Object sortValue = read(row, sort);
                if (sortValue != null) {
                    values.put(sort, sortValue);
                }
            }
            values.put(KEY_PAGE, metadata.getPage());
            return values;
        };
    }

    private static Object read(Object row, String name) {
        if (name == null || name.isEmpty()) {
            return null;
        }
        String wanted = normalize(name);
        if (row instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (entry.getKey() != null && normalize(entry.getKey().toString()).equals(wanted)) {
                    return entry.getValue();
                }
            }
            return null;
        }
        Class<?> type = row.getClass();
        if (type.isRecord()) {
            for (RecordComponent component : type.getRecordComponents()) {
                if (normalize(component.getName()).equals(wanted)) {
                    try {
                        component.getAccessor().setAccessible(true);
                        return component.getAccessor().invoke(row);
                    } catch (ReflectiveOperationException ex) {
                        throw new IllegalStateException("Failed to read " + name + " from " + type.getSimpleName(), ex);
                    }
                }
            }
            return null;
        }
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            for (Field field : current.getDeclaredFields()) {
                if (Modifier.isStatic(field.getModifiers()) || !normalize(field.getName()).equals(wanted)) {
                    continue;
                }
                try {
                    field.setAccessible(true);
                    return field.get(row);
                } catch (IllegalAccessException ex) {
                    throw new IllegalStateException("Failed to read " + name + " from " + type.getSimpleName(), ex);
                }
            }
        }
        return null;
    }

    private static String normalize(String name) {
        int dot = name.lastIndexOf('.');
        String simple = dot < 0 ? name : name.substring(dot + 1);
        return simple.replace("_", "").toLowerCase(Locale.ROOT);
    }
}
