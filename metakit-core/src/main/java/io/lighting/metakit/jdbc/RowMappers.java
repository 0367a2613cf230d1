package io.lighting.metakit.jdbc;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ready-made {@link RowMapper}s.
 * <p>
 * Column labels are matched case-insensitively against record components or bean
 * fields; {@code snake_case} labels also match {@code camelCase} names. Columns that
 * are not selected leave the target at its default value, which is how field selection
 * shows up in mapped rows.
 */
public final class RowMappers {
    private static final Map<Class<?>, RowMapper<?>> CACHE = new ConcurrentHashMap<>();

    private RowMappers() {
    }

    public static <T> RowMapper<T> auto(Class<T> type) {
        Objects.requireNonNull(type, "type");
        @SuppressWarnings("unchecked")
        RowMapper<T> mapper = (RowMapper<T>) CACHE.computeIfAbsent(type, RowMappers::createMapper);
        return mapper;
    }

    /**
     * Maps each row to an insertion-ordered map keyed by lower-case column label.
     */
    public static RowMapper<Map<String, Object>> asMap() {
        return resultSet -> {
            ResultSetMetaData meta = resultSet.getMetaData();
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= meta.getColumnCount(); i++) {
                row.put(label(meta, i).toLowerCase(Locale.ROOT), resultSet.getObject(i));
            }
            return row;
        };
    }

    private static RowMapper<?> createMapper(Class<?> type) {
        if (type.isRecord()) {
            return recordMapper(type);
        }
        return beanMapper(type);
    }

    private static <T> RowMapper<T> recordMapper(Class<T> type) {
        RecordComponent[] components = type.getRecordComponents();
        Class<?>[] paramTypes = new Class<?>[components.length];
        for (int i = 0; i < components.length; i++) {
            paramTypes[i] = components[i].getType();
        }
        Constructor<T> ctor = constructor(type, paramTypes);
        return resultSet -> {
            Map<String, Integer> indexes = columnIndexes(resultSet);
            Object[] args = new Object[components.length];
            for (int i = 0; i < components.length; i++) {
                Integer index = indexes.get(normalize(components[i].getName()));
                Object value = index == null ? null : read(resultSet, index, paramTypes[i]);
                args[i] = defaultIfPrimitive(paramTypes[i], value);
            }
            try {
                return ctor.newInstance(args);
            } catch (ReflectiveOperationException ex) {
                throw new IllegalStateException("Failed to map row to " + type.getSimpleName(), ex);
            }
        };
    }

    private static <T> RowMapper<T> beanMapper(Class<T> type) {
        Constructor<T> ctor = constructor(type);
        Map<String, Field> fields = fieldMap(type);
        return resultSet -> {
            Map<String, Integer> indexes = columnIndexes(resultSet);
            T instance;
            try {
                instance = ctor.newInstance();
            } catch (ReflectiveOperationException ex) {
                throw new IllegalStateException("Failed to map row to " + type.getSimpleName(), ex);
            }
            for (Map.Entry<String, Field> entry : fields.entrySet()) {
                Integer index = indexes.get(entry.getKey());
                if (index == null) {
                    continue;
                }
                Field field = entry.getValue();
                Object value = read(resultSet, index, field.getType());
                if (value == null && field.getType().isPrimitive()) {
                    continue;
                }
                try {
                    field.set(instance, value);
                } catch (IllegalAccessException ex) {
                    throw new IllegalStateException("Failed to map row to " + type.getSimpleName(), ex);
                }
            }
            return instance;
        };
    }

    private static Object read(ResultSet resultSet, int index, Class<?> type) throws SQLException {
        Object value = resultSet.getObject(index, boxed(type));
        if (resultSet.wasNull()) {
            return null;
        }
        return value;
    }

    private static Map<String, Integer> columnIndexes(ResultSet resultSet) throws SQLException {
        ResultSetMetaData meta = resultSet.getMetaData();
        Map<String, Integer> indexes = new HashMap<>();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            indexes.putIfAbsent(normalize(label(meta, i)), i);
        }
        return indexes;
    }

    private static String label(ResultSetMetaData meta, int index) throws SQLException {
        String label = meta.getColumnLabel(index);
        if (label == null || label.isBlank()) {
            label = meta.getColumnName(index);
        }
        return label;
    }

    private static Map<String, Field> fieldMap(Class<?> type) {
        Map<String, Field> fields = new LinkedHashMap<>();
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            for (Field field : current.getDeclaredFields()) {
                if (Modifier.isStatic(field.getModifiers()) || Modifier.isTransient(field.getModifiers())) {
                    continue;
                }
                field.setAccessible(true);
                fields.putIfAbsent(normalize(field.getName()), field);
            }
        }
        return fields;
    }

    private static Class<?> boxed(Class<?> type) {
        if (!type.isPrimitive()) {
            return type;
        }
        if (type == boolean.class) {
            return Boolean.class;
        }
        if (type == char.class) {
            return Character.class;
        }
        if (type == byte.class) {
            return Byte.class;
        }
        if (type == short.class) {
            return Short.class;
        }
        if (type == int.class) {
            return Integer.class;
        }
        if (type == long.class) {
            return Long.class;
        }
        if (type == float.class) {
            return Float.class;
        }
        return Double.class;
    }

    private static Object defaultIfPrimitive(Class<?> type, Object value) {
        if (value != null || !type.isPrimitive()) {
            return value;
        }
        if (type == boolean.class) {
            return false;
        }
        if (type == char.class) {
            return '\0';
        }
        if (type == byte.class) {
            return (byte) 0;
        }
        if (type == short.class) {
            return (short) 0;
        }
        if (type == int.class) {
            return 0;
        }
        if (type == long.class) {
            return 0L;
        }
        if (type == float.class) {
            return 0f;
        }
        return 0d;
    }

    // created_at and createdAt both normalize to "createdat"
    private static String normalize(String value) {
        return value.replace("_", "").toLowerCase(Locale.ROOT);
    }

    private static <T> Constructor<T> constructor(Class<T> type, Class<?>... parameterTypes) {
        try {
            Constructor<T> ctor = type.getDeclaredConstructor(parameterTypes);
            ctor.setAccessible(true);
            return ctor;
        } catch (ReflectiveOperationException ex) {
            throw new IllegalStateException("No accessible constructor for " + type.getSimpleName(), ex);
        }
    }
}
