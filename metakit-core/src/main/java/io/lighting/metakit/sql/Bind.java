package io.lighting.metakit.sql;

import java.sql.Types;
import java.util.Objects;

public sealed interface Bind permits Bind.Value, Bind.NullValue {
    int jdbcType();

    static Bind of(Object value) {
        if (value == null) {
            return new NullValue(Types.NULL);
        }
        return new Value(value, 0);
    }

    record Value(Object value, int jdbcType) implements Bind {
        public Value {
            Objects.requireNonNull(value, "value");
        }
    }

    record NullValue(int jdbcType) implements Bind {
    }
}
