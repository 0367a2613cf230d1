package io.lighting.metakit.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public record RenderedSql(String sql, List<Bind> binds) {
    public RenderedSql {
        Objects.requireNonNull(sql, "sql");
        Objects.requireNonNull(binds, "binds");
        binds = List.copyOf(binds);
    }

    public static RenderedSql of(String sql, Object... args) {
        Objects.requireNonNull(sql, "sql");
        List<Bind> binds = new ArrayList<>();
        if (args != null) {
            for (Object arg : args) {
                binds.add(Bind.of(arg));
            }
        }
        return new RenderedSql(sql, binds);
    }

    public RenderedSql withBinds(List<Bind> newBinds) {
        return new RenderedSql(sql, newBinds);
    }
}
