package io.lighting.metakit.db;

public enum QueryOperation {
    COUNT,
    FETCH
}
