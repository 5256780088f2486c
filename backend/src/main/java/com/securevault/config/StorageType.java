package com.securevault.config;

public enum StorageType {
    /** Process-local map; data is lost on restart. */
    MEMORY,
    CASSANDRA
}
