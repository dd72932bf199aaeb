package io.fetch4j.core;

public enum JobStatus {
    ACTIVE,
    INACTIVE
}
