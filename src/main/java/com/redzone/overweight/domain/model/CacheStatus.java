package com.redzone.overweight.domain.model;

public enum CacheStatus {
    INITIALIZING,
    OK,
    STALE,
    ERROR
}
