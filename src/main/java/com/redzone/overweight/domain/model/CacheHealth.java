package com.redzone.overweight.domain.model;

import java.time.Instant;

public record CacheHealth(CacheStatus status, Instant refreshedAt) {}
