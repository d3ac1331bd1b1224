package com.tfve.sync.core.ratelimit;

public enum Decision {
    ALLOW,
    REJECT
}
