package com.adrelay.domain;

public enum ScheduledPostStatus {
    SCHEDULED,
    PUBLISHED,
    FAILED
}
