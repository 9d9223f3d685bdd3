package com.starscape.thumbnailer.features.ingestthumbnail.domain;

public enum EventStatus {
    SUCCESS,
    SKIPPED,
    FAILED,
    PARTIAL_SUCCESS
}
