package com.starscape.thumbnailer.features.ingestthumbnail.domain;

public record ThumbnailArtifact(
    byte[] bytes,
    int width,
    int height,
    String contentType
) {}
