package com.starscape.thumbnailer.features.ingestthumbnail.domain;

import java.awt.image.BufferedImage;

/**
 * A decoded source image plus what is known about its original encoding.
 * Lives only while one event is processed.
 *
 * @param format     ImageIO format name of the source ("png", "JPEG", ...)
 * @param colorMode  one of RGB, RGBA, L, LA, P, CMYK, OTHER
 * @param byteLength size of the encoded source
 * @param sourceWidth  width of the encoded source; the decoded image is smaller when it was subsampled
 * @param sourceHeight height of the encoded source
 */
public record ImageArtifact(
    BufferedImage image,
    String format,
    String colorMode,
    long byteLength,
    int sourceWidth,
    int sourceHeight
) {
    
    public int width() {
        return image.getWidth();
    }
    
    public int height() {
        return image.getHeight();
    }
}
