package com.starscape.thumbnailer.features.ingestthumbnail.app;

import com.starscape.thumbnailer.common.config.IngestionSettings;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.ImageArtifact;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.ImageDecodeException;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.ThumbnailArtifact;
import net.coobird.thumbnailator.Thumbnails;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.Dimension;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;

/**
 * Turns encoded source images into bounded RGB JPEG thumbnails:
 * - Decodes with ImageIO, recording the source format and color mode
 * - Rejects sources above the pixel limit and subsamples large ones while decoding
 * - Converts every non-RGB color mode to 8-bit RGB (alpha is dropped)
 * - Shrinks to fit the configured box, keeping aspect ratio and never upscaling
 * - Encodes JPEG at the configured quality
 */
@Component
public class ThumbnailRenderer {
    
    public static final String OUTPUT_FORMAT = "jpg";
    public static final String CONTENT_TYPE = "image/jpeg";
    
    private final int maxWidth;
    private final int maxHeight;
    private final float quality;
    private final long maxSourcePixels;
    
    public ThumbnailRenderer(IngestionSettings settings) {
        this.maxWidth = settings.maxWidth();
        this.maxHeight = settings.maxHeight();
        this.quality = settings.quality();
        this.maxSourcePixels = settings.maxSourcePixels();
    }
    
    /**
     * Decode image bytes.
     *
     * Only the header is read before the size check, and sources much larger than the thumbnail box
     * are decoded at a reduced size, so heap use stays bounded whatever the compressed size.
     *
     * @throws ImageDecodeException for empty or corrupt data, unsupported codecs and oversized images
     */
    public ImageArtifact decode(byte[] bytes) throws ImageDecodeException {
        if (bytes == null || bytes.length == 0) {
            throw new ImageDecodeException("Image data is empty");
        }
        
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
            if (input == null) {
                throw new ImageDecodeException("No image input stream available");
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                throw new ImageDecodeException("Unsupported image format");
            }
            
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                int sourceWidth = reader.getWidth(0);
                int sourceHeight = reader.getHeight(0);
                if ((long) sourceWidth * sourceHeight > maxSourcePixels) {
                    throw new ImageDecodeException("Image of " + sourceWidth + "x" + sourceHeight
                        + " exceeds the limit of " + maxSourcePixels + " pixels");
                }
                
                ImageReadParam param = reader.getDefaultReadParam();
                int step = subsamplingStep(sourceWidth, sourceHeight, maxWidth, maxHeight);
                if (step > 1) {
                    param.setSourceSubsampling(step, step, 0, 0);
                }
                BufferedImage image = reader.read(0, param);
                String format = reader.getFormatName().toLowerCase(Locale.ROOT);
                return new ImageArtifact(
                    image, format, colorModeOf(image), bytes.length, sourceWidth, sourceHeight);
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            // ImageIO readers signal corrupt data with unchecked exceptions as well
            throw new ImageDecodeException("Failed to decode image: " + e.getMessage(), e);
        }
    }
    
    /**
     * Render the thumbnail of a decoded image.
     * Output depends only on the image pixels and the configured bounds and quality.
     *
     * @throws ImageDecodeException if conversion or encoding fails
     */
    public ThumbnailArtifact render(ImageArtifact artifact) throws ImageDecodeException {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        Dimension size;
        try {
            BufferedImage rgb = toRgb(artifact.image());
            size = fit(rgb.getWidth(), rgb.getHeight(), maxWidth, maxHeight);
            
            Thumbnails.of(rgb)
                    .forceSize(size.width, size.height)
                    .imageType(BufferedImage.TYPE_INT_RGB)
                    .outputFormat(OUTPUT_FORMAT)
                    .outputQuality(quality)
                    .toOutputStream(output);
        } catch (IOException | RuntimeException e) {
            throw new ImageDecodeException("Failed to render thumbnail: " + e.getMessage(), e);
        }
        
        return new ThumbnailArtifact(output.toByteArray(), size.width, size.height, CONTENT_TYPE);
    }
    
    /**
     * Largest size within maxWidth x maxHeight with the same aspect ratio.
     * Images already inside the box keep their size.
     */
    public static Dimension fit(int width, int height, int maxWidth, int maxHeight) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive: " + width + "x" + height);
        }
        if (width <= maxWidth && height <= maxHeight) {
            return new Dimension(width, height);
        }
        
        double scale = Math.min((double) maxWidth / width, (double) maxHeight / height);
        int targetWidth = (int) Math.max(1, Math.min(maxWidth, Math.round(width * scale)));
        int targetHeight = (int) Math.max(1, Math.min(maxHeight, Math.round(height * scale)));
        return new Dimension(targetWidth, targetHeight);
    }
    
    /**
     * Largest whole subsampling step that still leaves both sides at least twice the box,
     * so the final resize works from more pixels than it outputs. 1 means decode every pixel.
     */
    public static int subsamplingStep(int width, int height, int maxWidth, int maxHeight) {
        int step = Math.min(width / (2 * maxWidth), height / (2 * maxHeight));
        return Math.max(1, step);
    }
    
    /**
     * Copy into an 8-bit RGB image, keeping color values and dropping alpha.
     * Images that are already TYPE_INT_RGB are returned as-is.
     */
    public static BufferedImage toRgb(BufferedImage source) {
        if (source.getType() == BufferedImage.TYPE_INT_RGB) {
            return source;
        }
        
        int width = source.getWidth();
        int height = source.getHeight();
        BufferedImage rgb = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            source.getRGB(0, y, width, 1, row, 0, width);
            for (int x = 0; x < width; x++) {
                row[x] &= 0x00FFFFFF;
            }
            rgb.setRGB(0, y, width, 1, row, 0, width);
        }
        return rgb;
    }
    
    public static String colorModeOf(BufferedImage image) {
        ColorModel colorModel = image.getColorModel();
        if (colorModel instanceof IndexColorModel) {
            return "P";
        }
        
        boolean alpha = colorModel.hasAlpha();
        return switch (colorModel.getColorSpace().getType()) {
            case ColorSpace.TYPE_GRAY -> alpha ? "LA" : "L";
            case ColorSpace.TYPE_RGB -> alpha ? "RGBA" : "RGB";
            case ColorSpace.TYPE_CMYK -> "CMYK";
            default -> "OTHER";
        };
    }
}
