package com.gomflow.smartagent.intake;

import com.gomflow.smartagent.config.SmartAgentProperties;
import com.gomflow.smartagent.exception.InvalidImageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.Optional;

/**
 * Validates uploads and produces the normalised variants the recognition ports consume.
 *
 * The fingerprint hashes decoded pixels rather than file bytes, so a re-encoded copy of the
 * same screenshot at the same size still deduplicates.
 */
@Slf4j
@Component
public class ImagePreprocessor {

    private final SmartAgentProperties.Intake settings;

    public ImagePreprocessor(SmartAgentProperties properties) {
        this.settings = properties.getIntake();
    }

    public PreparedImage prepare(byte[] imageBytes) {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new InvalidImageException("Image is empty");
        }
        if (imageBytes.length > settings.getMaxImageBytes()) {
            throw new InvalidImageException(String.format("Image too large: %d bytes > %d bytes",
                    imageBytes.length, settings.getMaxImageBytes()));
        }

        ImageFormat format = ImageFormat.detect(imageBytes)
                .filter(this::isAllowed)
                .orElseThrow(() -> new InvalidImageException(
                        "Unsupported image format, allowed: " + settings.getAllowedFormats()));

        BufferedImage decoded = decode(imageBytes);
        int width = decoded.getWidth();
        int height = decoded.getHeight();

        BufferedImage normalized = fitWithinBounds(toRgb(decoded));
        BufferedImage recognition = contrastStretchedGray(normalized);

        PreparedImage prepared = new PreparedImage(
                encodeJpeg(normalized),
                encodeJpeg(recognition),
                normalized.getWidth(),
                normalized.getHeight(),
                format,
                fingerprint(normalized),
                imageBytes.length);

        log.debug("Prepared {} image {}x{} -> {}x{}, fingerprint={}", format.getValue(), width, height,
                prepared.width(), prepared.height(), prepared.fingerprint());
        return prepared;
    }

    private boolean isAllowed(ImageFormat format) {
        return settings.getAllowedFormats().stream()
                .map(ImageFormat::fromValue)
                .flatMap(Optional::stream)
                .anyMatch(allowed -> allowed == format);
    }

    /**
     * Decodes the image after checking its header dimensions, so an oversized raster is
     * refused before any pixel memory is allocated.
     */
    private BufferedImage decode(byte[] imageBytes) {
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(imageBytes))) {
            Iterator<ImageReader> readers = input == null ? null : ImageIO.getImageReaders(input);
            if (readers == null || !readers.hasNext()) {
                throw new InvalidImageException("Image could not be decoded");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                checkDimensions(reader.getWidth(0), reader.getHeight(0));
                return reader.read(0);
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            throw new InvalidImageException("Image could not be decoded: " + e.getMessage(), e);
        }
    }

    private void checkDimensions(int width, int height) {
        if (width < settings.getMinWidth() || height < settings.getMinHeight()) {
            throw new InvalidImageException(String.format("Image dimensions too small: %dx%d, required: %dx%d",
                    width, height, settings.getMinWidth(), settings.getMinHeight()));
        }
        if ((long) width * height > settings.getMaxPixels()) {
            throw new InvalidImageException(String.format("Image dimensions too large: %dx%d exceeds %d pixels",
                    width, height, settings.getMaxPixels()));
        }
    }

    /**
     * Flattens transparency onto white and drops any colour model quirks.
     */
    static BufferedImage toRgb(BufferedImage source) {
        BufferedImage rgb = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = rgb.createGraphics();
        try {
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, source.getWidth(), source.getHeight());
            graphics.drawImage(source, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        return rgb;
    }

    private BufferedImage fitWithinBounds(BufferedImage image) {
        double scale = Math.min(1.0, Math.min(
                (double) settings.getMaxWidth() / image.getWidth(),
                (double) settings.getMaxHeight() / image.getHeight()));
        if (scale >= 1.0) {
            return image;
        }

        int targetWidth = Math.max(1, (int) Math.round(image.getWidth() * scale));
        int targetHeight = Math.max(1, (int) Math.round(image.getHeight() * scale));
        BufferedImage scaled = new BufferedImage(targetWidth, targetHeight, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = scaled.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            graphics.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            graphics.drawImage(image, 0, 0, targetWidth, targetHeight, null);
        } finally {
            graphics.dispose();
        }
        return scaled;
    }

    /**
     * Luminance image with its range stretched to the full 0-255 scale.
     */
    static BufferedImage contrastStretchedGray(BufferedImage rgb) {
        int width = rgb.getWidth();
        int height = rgb.getHeight();
        int[] luminance = new int[width * height];
        int min = 255;
        int max = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int pixel = rgb.getRGB(x, y);
                int r = (pixel >> 16) & 0xFF;
                int g = (pixel >> 8) & 0xFF;
                int b = pixel & 0xFF;
                int value = (int) Math.round(0.299 * r + 0.587 * g + 0.114 * b);
                luminance[y * width + x] = value;
                min = Math.min(min, value);
                max = Math.max(max, value);
            }
        }

        BufferedImage gray = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster raster = gray.getRaster();
        int range = max - min;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int value = luminance[y * width + x];
                int stretched = range == 0 ? value : (value - min) * 255 / range;
                raster.setSample(x, y, 0, stretched);
            }
        }
        return gray;
    }

    static String fingerprint(BufferedImage rgb) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(ByteBuffer.allocate(8).putInt(rgb.getWidth()).putInt(rgb.getHeight()).array());
            ByteBuffer row = ByteBuffer.allocate(rgb.getWidth() * 4);
            int[] pixels = new int[rgb.getWidth()];
            for (int y = 0; y < rgb.getHeight(); y++) {
                rgb.getRGB(0, y, rgb.getWidth(), 1, pixels, 0, rgb.getWidth());
                row.clear();
                for (int pixel : pixels) {
                    row.putInt(pixel & 0x00FFFFFF);
                }
                digest.update(row.array());
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private byte[] encodeJpeg(BufferedImage image) {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IllegalStateException("No JPEG writer available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        try (ImageOutputStream stream = ImageIO.createImageOutputStream(output)) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(settings.getJpegQuality());
            writer.setOutput(stream);
            writer.write(null, new IIOImage(image, null, null), param);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode image as JPEG", e);
        } finally {
            writer.dispose();
        }
        return output.toByteArray();
    }
}
