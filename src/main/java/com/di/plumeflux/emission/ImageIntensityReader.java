package com.di.plumeflux.emission;

import com.di.plumeflux.exception.MalformedDataException;
import com.di.plumeflux.exception.TransientIoException;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Mean pixel intensity of a camera image over a band of rows. Rows default to the whole image;
 * only the first band of the raster is used.
 */
public class ImageIntensityReader {

    private final Integer topRow;
    private final Integer bottomRow;

    public ImageIntensityReader(Integer topRow, Integer bottomRow) {
        this.topRow = topRow;
        this.bottomRow = bottomRow;
    }

    public double meanIntensity(Path path) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new TransientIoException("Cannot read image " + path, e);
        }
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(bytes));
        } catch (IOException e) {
            throw new MalformedDataException("Corrupt image " + path, e);
        }
        if (image == null) {
            throw new MalformedDataException("Unsupported image format " + path);
        }

        Raster raster = image.getRaster();
        int top = topRow == null ? 0 : topRow;
        int bottom = bottomRow == null ? raster.getHeight() - 1 : bottomRow;
        if (top < 0 || bottom >= raster.getHeight() || top > bottom) {
            throw new MalformedDataException(String.format("ROI rows %d-%d outside %s (%d rows)",
                    top, bottom, path.getFileName(), raster.getHeight()));
        }
        double sum = 0;
        long count = 0;
        for (int y = top; y <= bottom; y++) {
            for (int x = 0; x < raster.getWidth(); x++) {
                sum += raster.getSample(x, y, 0);
                count++;
            }
        }
        return sum / count;
    }
}
