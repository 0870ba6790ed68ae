package com.resizr.backend.pipeline;

import com.resizr.backend.exception.ImageNotFoundException;
import com.resizr.backend.model.Raster;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
@Slf4j
public class ImageLoader {

	static {
		ImageIO.setUseCache(false);
	}

	public Raster load(Path source) throws ImageNotFoundException {
		if (!Files.isRegularFile(source)) {
			throw new ImageNotFoundException(source);
		}

		BufferedImage image;
		try (InputStream in = new BufferedInputStream(Files.newInputStream(source))) {
			image = ImageIO.read(in);
		} catch (IOException | RuntimeException e) {
			log.warn("Could not decode {}: {}", source, e.getMessage());
			throw new ImageNotFoundException(source, e);
		}
		if (image == null) {
			log.warn("No image reader recognises {}", source);
			throw new ImageNotFoundException(source);
		}
		return toRaster(image);
	}

	static Raster toRaster(BufferedImage image) {
		int width = image.getWidth();
		int height = image.getHeight();
		byte[] rgba = new byte[width * height * Raster.CHANNELS];
		int[] row = new int[width];
		int o = 0;
		for (int y = 0; y < height; y++) {
			// ARGB in the default sRGB color model, alpha 0xff when the source has none
			image.getRGB(0, y, width, 1, row, 0, width);
			for (int x = 0; x < width; x++) {
				int argb = row[x];
				rgba[o++] = (byte) (argb >>> 16);
				rgba[o++] = (byte) (argb >>> 8);
				rgba[o++] = (byte) argb;
				rgba[o++] = (byte) (argb >>> 24);
			}
		}
		return new Raster(width, height, rgba);
	}
}
