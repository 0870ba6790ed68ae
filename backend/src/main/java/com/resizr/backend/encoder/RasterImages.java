package com.resizr.backend.encoder;

import com.resizr.backend.model.Raster;

import java.awt.image.BufferedImage;

final class RasterImages {

	private RasterImages() {
	}

	static BufferedImage toBufferedImage(Raster raster, boolean keepAlpha) {
		int width = raster.getWidth();
		int height = raster.getHeight();
		byte[] rgba = raster.getRgba();
		BufferedImage image = new BufferedImage(width, height,
				keepAlpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
		int[] row = new int[width];
		int p = 0;
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				int r = rgba[p++] & 0xff;
				int g = rgba[p++] & 0xff;
				int b = rgba[p++] & 0xff;
				int a = rgba[p++] & 0xff;
				row[x] = (a << 24) | (r << 16) | (g << 8) | b;
			}
			image.setRGB(0, y, width, 1, row, 0, width);
		}
		return image;
	}
}
