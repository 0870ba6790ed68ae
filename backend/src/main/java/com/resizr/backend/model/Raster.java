package com.resizr.backend.model;

import lombok.Getter;

@Getter
public class Raster {
	public static final int CHANNELS = 4;

	private final int width;
	private final int height;
	private final byte[] rgba;

	public Raster(int width, int height, byte[] rgba) {
		if (width <= 0 || height <= 0) {
			throw new IllegalArgumentException("raster dimensions must be positive, got " + width + "x" + height);
		}
		if ((long) width * height * CHANNELS != rgba.length) {
			throw new IllegalArgumentException(String.format(
					"buffer of %d bytes does not match a %dx%d RGBA raster", rgba.length, width, height));
		}
		this.width = width;
		this.height = height;
		this.rgba = rgba;
	}

	public Dimensions getDimensions() {
		return new Dimensions(width, height);
	}
}
