package com.resizr.backend.model;

import com.resizr.backend.enums.ResizeMode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ResizeSpec {
	ResizeMode mode;
	int width;
	int height;
	double factor;

	public static ResizeSpec width(int width) {
		requirePositive("width", width);
		return new ResizeSpec(ResizeMode.WIDTH, width, 0, 0);
	}

	public static ResizeSpec height(int height) {
		requirePositive("height", height);
		return new ResizeSpec(ResizeMode.HEIGHT, 0, height, 0);
	}

	public static ResizeSpec widthAndHeight(int width, int height) {
		requirePositive("width", width);
		requirePositive("height", height);
		return new ResizeSpec(ResizeMode.WIDTH_AND_HEIGHT, width, height, 0);
	}

	public static ResizeSpec scale(double factor) {
		if (!Double.isFinite(factor) || factor <= 0) {
			throw new IllegalArgumentException("scale must be a positive number, got " + factor);
		}
		return new ResizeSpec(ResizeMode.SCALE, 0, 0, factor);
	}

	/**
	 * Builds a spec from optional command line values. Exactly one of {width and/or height} or scale
	 * must be present.
	 */
	public static ResizeSpec of(Integer width, Integer height, Double scale) {
		if (scale != null) {
			if (width != null || height != null) {
				throw new IllegalArgumentException("provide one or both of width and height, or only scale");
			}
			return scale(scale);
		}
		if (width != null && height != null) {
			return widthAndHeight(width, height);
		}
		if (width != null) {
			return width(width);
		}
		if (height != null) {
			return height(height);
		}
		throw new IllegalArgumentException("provide one or both of width and height, or only scale");
	}

	@Override
	public String toString() {
		switch (mode) {
			case WIDTH:
				return "Width(" + width + ")";
			case HEIGHT:
				return "Height(" + height + ")";
			case WIDTH_AND_HEIGHT:
				return "WidthAndHeight(" + width + ", " + height + ")";
			default:
				return "Scale(" + factor + ")";
		}
	}

	private static void requirePositive(String name, int value) {
		if (value <= 0) {
			throw new IllegalArgumentException(name + " must be a positive integer, got " + value);
		}
	}
}
