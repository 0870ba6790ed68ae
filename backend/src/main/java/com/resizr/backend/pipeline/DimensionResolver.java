package com.resizr.backend.pipeline;

import com.resizr.backend.exception.FailedToResizeException;
import com.resizr.backend.model.Dimensions;
import com.resizr.backend.model.Raster;
import com.resizr.backend.model.ResizeSpec;

/**
 * Maps a source size and a {@link ResizeSpec} to the concrete target size.
 *
 * <p>Derived dimensions are rounded half away from zero. A target with a zero dimension, or one
 * whose RGBA buffer would not fit in a Java array, is rejected before anything is allocated.
 */
public final class DimensionResolver {

	private static final long MAX_BUFFER_BYTES = Integer.MAX_VALUE - 8;

	private DimensionResolver() {
	}

	public static Dimensions resolve(int sourceWidth, int sourceHeight, ResizeSpec spec) throws FailedToResizeException {
		if (sourceWidth <= 0 || sourceHeight <= 0) {
			throw new FailedToResizeException("source dimensions must be positive, got " + sourceWidth + "x" + sourceHeight);
		}
		double aspectRatio = (double) sourceWidth / (double) sourceHeight;

		long width;
		long height;
		switch (spec.getMode()) {
			case WIDTH:
				width = spec.getWidth();
				height = roundHalfAwayFromZero(spec.getWidth() / aspectRatio);
				break;
			case HEIGHT:
				width = roundHalfAwayFromZero(spec.getHeight() * aspectRatio);
				height = spec.getHeight();
				break;
			case WIDTH_AND_HEIGHT:
				width = spec.getWidth();
				height = spec.getHeight();
				break;
			case SCALE:
				width = roundHalfAwayFromZero(sourceWidth * spec.getFactor());
				height = roundHalfAwayFromZero(sourceHeight * spec.getFactor());
				break;
			default:
				throw new IllegalStateException("unknown resize mode " + spec.getMode());
		}

		if (width <= 0 || height <= 0) {
			throw new FailedToResizeException(String.format(
					"%s on a %dx%d source resolves to %dx%d, which has a zero dimension",
					spec, sourceWidth, sourceHeight, width, height));
		}
		if (width > Integer.MAX_VALUE || height > Integer.MAX_VALUE
				|| width * height > MAX_BUFFER_BYTES / Raster.CHANNELS) {
			throw new FailedToResizeException(String.format(
					"%s on a %dx%d source resolves to %dx%d, which is too large to allocate",
					spec, sourceWidth, sourceHeight, width, height));
		}
		return new Dimensions((int) width, (int) height);
	}

	static long roundHalfAwayFromZero(double value) {
		// Math.round is half-up, mirror it for negatives
		return value < 0 ? -Math.round(-value) : Math.round(value);
	}
}
