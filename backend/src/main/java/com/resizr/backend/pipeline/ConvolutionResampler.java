package com.resizr.backend.pipeline;

import com.resizr.backend.enums.FilterType;
import com.resizr.backend.model.Raster;
import org.springframework.stereotype.Component;

/**
 * Separable two-pass convolution: rows first into a float buffer, then columns. Color channels are
 * weighted by alpha while filtering so transparent pixels do not bleed their color into the result.
 */
@Component
public class ConvolutionResampler implements Resampler {

	private static final int C = Raster.CHANNELS;

	@Override
	public Raster resample(Raster source, int width, int height, FilterType filter) {
		if (width <= 0 || height <= 0) {
			throw new IllegalArgumentException("target dimensions must be positive, got " + width + "x" + height);
		}
		int sw = source.getWidth();
		int sh = source.getHeight();
		byte[] src = source.getRgba();

		if ((long) width * sh * C > Integer.MAX_VALUE - 8) {
			throw new IllegalArgumentException(String.format(
					"intermediate buffer for %dx%d -> %dx%d exceeds the maximum array size", sw, sh, width, height));
		}

		Coefficients horizontal = Coefficients.compute(sw, width, filter);
		Coefficients vertical = Coefficients.compute(sh, height, filter);

		float[] rows = new float[width * sh * C];
		for (int y = 0; y < sh; y++) {
			int rowOffset = y * sw;
			int outOffset = y * width * C;
			for (int x = 0; x < width; x++) {
				int start = horizontal.start[x];
				int count = horizontal.count[x];
				int k = x * horizontal.maxTaps;
				float r = 0, g = 0, b = 0, a = 0;
				for (int t = 0; t < count; t++) {
					int p = (rowOffset + start + t) * C;
					float w = horizontal.weights[k + t];
					float alpha = (src[p + 3] & 0xff);
					float wa = w * alpha / 255f;
					r += (src[p] & 0xff) * wa;
					g += (src[p + 1] & 0xff) * wa;
					b += (src[p + 2] & 0xff) * wa;
					a += alpha * w;
				}
				int o = outOffset + x * C;
				rows[o] = r;
				rows[o + 1] = g;
				rows[o + 2] = b;
				rows[o + 3] = a;
			}
		}

		byte[] out = new byte[width * height * C];
		int stride = width * C;
		for (int y = 0; y < height; y++) {
			int start = vertical.start[y];
			int count = vertical.count[y];
			int k = y * vertical.maxTaps;
			int outOffset = y * stride;
			for (int x = 0; x < width; x++) {
				float r = 0, g = 0, b = 0, a = 0;
				for (int t = 0; t < count; t++) {
					int p = (start + t) * stride + x * C;
					float w = vertical.weights[k + t];
					r += rows[p] * w;
					g += rows[p + 1] * w;
					b += rows[p + 2] * w;
					a += rows[p + 3] * w;
				}
				int o = outOffset + x * C;
				int alpha = clamp(a);
				if (alpha == 0) {
					out[o] = 0;
					out[o + 1] = 0;
					out[o + 2] = 0;
					out[o + 3] = 0;
				} else {
					float unpremultiply = 255f / alpha;
					out[o] = (byte) clamp(r * unpremultiply);
					out[o + 1] = (byte) clamp(g * unpremultiply);
					out[o + 2] = (byte) clamp(b * unpremultiply);
					out[o + 3] = (byte) alpha;
				}
			}
		}
		return new Raster(width, height, out);
	}

	private static int clamp(float value) {
		int v = Math.round(value);
		if (v < 0) {
			return 0;
		}
		return Math.min(v, 255);
	}

	/**
	 * Per output index: first source index, number of taps and normalized weights.
	 */
	static final class Coefficients {
		final int[] start;
		final int[] count;
		final float[] weights;
		final int maxTaps;

		private Coefficients(int[] start, int[] count, float[] weights, int maxTaps) {
			this.start = start;
			this.count = count;
			this.weights = weights;
			this.maxTaps = maxTaps;
		}

		static Coefficients compute(int inSize, int outSize, FilterType filter) {
			double scale = (double) inSize / outSize;
			double filterScale = Math.max(scale, 1.0);
			double support = filter.getSupport() * filterScale;
			int maxTaps = (int) Math.ceil(support) * 2 + 1;

			int[] start = new int[outSize];
			int[] count = new int[outSize];
			float[] weights = new float[outSize * maxTaps];
			double[] scratch = new double[maxTaps];

			for (int i = 0; i < outSize; i++) {
				double center = (i + 0.5) * scale;
				int min = Math.max((int) (center - support + 0.5), 0);
				int max = Math.min((int) (center + support + 0.5), inSize);
				int taps = Math.min(max - min, maxTaps);

				double total = 0;
				for (int t = 0; t < taps; t++) {
					double w = filter.weight((t + min - center + 0.5) / filterScale);
					scratch[t] = w;
					total += w;
				}
				if (taps <= 0 || total == 0) {
					// nearest source pixel
					min = Math.min(Math.max((int) center, 0), inSize - 1);
					taps = 1;
					scratch[0] = 1;
					total = 1;
				}
				start[i] = min;
				count[i] = taps;
				for (int t = 0; t < taps; t++) {
					weights[i * maxTaps + t] = (float) (scratch[t] / total);
				}
			}
			return new Coefficients(start, count, weights, maxTaps);
		}
	}
}
