package com.resizr.backend.enums;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Resampling kernels available to the resize stage.
 *
 * <p>Each kernel is defined on the source pixel grid at a scale of 1; when downsampling the
 * resampler stretches the support by the scale factor.
 */
public enum FilterType {
	BOX("box", 0.5) {
		@Override
		public double weight(double x) {
			return x > -0.5 && x <= 0.5 ? 1.0 : 0.0;
		}
	},
	BILINEAR("bilinear", 1.0) {
		@Override
		public double weight(double x) {
			double ax = Math.abs(x);
			return ax < 1.0 ? 1.0 - ax : 0.0;
		}
	},
	HAMMING("hamming", 1.0) {
		@Override
		public double weight(double x) {
			double ax = Math.abs(x);
			if (ax >= 1.0) {
				return 0.0;
			}
			return sinc(ax) * (0.54 + 0.46 * Math.cos(Math.PI * ax));
		}
	},
	CATMULL_ROM("catmull-rom", 2.0) {
		@Override
		public double weight(double x) {
			return cubic(x, 0.0, 0.5);
		}
	},
	MITCHELL("mitchell", 2.0) {
		@Override
		public double weight(double x) {
			return cubic(x, 1.0 / 3.0, 1.0 / 3.0);
		}
	},
	GAUSSIAN("gaussian", 3.0) {
		@Override
		public double weight(double x) {
			// sigma = 0.5
			return Math.exp(-2.0 * x * x) * Math.sqrt(2.0 / Math.PI);
		}
	},
	LANCZOS3("lanczos3", 3.0) {
		@Override
		public double weight(double x) {
			double ax = Math.abs(x);
			if (ax >= 3.0) {
				return 0.0;
			}
			return sinc(ax) * sinc(ax / 3.0);
		}
	};

	private final String optionName;
	private final double support;

	FilterType(String optionName, double support) {
		this.optionName = optionName;
		this.support = support;
	}

	public abstract double weight(double x);

	public double getSupport() {
		return support;
	}

	public String getOptionName() {
		return optionName;
	}

	public static Optional<FilterType> fromName(String name) {
		if (name == null) {
			return Optional.empty();
		}
		String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
		return Arrays.stream(values())
				.filter(f -> f.optionName.equals(normalized))
				.findFirst();
	}

	private static double sinc(double x) {
		if (x == 0.0) {
			return 1.0;
		}
		double px = Math.PI * x;
		return Math.sin(px) / px;
	}

	// Mitchell-Netravali family, B and C parameters
	private static double cubic(double x, double b, double c) {
		double ax = Math.abs(x);
		if (ax < 1.0) {
			return ((12 - 9 * b - 6 * c) * ax * ax * ax
					+ (-18 + 12 * b + 6 * c) * ax * ax
					+ (6 - 2 * b)) / 6.0;
		}
		if (ax < 2.0) {
			return ((-b - 6 * c) * ax * ax * ax
					+ (6 * b + 30 * c) * ax * ax
					+ (-12 * b - 48 * c) * ax
					+ (8 * b + 24 * c)) / 6.0;
		}
		return 0.0;
	}
}
