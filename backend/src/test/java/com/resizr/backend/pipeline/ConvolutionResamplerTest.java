package com.resizr.backend.pipeline;

import com.resizr.backend.enums.FilterType;
import com.resizr.backend.model.Raster;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConvolutionResamplerTest {

	private final ConvolutionResampler resampler = new ConvolutionResampler();

	@ParameterizedTest
	@EnumSource(FilterType.class)
	void producesExactTargetSize(FilterType filter) {
		Raster source = solid(37, 23, 10, 20, 30, 255);

		Raster down = resampler.resample(source, 9, 5, filter);
		Raster up = resampler.resample(source, 80, 61, filter);

		assertThat(down.getWidth()).isEqualTo(9);
		assertThat(down.getHeight()).isEqualTo(5);
		assertThat(down.getRgba()).hasSize(9 * 5 * 4);
		assertThat(up.getWidth()).isEqualTo(80);
		assertThat(up.getHeight()).isEqualTo(61);
	}

	@ParameterizedTest
	@EnumSource(FilterType.class)
	void solidColorStaysSolid(FilterType filter) {
		Raster resized = resampler.resample(solid(50, 40, 200, 100, 50, 255), 17, 13, filter);

		byte[] rgba = resized.getRgba();
		for (int i = 0; i < rgba.length; i += 4) {
			assertThat(rgba[i] & 0xff).isEqualTo(200);
			assertThat(rgba[i + 1] & 0xff).isEqualTo(100);
			assertThat(rgba[i + 2] & 0xff).isEqualTo(50);
			assertThat(rgba[i + 3] & 0xff).isEqualTo(255);
		}
	}

	@Test
	void boxAtSameSizeIsIdentity() {
		Raster source = noise(31, 17);

		Raster copy = resampler.resample(source, 31, 17, FilterType.BOX);

		assertThat(copy.getRgba()).isEqualTo(source.getRgba());
	}

	@Test
	void transparentPixelsDoNotTintNeighbours() {
		// left half opaque red, right half fully transparent green
		byte[] rgba = new byte[8 * 2 * 4];
		for (int y = 0; y < 2; y++) {
			for (int x = 0; x < 8; x++) {
				int p = (y * 8 + x) * 4;
				if (x < 4) {
					rgba[p] = (byte) 255;
					rgba[p + 3] = (byte) 255;
				} else {
					rgba[p + 1] = (byte) 255;
				}
			}
		}

		Raster resized = resampler.resample(new Raster(8, 2, rgba), 2, 1, FilterType.BILINEAR);

		byte[] out = resized.getRgba();
		for (int p = 0; p < out.length; p += 4) {
			assertThat(out[p] & 0xff).isEqualTo(255);
			assertThat(out[p + 1] & 0xff).isZero();
		}
		assertThat(out[3] & 0xff).isBetween(200, 240);
		assertThat(out[7] & 0xff).isBetween(1, 100);
	}

	@Test
	void sameInputGivesSameOutput() {
		Raster source = noise(64, 48);

		Raster first = resampler.resample(source, 20, 15, FilterType.LANCZOS3);
		Raster second = resampler.resample(source, 20, 15, FilterType.LANCZOS3);

		assertThat(first.getRgba()).isEqualTo(second.getRgba());
	}

	@Test
	void rejectsNonPositiveTarget() {
		assertThatThrownBy(() -> resampler.resample(solid(4, 4, 0, 0, 0, 255), 0, 4, FilterType.BOX))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("0x4");
	}

	@Test
	void oneByOneSourceCanBeEnlarged() {
		Raster resized = resampler.resample(solid(1, 1, 9, 8, 7, 255), 3, 2, FilterType.MITCHELL);

		byte[] expected = new byte[3 * 2 * 4];
		for (int i = 0; i < expected.length; i += 4) {
			expected[i] = 9;
			expected[i + 1] = 8;
			expected[i + 2] = 7;
			expected[i + 3] = (byte) 255;
		}
		assertThat(resized.getRgba()).isEqualTo(expected);
	}

	static Raster solid(int width, int height, int r, int g, int b, int a) {
		byte[] rgba = new byte[width * height * 4];
		for (int i = 0; i < rgba.length; i += 4) {
			rgba[i] = (byte) r;
			rgba[i + 1] = (byte) g;
			rgba[i + 2] = (byte) b;
			rgba[i + 3] = (byte) a;
		}
		return new Raster(width, height, rgba);
	}

	static Raster noise(int width, int height) {
		byte[] rgba = new byte[width * height * 4];
		int seed = 12345;
		for (int i = 0; i < rgba.length; i++) {
			seed = seed * 1103515245 + 12345;
			rgba[i] = (byte) (seed >>> 16);
		}
		for (int i = 3; i < rgba.length; i += 4) {
			rgba[i] = (byte) 255;
		}
		return new Raster(width, height, Arrays.copyOf(rgba, rgba.length));
	}
}
