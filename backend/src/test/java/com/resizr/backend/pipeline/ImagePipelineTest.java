package com.resizr.backend.pipeline;

import com.resizr.backend.TestImages;
import com.resizr.backend.config.ResizrProperties;
import com.resizr.backend.encoder.AvifEncoder;
import com.resizr.backend.encoder.ImageEncoder;
import com.resizr.backend.encoder.JpegEncoder;
import com.resizr.backend.enums.Encoding;
import com.resizr.backend.enums.FilterType;
import com.resizr.backend.exception.FailedToResizeException;
import com.resizr.backend.exception.ImageNotFoundException;
import com.resizr.backend.model.EncodeConfig;
import com.resizr.backend.model.EncodedImage;
import com.resizr.backend.model.Raster;
import com.resizr.backend.model.ResizeSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ImagePipelineTest {

	@TempDir
	Path dir;

	private ImageEncoder avif;
	private ImagePipeline pipeline;
	private final EncodeConfig config = EncodeConfig.defaults();

	@BeforeEach
	void setUp() throws Exception {
		avif = mock(ImageEncoder.class);
		when(avif.getEncoding()).thenReturn(Encoding.AVIF);
		when(avif.encode(any(Raster.class), any(EncodeConfig.class))).thenAnswer(inv -> {
			Raster raster = inv.getArgument(0);
			return EncodedImage.builder()
					.bytes(new byte[]{(byte) raster.getWidth(), (byte) raster.getHeight()})
					.encoding(Encoding.AVIF)
					.build();
		});
		pipeline = new ImagePipeline(new ImageLoader(), new ImageResizer(new ConvolutionResampler()),
				List.of(new JpegEncoder(), avif));
	}

	@Test
	@DisplayName("4000x3000 JPEG at Width(1000) comes back as a 1000x750 image")
	void largeJpegToWidth() throws Exception {
		Path source = TestImages.write(dir, "large.jpg", 4000, 3000);

		EncodedImage encoded = pipeline.process(source, ResizeSpec.width(1000), Encoding.JPEG, config);

		BufferedImage decoded = TestImages.decode(encoded.getBytes());
		assertThat(decoded.getWidth()).isEqualTo(1000);
		assertThat(decoded.getHeight()).isEqualTo(750);
		assertThat(encoded.getEncoding()).isEqualTo(Encoding.JPEG);
		assertThat(encoded.getDisplayName()).contains("large.jpg");
	}

	@Test
	@DisplayName("4000x3000 JPEG at Width(1000) encodes to a 1000x750 AVIF")
	void largeJpegToAvif() throws Exception {
		assumeTrue(TestImages.avifencInstalled(), "avifenc is not installed");
		Path source = TestImages.write(dir, "large.jpg", 4000, 3000);
		ImagePipeline real = new ImagePipeline(new ImageLoader(), new ImageResizer(new ConvolutionResampler()),
				List.of(new AvifEncoder(new ResizrProperties())));
		EncodeConfig fast = EncodeConfig.builder().speed(10).build();

		EncodedImage encoded = real.process(source, ResizeSpec.width(1000), Encoding.AVIF, fast);

		assertThat(encoded.getEncoding()).isEqualTo(Encoding.AVIF);
		assertThat(TestImages.avifDimensions(encoded.getBytes())).containsExactly(1000, 750);
		assertThat(encoded.getDisplayName()).contains("large.avif");
	}

	@Test
	@DisplayName("200x100 PNG at Scale(2.5) comes back as 500x250")
	void pngScaledUp() throws Exception {
		Path source = TestImages.write(dir, "small.png", 200, 100);

		EncodedImage encoded = pipeline.process(source, ResizeSpec.scale(2.5), Encoding.JPEG, config);

		BufferedImage decoded = TestImages.decode(encoded.getBytes());
		assertThat(decoded.getWidth()).isEqualTo(500);
		assertThat(decoded.getHeight()).isEqualTo(250);
		assertThat(encoded.getDisplayName()).contains("small.jpg");
	}

	@Test
	void encoderReceivesResolvedRasterAndNamesOutputAfterSource() throws Exception {
		Path source = TestImages.write(dir, "cat.png", 120, 80);

		EncodedImage encoded = pipeline.process(source, ResizeSpec.height(40), Encoding.AVIF, config);

		assertThat(encoded.getBytes()).containsExactly(60, 40);
		assertThat(encoded.getDisplayName()).contains("cat.avif");
	}

	@Test
	void sameInputsGiveIdenticalBytes() throws Exception {
		Path source = TestImages.write(dir, "same.png", 300, 200);
		EncodeConfig bilinear = EncodeConfig.builder().quality(75).filter(FilterType.BILINEAR).build();

		byte[] first = pipeline.process(source, ResizeSpec.width(97), Encoding.JPEG, bilinear).getBytes();
		byte[] second = pipeline.process(source, ResizeSpec.width(97), Encoding.JPEG, bilinear).getBytes();

		assertThat(first).isEqualTo(second);
	}

	@Test
	void missingSourceIsNotFoundAndNothingIsEncoded() throws Exception {
		assertThatThrownBy(() -> pipeline.process(dir.resolve("missing.jpg"), ResizeSpec.width(10), Encoding.AVIF, config))
				.isInstanceOf(ImageNotFoundException.class);

		verify(avif, never()).encode(any(), any());
	}

	@Test
	void zeroDerivedDimensionFailsBeforeEncoding() throws Exception {
		Path source = TestImages.write(dir, "wide.png", 1000, 10);

		assertThatThrownBy(() -> pipeline.process(source, ResizeSpec.width(1), Encoding.AVIF, config))
				.isInstanceOf(FailedToResizeException.class)
				.hasMessageStartingWith("failed to resize: ");

		verify(avif, never()).encode(any(), any());
	}

	@Test
	void encoderFailureKeepsDiagnostic() throws Exception {
		doThrow(new FailedToResizeException("encoder exploded"))
				.when(avif).encode(any(Raster.class), any(EncodeConfig.class));
		Path source = TestImages.write(dir, "boom.png", 20, 20);

		assertThatThrownBy(() -> pipeline.process(source, ResizeSpec.scale(0.5), Encoding.AVIF, config))
				.isInstanceOf(FailedToResizeException.class)
				.extracting(e -> ((FailedToResizeException) e).getDiagnostic())
				.isEqualTo("encoder exploded");
	}

	@Test
	void resamplerFailureIsTranslated() throws Exception {
		Resampler broken = (source, width, height, filter) -> {
			throw new IllegalStateException("kernel blew up");
		};
		ImagePipeline failing = new ImagePipeline(new ImageLoader(), new ImageResizer(broken), List.of(avif));
		Path source = TestImages.write(dir, "x.png", 20, 20);

		assertThatThrownBy(() -> failing.process(source, ResizeSpec.width(10), Encoding.AVIF, config))
				.isInstanceOf(FailedToResizeException.class)
				.hasMessage("failed to resize: kernel blew up");
	}

	@Test
	void unregisteredEncodingFails() throws Exception {
		ImagePipeline jpegOnly = new ImagePipeline(new ImageLoader(), new ImageResizer(new ConvolutionResampler()),
				List.of(new JpegEncoder()));

		assertThatThrownBy(() -> jpegOnly.process(dir.resolve("a.png"), ResizeSpec.width(1), Encoding.AVIF, config))
				.isInstanceOf(FailedToResizeException.class);
	}

	@Test
	void displayNameFallsBackForOddPaths() {
		assertThat(ImagePipeline.displayName(Path.of("photos/archive.tar.gz"), Encoding.JPEG)).isEqualTo("archive.tar.jpg");
		assertThat(ImagePipeline.displayName(Path.of(".hidden"), Encoding.AVIF)).isEqualTo("image.avif");
	}
}
