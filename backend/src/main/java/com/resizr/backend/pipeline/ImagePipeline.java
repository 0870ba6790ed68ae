package com.resizr.backend.pipeline;

import com.resizr.backend.encoder.ImageEncoder;
import com.resizr.backend.enums.Encoding;
import com.resizr.backend.exception.FailedToResizeException;
import com.resizr.backend.exception.ImageProcessingException;
import com.resizr.backend.model.EncodeConfig;
import com.resizr.backend.model.EncodedImage;
import com.resizr.backend.model.Raster;
import com.resizr.backend.model.ResizeSpec;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class ImagePipeline {

	private final ImageLoader loader;
	private final ImageResizer resizer;
	private final Map<Encoding, ImageEncoder> encoders;

	public ImagePipeline(ImageLoader loader, ImageResizer resizer, List<ImageEncoder> encoders) {
		this.loader = loader;
		this.resizer = resizer;
		Map<Encoding, ImageEncoder> byEncoding = new EnumMap<>(Encoding.class);
		for (ImageEncoder encoder : encoders) {
			byEncoding.put(encoder.getEncoding(), encoder);
		}
		this.encoders = Collections.unmodifiableMap(byEncoding);
	}

	public EncodedImage process(Path source, ResizeSpec spec, Encoding encoding, EncodeConfig config) throws ImageProcessingException {
		ImageEncoder encoder = encoders.get(encoding);
		if (encoder == null) {
			throw new FailedToResizeException("no encoder registered for " + encoding);
		}
		long begin = System.nanoTime();

		long stage = System.nanoTime();
		Raster original = loader.load(source);
		log.debug("Loaded {} ({}) in {}s", source, original.getDimensions(), elapsedSecs(stage));

		stage = System.nanoTime();
		Raster resized = resizer.resize(original, spec, config.getFilter());
		log.debug("Resized to {} in {}s", resized.getDimensions(), elapsedSecs(stage));

		stage = System.nanoTime();
		EncodedImage encoded = encoder.encode(resized, config);
		log.debug("Encoded {} in {}s, {} KiB", encoding, elapsedSecs(stage), String.format("%.1f", encoded.size() / 1024.0));

		log.debug("Processed {} as {} {} in {}s", source, spec, encoding, elapsedSecs(begin));
		return encoded.withDisplayName(displayName(source, encoding));
	}

	static String displayName(Path source, Encoding encoding) {
		Path fileName = source.getFileName();
		String stem = fileName == null ? "image" : FilenameUtils.getBaseName(fileName.toString());
		return (stem.isEmpty() ? "image" : stem) + "." + encoding.getExtension();
	}

	private static String elapsedSecs(long startNanos) {
		return String.format("%.3f", (System.nanoTime() - startNanos) / 1e9);
	}
}
