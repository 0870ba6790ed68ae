package com.resizr.backend.service;

import com.resizr.backend.concurrency.ConcurrencyGate;
import com.resizr.backend.config.ResizrProperties;
import com.resizr.backend.dto.ImageResizeRequest;
import com.resizr.backend.enums.Encoding;
import com.resizr.backend.exception.ImageNotFoundException;
import com.resizr.backend.model.EncodedImage;
import com.resizr.backend.model.ResizeSpec;
import com.resizr.backend.worker.ImageProcessingWorker;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

@Service
@ConditionalOnWebApplication
@Slf4j
public class ImageResizeServiceImpl implements ImageResizeService {

	private final ImageProcessingWorker imageProcessingWorker;
	private final ConcurrencyGate concurrencyGate;
	private final Path imagesDir;

	public ImageResizeServiceImpl(ImageProcessingWorker imageProcessingWorker, ConcurrencyGate concurrencyGate,
								  ResizrProperties properties) {
		this.imageProcessingWorker = imageProcessingWorker;
		this.concurrencyGate = concurrencyGate;
		this.imagesDir = properties.getImagesDir().toAbsolutePath().normalize();
		if (!Files.isDirectory(imagesDir)) {
			throw new IllegalStateException("images directory does not exist: " + imagesDir);
		}
		log.info("Serving images from {} with at most {} concurrent conversions", imagesDir, concurrencyGate.getCapacity());
	}

	@Override
	public CompletableFuture<EncodedImage> resize(String imageName, ResizeSpec spec, Encoding encoding) {
		Optional<Path> source = resolve(imageName);
		if (source.isEmpty()) {
			log.warn("Rejected image name outside {}: {}", imagesDir, imageName);
			return CompletableFuture.failedFuture(new ImageNotFoundException(imageName));
		}
		ImageResizeRequest request = ImageResizeRequest.builder()
				.source(source.get())
				.spec(spec)
				.encoding(encoding)
				.build();
		return concurrencyGate.submit(() -> imageProcessingWorker.processImage(request));
	}

	@Override
	public Path getImagesDir() {
		return imagesDir;
	}

	Optional<Path> resolve(String imageName) {
		if (imageName == null || imageName.isBlank() || imageName.indexOf('\0') >= 0
				|| !imageName.equals(FilenameUtils.getName(imageName))
				|| ".".equals(imageName) || "..".equals(imageName)) {
			return Optional.empty();
		}
		try {
			Path candidate = imagesDir.resolve(imageName).normalize();
			return candidate.startsWith(imagesDir) ? Optional.of(candidate) : Optional.empty();
		} catch (InvalidPathException e) {
			return Optional.empty();
		}
	}
}
