package com.resizr.backend.worker;

import com.resizr.backend.dto.ImageResizeRequest;
import com.resizr.backend.exception.ImageProcessingException;
import com.resizr.backend.model.EncodeConfig;
import com.resizr.backend.model.EncodedImage;
import com.resizr.backend.pipeline.ImagePipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

@Component
@ConditionalOnWebApplication
@RequiredArgsConstructor
@Slf4j
public class ImageProcessingWorker {

	public static final String EXECUTOR = "imageWorkerExecutor";

	private final ImagePipeline imagePipeline;
	private final EncodeConfig encodeConfig;

	@Async(EXECUTOR)
	public CompletableFuture<EncodedImage> processImage(ImageResizeRequest request) {
		log.debug("STARTING {} {} for {}", request.getSpec(), request.getEncoding(), request.getSource());
		try {
			EncodedImage encoded = imagePipeline.process(request.getSource(), request.getSpec(), request.getEncoding(), encodeConfig);
			log.debug("FINISHED {} ({} bytes)", request.getSource(), encoded.size());
			return CompletableFuture.completedFuture(encoded);
		} catch (ImageProcessingException e) {
			return CompletableFuture.failedFuture(e);
		}
	}
}
