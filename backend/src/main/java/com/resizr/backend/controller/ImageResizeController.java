package com.resizr.backend.controller;

import com.resizr.backend.enums.Encoding;
import com.resizr.backend.exception.UnsupportedEncodingSelectorException;
import com.resizr.backend.model.EncodedImage;
import com.resizr.backend.model.ResizeSpec;
import com.resizr.backend.service.ImageResizeService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/images/resized")
@RequiredArgsConstructor
@ConditionalOnWebApplication
public class ImageResizeController {

	private final ImageResizeService imageResizeService;

	@GetMapping("/{width}/{height}/{image}/{encoding}")
	public CompletableFuture<ResponseEntity<byte[]>> widthAndHeight(@PathVariable int width, @PathVariable int height,
																	@PathVariable String image, @PathVariable String encoding) {
		return resize(image, ResizeSpec.widthAndHeight(width, height), parseEncoding(encoding));
	}

	@GetMapping("/width/{width}/{image}/{encoding}")
	public CompletableFuture<ResponseEntity<byte[]>> width(@PathVariable int width, @PathVariable String image,
														   @PathVariable String encoding) {
		return resize(image, ResizeSpec.width(width), parseEncoding(encoding));
	}

	@GetMapping("/height/{height}/{image}/{encoding}")
	public CompletableFuture<ResponseEntity<byte[]>> height(@PathVariable int height, @PathVariable String image,
															@PathVariable String encoding) {
		return resize(image, ResizeSpec.height(height), parseEncoding(encoding));
	}

	@GetMapping("/scale/{scale}/{image}/{encoding}")
	public CompletableFuture<ResponseEntity<byte[]>> scale(@PathVariable double scale, @PathVariable String image,
														   @PathVariable String encoding) {
		return resize(image, ResizeSpec.scale(scale), parseEncoding(encoding));
	}

	@GetMapping("/{width}/{height}/{image}")
	public CompletableFuture<ResponseEntity<byte[]>> widthAndHeightAvif(@PathVariable int width, @PathVariable int height,
																		@PathVariable String image) {
		return resize(image, ResizeSpec.widthAndHeight(width, height), Encoding.AVIF);
	}

	@GetMapping("/width/{width}/{image}")
	public CompletableFuture<ResponseEntity<byte[]>> widthAvif(@PathVariable int width, @PathVariable String image) {
		return resize(image, ResizeSpec.width(width), Encoding.AVIF);
	}

	@GetMapping("/height/{height}/{image}")
	public CompletableFuture<ResponseEntity<byte[]>> heightAvif(@PathVariable int height, @PathVariable String image) {
		return resize(image, ResizeSpec.height(height), Encoding.AVIF);
	}

	@GetMapping("/scale/{scale}/{image}")
	public CompletableFuture<ResponseEntity<byte[]>> scaleAvif(@PathVariable double scale, @PathVariable String image) {
		return resize(image, ResizeSpec.scale(scale), Encoding.AVIF);
	}

	private CompletableFuture<ResponseEntity<byte[]>> resize(String image, ResizeSpec spec, Encoding encoding) {
		return imageResizeService.resize(image, spec, encoding).thenApply(ImageResizeController::toResponse);
	}

	private static Encoding parseEncoding(String encoding) {
		return Encoding.fromSelector(encoding).orElseThrow(() -> new UnsupportedEncodingSelectorException(encoding));
	}

	static ResponseEntity<byte[]> toResponse(EncodedImage encoded) {
		ResponseEntity.BodyBuilder response = ResponseEntity.ok()
				.contentType(MediaType.parseMediaType(encoded.getEncoding().getMimeType()))
				.contentLength(encoded.size());
		encoded.getDisplayName().ifPresent(name -> response.header(HttpHeaders.CONTENT_DISPOSITION,
				ContentDisposition.inline().filename(name).build().toString()));
		return response.body(encoded.getBytes());
	}
}
