package com.resizr.backend.controller;

import com.resizr.backend.concurrency.ConcurrencyGate;
import com.resizr.backend.config.ResizrProperties;
import com.resizr.backend.service.ImageResizeService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
@ConditionalOnWebApplication
public class HealthCheckController {

	private final ImageResizeService imageResizeService;
	private final ConcurrencyGate concurrencyGate;
	private final ResizrProperties properties;

	@GetMapping
	public ResponseEntity<Map<String, String>> checkHealth() {
		Path imagesDir = imageResizeService.getImagesDir();
		boolean readable = Files.isDirectory(imagesDir) && Files.isReadable(imagesDir);

		Map<String, String> response = new LinkedHashMap<>();
		response.put("status", readable ? "UP" : "DOWN");
		response.put("images_dir", readable ? "OK" : "Error: " + imagesDir + " is not a readable directory");
		response.put("concurrency_limit", String.valueOf(concurrencyGate.getCapacity()));
		response.put("in_flight", String.valueOf(concurrencyGate.getInFlight()));
		response.put("waiting", String.valueOf(concurrencyGate.getWaiting()));
		response.put("avif_encoder", properties.getAvif().getEncoderPath());
		return readable ? ResponseEntity.ok(response) : ResponseEntity.status(503).body(response);
	}
}
