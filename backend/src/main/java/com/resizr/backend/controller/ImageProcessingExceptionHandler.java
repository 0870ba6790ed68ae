package com.resizr.backend.controller;

import com.resizr.backend.exception.FailedToResizeException;
import com.resizr.backend.exception.ImageNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
@Slf4j
public class ImageProcessingExceptionHandler {

	@ExceptionHandler(ImageNotFoundException.class)
	public ResponseEntity<String> handleNotFound(ImageNotFoundException e) {
		log.error("Image not found: source={}, error={}", e.getSource(), e.getMessage());
		return text(HttpStatus.NOT_FOUND, "not found");
	}

	@ExceptionHandler(FailedToResizeException.class)
	public ResponseEntity<String> handleFailedToResize(FailedToResizeException e) {
		log.error("Failed to resize: diagnostic={}", e.getDiagnostic(), e);
		return text(HttpStatus.INTERNAL_SERVER_ERROR, e.getDiagnostic());
	}

	@ExceptionHandler(IllegalArgumentException.class)
	public ResponseEntity<String> handleBadRequest(IllegalArgumentException e) {
		log.warn("Rejected request: {}", e.getMessage());
		return text(HttpStatus.BAD_REQUEST, e.getMessage());
	}

	@ExceptionHandler(MethodArgumentTypeMismatchException.class)
	public ResponseEntity<String> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
		String message = "invalid value '" + e.getValue() + "' for " + e.getName();
		log.warn("Rejected request: {}", message);
		return text(HttpStatus.BAD_REQUEST, message);
	}

	private static ResponseEntity<String> text(HttpStatus status, String body) {
		return ResponseEntity.status(status)
				.contentType(MediaType.TEXT_PLAIN)
				.body(body);
	}
}
