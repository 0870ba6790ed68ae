package com.resizr.backend.exception;

public abstract class ImageProcessingException extends Exception {
	protected ImageProcessingException(String message) {
		super(message);
	}

	protected ImageProcessingException(String message, Throwable cause) {
		super(message, cause);
	}
}
