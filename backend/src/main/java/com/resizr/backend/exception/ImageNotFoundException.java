package com.resizr.backend.exception;

import lombok.Getter;

import java.nio.file.Path;

@Getter
public class ImageNotFoundException extends ImageProcessingException {
	private final String source;

	public ImageNotFoundException(String source) {
		super("image not found");
		this.source = source;
	}

	public ImageNotFoundException(Path source) {
		this(String.valueOf(source));
	}

	public ImageNotFoundException(Path source, Throwable cause) {
		super("image not found", cause);
		this.source = String.valueOf(source);
	}
}
