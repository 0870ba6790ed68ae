package com.resizr.backend.exception;

import lombok.Getter;

/**
 * Resolving the target size, resampling or encoding failed. {@link #getDiagnostic()} holds the
 * collaborator's text unchanged.
 */
@Getter
public class FailedToResizeException extends ImageProcessingException {
	private final String diagnostic;

	public FailedToResizeException(String diagnostic) {
		super("failed to resize: " + diagnostic);
		this.diagnostic = diagnostic;
	}

	public FailedToResizeException(String diagnostic, Throwable cause) {
		super("failed to resize: " + diagnostic, cause);
		this.diagnostic = diagnostic;
	}
}
