package com.resizr.backend.exception;

import lombok.Getter;

@Getter
public class UnsupportedEncodingSelectorException extends IllegalArgumentException {
	private final String selector;

	public UnsupportedEncodingSelectorException(String selector) {
		super("unsupported encoding '" + selector + "', expected one of avif, jpeg, jpg");
		this.selector = selector;
	}
}
