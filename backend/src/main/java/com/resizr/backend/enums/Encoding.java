package com.resizr.backend.enums;

import java.util.Locale;
import java.util.Optional;

public enum Encoding {
	AVIF("image/avif", "avif"),
	JPEG("image/jpeg", "jpg");

	private final String mimeType;
	private final String extension;

	Encoding(String mimeType, String extension) {
		this.mimeType = mimeType;
		this.extension = extension;
	}

	public String getMimeType() {
		return mimeType;
	}

	public String getExtension() {
		return extension;
	}

	public static Optional<Encoding> fromSelector(String selector) {
		if (selector == null) {
			return Optional.empty();
		}
		switch (selector.trim().toLowerCase(Locale.ROOT)) {
			case "avif":
				return Optional.of(AVIF);
			case "jpeg":
			case "jpg":
				return Optional.of(JPEG);
			default:
				return Optional.empty();
		}
	}
}
