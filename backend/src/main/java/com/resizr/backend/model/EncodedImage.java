package com.resizr.backend.model;

import com.resizr.backend.enums.Encoding;
import lombok.Builder;
import lombok.Value;

import java.util.Optional;

@Value
@Builder
public class EncodedImage {
	byte[] bytes;
	Encoding encoding;
	String displayName;

	public Optional<String> getDisplayName() {
		return Optional.ofNullable(displayName);
	}

	public EncodedImage withDisplayName(String name) {
		return new EncodedImage(bytes, encoding, name);
	}

	public int size() {
		return bytes.length;
	}
}
