package com.resizr.backend.model;

import com.resizr.backend.enums.FilterType;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class EncodeConfig {
	public static final float DEFAULT_QUALITY = 90f;
	public static final int DEFAULT_SPEED = 4;
	public static final FilterType DEFAULT_FILTER = FilterType.LANCZOS3;

	@Builder.Default
	float quality = DEFAULT_QUALITY;

	@Builder.Default
	int speed = DEFAULT_SPEED;

	@Builder.Default
	FilterType filter = DEFAULT_FILTER;

	public static EncodeConfig defaults() {
		return EncodeConfig.builder().build();
	}

	public EncodeConfig validate() {
		if (!(quality >= 1f && quality <= 100f)) {
			throw new IllegalArgumentException("quality must be within 1..100, got " + quality);
		}
		if (speed < 1 || speed > 10) {
			throw new IllegalArgumentException("speed must be within 1..10, got " + speed);
		}
		if (filter == null) {
			throw new IllegalArgumentException("filter must be set");
		}
		return this;
	}

	public int getRoundedQuality() {
		return (int) Math.floor(quality + 0.5f);
	}
}
