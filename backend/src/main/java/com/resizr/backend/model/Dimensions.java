package com.resizr.backend.model;

import lombok.Value;

@Value
public class Dimensions {
	int width;
	int height;

	@Override
	public String toString() {
		return width + "x" + height;
	}
}
