package com.resizr.backend.enums;

public enum ResizeMode {
	WIDTH,
	HEIGHT,
	WIDTH_AND_HEIGHT,
	SCALE
}
