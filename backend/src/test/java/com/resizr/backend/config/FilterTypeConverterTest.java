package com.resizr.backend.config;

import com.resizr.backend.enums.FilterType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilterTypeConverterTest {

	private final FilterTypeConverter converter = new FilterTypeConverter();

	@Test
	void convertsKernelNames() {
		assertThat(converter.convert("lanczos3")).isEqualTo(FilterType.LANCZOS3);
		assertThat(converter.convert("catmull-rom")).isEqualTo(FilterType.CATMULL_ROM);
		assertThat(converter.convert(" Gaussian ")).isEqualTo(FilterType.GAUSSIAN);
	}

	@Test
	void unknownNameListsTheKernels() {
		assertThatThrownBy(() -> converter.convert("nearest"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("nearest")
				.hasMessageContaining("box, bilinear");
	}
}
