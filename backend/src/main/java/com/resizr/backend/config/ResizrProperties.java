package com.resizr.backend.config;

import com.resizr.backend.enums.FilterType;
import com.resizr.backend.model.EncodeConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "resizr")
public class ResizrProperties {

	@NotNull
	private Path imagesDir = Paths.get("images");

	@Min(1)
	private int concurrencyLimit = 50;

	@Min(1)
	private int workerThreads = Runtime.getRuntime().availableProcessors();

	@Valid
	private Encode encode = new Encode();

	@Valid
	private Avif avif = new Avif();

	public EncodeConfig toEncodeConfig() {
		return EncodeConfig.builder()
				.quality(encode.getQuality())
				.speed(encode.getSpeed())
				.filter(encode.getFilter())
				.build()
				.validate();
	}

	@Data
	public static class Encode {
		@DecimalMin("1")
		@DecimalMax("100")
		private float quality = EncodeConfig.DEFAULT_QUALITY;

		@Min(1)
		@Max(10)
		private int speed = EncodeConfig.DEFAULT_SPEED;

		@NotNull
		private FilterType filter = EncodeConfig.DEFAULT_FILTER;
	}

	@Data
	public static class Avif {
		@NotBlank
		private String encoderPath = "avifenc";

		@NotNull
		private Duration timeout = Duration.ofMinutes(2);
	}
}
