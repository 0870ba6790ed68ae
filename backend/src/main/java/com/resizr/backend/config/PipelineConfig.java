package com.resizr.backend.config;

import com.resizr.backend.concurrency.ConcurrencyGate;
import com.resizr.backend.model.EncodeConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ResizrProperties.class)
@Slf4j
public class PipelineConfig {

	@Bean
	public EncodeConfig encodeConfig(ResizrProperties properties) {
		EncodeConfig config = properties.toEncodeConfig();
		log.info("Encoding with quality={}, speed={}, filter={}", config.getQuality(), config.getSpeed(),
				config.getFilter().getOptionName());
		return config;
	}

	@Bean
	@ConditionalOnWebApplication
	public ConcurrencyGate concurrencyGate(ResizrProperties properties) {
		return new ConcurrencyGate(properties.getConcurrencyLimit());
	}
}
