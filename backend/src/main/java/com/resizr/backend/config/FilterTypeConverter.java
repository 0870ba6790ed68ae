package com.resizr.backend.config;

import com.resizr.backend.enums.FilterType;
import org.springframework.boot.context.properties.ConfigurationPropertiesBinding;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.stream.Collectors;

@Component
@ConfigurationPropertiesBinding
public class FilterTypeConverter implements Converter<String, FilterType> {

	@Override
	public FilterType convert(String source) {
		return FilterType.fromName(source).orElseThrow(() -> new IllegalArgumentException(
				"unknown filter '" + source + "', expected one of " + Arrays.stream(FilterType.values())
						.map(FilterType::getOptionName)
						.collect(Collectors.joining(", "))));
	}
}
