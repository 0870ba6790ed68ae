package com.resizr.backend.dto;

import com.resizr.backend.enums.Encoding;
import com.resizr.backend.model.ResizeSpec;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

@Value
@Builder
public class ImageResizeRequest {
	Path source;
	ResizeSpec spec;
	Encoding encoding;
}
