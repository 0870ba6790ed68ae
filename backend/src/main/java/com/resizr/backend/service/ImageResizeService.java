package com.resizr.backend.service;

import com.resizr.backend.enums.Encoding;
import com.resizr.backend.model.EncodedImage;
import com.resizr.backend.model.ResizeSpec;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

public interface ImageResizeService {

	CompletableFuture<EncodedImage> resize(String imageName, ResizeSpec spec, Encoding encoding);

	Path getImagesDir();
}
