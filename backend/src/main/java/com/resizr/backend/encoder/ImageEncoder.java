package com.resizr.backend.encoder;

import com.resizr.backend.enums.Encoding;
import com.resizr.backend.exception.FailedToResizeException;
import com.resizr.backend.model.EncodeConfig;
import com.resizr.backend.model.EncodedImage;
import com.resizr.backend.model.Raster;

public interface ImageEncoder {

	Encoding getEncoding();

	EncodedImage encode(Raster raster, EncodeConfig config) throws FailedToResizeException;
}
