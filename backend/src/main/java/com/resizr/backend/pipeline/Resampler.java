package com.resizr.backend.pipeline;

import com.resizr.backend.enums.FilterType;
import com.resizr.backend.model.Raster;

public interface Resampler {

	Raster resample(Raster source, int width, int height, FilterType filter);
}
