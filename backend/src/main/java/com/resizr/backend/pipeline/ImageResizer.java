package com.resizr.backend.pipeline;

import com.resizr.backend.enums.FilterType;
import com.resizr.backend.exception.FailedToResizeException;
import com.resizr.backend.model.Dimensions;
import com.resizr.backend.model.Raster;
import com.resizr.backend.model.ResizeSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class ImageResizer {

	private final Resampler resampler;

	public Raster resize(Raster original, ResizeSpec spec, FilterType filter) throws FailedToResizeException {
		Dimensions target = DimensionResolver.resolve(original.getWidth(), original.getHeight(), spec);
		log.debug("Resizing {} -> {} with {} ({})", original.getDimensions(), target, filter.getOptionName(), spec);

		Raster resized;
		try {
			resized = resampler.resample(original, target.getWidth(), target.getHeight(), filter);
		} catch (RuntimeException e) {
			throw new FailedToResizeException(String.valueOf(e.getMessage()), e);
		}
		if (resized.getWidth() != target.getWidth() || resized.getHeight() != target.getHeight()) {
			throw new FailedToResizeException(String.format(
					"resampler produced %s instead of %s", resized.getDimensions(), target));
		}
		return resized;
	}
}
