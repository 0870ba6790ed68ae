package com.resizr.backend.encoder;

import com.resizr.backend.enums.Encoding;
import com.resizr.backend.exception.FailedToResizeException;
import com.resizr.backend.model.EncodeConfig;
import com.resizr.backend.model.EncodedImage;
import com.resizr.backend.model.Raster;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

@Component
@Slf4j
public class JpegEncoder implements ImageEncoder {

	@Override
	public Encoding getEncoding() {
		return Encoding.JPEG;
	}

	@Override
	public EncodedImage encode(Raster raster, EncodeConfig config) throws FailedToResizeException {
		Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
		if (!writers.hasNext()) {
			throw new FailedToResizeException("no JPEG writer available");
		}
		ImageWriter writer = writers.next();

		int quality = Math.max(1, Math.min(100, config.getRoundedQuality()));
		ImageWriteParam param = writer.getDefaultWriteParam();
		param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
		param.setCompressionQuality(quality / 100f);

		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		try (ImageOutputStream out = ImageIO.createImageOutputStream(bytes)) {
			writer.setOutput(out);
			// no alpha in JPEG
			writer.write(null, new IIOImage(RasterImages.toBufferedImage(raster, false), null, null), param);
		} catch (IOException | RuntimeException e) {
			throw new FailedToResizeException(String.valueOf(e.getMessage()), e);
		} finally {
			writer.dispose();
		}

		log.debug("JPEG encoded {}x{} at quality {}", raster.getWidth(), raster.getHeight(), quality);
		return EncodedImage.builder()
				.bytes(bytes.toByteArray())
				.encoding(Encoding.JPEG)
				.build();
	}
}
