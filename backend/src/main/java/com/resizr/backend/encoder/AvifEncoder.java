package com.resizr.backend.encoder;

import com.resizr.backend.config.ResizrProperties;
import com.resizr.backend.enums.Encoding;
import com.resizr.backend.exception.FailedToResizeException;
import com.resizr.backend.model.EncodeConfig;
import com.resizr.backend.model.EncodedImage;
import com.resizr.backend.model.Raster;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Component
@RequiredArgsConstructor
@Slf4j
public class AvifEncoder implements ImageEncoder {

	private final ResizrProperties properties;

	@Override
	public Encoding getEncoding() {
		return Encoding.AVIF;
	}

	@Override
	public EncodedImage encode(Raster raster, EncodeConfig config) throws FailedToResizeException {
		Path input = null;
		Path output = null;
		try {
			input = Files.createTempFile("resizr-avif-in-", ".png");
			output = Files.createTempFile("resizr-avif-out-", ".avif");
			if (!ImageIO.write(RasterImages.toBufferedImage(raster, true), "png", input.toFile())) {
				throw new FailedToResizeException("no PNG writer available to hand the raster to avifenc");
			}

			executeCommand(buildCommand(input, output, config));

			byte[] bytes = Files.readAllBytes(output);
			if (bytes.length == 0) {
				throw new FailedToResizeException("avifenc produced an empty file");
			}
			return EncodedImage.builder()
					.bytes(bytes)
					.encoding(Encoding.AVIF)
					.build();
		} catch (IOException e) {
			throw new FailedToResizeException(String.valueOf(e.getMessage()), e);
		} finally {
			cleanup(input);
			cleanup(output);
		}
	}

	List<String> buildCommand(Path input, Path output, EncodeConfig config) {
		String quality = String.valueOf(config.getRoundedQuality());
		List<String> command = new ArrayList<>();
		command.add(properties.getAvif().getEncoderPath());
		command.add("--speed");
		command.add(String.valueOf(config.getSpeed()));
		command.add("--qcolor");
		command.add(quality);
		command.add("--qalpha");
		command.add(quality);
		command.add(input.toAbsolutePath().toString());
		command.add(output.toAbsolutePath().toString());
		return command;
	}

	private void executeCommand(List<String> command) throws IOException, FailedToResizeException {
		log.debug("avifenc command to be executed: {}", String.join(" ", command));

		Path console = Files.createTempFile("resizr-avifenc-", ".log");
		try {
			ProcessBuilder processBuilder = new ProcessBuilder(command);
			processBuilder.redirectErrorStream(true);
			processBuilder.redirectOutput(console.toFile());
			Process process = processBuilder.start();

			boolean finished;
			try {
				finished = process.waitFor(properties.getAvif().getTimeout().toMillis(), TimeUnit.MILLISECONDS);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				process.destroyForcibly();
				throw new FailedToResizeException("interrupted while waiting for avifenc", e);
			}
			if (!finished) {
				process.destroyForcibly();
				throw new FailedToResizeException("avifenc timed out after " + properties.getAvif().getTimeout());
			}

			String output = new String(Files.readAllBytes(console), StandardCharsets.UTF_8).trim();
			if (!output.isEmpty()) {
				log.debug("avifenc output: {}", output);
			}
			if (process.exitValue() != 0) {
				throw new FailedToResizeException(output.isEmpty()
						? "avifenc failed with exit code " + process.exitValue()
						: output);
			}
		} finally {
			cleanup(console);
		}
	}

	private void cleanup(Path file) {
		if (file == null) {
			return;
		}
		try {
			Files.deleteIfExists(file);
		} catch (IOException e) {
			log.warn("Could not delete temporary file: {}", file.toAbsolutePath());
		}
	}
}
