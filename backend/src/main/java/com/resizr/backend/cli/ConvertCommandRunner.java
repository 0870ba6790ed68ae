package com.resizr.backend.cli;

import com.resizr.backend.exception.ImageProcessingException;
import com.resizr.backend.model.EncodeConfig;
import com.resizr.backend.model.EncodedImage;
import com.resizr.backend.pipeline.ImagePipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;

@Component
@ConditionalOnProperty(name = "resizr.mode", havingValue = "convert")
@RequiredArgsConstructor
@Slf4j
public class ConvertCommandRunner implements ApplicationRunner, ExitCodeGenerator {

	static final int EXIT_OK = 0;
	static final int EXIT_FAILED = 1;
	static final int EXIT_USAGE = 2;

	private final ImagePipeline imagePipeline;
	private final EncodeConfig encodeConfig;

	private PrintStream err = System.err;
	private int exitCode = EXIT_OK;

	@Override
	public void run(ApplicationArguments args) {
		ConvertArguments convert;
		try {
			convert = ConvertArguments.parse(args);
		} catch (IllegalArgumentException e) {
			log.error("Invalid convert arguments: {}", e.getMessage());
			err.println("error: " + e.getMessage());
			err.println(ConvertArguments.USAGE);
			exitCode = EXIT_USAGE;
			return;
		}

		exitCode = convert(convert);
	}

	int convert(ConvertArguments convert) {
		EncodedImage image;
		try {
			image = imagePipeline.process(convert.getSource(), convert.getSpec(), convert.getEncoding(), encodeConfig);
		} catch (ImageProcessingException e) {
			log.error("Conversion of {} failed: {}", convert.getSource(), e.getMessage(), e);
			err.println("error: " + e.getMessage());
			return EXIT_FAILED;
		}

		long begin = System.nanoTime();
		try {
			Files.write(convert.getOutput(), image.getBytes());
		} catch (IOException e) {
			log.error("Could not write {}: {}", convert.getOutput(), e.getMessage(), e);
			err.println("error: could not write " + convert.getOutput() + ": " + e.getMessage());
			return EXIT_FAILED;
		}
		log.info("Wrote {} ({} bytes, {}) in {}s", convert.getOutput(), image.size(), convert.getEncoding(),
				String.format("%.3f", (System.nanoTime() - begin) / 1e9));
		return EXIT_OK;
	}

	void setErr(PrintStream err) {
		this.err = err;
	}

	@Override
	public int getExitCode() {
		return exitCode;
	}
}
