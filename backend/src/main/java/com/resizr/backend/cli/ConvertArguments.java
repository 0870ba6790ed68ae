package com.resizr.backend.cli;

import com.resizr.backend.enums.Encoding;
import com.resizr.backend.exception.UnsupportedEncodingSelectorException;
import com.resizr.backend.model.ResizeSpec;
import lombok.Value;
import org.apache.commons.io.FilenameUtils;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Arguments of {@code convert <source-image> [--width W] [--height H] [--scale S] [--encoding avif|jpeg]
 * <output-file>}. Options take their value either as {@code --width=W} or as the next argument.
 * Everything is validated here, before any image is read.
 */
@Value
public class ConvertArguments {

	public static final String COMMAND = "convert";
	public static final String USAGE = "usage: convert <source-image> [--width W] [--height H] [--scale S] "
			+ "[--encoding avif|jpeg] [--quality 1..100] [--speed 1..10] [--filter NAME] <output-file>";

	private static final Set<String> VALUED_OPTIONS = Set.of(
			"width", "height", "scale", "encoding",
			"quality", "speed", "filter", "images", "concurrency", "address", "port", "avifenc");

	Path source;
	Path output;
	ResizeSpec spec;
	Encoding encoding;

	public static ConvertArguments parse(ApplicationArguments arguments) {
		ApplicationArguments args = new DefaultApplicationArguments(joinOptionValues(arguments.getSourceArgs()));
		List<String> positional = args.getNonOptionArgs();
		int offset = !positional.isEmpty() && COMMAND.equals(positional.get(0)) ? 1 : 0;
		if (positional.size() - offset != 2) {
			throw new IllegalArgumentException("expected a source image and an output file");
		}
		Path source = Paths.get(positional.get(offset));
		Path output = Paths.get(positional.get(offset + 1));

		ResizeSpec spec = ResizeSpec.of(
				intOption(args, "width"),
				intOption(args, "height"),
				doubleOption(args, "scale"));

		return new ConvertArguments(source, output, spec, encoding(args, output));
	}

	private static Encoding encoding(ApplicationArguments args, Path output) {
		String selector = option(args, "encoding");
		if (selector != null) {
			return Encoding.fromSelector(selector).orElseThrow(() -> new UnsupportedEncodingSelectorException(selector));
		}
		Path fileName = output.getFileName();
		String extension = fileName == null ? "" : FilenameUtils.getExtension(fileName.toString());
		return Encoding.fromSelector(extension).orElse(Encoding.AVIF);
	}

	private static Integer intOption(ApplicationArguments args, String name) {
		String value = option(args, name);
		if (value == null) {
			return null;
		}
		try {
			return Integer.valueOf(value.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("--" + name + " expects a positive integer, got '" + value + "'");
		}
	}

	private static Double doubleOption(ApplicationArguments args, String name) {
		String value = option(args, name);
		if (value == null) {
			return null;
		}
		try {
			return Double.valueOf(value.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("--" + name + " expects a positive number, got '" + value + "'");
		}
	}

	private static String option(ApplicationArguments args, String name) {
		if (!args.containsOption(name)) {
			return null;
		}
		List<String> values = args.getOptionValues(name);
		if (values == null || values.isEmpty() || values.get(0).isBlank()) {
			throw new IllegalArgumentException("--" + name + " needs a value, e.g. --" + name + "=100");
		}
		if (values.size() > 1) {
			throw new IllegalArgumentException("--" + name + " given more than once");
		}
		return values.get(0);
	}

	public static String[] joinOptionValues(String[] args) {
		List<String> joined = new ArrayList<>(args.length);
		for (int i = 0; i < args.length; i++) {
			String arg = args[i];
			if (arg.startsWith("--") && VALUED_OPTIONS.contains(arg.substring(2))
					&& i + 1 < args.length && !args[i + 1].startsWith("--")) {
				joined.add(arg + "=" + args[++i]);
			} else {
				joined.add(arg);
			}
		}
		return joined.toArray(new String[0]);
	}
}
