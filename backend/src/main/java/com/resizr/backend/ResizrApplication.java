package com.resizr.backend;

import com.resizr.backend.cli.ConvertArguments;
import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Map;

@SpringBootApplication
public class ResizrApplication {

	public static void main(String[] rawArgs) {
		String[] args = ConvertArguments.joinOptionValues(rawArgs);
		SpringApplication application = new SpringApplication(ResizrApplication.class);
		if (ConvertArguments.COMMAND.equals(command(args))) {
			application.setWebApplicationType(WebApplicationType.NONE);
			application.setBannerMode(Banner.Mode.OFF);
			application.setDefaultProperties(Map.of("resizr.mode", ConvertArguments.COMMAND));
			System.exit(SpringApplication.exit(application.run(args)));
		}
		application.run(args);
	}

	static String command(String[] args) {
		for (String arg : args) {
			if (!arg.startsWith("--")) {
				return arg;
			}
		}
		return "server";
	}
}
