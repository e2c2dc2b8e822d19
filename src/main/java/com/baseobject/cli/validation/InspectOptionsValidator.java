package com.baseobject.cli.validation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.baseobject.cli.exception.OptionsValidationException;
import com.baseobject.cli.model.InspectOptions;
import com.baseobject.cli.model.ValidatedInspectOptions;

public class InspectOptionsValidator {

	public ValidatedInspectOptions validate(InspectOptions o) {
		List<String> errors = new ArrayList<>();

		boolean hasFile = o.getFile() != null;
		boolean hasJson = o.getJson() != null;

		if (!hasFile && !hasJson) {
			errors.add("Either --file or --json must be provided.");
		}
		if (hasFile && hasJson) {
			errors.add("Only one of --file or --json may be provided.");
		}

		String jsonText = null;
		String source = null;
		if (hasJson && !hasFile) {
			if (isBlank(o.getJson())) {
				errors.add("Inline JSON must not be blank (--json / -j).");
			}
			jsonText = o.getJson();
			source = "inline";
		} else if (hasFile && !hasJson) {
			if (!existsFile(o.getFile())) {
				errors.add("Input file does not exist or is not a regular file: " + o.getFile());
			} else {
				jsonText = read(o.getFile(), errors);
				source = o.getFile().toAbsolutePath().normalize().toString();
			}
		}

		Set<String> excluded = new LinkedHashSet<>();
		for (String name : o.getExclude()) {
			if (isBlank(name)) {
				errors.add("Excluded field names must not be blank (--exclude / -x).");
			} else {
				excluded.add(name.trim());
			}
		}

		if (o.getSort() == null) {
			errors.add("Sort order is required (--sort / -s).");
		}
		if (o.getLogLevel() == null) {
			errors.add("Log level is required (--log-level / -l).");
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException("inspect", errors);
		}

		return new ValidatedInspectOptions(jsonText, source, excluded);
	}

	private static String read(Path file, List<String> errors) {
		try {
			return Files.readString(file, StandardCharsets.UTF_8);
		} catch (IOException e) {
			errors.add("Input file cannot be read: " + file + " (" + e.getMessage() + ")");
			return null;
		}
	}

	private static boolean existsFile(Path p) {
		return p != null && Files.exists(p) && Files.isRegularFile(p);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
