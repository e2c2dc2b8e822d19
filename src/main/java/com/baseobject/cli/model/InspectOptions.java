package com.baseobject.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.baseobject.cli.logging.LogLevel;
import com.baseobject.core.SortOrder;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "inspect" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class InspectOptions {

	@Option(names = { "--file", "-f" }, description = "JSON file holding the record's fields")
	private Path file;

	@Option(names = { "--json", "-j" }, description = "Inline JSON object holding the record's fields")
	private String json;

	@Option(names = { "--immutable", "-i" }, description = "Build an immutable record and report its locks")
	private boolean immutable;

	@Option(names = { "--exclude", "-x" }, split = ",", description = "Field names left out of the output (comma-separated)")
	private List<String> exclude = new ArrayList<>();

	@Option(names = { "--sort", "-s" }, defaultValue = "NONE", description = "Field order: NONE, ASCENDING or DESCENDING")
	private SortOrder sort;

	@Option(names = { "--indent" }, description = "Pretty-print the JSON output")
	private boolean indent;

	@Option(names = { "--log-level", "-l" }, defaultValue = "INFO", description = "CRITICAL, ERROR, WARNING, INFO, DEBUG or SILENT")
	private LogLevel logLevel;

	@Option(names = { "--summary" }, description = "Log field names, value types and lock states")
	private boolean summary;
}
