package com.baseobject.cli.logging;

import ch.qos.logback.classic.Level;

/**
 * Verbosity levels accepted by the command line, mapped onto Logback levels.
 */
public enum LogLevel {

	CRITICAL(Level.ERROR),
	ERROR(Level.ERROR),
	WARNING(Level.WARN),
	INFO(Level.INFO),
	DEBUG(Level.DEBUG),
	SILENT(Level.OFF);

	private final Level logbackLevel;

	LogLevel(Level logbackLevel) {
		this.logbackLevel = logbackLevel;
	}

	public Level getLogbackLevel() {
		return logbackLevel;
	}
}
