package com.baseobject.cli.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.experimental.UtilityClass;

/**
 * Applies a {@link LogLevel} to every logger of the application.
 */
@UtilityClass
public class LoggingConfigurer {

	public final String ROOT_LOGGER = "com.baseobject";

	public void apply(LogLevel level) {
		Logger logger = LoggerFactory.getLogger(ROOT_LOGGER);
		if (logger instanceof ch.qos.logback.classic.Logger logback) {
			logback.setLevel(level.getLogbackLevel());
		} else {
			logger.warn("Logging backend {} does not support level changes", logger.getClass().getName());
		}
	}

	/**
	 * Current level of the application loggers, or null when it is inherited.
	 */
	public ch.qos.logback.classic.Level currentLevel() {
		Logger logger = LoggerFactory.getLogger(ROOT_LOGGER);
		if (logger instanceof ch.qos.logback.classic.Logger logback) {
			return logback.getLevel();
		}
		return null;
	}

	/**
	 * Drops an explicit level so the configured one applies again.
	 */
	public void reset() {
		Logger logger = LoggerFactory.getLogger(ROOT_LOGGER);
		if (logger instanceof ch.qos.logback.classic.Logger logback) {
			logback.setLevel(null);
		}
	}
}
