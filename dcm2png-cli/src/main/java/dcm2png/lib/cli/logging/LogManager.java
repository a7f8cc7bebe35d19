/*-
 * #%L
 * This file is part of dcm2png.
 * %%
 * Copyright (C) 2024 dcm2png developers
 * %%
 * dcm2png is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * dcm2png is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with dcm2png.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package dcm2png.lib.cli.logging;

import java.io.File;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;

/**
 * Manage logging levels.
 * <p>
 * This requires Logback as the SLF4J backend; if another backend is bound, requests are logged and ignored.
 */
public class LogManager {

	private static final Logger logger = LoggerFactory.getLogger(LogManager.class);

	/**
	 * Available log levels.
	 */
	public static enum LogLevel {
		/**
		 * Trace logging (an awful lot of messages)
		 */
		TRACE,
		/**
		 * Debug logging (a lot of messages)
		 */
		DEBUG,
		/**
		 * Info logging (default)
		 */
		INFO,
		/**
		 * Warn logging (only if something is moderately important)
		 */
		WARN,
		/**
		 * Error logging (only if something goes recognizably wrong)
		 */
		ERROR,
		/**
		 * All log messages
		 */
		ALL,
		/**
		 * Turn off logging
		 */
		OFF;
	}

	private static LogLevel logLevel = LogLevel.INFO;

	private LogManager() {
		throw new AssertionError();
	}

	/**
	 * Set the minimum level of messages logged by the root logger.
	 * @param level
	 */
	public static synchronized void setRootLogLevel(LogLevel level) {
		var root = getRootLogger();
		if (root == null) {
			logger.warn("Cannot set log level to {} without logback!", level);
			return;
		}
		root.setLevel(getLevel(level));
		logLevel = level;
	}

	/**
	 * Get the root log level, as last set with {@link #setRootLogLevel(LogLevel)}.
	 * @return
	 */
	public static synchronized LogLevel getRootLogLevel() {
		return logLevel;
	}

	/**
	 * Request logging to the specified file, in addition to the console.
	 * @param file
	 */
	public static void logToFile(File file) {
		var context = getLoggerContext();
		if (context == null) {
			logger.warn("Cannot log to file without logback!");
			return;
		}
		FileAppender<ILoggingEvent> appender = new FileAppender<>();

		PatternLayoutEncoder encoder = new PatternLayoutEncoder();
		encoder.setContext(context);
		encoder.setPattern("%d{HH:mm:ss.SSS} [%thread] [%-5level] %logger{36} - %msg%n");
		encoder.start();

		appender.setFile(file.getAbsolutePath());
		appender.setContext(context);
		appender.setEncoder(encoder);
		appender.setName(file.getName());
		appender.start();
		context.getLogger(Logger.ROOT_LOGGER_NAME).addAppender(appender);
		logger.debug("Logging to {}", file);
	}

	static Level getLevel(LogLevel level) {
		switch (level) {
		case ALL:
			return Level.ALL;
		case DEBUG:
			return Level.DEBUG;
		case ERROR:
			return Level.ERROR;
		case OFF:
			return Level.OFF;
		case TRACE:
			return Level.TRACE;
		case WARN:
			return Level.WARN;
		case INFO:
		default:
			return Level.INFO;
		}
	}

	static LoggerContext getLoggerContext() {
		if (LoggerFactory.getILoggerFactory() instanceof LoggerContext)
			return (LoggerContext)LoggerFactory.getILoggerFactory();
		return null;
	}

	static ch.qos.logback.classic.Logger getRootLogger() {
		var context = getLoggerContext();
		return context == null ? null : context.getLogger(Logger.ROOT_LOGGER_NAME);
	}

}
