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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import dcm2png.lib.cli.logging.LogManager.LogLevel;

@SuppressWarnings("javadoc")
public class TestLogManager {

	@AfterEach
	public void resetLevel() {
		LogManager.setRootLogLevel(LogLevel.INFO);
	}

	@Test
	public void test_setRootLevel() {
		assertNotNull(LogManager.getRootLogger());
		LogManager.setRootLogLevel(LogLevel.DEBUG);
		assertEquals(LogLevel.DEBUG, LogManager.getRootLogLevel());
		assertEquals(Level.DEBUG, LogManager.getRootLogger().getLevel());
		assertTrue(LoggerFactory.getLogger(TestLogManager.class).isDebugEnabled());

		LogManager.setRootLogLevel(LogLevel.WARN);
		assertFalse(LoggerFactory.getLogger(TestLogManager.class).isInfoEnabled());
	}

	@Test
	public void test_levels() {
		for (var level : LogLevel.values())
			assertEquals(level.name(), LogManager.getLevel(level).toString());
	}

	@Test
	public void test_logToFile(@TempDir Path dir) throws IOException {
		var file = dir.resolve("log.txt");
		LogManager.logToFile(file.toFile());
		LoggerFactory.getLogger(TestLogManager.class).warn("This warning is expected");
		assertTrue(Files.readString(file).contains("This warning is expected"));
		var root = LogManager.getRootLogger();
		var appender = root.getAppender(file.getFileName().toString());
		root.detachAppender(appender);
		appender.stop();
	}

}
