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

package dcm2png.lib.common;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.event.Level;

/**
 * Helper class for logging.
 */
public class LogTools {

	private static Map<Logger, Map<Level, Set<String>>> alreadyLogged = new ConcurrentHashMap<>();

	private LogTools() {
		throw new AssertionError();
	}

	/**
	 * Log a message once at the specified level.
	 * <p>
	 * This is intended for warnings that apply to many images in a batch (e.g. an unsupported
	 * header value), so that the log is not flooded with identical messages.
	 *
	 * @param logger
	 * @param level
	 * @param message
	 * @return true if the message was logged, false otherwise (i.e. it has already been logged)
	 */
	public static boolean logOnce(Logger logger, Level level, String message) {
		var map = alreadyLogged.computeIfAbsent(logger, l -> new ConcurrentHashMap<>());
		var set = map.computeIfAbsent(level, l -> ConcurrentHashMap.newKeySet());
		if (set.add(message)) {
			logger.atLevel(level).log(message);
			return true;
		}
		return false;
	}

	/**
	 * Log a message once at the WARN level.
	 *
	 * @param logger
	 * @param message
	 * @return true if the message was logged, false otherwise (i.e. it has already been logged)
	 */
	public static boolean warnOnce(Logger logger, String message) {
		return logOnce(logger, Level.WARN, message);
	}

}
