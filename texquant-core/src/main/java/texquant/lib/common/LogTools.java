/*-
 * #%L
 * This file is part of TexQuant.
 * %%
 * Copyright (C) 2014 - 2016 The Queen's University of Belfast, Northern Ireland
 * Contact: IP Management (ipmanagement@qub.ac.uk)
 * Copyright (C) 2018 - 2020 QuPath developers, The University of Edinburgh
 * Copyright (C) 2024 TexQuant developers
 * %%
 * TexQuant is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * TexQuant is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with TexQuant.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package texquant.lib.common;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.event.Level;

/**
 * Helper class for logging.
 *
 * @author Pete Bankhead
 */
public class LogTools {

	private static Map<Logger, Map<Level, Set<String>>> alreadyLogged = new ConcurrentHashMap<>();

	/**
	 * Log a message once at the specified level.
	 * <p>
	 * This is intended for warnings that would otherwise be emitted for every pixel or every call,
	 * e.g. when a calculation produces non-finite values.
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
