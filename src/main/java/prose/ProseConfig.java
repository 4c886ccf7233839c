package prose;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Settings read once from the environment.
 */
public final class ProseConfig {
	private static final Logger LOGGER = Logger.getLogger(ProseConfig.class.getName());

	private ProseConfig() {
	}

	/**
	 * Interpreter used to run generated code.
	 * Environment variable: PROSE_PYTHON
	 */
	public static final String PYTHON_COMMAND = getEnvOrDefault("PROSE_PYTHON", "python3");

	/**
	 * Wall-clock limit for one execution, in milliseconds.
	 * Environment variable: PROSE_EXEC_TIMEOUT_MS
	 */
	public static final long EXEC_TIMEOUT_MS = getLongOrDefault("PROSE_EXEC_TIMEOUT_MS", 30_000L, Long.MAX_VALUE);

	/**
	 * Longest accepted input block, in characters.
	 * Environment variable: PROSE_MAX_INPUT_LENGTH
	 */
	public static final int MAX_INPUT_LENGTH = (int) getLongOrDefault("PROSE_MAX_INPUT_LENGTH", 1000L,
			Integer.MAX_VALUE);

	/**
	 * Per-statement tracing on the console.
	 * Environment variable: PROSE_DEBUG
	 */
	public static final boolean DEBUG = System.getenv("PROSE_DEBUG") != null;

	private static String getEnvOrDefault(String key, String defaultValue) {
		String value = System.getenv(key);
		return value != null && !value.isBlank() ? value : defaultValue;
	}

	private static long getLongOrDefault(String key, long defaultValue, long max) {
		return parsePositive(key, System.getenv(key), defaultValue, max);
	}

	/**
	 * @return {@code value} as a number in {@code 1..max}, or {@code defaultValue}
	 *         when it is absent or out of range
	 */
	static long parsePositive(String key, String value, long defaultValue, long max) {
		if (value == null || value.isBlank()) {
			return defaultValue;
		}
		try {
			long parsed = Long.parseLong(value.strip());
			if (parsed > 0 && parsed <= max) {
				return parsed;
			}
			LOGGER.log(Level.WARNING, "Ignoring {0}={1}: expected an integer between 1 and {2}, using {3}",
					new Object[] { key, value, max, defaultValue });
		} catch (NumberFormatException e) {
			LOGGER.log(Level.WARNING, "Ignoring {0}={1}: not a number, using {2}",
					new Object[] { key, value, defaultValue });
		}
		return defaultValue;
	}
}
