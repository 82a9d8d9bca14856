package works.pylit.codec.io;

import com.ibm.icu.lang.UCharacter;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.nio.charset.StandardCharsets.US_ASCII;

/**
 * Resolves the names a <code>\N{NAME}</code> escape accepts:
 * character names (including the algorithmic {@code CJK UNIFIED IDEOGRAPH-4E2D}
 * and {@code HANGUL SYLLABLE GA} forms) and formal name aliases such as {@code LINE FEED} or {@code NBSP}.
 * <p>
 * Matching ignores case, except in the algorithmic names, which must be upper case.
 */
final class UnicodeNames {
	static final int NOT_FOUND = -1;

	private static final String ALIAS_RESOURCE = "name-aliases.txt";
	private static final String[] CASE_SENSITIVE_PREFIXES = { "CJK UNIFIED IDEOGRAPH-", "HANGUL SYLLABLE " };

	private UnicodeNames() { }

	/**
	 * @return the code point, or {@link #NOT_FOUND}
	 */
	static int lookup(String name) {
		if (!isWellFormed(name)) {
			return NOT_FOUND;
		}
		String upper = name.toUpperCase(Locale.ROOT);
		if (!upper.equals(name)) {
			for (String prefix : CASE_SENSITIVE_PREFIXES) {
				if (upper.startsWith(prefix)) {
					return NOT_FOUND;
				}
			}
		}
		Integer alias = AliasHolder.ALIASES.get(upper);
		if (alias != null) {
			return alias;
		}
		int result = UCharacter.getCharFromName(upper);
		if (result == NOT_FOUND) {
			// Corrections like LATIN CAPITAL LETTER GHA
			result = UCharacter.getCharFromNameAlias(upper);
		}
		return result;
	}

	/**
	 * Names are words of letters, digits and hyphens separated by single spaces.
	 */
	static boolean isWellFormed(String name) {
		if (name.isEmpty() || name.charAt(0) == ' ' || name.charAt(name.length() - 1) == ' ') {
			return false;
		}
		char previous = 0;
		for (int i = 0; i < name.length(); i++) {
			char c = name.charAt(i);
			boolean allowed = ('A' <= c && c <= 'Z')
				|| ('a' <= c && c <= 'z')
				|| Util.isDecimalDigit(c)
				|| c == '-'
				|| (c == ' ' && previous != ' ');
			if (!allowed) {
				return false;
			}
			previous = c;
		}
		return true;
	}

	private static final class AliasHolder {
		static final Map<String, Integer> ALIASES = loadAliases();
	}

	private static Map<String, Integer> loadAliases() {
		InputStream stream = UnicodeNames.class.getResourceAsStream(ALIAS_RESOURCE);
		if (stream == null) {
			throw new IllegalStateException("Missing resource " + ALIAS_RESOURCE);
		}
		Map<String, Integer> result = new HashMap<>();
		try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, US_ASCII))) {
			String line;
			while ((line = reader.readLine()) != null) {
				if (line.isBlank() || line.startsWith("#")) {
					continue;
				}
				int semicolon = line.indexOf(';');
				if (semicolon < 0) {
					throw new IllegalStateException("Malformed line in " + ALIAS_RESOURCE + ": " + line);
				}
				result.put(line.substring(0, semicolon), Integer.parseInt(line.substring(semicolon + 1), 16));
			}
		} catch (IOException e) {
			throw new UncheckedIOException("Unable to read " + ALIAS_RESOURCE, e);
		}
		LOGGER.debug("Loaded {} Unicode name aliases", result.size());
		return Map.copyOf(result);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(UnicodeNames.class);
}
