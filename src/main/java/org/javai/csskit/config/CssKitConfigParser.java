package org.javai.csskit.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import org.javai.csskit.CssKitException;
import org.javai.csskit.automaton.MinimizerOptions;
import org.javai.csskit.parser.ParserOptions;
import org.javai.csskit.tokenizer.TokenizerOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads a {@link CssKitConfig} from YAML.
 * <p>
 * The document has up to three sections, {@code tokenizer}, {@code parser}
 * and {@code minimizer}, each a map of kebab-case switches:
 *
 * <pre>
 * tokenizer:
 *   preserve-whitespace: false
 *   preserve-comments: true
 *   recognize-colors: true
 *   recognize-functions: true
 * parser:
 *   error-recovery: true
 *   state-minimization: true
 *   ast-optimization: false
 *   preserve-comments: false
 *   parse-nested-rules: true
 * minimizer:
 *   remove-unreachable-states: false
 *   stamp-metadata: true
 * </pre>
 *
 * Missing switches keep their defaults. Unknown keys are logged and ignored.
 */
public class CssKitConfigParser {

	private static final Logger logger = LoggerFactory.getLogger(CssKitConfigParser.class);

	/** Classpath location of the bundled defaults. */
	public static final String DEFAULTS_RESOURCE = "META-INF/csskit-defaults.yml";

	private static final Set<String> SECTIONS = Set.of("tokenizer", "parser", "minimizer");

	private final Yaml yaml = new Yaml();

	public CssKitConfig parse(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return build(yaml.load(reader), "path " + path);
		} catch (IOException | YAMLException e) {
			throw new CssKitException("Failed to load configuration from path: " + path, e);
		}
	}

	public CssKitConfig parse(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream), "input stream");
		} catch (YAMLException e) {
			throw new CssKitException("Failed to load configuration from input stream", e);
		}
	}

	public CssKitConfig parse(Reader reader) {
		try {
			return build(yaml.load(reader), "reader");
		} catch (YAMLException e) {
			throw new CssKitException("Failed to load configuration from reader", e);
		}
	}

	public CssKitConfig parseString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent), "string");
		} catch (YAMLException e) {
			throw new CssKitException("Failed to load configuration from string", e);
		}
	}

	/**
	 * Loads the bundled defaults, or the built-in defaults when the resource is absent.
	 */
	public CssKitConfig loadDefaults() {
		InputStream in = CssKitConfigParser.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE);
		if (in == null) {
			logger.debug("No {} on the classpath; using built-in defaults", DEFAULTS_RESOURCE);
			return CssKitConfig.defaults();
		}
		try (in) {
			return parse(in);
		} catch (IOException e) {
			throw new CssKitException("Failed to close " + DEFAULTS_RESOURCE, e);
		}
	}

	private CssKitConfig build(Object document, String source) {
		if (document == null) {
			logger.debug("Empty configuration from {}; using defaults", source);
			return CssKitConfig.defaults();
		}
		Map<String, Object> data = asMap(document, "configuration root");
		for (String key : data.keySet()) {
			if (!SECTIONS.contains(key)) {
				logger.warn("Ignoring unknown configuration section '{}'", key);
			}
		}

		TokenizerOptions tokenizer = buildTokenizer(section(data, "tokenizer"));
		ParserOptions parser = buildParser(section(data, "parser"), tokenizer);
		MinimizerOptions minimizer = buildMinimizer(section(data, "minimizer"));
		logger.debug("Loaded configuration from {}", source);
		return new CssKitConfig(tokenizer, parser, minimizer);
	}

	private TokenizerOptions buildTokenizer(Map<String, Object> map) {
		warnUnknown("tokenizer", map,
				Set.of("preserve-whitespace", "preserve-comments", "recognize-colors", "recognize-functions"));
		TokenizerOptions defaults = TokenizerOptions.defaults();
		return TokenizerOptions.builder()
				.preserveWhitespace(flag(map, "tokenizer", "preserve-whitespace", defaults.preserveWhitespace()))
				.preserveComments(flag(map, "tokenizer", "preserve-comments", defaults.preserveComments()))
				.recognizeColors(flag(map, "tokenizer", "recognize-colors", defaults.recognizeColors()))
				.recognizeFunctions(flag(map, "tokenizer", "recognize-functions", defaults.recognizeFunctions()))
				.build();
	}

	private ParserOptions buildParser(Map<String, Object> map, TokenizerOptions tokenizer) {
		warnUnknown("parser", map, Set.of("error-recovery", "state-minimization", "ast-optimization",
				"preserve-comments", "parse-nested-rules"));
		ParserOptions defaults = ParserOptions.defaults();
		return ParserOptions.builder()
				.tokenizer(tokenizer)
				.errorRecovery(flag(map, "parser", "error-recovery", defaults.errorRecovery()))
				.stateMinimization(flag(map, "parser", "state-minimization", defaults.stateMinimization()))
				.astOptimization(flag(map, "parser", "ast-optimization", defaults.astOptimization()))
				.preserveComments(flag(map, "parser", "preserve-comments", defaults.preserveComments()))
				.parseNestedRules(flag(map, "parser", "parse-nested-rules", defaults.parseNestedRules()))
				.build();
	}

	private MinimizerOptions buildMinimizer(Map<String, Object> map) {
		warnUnknown("minimizer", map, Set.of("remove-unreachable-states", "stamp-metadata"));
		MinimizerOptions defaults = MinimizerOptions.defaults();
		return MinimizerOptions.builder()
				.removeUnreachableStates(flag(map, "minimizer", "remove-unreachable-states",
						defaults.removeUnreachableStates()))
				.stampMetadata(flag(map, "minimizer", "stamp-metadata", defaults.stampMetadata()))
				.build();
	}

	private static Map<String, Object> section(Map<String, Object> data, String name) {
		Object value = data.get(name);
		return value == null ? Map.of() : asMap(value, "section '" + name + "'");
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> asMap(Object value, String what) {
		if (!(value instanceof Map)) {
			throw new CssKitException("Expected a mapping for " + what + " but found " + describe(value));
		}
		return (Map<String, Object>) value;
	}

	private static void warnUnknown(String section, Map<String, Object> map, Set<String> known) {
		for (String key : map.keySet()) {
			if (!known.contains(key)) {
				logger.warn("Ignoring unknown configuration key '{}.{}'", section, key);
			}
		}
	}

	private static boolean flag(Map<String, Object> map, String section, String key, boolean defaultValue) {
		Object value = map.get(key);
		if (value == null) {
			return defaultValue;
		}
		if (value instanceof Boolean b) {
			return b;
		}
		throw new CssKitException("Expected true or false for '" + section + "." + key + "' but found "
				+ describe(value));
	}

	private static String describe(Object value) {
		return value == null ? "nothing" : value.getClass().getSimpleName() + " '" + value + "'";
	}
}
