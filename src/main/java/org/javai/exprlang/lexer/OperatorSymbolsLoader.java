package org.javai.exprlang.lexer;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads {@link OperatorSymbols} from YAML.
 * <p>
 * The document has one optional mapping per table ({@code prefix}, {@code modifier},
 * {@code logical}, {@code comparator}, {@code ternary}), each mapping symbol text to
 * the name of an {@link Operator}. A missing table is empty.
 */
public class OperatorSymbolsLoader {

	private static final Logger logger = LoggerFactory.getLogger(OperatorSymbolsLoader.class);

	static final String DEFAULT_RESOURCE = "META-INF/exprlang-operators.yml";

	private final Yaml yaml = new Yaml();

	/**
	 * Load the tables bundled with this library.
	 */
	public OperatorSymbols loadDefault() {
		return loadResource(DEFAULT_RESOURCE, OperatorSymbolsLoader.class.getClassLoader());
	}

	/**
	 * Load operator tables from a classpath resource.
	 */
	public OperatorSymbols loadResource(String resourceName, ClassLoader loader) {
		try (InputStream stream = loader.getResourceAsStream(resourceName)) {
			if (stream == null) {
				throw new IllegalStateException("Operator table resource not found: " + resourceName);
			}
			OperatorSymbols symbols = parse(stream);
			logger.debug("Loaded operator tables from '{}'", resourceName);
			return symbols;
		} catch (IOException e) {
			throw new IllegalStateException("Failed to read operator table resource: " + resourceName, e);
		}
	}

	/**
	 * Load operator tables from a file.
	 */
	public OperatorSymbols parse(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return parse(reader);
		} catch (IOException e) {
			throw new IllegalStateException("Failed to read operator tables from path: " + path, e);
		}
	}

	public OperatorSymbols parse(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream));
		} catch (IllegalStateException e) {
			throw e;
		} catch (RuntimeException e) {
			throw new IllegalStateException("Failed to parse operator tables from input stream", e);
		}
	}

	public OperatorSymbols parse(Reader reader) {
		try {
			return build(yaml.load(reader));
		} catch (IllegalStateException e) {
			throw e;
		} catch (RuntimeException e) {
			throw new IllegalStateException("Failed to parse operator tables from reader", e);
		}
	}

	public OperatorSymbols parseString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent));
		} catch (IllegalStateException e) {
			throw e;
		} catch (RuntimeException e) {
			throw new IllegalStateException("Failed to parse operator tables from string", e);
		}
	}

	private OperatorSymbols build(Object document) {
		if (document == null) {
			return new OperatorSymbols(Map.of(), Map.of(), Map.of(), Map.of(), Map.of());
		}
		if (!(document instanceof Map<?, ?> data)) {
			throw new IllegalStateException("Operator tables must be a YAML mapping, found "
					+ document.getClass().getSimpleName());
		}
		return new OperatorSymbols(
			buildTable("prefix", data.get("prefix")),
			buildTable("modifier", data.get("modifier")),
			buildTable("logical", data.get("logical")),
			buildTable("comparator", data.get("comparator")),
			buildTable("ternary", data.get("ternary"))
		);
	}

	private Map<String, Operator> buildTable(String tableName, Object section) {
		if (section == null) {
			return Map.of();
		}
		if (!(section instanceof Map<?, ?> entries)) {
			throw new IllegalStateException("Operator table '" + tableName + "' must be a mapping");
		}
		Map<String, Operator> table = new LinkedHashMap<>();
		for (Map.Entry<?, ?> entry : entries.entrySet()) {
			String symbol = String.valueOf(entry.getKey());
			if (symbol.isBlank()) {
				throw new IllegalStateException("Operator table '" + tableName + "' contains a blank symbol");
			}
			table.put(symbol, operatorNamed(tableName, symbol, entry.getValue()));
		}
		return table;
	}

	private Operator operatorNamed(String tableName, String symbol, Object name) {
		try {
			return Operator.valueOf(String.valueOf(name));
		} catch (IllegalArgumentException e) {
			throw new IllegalStateException("Unknown operator '" + name + "' for symbol '" + symbol
					+ "' in table '" + tableName + "'", e);
		}
	}
}
