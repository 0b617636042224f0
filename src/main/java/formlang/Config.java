package formlang;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Global settings of the library.
 *
 * The defaults can be overridden in a <code>formlang.ini</code> file (lines of the form <code>key = value</code>),
 * found either in the working directory or on the class path, and by system properties named
 * <code>formlang.key</code>.
 */
public class Config {

	private static final Logger LOG = Logger.getLogger(Config.class.getName());

	public static final String configFile = "formlang.ini";

	private static final Map<String, String> config = new HashMap<String, String>(){{
		put("ruleOrdering", "EDGES_REVERSE");
		put("ruleOrderingSeed", "42");
		put("recursiveDescentMaxDepth", "1000");
		put("logLevel", "INFO");
	}};

	/**
	 * Name of the default rule ordering strategy used by the indexed grammar marking
	 */
	public static String getRuleOrdering(){
		return get("ruleOrdering");
	}

	/**
	 * Seed of the random rule ordering
	 */
	public static long getRuleOrderingSeed(){
		return Long.parseLong(get("ruleOrderingSeed"));
	}

	/**
	 * Maximum number of nested expansions the recursive descent parser performs before giving up
	 */
	public static int getRecursiveDescentMaxDepth(){
		return Integer.parseInt(get("recursiveDescentMaxDepth"));
	}

	public static Level getLogLevel(){
		return Level.parse(get("logLevel"));
	}

	/**
	 * Overrides a config value at runtime.
	 *
	 * @throws IllegalArgumentException if the key is unknown
	 */
	public static void set(String key, String value){
		if (!config.containsKey(key)){
			throw new IllegalArgumentException(String.format("Unknown config key \"%s\"", key));
		}
		config.put(key, value);
	}

	public static String get(String key){
		String property = System.getProperty("formlang." + key);
		if (property != null){
			return property;
		}
		if (!config.containsKey(key)){
			throw new IllegalArgumentException(String.format("Unknown config key \"%s\"", key));
		}
		return config.get(key);
	}

	private static void loadConfig(Reader source) throws IOException {
		try (BufferedReader reader = new BufferedReader(source)) {
			String line;
			while ((line = reader.readLine()) != null){
				if (line.contains(" = ")){
					String[] parts = line.split(" = ", 2);
					String key = parts[0].trim();
					if (config.containsKey(key)){
						config.put(key, parts[1].trim());
					} else {
						LOG.warning(String.format("Unknown config key \"%s\"", key));
					}
				}
			}
		}
	}

	private static void loadConfig(){
		try {
			InputStream resource = Config.class.getClassLoader().getResourceAsStream(configFile);
			if (resource != null){
				loadConfig(new InputStreamReader(resource, StandardCharsets.UTF_8));
			}
			File file = new File(configFile);
			if (file.exists()){
				loadConfig(new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8));
			}
		} catch (IOException e) {
			LOG.log(Level.WARNING, "Can't read " + configFile, e);
		}
		Logger.getLogger("formlang").setLevel(getLogLevel());
	}

	static {
		loadConfig();
	}
}
