package lltools;

import java.io.*;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Global settings of the grammar tools.
 *
 * Defaults are overridden by <pre>key = value</pre> lines in {@value #configFile} (working directory)
 * and then by <pre>lltools.key</pre> system properties.
 */
public class Config {

	public static final String configFile = "lltools.ini";

	private static final Logger LOG = Logger.getLogger("Config");

	private static final Map<String, String> config = new HashMap<String, String>(){{
		put("epsilon", "ε");
		put("endMarker", "$");
		put("primeMark", "'");
		put("maxFactoringPasses", "10000");
		put("warnImplicitTerminals", "yes");
	}};

	/** Name of the epsilon symbol */
	public static String epsilon(){
		return config.get("epsilon");
	}

	/** Name of the end of input terminal used in follow sets */
	public static String endMarker(){
		return config.get("endMarker");
	}

	/** Suffix appended to a non terminal name to create a new non terminal */
	public static String primeMark(){
		return config.get("primeMark");
	}

	/** Maximum number of rescans of the left factoring before giving up */
	public static int maxFactoringPasses(){
		return Integer.parseInt(config.get("maxFactoringPasses"));
	}

	/** Log a warning for symbols that are treated as terminals without being declared? */
	public static boolean warnImplicitTerminals(){
		return config.get("warnImplicitTerminals").equals("yes");
	}

	/**
	 * Sets the value if it is valid for the key, invalid values are reported and ignored
	 */
	private static void set(String key, String value){
		if (isValid(key, value)){
			config.put(key, value);
		} else {
			System.err.println("Invalid value \"" + value + "\" for config key \"" + key + "\"");
		}
	}

	private static boolean isValid(String key, String value){
		switch (key){
			case "maxFactoringPasses":
				try {
					return Integer.parseInt(value) > 0;
				} catch (NumberFormatException e) {
					return false;
				}
			case "warnImplicitTerminals":
				return value.equals("yes") || value.equals("no");
			default:
				return !value.isEmpty() && !value.contains(" ");
		}
	}

	static void loadConfig(File file){
		if (!file.exists()){
			return;
		}
		try (BufferedReader reader = new BufferedReader(new InputStreamReader(new FileInputStream(file), "UTF-8"))) {
			String line;
			while ((line = reader.readLine()) != null){
				if (line.contains(" = ")){
					String[] parts = line.split(" = ", 2);
					if (config.containsKey(parts[0].trim())){
						set(parts[0].trim(), parts[1].trim());
					} else {
						System.err.println("Unknown config key \"" + parts[0] + "\"");
					}
				}
			}
		} catch (IOException e) {
			LOG.log(Level.WARNING, "Can't read " + file, e);
		}
	}

	private static void loadSystemProperties(){
		for (String key : new ArrayList<>(config.keySet())){
			String value = System.getProperty("lltools." + key);
			if (value != null){
				set(key, value);
			}
		}
	}

	static {
		loadConfig(new File(configFile));
		loadSystemProperties();
	}
}
