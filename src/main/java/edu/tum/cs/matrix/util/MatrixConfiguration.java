package edu.tum.cs.matrix.util;

import java.io.FileReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Library settings, read from the file named by the system property <code>edu.tum.cs.matrix.config</code> or, if
 * that is not set, from the classpath resource <code>/matrix.properties</code>. Local properties are prefixed with
 * the simple name of the class they belong to.
 */
public class MatrixConfiguration extends Properties {

	private static final long serialVersionUID = 2290148837015962104L;
	private static final Logger logger = Logger.getLogger(MatrixConfiguration.class.getName());

	public static final String CONFIG_FILE_PROPERTY = "edu.tum.cs.matrix.config";
	private static final String defaultResource = "/matrix.properties";

	private final String root;

	public MatrixConfiguration(Class<?> cls) {
		try {
			String configFileName = System.getProperty(CONFIG_FILE_PROPERTY);
			if (configFileName != null) {
				Reader reader = new FileReader(configFileName);
				try {
					load(reader);
				} finally {
					reader.close();
				}
				logger.config("loaded configuration from " + configFileName);
			} else {
				InputStream in = MatrixConfiguration.class.getResourceAsStream(defaultResource);
				if (in != null) {
					try {
						load(in);
					} finally {
						in.close();
					}
					logger.config("loaded configuration from classpath resource " + defaultResource);
				} else {
					logger.config("no configuration found, using defaults");
				}
			}
		} catch (IOException ex) {
			throw new RuntimeException("error reading configuration", ex);
		}
		root = cls.getSimpleName();
	}

	/**
	 * Creates a configuration from explicitly given properties, including their defaults, without reading any file.
	 */
	public MatrixConfiguration(Class<?> cls, Properties properties) {
		for (String key : properties.stringPropertyNames())
			setProperty(key, properties.getProperty(key));
		root = cls.getSimpleName();
	}

	private String makeGlobal(String key) {
		return root + "." + key;
	}

	@Override
	public String getProperty(String key, String defaultValue) {
		String value = super.getProperty(key);
		if (value == null) {
			value = defaultValue;
			if (value == null)
				throw new RuntimeException("required property '" + key + "' not specified");
		}
		return value;
	}

	public String getLocalProperty(String key, String defaultValue) {
		return getProperty(makeGlobal(key), defaultValue);
	}

	public String getLocalProperty(String key) {
		return getLocalProperty(key, null);
	}

	public boolean getBooleanProperty(String key, Boolean defaultValue) {
		String rawValue = getProperty(key, (defaultValue != null) ? defaultValue.toString() : null);
		return Boolean.parseBoolean(rawValue);
	}

	public boolean getLocalBooleanProperty(String key, Boolean defaultValue) {
		return getBooleanProperty(makeGlobal(key), defaultValue);
	}

}
