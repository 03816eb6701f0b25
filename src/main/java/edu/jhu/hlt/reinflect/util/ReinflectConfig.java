// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.reinflect.util;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.util.Properties;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Charsets;
import com.google.common.io.Files;

/**
 * A utility wrapper around {@code java.util.Properties}, supporting type specific querying
 * on property values, and throwing Exception when properties are not found in cases with no
 * default value.
 * <p>
 * Uses System level properties if they exist, then checks the property file that was loaded
 * into this object as backup (so command line specified properties can supersede a
 * configuration file). The file is named by the {@code config.filename} system property.
 * <p>
 * Values may reference other properties, meant for things like setting a root directory just
 * once, and making other values relative to that. Syntax is: (via example)
 * <p>
 * ROOT = /home/joe/project Data = {ROOT}/data
 */
public class ReinflectConfig {

	public final static String CONFIG_FILENAME = "config.filename";

	// aligner (EM over the pair covering grammar)
	public final static String ALIGNER_MAX_SOURCE_LENGTH = "aligner.maxSourceLength";
	public final static String ALIGNER_MAX_TARGET_LENGTH = "aligner.maxTargetLength";
	public final static String ALIGNER_SOURCE_EPSILON = "aligner.sourceEpsilon";
	public final static String ALIGNER_TARGET_EPSILON = "aligner.targetEpsilon";
	public final static String ALIGNER_RANDOM_STARTS = "aligner.randomStarts";
	public final static String ALIGNER_SEED = "aligner.seed";
	public final static String ALIGNER_MAX_ITERATIONS = "aligner.maxIterations";
	public final static String ALIGNER_DELTA = "aligner.delta";
	public final static String ALIGNER_MAX_FAILURE_FRACTION = "aligner.maxFailureFraction";
	public final static String ALIGNER_THREADS = "aligner.threads";

	// pair n-gram model
	public final static String NGRAM_ORDER = "ngram.order";
	public final static String NGRAM_DISCOUNT = "ngram.discount";

	// decoder
	public final static String DECODER_MAX_INSERTIONS = "decoder.maxInsertions";
	public final static String DECODER_THREADS = "decoder.threads";

	private static final Logger logger = Logger.getLogger(ReinflectConfig.class.getName());

	static Properties properties;
	static boolean isLoaded = false;
	static String propertiesFileName = null;

	static Pattern variablePattern = Pattern.compile("\\{[^\\\\}]+\\}");

	public static String getPropertiesFileName() {
		return propertiesFileName;
	}

	private static String parsePropertyValue(String value) throws IOException {
		String group, replacement;
		Matcher m = variablePattern.matcher(value);
		StringBuffer sb = new StringBuffer();
		while (m.find()) {
			group = m.group();
			group = group.substring(1, group.length() - 1);
			replacement = ReinflectConfig.getString(group, null);
			if (replacement != null)
				m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
			else {
				logger.warning("Cannot parse property [" + value + "], as [" + group + "] does not resolve");
				return null;
			}
		}
		m.appendTail(sb);
		return sb.toString();
	}

	public static void load() throws IOException {
		String filename = System.getProperty(CONFIG_FILENAME);
		if (filename != null) {
			logger.info("Loading properties file: " + filename);
			load(filename);
		}
	}

	public static void load(String filename) throws IOException {
		logger.config("Reading property file [" + filename + "]");
		if (properties == null) properties = new Properties();
		try (Reader reader = Files.newReader(new File(filename), Charsets.UTF_8)) {
			properties.load(reader);
		}
		isLoaded = true;
		propertiesFileName = filename;
	}

	/**
	 * System property first, then the loaded file; null if neither has the key.
	 */
	private static String rawValue(String key) throws IOException {
		if (!isLoaded) load();

		String value = System.getProperty(key);
		if (value == null && properties != null) value = properties.getProperty(key);
		return value;
	}

	private static String required(String key) throws IOException {
		String value = rawValue(key);
		if (value == null)
			throw new IOException("Key not found in property specification: [" + key + "]");
		if ((value = parsePropertyValue(value)) == null)
			throw new IOException("Key not resolvable in property specification: [" + key + "]");
		return value;
	}

	private static String optional(String key, Object defaultValue) throws IOException {
		String value = rawValue(key);
		if (value == null) {
			logger.config("Returning default value for " + key + " : " + defaultValue);
			return null;
		}
		if ((value = parsePropertyValue(value)) == null) {
			logger.config("Key not fully resolvable, returning default value for " + key + " : "
					+ defaultValue);
			return null;
		}
		logger.config("Returning value for " + key + " : " + value);
		return value;
	}

	public static double getDouble(String key) throws IOException {
		return Double.parseDouble(required(key));
	}

	public static double getDouble(String key, double defaultValue) throws IOException {
		String value = optional(key, defaultValue);
		return value == null ? defaultValue : Double.parseDouble(value.trim());
	}

	public static long getLong(String key) throws IOException {
		return Long.parseLong(required(key).trim());
	}

	public static long getLong(String key, long defaultValue) throws IOException {
		String value = optional(key, defaultValue);
		return value == null ? defaultValue : Long.parseLong(value.trim());
	}

	public static int getInt(String key) throws IOException {
		return Integer.parseInt(required(key).trim());
	}

	public static int getInt(String key, int defaultValue) throws IOException {
		String value = optional(key, defaultValue);
		return value == null ? defaultValue : Integer.parseInt(value.trim());
	}

	public static String getString(String key) throws IOException {
		return required(key);
	}

	public static String getString(String key, String defaultValue) throws IOException {
		String value = optional(key, defaultValue);
		return value == null ? defaultValue : value;
	}

	public static boolean getBoolean(String key) throws IOException {
		return Boolean.valueOf(required(key).trim());
	}

	public static boolean getBoolean(String key, boolean defaultValue) throws IOException {
		String value = optional(key, defaultValue);
		return value == null ? defaultValue : Boolean.valueOf(value.trim());
	}
}
