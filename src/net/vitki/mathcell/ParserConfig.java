package net.vitki.mathcell;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * The two numbers the parser takes from the configuration:
 * how many digits of a number are shown and how long an expression
 * may be before it is not parsed at all.
 * <p>
 * Defaults come from <code>mathcell.properties</code> next to this class.
 *
 * @author vit
 *
 */
public class ParserConfig
{
	public static final String DEFAULTS_RESOURCE = "mathcell.properties";
	public static final String KEY_DISPLAYED_DIGITS = "displayedDigits";
	public static final String KEY_SHOW_LENGTH = "showLength";

	public static final int MIN_DISPLAYED_DIGITS = 10;
	public static final int DEFAULT_DISPLAYED_DIGITS = 100;
	public static final int UNLIMITED = 0;

	private static final int[] length_cutoffs = { 50000, 500000, 5000000, UNLIMITED };

	private int displayed_digits;
	private int show_length;

	public ParserConfig() {
		displayed_digits = DEFAULT_DISPLAYED_DIGITS;
		show_length = 0;
	}

	public ParserConfig(int displayed_digits, int show_length) {
		setDisplayedDigits(displayed_digits);
		setShowLength(show_length);
	}

	/**
	 * Configuration with the packaged defaults.
	 */
	public static ParserConfig getDefault() throws IOException {
		ParserConfig config = new ParserConfig();
		InputStream is = ParserConfig.class.getResourceAsStream(DEFAULTS_RESOURCE);
		if (is == null)
			throw new IOException("resource "+DEFAULTS_RESOURCE+" not found");
		Properties props = new Properties();
		try {
			props.load(is);
		} finally {
			is.close();
		}
		config.load(props);
		return config;
	}

	/**
	 * Override settings with the keys present in props.
	 */
	public void load (Properties props) {
		String value = props.getProperty(KEY_DISPLAYED_DIGITS);
		if (value != null)
			setDisplayedDigits(parseInt(KEY_DISPLAYED_DIGITS, value));
		value = props.getProperty(KEY_SHOW_LENGTH);
		if (value != null)
			setShowLength(parseInt(KEY_SHOW_LENGTH, value));
	}

	public void load (File file) throws IOException {
		Properties props = new Properties();
		FileInputStream fis = new FileInputStream(file);
		try {
			props.load(fis);
		} finally {
			fis.close();
		}
		load(props);
	}

	private static int parseInt (String key, String value) {
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("incorrect "+key+" ["+value+"]");
		}
	}

	public final int getDisplayedDigits() {
		return displayed_digits;
	}

	public void setDisplayedDigits (int digits) {
		displayed_digits = digits < MIN_DISPLAYED_DIGITS ? MIN_DISPLAYED_DIGITS : digits;
	}

	public final int getShowLength() {
		return show_length;
	}

	/**
	 * Selector 0 to 3, anything else is taken as 0.
	 */
	public void setShowLength (int selector) {
		show_length = (selector < 0 || selector >= length_cutoffs.length) ? 0 : selector;
	}

	/**
	 * Longest input parseLine() parses, UNLIMITED for no limit.
	 */
	public final int getLengthCutoff() {
		return length_cutoffs[show_length];
	}
}
