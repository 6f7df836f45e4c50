package edu.tum.cs.matrix;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.base.Optional;
import com.google.common.base.Strings;

import edu.tum.cs.matrix.util.MatrixConfiguration;

/**
 * Renders a matrix as text: a leading line break, followed by one bracketed line per row. All values are padded to
 * the length of the longest value in the matrix, e.g.
 * <pre>
 * [  1 10 ]
 * [ -3  4 ]
 * </pre>
 */
public class MatrixFormat {

	public static final String PROP_OPEN_BRACKET = "openBracket";
	public static final String PROP_CLOSE_BRACKET = "closeBracket";
	public static final String PROP_ALIGN_RIGHT = "alignRight";

	private static final Logger logger = Logger.getLogger(MatrixFormat.class.getName());
	private static final String lineSeparator = "\n";

	private static MatrixFormat defaultFormat;

	private final String openBracket;
	private final String closeBracket;
	private final boolean alignRight;

	public MatrixFormat() {
		this("[", "]", true);
	}

	public MatrixFormat(String openBracket, String closeBracket, boolean alignRight) {
		this.openBracket = openBracket;
		this.closeBracket = closeBracket;
		this.alignRight = alignRight;
	}

	public MatrixFormat(MatrixConfiguration config) {
		this(config.getLocalProperty(PROP_OPEN_BRACKET, "["), config.getLocalProperty(PROP_CLOSE_BRACKET, "]"),
				config.getLocalBooleanProperty(PROP_ALIGN_RIGHT, true));
	}

	/**
	 * @return the format used by {@link Matrix#toString()}, configured from the default configuration. If the
	 * 	configuration cannot be read, the unconfigured format is returned and loading is retried on the next call.
	 */
	public static synchronized MatrixFormat getDefault() {
		if (defaultFormat == null) {
			Optional<MatrixFormat> format = loadDefault();
			if (!format.isPresent())
				return new MatrixFormat();
			defaultFormat = format.get();
		}
		return defaultFormat;
	}

	static Optional<MatrixFormat> loadDefault() {
		try {
			return Optional.of(new MatrixFormat(new MatrixConfiguration(MatrixFormat.class)));
		} catch (RuntimeException ex) {
			logger.log(Level.WARNING, "cannot read configuration, using default format", ex);
			return Optional.absent();
		}
	}

	public String format(Matrix<?> matrix) {
		int width = 0;
		for (Object value : matrix.values())
			width = Math.max(width, value.toString().length());

		StringBuilder sb = new StringBuilder(lineSeparator);
		for (List<?> row : matrix.rows()) {
			sb.append(openBracket).append(' ');
			for (Object value : row)
				sb.append(pad(value.toString(), width)).append(' ');
			sb.append(closeBracket).append(lineSeparator);
		}
		return sb.toString();
	}

	private String pad(String s, int width) {
		if (alignRight)
			return Strings.padStart(s, width, ' ');
		return Strings.padEnd(s, width, ' ');
	}

}
