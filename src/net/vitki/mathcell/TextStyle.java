package net.vitki.mathcell;

/**
 * Text styles a leaf cell can carry.
 * The style selects font and color in a renderer and the tag
 * a text cell is written back with.
 *
 * @author vit
 *
 */
public final class TextStyle
{
	public static final int TS_DEFAULT = 0;
	public static final int TS_VARIABLE = 1;
	public static final int TS_NUMBER = 2;
	public static final int TS_FUNCTION = 3;
	public static final int TS_SPECIAL_CONSTANT = 4;
	public static final int TS_GREEK_CONSTANT = 5;
	public static final int TS_STRING = 6;
	public static final int TS_INPUT = 7;
	public static final int TS_MAIN_PROMPT = 8;
	public static final int TS_OTHER_PROMPT = 9;
	public static final int TS_LABEL = 10;
	public static final int TS_USERLABEL = 11;
	public static final int TS_HIGHLIGHT = 12;
	public static final int TS_WARNING = 13;
	public static final int TS_ERROR = 14;
	public static final int TS_TEXT = 15;
	public static final int TS_SUBSUBSECTION = 16;
	public static final int TS_SUBSECTION = 17;
	public static final int TS_SECTION = 18;
	public static final int TS_TITLE = 19;

	private static final String[] names = {
		"default", "variable", "number", "function", "special-constant",
		"greek-constant", "string", "input", "main-prompt", "other-prompt",
		"label", "user-label", "highlight", "warning", "error", "text",
		"subsubsection", "subsection", "section", "title"
	};

	private TextStyle() { }

	public static final String getName (int style) {
		if (style < 0 || style >= names.length)
			return "unknown";
		return names[style];
	}

	public static final boolean isLabel (int style) {
		return style == TS_LABEL || style == TS_USERLABEL;
	}
}
