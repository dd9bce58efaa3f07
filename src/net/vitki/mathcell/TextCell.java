package net.vitki.mathcell;

import java.util.HashMap;

/**
 * A piece of text: a variable, a number, an operator, a label, ...
 * <p>
 * The raw value is what was read and what is written back; the displayed
 * value may differ (unicode minus, elided digits of long numbers).
 *
 * @author vit
 *
 */
public class TextCell extends MathCell
{
	public static final char UNICODE_MINUS = '\u2212';

	private String value;
	private String display;
	private boolean is_exponent;

	public TextCell() {
		this("");
	}

	public TextCell(String text) {
		super();
		is_exponent = false;
		setValue(text);
	}

	public MathCell copy() {
		TextCell tmp = new TextCell(value);
		tmp.copyData(this);
		tmp.display = display;
		tmp.is_exponent = is_exponent;
		return tmp;
	}

	public String getValue() {
		return value;
	}

	public void setValue (String text) {
		value = text == null ? "" : text;
		display = value.replace('-', UNICODE_MINUS);
		invalidateSizeInformation();
	}

	public final String getDisplayedValue() {
		return display;
	}

	/**
	 * Show something else than the value, without touching what is exported.
	 */
	public void setDisplayedValue (String text) {
		display = text == null ? "" : text;
		invalidateSizeInformation();
	}

	public void setExponentFlag() {
		is_exponent = true;
	}

	public final boolean isExponent() {
		return is_exponent;
	}

	public boolean isOperator() {
		if (value.length() != 1)
			return false;
		return operator_glyphs.indexOf(value.charAt(0)) >= 0;
	}

	private static final String operator_glyphs = "+*/-" + UNICODE_MINUS;

	public String getDiffPart() {
		if (is_hidden || isOperator() || value.trim().length() == 0)
			return "";
		return "," + value + ",1";
	}

    /*
     * ========================= Sizes ===============================
     */

	protected void recalculateSize (LayoutContext ctx, int fontsize) {
		int pad = ctx.scalePx(MC_TEXT_PADDING);
		height = ctx.getTextHeight(text_style, fontsize) + 2 * pad;
		center = height / 2;
		if (is_hidden)
			width = 0;
		else
			width = ctx.getTextWidth(display, text_style, fontsize) + 2 * pad;
	}

    /*
     * ========================= Conversions ===============================
     */

	public String toString() {
		if (alt_copy_text != null && alt_copy_text.length() > 0)
			return alt_copy_text;
		if (text_style == TextStyle.TS_STRING)
			return "\"" + value + "\"";
		return value;
	}

	public String toTeX() {
		if (is_hidden)
			return "\\,";
		switch (text_style) {
		case TextStyle.TS_NUMBER:
			return value;
		case TextStyle.TS_GREEK_CONSTANT:
		case TextStyle.TS_VARIABLE:
			return variableToTeX(value);
		case TextStyle.TS_SPECIAL_CONSTANT:
			String special = (String) tex_specials.get(value);
			if (special != null)
				return special;
			return variableToTeX(value);
		case TextStyle.TS_FUNCTION:
			if (Util.isOneOf(value, tex_functions))
				return "\\" + value + " ";
			return "\\operatorname{" + Util.texEscape(value) + "}";
		case TextStyle.TS_STRING:
		case TextStyle.TS_ERROR:
			return "\\mbox{" + Util.texEscape(value) + "}";
		case TextStyle.TS_LABEL:
		case TextStyle.TS_USERLABEL:
			return "\\mbox{" + Util.texEscape(value.trim()) + "}\\quad ";
		}
		String op = (String) tex_ops.get(value);
		if (op != null)
			return op;
		return Util.texEscape(value);
	}

	private static final String variableToTeX (String name) {
		String key = name.startsWith("%") ? name.substring(1) : name;
		String greek = (String) tex_greek.get(key);
		if (greek != null)
			return greek;
		if (name.length() == 1)
			return name;
		return "\\mathit{" + Util.texEscape(name) + "}";
	}

	public String toXML() {
		String tag = getXMLTag();
		StringBuffer sb = new StringBuffer();
		sb.append('<').append(tag);
		if (!is_hidden) {
			if (text_style == TextStyle.TS_ERROR)
				sb.append(" type=\"error\"");
			else if (text_style == TextStyle.TS_USERLABEL)
				sb.append(" userdefined=\"yes\"");
		}
		if (alt_copy_text != null)
			sb.append(" altCopy=\"").append(Util.xmlEscape(alt_copy_text)).append('"');
		sb.append('>');
		sb.append(Util.xmlEscape(value));
		sb.append("</").append(tag).append('>');
		return sb.toString();
	}

	private String getXMLTag() {
		if (is_hidden)
			return "h";
		switch (text_style) {
		case TextStyle.TS_VARIABLE:
			return "v";
		case TextStyle.TS_NUMBER:
			return "n";
		case TextStyle.TS_GREEK_CONSTANT:
			return "g";
		case TextStyle.TS_SPECIAL_CONSTANT:
			return "s";
		case TextStyle.TS_FUNCTION:
			return "fnm";
		case TextStyle.TS_STRING:
			return "st";
		case TextStyle.TS_LABEL:
		case TextStyle.TS_USERLABEL:
			return "lbl";
		}
		return "t";
	}

    /*
     * ========================= Translations ===============================
     */

	private static final String tex_functions = "sin cos tan cot sec csc arcsin arccos arctan"
											+ " sinh cosh tanh coth log ln exp det max min"
											+ " gcd arg deg dim sup inf";

	private static HashMap tex_greek;
	private static HashMap tex_specials;
	private static HashMap tex_ops;

	static {
		setupTeXTranslations();
	}

	private static void setupTeXTranslations() {
		tex_greek = new HashMap();
		tex_specials = new HashMap();
		tex_ops = new HashMap();

		String[] small = {
			"alpha", "beta", "gamma", "delta", "epsilon", "zeta", "eta", "theta",
			"iota", "kappa", "lambda", "mu", "nu", "xi", "omicron", "pi", "rho",
			"sigma", "tau", "upsilon", "phi", "chi", "psi", "omega"
		};
		for (int i = 0; i < small.length; i++) {
			String name = small[i];
			// omicron has no TeX macro
			String tex = "omicron".equals(name) ? "o" : "\\" + name;
			tex_greek.put(name, tex);
			tex_greek.put(String.valueOf((char)(0x03b1 + (i < 17 ? i : i + 1))), tex);
		}
		String[] capital = {
			"Gamma", "Delta", "Theta", "Lambda", "Xi", "Pi", "Sigma", "Upsilon",
			"Phi", "Psi", "Omega"
		};
		for (int i = 0; i < capital.length; i++)
			tex_greek.put(capital[i], "\\" + capital[i]);

		tex_specials.put("%e", "e");
		tex_specials.put("%i", "i");
		tex_specials.put("%pi", "\\pi");
		tex_specials.put("%gamma", "\\gamma");
		tex_specials.put("%phi", "\\phi");
		tex_specials.put("inf", "\\infty ");
		tex_specials.put("minf", "-\\infty ");

		tex_ops.put("*", "\\cdot ");
		tex_ops.put("-", "-");
		tex_ops.put(String.valueOf(UNICODE_MINUS), "-");
		tex_ops.put(">=", "\\geq ");
		tex_ops.put("<=", "\\leq ");
		tex_ops.put("#", "\\neq ");
		tex_ops.put("->", "\\to ");
		tex_ops.put("%", "\\% ");
		tex_ops.put("\u2192", "\\to ");
		tex_ops.put("\u2264", "\\leq ");
		tex_ops.put("\u2265", "\\geq ");
		tex_ops.put("\u2260", "\\neq ");
	}
}
