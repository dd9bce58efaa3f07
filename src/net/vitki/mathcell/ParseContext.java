package net.vitki.mathcell;

/**
 * What a recursive parse call inherits from its caller: the cell type
 * given to produced cells, the fraction style and the highlight flag.
 * Contexts are never modified, a nested call gets a new one.
 *
 * @author vit
 *
 */
public final class ParseContext
{
	public static final ParseContext DEFAULT = new ParseContext(MathCell.MC_TYPE_DEFAULT,
													FracCell.FC_NORMAL, false);

	private final int type;
	private final int frac_style;
	private final boolean highlight;

	public ParseContext(int type, int frac_style, boolean highlight) {
		this.type = type;
		this.frac_style = frac_style;
		this.highlight = highlight;
	}

	public static final ParseContext forType (int type) {
		return new ParseContext(type, FracCell.FC_NORMAL, false);
	}

	public final int getType() {
		return type;
	}

	public final int getFracStyle() {
		return frac_style;
	}

	public final boolean isHighlight() {
		return highlight;
	}

	public ParseContext withHighlight (boolean on) {
		return on == highlight ? this : new ParseContext(type, frac_style, on);
	}

	public ParseContext withFracStyle (int style) {
		return style == frac_style ? this : new ParseContext(type, style, highlight);
	}
}
