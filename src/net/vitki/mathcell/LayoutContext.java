package net.vitki.mathcell;

/**
 * Everything the size computation needs to know about the output surface:
 * the zoom factor and the font metrics.
 *
 * @author vit
 *
 */
public class LayoutContext
{
	public static final int DEFAULT_FONT_SIZE = 12;

	private TextMeasurer measurer;
	private double scale;
	private int font_size;

	public LayoutContext() {
		this(new FixedMetrics(), 1.0, DEFAULT_FONT_SIZE);
	}

	public LayoutContext(TextMeasurer measurer, double scale, int font_size) {
		if (measurer == null)
			throw new IllegalArgumentException("no text measurer");
		this.measurer = measurer;
		this.scale = scale;
		this.font_size = font_size;
	}

	public final int scalePx (int px) {
		return (int)(px * scale + 0.5);
	}

	public final double getScale() {
		return scale;
	}

	public final int getDefaultFontSize() {
		return font_size;
	}

	public int getTextWidth (String text, int style, int fontsize) {
		return measurer.getTextWidth(text, style, scalePx(fontsize));
	}

	public int getTextHeight (int style, int fontsize) {
		return measurer.getTextHeight(style, scalePx(fontsize));
	}

	/**
	 * Font size for exponents, indices and limits under a sign.
	 */
	public static final int smaller (int fontsize) {
		int size = fontsize - MathCell.SIZE_DEC;
		return size < MathCell.MC_MIN_SIZE ? MathCell.MC_MIN_SIZE : size;
	}
}
