package net.vitki.mathcell;

/**
 * Monospaced approximation of font metrics.
 * Used when no rendering backend is attached (command line, tests).
 *
 * @author vit
 *
 */
public class FixedMetrics implements TextMeasurer
{
	public static int CHAR_WIDTH_PERCENT = 60;
	public static int LINE_HEIGHT_PERCENT = 125;

	public int getTextWidth (String text, int style, int fontsize) {
		if (text == null)
			return 0;
		int w = fontsize * CHAR_WIDTH_PERCENT / 100;
		if (w < 1)
			w = 1;
		if (style == TextStyle.TS_TITLE || style == TextStyle.TS_SECTION)
			w += w / 2;
		return text.length() * w;
	}

	public int getTextHeight (int style, int fontsize) {
		int h = fontsize * LINE_HEIGHT_PERCENT / 100;
		if (style == TextStyle.TS_TITLE || style == TextStyle.TS_SECTION)
			h += h / 2;
		return h < 1 ? 1 : h;
	}
}
