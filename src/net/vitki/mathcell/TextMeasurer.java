package net.vitki.mathcell;

/**
 * Font metrics as supplied by a rendering backend.
 * Sizes are in pixels, font sizes are already scaled.
 *
 * @author vit
 *
 */
public interface TextMeasurer
{
	int getTextWidth (String text, int style, int fontsize);

	int getTextHeight (int style, int fontsize);
}
