package net.vitki.mathcell;

/**
 * Complex conjugate, drawn with a bar over the contents.
 *
 * @author vit
 *
 */
public class ConjugateCell extends InnerCell
{
	protected InnerCell newInstance() {
		return new ConjugateCell();
	}

	protected void measureDecoration (LayoutContext ctx, int fontsize) {
		left_width = right_width = ctx.scalePx(2);
		top_skip = ctx.scalePx(4);
		bottom_skip = 0;
	}

	public String toString() {
		return "conjugate(" + CellList.toString(inner) + ")";
	}

	public String toTeX() {
		return "\\overline{" + CellList.toTeX(inner) + "}";
	}

	public String toXML() {
		return innerXML("cj");
	}
}
