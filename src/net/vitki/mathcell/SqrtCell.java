package net.vitki.mathcell;

/**
 * @author vit
 *
 */
public class SqrtCell extends InnerCell
{
	protected InnerCell newInstance() {
		return new SqrtCell();
	}

	protected void measureDecoration (LayoutContext ctx, int fontsize) {
		// the radical sign grows with the height of its contents
		left_width = ctx.scalePx(fontsize / 2) + CellList.getMaxHeight(inner) / 4;
		right_width = ctx.scalePx(2);
		top_skip = ctx.scalePx(3);
		bottom_skip = 0;
	}

	public String toString() {
		return "sqrt(" + CellList.toString(inner) + ")";
	}

	public String toTeX() {
		return "\\sqrt{" + CellList.toTeX(inner) + "}";
	}

	public String toXML() {
		return innerXML("q");
	}
}
