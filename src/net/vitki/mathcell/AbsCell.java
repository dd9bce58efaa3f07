package net.vitki.mathcell;

/**
 * @author vit
 *
 */
public class AbsCell extends InnerCell
{
	protected InnerCell newInstance() {
		return new AbsCell();
	}

	protected void measureDecoration (LayoutContext ctx, int fontsize) {
		left_width = right_width = ctx.scalePx(4);
		top_skip = bottom_skip = ctx.scalePx(1);
	}

	public String toString() {
		return "abs(" + CellList.toString(inner) + ")";
	}

	public String toTeX() {
		return "\\left|" + CellList.toTeX(inner) + "\\right|";
	}

	public String toXML() {
		return innerXML("a");
	}
}
