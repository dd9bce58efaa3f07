package net.vitki.mathcell;

/**
 * Parenthesized chain. Without the print flag the parentheses take no
 * room and are not written to text or TeX: they only group.
 *
 * @author vit
 *
 */
public class ParenCell extends InnerCell
{
	private boolean print;

	public ParenCell() {
		super();
		print = true;
	}

	protected InnerCell newInstance() {
		ParenCell tmp = new ParenCell();
		tmp.print = print;
		return tmp;
	}

	public final boolean isPrint() {
		return print;
	}

	public void setPrint (boolean print) {
		this.print = print;
		invalidateSizeInformation();
	}

	protected void measureDecoration (LayoutContext ctx, int fontsize) {
		top_skip = bottom_skip = 0;
		if (!print) {
			left_width = right_width = 0;
			return;
		}
		left_width = ctx.getTextWidth("(", TextStyle.TS_DEFAULT, fontsize);
		right_width = ctx.getTextWidth(")", TextStyle.TS_DEFAULT, fontsize);
		// tall contents get stretched parentheses
		int line = ctx.getTextHeight(TextStyle.TS_DEFAULT, fontsize);
		int inside = CellList.getMaxHeight(inner);
		if (inside > line) {
			left_width += ctx.scalePx(2);
			right_width += ctx.scalePx(2);
			top_skip = bottom_skip = ctx.scalePx(1);
		}
	}

	public String toString() {
		if (!print)
			return CellList.toString(inner);
		return "(" + CellList.toString(inner) + ")";
	}

	public String toTeX() {
		if (!print)
			return CellList.toTeX(inner);
		return "\\left(" + CellList.toTeX(inner) + "\\right)";
	}

	public String toXML() {
		if (!print)
			return "<p print=\"no\">" + CellList.toXML(inner) + "</p>";
		return innerXML("p");
	}
}
