package net.vitki.mathcell;

/**
 * Expression evaluated at a point: a vertical bar with the
 * substitutions written below it.
 *
 * @author vit
 *
 */
public class AtCell extends MathCell
{
	private MathCell base;
	private MathCell index;
	private int bar_width;

	public AtCell() {
		super();
		base = index = null;
		bar_width = 0;
	}

	public MathCell copy() {
		AtCell tmp = new AtCell();
		tmp.copyData(this);
		tmp.setBase(CellList.copyList(base));
		tmp.setIndex(CellList.copyList(index));
		return tmp;
	}

	protected MathCell[] getInnerCells() {
		return new MathCell[] { base, index };
	}

	public final MathCell getBase() {
		return base;
	}

	public void setBase (MathCell cell) {
		if (base != null)
			base.destroy();
		base = cell;
		invalidateSizeInformation();
	}

	public final MathCell getIndex() {
		return index;
	}

	public void setIndex (MathCell cell) {
		if (index != null)
			index.destroy();
		index = cell;
		invalidateSizeInformation();
	}

	protected void recalculateSize (LayoutContext ctx, int fontsize) {
		CellList.recalculate(base, ctx, fontsize);
		CellList.recalculate(index, ctx, LayoutContext.smaller(fontsize));
		bar_width = ctx.scalePx(4);
		width = CellList.getFullWidth(base) + bar_width + CellList.getFullWidth(index);
		center = CellList.getMaxCenter(base);
		height = center + Math.max(CellList.getMaxDrop(base), CellList.getMaxHeight(index));
	}

	public void setPosition (int x, int y) {
		super.setPosition(x, y);
		CellList.arrange(base, x, y);
		// the substitutions hang from the center line
		CellList.arrange(index, x + CellList.getFullWidth(base) + bar_width,
						y + CellList.getMaxCenter(index));
	}

	public String toString() {
		return "at(" + CellList.toString(base) + "," + CellList.toString(index) + ")";
	}

	public String toTeX() {
		return "\\left." + CellList.toTeX(base) + "\\right|_{" + CellList.toTeX(index) + "}";
	}

	public String toXML() {
		return "<at>" + CellList.toXMLRow(base) + CellList.toXMLRow(index) + "</at>";
	}
}
