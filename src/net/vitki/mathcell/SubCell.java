package net.vitki.mathcell;

/**
 * @author vit
 *
 */
public class SubCell extends MathCell
{
	private MathCell base;
	private MathCell index;
	private int rise;

	public SubCell() {
		super();
		base = index = null;
		rise = 0;
	}

	public MathCell copy() {
		SubCell tmp = new SubCell();
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
		if (index != null)
			index.setExponentFlag();
		invalidateSizeInformation();
	}

	protected void recalculateSize (LayoutContext ctx, int fontsize) {
		CellList.recalculate(base, ctx, fontsize);
		CellList.recalculate(index, ctx, LayoutContext.smaller(fontsize));
		rise = ctx.scalePx(MC_EXP_INDENT);
		int base_drop = CellList.getMaxDrop(base);
		width = CellList.getFullWidth(base) + CellList.getFullWidth(index);
		center = CellList.getMaxCenter(base);
		height = center + Math.max(base_drop, base_drop - rise + CellList.getMaxHeight(index));
	}

	public void setPosition (int x, int y) {
		super.setPosition(x, y);
		CellList.arrange(base, x, y);
		CellList.arrange(index, x + CellList.getFullWidth(base),
						y + CellList.getMaxDrop(base) - rise + CellList.getMaxCenter(index));
	}

	public String toString() {
		return CellList.toGroupedString(base) + "[" + CellList.toString(index) + "]";
	}

	public String toTeX() {
		return "{" + CellList.toTeX(base) + "}_{" + CellList.toTeX(index) + "}";
	}

	public String toXML() {
		return "<i>" + CellList.toXMLRow(base) + CellList.toXMLRow(index) + "</i>";
	}
}
