package net.vitki.mathcell;

/**
 * A base with both an index and a power stacked behind it.
 *
 * @author vit
 *
 */
public class SubSupCell extends MathCell
{
	private MathCell base;
	private MathCell index;
	private MathCell power;
	private int rise;

	public SubSupCell() {
		super();
		base = index = power = null;
		rise = 0;
	}

	public MathCell copy() {
		SubSupCell tmp = new SubSupCell();
		tmp.copyData(this);
		tmp.setBase(CellList.copyList(base));
		tmp.setIndex(CellList.copyList(index));
		tmp.setPower(CellList.copyList(power));
		return tmp;
	}

	protected MathCell[] getInnerCells() {
		return new MathCell[] { base, index, power };
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

	public final MathCell getPower() {
		return power;
	}

	public void setPower (MathCell cell) {
		if (power != null)
			power.destroy();
		power = cell;
		if (power != null)
			power.setExponentFlag();
		invalidateSizeInformation();
	}

	protected void recalculateSize (LayoutContext ctx, int fontsize) {
		int small = LayoutContext.smaller(fontsize);
		CellList.recalculate(base, ctx, fontsize);
		CellList.recalculate(index, ctx, small);
		CellList.recalculate(power, ctx, small);
		rise = ctx.scalePx(MC_EXP_INDENT);
		int base_center = CellList.getMaxCenter(base);
		int base_drop = CellList.getMaxDrop(base);
		width = CellList.getFullWidth(base)
				+ Math.max(CellList.getFullWidth(index), CellList.getFullWidth(power));
		center = Math.max(base_center, base_center - rise + CellList.getMaxHeight(power));
		height = center + Math.max(base_drop, base_drop - rise + CellList.getMaxHeight(index));
	}

	public void setPosition (int x, int y) {
		super.setPosition(x, y);
		int right = x + CellList.getFullWidth(base);
		CellList.arrange(base, x, y);
		CellList.arrange(index, right, y + CellList.getMaxDrop(base) - rise + CellList.getMaxCenter(index));
		CellList.arrange(power, right, y - CellList.getMaxCenter(base) + rise - CellList.getMaxDrop(power));
	}

	public String toString() {
		return CellList.toGroupedString(base) + "[" + CellList.toString(index) + "]^"
				+ CellList.toGroupedString(power);
	}

	public String toTeX() {
		return "{" + CellList.toTeX(base) + "}_{" + CellList.toTeX(index) + "}^{"
				+ CellList.toTeX(power) + "}";
	}

	public String toXML() {
		return "<ie>" + CellList.toXMLRow(base) + CellList.toXMLRow(index)
				+ CellList.toXMLRow(power) + "</ie>";
	}
}
