package net.vitki.mathcell;

/**
 * Base raised to a power. The power is drawn with a smaller font.
 *
 * @author vit
 *
 */
public class ExptCell extends MathCell
{
	private MathCell base;
	private MathCell power;
	// a^^b, the non-commutative power of matrices
	private boolean is_matrix;
	private int rise;

	public ExptCell() {
		super();
		base = power = null;
		is_matrix = false;
		rise = 0;
	}

	public MathCell copy() {
		ExptCell tmp = new ExptCell();
		tmp.copyData(this);
		tmp.is_matrix = is_matrix;
		tmp.setBase(CellList.copyList(base));
		tmp.setPower(CellList.copyList(power));
		return tmp;
	}

	protected MathCell[] getInnerCells() {
		return new MathCell[] { base, power };
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

	public final boolean isMatrix() {
		return is_matrix;
	}

	public void setMatrix (boolean matrix) {
		is_matrix = matrix;
	}

	protected void recalculateSize (LayoutContext ctx, int fontsize) {
		CellList.recalculate(base, ctx, fontsize);
		CellList.recalculate(power, ctx, LayoutContext.smaller(fontsize));
		rise = ctx.scalePx(MC_EXP_INDENT);
		int base_center = CellList.getMaxCenter(base);
		width = CellList.getFullWidth(base) + CellList.getFullWidth(power);
		center = Math.max(base_center, base_center - rise + CellList.getMaxHeight(power));
		height = center + CellList.getMaxDrop(base);
	}

	public void setPosition (int x, int y) {
		super.setPosition(x, y);
		CellList.arrange(base, x, y);
		CellList.arrange(power, x + CellList.getFullWidth(base),
						y - CellList.getMaxCenter(base) + rise - CellList.getMaxDrop(power));
	}

	public String getDiffPart() {
		return "," + CellList.toString(base) + "," + CellList.toString(power);
	}

	public String toString() {
		return CellList.toGroupedString(base) + (is_matrix ? "^^" : "^")
				+ CellList.toGroupedString(power);
	}

	public String toTeX() {
		return "{" + CellList.toTeX(base) + "}^{" + CellList.toTeX(power) + "}";
	}

	public String toXML() {
		return (is_matrix ? "<e type=\"mat\">" : "<e>") + CellList.toXMLRow(base)
				+ CellList.toXMLRow(power) + "</e>";
	}
}
