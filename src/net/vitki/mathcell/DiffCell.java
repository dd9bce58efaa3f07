package net.vitki.mathcell;

/**
 * A derivative: the d/dx fraction followed by the differentiated expression.
 *
 * @author vit
 *
 */
public class DiffCell extends MathCell
{
	private MathCell diff;
	private MathCell base;

	public DiffCell() {
		super();
		diff = base = null;
	}

	public MathCell copy() {
		DiffCell tmp = new DiffCell();
		tmp.copyData(this);
		tmp.setDiff(CellList.copyList(diff));
		tmp.setBase(CellList.copyList(base));
		return tmp;
	}

	protected MathCell[] getInnerCells() {
		return new MathCell[] { diff, base };
	}

	public final MathCell getDiff() {
		return diff;
	}

	public void setDiff (MathCell cell) {
		if (diff != null)
			diff.destroy();
		diff = cell;
		invalidateSizeInformation();
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

	protected void recalculateSize (LayoutContext ctx, int fontsize) {
		CellList.recalculate(diff, ctx, fontsize);
		CellList.recalculate(base, ctx, fontsize);
		width = CellList.getFullWidth(diff) + CellList.getFullWidth(base);
		center = Math.max(CellList.getMaxCenter(diff), CellList.getMaxCenter(base));
		height = center + Math.max(CellList.getMaxDrop(diff), CellList.getMaxDrop(base));
	}

	public void setPosition (int x, int y) {
		super.setPosition(x, y);
		CellList.arrange(diff, x, y);
		CellList.arrange(base, x + CellList.getFullWidth(diff), y);
	}

	/**
	 * <code>'diff(f,x,1)</code>, the variables and orders
	 * come from the denominator of the fraction.
	 */
	public String toString() {
		StringBuffer sb = new StringBuffer("'diff(");
		sb.append(CellList.toString(base));
		for (MathCell tmp = diff; tmp != null; tmp = tmp.next)
			sb.append(tmp.getDiffPart());
		sb.append(')');
		return sb.toString();
	}

	public String toTeX() {
		return CellList.toTeX(diff) + CellList.toTeX(base);
	}

	public String toXML() {
		return "<d>" + CellList.toXMLRow(diff) + CellList.toXMLRow(base) + "</d>";
	}
}
