package net.vitki.mathcell;

/**
 * <code>lim</code> with the approach written below it, followed by the
 * expression.
 *
 * @author vit
 *
 */
public class LimitCell extends MathCell
{
	private MathCell name;
	private MathCell under;
	private MathCell base;

	public LimitCell() {
		super();
		name = under = base = null;
	}

	public MathCell copy() {
		LimitCell tmp = new LimitCell();
		tmp.copyData(this);
		tmp.setName(CellList.copyList(name));
		tmp.setUnder(CellList.copyList(under));
		tmp.setBase(CellList.copyList(base));
		return tmp;
	}

	protected MathCell[] getInnerCells() {
		return new MathCell[] { name, under, base };
	}

	public final MathCell getName() {
		return name;
	}

	public void setName (MathCell cell) {
		if (name != null)
			name.destroy();
		name = cell;
		invalidateSizeInformation();
	}

	public final MathCell getUnder() {
		return under;
	}

	public void setUnder (MathCell cell) {
		if (under != null)
			under.destroy();
		under = cell;
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
		CellList.recalculate(name, ctx, fontsize);
		CellList.recalculate(under, ctx, LayoutContext.smaller(fontsize));
		CellList.recalculate(base, ctx, fontsize);
		width = Math.max(CellList.getFullWidth(name), CellList.getFullWidth(under))
				+ CellList.getFullWidth(base);
		center = Math.max(CellList.getMaxCenter(name), CellList.getMaxCenter(base));
		height = center + Math.max(CellList.getMaxDrop(name) + CellList.getMaxHeight(under),
									CellList.getMaxDrop(base));
	}

	public void setPosition (int x, int y) {
		super.setPosition(x, y);
		int name_w = CellList.getFullWidth(name);
		int under_w = CellList.getFullWidth(under);
		int left = Math.max(name_w, under_w);
		CellList.arrange(name, x + (left - name_w) / 2, y);
		CellList.arrange(under, x + (left - under_w) / 2,
						y + CellList.getMaxDrop(name) + CellList.getMaxCenter(under));
		CellList.arrange(base, x + left, y);
	}

	/**
	 * <code>x->0+</code> is written as <code>x,0,plus</code>.
	 */
	public String toString() {
		String approach = CellList.toString(under);
		String direction = null;
		if (approach.endsWith("+")) {
			direction = "plus";
		} else if (approach.endsWith("-") || approach.endsWith(String.valueOf(TextCell.UNICODE_MINUS))) {
			direction = "minus";
		}
		if (direction != null)
			approach = approach.substring(0, approach.length() - 1) + "," + direction;
		int arrow = approach.indexOf("->");
		if (arrow >= 0)
			approach = approach.substring(0, arrow) + "," + approach.substring(arrow + 2);
		else if ((arrow = approach.indexOf('\u2192')) >= 0)
			approach = approach.substring(0, arrow) + "," + approach.substring(arrow + 1);
		return "limit(" + CellList.toString(base) + "," + approach + ")";
	}

	public String toTeX() {
		return "\\lim_{" + CellList.toTeX(under) + "}{" + CellList.toTeX(base) + "}";
	}

	public String toXML() {
		return "<lm>" + CellList.toXMLRow(name) + CellList.toXMLRow(under)
				+ CellList.toXMLRow(base) + "</lm>";
	}
}
