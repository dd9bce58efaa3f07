package net.vitki.mathcell;

/**
 * Function name followed by its argument, usually a parenthesized list.
 *
 * @author vit
 *
 */
public class FunCell extends MathCell
{
	private MathCell name;
	private MathCell arg;

	public FunCell() {
		super();
		name = arg = null;
	}

	public MathCell copy() {
		FunCell tmp = new FunCell();
		tmp.copyData(this);
		tmp.setName(CellList.copyList(name));
		tmp.setArg(CellList.copyList(arg));
		return tmp;
	}

	protected MathCell[] getInnerCells() {
		return new MathCell[] { name, arg };
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

	public final MathCell getArg() {
		return arg;
	}

	public void setArg (MathCell cell) {
		if (arg != null)
			arg.destroy();
		arg = cell;
		invalidateSizeInformation();
	}

	protected void recalculateSize (LayoutContext ctx, int fontsize) {
		CellList.recalculate(name, ctx, fontsize);
		CellList.recalculate(arg, ctx, fontsize);
		width = CellList.getFullWidth(name) + CellList.getFullWidth(arg);
		center = Math.max(CellList.getMaxCenter(name), CellList.getMaxCenter(arg));
		height = center + Math.max(CellList.getMaxDrop(name), CellList.getMaxDrop(arg));
	}

	public void setPosition (int x, int y) {
		super.setPosition(x, y);
		CellList.arrange(name, x, y);
		CellList.arrange(arg, x + CellList.getFullWidth(name), y);
	}

	public String toString() {
		return CellList.toString(name) + CellList.toString(arg);
	}

	public String toTeX() {
		return CellList.toTeX(name) + CellList.toTeX(arg);
	}

	public String toXML() {
		return "<fn>" + CellList.toXMLRow(name) + CellList.toXMLRow(arg) + "</fn>";
	}
}
