package net.vitki.mathcell;

/**
 * Base for cells drawing something around a single inner chain:
 * roots, absolute values, conjugates and parentheses.
 * Subclasses only tell how much room the decoration takes.
 *
 * @author vit
 *
 */
public abstract class InnerCell extends MathCell
{
	protected MathCell inner;
	protected int left_width;
	protected int right_width;
	protected int top_skip;
	protected int bottom_skip;

	public InnerCell() {
		super();
		inner = null;
		left_width = right_width = top_skip = bottom_skip = 0;
	}

	protected abstract InnerCell newInstance();

	/**
	 * Fill left_width, right_width, top_skip and bottom_skip
	 * once the inner chain has been recalculated.
	 */
	protected abstract void measureDecoration (LayoutContext ctx, int fontsize);

	public MathCell copy() {
		InnerCell tmp = newInstance();
		tmp.copyData(this);
		tmp.setInner(CellList.copyList(inner));
		return tmp;
	}

	protected MathCell[] getInnerCells() {
		return new MathCell[] { inner };
	}

	public final MathCell getInner() {
		return inner;
	}

	public void setInner (MathCell cell) {
		if (inner != null)
			inner.destroy();
		inner = cell;
		invalidateSizeInformation();
	}

	protected void recalculateSize (LayoutContext ctx, int fontsize) {
		CellList.recalculate(inner, ctx, fontsize);
		measureDecoration(ctx, fontsize);
		width = left_width + CellList.getFullWidth(inner) + right_width;
		center = CellList.getMaxCenter(inner) + top_skip;
		height = center + CellList.getMaxDrop(inner) + bottom_skip;
	}

	public void setPosition (int x, int y) {
		super.setPosition(x, y);
		CellList.arrange(inner, x + left_width, y);
	}

	protected final String innerXML (String tag) {
		return "<" + tag + ">" + CellList.toXML(inner) + "</" + tag + ">";
	}
}
