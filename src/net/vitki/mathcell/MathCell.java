package net.vitki.mathcell;

import java.awt.Point;
import java.awt.Rectangle;

/**
 * The base class all cell types are derived from.
 * <p>
 * A cell is at the same time a node of an expression tree (composite cells
 * own the chains in their named slots) and a member of a sibling chain
 * that is laid out left to right. A cell owns its <code>next</code> cell:
 * destroying a cell destroys the whole tail after it.
 * <p>
 * The draw order (<code>next_to_draw</code>) is a separate view over the
 * sibling chain maintained by {@link CellList#linkDrawOrder(MathCell)}.
 * It skips hidden cells and owns nothing.
 *
 * @author vit
 *
 */
public abstract class MathCell
{
	public static final int UNSET = -1;

	public static final int MC_CELL_SKIP = 0;
	public static final int MC_BASE_INDENT = 12;
	public static final int MC_LINE_SKIP = 2;
	public static final int MC_TEXT_PADDING = 1;
	public static final int MC_GROUP_SKIP = 20;
	public static final int MC_GROUP_LEFT_INDENT = 15;
	public static final int MC_EXP_INDENT = 4;
	public static final int MC_MIN_SIZE = 8;
	public static final int MC_MAX_SIZE = 36;
	public static final int SIZE_DEC = 2;

	public static final int MC_TYPE_DEFAULT = 0;
	public static final int MC_TYPE_MAIN_PROMPT = 1;
	public static final int MC_TYPE_PROMPT = 2;
	public static final int MC_TYPE_LABEL = 3;
	public static final int MC_TYPE_INPUT = 4;
	public static final int MC_TYPE_ERROR = 5;
	public static final int MC_TYPE_TEXT = 6;
	public static final int MC_TYPE_SUBSUBSECTION = 7;
	public static final int MC_TYPE_SUBSECTION = 8;
	public static final int MC_TYPE_SECTION = 9;
	public static final int MC_TYPE_TITLE = 10;
	public static final int MC_TYPE_IMAGE = 11;
	public static final int MC_TYPE_SLIDE = 12;
	public static final int MC_TYPE_GROUP = 13;

	protected static final MathCell[] NO_CELLS = new MathCell[0];

	protected int width;
	protected int height;
	// distance between the top and the center line
	protected int center;
	// aggregates over the rest of the line, see CellList.computeAggregates()
	int max_center;
	int max_drop;
	protected int font_size;

	protected int type;
	protected int text_style;

	protected boolean big_skip;
	protected boolean break_page;
	protected boolean break_line;
	protected boolean force_break_line;
	protected boolean is_broken;
	protected boolean is_hidden;
	protected boolean highlight;
	protected String alt_copy_text;

	protected int current_x;
	protected int current_y;

	MathCell next;
	MathCell previous;
	MathCell next_to_draw;
	MathCell previous_to_draw;
	GroupCell group;

	private boolean destroyed;

	public MathCell() {
		width = height = center = UNSET;
		max_center = max_drop = UNSET;
		font_size = UNSET;
		type = MC_TYPE_DEFAULT;
		text_style = TextStyle.TS_DEFAULT;
		big_skip = true;
		break_page = break_line = force_break_line = false;
		is_broken = is_hidden = highlight = false;
		alt_copy_text = null;
		current_x = current_y = UNSET;
		next = previous = next_to_draw = previous_to_draw = null;
		group = null;
		destroyed = false;
	}

	/**
	 * A deep copy of this cell and the chains in its slots,
	 * without the cells following it.
	 */
	public abstract MathCell copy();

	/**
	 * Recompute width, height and center for the given font size.
	 * Owned child chains must be recalculated first.
	 */
	protected abstract void recalculateSize (LayoutContext ctx, int fontsize);

	/**
	 * Linear plain text form.
	 */
	public abstract String toString();

	public abstract String toTeX();

	/**
	 * The markup this cell was built from.
	 * Highlighting and forced line breaks are written by the enclosing chain.
	 */
	public abstract String toXML();

	/**
	 * The heads of the chains this cell owns, in slot order.
	 * Null slots are allowed.
	 */
	protected MathCell[] getInnerCells() {
		return NO_CELLS;
	}

	protected void copyData (MathCell src) {
		type = src.type;
		text_style = src.text_style;
		big_skip = src.big_skip;
		break_page = src.break_page;
		break_line = src.break_line;
		force_break_line = src.force_break_line;
		is_hidden = src.is_hidden;
		highlight = src.highlight;
		alt_copy_text = src.alt_copy_text;
	}

    /*
     * ========================= Chain ===============================
     */

	public final MathCell getNext() {
		return next;
	}

	public final MathCell getPrevious() {
		return previous;
	}

	public final MathCell getNextToDraw() {
		return next_to_draw;
	}

	public final MathCell getPreviousToDraw() {
		return previous_to_draw;
	}

	public final MathCell last() {
		MathCell tmp = this;
		while (tmp.next != null)
			tmp = tmp.next;
		return tmp;
	}

	/**
	 * Attach a chain of cells to the end of the chain this cell is in.
	 * The appended cells become owned by the chain.
	 */
	public void appendCell (MathCell p) {
		if (p == null)
			return;
		if (p.previous != null)
			throw new IllegalStateException("appended cell already has an owner");
		MathCell tail = last();
		tail.next = p;
		p.previous = tail;
		tail.resetAggregates();
	}

	/**
	 * Detach the cells following this one.
	 * The caller becomes the owner of the returned chain.
	 */
	public MathCell cutTail() {
		MathCell tail = next;
		if (tail != null) {
			tail.previous = null;
			next = null;
			resetAggregates();
		}
		return tail;
	}

	public final GroupCell getGroup() {
		return group;
	}

	public void setGroup (GroupCell parent) {
		group = parent;
		MathCell[] inner = getInnerCells();
		for (int i = 0; i < inner.length; i++)
			CellList.setGroup(inner[i], parent);
	}

    /*
     * ========================= Destruction ===============================
     */

	/**
	 * Release this cell, everything it owns and its whole tail.
	 */
	public final void destroy() {
		MathCell tmp = this;
		if (previous != null) {
			previous.next = null;
			previous.resetAggregates();
			previous = null;
		}
		while (tmp != null) {
			if (tmp.destroyed)
				throw new IllegalStateException("cell destroyed twice: " + tmp.getClass().getName());
			MathCell following = tmp.next;
			tmp.destroyed = true;
			tmp.destroyInner();
			tmp.release();
			tmp.next = tmp.previous = null;
			tmp.next_to_draw = tmp.previous_to_draw = null;
			tmp.group = null;
			if (following != null)
				following.previous = null;
			tmp = following;
		}
	}

	protected void destroyInner() {
		MathCell[] inner = getInnerCells();
		for (int i = 0; i < inner.length; i++) {
			if (inner[i] != null)
				inner[i].destroy();
		}
	}

	/**
	 * Hook for cells holding resources besides other cells.
	 */
	protected void release() { }

	public final boolean isDestroyed() {
		return destroyed;
	}

    /*
     * ========================= Sizes ===============================
     */

	public void recalculate (LayoutContext ctx, int fontsize) {
		if (fontsize == font_size && !isDirty())
			return;
		recalculateSize(ctx, fontsize);
		font_size = fontsize;
		resetAggregates();
	}

	public boolean isDirty() {
		if (width == UNSET || height == UNSET || center == UNSET)
			return true;
		MathCell[] inner = getInnerCells();
		for (int i = 0; i < inner.length; i++) {
			if (CellList.isDirty(inner[i]))
				return true;
		}
		return false;
	}

	/**
	 * Mark this cell and everything it owns as to be recalculated.
	 */
	public void invalidateSizeInformation() {
		resetSize();
		resetAggregates();
		MathCell[] inner = getInnerCells();
		for (int i = 0; i < inner.length; i++)
			CellList.invalidate(inner[i]);
	}

	public final void resetSize() {
		width = height = center = UNSET;
		font_size = UNSET;
	}

	/**
	 * The line aggregates of this cell and of every cell before it depend on
	 * this cell. Valid aggregates always form a suffix of the chain, so the
	 * walk stops at the first cell that is already unset.
	 */
	final void resetAggregates() {
		MathCell tmp = this;
		while (tmp != null && (tmp.max_center != UNSET || tmp.max_drop != UNSET || tmp == this)) {
			tmp.max_center = tmp.max_drop = UNSET;
			tmp = tmp.previous;
		}
	}

	public final int getWidth() {
		return width;
	}

	public final int getHeight() {
		return height;
	}

	public final int getCenter() {
		return center;
	}

	public final int getDrop() {
		return height - center;
	}

	/**
	 * The largest distance between top and center in the rest of this line.
	 */
	public final int getMaxCenter() {
		if (max_center == UNSET)
			CellList.computeAggregates(this);
		return max_center;
	}

	public final int getMaxDrop() {
		if (max_drop == UNSET)
			CellList.computeAggregates(this);
		return max_drop;
	}

	public final int getMaxHeight() {
		return getMaxCenter() + getMaxDrop();
	}

	public final int getFullWidth() {
		return CellList.getFullWidth(this);
	}

    /*
     * ========================= Position ===============================
     */

	/**
	 * Place this cell with its left edge at x and its center line at y.
	 * Composite cells also place the cells they own.
	 */
	public void setPosition (int x, int y) {
		current_x = x;
		current_y = y;
	}

	public final Point getCurrentPoint() {
		return new Point(current_x, current_y);
	}

	public Rectangle getRect() {
		return new Rectangle(current_x, current_y - center, width, height);
	}

	public final boolean containsPoint (Point point) {
		return getRect().contains(point);
	}

	public final boolean containsRect (Rectangle big) {
		return big.intersects(getRect());
	}

    /*
     * ========================= Flags ===============================
     */

	public final int getType() {
		return type;
	}

	public void setType (int type) {
		this.type = type;
	}

	public final int getStyle() {
		return text_style;
	}

	public void setStyle (int style) {
		text_style = style;
	}

	public final boolean isHighlighted() {
		return highlight;
	}

	public void setHighlight (boolean highlight) {
		this.highlight = highlight;
	}

	public final boolean isHidden() {
		return is_hidden;
	}

	public void setHidden (boolean hidden) {
		if (is_hidden != hidden) {
			is_hidden = hidden;
			invalidateSizeInformation();
		}
	}

	public final String getAltCopyText() {
		return alt_copy_text;
	}

	public void setAltCopyText (String text) {
		alt_copy_text = text;
	}

	public final void breakLine (boolean breakLine) {
		break_line = breakLine;
	}

	public final void breakPage (boolean breakPage) {
		break_page = breakPage;
	}

	public final void forceBreakLine (boolean force) {
		force_break_line = break_line = force;
		resetAggregates();
	}

	public final boolean forceBreakLineHere() {
		return force_break_line;
	}

	public final boolean breakPageHere() {
		return break_page;
	}

	public final boolean breakLineHere() {
		return !is_broken && (break_line || force_break_line);
	}

	public void unbreak() {
		is_broken = false;
		resetAggregates();
	}

	public final boolean isBroken() {
		return is_broken;
	}

	public final void setSkip (boolean skip) {
		big_skip = skip;
	}

	public final boolean hasBigSkip() {
		return big_skip;
	}

	public void setExponentFlag() { }

	public String getValue() {
		return "";
	}

	/**
	 * Variable and order of a derivative, as written in the
	 * <code>'diff(...)</code> form. Empty for everything but fractions.
	 */
	public String getDiffPart() {
		return "";
	}

	public boolean isOperator() {
		return false;
	}

	/**
	 * Text, titles and sections are never sent to maxima.
	 */
	public final boolean isComment() {
		return type == MC_TYPE_TEXT || type == MC_TYPE_SECTION
				|| type == MC_TYPE_SUBSECTION || type == MC_TYPE_SUBSUBSECTION
				|| type == MC_TYPE_TITLE;
	}
}
