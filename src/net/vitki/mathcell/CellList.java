package net.vitki.mathcell;

import java.util.Vector;

/**
 * Operations on a whole chain of sibling cells.
 * All walks along a chain are loops: outputs may be thousands of cells long.
 *
 * @author vit
 *
 */
public final class CellList
{
	private CellList() { }

	public static final int length (MathCell head) {
		int n = 0;
		for (MathCell tmp = head; tmp != null; tmp = tmp.next)
			n++;
		return n;
	}

	public static final MathCell copyList (MathCell head) {
		MathCell first = null;
		MathCell last = null;
		for (MathCell tmp = head; tmp != null; tmp = tmp.next) {
			MathCell cp = tmp.copy();
			if (first == null) {
				first = cp;
			} else {
				last.next = cp;
				cp.previous = last;
			}
			last = cp;
		}
		return first;
	}

	public static final void setGroup (MathCell head, GroupCell group) {
		for (MathCell tmp = head; tmp != null; tmp = tmp.next)
			tmp.setGroup(group);
	}

    /*
     * ========================= Sizes ===============================
     */

	public static final boolean isDirty (MathCell head) {
		for (MathCell tmp = head; tmp != null; tmp = tmp.next) {
			if (tmp.isDirty())
				return true;
		}
		return false;
	}

	public static final void invalidate (MathCell head) {
		for (MathCell tmp = head; tmp != null; tmp = tmp.next)
			tmp.invalidateSizeInformation();
	}

	public static final void recalculate (MathCell head, LayoutContext ctx, int fontsize) {
		for (MathCell tmp = head; tmp != null; tmp = tmp.next)
			tmp.recalculate(ctx, fontsize);
	}

	public static final int getFullWidth (MathCell head) {
		int w = 0;
		for (MathCell tmp = head; tmp != null; tmp = tmp.next) {
			checkSize(tmp);
			w += tmp.width;
		}
		return w;
	}

	public static final int getMaxCenter (MathCell head) {
		return head == null ? 0 : head.getMaxCenter();
	}

	public static final int getMaxDrop (MathCell head) {
		return head == null ? 0 : head.getMaxDrop();
	}

	public static final int getMaxHeight (MathCell head) {
		return head == null ? 0 : head.getMaxHeight();
	}

	/**
	 * Fill max_center and max_drop of start and of every cell up to the end
	 * of its line. A line ends before the next cell that breaks the line.
	 * Cells whose aggregates are still valid end the walk early.
	 */
	static final void computeAggregates (MathCell start) {
		Vector run = new Vector();
		MathCell tmp = start;
		while (tmp != null && tmp.max_center == MathCell.UNSET) {
			checkSize(tmp);
			run.add(tmp);
			tmp = tmp.next;
		}
		for (int i = run.size() - 1; i >= 0; i--) {
			MathCell cell = (MathCell) run.get(i);
			int mc = cell.is_broken ? 0 : cell.center;
			int md = cell.is_broken ? 0 : cell.height - cell.center;
			MathCell after = cell.next;
			if (after != null && !after.breakLineHere()) {
				if (after.max_center > mc)
					mc = after.max_center;
				if (after.max_drop > md)
					md = after.max_drop;
			}
			cell.max_center = mc;
			cell.max_drop = md;
		}
	}

	private static final void checkSize (MathCell cell) {
		if (cell.width == MathCell.UNSET || cell.height == MathCell.UNSET)
			throw new IllegalStateException("size of " + cell.getClass().getName()
											+ " queried before recalculation");
	}

    /*
     * ========================= Lines ===============================
     */

	/**
	 * Width of the widest line of a chain with line breaks.
	 */
	public static final int getLinesWidth (MathCell head) {
		int widest = 0;
		int w = 0;
		for (MathCell tmp = head; tmp != null; tmp = tmp.next) {
			if (tmp != head && tmp.breakLineHere()) {
				if (w > widest)
					widest = w;
				w = 0;
			}
			checkSize(tmp);
			w += tmp.width;
		}
		return w > widest ? w : widest;
	}

	/**
	 * Total height of a chain with line breaks.
	 */
	public static final int getLinesHeight (MathCell head, int line_skip) {
		int h = 0;
		for (MathCell tmp = head; tmp != null; tmp = tmp.next) {
			if (tmp == head || tmp.breakLineHere()) {
				if (tmp != head)
					h += line_skip;
				h += tmp.getMaxHeight();
			}
		}
		return h;
	}

	/**
	 * Place all cells of a single line, left to right, on center line y.
	 */
	public static final void arrange (MathCell head, int x, int y) {
		for (MathCell tmp = head; tmp != null; tmp = tmp.next) {
			tmp.setPosition(x, y);
			x += tmp.width;
		}
	}

	/**
	 * Place a chain with line breaks below the point (x, top).
	 * Returns the height used.
	 */
	public static final int arrangeLines (MathCell head, int x, int top, int line_skip) {
		int y = top;
		int cx = x;
		int line_drop = 0;
		for (MathCell tmp = head; tmp != null; tmp = tmp.next) {
			if (tmp == head || tmp.breakLineHere()) {
				if (tmp != head)
					y += line_drop + line_skip;
				y += tmp.getMaxCenter();
				line_drop = tmp.getMaxDrop();
				cx = x;
			}
			tmp.setPosition(cx, y);
			cx += tmp.width;
		}
		return head == null ? 0 : y + line_drop - top;
	}

    /*
     * ========================= Draw order ===============================
     */

	/**
	 * Rebuild the draw order of a chain. Hidden cells are left out.
	 * Returns the first cell to draw.
	 */
	public static final MathCell linkDrawOrder (MathCell head) {
		MathCell first = null;
		MathCell last = null;
		for (MathCell tmp = head; tmp != null; tmp = tmp.next) {
			tmp.next_to_draw = tmp.previous_to_draw = null;
			if (tmp.is_hidden)
				continue;
			if (first == null)
				first = tmp;
			else {
				last.next_to_draw = tmp;
				tmp.previous_to_draw = last;
			}
			last = tmp;
		}
		return first;
	}

	public static final Vector getDrawOrder (MathCell head) {
		Vector cells = new Vector();
		for (MathCell tmp = linkDrawOrder(head); tmp != null; tmp = tmp.next_to_draw)
			cells.add(tmp);
		return cells;
	}

    /*
     * ========================= Conversions ===============================
     */

	public static final String toString (MathCell head) {
		StringBuffer sb = new StringBuffer();
		for (MathCell tmp = head; tmp != null; tmp = tmp.next) {
			if (tmp != head && tmp.force_break_line)
				sb.append('\n');
			sb.append(tmp.toString());
		}
		return sb.toString();
	}

	/**
	 * Linear text of a chain, parenthesized when it has more than one cell.
	 */
	public static final String toGroupedString (MathCell head) {
		String s = toString(head);
		if (head == null || head.next == null)
			return s;
		return "(" + s + ")";
	}

	public static final String toTeX (MathCell head) {
		StringBuffer sb = new StringBuffer();
		for (MathCell tmp = head; tmp != null; tmp = tmp.next) {
			if (tmp != head && tmp.force_break_line)
				sb.append('\n');
			sb.append(tmp.toTeX());
		}
		return sb.toString();
	}

	/**
	 * Markup of a whole chain. A forced line break opens a new
	 * <code>mth</code> element, highlighted cells are wrapped in <code>hl</code>.
	 */
	public static final String toXML (MathCell head) {
		StringBuffer sb = new StringBuffer();
		boolean in_line = false;
		for (MathCell tmp = head; tmp != null; tmp = tmp.next) {
			if (tmp.force_break_line) {
				if (in_line)
					sb.append("</mth>");
				sb.append("<mth>");
				in_line = true;
			}
			if (tmp.highlight)
				sb.append("<hl>").append(tmp.toXML()).append("</hl>");
			else
				sb.append(tmp.toXML());
		}
		if (in_line)
			sb.append("</mth>");
		return sb.toString();
	}

	public static final String toXMLRow (MathCell head) {
		return "<r>" + toXML(head) + "</r>";
	}
}
