package net.vitki.mathcell;

/**
 * One block of a worksheet: maxima input with its output, an image, a page
 * break, comment text, a title or a section heading.
 * <p>
 * Groups are chained with <code>next</code> like any other cells.
 * Folding a heading moves the groups below it, up to the next heading of
 * the same or a higher level, out of that chain into the folded subtree of
 * the heading. The folded groups stay owned by the heading.
 *
 * @author vit
 *
 */
public class GroupCell extends MathCell
{
	public static final int GC_TYPE_CODE = 0;
	public static final int GC_TYPE_IMAGE = 1;
	public static final int GC_TYPE_PAGEBREAK = 2;
	public static final int GC_TYPE_TEXT = 3;
	public static final int GC_TYPE_TITLE = 4;
	public static final int GC_TYPE_SECTION = 5;
	public static final int GC_TYPE_SUBSECTION = 6;
	public static final int GC_TYPE_SUBSUBSECTION = 7;

	private static final String[] type_names = {
		"code", "image", "pagebreak", "text", "title", "section", "subsection", "subsubsection"
	};

	private int group_type;
	private EditorCell input;
	private MathCell output;
	private boolean hide;
	private GroupCell hidden_tree;

	private int indent;
	private int output_skip;

	public GroupCell(int group_type) {
		super();
		this.group_type = group_type;
		type = MC_TYPE_GROUP;
		input = null;
		output = null;
		hide = false;
		hidden_tree = null;
		indent = output_skip = 0;
		if (group_type == GC_TYPE_PAGEBREAK)
			break_page = true;
		group = this;
	}

	public MathCell copy() {
		GroupCell tmp = new GroupCell(group_type);
		tmp.copyData(this);
		tmp.hide = hide;
		if (input != null)
			tmp.setInput((EditorCell) input.copy());
		tmp.appendOutput(CellList.copyList(output));
		if (hidden_tree != null)
			tmp.hideTree((GroupCell) CellList.copyList(hidden_tree));
		return tmp;
	}

	/**
	 * The folded subtree is not part of the layout and is left out here.
	 */
	protected MathCell[] getInnerCells() {
		return new MathCell[] { input, output };
	}

	protected void destroyInner() {
		super.destroyInner();
		if (hidden_tree != null)
			hidden_tree.destroy();
		input = null;
		output = null;
		hidden_tree = null;
	}

	/**
	 * A group is the group of its own contents, whatever encloses it.
	 */
	public void setGroup (GroupCell parent) {
		super.setGroup(this);
	}

	public static final String getTypeName (int group_type) {
		if (group_type < 0 || group_type >= type_names.length)
			return "text";
		return type_names[group_type];
	}

	public final int getGroupType() {
		return group_type;
	}

	public final boolean isSectioning() {
		return group_type == GC_TYPE_TITLE || group_type == GC_TYPE_SECTION
				|| group_type == GC_TYPE_SUBSECTION || group_type == GC_TYPE_SUBSUBSECTION;
	}

	/**
	 * 1 for titles down to 4 for subsubsections, 5 for everything else.
	 */
	public final int getLevel() {
		switch (group_type) {
		case GC_TYPE_TITLE: return 1;
		case GC_TYPE_SECTION: return 2;
		case GC_TYPE_SUBSECTION: return 3;
		case GC_TYPE_SUBSUBSECTION: return 4;
		}
		return 5;
	}

    /*
     * ========================= Contents ===============================
     */

	public final EditorCell getInput() {
		return input;
	}

	public void setInput (EditorCell editor) {
		if (input != null)
			input.destroy();
		input = editor;
		if (input != null)
			input.setGroup(this);
		invalidateSizeInformation();
	}

	public final String getEditableContent() {
		return input == null ? "" : input.getValue();
	}

	public void setEditableContent (String text) {
		if (input == null) {
			EditorCell editor = new EditorCell();
			editor.setType(getEditorType());
			setInput(editor);
		}
		input.setValue(text);
		invalidateSizeInformation();
	}

	private int getEditorType() {
		switch (group_type) {
		case GC_TYPE_CODE: return MC_TYPE_INPUT;
		case GC_TYPE_TITLE: return MC_TYPE_TITLE;
		case GC_TYPE_SECTION: return MC_TYPE_SECTION;
		case GC_TYPE_SUBSECTION: return MC_TYPE_SUBSECTION;
		case GC_TYPE_SUBSUBSECTION: return MC_TYPE_SUBSUBSECTION;
		}
		return MC_TYPE_TEXT;
	}

	public final MathCell getOutput() {
		return output;
	}

	/**
	 * Append a chain to the output. The group becomes its owner.
	 */
	public void appendOutput (MathCell cell) {
		if (cell == null)
			return;
		if (output == null)
			output = cell;
		else
			output.appendCell(cell);
		CellList.setGroup(cell, this);
		invalidateSizeInformation();
	}

	public void removeOutput() {
		if (output != null)
			output.destroy();
		output = null;
		invalidateSizeInformation();
	}

	public final boolean isHiddenOutput() {
		return hide;
	}

	/**
	 * Hide the output of this group, the input stays visible.
	 */
	public void hide (boolean hide) {
		if (this.hide != hide) {
			this.hide = hide;
			invalidateSizeInformation();
		}
	}

    /*
     * ========================= Folding ===============================
     */

	public final GroupCell getHiddenTree() {
		return hidden_tree;
	}

	public final boolean isFolded() {
		return hidden_tree != null;
	}

	/**
	 * Take ownership of an already folded chain of groups.
	 */
	public void hideTree (GroupCell tree) {
		if (tree == hidden_tree)
			return;
		if (hidden_tree != null)
			hidden_tree.destroy();
		hidden_tree = tree;
	}

	/**
	 * Move the groups following this one into the folded subtree,
	 * up to the next group of the same or a higher level.
	 * Returns false when there was nothing to fold.
	 */
	public boolean fold() {
		if (hidden_tree != null || !(next instanceof GroupCell))
			return false;
		int level = getLevel();
		GroupCell start = (GroupCell) next;
		GroupCell end = null;
		for (MathCell tmp = start; tmp instanceof GroupCell; tmp = tmp.next) {
			if (((GroupCell) tmp).getLevel() <= level)
				break;
			end = (GroupCell) tmp;
		}
		if (end == null)
			return false;
		MathCell after = end.next;
		end.next = null;
		start.previous = null;
		next = after;
		if (after != null)
			after.previous = this;
		resetAggregates();
		end.resetAggregates();
		hidden_tree = start;
		return true;
	}

	/**
	 * Put the folded groups back after this one.
	 * Returns the last group put back, null when nothing was folded.
	 */
	public GroupCell unfold() {
		if (hidden_tree == null)
			return null;
		GroupCell start = hidden_tree;
		GroupCell end = (GroupCell) start.last();
		hidden_tree = null;
		MathCell after = next;
		next = start;
		start.previous = this;
		end.next = after;
		if (after != null)
			after.previous = end;
		resetAggregates();
		end.resetAggregates();
		return end;
	}

    /*
     * ========================= Sizes ===============================
     */

	protected void recalculateSize (LayoutContext ctx, int fontsize) {
		indent = ctx.scalePx(MC_GROUP_LEFT_INDENT);
		output_skip = ctx.scalePx(MC_LINE_SKIP);
		if (group_type == GC_TYPE_PAGEBREAK) {
			width = indent;
			height = ctx.scalePx(10);
			center = height / 2;
			return;
		}
		int w = 0;
		int h = 0;
		if (input != null) {
			input.recalculate(ctx, fontsize);
			w = input.getWidth();
			h = input.getHeight();
			center = input.getCenter();
		} else {
			center = 0;
		}
		CellList.recalculate(output, ctx, fontsize);
		if (output != null && !hide) {
			w = Math.max(w, CellList.getLinesWidth(output));
			if (h > 0)
				h += output_skip;
			h += CellList.getLinesHeight(output, ctx.scalePx(MC_LINE_SKIP));
		}
		width = indent + w;
		height = h;
	}

	public void setPosition (int x, int y) {
		super.setPosition(x, y);
		if (group_type == GC_TYPE_PAGEBREAK)
			return;
		int top = y - center;
		int out_top = top;
		if (input != null) {
			input.setPosition(x + indent, top + input.getCenter());
			out_top += input.getHeight() + output_skip;
		}
		if (output != null && !hide)
			CellList.arrangeLines(output, x + indent, out_top, output_skip);
	}

    /*
     * ========================= Conversions ===============================
     */

	public String toString() {
		StringBuffer sb = new StringBuffer();
		if (input != null)
			sb.append(input.getValue());
		if (output != null && !hide) {
			if (sb.length() > 0)
				sb.append('\n');
			sb.append(CellList.toString(output));
		}
		return sb.toString();
	}

	public String toTeX() {
		StringBuffer sb = new StringBuffer();
		switch (group_type) {
		case GC_TYPE_PAGEBREAK:
			sb.append("\\pagebreak");
			break;
		case GC_TYPE_CODE:
			if (input != null)
				sb.append(input.toTeX());
			if (output != null && !hide)
				sb.append("\n\\[").append(CellList.toTeX(output)).append("\\]");
			break;
		case GC_TYPE_IMAGE:
			if (output != null)
				sb.append(CellList.toTeX(output));
			if (input != null && input.getValue().length() > 0)
				sb.append("\n\n").append(input.toTeX());
			break;
		default:
			if (input != null)
				sb.append(input.toTeX());
			break;
		}
		for (MathCell tmp = hidden_tree; tmp != null; tmp = tmp.next)
			sb.append("\n\n").append(tmp.toTeX());
		return sb.toString();
	}

	public String toXML() {
		StringBuffer sb = new StringBuffer("<cell type=\"");
		if (group_type == GC_TYPE_SUBSUBSECTION)
			sb.append("subsection\" sectioning_level=\"4\"");
		else
			sb.append(getTypeName(group_type)).append('"');
		if (hide)
			sb.append(" hide=\"true\"");
		sb.append('>');
		switch (group_type) {
		case GC_TYPE_PAGEBREAK:
			break;
		case GC_TYPE_CODE:
			sb.append("<input>");
			if (input != null)
				sb.append(input.toXML());
			sb.append("</input>");
			if (output != null)
				sb.append("<output>").append(CellList.toXML(output)).append("</output>");
			break;
		case GC_TYPE_IMAGE:
			if (output != null)
				sb.append(CellList.toXML(output));
			if (input != null)
				sb.append(input.toXML());
			break;
		default:
			if (input != null)
				sb.append(input.toXML());
			break;
		}
		if (hidden_tree != null) {
			sb.append("<fold>");
			for (MathCell tmp = hidden_tree; tmp != null; tmp = tmp.next)
				sb.append(tmp.toXML());
			sb.append("</fold>");
		}
		sb.append("</cell>");
		return sb.toString();
	}
}
