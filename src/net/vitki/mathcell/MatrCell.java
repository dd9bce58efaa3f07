package net.vitki.mathcell;

import java.util.Vector;

/**
 * A matrix or a table.
 * <p>
 * Rows are vectors of cell chains, one chain per column.
 * The parser fills it row by row and calls {@link #setDimension()}
 * when done: short rows are then padded with empty cells.
 * Special matrices are tables without brackets, inference matrices draw a
 * line above the last row.
 *
 * @author vit
 *
 */
public class MatrCell extends MathCell
{
	private Vector rows;
	private boolean special;
	private boolean inference;
	private boolean row_names;
	private boolean col_names;

	private int[] col_widths;
	private int[] row_centers;
	private int[] row_drops;
	private int cell_skip;
	private int row_skip;
	private int bracket_width;

	public MatrCell() {
		super();
		rows = new Vector();
		special = inference = row_names = col_names = false;
		col_widths = row_centers = row_drops = null;
		cell_skip = row_skip = bracket_width = 0;
	}

	public MathCell copy() {
		MatrCell tmp = new MatrCell();
		tmp.copyData(this);
		tmp.special = special;
		tmp.inference = inference;
		tmp.row_names = row_names;
		tmp.col_names = col_names;
		for (int i = 0; i < rows.size(); i++) {
			Vector row = (Vector) rows.get(i);
			tmp.newRow();
			for (int j = 0; j < row.size(); j++)
				tmp.addNewCell(CellList.copyList((MathCell) row.get(j)));
		}
		return tmp;
	}

	protected MathCell[] getInnerCells() {
		Vector all = new Vector();
		for (int i = 0; i < rows.size(); i++)
			all.addAll((Vector) rows.get(i));
		return (MathCell[]) all.toArray(new MathCell[all.size()]);
	}

    /*
     * ========================= Filling ===============================
     */

	public void newRow() {
		rows.add(new Vector());
		invalidateSizeInformation();
	}

	public void newColumn() {
		if (rows.size() == 0)
			newRow();
	}

	/**
	 * Add a chain to the current row. A missing cell becomes an empty one,
	 * so that rows keep their column positions.
	 */
	public void addNewCell (MathCell cell) {
		if (rows.size() == 0)
			newRow();
		if (cell == null)
			cell = new TextCell();
		((Vector) rows.lastElement()).add(cell);
		invalidateSizeInformation();
	}

	public void setDimension() {
		int cols = getColumnCount();
		for (int i = 0; i < rows.size(); i++) {
			Vector row = (Vector) rows.get(i);
			while (row.size() < cols)
				row.add(new TextCell());
		}
		invalidateSizeInformation();
	}

	public final int getRowCount() {
		return rows.size();
	}

	public final int getColumnCount() {
		int cols = 0;
		for (int i = 0; i < rows.size(); i++) {
			int n = ((Vector) rows.get(i)).size();
			if (n > cols)
				cols = n;
		}
		return cols;
	}

	public final MathCell getCell (int row, int col) {
		Vector r = (Vector) rows.get(row);
		return col < r.size() ? (MathCell) r.get(col) : null;
	}

	public final boolean isSpecial() {
		return special;
	}

	public void setSpecialFlag (boolean special) {
		this.special = special;
		invalidateSizeInformation();
	}

	public final boolean isInference() {
		return inference;
	}

	public void setInferenceFlag (boolean inference) {
		this.inference = inference;
		invalidateSizeInformation();
	}

	public final boolean hasRowNames() {
		return row_names;
	}

	public void setRowNames (boolean names) {
		row_names = names;
	}

	public final boolean hasColNames() {
		return col_names;
	}

	public void setColNames (boolean names) {
		col_names = names;
	}

    /*
     * ========================= Sizes ===============================
     */

	protected void recalculateSize (LayoutContext ctx, int fontsize) {
		int nrows = rows.size();
		int ncols = getColumnCount();
		col_widths = new int[ncols];
		row_centers = new int[nrows];
		row_drops = new int[nrows];
		cell_skip = ctx.scalePx(10);
		row_skip = ctx.scalePx(5);
		bracket_width = special ? 0 : ctx.scalePx(6);
		for (int i = 0; i < nrows; i++) {
			Vector row = (Vector) rows.get(i);
			for (int j = 0; j < row.size(); j++) {
				MathCell cell = (MathCell) row.get(j);
				CellList.recalculate(cell, ctx, fontsize);
				col_widths[j] = Math.max(col_widths[j], CellList.getFullWidth(cell));
				row_centers[i] = Math.max(row_centers[i], CellList.getMaxCenter(cell));
				row_drops[i] = Math.max(row_drops[i], CellList.getMaxDrop(cell));
			}
		}
		width = 2 * bracket_width;
		for (int j = 0; j < ncols; j++)
			width += col_widths[j] + cell_skip;
		height = 0;
		for (int i = 0; i < nrows; i++)
			height += row_centers[i] + row_drops[i] + row_skip;
		center = height / 2;
	}

	public void setPosition (int x, int y) {
		super.setPosition(x, y);
		if (row_centers == null)
			return;
		int top = y - center + row_skip / 2;
		for (int i = 0; i < rows.size(); i++) {
			Vector row = (Vector) rows.get(i);
			int line = top + row_centers[i];
			int cx = x + bracket_width + cell_skip / 2;
			for (int j = 0; j < row.size(); j++) {
				MathCell cell = (MathCell) row.get(j);
				int w = CellList.getFullWidth(cell);
				CellList.arrange(cell, cx + (col_widths[j] - w) / 2, line);
				cx += col_widths[j] + cell_skip;
			}
			top = line + row_drops[i] + row_skip;
		}
	}

    /*
     * ========================= Conversions ===============================
     */

	public String toString() {
		StringBuffer sb = new StringBuffer("matrix(");
		for (int i = 0; i < rows.size(); i++) {
			Vector row = (Vector) rows.get(i);
			if (i > 0)
				sb.append(',');
			sb.append('[');
			for (int j = 0; j < row.size(); j++) {
				if (j > 0)
					sb.append(',');
				sb.append(CellList.toString((MathCell) row.get(j)));
			}
			sb.append(']');
		}
		sb.append(')');
		return sb.toString();
	}

	public String toTeX() {
		StringBuffer sb = new StringBuffer();
		int ncols = getColumnCount();
		if (special) {
			sb.append("\\begin{array}{");
			for (int j = 0; j < ncols; j++)
				sb.append('c');
			sb.append('}');
		} else {
			sb.append("\\begin{pmatrix}");
		}
		for (int i = 0; i < rows.size(); i++) {
			Vector row = (Vector) rows.get(i);
			if (i > 0)
				sb.append("\\\\\n");
			if (inference && i > 0 && i == rows.size() - 1)
				sb.append("\\hline\n");
			for (int j = 0; j < row.size(); j++) {
				if (j > 0)
					sb.append(" & ");
				sb.append(CellList.toTeX((MathCell) row.get(j)));
			}
		}
		sb.append(special ? "\\end{array}" : "\\end{pmatrix}");
		return sb.toString();
	}

	public String toXML() {
		StringBuffer sb = new StringBuffer("<tb");
		if (inference)
			sb.append(" inference=\"true\"");
		else if (special)
			sb.append(" special=\"true\"");
		if (row_names)
			sb.append(" rownames=\"true\"");
		if (col_names)
			sb.append(" colnames=\"true\"");
		sb.append('>');
		for (int i = 0; i < rows.size(); i++) {
			Vector row = (Vector) rows.get(i);
			sb.append("<mtr>");
			for (int j = 0; j < row.size(); j++)
				sb.append("<mtd>").append(CellList.toXML((MathCell) row.get(j))).append("</mtd>");
			sb.append("</mtr>");
		}
		sb.append("</tb>");
		return sb.toString();
	}
}
