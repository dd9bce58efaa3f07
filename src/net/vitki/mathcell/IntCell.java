package net.vitki.mathcell;

/**
 * Definite or indefinite integral. The variable slot holds
 * <code>d x</code> as it was written.
 *
 * @author vit
 *
 */
public class IntCell extends MathCell
{
	public static final int INT_DEF = 0;
	public static final int INT_IDEF = 1;

	private MathCell under;
	private MathCell over;
	private MathCell base;
	private MathCell var;
	private int int_style;
	private int sign_width;
	private int sign_height;

	public IntCell() {
		super();
		under = over = base = var = null;
		int_style = INT_IDEF;
		sign_width = sign_height = 0;
	}

	public MathCell copy() {
		IntCell tmp = new IntCell();
		tmp.copyData(this);
		tmp.int_style = int_style;
		tmp.setUnder(CellList.copyList(under));
		tmp.setOver(CellList.copyList(over));
		tmp.setBase(CellList.copyList(base));
		tmp.setVar(CellList.copyList(var));
		return tmp;
	}

	protected MathCell[] getInnerCells() {
		return new MathCell[] { under, over, base, var };
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

	public final MathCell getOver() {
		return over;
	}

	public void setOver (MathCell cell) {
		if (over != null)
			over.destroy();
		over = cell;
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

	public final MathCell getVar() {
		return var;
	}

	public void setVar (MathCell cell) {
		if (var != null)
			var.destroy();
		var = cell;
		invalidateSizeInformation();
	}

	public final int getIntStyle() {
		return int_style;
	}

	public void setIntStyle (int style) {
		int_style = style;
		invalidateSizeInformation();
	}

	protected void recalculateSize (LayoutContext ctx, int fontsize) {
		int small = LayoutContext.smaller(fontsize);
		CellList.recalculate(under, ctx, small);
		CellList.recalculate(over, ctx, small);
		CellList.recalculate(base, ctx, fontsize);
		CellList.recalculate(var, ctx, fontsize);
		sign_height = ctx.scalePx(fontsize * 2);
		sign_width = ctx.scalePx(fontsize * 2 / 3);
		int body_center = Math.max(CellList.getMaxCenter(base), CellList.getMaxCenter(var));
		int body_drop = Math.max(CellList.getMaxDrop(base), CellList.getMaxDrop(var));
		width = sign_width + CellList.getFullWidth(base) + CellList.getFullWidth(var);
		if (int_style == INT_DEF) {
			// limits are written at the right of the sign
			width += Math.max(CellList.getFullWidth(under), CellList.getFullWidth(over));
			center = Math.max(body_center, sign_height / 2 + CellList.getMaxHeight(over) / 2);
			height = center + Math.max(body_drop, sign_height / 2 + CellList.getMaxHeight(under) / 2);
		} else {
			center = Math.max(body_center, sign_height / 2);
			height = center + Math.max(body_drop, sign_height / 2);
		}
	}

	public void setPosition (int x, int y) {
		super.setPosition(x, y);
		int cx = x + sign_width;
		if (int_style == INT_DEF) {
			CellList.arrange(over, cx, y - sign_height / 2 + CellList.getMaxCenter(over) / 2);
			CellList.arrange(under, cx, y + sign_height / 2 - CellList.getMaxDrop(under) / 2);
			cx += Math.max(CellList.getFullWidth(under), CellList.getFullWidth(over));
		}
		CellList.arrange(base, cx, y);
		CellList.arrange(var, cx + CellList.getFullWidth(base), y);
	}

	/**
	 * The variable name without the leading d.
	 */
	public final String getVarName() {
		String name = CellList.toString(var).trim();
		if (name.length() > 1 && name.charAt(0) == 'd')
			name = name.substring(1).trim();
		return name;
	}

	public String toString() {
		StringBuffer sb = new StringBuffer("integrate(");
		sb.append(CellList.toString(base)).append(',').append(getVarName());
		if (int_style == INT_DEF) {
			sb.append(',').append(CellList.toString(under));
			sb.append(',').append(CellList.toString(over));
		}
		sb.append(')');
		return sb.toString();
	}

	public String toTeX() {
		StringBuffer sb = new StringBuffer("\\int");
		if (int_style == INT_DEF) {
			sb.append("_{").append(CellList.toTeX(under)).append('}');
			sb.append("^{").append(CellList.toTeX(over)).append('}');
		}
		sb.append('{').append(CellList.toTeX(base)).append("}{\\;");
		sb.append(CellList.toTeX(var)).append('}');
		return sb.toString();
	}

	public String toXML() {
		if (int_style == INT_DEF)
			return "<in>" + CellList.toXMLRow(under) + CellList.toXMLRow(over)
					+ CellList.toXMLRow(base) + CellList.toXMLRow(var) + "</in>";
		return "<in def=\"false\">" + CellList.toXMLRow(base) + CellList.toXMLRow(var) + "</in>";
	}
}
