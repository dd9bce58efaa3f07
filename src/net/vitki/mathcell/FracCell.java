package net.vitki.mathcell;

/**
 * A fraction, a binomial coefficient (no line) or the d/dx part of a
 * derivative.
 *
 * @author vit
 *
 */
public class FracCell extends MathCell
{
	public static final int FC_NORMAL = 0;
	public static final int FC_CHOOSE = 1;
	public static final int FC_DIFF = 2;

	private MathCell num;
	private MathCell denom;
	private int frac_style;
	// inside an exponent fractions are written inline: a/b
	private boolean exponent;
	private int gap;
	private int slash_width;

	public FracCell() {
		super();
		num = denom = null;
		frac_style = FC_NORMAL;
		exponent = false;
		gap = slash_width = 0;
	}

	public MathCell copy() {
		FracCell tmp = new FracCell();
		tmp.copyData(this);
		tmp.frac_style = frac_style;
		tmp.exponent = exponent;
		tmp.setNum(CellList.copyList(num));
		tmp.setDenom(CellList.copyList(denom));
		return tmp;
	}

	protected MathCell[] getInnerCells() {
		return new MathCell[] { num, denom };
	}

	public final MathCell getNum() {
		return num;
	}

	public void setNum (MathCell cell) {
		if (num != null)
			num.destroy();
		num = cell;
		invalidateSizeInformation();
	}

	public final MathCell getDenom() {
		return denom;
	}

	public void setDenom (MathCell cell) {
		if (denom != null)
			denom.destroy();
		denom = cell;
		invalidateSizeInformation();
	}

	public final int getFracStyle() {
		return frac_style;
	}

	public void setFracStyle (int style) {
		frac_style = style;
		invalidateSizeInformation();
	}

	public void setExponentFlag() {
		exponent = true;
		invalidateSizeInformation();
	}

	public final boolean isExponent() {
		return exponent;
	}

    /*
     * ========================= Sizes ===============================
     */

	protected void recalculateSize (LayoutContext ctx, int fontsize) {
		CellList.recalculate(num, ctx, fontsize);
		CellList.recalculate(denom, ctx, fontsize);
		int num_w = CellList.getFullWidth(num);
		int denom_w = CellList.getFullWidth(denom);
		if (exponent) {
			slash_width = ctx.getTextWidth("/", TextStyle.TS_DEFAULT, fontsize);
			width = num_w + slash_width + denom_w;
			center = Math.max(CellList.getMaxCenter(num), CellList.getMaxCenter(denom));
			height = center + Math.max(CellList.getMaxDrop(num), CellList.getMaxDrop(denom));
			return;
		}
		gap = ctx.scalePx(2);
		width = Math.max(num_w, denom_w) + 2 * gap;
		height = CellList.getMaxHeight(num) + CellList.getMaxHeight(denom) + 2 * gap;
		center = CellList.getMaxHeight(num) + gap;
	}

	public void setPosition (int x, int y) {
		super.setPosition(x, y);
		if (exponent) {
			CellList.arrange(num, x, y);
			CellList.arrange(denom, x + CellList.getFullWidth(num) + slash_width, y);
			return;
		}
		int num_w = CellList.getFullWidth(num);
		int denom_w = CellList.getFullWidth(denom);
		CellList.arrange(num, x + (width - num_w) / 2, y - gap - CellList.getMaxDrop(num));
		CellList.arrange(denom, x + (width - denom_w) / 2, y + gap + CellList.getMaxCenter(denom));
	}

    /*
     * ========================= Conversions ===============================
     */

	public String getDiffPart() {
		StringBuffer sb = new StringBuffer();
		for (MathCell tmp = denom; tmp != null; tmp = tmp.next) {
			if ("d".equals(tmp.getValue()))
				continue;
			sb.append(tmp.getDiffPart());
		}
		return sb.toString();
	}

	public String toString() {
		if (frac_style == FC_CHOOSE)
			return "binomial(" + CellList.toString(num) + "," + CellList.toString(denom) + ")";
		return CellList.toGroupedString(num) + "/" + CellList.toGroupedString(denom);
	}

	public String toTeX() {
		if (frac_style == FC_CHOOSE)
			return "\\binom{" + CellList.toTeX(num) + "}{" + CellList.toTeX(denom) + "}";
		return "\\frac{" + CellList.toTeX(num) + "}{" + CellList.toTeX(denom) + "}";
	}

	public String toXML() {
		StringBuffer sb = new StringBuffer("<f");
		if (frac_style == FC_CHOOSE)
			sb.append(" line=\"no\"");
		else if (frac_style == FC_DIFF)
			sb.append(" diffstyle=\"yes\"");
		sb.append('>');
		sb.append(CellList.toXMLRow(num)).append(CellList.toXMLRow(denom));
		sb.append("</f>");
		return sb.toString();
	}
}
