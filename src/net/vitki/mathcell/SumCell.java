package net.vitki.mathcell;

/**
 * Sum or product with limits above and below the sign.
 * A list sum (<code>lsum</code>) has no upper limit.
 *
 * @author vit
 *
 */
public class SumCell extends MathCell
{
	public static final int SM_SUM = 0;
	public static final int SM_PROD = 1;
	public static final int SM_LSUM = 2;

	private MathCell under;
	private MathCell over;
	private MathCell base;
	private int sum_style;
	private int sign_width;
	private int sign_height;

	public SumCell() {
		super();
		under = over = base = null;
		sum_style = SM_SUM;
		sign_width = sign_height = 0;
	}

	public MathCell copy() {
		SumCell tmp = new SumCell();
		tmp.copyData(this);
		tmp.sum_style = sum_style;
		tmp.setUnder(CellList.copyList(under));
		tmp.setOver(CellList.copyList(over));
		tmp.setBase(CellList.copyList(base));
		return tmp;
	}

	protected MathCell[] getInnerCells() {
		return new MathCell[] { under, over, base };
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

	public final int getSumStyle() {
		return sum_style;
	}

	public void setSumStyle (int style) {
		sum_style = style;
		invalidateSizeInformation();
	}

	protected void recalculateSize (LayoutContext ctx, int fontsize) {
		int small = LayoutContext.smaller(fontsize);
		CellList.recalculate(under, ctx, small);
		CellList.recalculate(over, ctx, small);
		CellList.recalculate(base, ctx, fontsize);
		sign_height = ctx.scalePx(fontsize * 3 / 2);
		sign_width = ctx.scalePx(fontsize);
		int sign_box = Math.max(sign_width,
					Math.max(CellList.getFullWidth(under), CellList.getFullWidth(over)));
		width = sign_box + ctx.scalePx(4) + CellList.getFullWidth(base);
		center = Math.max(CellList.getMaxCenter(base), CellList.getMaxHeight(over) + sign_height / 2);
		height = center + Math.max(CellList.getMaxDrop(base),
									CellList.getMaxHeight(under) + sign_height / 2);
	}

	public void setPosition (int x, int y) {
		super.setPosition(x, y);
		int under_w = CellList.getFullWidth(under);
		int over_w = CellList.getFullWidth(over);
		int sign_box = Math.max(sign_width, Math.max(under_w, over_w));
		CellList.arrange(under, x + (sign_box - under_w) / 2,
						y + sign_height / 2 + CellList.getMaxCenter(under));
		CellList.arrange(over, x + (sign_box - over_w) / 2,
						y - sign_height / 2 - CellList.getMaxDrop(over));
		CellList.arrange(base, x + width - CellList.getFullWidth(base), y);
	}

	public String toString() {
		String from = CellList.toString(under);
		if (sum_style == SM_LSUM) {
			int in = from.indexOf(" in ");
			if (in >= 0)
				from = from.substring(0, in) + "," + from.substring(in + 4);
			return "lsum(" + CellList.toString(base) + "," + from + ")";
		}
		int eq = from.indexOf('=');
		if (eq >= 0)
			from = from.substring(0, eq) + "," + from.substring(eq + 1);
		return (sum_style == SM_PROD ? "product(" : "sum(") + CellList.toString(base)
				+ "," + from + "," + CellList.toString(over) + ")";
	}

	public String toTeX() {
		String sign = sum_style == SM_PROD ? "\\prod" : "\\sum";
		String limits = "_{" + CellList.toTeX(under) + "}";
		if (sum_style != SM_LSUM)
			limits += "^{" + CellList.toTeX(over) + "}";
		return sign + limits + "{" + CellList.toTeX(base) + "}";
	}

	public String toXML() {
		String head;
		switch (sum_style) {
		case SM_PROD: head = "<sm type=\"prod\">"; break;
		case SM_LSUM: head = "<sm type=\"lsum\">"; break;
		default: head = "<sm>"; break;
		}
		return head + CellList.toXMLRow(under) + CellList.toXMLRow(over)
				+ CellList.toXMLRow(base) + "</sm>";
	}
}
