package net.vitki.mathcell;

/**
 * Editable text of a group: maxima input, comment text, a title or
 * a section heading. Editing itself is done elsewhere; this cell only
 * holds, measures and writes the text.
 *
 * @author vit
 *
 */
public class EditorCell extends MathCell
{
	private String value;

	public EditorCell() {
		this("");
	}

	public EditorCell(String text) {
		super();
		type = MC_TYPE_INPUT;
		text_style = TextStyle.TS_INPUT;
		setValue(text);
	}

	public MathCell copy() {
		EditorCell tmp = new EditorCell(value);
		tmp.copyData(this);
		return tmp;
	}

	public String getValue() {
		return value;
	}

	public void setValue (String text) {
		value = text == null ? "" : text;
		invalidateSizeInformation();
	}

	/**
	 * Also selects the text style the contents are shown with.
	 */
	public void setType (int type) {
		super.setType(type);
		switch (type) {
		case MC_TYPE_TEXT: text_style = TextStyle.TS_TEXT; break;
		case MC_TYPE_TITLE: text_style = TextStyle.TS_TITLE; break;
		case MC_TYPE_SECTION: text_style = TextStyle.TS_SECTION; break;
		case MC_TYPE_SUBSECTION: text_style = TextStyle.TS_SUBSECTION; break;
		case MC_TYPE_SUBSUBSECTION: text_style = TextStyle.TS_SUBSUBSECTION; break;
		default: text_style = TextStyle.TS_INPUT; break;
		}
		invalidateSizeInformation();
	}

	public final String[] getLines() {
		return value.split("\n", -1);
	}

	public static final int typeFromName (String name) {
		if ("text".equals(name))
			return MC_TYPE_TEXT;
		if ("title".equals(name))
			return MC_TYPE_TITLE;
		if ("section".equals(name))
			return MC_TYPE_SECTION;
		if ("subsection".equals(name))
			return MC_TYPE_SUBSECTION;
		if ("subsubsection".equals(name))
			return MC_TYPE_SUBSUBSECTION;
		return MC_TYPE_INPUT;
	}

	public static final String typeName (int type) {
		switch (type) {
		case MC_TYPE_TEXT: return "text";
		case MC_TYPE_TITLE: return "title";
		case MC_TYPE_SECTION: return "section";
		case MC_TYPE_SUBSECTION: return "subsection";
		case MC_TYPE_SUBSUBSECTION: return "subsubsection";
		}
		return "input";
	}

	protected void recalculateSize (LayoutContext ctx, int fontsize) {
		String[] lines = getLines();
		int line_height = ctx.getTextHeight(text_style, fontsize) + ctx.scalePx(MC_LINE_SKIP);
		int pad = ctx.scalePx(MC_TEXT_PADDING);
		int w = 0;
		for (int i = 0; i < lines.length; i++)
			w = Math.max(w, ctx.getTextWidth(lines[i], text_style, fontsize));
		width = w + 2 * pad;
		height = lines.length * line_height + 2 * pad;
		center = line_height / 2 + pad;
	}

	public String toString() {
		return value;
	}

	public String toTeX() {
		switch (type) {
		case MC_TYPE_INPUT:
			return "\\begin{verbatim}\n" + value + "\n\\end{verbatim}";
		case MC_TYPE_TITLE:
			return "\\title{" + Util.texEscape(value) + "}\n\\maketitle";
		case MC_TYPE_SECTION:
			return "\\section{" + Util.texEscape(value) + "}";
		case MC_TYPE_SUBSECTION:
			return "\\subsection{" + Util.texEscape(value) + "}";
		case MC_TYPE_SUBSUBSECTION:
			return "\\subsubsection{" + Util.texEscape(value) + "}";
		}
		return Util.texEscape(value);
	}

	public String toXML() {
		StringBuffer sb = new StringBuffer();
		sb.append("<editor type=\"").append(typeName(type)).append("\">");
		String[] lines = getLines();
		for (int i = 0; i < lines.length; i++)
			sb.append("<line>").append(Util.xmlEscape(lines[i])).append("</line>");
		sb.append("</editor>");
		return sb.toString();
	}
}
