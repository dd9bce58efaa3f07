package net.vitki.mathcell;

import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.util.HashMap;
import java.util.Vector;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.ParserConfigurationException;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

/**
 * Builds cell trees from worksheet markup.
 * <p>
 * Every element is dispatched on its tag name. Composite tags take their
 * parts from their children in a fixed order; when a part is missing the
 * tag produces nothing and parsing goes on with the next sibling.
 * Unknown tags with children are transparent. Unknown empty tags and
 * broken composites are reported to the notifier, once per call of a
 * public parse method.
 *
 * @author vit
 *
 */
public class MathParser
{
	public static final String TOO_LONG_TEXT = " << Expression too long to display! >>";
	public static final String WARNING_TEXT = "Parts of the document will not be loaded correctly!";
	public static final String ALT_COPY_ATTR = "altCopy";

	private static final int TAG_VARIABLE = 1;
	private static final int TAG_TEXT = 2;
	private static final int TAG_NUMBER = 3;
	private static final int TAG_GREEK = 4;
	private static final int TAG_SPECIAL = 5;
	private static final int TAG_FUNCTION_NAME = 6;
	private static final int TAG_STRING = 7;
	private static final int TAG_HIDDEN = 8;
	private static final int TAG_LABEL = 9;
	private static final int TAG_ASCII = 10;
	private static final int TAG_SPACE = 11;
	private static final int TAG_PAREN = 12;
	private static final int TAG_SQRT = 13;
	private static final int TAG_ABS = 14;
	private static final int TAG_CONJUGATE = 15;
	private static final int TAG_FRAC = 16;
	private static final int TAG_EXPT = 17;
	private static final int TAG_SUB = 18;
	private static final int TAG_SUBSUP = 19;
	private static final int TAG_FUN = 20;
	private static final int TAG_LIMIT = 21;
	private static final int TAG_SUM = 22;
	private static final int TAG_INT = 23;
	private static final int TAG_DIFF = 24;
	private static final int TAG_AT = 25;
	private static final int TAG_TABLE = 26;
	private static final int TAG_IMAGE = 27;
	private static final int TAG_SLIDE = 28;
	private static final int TAG_EDITOR = 29;
	private static final int TAG_CELL = 30;
	private static final int TAG_LINE = 31;
	private static final int TAG_ROW = 32;
	private static final int TAG_HIGHLIGHT = 33;

	private static HashMap tags;

	static {
		setupTags();
	}

	private static void setupTags() {
		tags = new HashMap();
		tags.put("v", Integer.valueOf(TAG_VARIABLE));
		tags.put("t", Integer.valueOf(TAG_TEXT));
		tags.put("n", Integer.valueOf(TAG_NUMBER));
		tags.put("g", Integer.valueOf(TAG_GREEK));
		tags.put("s", Integer.valueOf(TAG_SPECIAL));
		tags.put("fnm", Integer.valueOf(TAG_FUNCTION_NAME));
		tags.put("st", Integer.valueOf(TAG_STRING));
		tags.put("h", Integer.valueOf(TAG_HIDDEN));
		tags.put("lbl", Integer.valueOf(TAG_LABEL));
		tags.put("ascii", Integer.valueOf(TAG_ASCII));
		tags.put("mspace", Integer.valueOf(TAG_SPACE));
		tags.put("p", Integer.valueOf(TAG_PAREN));
		tags.put("q", Integer.valueOf(TAG_SQRT));
		tags.put("a", Integer.valueOf(TAG_ABS));
		tags.put("cj", Integer.valueOf(TAG_CONJUGATE));
		tags.put("f", Integer.valueOf(TAG_FRAC));
		tags.put("e", Integer.valueOf(TAG_EXPT));
		tags.put("i", Integer.valueOf(TAG_SUB));
		tags.put("ie", Integer.valueOf(TAG_SUBSUP));
		tags.put("fn", Integer.valueOf(TAG_FUN));
		tags.put("lm", Integer.valueOf(TAG_LIMIT));
		tags.put("sm", Integer.valueOf(TAG_SUM));
		tags.put("in", Integer.valueOf(TAG_INT));
		tags.put("d", Integer.valueOf(TAG_DIFF));
		tags.put("at", Integer.valueOf(TAG_AT));
		tags.put("tb", Integer.valueOf(TAG_TABLE));
		tags.put("img", Integer.valueOf(TAG_IMAGE));
		tags.put("slide", Integer.valueOf(TAG_SLIDE));
		tags.put("editor", Integer.valueOf(TAG_EDITOR));
		tags.put("cell", Integer.valueOf(TAG_CELL));
		tags.put("mth", Integer.valueOf(TAG_LINE));
		tags.put("line", Integer.valueOf(TAG_LINE));
		tags.put("r", Integer.valueOf(TAG_ROW));
		tags.put("hl", Integer.valueOf(TAG_HIGHLIGHT));
	}

	private ParserConfig config;
	private ImageResolver resolver;
	private Notifier notifier;
	private DocumentBuilder dbuilder;
	private PrintStream log_ps;

	// the warning has been given during the running call
	private boolean warned;
	private int skipped_count;

	public MathParser() {
		this(new ParserConfig(), null, null);
	}

	public MathParser(ParserConfig config, ImageResolver resolver, Notifier notifier) {
		this.config = config != null ? config : new ParserConfig();
		this.resolver = resolver;
		this.notifier = notifier;
		dbuilder = null;
		log_ps = null;
		warned = false;
		skipped_count = 0;
	}

	public final ParserConfig getConfig() {
		return config;
	}

	public final ImageResolver getResolver() {
		return resolver;
	}

	public void setDebugLog (PrintStream ps) {
		log_ps = ps;
	}

	/**
	 * Number of tags skipped by the last call.
	 */
	public final int getSkippedCount() {
		return skipped_count;
	}

    /*
     * ========================= Entry points ===============================
     */

	/**
	 * Parse an expression given as markup, the children of its root
	 * element become cells of the given type.
	 * Input longer than the configured limit is not parsed: a single
	 * line with a notice is returned instead.
	 */
	public MathCell parseLine (String s, int type) throws CellParseException {
		if (s == null)
			throw new CellParseException("no expression");
		startCall();
		s = replaceControlChars(s);
		int cutoff = config.getLengthCutoff();
		if (cutoff != ParserConfig.UNLIMITED && s.length() >= cutoff) {
			logln("expression of "+s.length()+" characters not parsed");
			TextCell cell = new TextCell(TOO_LONG_TEXT);
			cell.setType(type);
			cell.forceBreakLine(true);
			return cell;
		}
		Document doc;
		try {
			doc = getDocumentBuilder().parse(new InputSource(new StringReader(s)));
		} catch (SAXException e) {
			throw new CellParseException("malformed expression: "+e.getMessage(), e);
		} catch (IOException e) {
			throw new CellParseException("cannot read expression: "+e.getMessage(), e);
		}
		Element root = doc.getDocumentElement();
		Util.normalizeElement(root);
		return parse(root.getFirstChild(), true, ParseContext.forType(type));
	}

	/**
	 * Parse all children of the document element of a worksheet.
	 */
	public MathCell parseDocument (Document doc) throws CellParseException {
		if (doc == null || doc.getDocumentElement() == null)
			throw new CellParseException("no document");
		startCall();
		Element root = doc.getDocumentElement();
		Util.normalizeElement(root);
		return parse(root.getFirstChild(), true, ParseContext.DEFAULT);
	}

	public MathCell parseTag (Node node, boolean all) {
		return parseTag(node, all, ParseContext.DEFAULT);
	}

	/**
	 * Parse node and, when all is set, the siblings following it.
	 * Returns the head of the chain built, null when nothing was built.
	 */
	public MathCell parseTag (Node node, boolean all, ParseContext ctx) {
		startCall();
		if (node != null && node.getNodeType() == Node.ELEMENT_NODE) {
			Node parent = node.getParentNode();
			// indentation between siblings is dropped as well
			if (all && parent != null && parent.getNodeType() == Node.ELEMENT_NODE)
				Util.normalizeElement(parent);
			else
				Util.normalizeElement(node);
		}
		return parse(node, all, ctx);
	}

	private void startCall() {
		warned = false;
		skipped_count = 0;
	}

	private static String replaceControlChars (String s) {
		StringBuffer sb = null;
		int n = s.length();
		for (int i = 0; i < n; i++) {
			char c = s.charAt(i);
			if (Character.isISOControl(c)) {
				if (sb == null) {
					sb = new StringBuffer(n);
					sb.append(s.substring(0, i));
				}
				sb.append('\uFFFD');
			} else if (sb != null) {
				sb.append(c);
			}
		}
		return sb == null ? s : sb.toString();
	}

	private DocumentBuilder getDocumentBuilder() throws CellParseException {
		if (dbuilder == null) {
			try {
				dbuilder = Util.newDocumentBuilder();
			} catch (ParserConfigurationException e) {
				throw new CellParseException("no xml parser: "+e.getMessage(), e);
			}
		}
		return dbuilder;
	}

    /*
     * ========================= Traverser ===============================
     */

	private MathCell parse (Node node, boolean all, ParseContext ctx) {
		MathCell head = null;
		MathCell tail = null;
		for (; node != null; node = node.getNextSibling()) {
			MathCell cell;
			switch (node.getNodeType()) {
			case Node.ELEMENT_NODE:
				Element elem = (Element) node;
				cell = parseElement(elem, ctx);
				if (cell != null && elem.hasAttribute(ALT_COPY_ATTR))
					cell.setAltCopyText(elem.getAttribute(ALT_COPY_ATTR));
				break;
			case Node.TEXT_NODE:
			case Node.CDATA_SECTION_NODE:
				cell = newText(node.getNodeValue(), TextStyle.TS_DEFAULT, ctx);
				break;
			default:
				continue;
			}
			if (cell != null) {
				if (head == null)
					head = cell;
				else
					tail.appendCell(cell);
				tail = cell.last();
			}
			if (!all)
				break;
		}
		return head;
	}

	private MathCell parseElement (Element elem, ParseContext ctx) {
		String tag = Util.getTagName(elem);
		Integer id = (Integer) tags.get(tag);
		if (id == null) {
			if (elem.hasChildNodes())
				return parse(elem.getFirstChild(), true, ctx);
			return skipped(tag, "unknown tag", null);
		}
		MathCell cell;
		switch (id.intValue()) {
		case TAG_VARIABLE:
			return parseText(elem, TextStyle.TS_VARIABLE, ctx);
		case TAG_TEXT:
			if ("error".equals(elem.getAttribute("type")))
				return parseText(elem, TextStyle.TS_ERROR, ctx);
			return parseText(elem, TextStyle.TS_DEFAULT, ctx);
		case TAG_NUMBER:
			return parseText(elem, TextStyle.TS_NUMBER, ctx);
		case TAG_GREEK:
			return parseText(elem, TextStyle.TS_GREEK_CONSTANT, ctx);
		case TAG_SPECIAL:
			return parseText(elem, TextStyle.TS_SPECIAL_CONSTANT, ctx);
		case TAG_FUNCTION_NAME:
			return parseText(elem, TextStyle.TS_FUNCTION, ctx);
		case TAG_STRING:
			return parseText(elem, TextStyle.TS_STRING, ctx);
		case TAG_HIDDEN:
			cell = parseText(elem, TextStyle.TS_DEFAULT, ctx);
			cell.setHidden(true);
			return cell;
		case TAG_LABEL:
			if ("yes".equals(elem.getAttribute("userdefined")))
				cell = parseText(elem, TextStyle.TS_USERLABEL, ctx);
			else
				cell = parseText(elem, TextStyle.TS_LABEL, ctx);
			cell.forceBreakLine(true);
			return cell;
		case TAG_ASCII:
			return parseCharCode(elem, ctx);
		case TAG_SPACE:
			return newText(" ", TextStyle.TS_DEFAULT, ctx);
		case TAG_PAREN:
		case TAG_SQRT:
		case TAG_ABS:
		case TAG_CONJUGATE:
			return parseInner(elem, id.intValue(), ctx);
		case TAG_FRAC:
			return parseFrac(elem, ctx);
		case TAG_EXPT:
			return parseExpt(elem, ctx);
		case TAG_SUB:
			return parseSub(elem, ctx);
		case TAG_SUBSUP:
			return parseSubSup(elem, ctx);
		case TAG_FUN:
			return parseFun(elem, ctx);
		case TAG_LIMIT:
			return parseLimit(elem, ctx);
		case TAG_SUM:
			return parseSum(elem, ctx);
		case TAG_INT:
			return parseIntegral(elem, ctx);
		case TAG_DIFF:
			return parseDiff(elem, ctx);
		case TAG_AT:
			return parseAt(elem, ctx);
		case TAG_TABLE:
			return parseTable(elem, ctx);
		case TAG_IMAGE:
			return parseImage(elem);
		case TAG_SLIDE:
			return parseSlide(elem);
		case TAG_EDITOR:
			return parseEditorTag(elem);
		case TAG_CELL:
			return parseCellTag(elem, ctx);
		case TAG_LINE:
			cell = parse(elem.getFirstChild(), true, ctx);
			if (cell != null)
				cell.forceBreakLine(true);
			else
				cell = newText(" ", TextStyle.TS_DEFAULT, ctx);
			return cell;
		case TAG_ROW:
			return parse(elem.getFirstChild(), true, ctx);
		case TAG_HIGHLIGHT:
			return parse(elem.getFirstChild(), true, ctx.withHighlight(true));
		}
		return skipped(tag, "unknown tag", null);
	}

	/**
	 * Log a skipped tag, warn the user once per call.
	 * The partially built cell is destroyed.
	 */
	private MathCell skipped (String tag, String reason, MathCell partial) {
		if (partial != null)
			partial.destroy();
		skipped_count++;
		logln("skipped <"+tag+">: "+reason);
		if (!warned) {
			warned = true;
			if (notifier != null)
				notifier.warning(WARNING_TEXT+" Found "+reason+" <"+tag+">");
		}
		return null;
	}

	private MathCell malformed (Element elem, MathCell partial) {
		return skipped(Util.getTagName(elem), "incomplete tag", partial);
	}

	private static Vector getChildren (Element elem) {
		Vector kids = new Vector();
		for (Node n = elem.getFirstChild(); n != null; n = n.getNextSibling()) {
			short t = n.getNodeType();
			if (t == Node.ELEMENT_NODE || t == Node.TEXT_NODE || t == Node.CDATA_SECTION_NODE)
				kids.add(n);
		}
		return kids;
	}

	/**
	 * Flags of composite tags are given by any attribute at all.
	 */
	private static boolean hasFlagAttributes (Element elem) {
		return elem.getAttributes().getLength() > 0;
	}

	private static MathCell finish (MathCell cell, ParseContext ctx) {
		cell.setType(ctx.getType());
		cell.setStyle(TextStyle.TS_VARIABLE);
		cell.setHighlight(ctx.isHighlight());
		return cell;
	}

    /*
     * ========================= Text ===============================
     */

	private MathCell parseText (Element elem, int style, ParseContext ctx) {
		return newText(elem.getTextContent(), style, ctx);
	}

	private TextCell newText (String text, int style, ParseContext ctx) {
		TextCell cell = new TextCell(text);
		cell.setType(style == TextStyle.TS_ERROR ? MathCell.MC_TYPE_ERROR : ctx.getType());
		cell.setStyle(style);
		cell.setHighlight(ctx.isHighlight());
		if (style == TextStyle.TS_NUMBER) {
			String shown = truncateDigits(cell.getValue(), config.getDisplayedDigits());
			if (!shown.equals(cell.getValue()))
				cell.setDisplayedValue(shown.replace('-', TextCell.UNICODE_MINUS));
		}
		return cell;
	}

	/**
	 * Elide the middle of a number longer than cutoff digits:
	 * <code>123[8 digits]234</code>. The cutoff is at least 10.
	 */
	public static final String truncateDigits (String digits, int cutoff) {
		if (cutoff < ParserConfig.MIN_DISPLAYED_DIGITS)
			cutoff = ParserConfig.MIN_DISPLAYED_DIGITS;
		int len = digits.length();
		if (len <= cutoff)
			return digits;
		int left = cutoff / 3;
		if (left > 30)
			left = 30;
		return digits.substring(0, left) + "[" + (len - 2 * left) + " digits]"
				+ digits.substring(len - left);
	}

	private MathCell parseCharCode (Element elem, ParseContext ctx) {
		String text = elem.getTextContent();
		try {
			int code = Integer.parseInt(text.trim());
			text = new String(Character.toChars(code));
		} catch (NumberFormatException e) {
			logln("ascii: not a character code ["+text+"]");
		} catch (IllegalArgumentException e) {
			logln("ascii: no such character ["+text+"]");
		}
		return newText(text, TextStyle.TS_DEFAULT, ctx);
	}

    /*
     * ========================= Composites ===============================
     */

	private MathCell parseInner (Element elem, int id, ParseContext ctx) {
		if (!elem.hasChildNodes())
			return malformed(elem, null);
		InnerCell cell;
		switch (id) {
		case TAG_SQRT: cell = new SqrtCell(); break;
		case TAG_ABS: cell = new AbsCell(); break;
		case TAG_CONJUGATE: cell = new ConjugateCell(); break;
		default:
			ParenCell paren = new ParenCell();
			if (hasFlagAttributes(elem))
				paren.setPrint(false);
			cell = paren;
			break;
		}
		cell.setInner(parse(elem.getFirstChild(), true, ctx));
		if (cell.getInner() == null)
			return malformed(elem, cell);
		return finish(cell, ctx);
	}

	private MathCell parseFrac (Element elem, ParseContext ctx) {
		Vector kids = getChildren(elem);
		if (kids.size() < 2)
			return malformed(elem, null);
		FracCell frac = new FracCell();
		frac.setFracStyle(ctx.getFracStyle());
		frac.setNum(parse((Node) kids.get(0), false, ctx));
		frac.setDenom(parse((Node) kids.get(1), false, ctx));
		if (frac.getNum() == null || frac.getDenom() == null)
			return malformed(elem, frac);
		if ("no".equals(elem.getAttribute("line")))
			frac.setFracStyle(FracCell.FC_CHOOSE);
		if ("yes".equals(elem.getAttribute("diffstyle")))
			frac.setFracStyle(FracCell.FC_DIFF);
		return finish(frac, ctx);
	}

	private MathCell parseExpt (Element elem, ParseContext ctx) {
		Vector kids = getChildren(elem);
		if (kids.size() < 2)
			return malformed(elem, null);
		ExptCell expt = new ExptCell();
		expt.setMatrix(hasFlagAttributes(elem));
		expt.setBase(parse((Node) kids.get(0), false, ctx));
		expt.setPower(parse((Node) kids.get(1), false, ctx));
		if (expt.getBase() == null || expt.getPower() == null)
			return malformed(elem, expt);
		return finish(expt, ctx);
	}

	private MathCell parseSub (Element elem, ParseContext ctx) {
		Vector kids = getChildren(elem);
		if (kids.size() < 2)
			return malformed(elem, null);
		SubCell sub = new SubCell();
		sub.setBase(parse((Node) kids.get(0), false, ctx));
		sub.setIndex(parse((Node) kids.get(1), false, ctx));
		if (sub.getBase() == null || sub.getIndex() == null)
			return malformed(elem, sub);
		return finish(sub, ctx);
	}

	private MathCell parseSubSup (Element elem, ParseContext ctx) {
		Vector kids = getChildren(elem);
		if (kids.size() < 3)
			return malformed(elem, null);
		SubSupCell subsup = new SubSupCell();
		subsup.setBase(parse((Node) kids.get(0), false, ctx));
		subsup.setIndex(parse((Node) kids.get(1), false, ctx));
		subsup.setPower(parse((Node) kids.get(2), false, ctx));
		if (subsup.getBase() == null || subsup.getIndex() == null || subsup.getPower() == null)
			return malformed(elem, subsup);
		return finish(subsup, ctx);
	}

	private MathCell parseFun (Element elem, ParseContext ctx) {
		Vector kids = getChildren(elem);
		if (kids.size() < 2)
			return malformed(elem, null);
		FunCell fun = new FunCell();
		fun.setName(parse((Node) kids.get(0), false, ctx));
		fun.setArg(parse((Node) kids.get(1), false, ctx));
		if (fun.getName() == null || fun.getArg() == null)
			return malformed(elem, fun);
		return finish(fun, ctx);
	}

	private MathCell parseLimit (Element elem, ParseContext ctx) {
		Vector kids = getChildren(elem);
		if (kids.size() < 3)
			return malformed(elem, null);
		LimitCell limit = new LimitCell();
		limit.setName(parse((Node) kids.get(0), false, ctx));
		limit.setUnder(parse((Node) kids.get(1), false, ctx));
		limit.setBase(parse((Node) kids.get(2), false, ctx));
		if (limit.getName() == null || limit.getUnder() == null || limit.getBase() == null)
			return malformed(elem, limit);
		return finish(limit, ctx);
	}

	private MathCell parseSum (Element elem, ParseContext ctx) {
		Vector kids = getChildren(elem);
		if (kids.size() < 3)
			return malformed(elem, null);
		String type = elem.getAttribute("type");
		SumCell sum = new SumCell();
		if ("prod".equals(type))
			sum.setSumStyle(SumCell.SM_PROD);
		else if ("lsum".equals(type))
			sum.setSumStyle(SumCell.SM_LSUM);
		sum.setUnder(parse((Node) kids.get(0), false, ctx));
		// a list sum has no upper limit, its second child is ignored
		if (sum.getSumStyle() != SumCell.SM_LSUM)
			sum.setOver(parse((Node) kids.get(1), false, ctx));
		sum.setBase(parse((Node) kids.get(2), false, ctx));
		if (sum.getUnder() == null || sum.getBase() == null
				|| (sum.getOver() == null && sum.getSumStyle() != SumCell.SM_LSUM))
			return malformed(elem, sum);
		return finish(sum, ctx);
	}

	/**
	 * <code>&lt;in&gt;</code> without attributes is a definite integral:
	 * lower and upper limit, integrand, variable. With attributes it is an
	 * indefinite one: integrand, variable. The variable takes all
	 * remaining children.
	 */
	private MathCell parseIntegral (Element elem, ParseContext ctx) {
		Vector kids = getChildren(elem);
		IntCell in = new IntCell();
		if (!hasFlagAttributes(elem)) {
			if (kids.size() < 4)
				return malformed(elem, in);
			in.setIntStyle(IntCell.INT_DEF);
			in.setUnder(parse((Node) kids.get(0), false, ctx));
			in.setOver(parse((Node) kids.get(1), false, ctx));
			in.setBase(parse((Node) kids.get(2), false, ctx));
			in.setVar(parse((Node) kids.get(3), true, ctx));
			if (in.getUnder() == null || in.getOver() == null)
				return malformed(elem, in);
		} else {
			if (kids.size() < 2)
				return malformed(elem, in);
			in.setIntStyle(IntCell.INT_IDEF);
			in.setBase(parse((Node) kids.get(0), false, ctx));
			in.setVar(parse((Node) kids.get(1), true, ctx));
		}
		if (in.getBase() == null || in.getVar() == null)
			return malformed(elem, in);
		return finish(in, ctx);
	}

	private MathCell parseDiff (Element elem, ParseContext ctx) {
		Vector kids = getChildren(elem);
		if (kids.size() < 2)
			return malformed(elem, null);
		DiffCell diff = new DiffCell();
		diff.setDiff(parse((Node) kids.get(0), false, ctx.withFracStyle(FracCell.FC_DIFF)));
		diff.setBase(parse((Node) kids.get(1), true, ctx));
		if (diff.getDiff() == null || diff.getBase() == null)
			return malformed(elem, diff);
		return finish(diff, ctx);
	}

	private MathCell parseAt (Element elem, ParseContext ctx) {
		Vector kids = getChildren(elem);
		if (kids.size() < 2)
			return malformed(elem, null);
		AtCell at = new AtCell();
		at.setBase(parse((Node) kids.get(0), false, ctx));
		at.setIndex(parse((Node) kids.get(1), false, ctx));
		if (at.getBase() == null || at.getIndex() == null)
			return malformed(elem, at);
		return finish(at, ctx);
	}

	private MathCell parseTable (Element elem, ParseContext ctx) {
		MatrCell matrix = new MatrCell();
		if ("true".equals(elem.getAttribute("special")))
			matrix.setSpecialFlag(true);
		if ("true".equals(elem.getAttribute("inference"))) {
			matrix.setInferenceFlag(true);
			matrix.setSpecialFlag(true);
		}
		if ("true".equals(elem.getAttribute("colnames")))
			matrix.setColNames(true);
		if ("true".equals(elem.getAttribute("rownames")))
			matrix.setRowNames(true);
		for (Node row = elem.getFirstChild(); row != null; row = row.getNextSibling()) {
			if (row.getNodeType() != Node.ELEMENT_NODE)
				continue;
			matrix.newRow();
			for (Node cell = row.getFirstChild(); cell != null; cell = cell.getNextSibling()) {
				matrix.newColumn();
				matrix.addNewCell(parse(cell, false, ctx));
			}
		}
		matrix.setDimension();
		return finish(matrix, ctx);
	}

    /*
     * ========================= Images ===============================
     */

	/**
	 * Images read from an archive are never deleted, other images are
	 * temporary files unless <code>del="no"</code>.
	 */
	private MathCell parseImage (Element elem) {
		String filename = elem.getTextContent().trim();
		boolean delete = !"no".equals(elem.getAttribute("del"));
		if (resolver != null && resolver.isArchive())
			delete = false;
		ImgCell img = new ImgCell(filename, resolver, delete);
		if ("false".equals(elem.getAttribute("rect")))
			img.drawRectangle(false);
		if (!img.isLoaded())
			logln("image "+filename+" has no displayable contents");
		return img;
	}

	private MathCell parseSlide (Element elem) {
		SlideShowCell slide = new SlideShowCell(resolver);
		if (elem.hasAttribute("fr")) {
			String rate = elem.getAttribute("fr");
			try {
				slide.setFrameRate(Integer.parseInt(rate.trim()));
			} catch (NumberFormatException e) {
				logln("slide: incorrect frame rate ["+rate+"]");
			}
		}
		slide.loadImages(elem.getTextContent());
		return slide;
	}

    /*
     * ========================= Groups ===============================
     */

	/**
	 * Lines of an editor are joined with newlines, empty lines included.
	 */
	public MathCell parseEditorTag (Element elem) {
		EditorCell editor = new EditorCell();
		editor.setType(EditorCell.typeFromName(elem.getAttribute("type")));
		StringBuffer sb = new StringBuffer();
		boolean first = true;
		for (Node line = elem.getFirstChild(); line != null; line = line.getNextSibling()) {
			if (line.getNodeType() != Node.ELEMENT_NODE || !"line".equals(Util.getTagName(line)))
				continue;
			if (!first)
				sb.append('\n');
			sb.append(line.getTextContent());
			first = false;
		}
		editor.setValue(sb.toString());
		return editor;
	}

	/**
	 * Build one worksheet group. A <code>fold</code> child holds the
	 * groups that were folded under a heading when the worksheet was saved.
	 */
	public MathCell parseCellTag (Element elem, ParseContext ctx) {
		boolean hide = "true".equals(elem.getAttribute("hide"));
		String type = elem.getAttribute("type");
		if (type.length() == 0)
			type = "text";
		GroupCell group;
		if ("code".equals(type)) {
			group = new GroupCell(GroupCell.GC_TYPE_CODE);
			for (Node n = elem.getFirstChild(); n != null; n = n.getNextSibling()) {
				if (n.getNodeType() != Node.ELEMENT_NODE)
					continue;
				String name = Util.getTagName(n);
				if ("input".equals(name))
					group.setEditableContent(takeEditorValue(parse(n.getFirstChild(), true, ctx)));
				else if ("output".equals(name))
					group.appendOutput(parse(n.getFirstChild(), true, ctx));
			}
		} else if ("image".equals(type)) {
			group = new GroupCell(GroupCell.GC_TYPE_IMAGE);
			for (Node n = elem.getFirstChild(); n != null; n = n.getNextSibling()) {
				if (n.getNodeType() == Node.ELEMENT_NODE && "editor".equals(Util.getTagName(n)))
					group.setEditableContent(takeEditorValue(parseEditorTag((Element) n)));
				else
					group.appendOutput(parse(n, false, ctx));
			}
		} else if ("pagebreak".equals(type)) {
			group = new GroupCell(GroupCell.GC_TYPE_PAGEBREAK);
		} else if ("text".equals(type)) {
			group = new GroupCell(GroupCell.GC_TYPE_TEXT);
			group.setEditableContent(takeEditorValue(parse(elem.getFirstChild(), true, ctx)));
		} else {
			int gc_type;
			if ("title".equals(type))
				gc_type = GroupCell.GC_TYPE_TITLE;
			else if ("section".equals(type))
				gc_type = GroupCell.GC_TYPE_SECTION;
			else if ("subsection".equals(type))
				// subsubsections are saved as subsections to stay readable by old versions
				gc_type = "4".equals(elem.getAttribute("sectioning_level"))
							? GroupCell.GC_TYPE_SUBSUBSECTION : GroupCell.GC_TYPE_SUBSECTION;
			else if ("subsubsection".equals(type))
				gc_type = GroupCell.GC_TYPE_SUBSUBSECTION;
			else
				return skipped("cell", "unknown cell type \""+type+"\"", null);
			group = new GroupCell(gc_type);
			for (Node n = elem.getFirstChild(); n != null; n = n.getNextSibling()) {
				if (n.getNodeType() != Node.ELEMENT_NODE)
					continue;
				String name = Util.getTagName(n);
				if ("editor".equals(name))
					group.setEditableContent(takeEditorValue(parseEditorTag((Element) n)));
				else if ("fold".equals(name))
					group.hideTree(parseFold((Element) n, ctx));
			}
		}
		group.setGroup(group);
		group.hide(hide);
		return group;
	}

	/**
	 * Every child of a fold is one group; they are chained but not laid out.
	 */
	private GroupCell parseFold (Element fold, ParseContext ctx) {
		GroupCell tree = null;
		for (Node n = fold.getFirstChild(); n != null; n = n.getNextSibling()) {
			MathCell cell = parse(n, false, ctx);
			if (cell == null)
				continue;
			if (!(cell instanceof GroupCell)) {
				skipped(Util.getTagName(n), "no cell inside fold", cell);
				continue;
			}
			if (tree == null)
				tree = (GroupCell) cell;
			else
				tree.appendCell(cell);
		}
		return tree;
	}

	/**
	 * The text of the first editor in a chain. The chain is destroyed.
	 */
	private static String takeEditorValue (MathCell chain) {
		String value = "";
		for (MathCell tmp = chain; tmp != null; tmp = tmp.getNext()) {
			if (tmp instanceof EditorCell) {
				value = tmp.getValue();
				break;
			}
		}
		if (chain != null)
			chain.destroy();
		return value;
	}

    /*
     * ============================= Debugging ============================
     */

	protected void log (String s) {
		if (log_ps != null)
			log_ps.print(s);
	}

	protected void logln (String s) {
		if (log_ps != null)
			log_ps.println(s);
	}
}
