package net.vitki.mathcell;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.StringReader;
import java.util.Vector;

import org.junit.Before;
import org.junit.Test;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;

public class MathParserTest
{
	static class RecordingNotifier implements Notifier
	{
		Vector messages = new Vector();

		public void warning (String message) {
			messages.add(message);
		}
	}

	private RecordingNotifier notifier;
	private MathParser parser;

	@Before
	public void setUp() {
		notifier = new RecordingNotifier();
		parser = new MathParser(new ParserConfig(), null, notifier);
	}

	private MathCell parse (String markup) throws CellParseException {
		return parser.parseLine("<mth>" + markup + "</mth>", MathCell.MC_TYPE_DEFAULT);
	}

	private static Element element (String xml) throws Exception {
		return Util.newDocumentBuilder().parse(new InputSource(new StringReader(xml))).getDocumentElement();
	}

	@Test
	public void textTagsBecomeASiblingChain() throws Exception {
		MathCell head = parse("<v>x</v><t>+</t><n>1</n>");
		assertEquals(3, CellList.length(head));
		assertEquals("x+1", CellList.toString(head));
		assertEquals(TextStyle.TS_VARIABLE, head.getStyle());
		assertEquals(TextStyle.TS_NUMBER, head.getNext().getNext().getStyle());
		assertEquals(head, head.getNext().getPrevious());
		assertTrue(notifier.messages.isEmpty());
	}

	@Test
	public void fractions() throws Exception {
		MathCell cell = parse("<f><r><v>a</v></r><r><n>2</n></r></f>");
		assertTrue(cell instanceof FracCell);
		assertEquals("a/2", cell.toString());

		cell = parse("<f line=\"no\"><r><v>n</v></r><r><v>k</v></r></f>");
		assertEquals(FracCell.FC_CHOOSE, ((FracCell) cell).getFracStyle());
		assertEquals("binomial(n,k)", cell.toString());
	}

	@Test
	public void exponentWithAnyAttributeIsMatrixPower() throws Exception {
		MathCell cell = parse("<e type=\"mat\"><r><v>A</v></r><r><n>2</n></r></e>");
		assertTrue(((ExptCell) cell).isMatrix());
		assertEquals("A^^2", cell.toString());
		ExptCell plain = (ExptCell) parse("<e><v>x</v><n>2</n></e>");
		assertEquals("x^2", plain.toString());
		assertTrue(((TextCell) plain.getPower()).isExponent());
		assertFalse(((TextCell) plain.getBase()).isExponent());
	}

	@Test
	public void incompleteCompositeIsSkippedWithOneWarning() throws Exception {
		MathCell head = parse("<f><r><v>a</v></r></f><v>y</v>");
		assertEquals(1, CellList.length(head));
		assertEquals("y", head.getValue());
		assertEquals(1, notifier.messages.size());
		String msg = (String) notifier.messages.get(0);
		assertTrue(msg.startsWith(MathParser.WARNING_TEXT));
		assertTrue(msg.indexOf("<f>") >= 0);
		assertEquals(1, parser.getSkippedCount());
	}

	@Test
	public void warningIsGivenOncePerCall() throws Exception {
		parse("<foo/><bar/><v>x</v>");
		assertEquals(1, notifier.messages.size());
		assertEquals(2, parser.getSkippedCount());
		parse("<baz/>");
		assertEquals(2, notifier.messages.size());
		assertEquals(1, parser.getSkippedCount());
	}

	@Test
	public void unknownTagWithChildrenIsTransparent() throws Exception {
		MathCell head = parse("<wrap><v>x</v><v>y</v></wrap>");
		assertEquals("xy", CellList.toString(head));
		assertTrue(notifier.messages.isEmpty());
	}

	@Test
	public void emptyRowGivesNothingSilently() throws Exception {
		assertNull(parse("<r></r>"));
		assertTrue(notifier.messages.isEmpty());
	}

	@Test
	public void sums() throws Exception {
		MathCell cell = parse("<sm><r><v>i</v><t>=</t><n>1</n></r><r><v>n</v></r><r><v>i</v></r></sm>");
		assertEquals("sum(i,i,1,n)", cell.toString());

		cell = parse("<sm type=\"prod\"><r><v>k</v><t>=</t><n>1</n></r><r><n>5</n></r><r><v>k</v></r></sm>");
		assertEquals("product(k,k,1,5)", cell.toString());

		cell = parse("<sm type=\"lsum\"><r><v>i</v><t> in </t><v>L</v></r><r><v>z</v></r><r><v>i</v></r></sm>");
		assertNull(((SumCell) cell).getOver());
		assertEquals("lsum(i,i,L)", cell.toString());
	}

	@Test
	public void integrals() throws Exception {
		MathCell cell = parse("<in><r><n>0</n></r><r><n>1</n></r><r><v>x</v></r><r><s>d</s><v>x</v></r></in>");
		assertEquals(IntCell.INT_DEF, ((IntCell) cell).getIntStyle());
		assertEquals("integrate(x,x,0,1)", cell.toString());

		cell = parse("<in def=\"false\"><r><v>x</v></r><r><s>d</s><v>x</v></r></in>");
		assertEquals(IntCell.INT_IDEF, ((IntCell) cell).getIntStyle());
		assertEquals("integrate(x,x)", cell.toString());
	}

	@Test
	public void definiteIntegralWithoutLimitsIsSkipped() throws Exception {
		assertNull(parse("<in><r><v>x</v></r><r><v>y</v></r></in>"));
		assertEquals(1, notifier.messages.size());
	}

	@Test
	public void derivative() throws Exception {
		MathCell cell = parse("<d><f diffstyle=\"yes\"><r><s>d</s></r><r><s>d</s><v>x</v></r></f><r><v>y</v></r></d>");
		assertTrue(cell instanceof DiffCell);
		assertEquals(FracCell.FC_DIFF, ((FracCell) ((DiffCell) cell).getDiff()).getFracStyle());
		assertEquals("'diff(y,x,1)", cell.toString());
	}

	@Test
	public void limitsAndEvaluationPoints() throws Exception {
		MathCell cell = parse("<lm><r><fnm>lim</fnm></r><r><v>x</v><t>-></t><n>0</n><t>+</t></r><r><v>f</v></r></lm>");
		assertEquals("limit(f,x,0,plus)", cell.toString());
		cell = parse("<at><r><v>f</v></r><r><v>x</v><t>=</t><n>0</n></r></at>");
		assertEquals("at(f,x=0)", cell.toString());
	}

	@Test
	public void wrappers() throws Exception {
		assertEquals("sqrt(x)", parse("<q><v>x</v></q>").toString());
		assertEquals("(x+1)", parse("<p><v>x</v><t>+</t><n>1</n></p>").toString());
		ParenCell paren = (ParenCell) parse("<p print=\"no\"><v>x</v></p>");
		assertFalse(paren.isPrint());
		assertEquals("x", paren.toString());
		assertTrue(parse("<a><v>x</v></a>") instanceof AbsCell);
		assertTrue(parse("<cj><v>z</v></cj>") instanceof ConjugateCell);
	}

	@Test
	public void subscripts() throws Exception {
		assertEquals("a[i]", parse("<i><r><v>a</v></r><r><v>i</v></r></i>").toString());
		assertEquals("a[i]^2", parse("<ie><r><v>a</v></r><r><v>i</v></r><r><n>2</n></r></ie>").toString());
		assertEquals("sin(x)", parse("<fn><r><fnm>sin</fnm></r><r><p><v>x</v></p></r></fn>").toString());
	}

	@Test
	public void matrixRowsArePadded() throws Exception {
		MatrCell matrix = (MatrCell) parse("<tb><mtr><mtd><n>1</n></mtd><mtd><n>2</n></mtd></mtr>"
											+ "<mtr><mtd><n>3</n></mtd></mtr></tb>");
		assertEquals(2, matrix.getRowCount());
		assertEquals(2, matrix.getColumnCount());
		assertEquals("", matrix.getCell(1, 1).getValue());
		assertEquals("matrix([1,2],[3,])", matrix.toString());
	}

	@Test
	public void inferenceTableIsSpecial() throws Exception {
		MatrCell matrix = (MatrCell) parse("<tb inference=\"true\"><mtr><mtd><v>a</v></mtd></mtr>"
											+ "<mtr><mtd><v>b</v></mtd></mtr></tb>");
		assertTrue(matrix.isInference());
		assertTrue(matrix.isSpecial());
	}

	@Test
	public void textFlags() throws Exception {
		MathCell label = parse("<lbl>(%o1) </lbl>");
		assertTrue(label.forceBreakLineHere());
		assertEquals(TextStyle.TS_LABEL, label.getStyle());
		assertEquals(TextStyle.TS_USERLABEL, parse("<lbl userdefined=\"yes\">a</lbl>").getStyle());
		assertTrue(parse("<h>*</h>").isHidden());
		assertEquals(MathCell.MC_TYPE_ERROR, parse("<t type=\"error\">oops</t>").getType());
		assertEquals("A", parse("<ascii>65</ascii>").getValue());
		assertEquals(" ", parse("<mspace/>").getValue());
	}

	@Test
	public void highlightAndAltCopy() throws Exception {
		MathCell cell = parse("<hl><v>x</v></hl><v>y</v>");
		assertTrue(cell.isHighlighted());
		assertFalse(cell.getNext().isHighlighted());
		assertEquals("foo", parse("<v altCopy=\"foo\">x</v>").toString());
	}

	@Test
	public void typeIsPassedDown() throws Exception {
		MathCell cell = parser.parseLine("<mth><f><v>a</v><v>b</v></f></mth>", MathCell.MC_TYPE_LABEL);
		assertEquals(MathCell.MC_TYPE_LABEL, cell.getType());
		assertEquals(MathCell.MC_TYPE_LABEL, ((FracCell) cell).getNum().getType());
	}

	@Test
	public void longNumbersAreElidedForDisplay() throws Exception {
		parser = new MathParser(new ParserConfig(10, 0), null, notifier);
		TextCell cell = (TextCell) parse("<n>12345678901234</n>");
		assertEquals("12345678901234", cell.getValue());
		assertEquals("123[8 digits]234", cell.getDisplayedValue());
		assertEquals("<n>12345678901234</n>", cell.toXML());
		assertEquals("12345678901234", cell.toTeX());
	}

	@Test
	public void truncateDigits() {
		assertEquals("1234567890", MathParser.truncateDigits("1234567890", 10));
		assertEquals("123[8 digits]234", MathParser.truncateDigits("12345678901234", 3));
	}

	@Test
	public void tooLongExpressionIsNotParsed() throws Exception {
		StringBuffer sb = new StringBuffer("<mth>");
		while (sb.length() < 50000)
			sb.append("<v>x</v>");
		sb.append("</mth>");
		MathCell cell = parser.parseLine(sb.toString(), MathCell.MC_TYPE_DEFAULT);
		assertEquals(MathParser.TOO_LONG_TEXT, cell.getValue());
		assertTrue(cell.forceBreakLineHere());
		assertNull(cell.getNext());

		parser.getConfig().setShowLength(3);
		cell = parser.parseLine(sb.toString(), MathCell.MC_TYPE_DEFAULT);
		assertTrue(CellList.length(cell) > 1000);
	}

	@Test
	public void controlCharactersAreReplaced() throws Exception {
		MathCell cell = parse("<v>a\001b</v>");
		assertEquals("a\uFFFDb", cell.getValue());
	}

	@Test(expected = CellParseException.class)
	public void malformedMarkupThrows() throws Exception {
		parser.parseLine("<mth><v>x</mth>", MathCell.MC_TYPE_DEFAULT);
	}

	@Test
	public void slideShow() throws Exception {
		SlideShowCell slide = (SlideShowCell) parse("<slide fr=\"5\">a.png;b.png;</slide>");
		assertEquals(2, slide.getFrameCount());
		assertEquals("b.png", slide.getFrameName(1));
		assertEquals(5, slide.getFrameRate());
		assertEquals("<slide fr=\"5\">a.png;b.png</slide>", slide.toXML());
	}

	@Test
	public void imageWithoutResolverKeepsFlags() throws Exception {
		ImgCell img = (ImgCell) parse("<img del=\"no\" rect=\"false\">plot.png</img>");
		assertFalse(img.isDeleteOnClose());
		assertFalse(img.isDrawRectangle());
		assertFalse(img.isLoaded());
		assertEquals("<img del=\"no\" rect=\"false\">plot.png</img>", img.toXML());
	}

	@Test
	public void indentedMarkupFromAnotherDocument() throws Exception {
		MathCell cell = parser.parseTag(element("<f>\n  <r><v>a</v></r>\n  <r><v>b</v></r>\n</f>"), false);
		assertTrue(cell instanceof FracCell);
		assertEquals("a/b", cell.toString());
		assertEquals("<f><r><v>a</v></r><r><v>b</v></r></f>", cell.toXML());

		Element root = element("<mth>\n  <v>x</v>\n  <tb>\n    <mtr>\n      <mtd><n>1</n></mtd>\n    </mtr>\n  </tb>\n</mth>");
		MathCell head = parser.parseTag(root.getElementsByTagName("v").item(0), true);
		assertEquals(2, CellList.length(head));
		assertEquals("xmatrix([1])", CellList.toString(head));
		assertEquals(" ", parser.parseTag(element("<t> </t>"), false).getValue());
		assertTrue(notifier.messages.isEmpty());
	}

	@Test
	public void subsectionLevels() throws Exception {
		GroupCell group = (GroupCell) parser.parseTag(element(
				"<cell type=\"subsection\"><editor type=\"subsection\"><line>a</line></editor></cell>"), false);
		assertEquals(GroupCell.GC_TYPE_SUBSECTION, group.getGroupType());

		group = (GroupCell) parser.parseTag(element(
				"<cell type=\"subsection\" sectioning_level=\"3\"><editor type=\"subsection\"><line>b</line></editor></cell>"), false);
		assertEquals(GroupCell.GC_TYPE_SUBSECTION, group.getGroupType());

		group = (GroupCell) parser.parseTag(element(
				"<cell type=\"subsection\" sectioning_level=\"4\"><editor type=\"subsubsection\"><line>c</line></editor></cell>"), false);
		assertEquals(GroupCell.GC_TYPE_SUBSUBSECTION, group.getGroupType());
		assertEquals("c", group.getEditableContent());
	}

	@Test
	public void elidedNegativeNumberKeepsMinusSign() throws Exception {
		parser = new MathParser(new ParserConfig(10, 0), null, notifier);
		TextCell cell = (TextCell) parse("<n>-12345678901234</n>");
		assertEquals("-12345678901234", cell.getValue());
		assertEquals(TextCell.UNICODE_MINUS + "12[9 digits]234", cell.getDisplayedValue());
		assertEquals("<n>-12345678901234</n>", cell.toXML());
	}

	@Test
	public void altCopyCountsAsFlag() throws Exception {
		assertFalse(((ParenCell) parse("<p altCopy=\"(x)\"><v>x</v></p>")).isPrint());
		assertTrue(((ExptCell) parse("<e altCopy=\"A^^2\"><v>A</v><n>2</n></e>")).isMatrix());
		IntCell in = (IntCell) parse("<in altCopy=\"integrate(x,x)\"><r><v>x</v></r><r><s>d</s><v>x</v></r></in>");
		assertEquals(IntCell.INT_IDEF, in.getIntStyle());
	}

	private static final String[] SAVED_FORMS = {
		"<f><r><v>a</v></r><r><n>2</n></r></f>",
		"<f line=\"no\"><r><v>n</v></r><r><v>k</v></r></f>",
		"<e><r><v>x</v></r><r><n>2</n></r></e>",
		"<e type=\"mat\"><r><v>A</v></r><r><n>2</n></r></e>",
		"<ie><r><v>a</v></r><r><v>i</v></r><r><n>2</n></r></ie>",
		"<i><r><v>a</v></r><r><v>i</v></r></i>",
		"<fn><r><fnm>sin</fnm></r><r><p><v>x</v></p></r></fn>",
		"<q><v>x</v></q>",
		"<a><v>x</v></a>",
		"<cj><v>z</v></cj>",
		"<p><v>x</v><t>+</t><n>1</n></p>",
		"<p print=\"no\"><v>x</v></p>",
		"<lm><r><fnm>lim</fnm></r><r><v>x</v><t>-></t><n>0</n></r><r><v>f</v></r></lm>",
		"<sm><r><v>i</v><t>=</t><n>1</n></r><r><v>n</v></r><r><v>i</v></r></sm>",
		"<sm type=\"prod\"><r><v>k</v><t>=</t><n>1</n></r><r><n>5</n></r><r><v>k</v></r></sm>",
		"<sm type=\"lsum\"><r><v>i</v><t> in </t><v>L</v></r><r><v>z</v></r><r><v>i</v></r></sm>",
		"<in><r><n>0</n></r><r><n>1</n></r><r><v>x</v></r><r><s>d</s><v>x</v></r></in>",
		"<in def=\"false\"><r><v>x</v></r><r><s>d</s><v>x</v></r></in>",
		"<tb><mtr><mtd><n>1</n></mtd><mtd><n>2</n></mtd></mtr><mtr><mtd><n>3</n></mtd><mtd><n>4</n></mtd></mtr></tb>",
		"<d><f diffstyle=\"yes\"><r><s>d</s></r><r><s>d</s><v>x</v></r></f><r><v>y</v></r></d>",
		"<at><r><v>f</v></r><r><v>x</v><t>=</t><n>0</n></r></at>",
		"<hl><v>x</v></hl>",
		"<h>*</h>",
		"<g>%pi</g>",
		"<s>%e</s>",
		"<st>hello</st>",
		"<t type=\"error\">oops</t>",
		"<img>plot.png</img>",
		"<img del=\"no\">plot.png</img>",
		"<slide fr=\"5\">a.png;b.png</slide>",
	};

	@Test
	public void savedFormParsesToSameCell() throws Exception {
		for (int i = 0; i < SAVED_FORMS.length; i++) {
			MathCell cell = parse(SAVED_FORMS[i]);
			String xml = CellList.toXML(cell);
			MathCell again = parse(xml);
			assertEquals(SAVED_FORMS[i], cell.getClass(), again.getClass());
			assertEquals(SAVED_FORMS[i], cell.getStyle(), again.getStyle());
			assertEquals(SAVED_FORMS[i], xml, CellList.toXML(again));
			assertEquals(SAVED_FORMS[i], 1, CellList.length(again));
		}
		assertTrue(notifier.messages.isEmpty());
	}
}
