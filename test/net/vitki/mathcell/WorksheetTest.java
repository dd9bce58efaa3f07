package net.vitki.mathcell;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.util.Vector;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import javax.imageio.ImageIO;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.w3c.dom.Document;

public class WorksheetTest
{
	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	private MathParserTest.RecordingNotifier notifier;
	private Worksheet ws;

	@Before
	public void setUp() throws Exception {
		notifier = new MathParserTest.RecordingNotifier();
		ws = new Worksheet(new ParserConfig(), notifier);
	}

	@After
	public void tearDown() throws Exception {
		ws.close();
	}

	private String samplePath() throws Exception {
		return new File(getClass().getResource("sample.xml").toURI()).getPath();
	}

	private GroupCell group (int i) {
		MathCell tmp = ws.getTree();
		while (i-- > 0)
			tmp = tmp.getNext();
		return (GroupCell) tmp;
	}

	@Test
	public void loadsAllGroups() throws Exception {
		ws.load(samplePath());
		assertEquals(7, CellList.length(ws.getTree()));
		assertEquals(120, ws.getZoom());
		assertEquals(GroupCell.GC_TYPE_TITLE, group(0).getGroupType());
		assertEquals("Sample", group(0).getEditableContent());
		assertEquals(GroupCell.GC_TYPE_CODE, group(2).getGroupType());
		assertEquals("x+1;", group(2).getEditableContent());
		assertEquals("(%o1) x+1", CellList.toString(group(2).getOutput()));
		assertSame(group(2), group(2).getOutput().getGroup());
		assertEquals("first line\n\nthird", group(3).getEditableContent());
		assertEquals(GroupCell.GC_TYPE_SUBSUBSECTION, group(4).getGroupType());
		assertTrue(group(5).isHiddenOutput());
		assertTrue(group(5).isFolded());
		assertEquals(GroupCell.GC_TYPE_PAGEBREAK, group(6).getGroupType());
		assertTrue(group(6).breakPageHere());
		assertTrue(notifier.messages.isEmpty());
	}

	@Test
	public void drawOrderFollowsFolding() throws Exception {
		ws.load(samplePath());
		assertEquals(7, ws.getDrawOrder().size());
		assertSame(ws.getTree(), ws.getFirstToDraw());

		GroupCell section = group(1);
		assertTrue(ws.fold(section));
		// code, text and subsubsection go under the first section
		assertEquals(4, CellList.length(ws.getTree()));
		assertEquals(3, CellList.length(section.getHiddenTree()));
		Vector order = ws.getDrawOrder();
		assertEquals(4, order.size());
		assertSame(group(2), order.get(2));
		assertEquals("Calculus", group(2).getEditableContent());

		GroupCell last = ws.unfold(section);
		assertEquals(GroupCell.GC_TYPE_SUBSUBSECTION, last.getGroupType());
		assertEquals(7, ws.getDrawOrder().size());
		assertFalse(section.isFolded());
	}

	@Test
	public void foldingTheTitleTakesEverything() throws Exception {
		ws.load(samplePath());
		assertTrue(ws.fold(group(0)));
		assertEquals(1, ws.getDrawOrder().size());
		ws.unfoldAll();
		// the fold stored in the file is opened too
		assertEquals(8, CellList.length(ws.getTree()));
		assertEquals(8, ws.getDrawOrder().size());
	}

	@Test
	public void cannotFoldTwice() throws Exception {
		ws.load(samplePath());
		GroupCell folded = group(5);
		assertFalse(ws.fold(folded));
		assertFalse(ws.fold(group(6)));
	}

	@Test
	public void recalculateStacksGroups() throws Exception {
		ws.load(samplePath());
		LayoutContext ctx = new LayoutContext();
		int height = ws.recalculate(ctx);
		assertTrue(height > 0);
		int prev_y = -1;
		for (MathCell tmp = ws.getFirstToDraw(); tmp != null; tmp = tmp.getNextToDraw()) {
			assertFalse(tmp.isDirty());
			int y = tmp.getCurrentPoint().y;
			assertTrue(y > prev_y);
			prev_y = y;
		}
	}

	@Test
	public void xmlRoundTripIsStable() throws Exception {
		ws.load(samplePath());
		String xml = ws.toXML();
		assertTrue(xml.startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\"?>"));
		assertTrue(xml.indexOf("<cell type=\"subsection\" sectioning_level=\"4\">") >= 0);
		assertTrue(xml.indexOf("<fold><cell type=\"code\">") >= 0);

		Document doc = Util.newDocumentBuilder().parse(new ByteArrayInputStream(xml.getBytes("UTF-8")));
		Worksheet again = new Worksheet(new ParserConfig(), notifier);
		again.load(doc);
		assertEquals(xml, again.toXML());
		assertEquals(ws.toText(), again.toText());
		again.close();
	}

	@Test
	public void textAndTeX() throws Exception {
		ws.load(samplePath());
		String text = ws.toText();
		assertTrue(text.startsWith("Sample\n\nAlgebra\n\nx+1;\n(%o1) x+1"));
		String tex = ws.toTeX();
		assertTrue(tex.indexOf("\\begin{document}") >= 0);
		assertTrue(tex.indexOf("\\section{Algebra}") >= 0);
		assertTrue(tex.indexOf("\\subsubsection{Deep}") >= 0);
		assertTrue(tex.indexOf("\\pagebreak") >= 0);
	}

	@Test(expected = CellParseException.class)
	public void brokenFileThrows() throws Exception {
		File f = tmp.newFile("broken.xml");
		FileOutputStream fos = new FileOutputStream(f);
		fos.write("<wxMaximaDocument><cell>".getBytes("UTF-8"));
		fos.close();
		ws.load(f.getPath());
	}

	@Test
	public void unknownCellTypeIsReported() throws Exception {
		File f = tmp.newFile("odd.xml");
		FileOutputStream fos = new FileOutputStream(f);
		fos.write(("<wxMaximaDocument><cell type=\"weird\"/>"
					+ "<cell type=\"text\"><editor type=\"text\"><line>ok</line></editor></cell>"
					+ "</wxMaximaDocument>").getBytes("UTF-8"));
		fos.close();
		ws.load(f.getPath());
		assertEquals(1, CellList.length(ws.getTree()));
		assertEquals(1, notifier.messages.size());
	}

	@Test
	public void imagesAreReadFromArchive() throws Exception {
		ByteArrayOutputStream png = new ByteArrayOutputStream();
		ImageIO.write(new BufferedImage(30, 10, BufferedImage.TYPE_INT_RGB), "png", png);

		File f = tmp.newFile("plot.wxmx");
		ZipOutputStream zos = new ZipOutputStream(new FileOutputStream(f));
		zos.putNextEntry(new ZipEntry("mimetype"));
		zos.write("text/x-wxmathml".getBytes("UTF-8"));
		zos.closeEntry();
		zos.putNextEntry(new ZipEntry(Worksheet.CONTENT_ENTRY));
		zos.write(("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<wxMaximaDocument version=\"1.1\" zoom=\"100\">"
					+ "<cell type=\"image\"><editor type=\"text\"><line>a plot</line></editor>"
					+ "<img>image1.png</img></cell></wxMaximaDocument>").getBytes("UTF-8"));
		zos.closeEntry();
		zos.putNextEntry(new ZipEntry("image1.png"));
		zos.write(png.toByteArray());
		zos.closeEntry();
		zos.close();

		ws.load(f.getPath());
		GroupCell group = group(0);
		assertEquals(GroupCell.GC_TYPE_IMAGE, group.getGroupType());
		assertEquals("a plot", group.getEditableContent());
		ImgCell img = (ImgCell) group.getOutput();
		assertNotNull(img);
		assertTrue(img.isLoaded());
		assertFalse(img.isDeleteOnClose());
		assertEquals("<img>image1.png</img>", img.toXML());

		img.recalculate(new LayoutContext(), LayoutContext.DEFAULT_FONT_SIZE);
		assertEquals(32, img.getWidth());
		assertEquals(12, img.getHeight());
	}

	@Test
	public void closeReleasesTree() throws Exception {
		ws.load(samplePath());
		MathCell head = ws.getTree();
		ws.close();
		assertNull(ws.getTree());
		assertTrue(head.isDestroyed());
	}

	@Test(expected = CellParseException.class)
	public void documentWithoutRootThrows() throws Exception {
		ws.load(Util.newDocumentBuilder().newDocument());
	}

	@Test
	public void zoomIsResetByNextLoad() throws Exception {
		ws.load(samplePath());
		assertEquals(120, ws.getZoom());
		Document doc = Util.newDocumentBuilder().parse(new ByteArrayInputStream(
				"<wxMaximaDocument version=\"1.1\"></wxMaximaDocument>".getBytes("UTF-8")));
		ws.load(doc);
		assertEquals(100, ws.getZoom());
		assertNull(ws.getTree());
	}
}
