package net.vitki.mathcell;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Vector;

import org.junit.Test;

public class MathCellTest
{
	private final MathParser parser = new MathParser();
	private final LayoutContext ctx = new LayoutContext();

	private MathCell parse (String markup) throws CellParseException {
		return parser.parseLine("<mth>" + markup + "</mth>", MathCell.MC_TYPE_DEFAULT);
	}

	@Test
	public void textSizes() throws Exception {
		MathCell head = parse("<v>x</v><t>+</t><n>1</n>");
		CellList.recalculate(head, ctx, 12);
		// 7px per character at 12pt, 1px padding on each side
		assertEquals(9, head.getWidth());
		assertEquals(17, head.getHeight());
		assertEquals(27, CellList.getFullWidth(head));
		assertEquals(8, head.getCenter());
	}

	@Test
	public void zoomScalesText() throws Exception {
		MathCell head = parse("<v>x</v>");
		head.recalculate(new LayoutContext(new FixedMetrics(), 2.0, 12), 12);
		assertEquals(18, head.getWidth());
	}

	@Test
	public void exponentUsesSmallerFont() throws Exception {
		ExptCell expt = (ExptCell) parse("<e><v>x</v><n>2</n></e>");
		expt.recalculate(ctx, 12);
		assertEquals(9, expt.getBase().getWidth());
		assertEquals(8, expt.getPower().getWidth());
		assertEquals(17, expt.getWidth());
		assertTrue(expt.getCenter() >= expt.getBase().getCenter());
	}

	@Test
	public void lineAggregatesStopAtForcedBreak() throws Exception {
		MathCell head = parse("<v>x</v><f><v>a</v><v>b</v></f>");
		CellList.recalculate(head, ctx, 12);
		MathCell frac = head.getNext();
		assertEquals(frac.getCenter(), head.getMaxCenter());
		assertEquals(head.getHeight() - head.getCenter() < frac.getDrop() ? frac.getDrop()
						: head.getHeight() - head.getCenter(), head.getMaxDrop());

		frac.forceBreakLine(true);
		assertEquals(head.getCenter(), head.getMaxCenter());
		assertEquals(head.getDrop(), head.getMaxDrop());
	}

	@Test
	public void changedCellInvalidatesOwner() throws Exception {
		FracCell frac = (FracCell) parse("<f><v>a</v><v>b</v></f>");
		frac.recalculate(ctx, 12);
		assertFalse(frac.isDirty());
		((TextCell) frac.getNum()).setValue("abc");
		assertTrue(frac.isDirty());
		int before = frac.getWidth();
		frac.recalculate(ctx, 12);
		assertTrue(frac.getWidth() > before);
	}

	@Test(expected = IllegalStateException.class)
	public void sizeBeforeRecalculationIsAnError() throws Exception {
		CellList.getFullWidth(parse("<v>x</v>"));
	}

	@Test
	public void drawOrderSkipsHiddenCells() throws Exception {
		MathCell head = parse("<v>a</v><h>*</h><v>b</v>");
		Vector order = CellList.getDrawOrder(head);
		assertEquals(2, order.size());
		assertSame(head.getNext().getNext(), head.getNextToDraw());
		assertSame(head, head.getNextToDraw().getPreviousToDraw());
	}

	@Test
	public void destroyReleasesWholeTail() throws Exception {
		MathCell head = parse("<v>a</v><p><v>b</v></p><v>c</v>");
		MathCell paren = head.getNext();
		MathCell inner = ((ParenCell) paren).getInner();
		MathCell last = paren.getNext();
		paren.destroy();
		assertTrue(paren.isDestroyed());
		assertTrue(inner.isDestroyed());
		assertTrue(last.isDestroyed());
		assertFalse(head.isDestroyed());
		assertEquals(1, CellList.length(head));
	}

	@Test(expected = IllegalStateException.class)
	public void destroyingTwiceIsAnError() throws Exception {
		MathCell head = parse("<v>a</v>");
		head.destroy();
		head.destroy();
	}

	@Test
	public void copyIsDeep() throws Exception {
		FracCell frac = (FracCell) parse("<f><r><v>a</v><t>+</t><n>1</n></r><r><n>2</n></r></f><v>tail</v>");
		FracCell cp = (FracCell) frac.copy();
		assertEquals(frac.toXML(), cp.toXML());
		assertEquals("(a+1)/2", cp.toString());
		assertNotSame(frac.getNum(), cp.getNum());
		assertEquals(null, cp.getNext());
		frac.destroy();
		assertFalse(cp.isDestroyed());
		assertFalse(cp.getNum().isDestroyed());
	}

	@Test
	public void appendingOwnedCellIsRefused() throws Exception {
		MathCell head = parse("<v>a</v><v>b</v>");
		MathCell other = parse("<v>c</v>");
		try {
			other.appendCell(head.getNext());
		} catch (IllegalStateException e) {
			return;
		}
		throw new AssertionError("owned cell appended");
	}

	@Test
	public void veryLongChains() {
		MathCell head = new TextCell("0");
		MathCell tail = head;
		for (int i = 1; i < 200000; i++) {
			MathCell cell = new TextCell("x");
			tail.appendCell(cell);
			tail = cell;
		}
		CellList.recalculate(head, ctx, 12);
		assertEquals(head.getCenter(), head.getMaxCenter());
		assertEquals(200000 * 9, head.getFullWidth());
		assertEquals(200000, CellList.getDrawOrder(head).size());
		head.destroy();
		assertTrue(tail.isDestroyed());
	}

	@Test
	public void texOutput() throws Exception {
		assertEquals("\\frac{a}{2}", parse("<f><v>a</v><n>2</n></f>").toTeX());
		assertEquals("\\sqrt{x}", parse("<q><v>x</v></q>").toTeX());
		assertEquals("\\alpha", parse("<g>%alpha</g>").toTeX());
	}
}
