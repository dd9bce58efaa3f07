package net.vitki.mathcell;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class GroupCellTest
{
	private static GroupCell newGroup (int type, String text) {
		GroupCell group = new GroupCell(type);
		group.setEditableContent(text);
		return group;
	}

	private static GroupCell chain (GroupCell[] groups) {
		for (int i = 1; i < groups.length; i++)
			groups[0].appendCell(groups[i]);
		return groups[0];
	}

	@Test
	public void levels() {
		assertEquals(1, new GroupCell(GroupCell.GC_TYPE_TITLE).getLevel());
		assertEquals(2, new GroupCell(GroupCell.GC_TYPE_SECTION).getLevel());
		assertEquals(3, new GroupCell(GroupCell.GC_TYPE_SUBSECTION).getLevel());
		assertEquals(4, new GroupCell(GroupCell.GC_TYPE_SUBSUBSECTION).getLevel());
		assertEquals(5, new GroupCell(GroupCell.GC_TYPE_CODE).getLevel());
		assertEquals(5, new GroupCell(GroupCell.GC_TYPE_PAGEBREAK).getLevel());
	}

	@Test
	public void foldStopsAtSameLevel() {
		GroupCell s1 = newGroup(GroupCell.GC_TYPE_SECTION, "one");
		GroupCell sub = newGroup(GroupCell.GC_TYPE_SUBSECTION, "one.one");
		GroupCell code = newGroup(GroupCell.GC_TYPE_CODE, "1+1;");
		GroupCell s2 = newGroup(GroupCell.GC_TYPE_SECTION, "two");
		chain(new GroupCell[] { s1, sub, code, s2 });

		assertTrue(s1.fold());
		assertSame(s2, s1.getNext());
		assertSame(s1, s2.getPrevious());
		assertSame(sub, s1.getHiddenTree());
		assertNull(sub.getPrevious());
		assertNull(code.getNext());

		assertSame(code, s1.unfold());
		assertSame(sub, s1.getNext());
		assertSame(s2, code.getNext());
		assertSame(code, s2.getPrevious());
		assertNull(s1.unfold());
	}

	@Test
	public void nothingToFold() {
		GroupCell s1 = newGroup(GroupCell.GC_TYPE_SECTION, "one");
		GroupCell s2 = newGroup(GroupCell.GC_TYPE_TITLE, "two");
		chain(new GroupCell[] { s1, s2 });
		assertFalse(s1.fold());
		assertFalse(s2.fold());
		GroupCell code = newGroup(GroupCell.GC_TYPE_CODE, "a;");
		code.appendCell(newGroup(GroupCell.GC_TYPE_CODE, "b;"));
		assertFalse(code.fold());
	}

	@Test
	public void outputBelongsToGroup() throws Exception {
		GroupCell group = newGroup(GroupCell.GC_TYPE_CODE, "x;");
		MathCell out = new MathParser().parseLine("<mth><v>x</v><v>y</v></mth>", MathCell.MC_TYPE_DEFAULT);
		group.appendOutput(out);
		assertSame(group, out.getGroup());
		assertSame(group, out.getNext().getGroup());
		assertSame(group, group.getInput().getGroup());
		assertEquals(MathCell.MC_TYPE_INPUT, group.getInput().getType());

		group.removeOutput();
		assertTrue(out.isDestroyed());
		assertNull(group.getOutput());
	}

	@Test
	public void hiddenOutputIsLeftOutOfLayout() throws Exception {
		GroupCell group = newGroup(GroupCell.GC_TYPE_CODE, "x;");
		group.appendOutput(new MathParser().parseLine("<mth><v>x</v></mth>", MathCell.MC_TYPE_DEFAULT));
		LayoutContext ctx = new LayoutContext();
		group.recalculate(ctx, 12);
		int shown = group.getHeight();
		group.hide(true);
		assertTrue(group.isDirty());
		group.recalculate(ctx, 12);
		assertTrue(group.getHeight() < shown);
		assertEquals("x;", group.toString());
	}

	@Test
	public void destroyTakesFoldedGroups() {
		GroupCell s1 = newGroup(GroupCell.GC_TYPE_SECTION, "one");
		GroupCell code = newGroup(GroupCell.GC_TYPE_CODE, "1;");
		chain(new GroupCell[] { s1, code });
		assertTrue(s1.fold());
		s1.destroy();
		assertTrue(code.isDestroyed());
	}

	@Test
	public void copyKeepsFold() {
		GroupCell s1 = newGroup(GroupCell.GC_TYPE_SUBSUBSECTION, "deep");
		s1.appendCell(newGroup(GroupCell.GC_TYPE_TEXT, "hello"));
		s1.fold();
		GroupCell cp = (GroupCell) s1.copy();
		assertEquals(s1.toXML(), cp.toXML());
		assertEquals("<cell type=\"subsection\" sectioning_level=\"4\"><editor type=\"subsubsection\">"
					+ "<line>deep</line></editor><fold><cell type=\"text\"><editor type=\"text\">"
					+ "<line>hello</line></editor></cell></fold></cell>", cp.toXML());
	}
}
