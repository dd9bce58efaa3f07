package net.vitki.mathcell;

import java.awt.Dimension;
import java.util.Vector;

/**
 * An animation: a list of frames shown one after another.
 *
 * @author vit
 *
 */
public class SlideShowCell extends MathCell
{
	public static final int DEFAULT_FRAME_RATE = 2;

	private ImageResolver resolver;
	private Vector frames;
	private Vector sizes;
	private int frame_rate;
	private int displayed;

	public SlideShowCell(ImageResolver resolver) {
		super();
		type = MC_TYPE_SLIDE;
		this.resolver = resolver;
		frames = new Vector();
		sizes = new Vector();
		frame_rate = UNSET;
		displayed = 0;
	}

	public MathCell copy() {
		SlideShowCell tmp = new SlideShowCell(resolver);
		tmp.copyData(this);
		tmp.frames.addAll(frames);
		tmp.sizes.addAll(sizes);
		tmp.frame_rate = frame_rate;
		tmp.displayed = displayed;
		return tmp;
	}

	/**
	 * Load the frames, a list of file names separated by semicolons.
	 * Empty names are skipped.
	 */
	public void loadImages (String list) {
		if (list == null)
			return;
		String[] names = list.split(";");
		for (int i = 0; i < names.length; i++) {
			String name = names[i].trim();
			if (name.length() == 0)
				continue;
			byte[] data = resolver == null ? null : resolver.resolve(name);
			frames.add(name);
			sizes.add(ImgCell.getImageSize(data, name));
		}
		invalidateSizeInformation();
	}

	public final int getFrameCount() {
		return frames.size();
	}

	public final String getFrameName (int i) {
		return (String) frames.get(i);
	}

	public final int getDisplayedIndex() {
		return displayed;
	}

	public void setDisplayedIndex (int i) {
		if (i >= 0 && i < frames.size())
			displayed = i;
	}

	public final int getFrameRate() {
		return frame_rate == UNSET ? DEFAULT_FRAME_RATE : frame_rate;
	}

	public void setFrameRate (int rate) {
		frame_rate = rate > 0 ? rate : UNSET;
	}

	protected void recalculateSize (LayoutContext ctx, int fontsize) {
		int w = 0;
		int h = 0;
		for (int i = 0; i < sizes.size(); i++) {
			Dimension d = (Dimension) sizes.get(i);
			if (d == null)
				continue;
			w = Math.max(w, (int)(d.width * ctx.getScale()));
			h = Math.max(h, (int)(d.height * ctx.getScale()));
		}
		if (w == 0 || h == 0)
			w = h = ctx.scalePx(ImgCell.PLACEHOLDER_SIZE);
		width = w + 2 * ctx.scalePx(1);
		height = h + 2 * ctx.scalePx(1);
		center = height / 2;
	}

	public String toString() {
		return " << Animation >> ";
	}

	public String toTeX() {
		return "\\verb| << Animation >> |";
	}

	public String toXML() {
		StringBuffer sb = new StringBuffer("<slide");
		if (frame_rate != UNSET)
			sb.append(" fr=\"").append(frame_rate).append('"');
		sb.append('>');
		for (int i = 0; i < frames.size(); i++) {
			if (i > 0)
				sb.append(';');
			sb.append(Util.xmlEscape((String) frames.get(i)));
		}
		sb.append("</slide>");
		return sb.toString();
	}
}
