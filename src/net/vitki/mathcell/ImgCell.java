package net.vitki.mathcell;

import java.awt.Dimension;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

import javax.imageio.ImageIO;

/**
 * An image, usually a plot.
 * <p>
 * The bytes come from an {@link ImageResolver}. When they cannot be had or
 * decoded the cell still lays out, as a small empty box.
 * Images written by maxima into temporary files are deleted through the
 * resolver when the cell is destroyed.
 *
 * @author vit
 *
 */
public class ImgCell extends MathCell
{
	public static final int PLACEHOLDER_SIZE = 20;

	private String filename;
	private ImageResolver resolver;
	private byte[] data;
	private Dimension size;
	private boolean delete_on_close;
	private boolean owns_file;
	private boolean draw_rectangle;

	public ImgCell(String filename, ImageResolver resolver, boolean delete_on_close) {
		super();
		type = MC_TYPE_IMAGE;
		this.filename = filename == null ? "" : filename.trim();
		this.resolver = resolver;
		this.delete_on_close = delete_on_close && (resolver == null || !resolver.isArchive());
		owns_file = this.delete_on_close;
		draw_rectangle = true;
		data = resolver == null ? null : resolver.resolve(this.filename);
		size = getImageSize(data, this.filename);
	}

	private ImgCell(ImgCell src) {
		super();
		filename = src.filename;
		resolver = src.resolver;
		data = src.data;
		size = src.size;
		delete_on_close = src.delete_on_close;
		// only the original removes the file
		owns_file = false;
		draw_rectangle = src.draw_rectangle;
	}

	public MathCell copy() {
		ImgCell tmp = new ImgCell(this);
		tmp.copyData(this);
		return tmp;
	}

	/**
	 * Pixel size of an image payload, null when it is empty or
	 * in a format that cannot be decoded here (eps, wmf).
	 */
	static final Dimension getImageSize (byte[] data, String name) {
		if (data == null || data.length == 0)
			return null;
		try {
			BufferedImage image = ImageIO.read(new ByteArrayInputStream(data));
			if (image == null)
				return null;
			return new Dimension(image.getWidth(), image.getHeight());
		} catch (IOException e) {
			System.err.println("warning: cannot decode image "+name+": "+e.getMessage());
			return null;
		}
	}

	public final String getFileName() {
		return filename;
	}

	public final byte[] getData() {
		return data;
	}

	public final boolean isLoaded() {
		return size != null;
	}

	public final boolean isDeleteOnClose() {
		return delete_on_close;
	}

	/**
	 * True when destroying this cell removes the file. Copies never do.
	 */
	public final boolean ownsFile() {
		return owns_file;
	}

	public final boolean isDrawRectangle() {
		return draw_rectangle;
	}

	public void drawRectangle (boolean draw) {
		draw_rectangle = draw;
	}

	protected void release() {
		if (owns_file && resolver != null)
			resolver.discard(filename);
		data = null;
	}

	protected void recalculateSize (LayoutContext ctx, int fontsize) {
		int border = draw_rectangle ? 2 * ctx.scalePx(1) : 0;
		if (size == null) {
			width = height = ctx.scalePx(PLACEHOLDER_SIZE) + border;
		} else {
			width = (int)(size.width * ctx.getScale()) + border;
			height = (int)(size.height * ctx.getScale()) + border;
		}
		center = height / 2;
	}

	public String toString() {
		return " << Graphics >> ";
	}

	public String toTeX() {
		if (Util.isImageFormat(Util.getExtension(filename)))
			return "\\includegraphics{" + filename + "}";
		return "\\verb| << Graphics >> |";
	}

	public String toXML() {
		StringBuffer sb = new StringBuffer("<img");
		if (!delete_on_close && (resolver == null || !resolver.isArchive()))
			sb.append(" del=\"no\"");
		if (!draw_rectangle)
			sb.append(" rect=\"false\"");
		sb.append('>').append(Util.xmlEscape(filename)).append("</img>");
		return sb.toString();
	}
}
