package net.vitki.mathcell;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.util.Vector;
import java.util.zip.ZipFile;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.ParserConfigurationException;

import org.w3c.dom.Document;
import org.xml.sax.SAXException;

/**
 * A whole worksheet: the chain of its groups, loaded from a
 * <code>.wxmx</code> archive or from a plain content file.
 * <p>
 * The worksheet owns the chain. Folding and unfolding go through here so
 * that the draw order is rebuilt afterwards.
 *
 * @author vit
 *
 */
public class Worksheet
{
	public static final String CONTENT_ENTRY = "content.xml";
	public static final String DOCUMENT_TAG = "wxMaximaDocument";
	public static final String DOCUMENT_VERSION = "1.1";

	public static final int FORMAT_XML = 0;
	public static final int FORMAT_TEXT = 1;
	public static final int FORMAT_TEX = 2;

	public static String ENCODING = "UTF-8";
	public static boolean SHOW_PROGRESS = false;

	private String in_path;
	private ParserConfig config;
	private Notifier notifier;
	private ImageResolver resolver;
	private MathParser parser;
	private DocumentBuilder dbuilder;

	private MathCell tree;
	private MathCell first_to_draw;
	private int zoom;

	private boolean debug;
	private String dbg_dir;
	private PrintStream log_ps;

	public Worksheet() throws ParserConfigurationException {
		this(new ParserConfig(), new ConsoleNotifier());
	}

	public Worksheet(ParserConfig config, Notifier notifier) throws ParserConfigurationException {
		this.config = config;
		this.notifier = notifier;
		resolver = null;
		parser = null;
		tree = first_to_draw = null;
		zoom = 100;
		debug = false;
		dbg_dir = null;
		log_ps = null;
		dbuilder = Util.newDocumentBuilder();
	}

    /*
     * ========================= Input ===============================
     */

	/**
	 * Read a worksheet. Archives are recognized by their contents,
	 * anything else is read as a content file.
	 */
	public void load (String path) throws IOException, CellParseException {
		in_path = path;
		close();
		File file = new File(path);
		if (!file.isFile())
			throw new IOException("file "+path+" does not exist");
		Document doc;
		if (isArchive(file)) {
			ZipImageResolver zip = new ZipImageResolver(new ZipFile(file));
			resolver = zip;
			InputStream is = zip.getEntryStream(CONTENT_ENTRY);
			try {
				doc = parseXML(is);
			} finally {
				is.close();
			}
		} else {
			File dir = file.getAbsoluteFile().getParentFile();
			resolver = new FileImageResolver(dir, false);
			doc = parseXML(file);
		}
		load(doc);
	}

	/**
	 * Build the tree from an already parsed content document.
	 */
	public void load (Document doc) throws CellParseException {
		if (tree != null)
			tree.destroy();
		tree = first_to_draw = null;
		zoom = 100;
		if (doc == null || doc.getDocumentElement() == null)
			throw new CellParseException("no document");
		String zoom_attr = doc.getDocumentElement().getAttribute("zoom");
		if (zoom_attr.length() > 0) {
			try {
				zoom = Integer.parseInt(zoom_attr.trim());
			} catch (NumberFormatException e) {
				logln("incorrect zoom ["+zoom_attr+"], using 100");
				zoom = 100;
			}
		}
		tree = getParser().parseDocument(doc);
		CellList.setGroup(tree, null);
		relinkDrawOrder();
		logln("loaded "+CellList.length(tree)+" groups, "
				+parser.getSkippedCount()+" tags skipped");
	}

	private static boolean isArchive (File file) throws IOException {
		InputStream is = new FileInputStream(file);
		try {
			// zip local file header
			return is.read() == 'P' && is.read() == 'K' && is.read() == 3 && is.read() == 4;
		} finally {
			is.close();
		}
	}

	private Document parseXML (InputStream is) throws IOException, CellParseException {
		try {
			return dbuilder.parse(is);
		} catch (SAXException e) {
			throw new CellParseException("malformed worksheet "+in_path+": "+e.getMessage(), e);
		}
	}

	private Document parseXML (File file) throws IOException, CellParseException {
		try {
			return dbuilder.parse(file);
		} catch (SAXException e) {
			throw new CellParseException("malformed worksheet "+in_path+": "+e.getMessage(), e);
		}
	}

	protected MathParser getParser() {
		if (parser == null) {
			parser = new MathParser(config, resolver, notifier);
			parser.setDebugLog(log_ps);
		}
		return parser;
	}

	public void close() throws IOException {
		if (tree != null)
			tree.destroy();
		tree = first_to_draw = null;
		parser = null;
		if (resolver instanceof ZipImageResolver)
			((ZipImageResolver) resolver).close();
		resolver = null;
	}

    /*
     * ========================= Tree ===============================
     */

	public final MathCell getTree() {
		return tree;
	}

	public final int getZoom() {
		return zoom;
	}

	public final MathCell getFirstToDraw() {
		return first_to_draw;
	}

	public Vector getDrawOrder() {
		Vector cells = new Vector();
		for (MathCell tmp = first_to_draw; tmp != null; tmp = tmp.getNextToDraw())
			cells.add(tmp);
		return cells;
	}

	protected void relinkDrawOrder() {
		first_to_draw = CellList.linkDrawOrder(tree);
	}

	public boolean fold (GroupCell group) {
		if (!group.fold())
			return false;
		relinkDrawOrder();
		return true;
	}

	public GroupCell unfold (GroupCell group) {
		GroupCell last = group.unfold();
		if (last != null)
			relinkDrawOrder();
		return last;
	}

	/**
	 * Unfold every group, folds inside folds included.
	 */
	public void unfoldAll() {
		for (MathCell tmp = tree; tmp != null; tmp = tmp.getNext()) {
			if (tmp instanceof GroupCell)
				((GroupCell) tmp).unfold();
		}
		relinkDrawOrder();
	}

    /*
     * ========================= Layout ===============================
     */

	/**
	 * Recalculate all groups and place them one below the other.
	 * Returns the height of the worksheet.
	 */
	public int recalculate (LayoutContext ctx) {
		int x = ctx.scalePx(MathCell.MC_BASE_INDENT);
		int y = ctx.scalePx(MathCell.MC_BASE_INDENT);
		int skip = ctx.scalePx(MathCell.MC_GROUP_SKIP);
		for (MathCell tmp = first_to_draw; tmp != null; tmp = tmp.getNextToDraw()) {
			tmp.recalculate(ctx, ctx.getDefaultFontSize());
			tmp.setPosition(x, y + tmp.getCenter());
			y += tmp.getHeight() + skip;
		}
		return y;
	}

    /*
     * ========================= Output ===============================
     */

	public String toXML() {
		StringBuffer sb = new StringBuffer();
		sb.append("<?xml version=\"1.0\" encoding=\"").append(ENCODING).append("\"?>\n\n");
		sb.append('<').append(DOCUMENT_TAG).append(" version=\"").append(DOCUMENT_VERSION);
		sb.append("\" zoom=\"").append(zoom).append("\">\n");
		for (MathCell tmp = tree; tmp != null; tmp = tmp.getNext())
			sb.append(tmp.toXML()).append('\n');
		sb.append("</").append(DOCUMENT_TAG).append(">\n");
		return sb.toString();
	}

	public String toText() {
		StringBuffer sb = new StringBuffer();
		for (MathCell tmp = tree; tmp != null; tmp = tmp.getNext()) {
			if (tmp != tree)
				sb.append("\n\n");
			sb.append(tmp.toString());
		}
		sb.append('\n');
		return sb.toString();
	}

	public String toTeX() {
		StringBuffer sb = new StringBuffer();
		sb.append("\\documentclass{article}\n");
		sb.append("\\usepackage{amsmath}\n");
		sb.append("\\usepackage{graphicx}\n");
		sb.append("\\begin{document}\n\n");
		for (MathCell tmp = tree; tmp != null; tmp = tmp.getNext())
			sb.append(tmp.toTeX()).append("\n\n");
		sb.append("\\end{document}\n");
		return sb.toString();
	}

	public String export (int format) {
		switch (format) {
		case FORMAT_TEXT: return toText();
		case FORMAT_TEX: return toTeX();
		}
		return toXML();
	}

	public void write (String out_path, int format) throws IOException {
		Writer w;
		if (out_path == null)
			w = new OutputStreamWriter(System.out, ENCODING);
		else
			w = new OutputStreamWriter(new FileOutputStream(out_path), ENCODING);
		try {
			w.write(export(format));
		} finally {
			if (out_path == null)
				w.flush();
			else
				w.close();
		}
	}

    static final void progressPrintln (String str) {
    	if (SHOW_PROGRESS)
    		System.err.println(str);
    }

    /*
     * ============================= main ============================
     */

    public static void main (String[] args) throws Exception {
    	String in_name = null;
    	String out_name = null;
    	String cfg_name = null;
    	String dbg_path = null;
    	int format = FORMAT_XML;
    	ParserConfig config = ParserConfig.getDefault();
    	boolean bad_usage = false;
    	try {
	    	for (int i = 0; i < args.length; i++) {
	    		if ("-o".equals(args[i])) {
	    			out_name = args[++i];
	    		} else if ("-d".equals(args[i])) {
	    			dbg_path = args[++i];
	    		} else if ("-c".equals(args[i])) {
	    			cfg_name = args[++i];
	    		} else if ("-digits".equals(args[i])) {
	    			config.setDisplayedDigits(Integer.parseInt(args[++i]));
	    		} else if ("-length".equals(args[i])) {
	    			config.setShowLength(Integer.parseInt(args[++i]));
	    		} else if ("-xml".equals(args[i])) {
	    			format = FORMAT_XML;
	    		} else if ("-text".equals(args[i])) {
	    			format = FORMAT_TEXT;
	    		} else if ("-tex".equals(args[i])) {
	    			format = FORMAT_TEX;
	    		} else if ("-h".equals(args[i])) {
	    			SHOW_PROGRESS = true;
	    		} else if (args[i].startsWith("-")) {
	    			bad_usage = true;
	    			break;
	    		} else if (in_name != null){
	    			bad_usage = true;
	    			break;
	    		} else {
	    			in_name = args[i];
	    		}
	    	}
    	} catch (ArrayIndexOutOfBoundsException e) {
    		bad_usage = true;
    	} catch (NumberFormatException e) {
    		bad_usage = true;
    	}
		if (bad_usage || in_name == null) {
			System.err.println("usage: java -jar mathcell.jar"
								+" [-d debug_dir|+] [-c config.properties]"
								+" [-digits N] [-length 0..3] [-h]"
								+" [-xml|-text|-tex] [-o <out>] <in.wxmx|in.xml>");
			System.exit(1);
		}
		if (cfg_name != null)
			config.load(new File(cfg_name));
		Worksheet ws = new Worksheet(config, new ConsoleNotifier());
		ws.run(in_name, out_name, dbg_path, format);
	}

	public void run (String in_path, String out_path, String dbg_path, int format)
						throws IOException, CellParseException {
		this.in_path = in_path;
		setupLogging(dbg_path, out_path);
		System.err.println("start: "+in_path);
		progressPrintln("parsing...");
		load(in_path);
		progressPrintln("laying out...");
		int height = recalculate(new LayoutContext());
		logln("worksheet height "+height);
		write(out_path, format);
		close();
		closeLog();
		System.err.println("done: "+(out_path != null ? out_path : "-"));
	}

    /*
     * ============================= Debugging ============================
     */

	protected void setupLogging (String dbg_path, String out_path) throws IOException {
		if (dbg_path == null)
			return;
		dbg_path = dbg_path.trim();
		if ("-".equals(dbg_path) || "+".equals(dbg_path) || "same".equals(dbg_path)) {
			dbg_path = (new File(out_path != null ? out_path : in_path)).getAbsolutePath();
			int pos = dbg_path.lastIndexOf(File.separatorChar);
			dbg_path = pos < 0 ? "." : dbg_path.substring(0, pos);
		}
		File dir = new File(dbg_path);
		if (!dir.isDirectory())
			throw new IOException("debugging directory "+dbg_path+" does not exist");
		dbg_dir = dir.getAbsolutePath() + File.separator;
		debug = true;
		String purename = Util.getFileName(in_path);
		int pos = purename.lastIndexOf(File.separatorChar);
		if (pos >= 0)
			purename = purename.substring(pos+1);
		log_ps = new PrintStream(new FileOutputStream(dbg_dir+"dbg-"+purename+".log"), true, ENCODING);
		if (parser != null)
			parser.setDebugLog(log_ps);
	}

	protected void closeLog () {
		if (debug)
			log_ps.close();
		log_ps = null;
		debug = false;
	}

	protected boolean isDebug() {
		return debug;
	}

	protected void log(String s) {
		if (debug)
			log_ps.print(s);
	}

	protected void logln(String s) {
		if (debug)
			log_ps.println(s);
	}
}
