package net.vitki.mathcell;

import java.io.File;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * @author vit
 *
 */

public class Util
{
    /*
     * ============================= XML utilities ============================
     */

	/**
	 * Document builder for worksheet markup: no validation, no comments.
	 */
	public static final DocumentBuilder newDocumentBuilder() throws ParserConfigurationException {
		// carefully choose document builder
		DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
		dbf.setNamespaceAware(true);
		dbf.setValidating(false);
		dbf.setCoalescing(true);
		dbf.setIgnoringComments(true);
		return dbf.newDocumentBuilder();
	}

	/**
	 * Name of an element without a namespace prefix.
	 */
	public static final String getTagName (Node node) {
		String name = node.getLocalName();
		return name != null ? name : node.getNodeName();
	}

	/**
	 * Drop the whitespace that only indents markup. Text of elements
	 * without child elements is kept as is: <code>&lt;t&gt; &lt;/t&gt;</code>
	 * is a space cell.
	 */
    public static Node normalizeElement (Node node) {
    	node.normalize();
   		normalizeSubtree(node);
    	return node;
    }

    public static final boolean isWhiteSpaceString(String text) {
		int n = text.length();
		for (int i = 0; i < n; i++) {
			char c = text.charAt(i);
			if (c != ' ' && c != '\t' && c != '\n' && c != '\r')
				return false;
		}
		return true;
    }

    private static void normalizeSubtree(Node node) {
    	NodeList children = node.getChildNodes();
    	boolean has_elements = false;
    	int i;
    	for (i = children.getLength() - 1; i >= 0; i--) {
    		if (children.item(i).getNodeType() == Node.ELEMENT_NODE) {
    			has_elements = true;
    			break;
    		}
    	}
    	for (i = children.getLength() - 1; i >= 0; i--) {
    		Node child = children.item(i);
    		switch (child.getNodeType()) {
    		case Node.ELEMENT_NODE:
    			normalizeSubtree(child);
    			break;
    		case Node.TEXT_NODE:
    			if (has_elements && isWhiteSpaceString(child.getNodeValue()))
    				node.removeChild(child);
    			break;
    		case Node.COMMENT_NODE:
    		case Node.PROCESSING_INSTRUCTION_NODE:
    			node.removeChild(child);
    			break;
    		}
    	}
    }

	public static final String xmlEscape (String text) {
		if (text == null)
			return "";
		int n = text.length();
		StringBuffer sb = null;
		for (int i = 0; i < n; i++) {
			char c = text.charAt(i);
			String rep;
			switch (c) {
			case '<': rep = "&lt;"; break;
			case '>': rep = "&gt;"; break;
			case '&': rep = "&amp;"; break;
			case '"': rep = "&quot;"; break;
			default: rep = null; break;
			}
			if (rep == null) {
				if (sb != null)
					sb.append(c);
				continue;
			}
			if (sb == null) {
				sb = new StringBuffer(n + 16);
				sb.append(text.substring(0, i));
			}
			sb.append(rep);
		}
		return sb == null ? text : sb.toString();
	}

    /*
     * ============================= TeX utilities ============================
     */

	public static final String texEscape (String text) {
		if (text == null)
			return "";
		StringBuffer sb = new StringBuffer(text.length() + 8);
		int n = text.length();
		for (int i = 0; i < n; i++) {
			char c = text.charAt(i);
			switch (c) {
			case '#': case '$': case '%': case '&': case '_': case '{': case '}':
				sb.append('\\').append(c);
				continue;
			case '\\': sb.append("\\ensuremath{\\backslash}"); continue;
			case '^': sb.append("\\^{}"); continue;
			case '~': sb.append("\\~{}"); continue;
			case TextCell.UNICODE_MINUS: sb.append('-'); continue;
			}
			sb.append(c);
		}
		return sb.toString();
	}

    /*
     * ============================= File utilities ============================
     */

	public static final String getFileName (String path) {
		File file = new File(path);
		try {
			path = file.getCanonicalPath();
		} catch (Exception e) {
			path = file.getAbsolutePath();
		}
		int dot = path.lastIndexOf('.');
		if (dot >= 0 && dot > path.lastIndexOf(File.separatorChar)) {
			path = path.substring(0, dot);
		}
		return path;
	}

    /*
     * ============================= String utilities ============================
     */

    public static final boolean isOneOf (String sample, String set, boolean ignore_case) {
    	if (sample == null || set == null)
    		return false;
    	int sample_len = sample.length();
    	int set_len = set.length();
    	if (sample_len == 0 || set_len == 0)
    		return false;
    	if (ignore_case) {
    		set = set.toLowerCase();
    		sample = sample.toLowerCase();
    	}
    	int pos = set.indexOf(sample);
    	while (pos >= 0) {
    		if (pos == 0 || set.charAt(pos-1) == ' ') {
    			int end = pos + sample_len;
    			if (end >= set_len || set.charAt(end) == ' ')
    				return true;
    		}
    		pos = set.indexOf(sample, pos + 1);
    	}
    	return false;
    }

    public static final boolean isOneOf (String sample, String set) {
    	return isOneOf(sample, set, false);
    }

    /*
     * ============================= Other utilities ============================
     */

	public static final String normalRef (String ref) {
		return (ref == null ? null : (ref.startsWith("./") ? ref.substring(2) : ref));
	}

	public static final String image_formats = "BMP EPS GIF JPG JPEG PCX PNG SVG TIFF TIF WMF";

	public static final boolean isImageFormat (String fmt) {
		return isOneOf(fmt, image_formats, true);
	}

	public static final String getExtension (String path) {
		int dot = path.lastIndexOf('.');
		return dot < 0 ? "" : path.substring(dot + 1);
	}
}
