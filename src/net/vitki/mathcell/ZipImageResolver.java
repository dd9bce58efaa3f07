package net.vitki.mathcell;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Reads images from the entries of a <code>.wxmx</code> archive.
 *
 * @author vit
 *
 */
public class ZipImageResolver implements ImageResolver
{
	private ZipFile zip;

	public ZipImageResolver(File path) throws IOException {
		this(new ZipFile(path));
	}

	public ZipImageResolver(ZipFile zip) {
		this.zip = zip;
	}

	public byte[] resolve (String name) {
		if (name == null || zip == null)
			return null;
		ZipEntry ze = zip.getEntry(Util.normalRef(name));
		if (ze == null) {
			System.err.println("warning: image "+name+" not found in "+zip.getName());
			return null;
		}
		try {
			return readEntry(ze);
		} catch (IOException e) {
			System.err.println("warning: cannot read image "+name+": "+e.getMessage());
			return null;
		}
	}

	protected byte[] readEntry (ZipEntry ze) throws IOException {
		ByteArrayOutputStream bos = new ByteArrayOutputStream();
		InputStream is = zip.getInputStream(ze);
		byte[] tmp_buf = new byte[32768];
		try {
			while(true) {
				int num = is.read(tmp_buf);
				if (num < 0)
					break;
				bos.write(tmp_buf, 0, num);
			}
		} finally {
			is.close();
		}
		return bos.toByteArray();
	}

	public InputStream getEntryStream (String name) throws IOException {
		ZipEntry ze = zip.getEntry(Util.normalRef(name));
		if (ze == null)
			throw new IOException("no entry "+name+" in "+zip.getName());
		return zip.getInputStream(ze);
	}

	// archive entries belong to the worksheet
	public void discard (String name) { }

	public boolean isArchive() {
		return true;
	}

	public void close() throws IOException {
		if (zip != null)
			zip.close();
		zip = null;
	}
}
