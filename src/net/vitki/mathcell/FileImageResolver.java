package net.vitki.mathcell;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;

/**
 * Reads images from plain files, relative names are taken
 * from a base directory. Files are only deleted on request
 * when deleting was allowed: worksheets opened from disk
 * keep their images.
 *
 * @author vit
 *
 */
public class FileImageResolver implements ImageResolver
{
	private File base_dir;
	private boolean allow_delete;

	public FileImageResolver() {
		this(null, true);
	}

	public FileImageResolver(File base_dir, boolean allow_delete) {
		this.base_dir = base_dir;
		this.allow_delete = allow_delete;
	}

	protected File getFile (String name) {
		File file = new File(name);
		if (!file.isAbsolute() && base_dir != null)
			file = new File(base_dir, name);
		return file;
	}

	public byte[] resolve (String name) {
		if (name == null)
			return null;
		File file = getFile(name);
		if (!file.isFile()) {
			System.err.println("warning: image "+file.getPath()+" does not exist");
			return null;
		}
		try {
			return readFile(file);
		} catch (IOException e) {
			System.err.println("warning: cannot read image "+file.getPath()+": "+e.getMessage());
			return null;
		}
	}

	private static byte[] readFile (File file) throws IOException {
		byte[] bb = new byte[(int) file.length()];
		FileInputStream fis = new FileInputStream(file);
		try {
			int off = 0;
			while (off < bb.length) {
				int num = fis.read(bb, off, bb.length - off);
				if (num < 0)
					break;
				off += num;
			}
		} finally {
			fis.close();
		}
		return bb;
	}

	public void discard (String name) {
		if (name == null || !allow_delete)
			return;
		File file = getFile(name);
		if (file.exists() && !file.delete())
			System.err.println("warning: cannot delete "+file.getPath());
	}

	public boolean isArchive() {
		return false;
	}
}
