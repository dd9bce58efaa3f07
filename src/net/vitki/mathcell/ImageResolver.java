package net.vitki.mathcell;

/**
 * Where images referenced from a worksheet come from.
 * The resolver owns whatever it extracted or created.
 *
 * @author vit
 *
 */
public interface ImageResolver
{
	/**
	 * The bytes of the named image, or null when they cannot be had.
	 */
	public byte[] resolve (String name);

	/**
	 * Remove a temporary image file when its cell goes away.
	 */
	public void discard (String name);

	/**
	 * True when images are read from the worksheet archive:
	 * such images are never deleted.
	 */
	public boolean isArchive();
}
