package net.vitki.mathcell;

/**
 * Receives messages meant for the user.
 *
 * @author vit
 *
 */
public interface Notifier
{
	public void warning (String message);
}
