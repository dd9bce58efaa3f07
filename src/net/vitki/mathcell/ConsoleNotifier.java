package net.vitki.mathcell;

import java.io.PrintStream;

/**
 * @author vit
 *
 */
public class ConsoleNotifier implements Notifier
{
	private PrintStream out;

	public ConsoleNotifier() {
		this(System.err);
	}

	public ConsoleNotifier(PrintStream out) {
		this.out = out;
	}

	public void warning (String message) {
		out.println("warning: " + message);
	}
}
