package org.beng183.sequences;

/**
 * Sequence input could not be read.
 */
@SuppressWarnings("serial")
public class LoadException extends Exception {

	public LoadException(String message, Throwable cause) {
		super(message, cause);
	}

	public LoadException(String message) {
		super(message);
	}

}
