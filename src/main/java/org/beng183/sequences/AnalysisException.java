package org.beng183.sequences;

/**
 * A sequence that cannot be analyzed as given, typically because it does not fit the alphabet of its declared kind.
 * The analyses themselves never throw this; it is raised by callers that check their input first.
 * @author dmyersturnbull
 */
@SuppressWarnings("serial")
public class AnalysisException extends Exception {

	public AnalysisException(String message, Throwable cause) {
		super(message, cause);
	}

	public AnalysisException(String message) {
		super(message);
	}

}
