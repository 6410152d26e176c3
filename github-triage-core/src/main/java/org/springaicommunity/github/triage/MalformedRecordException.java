package org.springaicommunity.github.triage;

/**
 * Thrown at the merge boundary when a raw upstream record cannot be turned into an
 * {@link IssueRecord}. The record is skipped; the run continues.
 */
public class MalformedRecordException extends RuntimeException {

	public MalformedRecordException(String message) {
		super(message);
	}

	public MalformedRecordException(String message, Throwable cause) {
		super(message, cause);
	}

}
