package org.springaicommunity.github.triage;

/**
 * Thrown when a query refers to an issue that is not in the collection, or that lacks
 * the data the query needs (for example an embedding for a similarity query).
 */
public class IssueNotFoundException extends RuntimeException {

	private final int issueNumber;

	public IssueNotFoundException(int issueNumber, String message) {
		super(message);
		this.issueNumber = issueNumber;
	}

	public static IssueNotFoundException missing(int issueNumber) {
		return new IssueNotFoundException(issueNumber, "Issue #" + issueNumber + " not found");
	}

	public static IssueNotFoundException withoutEmbedding(int issueNumber) {
		return new IssueNotFoundException(issueNumber, "Issue #" + issueNumber + " has no embedding");
	}

	public int getIssueNumber() {
		return issueNumber;
	}

}
