package org.springaicommunity.scvs;

/**
 * Review state of a pull request. {@link #MERGED} and {@link #REJECTED} requests are archived.
 */
public enum PullRequestState {

	OPEN("open"),

	EN_REVISION("en_revision"),

	MERGED("merged"),

	REJECTED("rejected");

	private final String label;

	PullRequestState(String label) {
		this.label = label;
	}

	public String label() {
		return label;
	}

}
