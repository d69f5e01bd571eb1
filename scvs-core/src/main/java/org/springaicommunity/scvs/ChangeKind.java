package org.springaicommunity.scvs;

/**
 * Kind of change tracked for a file path. Only the file identity and this kind are
 * tracked, never file content.
 */
public enum ChangeKind {

	ADDED("A"),

	MODIFIED("M"),

	DELETED("D");

	private final String marker;

	ChangeKind(String marker) {
		this.marker = marker;
	}

	/**
	 * Returns the one-letter marker used in listings.
	 * @return the marker
	 */
	public String marker() {
		return marker;
	}

}
