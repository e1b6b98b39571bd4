package org.macroingest.collector;

/**
 * Raw store file formats.
 */
public enum ExportFormat {

	/**
	 * Tabular data, one row per record.
	 */
	CSV("csv"),

	/**
	 * Documents, one JSON object per line.
	 */
	JSONL("jsonl");

	private final String extension;

	ExportFormat(String extension) {
		this.extension = extension;
	}

	public String extension() {
		return extension;
	}

}
