package org.macroingest.collector.sources;

/**
 * Publication types of the Federal Reserve press feed. Each type is exported as its own
 * dataset.
 */
public enum FedDocumentType {

	FOMC_STATEMENT("fomc_statement", "statements"),

	SPEECH("speech", "speeches"),

	TESTIMONY("testimony", "testimony"),

	MINUTES("minutes", "minutes"),

	PRESS_RELEASE("press_release", "press_releases");

	private final String label;

	private final String datasetName;

	FedDocumentType(String label, String datasetName) {
		this.label = label;
		this.datasetName = datasetName;
	}

	/**
	 * Value written to the {@code document_type} field.
	 * @return the label
	 */
	public String label() {
		return label;
	}

	public String datasetName() {
		return datasetName;
	}

}
