package org.macroingest.collector;

/**
 * Fetches one rendered page. Only this contract is part of the framework; how the page is
 * obtained (plain HTTP or a browser) is up to the implementation.
 */
@FunctionalInterface
public interface PageFetcher {

	/**
	 * Fetch a page.
	 * @param url page URL
	 * @return the page HTML
	 * @throws SourceRequestException if the page cannot be fetched
	 */
	String fetchPage(String url);

}
