package org.macroingest.collector;

import java.util.Map;

/**
 * Interface for plain HTTP access to sources.
 *
 * <p>
 * Abstracts the HTTP layer so adapters can be tested with mocks. Implementations make a
 * single attempt and signal failure with {@link SourceRequestException}; retries belong to
 * the {@link ResilienceEngine}.
 */
public interface SourceClient {

	/**
	 * Execute a GET request.
	 * @param url absolute URL including the query string
	 * @param headers extra request headers
	 * @return the response body
	 */
	String get(String url, Map<String, String> headers);

	default String get(String url) {
		return get(url, Map.of());
	}

	/**
	 * Execute a POST request with a JSON body.
	 * @param url absolute URL
	 * @param jsonBody request body
	 * @param headers extra request headers
	 * @return the response body
	 */
	String postJson(String url, String jsonBody, Map<String, String> headers);

}
