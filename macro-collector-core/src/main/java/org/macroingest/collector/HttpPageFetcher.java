package org.macroingest.collector;

import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * {@link PageFetcher} over a {@link SourceClient}, sending browser-like headers with a
 * User-Agent picked from a small rotation for every page.
 */
public class HttpPageFetcher implements PageFetcher {

	static final List<String> USER_AGENTS = List.of(
			"Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
			"Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
			"Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
			"Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:121.0) Gecko/20100101 Firefox/121.0");

	private final SourceClient client;

	private final Random random;

	public HttpPageFetcher(SourceClient client) {
		this(client, new Random());
	}

	HttpPageFetcher(SourceClient client, Random random) {
		this.client = client;
		this.random = random;
	}

	@Override
	public String fetchPage(String url) {
		String userAgent;
		synchronized (random) {
			userAgent = USER_AGENTS.get(random.nextInt(USER_AGENTS.size()));
		}
		return client.get(url, Map.of("User-Agent", userAgent, "Accept",
				"text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8", "Accept-Language", "en-US,en;q=0.9"));
	}

}
