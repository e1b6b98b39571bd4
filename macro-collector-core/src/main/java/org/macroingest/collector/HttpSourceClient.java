package org.macroingest.collector;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * {@link SourceClient} backed by the JDK {@link HttpClient}.
 *
 * <p>
 * The per-attempt timeout is enforced with {@link HttpRequest.Builder#timeout(Duration)};
 * the resulting {@link java.net.http.HttpTimeoutException} is classified retryable. Non-2xx
 * responses raise {@link SourceRequestException} with the status, body and parsed
 * {@code Retry-After} header.
 */
public class HttpSourceClient implements SourceClient {

	private static final Logger logger = LoggerFactory.getLogger(HttpSourceClient.class);

	static final String DEFAULT_USER_AGENT = "macro-collector/1.0";

	private final HttpClient httpClient;

	private final Duration requestTimeout;

	private final String userAgent;

	private final Clock clock;

	public HttpSourceClient(Duration connectTimeout, Duration requestTimeout, String userAgent) {
		this(HttpClient.newBuilder()
			.connectTimeout(connectTimeout)
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build(), requestTimeout, userAgent, Clock.systemUTC());
	}

	public HttpSourceClient(Duration requestTimeout) {
		this(Duration.ofSeconds(30), requestTimeout, DEFAULT_USER_AGENT);
	}

	HttpSourceClient(HttpClient httpClient, Duration requestTimeout, String userAgent, Clock clock) {
		this.httpClient = httpClient;
		this.requestTimeout = requestTimeout;
		this.userAgent = userAgent;
		this.clock = clock;
	}

	@Override
	public String get(String url, Map<String, String> headers) {
		HttpRequest.Builder builder = baseRequest(url, headers).GET();
		return execute(builder.build(), "GET " + redact(url));
	}

	@Override
	public String postJson(String url, String jsonBody, Map<String, String> headers) {
		HttpRequest.Builder builder = baseRequest(url, headers).header("Content-Type", "application/json")
			.POST(HttpRequest.BodyPublishers.ofString(jsonBody));
		return execute(builder.build(), "POST " + redact(url));
	}

	private HttpRequest.Builder baseRequest(String url, Map<String, String> headers) {
		HttpRequest.Builder builder = HttpRequest.newBuilder().uri(URI.create(url)).timeout(requestTimeout);
		if (!headers.containsKey("User-Agent")) {
			builder.header("User-Agent", userAgent);
		}
		headers.forEach(builder::header);
		return builder;
	}

	private String execute(HttpRequest request, String description) {
		logger.debug(description);
		long start = System.currentTimeMillis();
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
			int statusCode = response.statusCode();
			logger.debug("{} -> {} in {}ms", description, statusCode, System.currentTimeMillis() - start);
			if (statusCode >= 200 && statusCode < 300) {
				return response.body();
			}
			Duration retryAfter = parseRetryAfter(response.headers().firstValue("Retry-After").orElse(null));
			throw new SourceRequestException(describeStatus(statusCode, request.uri()), statusCode, response.body(),
					retryAfter);
		}
		catch (IOException e) {
			logger.debug("{} failed after {}ms: {}", description, System.currentTimeMillis() - start, e.toString());
			throw new SourceRequestException("HTTP request failed: " + e, e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new SourceRequestException("HTTP request interrupted", e);
		}
	}

	private static String describeStatus(int statusCode, URI uri) {
		return switch (statusCode) {
			case 400 -> "Bad request: " + redact(uri.toString());
			case 401 -> "Unauthorized: check credentials for " + uri.getHost();
			case 403 -> "Forbidden: " + redact(uri.toString());
			case 404 -> "Not found: " + redact(uri.toString());
			case 429 -> "Too Many Requests (429): " + uri.getHost();
			default -> "HTTP " + statusCode + " from " + redact(uri.toString());
		};
	}

	/**
	 * Mask credentials passed as query parameters before a URL is logged.
	 * @param url the URL
	 * @return the URL with key and token values replaced
	 */
	static String redact(String url) {
		return url.replaceAll("(?i)([?&](?:api_key|key|token|access_token)=)[^&]*", "$1***");
	}

	/**
	 * Parse a {@code Retry-After} value given either as delta-seconds or as an HTTP date.
	 * @param value header value
	 * @return the wait, or {@code null} if absent or unparseable
	 */
	@Nullable
	Duration parseRetryAfter(@Nullable String value) {
		if (value == null || value.isBlank()) {
			return null;
		}
		String trimmed = value.trim();
		try {
			return Duration.ofSeconds(Math.max(0, Long.parseLong(trimmed)));
		}
		catch (NumberFormatException e) {
			try {
				ZonedDateTime at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
				Duration wait = Duration.between(clock.instant(), at.toInstant());
				return wait.isNegative() ? Duration.ZERO : wait;
			}
			catch (DateTimeParseException ignored) {
				logger.debug("Ignoring unparseable Retry-After: {}", trimmed);
				return null;
			}
		}
	}

}
