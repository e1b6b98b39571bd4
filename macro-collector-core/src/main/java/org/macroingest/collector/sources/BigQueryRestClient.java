package org.macroingest.collector.sources;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.macroingest.collector.JsonNodeUtils;
import org.macroingest.collector.PayloadParseException;
import org.macroingest.collector.SourceClient;
import org.macroingest.collector.SourceRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Minimal BigQuery client over the v2 REST API ({@code jobs.query} and
 * {@code jobs.getQueryResults}), authenticated with an OAuth access token.
 *
 * <p>
 * Every call is a single attempt; callers run it through the resilience engine. A query
 * that has not completed within the server-side timeout is reported as a 503 so that it is
 * retried.
 */
public class BigQueryRestClient {

	private static final Logger logger = LoggerFactory.getLogger(BigQueryRestClient.class);

	public static final String DEFAULT_BASE_URL = "https://bigquery.googleapis.com/bigquery/v2";

	private static final int QUERY_TIMEOUT_MS = 60_000;

	private static final int PAGE_SIZE = 10_000;

	private final SourceClient client;

	private final ObjectMapper objectMapper;

	private final String projectId;

	private final String accessToken;

	private final String baseUrl;

	public BigQueryRestClient(SourceClient client, ObjectMapper objectMapper, String projectId, String accessToken) {
		this(client, objectMapper, projectId, accessToken, DEFAULT_BASE_URL);
	}

	public BigQueryRestClient(SourceClient client, ObjectMapper objectMapper, String projectId, String accessToken,
			String baseUrl) {
		this.client = client;
		this.objectMapper = objectMapper;
		this.projectId = projectId;
		this.accessToken = accessToken;
		this.baseUrl = baseUrl;
	}

	/**
	 * Validate a query without running it.
	 * @param sql standard SQL
	 * @return bytes the query would process
	 */
	public long dryRun(String sql) {
		ObjectNode request = queryRequest(sql);
		request.put("dryRun", true);
		request.put("useQueryCache", false);
		JsonNode response = post(request);
		return JsonNodeUtils.getLong(response, "totalBytesProcessed")
			.orElseThrow(() -> new PayloadParseException("Dry run response has no totalBytesProcessed"));
	}

	/**
	 * Run a query and collect every page of its result.
	 * @param sql standard SQL
	 * @return JSON text holding {@code schema} and all {@code rows}
	 */
	public String query(String sql) {
		ObjectNode request = queryRequest(sql);
		request.put("timeoutMs", QUERY_TIMEOUT_MS);
		request.put("maxResults", PAGE_SIZE);
		JsonNode page = post(request);

		String jobId = JsonNodeUtils.getString(page, "jobReference", "jobId").orElse("");
		String location = JsonNodeUtils.getString(page, "jobReference", "location").orElse("");
		if (!JsonNodeUtils.getBoolean(page, "jobComplete")) {
			page = results(jobId, location, null);
			if (!JsonNodeUtils.getBoolean(page, "jobComplete")) {
				throw new SourceRequestException("BigQuery job " + jobId + " did not complete in time", 503);
			}
		}

		ObjectNode combined = objectMapper.createObjectNode();
		combined.set("schema", page.path("schema"));
		ArrayNode rows = combined.putArray("rows");
		int pages = 1;
		while (true) {
			JsonNodeUtils.getArray(page, "rows").forEach(rows::add);
			String pageToken = JsonNodeUtils.getString(page, "pageToken").orElse(null);
			if (pageToken == null || pageToken.isEmpty()) {
				break;
			}
			page = results(jobId, location, pageToken);
			pages++;
		}
		logger.debug("BigQuery job {} returned {} row(s) in {} page(s)", jobId, rows.size(), pages);
		return combined.toString();
	}

	private ObjectNode queryRequest(String sql) {
		ObjectNode request = objectMapper.createObjectNode();
		request.put("query", sql);
		request.put("useLegacySql", false);
		return request;
	}

	private JsonNode post(ObjectNode request) {
		String body = client.postJson(baseUrl + "/projects/" + projectId + "/queries", request.toString(),
				authorization());
		return read(body);
	}

	private JsonNode results(String jobId, String location, @Nullable String pageToken) {
		StringBuilder url = new StringBuilder(baseUrl).append("/projects/")
			.append(projectId)
			.append("/queries/")
			.append(jobId)
			.append("?timeoutMs=")
			.append(QUERY_TIMEOUT_MS)
			.append("&maxResults=")
			.append(PAGE_SIZE);
		if (!location.isEmpty()) {
			url.append("&location=").append(URLEncoder.encode(location, StandardCharsets.UTF_8));
		}
		if (pageToken != null) {
			url.append("&pageToken=").append(URLEncoder.encode(pageToken, StandardCharsets.UTF_8));
		}
		return read(client.get(url.toString(), authorization()));
	}

	private Map<String, String> authorization() {
		return Map.of("Authorization", "Bearer " + accessToken);
	}

	private JsonNode read(String body) {
		try {
			return objectMapper.readTree(body);
		}
		catch (JsonProcessingException e) {
			throw new PayloadParseException("Malformed BigQuery response", e);
		}
	}

}
