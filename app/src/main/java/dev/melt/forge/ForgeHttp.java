package dev.melt.forge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.melt.config.ServiceConfig;
import dev.melt.git.GitServiceException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Shared HTTP plumbing for the forge APIs: one OkHttp client, JSON decoding, status classification. */
public final class ForgeHttp {
    private static final Logger logger = LogManager.getLogger(ForgeHttp.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    static final String RATE_LIMIT_MESSAGE = "GitHub API rate limit exceeded. Set GITHUB_TOKEN for higher limits.";

    private final OkHttpClient client;

    public ForgeHttp(ServiceConfig config) {
        long timeoutMillis = config.timeouts().httpRequest().toMillis();
        var userAgent = "melt/" + version();
        this.client = new OkHttpClient.Builder()
                .callTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .connectTimeout(Math.min(timeoutMillis, 10_000), TimeUnit.MILLISECONDS)
                .followRedirects(true)
                .addInterceptor(chain -> chain.proceed(chain.request()
                        .newBuilder()
                        .header("User-Agent", userAgent)
                        .build()))
                .build();
    }

    static ObjectMapper objectMapper() {
        return OBJECT_MAPPER;
    }

    /**
     * Performs a GET and decodes the body as JSON.
     *
     * @param detectGitHubRateLimit treat 403/429 with {@code x-ratelimit-remaining: 0} as a rate-limit error
     * @throws GitServiceException.RateLimited when the rate limit is detected
     * @throws ForgeApiException for transport errors, non-success statuses and undecodable bodies
     */
    JsonNode getJson(String url, Map<String, String> headers, boolean detectGitHubRateLimit)
            throws ForgeApiException, GitServiceException.RateLimited {
        var builder = new Request.Builder().url(url).get().header("Accept", "application/json");
        headers.forEach(builder::header);
        logger.debug("GET {}", url);
        try (Response response = client.newCall(builder.build()).execute()) {
            int code = response.code();
            if (detectGitHubRateLimit && (code == 403 || code == 429) && rateLimitExhausted(response)) {
                logger.warn("GitHub API rate limit exceeded for {}", url);
                throw new GitServiceException.RateLimited(RATE_LIMIT_MESSAGE);
            }
            if (!response.isSuccessful()) {
                throw new ForgeApiException("HTTP " + code + " from " + url);
            }
            var body = response.body();
            if (body == null) {
                throw new ForgeApiException("Empty response from " + url);
            }
            return OBJECT_MAPPER.readTree(body.string());
        } catch (IOException e) {
            throw new ForgeApiException("Request to " + url + " failed: " + e.getMessage(), e);
        }
    }

    private static boolean rateLimitExhausted(Response response) {
        var remaining = response.header("x-ratelimit-remaining");
        if (remaining == null) {
            return true;
        }
        try {
            return Integer.parseInt(remaining.trim()) == 0;
        } catch (NumberFormatException e) {
            return true;
        }
    }

    /** Build version read from the bundled {@code melt.properties}. */
    public static String version() {
        try (InputStream in = ForgeHttp.class.getResourceAsStream("/melt.properties")) {
            if (in == null) {
                return "dev";
            }
            var props = new Properties();
            props.load(in);
            return props.getProperty("version", "dev");
        } catch (IOException e) {
            logger.debug("Could not read melt.properties: {}", e.getMessage());
            return "dev";
        }
    }
}
