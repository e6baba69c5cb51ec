package alerthub.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.Headers;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 上游HTTP访问，统一超时、错误分类和JSON解析
 */
public class UpstreamHttpClient {
    public static final MediaType JSON_RPC = MediaType.parse("application/json-rpc");

    private final OkHttpClient client;
    private final ObjectMapper objectMapper;

    public UpstreamHttpClient(Duration connectTimeout, Duration readTimeout, Duration callTimeout) {
        this(new OkHttpClient.Builder()
                .connectTimeout(connectTimeout)
                .readTimeout(readTimeout)
                .writeTimeout(connectTimeout)
                .callTimeout(callTimeout)
                .build(), new ObjectMapper());
    }

    public UpstreamHttpClient(OkHttpClient client, ObjectMapper objectMapper) {
        this.client = client;
        this.objectMapper = objectMapper;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public static Request get(String url, Map<String, String> headers) {
        return newRequest(url, headers).get().build();
    }

    public static Request post(String url, Map<String, String> headers, String body, MediaType mediaType) {
        return newRequest(url, headers).post(RequestBody.create(body, mediaType)).build();
    }

    private static Request.Builder newRequest(String url, Map<String, String> headers) {
        HttpUrl parsed = HttpUrl.parse(StringUtils.defaultString(url));
        if (parsed == null) {
            throw SourceFetchException.configInvalid("Invalid URL: " + url);
        }
        return new Request.Builder()
                .url(parsed)
                .headers(Headers.of(headers));
    }

    /**
     * 同步执行，网络错误转为UPSTREAM_UNREACHABLE，不检查状态码
     */
    public UpstreamResponse execute(Request request) {
        try (Response response = client.newCall(request).execute()) {
            return toResponse(response);
        } catch (IOException e) {
            throw unreachable(e);
        }
    }

    /**
     * 同步执行，非2xx转为UPSTREAM_REJECTED
     */
    public UpstreamResponse executeForSuccess(Request request) {
        UpstreamResponse response = execute(request);
        if (!response.isSuccessful()) {
            throw SourceFetchException.rejected(response.getCode());
        }
        return response;
    }

    public CompletableFuture<UpstreamResponse> executeAsync(Request request) {
        CompletableFuture<UpstreamResponse> future = new CompletableFuture<>();
        Call call = client.newCall(request);
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                future.completeExceptionally(unreachable(e));
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    future.complete(toResponse(response));
                } catch (IOException e) {
                    future.completeExceptionally(unreachable(e));
                }
            }
        });
        future.whenComplete((result, error) -> {
            if (future.isCancelled()) {
                call.cancel();
            }
        });
        return future;
    }

    /**
     * 解析JSON响应，HTML页面单独报错（通常是地址或认证配置错误）
     */
    public JsonNode readJson(UpstreamResponse response) {
        String text = StringUtils.defaultString(response.getBody());
        if (!isJsonContentType(response.getContentType()) && looksLikeHtml(text)) {
            throw SourceFetchException.malformed("Received HTML response. Check the URL and authentication.");
        }
        try {
            JsonNode node = objectMapper.readTree(text);
            if (node == null || node.isMissingNode()) {
                throw SourceFetchException.malformed("Unexpected response format. Check the URL and authentication.");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw SourceFetchException.malformed("Unexpected response format. Check the URL and authentication.");
        }
    }

    public static boolean looksLikeHtml(String text) {
        String trimmed = StringUtils.defaultString(text).trim().toLowerCase(Locale.ROOT);
        return trimmed.startsWith("<!doctype") || trimmed.startsWith("<html");
    }

    private static boolean isJsonContentType(String contentType) {
        return StringUtils.containsIgnoreCase(contentType, "application/json");
    }

    private static UpstreamResponse toResponse(Response response) throws IOException {
        ResponseBody body = response.body();
        String text = body != null ? body.string() : "";
        return new UpstreamResponse(response.code(), response.header("Content-Type", ""), text);
    }

    private static SourceFetchException unreachable(IOException e) {
        if (e instanceof InterruptedIOException) {
            return SourceFetchException.unreachable("Request timed out", e);
        }
        return SourceFetchException.unreachable("Request failed: " + StringUtils.defaultIfBlank(e.getMessage(),
                e.getClass().getSimpleName()), e);
    }
}
