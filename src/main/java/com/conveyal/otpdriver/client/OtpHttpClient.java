package com.conveyal.otpdriver.client;

import com.conveyal.otpdriver.OtpDriverException;
import com.conveyal.otpdriver.util.JsonUtilities;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import org.apache.http.HttpEntity;
import org.apache.http.HttpResponse;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.config.SocketConfig;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;

/**
 * Thin wrapper around an Apache HTTP client, issuing GET requests against the OTP REST API and decoding the JSON
 * answers. One instance is shared by all threads of a batch of requests.
 */
public class OtpHttpClient implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(OtpHttpClient.class);

    /** Enough for every thread of a batch to hold its own connection to OTP. */
    private static final int MAX_CONNECTIONS_PER_ROUTE = 20;

    public interface Config {
        int httpTimeoutSeconds ();
    }

    private final CloseableHttpClient httpClient;

    public OtpHttpClient (Config config) {
        this.httpClient = makeHttpClient(config.httpTimeoutSeconds() * 1000);
    }

    private static CloseableHttpClient makeHttpClient (int timeoutMilliseconds) {
        PoolingHttpClientConnectionManager mgr = new PoolingHttpClientConnectionManager();
        mgr.setDefaultMaxPerRoute(MAX_CONNECTIONS_PER_ROUTE);
        mgr.setMaxTotal(MAX_CONNECTIONS_PER_ROUTE);
        SocketConfig cfg = SocketConfig.custom()
                .setSoTimeout(timeoutMilliseconds)
                .build();
        mgr.setDefaultSocketConfig(cfg);
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(timeoutMilliseconds)
                .setSocketTimeout(timeoutMilliseconds)
                .build();
        return HttpClients.custom().disableAutomaticRetries()
                .setConnectionManager(mgr)
                .setDefaultRequestConfig(requestConfig)
                .build();
    }

    /**
     * @return the HTTP status code of a GET request to the given URI, after discarding the body.
     * @throws IOException if no response was received at all, e.g. because nothing is listening yet.
     */
    public int status (URI uri) throws IOException {
        HttpGet httpGet = new HttpGet(uri);
        HttpEntity entity = null;
        try {
            HttpResponse response = httpClient.execute(httpGet);
            entity = response.getEntity();
            return response.getStatusLine().getStatusCode();
        } finally {
            // Consume the stream so the connection is released back to the (finite) pool.
            EntityUtils.consumeQuietly(entity);
        }
    }

    /** GET the URI and decode its JSON body into the given class, ignoring fields we do not model. */
    public <T> T getJson (URI uri, Class<T> type) {
        return getJson(uri, JsonUtilities.lenientObjectMapper.constructType(type));
    }

    public <T> T getJson (URI uri, JavaType type) {
        LOG.debug("GET {}", uri);
        HttpGet httpGet = new HttpGet(uri);
        httpGet.setHeader("Accept", "application/json");
        HttpEntity entity = null;
        try {
            HttpResponse response = httpClient.execute(httpGet);
            entity = response.getEntity();
            int statusCode = response.getStatusLine().getStatusCode();
            if (statusCode != 200 || entity == null) {
                String body = entity == null ? "" : EntityUtils.toString(entity);
                throw OtpDriverException.http(statusCode,
                        String.format("OTP answered %s with HTTP %d: %s", uri.getPath(), statusCode, body));
            }
            // readValue closes the stream, releasing the HTTP connection.
            return JsonUtilities.lenientObjectMapper.readValue(entity.getContent(), type);
        } catch (JsonProcessingException e) {
            throw OtpDriverException.jsonParsing("Could not decode the response from " + uri.getPath(), e);
        } catch (IOException e) {
            throw OtpDriverException.http("No response from OTP at " + uri, e);
        } finally {
            EntityUtils.consumeQuietly(entity);
        }
    }

    @Override
    public void close () throws IOException {
        httpClient.close();
    }

}
