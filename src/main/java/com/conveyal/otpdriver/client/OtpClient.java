package com.conveyal.otpdriver.client;

import com.conveyal.otpdriver.OtpDriverException;
import com.conveyal.otpdriver.api.GeoJsonFeatureCollection;
import com.conveyal.otpdriver.api.GeocodeResult;
import com.conveyal.otpdriver.api.PlanResponse;
import com.conveyal.otpdriver.api.RouterList;
import com.conveyal.otpdriver.results.IsochroneBand;
import com.conveyal.otpdriver.results.LegRow;
import com.conveyal.otpdriver.results.PlanResult;
import com.conveyal.otpdriver.results.ResultTables;
import com.conveyal.otpdriver.util.ExceptionUtils;
import com.conveyal.otpdriver.util.JsonUtilities;
import com.fasterxml.jackson.databind.JavaType;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Issues requests to the REST API of a running OTP 1.x and turns the responses into rows.
 * Batches of requests are spread over a fixed number of threads, since OTP itself handles concurrent requests well
 * and most of the time of a single request is spent waiting for its search to finish.
 */
public class OtpClient {

    private static final Logger LOG = LoggerFactory.getLogger(OtpClient.class);

    /** How often to report progress through a batch of requests. */
    private static final int PROGRESS_INTERVAL = 100;

    public interface Config {
        int planThreads ();
        ZoneId timeZone ();
    }

    private final Config config;
    private final OtpConnection connection;
    private final OtpHttpClient httpClient;

    public OtpClient (Config config, OtpConnection connection, OtpHttpClient httpClient) {
        this.config = config;
        this.connection = connection;
        this.httpClient = httpClient;
    }

    public OtpConnection connection () {
        return connection;
    }

    /** The routers loaded by the OTP instance, whatever router this client addresses. */
    public List<RouterList.RouterInfo> routers () {
        return httpClient.getJson(URI.create(connection.routersUrl()), RouterList.class).routerInfo;
    }

    /**
     * Plan trips between one origin and destination. A response in which OTP reports it found no trip gives a result
     * carrying OTP's message. Failure to reach OTP or decode its answer is thrown as an OtpDriverException.
     */
    public PlanResult plan (PlanRequest request) {
        URI uri = request.toUri(connection, ZonedDateTime.now(config.timeZone()));
        PlanResponse response = httpClient.getJson(uri, PlanResponse.class);
        if (response.error != null) {
            LOG.debug("No trip {}: {}", request, response.error.describe());
            return PlanResult.failure(request, response, response.error.describe());
        }
        if (!response.hasItineraries()) {
            return PlanResult.failure(request, response, "No itineraries found");
        }
        List<LegRow> rows = ResultTables.legRows(request.fromId, request.toId, response, config.timeZone());
        return PlanResult.success(request, response, rows);
    }

    /**
     * Plan every request of the batch. Results are in the order of the requests, and a request that fails for any
     * reason gives a failed result rather than stopping the rest of the batch.
     */
    public List<PlanResult> planMany (List<PlanRequest> requests) {
        return runBatch(requests, request -> {
            try {
                return plan(request);
            } catch (OtpDriverException e) {
                LOG.warn("Request {} failed: {}", request, e.getMessage());
                return PlanResult.failure(request, null, e.getMessage());
            } catch (RuntimeException e) {
                LOG.error("Request {} failed: {}", request, ExceptionUtils.stackTraceString(e));
                return PlanResult.failure(request, null, ExceptionUtils.shortCauseString(e));
            }
        });
    }

    /** Isochrone bands around one origin, one per cutoff that OTP could compute. */
    public List<IsochroneBand> isochrone (IsochroneRequest request) {
        URI uri = request.toUri(connection, ZonedDateTime.now(config.timeZone()));
        GeoJsonFeatureCollection collection = httpClient.getJson(uri, GeoJsonFeatureCollection.class);
        return ResultTables.isochroneBands(request.fromId, collection);
    }

    /** Isochrones around many origins. Unlike trip planning, any failure stops the whole batch. */
    public List<IsochroneBand> isochroneMany (List<IsochroneRequest> requests) {
        List<IsochroneBand> bands = new ArrayList<>();
        for (List<IsochroneBand> bandsForOrigin : runBatch(requests, this::isochrone)) {
            bands.addAll(bandsForOrigin);
        }
        return bands;
    }

    public List<GeocodeResult> geocode (GeocodeRequest request) {
        JavaType listType = JsonUtilities.lenientObjectMapper.getTypeFactory()
                .constructCollectionType(List.class, GeocodeResult.class);
        return httpClient.getJson(request.toUri(connection), listType);
    }

    /**
     * Apply the function to every input on a pool of planThreads threads, returning outputs in input order.
     * Exceptions thrown by the function are rethrown here once all tasks have been submitted.
     */
    private <I, O> List<O> runBatch (List<I> inputs, Function<I, O> function) {
        if (inputs.isEmpty()) return new ArrayList<>();
        int nThreads = Math.min(config.planThreads(), inputs.size());
        LOG.info("Sending {} requests to {} on {} threads.", inputs.size(), connection, nThreads);
        ExecutorService executor = Executors.newFixedThreadPool(nThreads,
                new ThreadFactoryBuilder().setNameFormat("otp-request-%d").setDaemon(true).build());
        try {
            List<Future<O>> futures = new ArrayList<>(inputs.size());
            for (I input : inputs) {
                futures.add(executor.submit(() -> function.apply(input)));
            }
            List<O> outputs = new ArrayList<>(inputs.size());
            for (Future<O> future : futures) {
                outputs.add(future.get());
                if (outputs.size() % PROGRESS_INTERVAL == 0) {
                    LOG.info("Received {} of {} responses.", outputs.size(), inputs.size());
                }
            }
            return outputs;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OtpDriverException(OtpDriverException.Type.UNKNOWN, "Interrupted during batch of requests.",
                    -1, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof OtpDriverException) {
                throw (OtpDriverException) cause;
            }
            LOG.error("Request failed: {}", ExceptionUtils.stackTraceString(cause));
            throw OtpDriverException.unknown(cause);
        } finally {
            executor.shutdownNow();
        }
    }

}
