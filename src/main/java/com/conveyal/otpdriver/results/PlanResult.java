package com.conveyal.otpdriver.results;

import com.conveyal.otpdriver.api.PlanResponse;
import com.conveyal.otpdriver.client.PlanRequest;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The outcome of one planner request: either the legs of the itineraries found, or the reason there are none.
 * A failed request does not abort a batch, it produces a result with an error message and no rows.
 */
public class PlanResult {

    public final PlanRequest request;

    /** Null if no response was received at all. */
    public final PlanResponse response;

    public final List<LegRow> rows;

    /** Null on success. */
    public final String error;

    private PlanResult (PlanRequest request, PlanResponse response, List<LegRow> rows, String error) {
        this.request = request;
        this.response = response;
        this.rows = ImmutableList.copyOf(rows);
        this.error = error;
    }

    public static PlanResult success (PlanRequest request, PlanResponse response, List<LegRow> rows) {
        return new PlanResult(request, response, rows, null);
    }

    public static PlanResult failure (PlanRequest request, PlanResponse response, String error) {
        return new PlanResult(request, response, ImmutableList.of(), error);
    }

    public boolean isSuccess () {
        return error == null;
    }

}
