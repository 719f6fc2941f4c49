package com.vitals.cluster;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.vitals.observability.HealthStatus;

/**
 * Messages exchanged between the coordinator and its workers.
 * <p>
 * On the wire every message is a JSON object tagged with a {@code type} property:
 * <pre>
 * {"type":"getStatsRequest","requestId":7}
 * {"type":"getStatsResponse","requestId":7,"healthStatus":{"worker-1":{...}}}
 * {"type":"getStatsResponse","requestId":7,"error":"disk unavailable"}
 * </pre>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ClusterMessage.GetStatsRequest.class, name = ClusterMessage.GET_STATS_REQUEST),
        @JsonSubTypes.Type(value = ClusterMessage.GetStatsResponse.class, name = ClusterMessage.GET_STATS_RESPONSE)
})
public sealed interface ClusterMessage permits ClusterMessage.GetStatsRequest, ClusterMessage.GetStatsResponse {

    String GET_STATS_REQUEST = "getStatsRequest";
    String GET_STATS_RESPONSE = "getStatsResponse";

    /** Identifier correlating a response with the request that caused it. */
    long requestId();

    /**
     * Fan-out request sent by the coordinator to every connected worker.
     *
     * @param requestId the aggregation request this belongs to
     */
    record GetStatsRequest(@JsonProperty("requestId") long requestId) implements ClusterMessage {
    }

    /**
     * A worker's reply: either its local health status or the error that prevented computing it.
     *
     * @param requestId    the aggregation request being answered
     * @param healthStatus the worker's status; {@code null} when {@code error} is set
     * @param error        failure description; {@code null} on success
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record GetStatsResponse(
            @JsonProperty("requestId") long requestId,
            @JsonProperty("healthStatus") HealthStatus healthStatus,
            @JsonProperty("error") String error
    ) implements ClusterMessage {

        public static GetStatsResponse success(long requestId, HealthStatus healthStatus) {
            return new GetStatsResponse(requestId, healthStatus, null);
        }

        public static GetStatsResponse failure(long requestId, String error) {
            return new GetStatsResponse(requestId, null, error);
        }

        /** Whether the worker reported an error instead of a status. */
        public boolean failed() {
            return error != null;
        }
    }
}
